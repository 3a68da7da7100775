package com.rankengine.scoring;

import com.rankengine.storage.Posting;

/**
 * 逐文档打分的排序策略。
 *
 * 调用顺序：{@code reset(docId)} 开始一篇文档，随后零到多次 {@code update}，
 * 最后 {@code evaluate()} 读取得分。实例带状态，一次只服务一个查询。
 */
public interface Ranker {

    /**
     * 开始为指定文档打分，丢弃之前累计的状态。
     */
    void reset(int docId);

    /**
     * 累计一个命中查询词项的证据。
     *
     * @param term 查询词项
     * @param multiplicity 词项在查询中出现的次数
     * @param posting 该词项在当前文档上的倒排项
     * @throws IllegalStateException 如果尚未reset，或倒排项的docId与当前文档不一致
     */
    void update(String term, int multiplicity, Posting posting);

    /**
     * 返回当前文档的最终得分，不修改状态。
     *
     * @throws IllegalStateException 如果尚未reset
     */
    double evaluate();
}
