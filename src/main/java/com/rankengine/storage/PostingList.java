package com.rankengine.storage;

import java.util.Iterator;

/**
 * 倒排列表，按文档ID严格递增保存倒排项。
 *
 * 构建期只允许追加；{@link #freeze()} 之后变为只读。
 * 每次调用 {@link #iterator()} 都返回独立的前向迭代器，互不共享游标状态。
 */
public interface PostingList extends Iterable<Posting> {

    /**
     * 追加倒排项。
     *
     * @param posting 倒排项，docId必须大于上一次追加的docId
     * @throws IllegalArgumentException 如果docId没有严格递增
     * @throws IllegalStateException 如果列表已冻结
     */
    void append(Posting posting);

    /**
     * 冻结列表，之后不再接受追加。
     */
    void freeze();

    boolean isFrozen();

    /**
     * 返回倒排项数量，即该词项的文档频率。
     */
    int size();

    @Override
    Iterator<Posting> iterator();

    /**
     * 返回按文档ID升序的游标。
     */
    default PostingCursor cursor() {
        return new PostingCursor(iterator());
    }
}
