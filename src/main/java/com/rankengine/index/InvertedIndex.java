package com.rankengine.index;

import com.rankengine.storage.Posting;

import java.util.Iterator;
import java.util.List;

/**
 * 只读倒排索引。
 */
public interface InvertedIndex {

    /**
     * 对文本做归一化与分词，返回索引使用的词项。文档与查询必须经过同一处理。
     */
    List<String> getTerms(String buffer);

    /**
     * 返回词项的倒排迭代器，按docId升序。未收录的词项返回空迭代器。
     */
    Iterator<Posting> getPostingsIterator(String term);

    /**
     * 包含该词项的文档数，未收录的词项为0。
     */
    int getDocumentFrequency(String term);

    default boolean contains(String term) {
        return getDocumentFrequency(term) > 0;
    }

    int getDocumentCount();

    int getTermCount();

    /**
     * 文档在各索引字段中的词项总数。
     */
    int getDocumentLength(int docId);

    double getAverageDocumentLength();

    IndexStatus getStatus();
}
