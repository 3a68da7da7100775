package com.rankengine.document;

/**
 * 有序文档集合，按docId顺序迭代。
 */
public interface Corpus extends Iterable<Document> {

    int size();

    /**
     * 按ID获取文档。
     *
     * @throws IndexOutOfBoundsException 如果ID不在 [0, size) 内
     */
    Document getDocument(int docId);
}
