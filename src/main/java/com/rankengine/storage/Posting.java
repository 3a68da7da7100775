package com.rankengine.storage;

/**
 * 倒排项，记录某词项在某文档中的出现次数。
 *
 * @param docId 文档ID，非负
 * @param termFrequency 文档内词频，至少为1
 */
public record Posting(int docId, int termFrequency) {
    public Posting {
        if (docId < 0) {
            throw new IllegalArgumentException("docId不能为负数: " + docId);
        }
        if (termFrequency < 1) {
            throw new IllegalArgumentException("termFrequency必须至少为1: " + termFrequency);
        }
    }
}
