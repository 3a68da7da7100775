package com.rankengine.index;

/**
 * 建索引时发现语料不满足前置条件。抛出后索引不可用。
 */
public class IndexBuildException extends RuntimeException {
    private final int expectedDocId;
    private final int actualDocId;

    public IndexBuildException(int expectedDocId, int actualDocId) {
        super("文档ID与语料序号不一致: 位置=" + expectedDocId + ", docId=" + actualDocId);
        this.expectedDocId = expectedDocId;
        this.actualDocId = actualDocId;
    }

    public int getExpectedDocId() {
        return expectedDocId;
    }

    public int getActualDocId() {
        return actualDocId;
    }
}
