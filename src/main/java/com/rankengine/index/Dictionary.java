package com.rankengine.index;

/**
 * 词项到整数ID的映射。ID从0开始连续分配，一经分配不再变化。
 */
public interface Dictionary extends Iterable<String> {

    /** 词项不存在时 {@link #getTermId(String)} 的返回值 */
    int UNKNOWN_TERM = -1;

    /**
     * 词项不存在时分配新ID，存在时返回已有ID。
     */
    int addIfAbsent(String term);

    /**
     * 查找词项ID，不存在返回 {@link #UNKNOWN_TERM}。
     */
    int getTermId(String term);

    /**
     * 按ID反查词项。
     */
    String getTerm(int termId);

    int size();
}
