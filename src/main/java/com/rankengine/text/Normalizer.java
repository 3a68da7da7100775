package com.rankengine.text;

/**
 * 文本归一化。索引期与查询期必须按相同顺序调用：先 canonicalize，再 normalize。
 */
public interface Normalizer {

    /**
     * 统一Unicode表示形式，例如全角/半角与组合字符。
     */
    String canonicalize(String text);

    /**
     * 大小写折叠。
     */
    String normalize(String text);
}
