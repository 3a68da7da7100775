package com.rankengine.text;

/**
 * 分词结果。
 *
 * @param term 词项文本
 * @param position 词项序号
 * @param startOffset 在输入文本中的起始偏移（含）
 * @param endOffset 在输入文本中的结束偏移（不含）
 */
public record Token(
    String term,
    int position,
    int startOffset,
    int endOffset
) {
}
