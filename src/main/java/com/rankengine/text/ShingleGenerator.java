package com.rankengine.text;

import java.util.ArrayList;
import java.util.List;

/**
 * 将文本切分为指定宽度、相互重叠的字符片段。例如 "mouse" 的3-shingle为 {"mou", "ous", "use"}。
 *
 * 文本短于宽度时输出一个较短的片段；不识别空白与标点。
 */
public class ShingleGenerator implements Tokenizer {

    private final int width;

    public ShingleGenerator(int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("shingle宽度必须为正数: " + width);
        }
        this.width = width;
    }

    public int getWidth() {
        return width;
    }

    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() < width) {
            return List.of(new Token(text, 0, 0, text.length()));
        }

        List<Token> tokens = new ArrayList<>(text.length() - width + 1);
        for (int start = 0; start + width <= text.length(); start++) {
            tokens.add(new Token(text.substring(start, start + width), start, start, start + width));
        }
        return List.copyOf(tokens);
    }
}
