package com.rankengine.text;

import java.util.ArrayList;
import java.util.List;

/**
 * 以连续的字母或数字为词项，其余字符均视为分隔符。支持任意Unicode脚本。
 */
public class SimpleTokenizer implements Tokenizer {

    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        int position = 0;
        int cursor = 0;

        while (cursor < text.length()) {
            int codePoint = text.codePointAt(cursor);
            if (!isWordCharacter(codePoint)) {
                cursor += Character.charCount(codePoint);
                continue;
            }

            int start = cursor;
            while (cursor < text.length() && isWordCharacter(text.codePointAt(cursor))) {
                cursor += Character.charCount(text.codePointAt(cursor));
            }
            tokens.add(new Token(text.substring(start, cursor), position, start, cursor));
            position++;
        }

        return List.copyOf(tokens);
    }

    private boolean isWordCharacter(int codePoint) {
        return Character.isLetterOrDigit(codePoint)
            || Character.getType(codePoint) == Character.NON_SPACING_MARK
            || Character.getType(codePoint) == Character.COMBINING_SPACING_MARK;
    }
}
