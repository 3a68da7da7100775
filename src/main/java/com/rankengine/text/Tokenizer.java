package com.rankengine.text;

import java.util.ArrayList;
import java.util.List;

public interface Tokenizer {

    /**
     * 将输入文本切分为词项列表，保留原文偏移。
     */
    List<Token> tokenize(String text);

    /**
     * 只返回词项文本，顺序与 {@link #tokenize(String)} 一致。
     */
    default List<String> strings(String text) {
        List<Token> tokens = tokenize(text);
        List<String> terms = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            terms.add(token.term());
        }
        return terms;
    }
}
