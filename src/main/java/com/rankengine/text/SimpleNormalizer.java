package com.rankengine.text;

import java.text.Normalizer.Form;
import java.util.Locale;

public class SimpleNormalizer implements Normalizer {

    /**
     * NFKC：半角片假名折叠为全角，"C" + 组合变音符合并为 "Ç"。
     */
    @Override
    public String canonicalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return java.text.Normalizer.normalize(text, Form.NFKC);
    }

    @Override
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT);
    }
}
