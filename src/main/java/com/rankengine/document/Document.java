package com.rankengine.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 语料中的一篇文档。
 *
 * @param docId 文档ID，等于其在语料中的序号
 * @param fields 字段名到字段值
 */
public record Document(
        int docId,
        Map<String, String> fields
) {
    public Document {
        if (docId < 0) {
            throw new IllegalArgumentException("docId不能为负数: " + docId);
        }
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * 读取字段，字段不存在时返回默认值。
     */
    public String getField(String name, String defaultValue) {
        String value = fields.get(name);
        return value == null ? defaultValue : value;
    }
}
