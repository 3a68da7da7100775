package com.rankengine.config;

import java.util.List;

/**
 * 全局常量定义
 *
 * 包含索引参数、查询参数、排序参数与命令行限制
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 索引参数 ====================
    /** 默认索引字段 */
    public static final List<String> DEFAULT_FIELDS = List.of("body");
    /** 默认分词器 */
    public static final String TOKENIZER_SIMPLE = "simple";
    /** 字符片段分词器 */
    public static final String TOKENIZER_SHINGLE = "shingle";
    /** 默认shingle宽度 */
    public static final int DEFAULT_SHINGLE_WIDTH = 3;

    // ==================== 查询参数 ====================
    /** 默认匹配阈值 N/M */
    public static final double DEFAULT_MATCH_THRESHOLD = 0.5;
    /** 默认返回结果数 */
    public static final int DEFAULT_HIT_COUNT = 10;

    // ==================== 排序参数 ====================
    /** 静态质量分字段名 */
    public static final String STATIC_SCORE_FIELD = "static_quality_score";
    /** 静态质量分缺失时的取值 */
    public static final double DEFAULT_STATIC_SCORE = 0.0;
    /** 动态分（TF-IDF）权重 */
    public static final double DYNAMIC_SCORE_WEIGHT = 1.0;
    /** 静态分权重 */
    public static final double STATIC_SCORE_WEIGHT = 1.0;
    /** 词频饱和系数 */
    public static final double BM25_K1 = 1.2;
    /** 长度归一化系数 */
    public static final double BM25_B = 0.75;

    // ==================== 命令行限制 ====================
    /** 查询字符串最大长度 */
    public static final int MAX_QUERY_LENGTH = 1024;
    /** 单次查询最大返回数 */
    public static final int MAX_SEARCH_LIMIT = 1000;
}
