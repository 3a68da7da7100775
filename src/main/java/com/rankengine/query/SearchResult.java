package com.rankengine.query;

import java.util.List;

/**
 * @param hits 按得分降序的结果
 * @param totalMatches 满足N-of-M条件的文档总数（截断前）
 * @param elapsedMs 查询耗时
 * @param query 原始查询
 */
public record SearchResult(
        List<SearchHit> hits,
        int totalMatches,
        long elapsedMs,
        String query
) {
}
