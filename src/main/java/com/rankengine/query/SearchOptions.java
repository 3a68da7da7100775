package com.rankengine.query;

/**
 * 查询参数。
 *
 * @param matchThreshold 匹配阈值 T = N/M，取值 (0, 1]
 * @param hitCount 最多返回的结果数，非负
 */
public record SearchOptions(double matchThreshold, int hitCount) {
    public SearchOptions {
        if (Double.isNaN(matchThreshold) || matchThreshold <= 0.0 || matchThreshold > 1.0) {
            throw new IllegalArgumentException("matchThreshold必须在(0, 1]内: " + matchThreshold);
        }
        if (hitCount < 0) {
            throw new IllegalArgumentException("hitCount不能为负数: " + hitCount);
        }
    }
}
