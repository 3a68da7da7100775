package com.rankengine.index;

public record IndexStatus(
        int docCount,
        int termCount,
        long postingCount,
        boolean compressed
) {
}
