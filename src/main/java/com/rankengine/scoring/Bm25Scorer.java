package com.rankengine.scoring;

import com.rankengine.config.Constants;

/**
 * BM25单词项打分公式。
 *
 * idf = ln((N - df + 0.5) / (df + 0.5) + 1)，恒为正；
 * 文档长度按 avgDocLength 归一化，k1 控制词频饱和，b 控制长度惩罚。
 */
public class Bm25Scorer {
    private final int totalDocs;
    private final double avgDocLength;
    private final double k1;
    private final double b;

    public Bm25Scorer(int totalDocs, double avgDocLength) {
        this(totalDocs, avgDocLength, Constants.BM25_K1, Constants.BM25_B);
    }

    public Bm25Scorer(int totalDocs, double avgDocLength, double k1, double b) {
        this.totalDocs = Math.max(totalDocs, 1);
        this.avgDocLength = avgDocLength <= 0 ? 1.0 : avgDocLength;
        this.k1 = k1;
        this.b = b;
    }

    public double computeIDF(int docFrequency) {
        int boundedDf = Math.max(0, Math.min(docFrequency, totalDocs));
        return Math.log((totalDocs - boundedDf + 0.5) / (boundedDf + 0.5) + 1);
    }

    /**
     * @param docLength 文档在索引字段中的词项总数
     * @return 词频非正时为0
     */
    public double score(int termFrequency, int docFrequency, int docLength) {
        if (termFrequency <= 0) {
            return 0.0;
        }
        double norm = 1 - b + b * (Math.max(docLength, 0) / avgDocLength);
        return computeIDF(docFrequency) * (termFrequency * (k1 + 1)) / (termFrequency + k1 * norm);
    }
}
