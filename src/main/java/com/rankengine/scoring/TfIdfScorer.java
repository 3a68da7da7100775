package com.rankengine.scoring;

public class TfIdfScorer {
    private final int totalDocs;

    public TfIdfScorer(int totalDocs) {
        this.totalDocs = totalDocs;
    }

    /**
     * idf = ln(N / df)。
     *
     * @throws IllegalArgumentException 如果df不在 [1, N] 内
     */
    public double computeIDF(int docFrequency) {
        if (docFrequency < 1 || docFrequency > totalDocs) {
            throw new IllegalArgumentException("文档频率越界: df=" + docFrequency + ", N=" + totalDocs);
        }
        return Math.log((double) totalDocs / docFrequency);
    }

    public double score(int termFrequency, int docFrequency) {
        return termFrequency * computeIDF(docFrequency);
    }
}
