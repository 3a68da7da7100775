package com.rankengine.scoring;

import com.rankengine.index.InvertedIndex;
import com.rankengine.storage.Posting;

/**
 * 传统TF-IDF打分：score += tf × ln(N / df) × 查询内重复次数。
 */
public class TfIdfRanker implements Ranker {
    private static final int IDLE = -1;

    private final InvertedIndex index;
    private final TfIdfScorer scorer;
    private int docId = IDLE;
    private double score;

    public TfIdfRanker(InvertedIndex index) {
        this.index = index;
        this.scorer = new TfIdfScorer(index.getDocumentCount());
    }

    @Override
    public void reset(int docId) {
        this.docId = docId;
        this.score = 0.0;
    }

    @Override
    public void update(String term, int multiplicity, Posting posting) {
        if (docId == IDLE) {
            throw new IllegalStateException("update之前必须先reset");
        }
        if (posting.docId() != docId) {
            throw new IllegalStateException("倒排项docId与当前文档不一致: current=" + docId + ", posting=" + posting.docId());
        }
        score += scorer.score(posting.termFrequency(), index.getDocumentFrequency(term)) * multiplicity;
    }

    @Override
    public double evaluate() {
        if (docId == IDLE) {
            throw new IllegalStateException("evaluate之前必须先reset");
        }
        return score;
    }
}
