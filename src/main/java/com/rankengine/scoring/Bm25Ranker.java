package com.rankengine.scoring;

import com.rankengine.index.InvertedIndex;
import com.rankengine.storage.Posting;

/**
 * BM25打分，按查询内重复次数加权。
 */
public class Bm25Ranker implements Ranker {
    private static final int IDLE = -1;

    private final InvertedIndex index;
    private final Bm25Scorer scorer;
    private int docId = IDLE;
    private double score;

    public Bm25Ranker(InvertedIndex index, double k1, double b) {
        this.index = index;
        this.scorer = new Bm25Scorer(index.getDocumentCount(), index.getAverageDocumentLength(), k1, b);
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
        int docFrequency = index.getDocumentFrequency(term);
        score += multiplicity * scorer.score(posting.termFrequency(), docFrequency, index.getDocumentLength(docId));
    }

    @Override
    public double evaluate() {
        if (docId == IDLE) {
            throw new IllegalStateException("evaluate之前必须先reset");
        }
        return score;
    }
}
