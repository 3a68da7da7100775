package com.rankengine.scoring;

import com.rankengine.config.Constants;
import com.rankengine.document.Corpus;
import com.rankengine.index.InvertedIndex;
import com.rankengine.storage.Posting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TF-IDF与文档静态质量分的线性组合：
 * final = dynamicWeight × tfidf + staticWeight × static。
 * 两部分是相加而不是相乘，静态分为0的文档仍按TF-IDF排序。
 *
 * 静态分取自文档字段（默认 {@value Constants#STATIC_SCORE_FIELD}），
 * 字段缺失或不是数值时按 {@value Constants#DEFAULT_STATIC_SCORE} 计算。
 */
public class StaticScoreRanker implements Ranker {
    private static final Logger logger = LoggerFactory.getLogger(StaticScoreRanker.class);
    private static final int IDLE = -1;

    private final Corpus corpus;
    private final InvertedIndex index;
    private final TfIdfScorer scorer;
    private final String staticScoreField;
    private final double dynamicWeight;
    private final double staticWeight;
    private int docId = IDLE;
    private double dynamicScore;

    public StaticScoreRanker(Corpus corpus, InvertedIndex index) {
        this(corpus, index, Constants.STATIC_SCORE_FIELD, Constants.DYNAMIC_SCORE_WEIGHT, Constants.STATIC_SCORE_WEIGHT);
    }

    public StaticScoreRanker(
            Corpus corpus,
            InvertedIndex index,
            String staticScoreField,
            double dynamicWeight,
            double staticWeight) {
        this.corpus = corpus;
        this.index = index;
        this.scorer = new TfIdfScorer(index.getDocumentCount());
        this.staticScoreField = staticScoreField;
        this.dynamicWeight = dynamicWeight;
        this.staticWeight = staticWeight;
    }

    @Override
    public void reset(int docId) {
        this.docId = docId;
        this.dynamicScore = 0.0;
    }

    @Override
    public void update(String term, int multiplicity, Posting posting) {
        if (docId == IDLE) {
            throw new IllegalStateException("update之前必须先reset");
        }
        if (posting.docId() != docId) {
            throw new IllegalStateException("倒排项docId与当前文档不一致: current=" + docId + ", posting=" + posting.docId());
        }
        dynamicScore += scorer.score(posting.termFrequency(), index.getDocumentFrequency(term)) * multiplicity;
    }

    @Override
    public double evaluate() {
        if (docId == IDLE) {
            throw new IllegalStateException("evaluate之前必须先reset");
        }
        return dynamicWeight * dynamicScore + staticWeight * staticScore();
    }

    private double staticScore() {
        String raw = corpus.getDocument(docId).getField(staticScoreField, null);
        if (raw == null || raw.isBlank()) {
            return Constants.DEFAULT_STATIC_SCORE;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException exception) {
            logger.warn("静态质量分不是数值: docId={}, {}={}", docId, staticScoreField, raw);
            return Constants.DEFAULT_STATIC_SCORE;
        }
    }
}
