package com.rankengine.scoring;

import com.rankengine.config.EngineConfig;
import com.rankengine.document.Corpus;
import com.rankengine.index.InvertedIndex;

import java.util.Locale;

/**
 * 可选的排序策略。每次调用 {@link #create} 都返回新实例。
 */
public enum RankerType {
    TFIDF {
        @Override
        public Ranker create(Corpus corpus, InvertedIndex index, EngineConfig config) {
            return new TfIdfRanker(index);
        }
    },
    STATIC {
        @Override
        public Ranker create(Corpus corpus, InvertedIndex index, EngineConfig config) {
            return new StaticScoreRanker(corpus, index, config.getStaticScoreField(),
                config.getDynamicScoreWeight(), config.getStaticScoreWeight());
        }
    },
    BM25 {
        @Override
        public Ranker create(Corpus corpus, InvertedIndex index, EngineConfig config) {
            return new Bm25Ranker(index, config.getBm25K1(), config.getBm25B());
        }
    };

    public abstract Ranker create(Corpus corpus, InvertedIndex index, EngineConfig config);

    /**
     * 按名称解析，忽略大小写。
     *
     * @throws IllegalArgumentException 如果名称未知
     */
    public static RankerType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("ranker名称不能为null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException exception) {
            throw new IllegalArgumentException("未知ranker: " + name + "，可选 tfidf|static|bm25", exception);
        }
    }
}
