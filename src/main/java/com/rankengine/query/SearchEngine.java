package com.rankengine.query;

import com.rankengine.config.EngineConfig;
import com.rankengine.document.Corpus;
import com.rankengine.index.InvertedIndex;
import com.rankengine.scoring.Ranker;
import com.rankengine.scoring.RankerType;
import com.rankengine.storage.PostingCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * N-of-M排序检索
 *
 * 查询含M个不同词项时，文档至少包含其中N个才算命中。N由匹配阈值 T = N/M 推出：
 * T = 1.0 等价于全部AND，N = 1 等价于OR。例如对 "orange apple banana" 做 2-of-3 匹配，
 * 等价于 (orange AND apple) OR (orange AND banana) OR (apple AND banana)。
 *
 * 实现为多路游标同步归并：每个查询词项一个游标，每轮取所有未耗尽游标中最小的docId作为前沿，
 * 停在前沿上的游标数不少于N时交给Ranker打分并送入Sieve，随后推进所有停在前沿上的游标。
 * 未耗尽的游标少于N个时，不可能再有文档达标，提前结束。
 *
 * 引擎本身无状态，可被多个线程共用；每个查询须使用自己的Ranker实例。
 */
public class SearchEngine {
    private static final Logger logger = LoggerFactory.getLogger(SearchEngine.class);

    private final Corpus corpus;
    private final InvertedIndex index;
    private final EngineConfig config;

    public SearchEngine(Corpus corpus, InvertedIndex index) {
        this(corpus, index, EngineConfig.defaults());
    }

    public SearchEngine(Corpus corpus, InvertedIndex index, EngineConfig config) {
        this.corpus = corpus;
        this.index = index;
        this.config = config;
    }

    /**
     * 使用配置中的阈值、结果数与排序策略执行查询。
     */
    public SearchResult search(String query) {
        SearchOptions options = new SearchOptions(config.getMatchThreshold(), config.getHitCount());
        return search(query, options, RankerType.fromName(config.getRanker()));
    }

    /**
     * 为本次查询新建指定类型的Ranker并执行查询。
     */
    public SearchResult search(String query, SearchOptions options, RankerType rankerType) {
        return search(query, options, rankerType.create(corpus, index, config));
    }

    public SearchResult search(String query, SearchOptions options, Ranker ranker) {
        if (options == null || ranker == null) {
            throw new IllegalArgumentException("options与ranker不能为null");
        }
        long startNanos = System.nanoTime();

        Map<String, Integer> queryTerms = collectQueryTerms(query);
        int termCount = queryTerms.size();
        if (termCount == 0 || options.hitCount() == 0) {
            return new SearchResult(List.of(), 0, elapsedMs(startNanos), query);
        }
        int required = requiredMatches(options.matchThreshold(), termCount);

        List<String> terms = new ArrayList<>(queryTerms.keySet());
        List<Integer> multiplicities = new ArrayList<>(queryTerms.values());
        PostingCursor[] cursors = new PostingCursor[termCount];
        int active = 0;
        for (int i = 0; i < termCount; i++) {
            cursors[i] = new PostingCursor(index.getPostingsIterator(terms.get(i)));
            if (!cursors[i].isExhausted()) {
                active++;
            }
        }

        Sieve sieve = new Sieve(options.hitCount());
        int totalMatches = 0;

        while (active >= required) {
            int frontier = Integer.MAX_VALUE;
            for (PostingCursor cursor : cursors) {
                if (!cursor.isExhausted() && cursor.docId() < frontier) {
                    frontier = cursor.docId();
                }
            }

            int onFrontier = 0;
            for (PostingCursor cursor : cursors) {
                if (!cursor.isExhausted() && cursor.docId() == frontier) {
                    onFrontier++;
                }
            }

            if (onFrontier >= required) {
                ranker.reset(frontier);
                for (int i = 0; i < termCount; i++) {
                    if (!cursors[i].isExhausted() && cursors[i].docId() == frontier) {
                        ranker.update(terms.get(i), multiplicities.get(i), cursors[i].current());
                    }
                }
                sieve.sift(ranker.evaluate(), frontier);
                totalMatches++;
            }

            for (PostingCursor cursor : cursors) {
                if (!cursor.isExhausted() && cursor.docId() == frontier) {
                    cursor.advance();
                    if (cursor.isExhausted()) {
                        active--;
                    }
                }
            }
        }

        List<SearchHit> hits = new ArrayList<>(sieve.size());
        for (Sieve.Candidate winner : sieve.winners()) {
            hits.add(new SearchHit(winner.score(), corpus.getDocument(winner.id())));
        }

        long elapsedMs = elapsedMs(startNanos);
        logger.debug("查询完成: query=\"{}\", M={}, N={}, 命中={}, 返回={}, 用时={}ms",
            query, termCount, required, totalMatches, hits.size(), elapsedMs);
        return new SearchResult(List.copyOf(hits), totalMatches, elapsedMs, query);
    }

    /**
     * N = clamp(round(T × M), 1, M)。
     */
    static int requiredMatches(double matchThreshold, int termCount) {
        long rounded = Math.round(matchThreshold * termCount);
        return (int) Math.max(1, Math.min(termCount, rounded));
    }

    /**
     * 查询词项去重，值为词项在查询中的出现次数，保持首次出现顺序。
     */
    private Map<String, Integer> collectQueryTerms(String query) {
        Map<String, Integer> queryTerms = new LinkedHashMap<>();
        for (String term : index.getTerms(query)) {
            queryTerms.merge(term, 1, Integer::sum);
        }
        return queryTerms;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
