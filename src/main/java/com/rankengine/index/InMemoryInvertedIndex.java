package com.rankengine.index;

import com.rankengine.document.Corpus;
import com.rankengine.document.Document;
import com.rankengine.storage.CompressedPostingList;
import com.rankengine.storage.InMemoryPostingList;
import com.rankengine.storage.Posting;
import com.rankengine.storage.PostingList;
import com.rankengine.text.Normalizer;
import com.rankengine.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存倒排索引，适用于小规模语料。
 *
 * 构造时一次性建好，之后只读，可以被多个查询线程同时读取。
 * 开启压缩时只压缩倒排列表，词典不压缩。
 */
public final class InMemoryInvertedIndex implements InvertedIndex {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryInvertedIndex.class);

    private final Normalizer normalizer;
    private final Tokenizer tokenizer;
    private final boolean compressed;
    private final Dictionary dictionary = new InMemoryDictionary();
    private final List<PostingList> postingLists = new ArrayList<>();
    private final int[] documentLengths;
    private final double averageDocumentLength;
    private long postingCount;

    public InMemoryInvertedIndex(Corpus corpus, List<String> fields, Normalizer normalizer, Tokenizer tokenizer) {
        this(corpus, fields, normalizer, tokenizer, false);
    }

    /**
     * 遍历语料建立索引。
     *
     * @throws IndexBuildException 如果某文档的docId与其在语料中的序号不一致
     */
    public InMemoryInvertedIndex(
            Corpus corpus,
            List<String> fields,
            Normalizer normalizer,
            Tokenizer tokenizer,
            boolean compressed) {
        if (corpus == null || fields == null || normalizer == null || tokenizer == null) {
            throw new IllegalArgumentException("corpus、fields、normalizer与tokenizer不能为null");
        }
        this.normalizer = normalizer;
        this.tokenizer = tokenizer;
        this.compressed = compressed;
        this.documentLengths = new int[corpus.size()];
        this.averageDocumentLength = buildIndex(corpus, List.copyOf(fields));
    }

    private double buildIndex(Corpus corpus, List<String> fields) {
        long startNanos = System.nanoTime();
        long totalLength = 0;
        int ordinal = 0;

        for (Document document : corpus) {
            if (document.docId() != ordinal) {
                throw new IndexBuildException(ordinal, document.docId());
            }
            if (ordinal >= documentLengths.length) {
                throw new IllegalStateException("语料迭代出的文档数超过size(): " + documentLengths.length);
            }

            // 文档内词频直方图，保持首次出现顺序，使词项ID分配可复现
            Map<String, Integer> histogram = new LinkedHashMap<>();
            int length = 0;
            for (String field : fields) {
                for (String term : getTerms(document.getField(field, ""))) {
                    histogram.merge(term, 1, Integer::sum);
                    length++;
                }
            }

            for (Map.Entry<String, Integer> entry : histogram.entrySet()) {
                int termId = dictionary.addIfAbsent(entry.getKey());
                if (termId == postingLists.size()) {
                    postingLists.add(compressed ? new CompressedPostingList() : new InMemoryPostingList());
                }
                postingLists.get(termId).append(new Posting(ordinal, entry.getValue()));
                postingCount++;
            }

            documentLengths[ordinal] = length;
            totalLength += length;
            ordinal++;
        }

        for (PostingList postingList : postingLists) {
            postingList.freeze();
        }

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.info("索引构建完成: 文档={}, 词项={}, 倒排项={}, 压缩={}, 用时={}ms",
            ordinal, dictionary.size(), postingCount, compressed, elapsedMs);
        return ordinal == 0 ? 0.0 : (double) totalLength / ordinal;
    }

    @Override
    public List<String> getTerms(String buffer) {
        if (buffer == null || buffer.isEmpty()) {
            return List.of();
        }
        String canonical = normalizer.canonicalize(buffer);
        return tokenizer.strings(normalizer.normalize(canonical));
    }

    @Override
    public Iterator<Posting> getPostingsIterator(String term) {
        int termId = dictionary.getTermId(term);
        if (termId == Dictionary.UNKNOWN_TERM) {
            return Collections.emptyIterator();
        }
        return postingLists.get(termId).iterator();
    }

    @Override
    public int getDocumentFrequency(String term) {
        int termId = dictionary.getTermId(term);
        if (termId == Dictionary.UNKNOWN_TERM) {
            return 0;
        }
        return postingLists.get(termId).size();
    }

    @Override
    public int getDocumentCount() {
        return documentLengths.length;
    }

    @Override
    public int getTermCount() {
        return dictionary.size();
    }

    @Override
    public int getDocumentLength(int docId) {
        return documentLengths[docId];
    }

    @Override
    public double getAverageDocumentLength() {
        return averageDocumentLength;
    }

    @Override
    public IndexStatus getStatus() {
        return new IndexStatus(documentLengths.length, dictionary.size(), postingCount, compressed);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("{");
        for (String term : dictionary) {
            if (builder.length() > 1) {
                builder.append(", ");
            }
            List<Posting> postings = new ArrayList<>();
            postingLists.get(dictionary.getTermId(term)).forEach(postings::add);
            builder.append(term).append('=').append(postings);
        }
        return builder.append('}').toString();
    }
}
