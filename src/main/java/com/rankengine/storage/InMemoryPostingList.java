package com.rankengine.storage;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 未压缩的内存倒排列表，docId与词频分别存放在两个并行数组中。
 */
public final class InMemoryPostingList implements PostingList {
    private static final int INITIAL_CAPACITY = 4;

    private int[] docIds = new int[INITIAL_CAPACITY];
    private int[] termFreqs = new int[INITIAL_CAPACITY];
    private int size;
    private boolean frozen;

    @Override
    public void append(Posting posting) {
        if (frozen) {
            throw new IllegalStateException("倒排列表已冻结，不能追加");
        }
        if (size > 0 && posting.docId() <= docIds[size - 1]) {
            throw new IllegalArgumentException("docIds必须严格递增，last=" + docIds[size - 1] + ", current=" + posting.docId());
        }
        if (size == docIds.length) {
            docIds = Arrays.copyOf(docIds, size * 2);
            termFreqs = Arrays.copyOf(termFreqs, size * 2);
        }
        docIds[size] = posting.docId();
        termFreqs[size] = posting.termFrequency();
        size++;
    }

    @Override
    public void freeze() {
        if (!frozen) {
            docIds = Arrays.copyOf(docIds, size);
            termFreqs = Arrays.copyOf(termFreqs, size);
            frozen = true;
        }
    }

    @Override
    public boolean isFrozen() {
        return frozen;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public Iterator<Posting> iterator() {
        int[] snapshotDocIds = docIds;
        int[] snapshotTermFreqs = termFreqs;
        int snapshotSize = size;
        return new Iterator<>() {
            private int index;

            @Override
            public boolean hasNext() {
                return index < snapshotSize;
            }

            @Override
            public Posting next() {
                if (index >= snapshotSize) {
                    throw new NoSuchElementException();
                }
                Posting posting = new Posting(snapshotDocIds[index], snapshotTermFreqs[index]);
                index++;
                return posting;
            }
        };
    }
}
