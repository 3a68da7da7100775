package com.rankengine.query;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * 有界的Top-K筛选器，只保留得分最高的K个候选。
 *
 * 得分相同时先进入的候选保留，后来者不会挤掉它，因此同一输入序列的结果是确定的。
 */
public final class Sieve {
    private static final int MAX_INITIAL_CAPACITY = 1024;

    private static final Comparator<Candidate> BY_SCORE_ASCENDING =
        Comparator.comparingDouble(Candidate::score).thenComparing(Candidate::id, Comparator.reverseOrder());

    private final int capacity;
    private final PriorityQueue<Candidate> heap;

    public Sieve(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity不能为负数: " + capacity);
        }
        this.capacity = capacity;
        this.heap = new PriorityQueue<>(Math.max(1, Math.min(capacity, MAX_INITIAL_CAPACITY)), BY_SCORE_ASCENDING);
    }

    /**
     * 提交一个候选。
     */
    public void sift(double score, int id) {
        if (capacity == 0) {
            return;
        }
        if (heap.size() < capacity) {
            heap.add(new Candidate(score, id));
            return;
        }
        if (score > heap.peek().score()) {
            heap.poll();
            heap.add(new Candidate(score, id));
        }
    }

    /**
     * 按得分降序返回保留的候选，得分相同按id升序。
     */
    public List<Candidate> winners() {
        List<Candidate> winners = new ArrayList<>(heap);
        winners.sort(BY_SCORE_ASCENDING.reversed());
        return winners;
    }

    public int size() {
        return heap.size();
    }

    public record Candidate(double score, int id) {
    }
}
