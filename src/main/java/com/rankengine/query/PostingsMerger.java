package com.rankengine.query;

import com.rankengine.storage.Posting;
import com.rankengine.storage.PostingCursor;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 两路倒排列表合并。
 *
 * 输入须按docId升序；输出同样升序，且按需拉取，不会展开整条列表。
 * 两侧在同一文档上都有倒排项时，输出左侧（第一个参数）的倒排项。
 */
public final class PostingsMerger {

    private PostingsMerger() {
        // 工具类，禁止实例化
    }

    /**
     * 交集：两侧都出现的文档。
     */
    public static Iterator<Posting> intersection(Iterator<Posting> left, Iterator<Posting> right) {
        PostingCursor leftCursor = new PostingCursor(left);
        PostingCursor rightCursor = new PostingCursor(right);
        return new MergingIterator() {
            @Override
            Posting computeNext() {
                while (!leftCursor.isExhausted() && !rightCursor.isExhausted()) {
                    int leftDocId = leftCursor.docId();
                    int rightDocId = rightCursor.docId();
                    if (leftDocId == rightDocId) {
                        Posting match = leftCursor.current();
                        leftCursor.advance();
                        rightCursor.advance();
                        return match;
                    }
                    if (leftDocId < rightDocId) {
                        leftCursor.advance();
                    } else {
                        rightCursor.advance();
                    }
                }
                return null;
            }
        };
    }

    /**
     * 并集：任一侧出现的文档，每个文档只输出一次。
     */
    public static Iterator<Posting> union(Iterator<Posting> left, Iterator<Posting> right) {
        PostingCursor leftCursor = new PostingCursor(left);
        PostingCursor rightCursor = new PostingCursor(right);
        return new MergingIterator() {
            @Override
            Posting computeNext() {
                if (leftCursor.isExhausted() && rightCursor.isExhausted()) {
                    return null;
                }
                if (rightCursor.isExhausted()) {
                    return take(leftCursor);
                }
                if (leftCursor.isExhausted()) {
                    return take(rightCursor);
                }
                int leftDocId = leftCursor.docId();
                int rightDocId = rightCursor.docId();
                if (leftDocId == rightDocId) {
                    rightCursor.advance();
                    return take(leftCursor);
                }
                return leftDocId < rightDocId ? take(leftCursor) : take(rightCursor);
            }
        };
    }

    private static Posting take(PostingCursor cursor) {
        Posting posting = cursor.current();
        cursor.advance();
        return posting;
    }

    /**
     * 预取一个元素的迭代器骨架，computeNext返回null表示结束。
     */
    private abstract static class MergingIterator implements Iterator<Posting> {
        private Posting next;
        private boolean ready;

        abstract Posting computeNext();

        @Override
        public boolean hasNext() {
            if (!ready) {
                next = computeNext();
                ready = true;
            }
            return next != null;
        }

        @Override
        public Posting next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ready = false;
            return next;
        }
    }
}
