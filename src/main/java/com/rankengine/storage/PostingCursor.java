package com.rankengine.storage;

import java.util.Collections;
import java.util.Iterator;

/**
 * 倒排列表游标：要么停在某个倒排项上，要么已耗尽。
 *
 * 创建时即定位到第一个倒排项，之后只能通过 {@link #advance()} 前移。
 */
public final class PostingCursor {
    private final Iterator<Posting> postings;
    private Posting current;

    public PostingCursor(Iterator<Posting> postings) {
        this.postings = postings;
        advance();
    }

    /**
     * 返回一个从一开始就耗尽的游标。
     */
    public static PostingCursor exhausted() {
        return new PostingCursor(Collections.emptyIterator());
    }

    /**
     * 当前倒排项；游标耗尽时返回null。
     */
    public Posting current() {
        return current;
    }

    public boolean isExhausted() {
        return current == null;
    }

    /**
     * 当前文档ID，调用前须确认游标未耗尽。
     */
    public int docId() {
        if (current == null) {
            throw new IllegalStateException("游标已耗尽");
        }
        return current.docId();
    }

    /**
     * 前移到下一个倒排项，没有更多时标记为耗尽。
     */
    public void advance() {
        current = postings.hasNext() ? postings.next() : null;
    }
}
