package com.rankengine.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PostingListTest {

    private static PostingList newList(boolean compressed) {
        return compressed ? new CompressedPostingList() : new InMemoryPostingList();
    }

    private static List<Posting> drain(Iterator<Posting> iterator) {
        List<Posting> postings = new ArrayList<>();
        iterator.forEachRemaining(postings::add);
        return postings;
    }

    @ParameterizedTest
    @ValueSource(booleans = {false, true})
    @DisplayName("追加后按docId升序迭代")
    void testAppendAndIterate(boolean compressed) {
        PostingList postingList = newList(compressed);
        postingList.append(new Posting(0, 2));
        postingList.append(new Posting(3, 1));
        postingList.append(new Posting(300, 7));
        postingList.freeze();

        assertEquals(3, postingList.size());
        assertEquals(List.of(new Posting(0, 2), new Posting(3, 1), new Posting(300, 7)), drain(postingList.iterator()));
    }

    @ParameterizedTest
    @ValueSource(booleans = {false, true})
    @DisplayName("docId不递增时拒绝追加")
    void testRejectNonIncreasingDocIds(boolean compressed) {
        PostingList postingList = newList(compressed);
        postingList.append(new Posting(5, 1));

        assertThrows(IllegalArgumentException.class, () -> postingList.append(new Posting(5, 1)));
        assertThrows(IllegalArgumentException.class, () -> postingList.append(new Posting(4, 1)));
        assertEquals(1, postingList.size());
    }

    @ParameterizedTest
    @ValueSource(booleans = {false, true})
    @DisplayName("冻结后不可追加")
    void testFreezeRejectsAppend(boolean compressed) {
        PostingList postingList = newList(compressed);
        postingList.append(new Posting(1, 1));
        postingList.freeze();

        assertTrue(postingList.isFrozen());
        assertThrows(IllegalStateException.class, () -> postingList.append(new Posting(2, 1)));
    }

    @ParameterizedTest
    @ValueSource(booleans = {false, true})
    @DisplayName("多个迭代器互不影响")
    void testIteratorsAreIndependent(boolean compressed) {
        PostingList postingList = newList(compressed);
        postingList.append(new Posting(1, 1));
        postingList.append(new Posting(2, 1));
        postingList.freeze();

        Iterator<Posting> first = postingList.iterator();
        first.next();
        first.next();
        Iterator<Posting> second = postingList.iterator();

        assertFalse(first.hasNext());
        assertEquals(1, second.next().docId());
        assertThrows(NoSuchElementException.class, first::next);
    }

    @ParameterizedTest
    @ValueSource(booleans = {false, true})
    @DisplayName("空列表的迭代器与游标")
    void testEmptyList(boolean compressed) {
        PostingList postingList = newList(compressed);
        postingList.freeze();

        assertEquals(0, postingList.size());
        assertFalse(postingList.iterator().hasNext());
        assertTrue(postingList.cursor().isExhausted());
    }

    @Test
    @DisplayName("压缩列表与未压缩列表内容一致且更紧凑")
    void testCompressedMatchesDense() {
        InMemoryPostingList dense = new InMemoryPostingList();
        CompressedPostingList compressed = new CompressedPostingList();
        for (int docId = 0; docId < 2000; docId += 3) {
            Posting posting = new Posting(docId, 1 + docId % 5);
            dense.append(posting);
            compressed.append(posting);
        }
        dense.freeze();
        compressed.freeze();

        assertEquals(drain(dense.iterator()), drain(compressed.iterator()));
        // 差值3与小词频各占1字节
        assertEquals(2 * compressed.size(), compressed.byteSize());
    }

    @Test
    @DisplayName("Posting拒绝非法字段")
    void testPostingValidation() {
        assertThrows(IllegalArgumentException.class, () -> new Posting(-1, 1));
        assertThrows(IllegalArgumentException.class, () -> new Posting(0, 0));
    }
}
