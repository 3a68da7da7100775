package com.rankengine.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class PostingCursorTest {

    @Test
    void testAdvanceUntilExhausted() {
        PostingCursor cursor = new PostingCursor(List.of(new Posting(2, 1), new Posting(9, 4)).iterator());

        assertFalse(cursor.isExhausted());
        assertEquals(2, cursor.docId());
        cursor.advance();
        assertEquals(new Posting(9, 4), cursor.current());
        cursor.advance();
        assertTrue(cursor.isExhausted());
        assertNull(cursor.current());
        assertThrows(IllegalStateException.class, cursor::docId);

        cursor.advance();
        assertTrue(cursor.isExhausted());
    }

    @Test
    void testExhaustedFactory() {
        assertTrue(PostingCursor.exhausted().isExhausted());
    }
}
