package com.rankengine.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SieveTest {

    @Test
    @DisplayName("只保留得分最高的K个，降序输出")
    void testKeepsTopK() {
        Sieve sieve = new Sieve(3);
        sieve.sift(0.5, 1);
        sieve.sift(2.0, 2);
        sieve.sift(1.0, 3);
        sieve.sift(0.1, 4);
        sieve.sift(3.0, 5);

        assertEquals(List.of(new Sieve.Candidate(3.0, 5), new Sieve.Candidate(2.0, 2), new Sieve.Candidate(1.0, 3)),
            sieve.winners());
    }

    @Test
    @DisplayName("容量为0时不保留任何候选")
    void testZeroCapacity() {
        Sieve sieve = new Sieve(0);
        sieve.sift(1.0, 1);

        assertTrue(sieve.winners().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new Sieve(-1));
    }

    @Test
    @DisplayName("同分时先进入者保留")
    void testTiesKeepEarlierCandidates() {
        Sieve sieve = new Sieve(2);
        sieve.sift(1.0, 10);
        sieve.sift(1.0, 4);
        sieve.sift(1.0, 7);

        assertEquals(List.of(new Sieve.Candidate(1.0, 4), new Sieve.Candidate(1.0, 10)), sieve.winners());
    }

    @Test
    @DisplayName("随机输入下结果数不超过K且得分不增")
    void testBoundAndOrdering() {
        Random random = new Random(42);
        Sieve sieve = new Sieve(7);
        for (int id = 0; id < 500; id++) {
            sieve.sift(random.nextDouble(), id);
        }

        List<Sieve.Candidate> winners = sieve.winners();
        assertEquals(7, winners.size());
        for (int i = 1; i < winners.size(); i++) {
            assertTrue(winners.get(i - 1).score() >= winners.get(i).score());
        }
    }

    @Test
    @DisplayName("容量很大时按需增长，不预先分配")
    void testHugeCapacity() {
        Sieve sieve = new Sieve(Integer.MAX_VALUE);
        sieve.sift(1.0, 0);
        sieve.sift(2.0, 1);

        assertEquals(List.of(new Sieve.Candidate(2.0, 1), new Sieve.Candidate(1.0, 0)), sieve.winners());
    }
}
