package com.rankengine.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

public final class InMemoryDictionary implements Dictionary {
    private final Map<String, Integer> termIds = new HashMap<>();
    private final List<String> terms = new ArrayList<>();

    @Override
    public int addIfAbsent(String term) {
        if (term == null) {
            throw new IllegalArgumentException("term不能为null");
        }
        Integer existing = termIds.get(term);
        if (existing != null) {
            return existing;
        }
        int termId = terms.size();
        termIds.put(term, termId);
        terms.add(term);
        return termId;
    }

    @Override
    public int getTermId(String term) {
        if (term == null) {
            return UNKNOWN_TERM;
        }
        return termIds.getOrDefault(term, UNKNOWN_TERM);
    }

    @Override
    public String getTerm(int termId) {
        return terms.get(termId);
    }

    @Override
    public int size() {
        return terms.size();
    }

    /**
     * 按ID顺序迭代词项。
     */
    @Override
    public Iterator<String> iterator() {
        return Collections.unmodifiableList(terms).iterator();
    }
}
