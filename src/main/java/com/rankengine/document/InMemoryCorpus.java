package com.rankengine.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

public class InMemoryCorpus implements Corpus {
    private final List<Document> documents = new ArrayList<>();

    public InMemoryCorpus() {
    }

    public InMemoryCorpus(List<Document> documents) {
        for (Document document : documents) {
            addDocument(document);
        }
    }

    /**
     * 追加文档。这里不校验docId与序号是否一致，由建索引时统一检查。
     */
    public void addDocument(Document document) {
        if (document == null) {
            throw new IllegalArgumentException("document不能为null");
        }
        documents.add(document);
    }

    @Override
    public int size() {
        return documents.size();
    }

    @Override
    public Document getDocument(int docId) {
        return documents.get(docId);
    }

    @Override
    public Iterator<Document> iterator() {
        return Collections.unmodifiableList(documents).iterator();
    }
}
