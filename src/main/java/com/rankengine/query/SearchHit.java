package com.rankengine.query;

import com.rankengine.document.Document;

public record SearchHit(
        double score,
        Document document
) {
}
