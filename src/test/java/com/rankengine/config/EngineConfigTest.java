package com.rankengine.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.rankengine.text.ShingleGenerator;
import com.rankengine.text.SimpleTokenizer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EngineConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertNotNull(config);
        assertEquals(Constants.DEFAULT_FIELDS, config.getFields());
        assertFalse(config.isCompressed());
        assertEquals(Constants.TOKENIZER_SIMPLE, config.getTokenizer());
        assertEquals(Constants.DEFAULT_MATCH_THRESHOLD, config.getMatchThreshold());
        assertEquals(Constants.DEFAULT_HIT_COUNT, config.getHitCount());
        assertEquals("tfidf", config.getRanker());
        assertEquals(Constants.STATIC_SCORE_FIELD, config.getStaticScoreField());
        assertEquals(Constants.BM25_K1, config.getBm25K1());
        assertEquals(Constants.BM25_B, config.getBm25B());
    }

    @Test
    void testSetters() {
        EngineConfig config = new EngineConfig();

        config.setFields(List.of("title"));
        config.setCompressed(true);
        config.setMatchThreshold(0.8);
        config.setHitCount(50);
        config.setDynamicScoreWeight(0.3);
        config.setStaticScoreWeight(0.7);

        assertEquals(List.of("title"), config.getFields());
        assertTrue(config.isCompressed());
        assertEquals(0.8, config.getMatchThreshold());
        assertEquals(50, config.getHitCount());
        assertEquals(0.3, config.getDynamicScoreWeight());
        assertEquals(0.7, config.getStaticScoreWeight());
    }

    @Test
    void testLoadFromJson() throws URISyntaxException {
        Path path = Path.of(getClass().getResource("/fixtures/engine-config.json").toURI());

        EngineConfig config = EngineConfig.load(path);

        assertEquals(List.of("title", "body"), config.getFields());
        assertTrue(config.isCompressed());
        assertEquals(0.67, config.getMatchThreshold());
        assertEquals(3, config.getHitCount());
        assertEquals("static", config.getRanker());
        assertEquals(0.5, config.getStaticScoreWeight());
        // 未出现的键保持默认值
        assertEquals(Constants.DYNAMIC_SCORE_WEIGHT, config.getDynamicScoreWeight());
    }

    @Test
    void testLoadRejectsUnknownKeysAndMissingFile() throws IOException {
        Path unknown = tempDir.resolve("unknown.json");
        Files.writeString(unknown, "{\"threshold\": 0.5}");

        assertThrows(UncheckedIOException.class, () -> EngineConfig.load(unknown));
        assertThrows(UncheckedIOException.class, () -> EngineConfig.load(tempDir.resolve("missing.json")));
    }

    @Test
    void testCreateTokenizer() {
        EngineConfig config = new EngineConfig();
        assertInstanceOf(SimpleTokenizer.class, config.createTokenizer());

        config.setTokenizer("SHINGLE");
        config.setShingleWidth(4);
        ShingleGenerator shingles = assertInstanceOf(ShingleGenerator.class, config.createTokenizer());
        assertEquals(4, shingles.getWidth());

        config.setTokenizer("whitespace");
        assertThrows(IllegalArgumentException.class, config::createTokenizer);
    }
}
