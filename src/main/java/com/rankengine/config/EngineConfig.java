package com.rankengine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rankengine.text.ShingleGenerator;
import com.rankengine.text.SimpleTokenizer;
import com.rankengine.text.Tokenizer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 引擎运行时配置
 *
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值
 */
public class EngineConfig {
    private List<String> fields = new ArrayList<>(Constants.DEFAULT_FIELDS);
    private boolean compressed;
    private String tokenizer = Constants.TOKENIZER_SIMPLE;
    private int shingleWidth = Constants.DEFAULT_SHINGLE_WIDTH;
    private double matchThreshold = Constants.DEFAULT_MATCH_THRESHOLD;
    private int hitCount = Constants.DEFAULT_HIT_COUNT;
    private String ranker = "tfidf";
    private String staticScoreField = Constants.STATIC_SCORE_FIELD;
    private double dynamicScoreWeight = Constants.DYNAMIC_SCORE_WEIGHT;
    private double staticScoreWeight = Constants.STATIC_SCORE_WEIGHT;
    private double bm25K1 = Constants.BM25_K1;
    private double bm25B = Constants.BM25_B;

    public List<String> getFields() {
        return fields;
    }

    public void setFields(List<String> fields) {
        this.fields = new ArrayList<>(fields);
    }

    public boolean isCompressed() {
        return compressed;
    }

    public void setCompressed(boolean compressed) {
        this.compressed = compressed;
    }

    public String getTokenizer() {
        return tokenizer;
    }

    public void setTokenizer(String tokenizer) {
        this.tokenizer = tokenizer;
    }

    public int getShingleWidth() {
        return shingleWidth;
    }

    public void setShingleWidth(int shingleWidth) {
        this.shingleWidth = shingleWidth;
    }

    public double getMatchThreshold() {
        return matchThreshold;
    }

    public void setMatchThreshold(double matchThreshold) {
        this.matchThreshold = matchThreshold;
    }

    public int getHitCount() {
        return hitCount;
    }

    public void setHitCount(int hitCount) {
        this.hitCount = hitCount;
    }

    public String getRanker() {
        return ranker;
    }

    public void setRanker(String ranker) {
        this.ranker = ranker;
    }

    public String getStaticScoreField() {
        return staticScoreField;
    }

    public void setStaticScoreField(String staticScoreField) {
        this.staticScoreField = staticScoreField;
    }

    public double getDynamicScoreWeight() {
        return dynamicScoreWeight;
    }

    public void setDynamicScoreWeight(double dynamicScoreWeight) {
        this.dynamicScoreWeight = dynamicScoreWeight;
    }

    public double getStaticScoreWeight() {
        return staticScoreWeight;
    }

    public void setStaticScoreWeight(double staticScoreWeight) {
        this.staticScoreWeight = staticScoreWeight;
    }

    public double getBm25K1() {
        return bm25K1;
    }

    public void setBm25K1(double bm25K1) {
        this.bm25K1 = bm25K1;
    }

    public double getBm25B() {
        return bm25B;
    }

    public void setBm25B(double bm25B) {
        this.bm25B = bm25B;
    }

    /**
     * 按配置创建分词器。
     *
     * @throws IllegalArgumentException 如果分词器名称未知
     */
    public Tokenizer createTokenizer() {
        String name = tokenizer == null ? Constants.TOKENIZER_SIMPLE : tokenizer.toLowerCase(Locale.ROOT);
        return switch (name) {
            case Constants.TOKENIZER_SIMPLE -> new SimpleTokenizer();
            case Constants.TOKENIZER_SHINGLE -> new ShingleGenerator(shingleWidth);
            default -> throw new IllegalArgumentException("未知分词器: " + tokenizer);
        };
    }

    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * 从JSON文件读取配置，未出现的键保持默认值，未知键视为错误。
     */
    public static EngineConfig load(Path path) {
        ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        try {
            return mapper.readValue(path.toFile(), EngineConfig.class);
        } catch (IOException exception) {
            throw new UncheckedIOException("读取配置文件失败: " + path, exception);
        }
    }
}
