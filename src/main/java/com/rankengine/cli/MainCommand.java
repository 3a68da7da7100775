package com.rankengine.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rankengine.config.Constants;
import com.rankengine.config.EngineConfig;
import com.rankengine.document.CorpusLoader;
import com.rankengine.document.InMemoryCorpus;
import com.rankengine.index.InMemoryInvertedIndex;
import com.rankengine.index.IndexStatus;
import com.rankengine.query.SearchEngine;
import com.rankengine.query.SearchHit;
import com.rankengine.query.SearchOptions;
import com.rankengine.query.SearchResult;
import com.rankengine.scoring.RankerType;
import com.rankengine.text.SimpleNormalizer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "rse",
    description = "🔍 N-of-M 排序检索引擎",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.SearchSubcommand.class,
        MainCommand.StatusSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"-c", "--config"}, description = "JSON配置文件路径")
    private Path configFile;

    @Option(names = {"--field"}, description = "索引字段（可指定多个），覆盖配置文件")
    private List<String> fields;

    @Option(names = {"--compressed"}, description = "使用压缩倒排列表")
    private boolean compressed;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 N-of-M 排序检索引擎");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    EngineConfig resolveConfig() {
        EngineConfig config = configFile == null ? EngineConfig.defaults() : EngineConfig.load(configFile);
        if (fields != null && !fields.isEmpty()) {
            config.setFields(fields);
        }
        if (compressed) {
            config.setCompressed(true);
        }
        return config;
    }

    InMemoryInvertedIndex buildIndex(InMemoryCorpus corpus, EngineConfig config) {
        return new InMemoryInvertedIndex(corpus, config.getFields(), new SimpleNormalizer(),
            config.createTokenizer(), config.isCompressed());
    }

    private String sanitizeQuery(String rawQuery) {
        if (rawQuery == null) {
            return "";
        }
        String trimmed = rawQuery.trim();
        if (trimmed.length() > Constants.MAX_QUERY_LENGTH) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "查询长度超过限制（最大 " + Constants.MAX_QUERY_LENGTH + " 字符）");
        }
        return trimmed;
    }

    @Command(name = "search", description = "🔎 对语料执行查询")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "语料文件（JSON数组）")
        private Path corpusFile;

        @Parameters(index = "1", description = "查询语句")
        private String query;

        @Option(names = {"-t", "--threshold"}, description = "匹配阈值 N/M，取值 (0, 1]")
        private Double threshold;

        @Option(names = {"-l", "--limit"}, description = "返回结果数量限制")
        private Integer limit;

        @Option(names = {"-r", "--ranker"}, description = "排序策略 (tfidf|static|bm25)")
        private String ranker;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                double effectiveThreshold = threshold == null ? config.getMatchThreshold() : threshold;
                int effectiveLimit = limit == null ? config.getHitCount() : limit;
                if (effectiveLimit > Constants.MAX_SEARCH_LIMIT) {
                    throw new IllegalArgumentException("limit=" + effectiveLimit + " 超过上限 " + Constants.MAX_SEARCH_LIMIT);
                }
                SearchOptions options = new SearchOptions(effectiveThreshold, effectiveLimit);
                RankerType rankerType = RankerType.fromName(ranker == null ? config.getRanker() : ranker);

                InMemoryCorpus corpus = new CorpusLoader().load(corpusFile);
                InMemoryInvertedIndex index = main.buildIndex(corpus, config);
                SearchEngine engine = new SearchEngine(corpus, index, config);
                String safeQuery = main.sanitizeQuery(query);
                SearchResult result = engine.search(safeQuery, options, rankerType);

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResult(result);
                    return 0;
                }

                System.out.println("🔍 查询: \"" + safeQuery + "\"");
                System.out.println();
                printTextResult(result);
                System.out.println();
                System.out.println("📊 共 " + result.totalMatches() + " 条匹配，用时 " + result.elapsedMs() + "ms");
                return 0;
            } catch (IllegalArgumentException exception) {
                System.err.println("❌ 参数错误: " + exception.getMessage());
                return 1;
            } catch (Exception exception) {
                System.err.println("❌ 搜索失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }

        private void printTextResult(SearchResult result) {
            if (result.hits().isEmpty()) {
                System.out.println("⚠️ 未找到匹配结果");
                return;
            }

            int rank = 1;
            for (SearchHit hit : result.hits()) {
                System.out.println("─────────────────────────────────");
                System.out.printf("%d. doc #%d (score: %.4f)%n", rank++, hit.document().docId(), hit.score());
                for (var field : hit.document().fields().entrySet()) {
                    System.out.println("   " + field.getKey() + ": " + abbreviate(field.getValue()));
                }
                System.out.println();
            }
        }

        private void printJsonResult(SearchResult result) throws IOException {
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        }

        private String abbreviate(String value) {
            String singleLine = value.replace("\n", " ");
            return singleLine.length() <= 80 ? singleLine : singleLine.substring(0, 77) + "...";
        }
    }

    @Command(name = "status", description = "📊 查看语料的索引统计信息")
    static class StatusSubcommand implements Callable<Integer> {

        @Parameters(description = "语料文件（JSON数组）", arity = "1")
        private Path corpusFile;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                InMemoryCorpus corpus = new CorpusLoader().load(corpusFile);
                InMemoryInvertedIndex index = main.buildIndex(corpus, config);
                IndexStatus status = index.getStatus();

                System.out.println("📊 索引状态");
                System.out.println("═══════════");
                System.out.println("📁 语料文件: " + corpusFile);
                System.out.println("🏷️ 索引字段: " + config.getFields());
                System.out.println("📄 文档总数: " + status.docCount());
                System.out.println("🔤 词条总数: " + status.termCount());
                System.out.println("📦 倒排项数: " + status.postingCount());
                System.out.println("🗜️ 压缩: " + (status.compressed() ? "是" : "否"));
                System.out.printf("📏 平均文档长度: %.2f%n", index.getAverageDocumentLength());
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }
    }
}
