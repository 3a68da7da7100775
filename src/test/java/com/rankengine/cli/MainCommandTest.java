package com.rankengine.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.rankengine.document.Document;
import com.rankengine.query.SearchHit;
import com.rankengine.query.SearchResult;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.lang.reflect.Method;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    @TempDir
    Path tempDir;

    private Path corpusFile;
    private Path configFile;

    @BeforeEach
    void setUp() throws IOException {
        corpusFile = copyFixture("fruit-corpus.json");
        configFile = copyFixture("engine-config.json");
    }

    private Path copyFixture(String name) throws IOException {
        Path target = tempDir.resolve(name);
        try (InputStream input = getClass().getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(input, name);
            Files.copy(input, target);
        }
        return target;
    }

    private static String captureStdout(Runnable action) {
        ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        try {
            System.setOut(new PrintStream(outputBuffer, true, StandardCharsets.UTF_8));
            action.run();
        } finally {
            System.setOut(originalOut);
        }
        return outputBuffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testCallWithoutSubcommand() {
        assertEquals(0, new MainCommand().call());
    }

    @Test
    void testHelpOptionReturnsZero() {
        int exitCode = new CommandLine(new MainCommand()).execute("--help");
        assertEquals(0, exitCode);
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        ParseResult parseResult = commandLine.parseArgs(
            "--field", "title", "--compressed", "search", corpusFile.toString(), "orange", "-t", "0.5");

        assertNotNull(parseResult.subcommand());
        assertEquals("search", parseResult.subcommand().commandSpec().name());
        assertEquals(List.of("title"), parseResult.matchedOption("--field").getValue());
    }

    @Test
    void testSearchTextOutput() {
        String output = captureStdout(() -> assertEquals(0, new CommandLine(new MainCommand())
            .execute("search", corpusFile.toString(), "orange apple banana", "-t", "0.67")));

        assertTrue(output.contains("doc #0"));
        assertTrue(output.contains("doc #2"));
        assertTrue(output.contains("共 2 条匹配"));
    }

    @Test
    void testSearchJsonOutputWithConfigFile() {
        String output = captureStdout(() -> assertEquals(0, new CommandLine(new MainCommand())
            .execute("--config", configFile.toString(), "search", corpusFile.toString(), "apple", "-f", "json")));

        assertTrue(output.contains("\"totalMatches\""));
        assertTrue(output.contains("\"hits\""));
        assertTrue(output.contains("Apples only"));
    }

    @Test
    void testSearchWithNoHits() {
        String output = captureStdout(() -> assertEquals(0, new CommandLine(new MainCommand())
            .execute("search", corpusFile.toString(), "durian")));

        assertTrue(output.contains("未找到匹配结果"));
    }

    @Test
    void testSearchRejectsInvalidOptions() {
        assertEquals(1, new CommandLine(new MainCommand())
            .execute("search", corpusFile.toString(), "orange", "-t", "1.5"));
        assertEquals(1, new CommandLine(new MainCommand())
            .execute("search", corpusFile.toString(), "orange", "-r", "cosine"));
        assertEquals(1, new CommandLine(new MainCommand())
            .execute("search", tempDir.resolve("missing.json").toString(), "orange"));
    }

    @Test
    void testStatusSubcommand() {
        String output = captureStdout(() -> assertEquals(0, new CommandLine(new MainCommand())
            .execute("--compressed", "status", corpusFile.toString())));

        assertTrue(output.contains("文档总数: 5"));
        assertTrue(output.contains("压缩: 是"));
    }

    @Test
    void testPrintJsonResult() throws Exception {
        MainCommand.SearchSubcommand searchSubcommand = new MainCommand.SearchSubcommand();
        Document document = new Document(1, Map.of("body", "demo"));
        SearchResult searchResult = new SearchResult(List.of(new SearchHit(1.5, document)), 1, 5L, "demo");

        Method printJsonResultMethod = MainCommand.SearchSubcommand.class.getDeclaredMethod("printJsonResult", SearchResult.class);
        printJsonResultMethod.setAccessible(true);

        String outputText = captureStdout(() -> {
            try {
                printJsonResultMethod.invoke(searchSubcommand, searchResult);
            } catch (ReflectiveOperationException exception) {
                throw new IllegalStateException(exception);
            }
        });

        assertTrue(outputText.contains("\"score\" : 1.5"));
        assertTrue(outputText.contains("\"query\" : \"demo\""));
    }
}
