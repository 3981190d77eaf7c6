package com.splayrope;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RopeDriverTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level rootLevel;
    private Level packageLevel;

    @BeforeEach
    void setUp() {
        rootLevel = loggerContext.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        packageLevel = loggerContext.getLogger("com.splayrope").getLevel();
    }

    @AfterEach
    void tearDown() {
        // execute() changes the levels of the shared logger context.
        loggerContext.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        loggerContext.getLogger("com.splayrope").setLevel(packageLevel);
    }

    private RopeDriver driver(ErrorPolicy policy) {
        return new RopeDriver(InputFormat.TEXT, policy, Rope.UNBOUNDED, objectMapper);
    }

    @Test
    void testRunTextScript() throws IOException {
        StringWriter output = new StringWriter();
        RunReport report = driver(ErrorPolicy.ABORT).run(new StringReader("hello\n1\n1 2 0\n"), output);
        assertEquals("elhlo\n", output.toString());
        assertEquals(5, report.length);
        assertEquals(1, report.operations);
        assertEquals(1, report.applied);
        assertEquals(0, report.rejected);
        assertFalse(report.aborted);
    }

    @Test
    void testRunEmptyText() throws IOException {
        StringWriter output = new StringWriter();
        RunReport report = driver(ErrorPolicy.ABORT).run(new StringReader("\n0\n"), output);
        assertEquals("\n", output.toString());
        assertEquals(0, report.length);
    }

    @Test
    void testRunAbortsOnRangeError() throws IOException {
        StringWriter output = new StringWriter();
        RunReport report = driver(ErrorPolicy.ABORT).run(
                new StringReader("abcdef\n3\n0 2 2\n0 2 4\n0 0 0\n"), output);
        assertTrue(report.aborted);
        assertEquals(1, report.applied);
        assertEquals(1, report.rejected);
        assertEquals("", output.toString());
    }

    @Test
    void testRunSkipsRangeErrors() throws IOException {
        StringWriter output = new StringWriter();
        RunReport report = driver(ErrorPolicy.SKIP).run(
                new StringReader("abcdef\n3\n0 2 4\n0 2 2\n5 4 0\n"), output);
        assertFalse(report.aborted);
        assertEquals(1, report.applied);
        assertEquals(2, report.rejected);
        assertEquals("deabcf\n", output.toString());
    }

    @Test
    void testRunJsonScript() throws IOException {
        RopeDriver driver = new RopeDriver(InputFormat.JSON, ErrorPolicy.ABORT, Rope.UNBOUNDED, objectMapper);
        StringWriter output = new StringWriter();
        driver.run(new StringReader("{\"text\": \"abcdef\", \"operations\": [{\"i\": 0, \"j\": 2, \"k\": 2}]}"),
                output);
        assertEquals("deabcf\n", output.toString());
    }

    @Test
    void testRunExceedsMaxLength() {
        RopeDriver driver = new RopeDriver(InputFormat.TEXT, ErrorPolicy.ABORT, 3, objectMapper);
        assertThrows(RopeResourceException.class,
                () -> driver.run(new StringReader("abcd\n0\n"), new StringWriter()));
    }

    @Test
    void testExecuteWithFiles(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("input.txt");
        Path output = dir.resolve("output.txt");
        Path report = dir.resolve("report.json");
        Files.writeString(input, "abcdefghij\n2\n0 4 5\n5 9 0\n", StandardCharsets.UTF_8);
        int code = RopeDriver.execute(new String[] {
                "--input", input.toString(), "--output", output.toString(), "--report", report.toString(),
                "--log-level", "warn" });
        assertEquals(RopeDriver.EXIT_OK, code);
        assertEquals("abcdefghij\n", Files.readString(output, StandardCharsets.UTF_8));
        JsonNode json = objectMapper.readTree(report.toFile());
        assertEquals(10, json.get("length").asInt());
        assertEquals(2, json.get("applied").asInt());
        assertEquals(0, json.get("rejected").asInt());
        assertFalse(json.get("aborted").asBoolean());
        assertTrue(json.has("elapsed_ms"));
    }

    @Test
    void testExecuteAborted(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("input.txt");
        Files.writeString(input, "abc\n1\n0 3 0\n", StandardCharsets.UTF_8);
        int code = RopeDriver.execute(new String[] {
                "--input", input.toString(), "--output", dir.resolve("out.txt").toString(), "--log-level", "off" });
        assertEquals(RopeDriver.EXIT_ABORTED, code);
    }

    @Test
    void testExecuteMalformedInput(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("input.txt");
        Files.writeString(input, "abc\nmany\n", StandardCharsets.UTF_8);
        int code = RopeDriver.execute(new String[] {
                "--input", input.toString(), "--output", dir.resolve("out.txt").toString(), "--log-level", "off" });
        assertEquals(RopeDriver.EXIT_FAILURE, code);
    }

    @Test
    void testExecuteMissingInputFile(@TempDir Path dir) {
        int code = RopeDriver.execute(new String[] {
                "--input", dir.resolve("missing.txt").toString(), "--output", dir.resolve("out.txt").toString(),
                "--log-level", "off" });
        assertEquals(RopeDriver.EXIT_FAILURE, code);
    }

    @Test
    void testExecuteNegativeMaxLength(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("input.txt");
        Files.writeString(input, "abc\n0\n", StandardCharsets.UTF_8);
        int code = RopeDriver.execute(new String[] {
                "--input", input.toString(), "--output", dir.resolve("out.txt").toString(),
                "--max-length", "-1" });
        assertEquals(RopeDriver.EXIT_FAILURE, code);
        assertFalse(Files.exists(dir.resolve("out.txt")));
    }

    @Test
    void testOptionNames() {
        assertEquals(ErrorPolicy.SKIP, ErrorPolicy.fromString("skip"));
        assertEquals(InputFormat.JSON, InputFormat.fromString("json"));
        assertThrows(IllegalArgumentException.class, () -> ErrorPolicy.fromString("retry"));
        assertThrows(IllegalArgumentException.class, () -> InputFormat.fromString("xml"));
    }

    @Test
    void testExecuteInvalidOption() {
        assertEquals(RopeDriver.EXIT_FAILURE, RopeDriver.execute(new String[] { "--format", "xml" }));
    }
}
