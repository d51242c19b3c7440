package com.tinyc;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class TinyCTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    public void testExpressionFromArguments() {
        int exitCode = execute("sub", "2", "sum", "1", "3", "4");

        assertEquals(0, exitCode);
        String output = out.toString();
        assertTrue(output.contains("tokens:  [\"sub\",\"2\",\"sum\",\"1\",\"3\",\"4\"]"));
        assertTrue(output.contains("\"type\" : \"op\""));
        assertTrue(output.contains("eval:    -6"));
        assertTrue(output.contains("compile: (2 - (1 + 3 + 4))"));
    }

    @Test
    public void testQuotedExpressionIsSplitByLexer() {
        assertEquals(0, execute("--stage", "eval", "mul 2 3 4"));
        assertEquals("eval:    24", out.toString().trim());
    }

    @Test
    public void testStageSelectionIsCaseInsensitive() {
        assertEquals(0, execute("-s", "COMPILE", "-s", "tokens", "sum 1 2 3"));
        String[] lines = out.toString().trim().split("\\R");
        assertEquals(2, lines.length);
        assertTrue(lines[0].startsWith("tokens:"));
        assertEquals("compile: (1 + 2 + 3)", lines[1]);
    }

    @Test
    public void testCompactOutput() {
        assertEquals(0, execute("-c", "-s", "ast", "sum 1 2"));
        assertEquals("ast:     {\"type\":\"op\",\"operator\":\"sum\",\"operands\":"
                + "[{\"type\":\"num\",\"value\":1},{\"type\":\"num\",\"value\":2}]}", out.toString().trim());
    }

    @Test
    public void testFailingProgramExitsWithOne() {
        int exitCode = execute("div", "4", "0");

        assertEquals(1, exitCode);
        assertTrue(out.toString().contains("eval:    error: Division by zero"));
        assertTrue(out.toString().contains("compile: (4 / 0)"));
    }

    @Test
    public void testProgramsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("programs.txt");
        Files.writeString(file, "sum 1 2 3\n\nmul 2 3 4\n", StandardCharsets.UTF_8);

        assertEquals(0, execute("-s", "eval", "--file", file.toString()));
        assertEquals("eval:    6" + System.lineSeparator() + "eval:    24", out.toString().trim());
    }

    @Test
    public void testMissingFileIsReported(@TempDir Path dir) {
        int exitCode = execute("--file", dir.resolve("missing.txt").toString());

        assertEquals(1, exitCode);
        assertTrue(err.toString().startsWith("Error:"));
        assertEquals("", out.toString());
    }

    @Test
    public void testProgramsFromStdin() {
        InputStream original = System.in;
        try {
            System.setIn(new ByteArrayInputStream("sub 2 sum 1 3 4\nsub\n".getBytes(StandardCharsets.UTF_8)));
            int exitCode = execute("-s", "eval", "-s", "compile");

            assertEquals(1, exitCode);
            String output = out.toString();
            assertTrue(output.contains("eval:    -6"));
            assertTrue(output.contains("eval:    error: Operator 'sub' needs at least one operand"));
            assertTrue(output.contains("compile: ()"));
        } finally {
            System.setIn(original);
        }
    }

    @Test
    public void testUnreadableStdinIsReported() {
        InputStream original = System.in;
        try {
            System.setIn(new InputStream() {
                @Override
                public int read() throws IOException {
                    throw new IOException("stream closed");
                }
            });
            int exitCode = execute("-s", "eval");

            assertEquals(1, exitCode);
            assertEquals("Error: stream closed", err.toString().trim());
            assertEquals("", out.toString());
        } finally {
            System.setIn(original);
        }
    }

    @Test
    public void testDeeplyNestedProgramFailsCleanly() {
        int exitCode = execute("-s", "ast", "-s", "eval", "sum ".repeat(50000) + "1");

        assertEquals(1, exitCode);
        assertTrue(out.toString().contains("ast:     error: Expression is nested too deeply for the ast stage"));
        assertTrue(out.toString().contains("eval:    skipped"));
    }

    @Test
    public void testUnknownStageIsUsageError() {
        assertEquals(2, execute("-s", "optimize", "sum 1 2"));
    }

    private int execute(String... args) {
        return new CommandLine(new TinyC())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setOut(new PrintWriter(out))
                .setErr(new PrintWriter(err))
                .execute(args);
    }
}
