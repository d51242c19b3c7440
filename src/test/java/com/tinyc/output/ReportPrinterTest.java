package com.tinyc.output;

import com.tinyc.pipeline.Pipeline;
import com.tinyc.pipeline.Stage;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ReportPrinterTest {

    @Test
    public void testAllStagesInPipelineOrder() {
        String report = print("sum 1 2 3", Set.of());
        String[] lines = report.split("\\R");
        assertEquals(4, lines.length);
        assertEquals("tokens:  [\"sum\",\"1\",\"2\",\"3\"]", lines[0]);
        assertTrue(lines[1].startsWith("ast:     {\"type\":\"op\""));
        assertEquals("eval:    6", lines[2]);
        assertEquals("compile: (1 + 2 + 3)", lines[3]);
    }

    @Test
    public void testSelectedStagesOnly() {
        String report = print("mul 2 3 4", EnumSet.of(Stage.COMPILE, Stage.EVAL));
        assertEquals("eval:    24" + System.lineSeparator() + "compile: (2 * 3 * 4)" + System.lineSeparator(), report);
    }

    @Test
    public void testFailedStageShowsError() {
        String report = print("div 4 0", EnumSet.of(Stage.EVAL, Stage.COMPILE));
        assertTrue(report.contains("eval:    error: Division by zero"));
        assertTrue(report.contains("compile: (4 / 0)"));
    }

    @Test
    public void testStagesAfterFailedParseAreSkipped() {
        String report = print("", Set.of());
        assertTrue(report.contains("tokens:  []"));
        assertTrue(report.contains("ast:     error: Parse error at token 0"));
        assertTrue(report.contains("eval:    skipped"));
        assertTrue(report.contains("compile: skipped"));
    }

    private String print(String program, Set<Stage> stages) {
        StringWriter sw = new StringWriter();
        new ReportPrinter(new AstFormatter(false), stages).print(new Pipeline().run(program), new PrintWriter(sw));
        return sw.toString();
    }
}
