package com.tinyc.output;

import com.tinyc.TinyCException;
import com.tinyc.pipeline.PipelineResult;
import com.tinyc.pipeline.Stage;
import com.tinyc.pipeline.StageOutcome;

import java.io.PrintWriter;
import java.math.BigDecimal;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Function;

/**
 * Prints the selected stages of a {@link PipelineResult}, one labelled line
 * per stage (the pretty-printed tree may span several lines). Failed stages
 * print their error, stages that never ran print "skipped".
 */
public class ReportPrinter {
    private final AstFormatter formatter;
    private final Set<Stage> stages;

    public ReportPrinter(AstFormatter formatter, Set<Stage> stages) {
        this.formatter = formatter;
        this.stages = stages.isEmpty() ? EnumSet.allOf(Stage.class) : EnumSet.copyOf(stages);
    }

    public void print(PipelineResult result, PrintWriter out) {
        for (Stage stage : stages) {
            out.println(label(stage) + render(stage, result));
        }
        out.flush();
    }

    private String render(Stage stage, PipelineResult result) {
        return switch (stage) {
            case TOKENS -> formatter.formatTokens(result.tokens());
            case AST -> render(result.ast(), formatter::format);
            case EVAL -> render(result.value(), BigDecimal::toPlainString);
            case COMPILE -> render(result.code(), Function.identity());
        };
    }

    private static <T> String render(StageOutcome<T> outcome, Function<T, String> onSuccess) {
        if (outcome instanceof StageOutcome.Success<T> success) {
            try {
                return onSuccess.apply(success.value());
            } catch (TinyCException e) {
                return "error: " + e.getMessage();
            }
        }
        if (outcome instanceof StageOutcome.Failure<T> failure) {
            return "error: " + failure.error().getMessage();
        }
        return "skipped";
    }

    private static String label(Stage stage) {
        String prefix = stage.label() + ":";
        return prefix + " ".repeat(Math.max(1, 9 - prefix.length()));
    }
}
