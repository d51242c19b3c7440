package com.tinyc.pipeline;

import com.tinyc.NestingTooDeepException;
import com.tinyc.TinyCException;
import com.tinyc.codegen.Compiler;
import com.tinyc.eval.Evaluator;
import com.tinyc.syntax.Expression;
import com.tinyc.syntax.Lexer;
import com.tinyc.syntax.Parser;
import org.eclipse.collections.api.list.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.function.Function;

/**
 * Runs lex, parse, evaluate and compile over one program. A failing stage is
 * recorded rather than rethrown; evaluation and compilation each run whenever
 * parsing succeeded, independently of one another. A program nested too
 * deeply to walk is recorded as a {@link NestingTooDeepException}.
 */
public class Pipeline {
    private static final Logger logger = LoggerFactory.getLogger(Pipeline.class);

    private final Lexer lexer;
    private final Parser parser;
    private final Evaluator evaluator;
    private final Compiler compiler;

    public Pipeline() {
        this(new Lexer(), new Parser(), new Evaluator(), new Compiler());
    }

    public Pipeline(Lexer lexer, Parser parser, Evaluator evaluator, Compiler compiler) {
        this.lexer = lexer;
        this.parser = parser;
        this.evaluator = evaluator;
        this.compiler = compiler;
    }

    public PipelineResult run(String source) {
        ImmutableList<String> tokens = lexer.lex(source);
        logger.debug("Lexed {} token(s) from '{}'", tokens.size(), source);

        StageOutcome<Expression> ast = attempt(Stage.AST, parser::parse, tokens);
        StageOutcome<BigDecimal> value = after(ast, Stage.EVAL, evaluator::evaluate);
        StageOutcome<String> code = after(ast, Stage.COMPILE, compiler::compile);

        return new PipelineResult(source, tokens, ast, value, code);
    }

    private <I, O> StageOutcome<O> after(StageOutcome<I> previous, Stage stage, Function<I, O> step) {
        if (previous instanceof StageOutcome.Success<I> success) {
            return attempt(stage, step, success.value());
        }
        logger.debug("Skipping {} stage", stage.label());
        return new StageOutcome.Skipped<>();
    }

    private static <I, O> StageOutcome<O> attempt(Stage stage, Function<I, O> step, I input) {
        try {
            O output = step.apply(input);
            logger.debug("{} stage succeeded", stage.label());
            return new StageOutcome.Success<>(output);
        } catch (TinyCException e) {
            logger.debug("{} stage failed ({}): {}", stage.label(), e.reason(), e.getMessage());
            return new StageOutcome.Failure<>(e);
        } catch (StackOverflowError e) {
            // parser, evaluator and compiler recurse once per nesting level
            logger.debug("{} stage ran out of stack", stage.label());
            return new StageOutcome.Failure<>(new NestingTooDeepException(stage.label()));
        }
    }
}
