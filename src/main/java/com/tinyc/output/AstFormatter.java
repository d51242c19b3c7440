package com.tinyc.output;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.core.JsonGenerator;
import com.tinyc.NestingTooDeepException;
import com.tinyc.syntax.Expression;
import org.eclipse.collections.api.list.ImmutableList;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;

/**
 * Debug representation of tokens and trees as JSON. Numbers are written as
 * {@code {"type":"num","value":2}}, operations as
 * {@code {"type":"op","operator":"sum","operands":[...]}}.
 */
public class AstFormatter {
    // nesting is bounded by the parser, not by Jackson's default write limit
    private final JsonFactory factory = JsonFactory.builder()
            .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(Integer.MAX_VALUE).build())
            .build();
    private final boolean prettyPrint;

    public AstFormatter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String format(Expression expression) {
        try {
            return write(generator -> writeExpression(expression, generator), prettyPrint);
        } catch (StackOverflowError e) {
            throw new NestingTooDeepException("ast");
        }
    }

    /** Tokens always go on a single line. */
    public String formatTokens(ImmutableList<String> tokens) {
        return write(generator -> {
            generator.writeStartArray();
            for (String token : tokens) {
                generator.writeString(token);
            }
            generator.writeEndArray();
        }, false);
    }

    private void writeExpression(Expression expression, JsonGenerator generator) throws IOException {
        generator.writeStartObject();
        if (expression instanceof Expression.Number number) {
            generator.writeStringField("type", "num");
            generator.writeFieldName("value");
            generator.writeNumber(number.value());
        } else {
            Expression.Operation operation = (Expression.Operation) expression;
            generator.writeStringField("type", "op");
            generator.writeStringField("operator", operation.keyword());
            generator.writeArrayFieldStart("operands");
            for (Expression operand : operation.operands()) {
                writeExpression(operand, generator);
            }
            generator.writeEndArray();
        }
        generator.writeEndObject();
    }

    private String write(JsonWriter body, boolean pretty) {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = factory.createGenerator(out)) {
            if (pretty) {
                generator.useDefaultPrettyPrinter();
            }
            body.write(generator);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON", e);
        }
        return out.toString();
    }

    @FunctionalInterface
    private interface JsonWriter {
        void write(JsonGenerator generator) throws IOException;
    }
}
