package com.tinyc.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for the prefix grammar:
 * <pre>
 * expression := number | operation
 * number     := [0-9]+
 * operation  := keyword expression+
 * </pre>
 * An operation takes every expression that follows it, so operand count is
 * decided by the remaining input. Tokens left over once the root expression
 * is complete are ignored.
 */
public class Parser {
    private static final Pattern NUMBER = Pattern.compile("[0-9]+");

    public Expression parse(ImmutableList<String> tokens) {
        return parseExpression(new TokenCursor(tokens));
    }

    private Expression parseExpression(TokenCursor cursor) {
        boolean number = cursor.peek()
                .map(token -> NUMBER.matcher(token).matches())
                .orElse(false);
        return number ? parseNumber(cursor) : parseOperation(cursor);
    }

    private Expression.Number parseNumber(TokenCursor cursor) {
        return new Expression.Number(new BigInteger(cursor.consume()));
    }

    private Expression.Operation parseOperation(TokenCursor cursor) {
        String keyword = cursor.consume();
        MutableList<Expression> operands = Lists.mutable.empty();
        while (cursor.hasNext()) {
            operands.add(parseExpression(cursor));
        }
        return new Expression.Operation(keyword, operands.toImmutable());
    }
}
