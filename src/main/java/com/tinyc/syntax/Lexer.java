package com.tinyc.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Splits program text into tokens. Tokens are never classified here; the
 * parser decides whether a token is a number or an operator keyword.
 * Separators are the characters matched by the regex {@code \s}.
 */
public class Lexer {
    public ImmutableList<String> lex(String input) {
        if (input == null) {
            return Lists.immutable.empty();
        }

        MutableList<String> tokens = Lists.mutable.empty();
        for (String piece : input.split("\\s+")) {
            String token = piece.trim();
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens.toImmutable();
    }
}
