package com.tinyc.syntax;

import org.eclipse.collections.api.list.ImmutableList;

import java.util.Optional;

/**
 * Read position over a token list, shared by all rules of one parse.
 * Only ever moves forward.
 */
final class TokenCursor {
    private final ImmutableList<String> tokens;
    private int position;

    TokenCursor(ImmutableList<String> tokens) {
        this.tokens = tokens;
    }

    Optional<String> peek() {
        return hasNext() ? Optional.of(tokens.get(position)) : Optional.empty();
    }

    String consume() {
        if (!hasNext()) {
            throw ParseException.unexpectedEnd(position);
        }
        return tokens.get(position++);
    }

    boolean hasNext() {
        return position < tokens.size();
    }
}
