package com.tinyc.syntax;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

public sealed interface Expression {
    record Number(BigInteger value) implements Expression {
        public Number {
            Objects.requireNonNull(value, "value");
        }

        public static Number of(long value) {
            return new Number(BigInteger.valueOf(value));
        }
    }

    /**
     * An operator applied to its operands. The keyword is kept exactly as it
     * appeared in the source, so an unrecognized keyword survives parsing and
     * is only rejected by the stages that need its meaning.
     */
    record Operation(String keyword, ImmutableList<Expression> operands) implements Expression {
        public Operation {
            Objects.requireNonNull(keyword, "keyword");
            Objects.requireNonNull(operands, "operands");
        }

        public static Operation of(Operator operator, Expression... operands) {
            return new Operation(operator.keyword(), Lists.immutable.of(operands));
        }

        public Optional<Operator> operator() {
            return Operator.fromKeyword(keyword);
        }
    }
}
