package com.tinyc.eval;

import com.tinyc.syntax.Expression;
import com.tinyc.syntax.Operator;
import org.eclipse.collections.api.list.ImmutableList;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Tree-walking interpreter. Operands are evaluated left to right before the
 * node's operator is resolved, then folded: {@code sum} and {@code mul} start
 * from their identity, {@code sub} and {@code div} start from the first operand.
 */
public class Evaluator {
    // Non-terminating quotients such as 1/3 are rounded to 34 significant digits.
    private static final MathContext DIVISION = MathContext.DECIMAL128;

    public BigDecimal evaluate(Expression expression) {
        return normalize(evaluateNode(expression));
    }

    private BigDecimal evaluateNode(Expression expression) {
        if (expression instanceof Expression.Number number) {
            return new BigDecimal(number.value());
        }

        Expression.Operation operation = (Expression.Operation) expression;
        ImmutableList<BigDecimal> values = operation.operands().collect(this::evaluateNode);
        Operator operator = operation.operator()
                .orElseThrow(() -> EvaluationException.unknownOperator(operation.keyword()));

        return switch (operator) {
            case SUM -> values.injectInto(BigDecimal.ZERO, BigDecimal::add);
            case MUL -> values.injectInto(BigDecimal.ONE, BigDecimal::multiply);
            case SUB -> {
                requireOperands(operation, values);
                BigDecimal result = values.getFirst();
                for (int i = 1; i < values.size(); i++) {
                    result = result.subtract(values.get(i));
                }
                yield result;
            }
            case DIV -> {
                requireOperands(operation, values);
                BigDecimal result = values.getFirst();
                for (int i = 1; i < values.size(); i++) {
                    BigDecimal divisor = values.get(i);
                    if (divisor.signum() == 0) {
                        throw EvaluationException.divisionByZero(i);
                    }
                    result = result.divide(divisor, DIVISION);
                }
                yield result;
            }
        };
    }

    private static void requireOperands(Expression.Operation operation, ImmutableList<BigDecimal> values) {
        if (values.isEmpty()) {
            throw EvaluationException.invalidArity(operation.keyword());
        }
    }

    private static BigDecimal normalize(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        // keep integral results free of exponent notation, e.g. 1E+2 -> 100
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }
}
