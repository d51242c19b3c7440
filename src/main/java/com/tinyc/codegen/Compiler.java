package com.tinyc.codegen;

import com.tinyc.syntax.Expression;
import com.tinyc.syntax.Operator;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * Translates the tree into fully parenthesized infix source. Never evaluates,
 * so programs that fail at run time (division by zero) still compile.
 */
public class Compiler {
    public String compile(Expression expression) {
        if (expression instanceof Expression.Number number) {
            return number.value().toString();
        }

        Expression.Operation operation = (Expression.Operation) expression;
        ImmutableList<String> operands = operation.operands().collect(this::compile);
        Operator operator = operation.operator()
                .orElseThrow(() -> CompilationException.unknownOperator(operation.keyword()));

        // one operand gives "(5)", none gives "()"
        return operands.makeString("(", " " + operator.symbol() + " ", ")");
    }
}
