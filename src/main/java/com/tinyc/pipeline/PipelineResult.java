package com.tinyc.pipeline;

import com.tinyc.syntax.Expression;
import org.eclipse.collections.api.list.ImmutableList;

import java.math.BigDecimal;

/**
 * Everything one run of the pipeline produced for a single program. Tokens
 * are always available since lexing cannot fail.
 */
public record PipelineResult(
        String source,
        ImmutableList<String> tokens,
        StageOutcome<Expression> ast,
        StageOutcome<BigDecimal> value,
        StageOutcome<String> code) {

    public boolean succeeded() {
        return ast.isSuccess() && value.isSuccess() && code.isSuccess();
    }
}
