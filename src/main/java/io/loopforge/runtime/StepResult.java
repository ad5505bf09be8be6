package io.loopforge.runtime;

import io.loopforge.engine.StepOutcome;
import io.loopforge.executor.ParsedResult;

/**
 * What one pipeline step produced: the outcome fed to the transition engine, an error detail
 * for {@code last_error}, and the agent's parsed {@code RESULT:} value when there was one.
 */
record StepResult(StepOutcome outcome, String detail, ParsedResult parsed) {
    static StepResult success(ParsedResult parsed) {
        return new StepResult(StepOutcome.SUCCESS, null, parsed);
    }

    static StepResult of(StepOutcome outcome, String detail) {
        return new StepResult(outcome, detail, null);
    }

    boolean hasResult() {
        return parsed != null && parsed.value() != null && !parsed.value().isNull();
    }
}
