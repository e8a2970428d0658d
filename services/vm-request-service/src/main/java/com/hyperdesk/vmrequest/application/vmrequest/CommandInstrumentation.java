package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.eventstore.Result;
import com.hyperdesk.observability.CommandMetrics;
import com.hyperdesk.observability.CorrelationContext;
import com.hyperdesk.observability.CorrelationContextHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Runs a command body inside its correlation context, with timing and outcome metrics, and
 * executes best-effort side effects.
 */
public class CommandInstrumentation {

    private static final Logger log = LoggerFactory.getLogger(CommandInstrumentation.class);

    private final CommandMetrics metrics;

    public CommandInstrumentation(CommandMetrics metrics) {
        this.metrics = metrics;
    }

    public <T, E> Result<T, E> run(String command, CorrelationContext context, Supplier<Result<T, E>> body) {
        return CorrelationContextHolder.callWithContext(context, () -> metrics.time(command, () -> {
            Result<T, E> result = body.get();
            metrics.recordOutcome(command, result.isSuccess()
                    ? CommandMetrics.OUTCOME_SUCCESS
                    : result.error().getClass().getSimpleName());
            return result;
        }));
    }

    /**
     * Runs a side effect that must not affect the command result. A failure value or an unchecked
     * exception is logged and counted.
     */
    public void bestEffort(String command, String sideEffect, Supplier<? extends Result<?, ?>> action) {
        try {
            Result<?, ?> result = action.get();
            if (result.isFailure()) {
                log.warn("{} side effect '{}' failed: {}", command, sideEffect, result.error());
                metrics.recordSideEffectFailure(command, sideEffect);
            }
        } catch (RuntimeException e) {
            log.warn("{} side effect '{}' threw", command, sideEffect, e);
            metrics.recordSideEffectFailure(command, sideEffect);
        }
    }

    /** Variant for side effects without a result value. */
    public void bestEffortRun(String command, String sideEffect, Runnable action) {
        bestEffort(command, sideEffect, () -> {
            action.run();
            return Result.success();
        });
    }
}
