package com.hyperdesk.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.function.Supplier;

/**
 * Micrometer instrumentation for command handlers and provisioning.
 * <p>
 * Every meter carries a {@code service} tag. Command outcomes are counted under
 * {@value #COMMANDS} with {@code command} and {@code outcome} tags, where the outcome is
 * {@code success} or the simple name of the error variant.
 */
public final class CommandMetrics {

    public static final String COMMANDS = "hyperdesk.commands";
    public static final String COMMAND_DURATION = "hyperdesk.command.duration";
    public static final String SIDE_EFFECT_FAILURES = "hyperdesk.side_effect.failures";

    public static final String TAG_SERVICE = "service";
    public static final String TAG_COMMAND = "command";
    public static final String TAG_OUTCOME = "outcome";
    public static final String OUTCOME_SUCCESS = "success";

    private final MeterRegistry registry;
    private final String serviceName;

    public CommandMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /** Counts one command outcome. */
    public void recordOutcome(String command, String outcome) {
        Counter.builder(COMMANDS)
                .description("Command handler outcomes")
                .tags(tags(TAG_COMMAND, command, TAG_OUTCOME, outcome))
                .register(registry)
                .increment();
    }

    /**
     * Counts a best-effort side effect (projection, timeline, notification) that failed after a
     * successful append.
     */
    public void recordSideEffectFailure(String command, String sideEffect) {
        Counter.builder(SIDE_EFFECT_FAILURES)
                .description("Best-effort side effects that failed after a committed command")
                .tags(tags(TAG_COMMAND, command, "side_effect", sideEffect))
                .register(registry)
                .increment();
    }

    /** Times {@code work} under {@value #COMMAND_DURATION} tagged with the command name. */
    public <T> T time(String command, Supplier<T> work) {
        Timer timer = Timer.builder(COMMAND_DURATION)
                .description("Command handler latency")
                .tags(tags(TAG_COMMAND, command))
                .register(registry);
        return timer.record(work);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags tags(String... extra) {
        return Tags.of(TAG_SERVICE, serviceName).and(extra);
    }
}
