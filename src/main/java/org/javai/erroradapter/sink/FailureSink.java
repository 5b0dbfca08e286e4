package org.javai.erroradapter.sink;

import org.javai.erroradapter.FailureRecord;

/**
 * Receives failures suppressed by an {@link org.javai.erroradapter.ErrorAdapter}.
 * Implementations might write structured logs, emit metrics, or forward to a
 * crash-analytics service.
 */
@FunctionalInterface
public interface FailureSink {

    /**
     * Records one suppressed failure.
     */
    void record(FailureRecord failure);

    /**
     * A sink that does nothing. Useful for testing.
     */
    static FailureSink noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite sink that fans out to all given sinks.
     *
     * @param sinks the sinks to delegate to
     * @return a composite sink
     */
    static FailureSink composite(FailureSink... sinks) {
        return CompositeFailureSink.of(sinks);
    }
}
