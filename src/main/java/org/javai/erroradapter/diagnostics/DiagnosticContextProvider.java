package org.javai.erroradapter.diagnostics;

/**
 * Captures a {@link DiagnosticContext} for a failure.
 * Implementations are called on the thread that ran the failed operation, from inside
 * the adapter's catch block.
 */
@FunctionalInterface
public interface DiagnosticContextProvider {

    int DEFAULT_MAX_DEPTH = 64;

    /**
     * Captures diagnostics for the given failure.
     *
     * @param failure The throwable raised by the operation
     * @return the captured context, never null
     */
    DiagnosticContext capture(Throwable failure);

    /**
     * The caller's call stack at the time of failure.
     */
    static DiagnosticContextProvider callStack() {
        return new CallStackContextProvider(DEFAULT_MAX_DEPTH);
    }

    static DiagnosticContextProvider callStack(int maxDepth) {
        return new CallStackContextProvider(maxDepth);
    }

    /**
     * The failure's own stack trace, including its cause chain.
     */
    static DiagnosticContextProvider failureStack() {
        return new FailureStackContextProvider(DEFAULT_MAX_DEPTH);
    }

    static DiagnosticContextProvider failureStack(int maxDepth) {
        return new FailureStackContextProvider(maxDepth);
    }

    /**
     * A provider that captures nothing.
     */
    static DiagnosticContextProvider none() {
        return failure -> DiagnosticContext.empty();
    }
}
