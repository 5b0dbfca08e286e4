package org.javai.erroradapter;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.erroradapter.config.ErrorAdapterSettings;
import org.javai.erroradapter.diagnostics.DiagnosticContext;
import org.javai.erroradapter.diagnostics.DiagnosticContextProvider;
import org.javai.erroradapter.sink.ConsoleFailureSink;
import org.javai.erroradapter.sink.FailureSink;
import org.javai.erroradapter.sink.log4j.Log4jFailureSink;

/**
 * Adapts fallible operations to optional results, logging every failure it suppresses.
 *
 * <p>The operation runs exactly once, synchronously, on the calling thread. If it returns,
 * its value comes back as an {@link Optional} (empty when the value is {@code null}). If it
 * throws, the exception is recorded to the configured {@link FailureSink} exactly once and
 * an empty {@code Optional} is returned. Nothing is retried, classified or rethrown.</p>
 *
 * <p>An empty result therefore means either "the operation produced no value" or "the
 * operation failed". Callers that need to tell the two apart should not use this adapter
 * for that call.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ErrorAdapter errors = ErrorAdapter.create();
 *
 * Optional<String> content = errors.wrap("Config.load",
 *     () -> Files.readString(Path.of("app.conf")));
 * }</pre>
 *
 * <p>{@link Error}s such as {@link OutOfMemoryError} are not operation failures and
 * propagate unchanged.</p>
 */
public final class ErrorAdapter {

    static final String UNNAMED_OPERATION = "unnamed";

    private static final Logger LOG = LogManager.getLogger(ErrorAdapter.class);

    private final FailureSink sink;
    private final DiagnosticContextProvider diagnostics;
    private final Clock clock;

    /**
     * Creates an adapter that logs through Log4j2 with the caller's call stack.
     * This is the recommended factory for production use.
     */
    public static ErrorAdapter create() {
        return new ErrorAdapter(new Log4jFailureSink(), DiagnosticContextProvider.callStack());
    }

    /**
     * Creates an adapter that prints failures and the caller's call stack to standard output.
     */
    public static ErrorAdapter console() {
        return new ErrorAdapter(new ConsoleFailureSink(), DiagnosticContextProvider.callStack());
    }

    /**
     * Creates an adapter that suppresses failures without recording them anywhere.
     * Useful for testing or prototyping.
     */
    public static ErrorAdapter silent() {
        return new ErrorAdapter(FailureSink.noOp(), DiagnosticContextProvider.none());
    }

    /**
     * Creates an adapter with call-stack diagnostics and the given sink.
     *
     * @param sink the sink that receives suppressed failures
     */
    public static ErrorAdapter withSink(FailureSink sink) {
        return new ErrorAdapter(sink, DiagnosticContextProvider.callStack());
    }

    /**
     * Creates an adapter with full control over sink and diagnostics.
     */
    public static ErrorAdapter of(FailureSink sink, DiagnosticContextProvider diagnostics) {
        return new ErrorAdapter(sink, diagnostics);
    }

    public static ErrorAdapter fromSettings(ErrorAdapterSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        return new ErrorAdapter(settings.createSink(), settings.createDiagnostics());
    }

    /**
     * Creates an adapter configured from system properties and environment variables.
     *
     * @see ErrorAdapterSettings#fromEnvironment()
     */
    public static ErrorAdapter fromEnvironment() {
        return fromSettings(ErrorAdapterSettings.fromEnvironment());
    }

    public ErrorAdapter(FailureSink sink, DiagnosticContextProvider diagnostics) {
        this(sink, diagnostics, Clock.systemUTC());
    }

    ErrorAdapter(FailureSink sink, DiagnosticContextProvider diagnostics, Clock clock) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Runs an unnamed operation.
     *
     * @see #wrap(String, Operation)
     */
    public <T> Optional<T> wrap(Operation<? extends T> operation) {
        return wrap(UNNAMED_OPERATION, operation);
    }

    /**
     * Runs the operation once and returns its value, or an empty result if it threw.
     *
     * @param name The operation name used when the failure is recorded
     * @param operation The work to execute
     * @return the value the operation returned, or empty if it returned null or failed
     */
    public <T> Optional<T> wrap(String name, Operation<? extends T> operation) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(operation, "operation must not be null");

        T result;
        try {
            result = operation.run();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            recordFailure(name, e);
            return Optional.empty();
        }
        return Optional.ofNullable(result);
    }

    /**
     * Runs an unnamed operation that already produces an {@link Optional}.
     *
     * @see #wrapOptional(String, Operation)
     */
    public <T> Optional<T> wrapOptional(Operation<Optional<T>> operation) {
        return wrapOptional(UNNAMED_OPERATION, operation);
    }

    /**
     * Runs an operation that already produces an {@link Optional}, flattening the result.
     * A {@code null} Optional is treated as empty.
     */
    public <T> Optional<T> wrapOptional(String name, Operation<Optional<T>> operation) {
        Optional<Optional<T>> result = wrap(name, operation);
        return result.flatMap(Function.identity());
    }

    private void recordFailure(String name, Exception failure) {
        FailureRecord record = FailureRecord.of(name, failure, captureContext(name, failure), clock.instant());
        try {
            sink.record(record);
        } catch (RuntimeException sinkFailure) {
            LOG.warn("FailureSink {} could not record failure of operation [{}]: {}",
                    sink.getClass().getName(), name, record.description(), sinkFailure);
        }
    }

    private DiagnosticContext captureContext(String name, Exception failure) {
        try {
            return diagnostics.capture(failure);
        } catch (RuntimeException e) {
            LOG.debug("Diagnostic capture failed for operation [{}]", name, e);
            return DiagnosticContext.empty();
        }
    }
}
