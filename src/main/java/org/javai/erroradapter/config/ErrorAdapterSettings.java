package org.javai.erroradapter.config;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import org.javai.erroradapter.diagnostics.DiagnosticContextProvider;
import org.javai.erroradapter.sink.ConsoleFailureSink;
import org.javai.erroradapter.sink.FailureSink;
import org.javai.erroradapter.sink.log4j.Log4jFailureSink;
import org.javai.erroradapter.sink.metrics.MetricsFailureSink;

/**
 * Configuration for an {@link org.javai.erroradapter.ErrorAdapter}.
 *
 * <p>Each value is resolved from a system property, then an environment variable,
 * then a default:
 * <ul>
 *   <li>{@code erroradapter.sink} / {@code ERRORADAPTER_SINK} - {@code log4j} (default),
 *       {@code metrics}, {@code console} or {@code none}</li>
 *   <li>{@code erroradapter.diagnostics} / {@code ERRORADAPTER_DIAGNOSTICS} -
 *       {@code call-stack} (default), {@code failure-stack} or {@code none}</li>
 *   <li>{@code erroradapter.stack.depth} / {@code ERRORADAPTER_STACK_DEPTH} - maximum
 *       number of frames captured, default 64</li>
 *   <li>{@code erroradapter.logger} / {@code ERRORADAPTER_LOGGER} - logger name for the
 *       log4j and metrics sinks</li>
 *   <li>{@code erroradapter.metrics.namespace} / {@code ERRORADAPTER_METRICS_NAMESPACE} -
 *       tracking key prefix for the metrics sink</li>
 * </ul>
 *
 * @param sink The kind of sink to build
 * @param diagnostics The kind of diagnostic context to capture
 * @param stackDepth Maximum number of frames captured
 * @param loggerName Logger name override (may be null)
 * @param metricsNamespace Tracking key prefix for the metrics sink (may be null)
 */
public record ErrorAdapterSettings(
        SinkType sink,
        DiagnosticsMode diagnostics,
        int stackDepth,
        String loggerName,
        String metricsNamespace
) {

    public static final String SINK_PROPERTY = "erroradapter.sink";
    public static final String DIAGNOSTICS_PROPERTY = "erroradapter.diagnostics";
    public static final String STACK_DEPTH_PROPERTY = "erroradapter.stack.depth";
    public static final String LOGGER_PROPERTY = "erroradapter.logger";
    public static final String METRICS_NAMESPACE_PROPERTY = "erroradapter.metrics.namespace";

    public enum SinkType {
        LOG4J, METRICS, CONSOLE, NONE
    }

    public enum DiagnosticsMode {
        CALL_STACK, FAILURE_STACK, NONE
    }

    public ErrorAdapterSettings {
        Objects.requireNonNull(sink, "sink must not be null");
        Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        if (stackDepth <= 0) {
            throw new IllegalArgumentException("stackDepth must be positive, was " + stackDepth);
        }
        loggerName = blankToNull(loggerName);
        metricsNamespace = blankToNull(metricsNamespace);
    }

    /**
     * Log4j sink, call-stack diagnostics, default depth.
     */
    public static ErrorAdapterSettings defaults() {
        return new ErrorAdapterSettings(SinkType.LOG4J, DiagnosticsMode.CALL_STACK,
                DiagnosticContextProvider.DEFAULT_MAX_DEPTH, null, null);
    }

    /**
     * Resolves settings from system properties and environment variables.
     */
    public static ErrorAdapterSettings fromEnvironment() {
        return resolve(System::getProperty, System::getenv);
    }

    /**
     * Resolves settings from the given lookups. A property value wins over the
     * environment variable of the same setting.
     *
     * @param properties looks up system-property style keys
     * @param environment looks up environment-variable style keys
     * @throws IllegalArgumentException if a value is present but invalid
     */
    public static ErrorAdapterSettings resolve(Function<String, String> properties, Function<String, String> environment) {
        Objects.requireNonNull(properties, "properties must not be null");
        Objects.requireNonNull(environment, "environment must not be null");

        String sink = lookup(properties, environment, SINK_PROPERTY);
        String diagnostics = lookup(properties, environment, DIAGNOSTICS_PROPERTY);
        String depth = lookup(properties, environment, STACK_DEPTH_PROPERTY);

        return new ErrorAdapterSettings(
                sink == null ? SinkType.LOG4J : parseEnum(SinkType.class, SINK_PROPERTY, sink),
                diagnostics == null ? DiagnosticsMode.CALL_STACK : parseEnum(DiagnosticsMode.class, DIAGNOSTICS_PROPERTY, diagnostics),
                depth == null ? DiagnosticContextProvider.DEFAULT_MAX_DEPTH : parseDepth(depth),
                lookup(properties, environment, LOGGER_PROPERTY),
                lookup(properties, environment, METRICS_NAMESPACE_PROPERTY)
        );
    }

    /**
     * Builds the sink these settings describe.
     */
    public FailureSink createSink() {
        return switch (sink) {
            case LOG4J -> loggerName == null ? new Log4jFailureSink() : new Log4jFailureSink(loggerName);
            case METRICS -> new MetricsFailureSink(metricsNamespace,
                    loggerName == null ? MetricsFailureSink.DEFAULT_LOGGER_NAME : loggerName);
            case CONSOLE -> new ConsoleFailureSink();
            case NONE -> FailureSink.noOp();
        };
    }

    /**
     * Builds the diagnostic context provider these settings describe.
     */
    public DiagnosticContextProvider createDiagnostics() {
        return switch (diagnostics) {
            case CALL_STACK -> DiagnosticContextProvider.callStack(stackDepth);
            case FAILURE_STACK -> DiagnosticContextProvider.failureStack(stackDepth);
            case NONE -> DiagnosticContextProvider.none();
        };
    }

    /**
     * The environment variable consulted for a property: upper case, dots as underscores.
     */
    static String environmentVariableFor(String property) {
        return property.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    private static String lookup(Function<String, String> properties, Function<String, String> environment, String property) {
        String value = blankToNull(properties.apply(property));
        if (value == null) {
            value = blankToNull(environment.apply(environmentVariableFor(property)));
        }
        return value;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String property, String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value '" + value + "' for " + property, e);
        }
    }

    private static int parseDepth(String value) {
        try {
            int depth = Integer.parseInt(value.trim());
            if (depth <= 0) {
                throw new IllegalArgumentException(
                        "Invalid value '" + value + "' for " + STACK_DEPTH_PROPERTY + ": must be positive");
            }
            return depth;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value '" + value + "' for " + STACK_DEPTH_PROPERTY, e);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
