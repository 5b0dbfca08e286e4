package org.javai.erroradapter.sink.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.erroradapter.FailureRecord;
import org.javai.erroradapter.diagnostics.DiagnosticContext;
import org.javai.erroradapter.sink.FailureSink;

import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Records suppressed failures through Log4j2.
 *
 * <p>Every entry carries the {@code SUPPRESSED_FAILURE} marker and is logged at the
 * configured level (ERROR unless specified). The message holds the operation, the error
 * description and its fingerprint, followed by the captured stack frames:
 * <pre>
 * Suppressed failure in operation [Config.load]: java.io.IOException: disk error | fingerprint=IOException@com.acme.Config:42, occurredAt=2024-01-20T10:30:00Z
 * 	at com.acme.Config.load(Config.java:42)
 * 	at com.acme.App.main(App.java:9)
 * </pre>
 *
 * <p>When no frames were captured, the throwable itself is attached so that the
 * configured layout prints its stack trace.
 */
public class Log4jFailureSink implements FailureSink {

	public static final String DEFAULT_LOGGER_NAME = "org.javai.erroradapter.FailureSink";
	public static final Marker SUPPRESSED_FAILURE = MarkerManager.getMarker("SUPPRESSED_FAILURE");

	private final Logger logger;
	private final Level level;

	/**
	 * Creates a sink logging at ERROR to the default logger.
	 */
	public Log4jFailureSink() {
		this(LogManager.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a sink logging at ERROR to the named logger.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jFailureSink(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jFailureSink(Logger logger) {
		this(logger, Level.ERROR);
	}

	/**
	 * @param logger the Log4j logger to use
	 * @param level the level every failure is logged at
	 */
	public Log4jFailureSink(Logger logger, Level level) {
		this.logger = Objects.requireNonNull(logger, "logger must not be null");
		this.level = Objects.requireNonNull(level, "level must not be null");
	}

	@Override
	public void record(FailureRecord failure) {
		LogBuilder entry = logger.atLevel(level).withMarker(SUPPRESSED_FAILURE);
		if (failure.context().isEmpty()) {
			entry = entry.withThrowable(failure.error());
		}
		entry.log(formatFailureMessage(failure));
	}

	public Level level() {
		return level;
	}

	static String formatFailureMessage(FailureRecord failure) {
		return """
			Suppressed failure in operation [%s]: %s \
			| fingerprint=%s, occurredAt=%s%s\
			""".formatted(
				failure.operation(),
				failure.description(),
				failure.fingerprint(),
				DateTimeFormatter.ISO_INSTANT.format(failure.occurredAt()),
				formatFrames(failure.context())
			);
	}

	private static String formatFrames(DiagnosticContext context) {
		StringBuilder sb = new StringBuilder();
		for (String frame : context.frames()) {
			sb.append("\n\tat ").append(frame);
		}
		return sb.toString();
	}
}
