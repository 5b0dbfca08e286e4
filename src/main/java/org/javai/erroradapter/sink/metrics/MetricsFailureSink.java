package org.javai.erroradapter.sink.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.erroradapter.FailureRecord;
import org.javai.erroradapter.sink.FailureSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeFormatter;

/**
 * Records suppressed failures as JSON-lines metrics via SLF4J.
 *
 * <p>One INFO line per failure, suitable for a metrics or crash-analytics pipeline that
 * tails the log. The tracking key is the operation name, prefixed by the configured
 * namespace when there is one.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"suppressed_failure","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.Config.load",...}
 * }</pre>
 */
public class MetricsFailureSink implements FailureSink {

	public static final String DEFAULT_LOGGER_NAME = "org.javai.erroradapter.Metrics";
	static final String EVENT_TYPE = "suppressed_failure";

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String namespace;
	private final Logger logger;

	/**
	 * Creates a MetricsFailureSink with no namespace and the default logger.
	 */
	public MetricsFailureSink() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsFailureSink(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsFailureSink(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName));
	}

	MetricsFailureSink(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void record(FailureRecord failure) {
		try {
			logger.info(MAPPER.writeValueAsString(toJson(failure)));
		} catch (JsonProcessingException e) {
			logger.warn("Could not serialize failure of operation [{}]", failure.operation(), e);
		}
	}

	ObjectNode toJson(FailureRecord failure) {
		ObjectNode node = MAPPER.createObjectNode();
		node.put("eventType", EVENT_TYPE);
		node.put("timestamp", DateTimeFormatter.ISO_INSTANT.format(failure.occurredAt()));
		node.put("trackingKey", buildTrackingKey(failure));
		node.put("operation", failure.operation());
		node.put("errorType", failure.errorType());
		if (failure.message() != null) {
			node.put("message", failure.message());
		}
		node.put("description", failure.description());
		node.put("fingerprint", failure.fingerprint());
		node.put("stackDepth", failure.context().depth());
		return node;
	}

	String buildTrackingKey(FailureRecord failure) {
		if (namespace == null) {
			return failure.operation();
		}
		return namespace + "." + failure.operation();
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
