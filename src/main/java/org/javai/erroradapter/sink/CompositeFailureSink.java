package org.javai.erroradapter.sink;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.erroradapter.FailureRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A {@link FailureSink} that delegates to multiple sinks, in order.
 *
 * <p>If a sink throws, the problem is logged at WARN and the remaining sinks still run.
 *
 * <pre>{@code
 * FailureSink sink = CompositeFailureSink.builder()
 *     .add(new Log4jFailureSink())
 *     .addIf(metricsEnabled, new MetricsFailureSink("checkout"))
 *     .build();
 * }</pre>
 */
public final class CompositeFailureSink implements FailureSink {

	private static final Logger LOG = LogManager.getLogger(CompositeFailureSink.class);

	private final List<FailureSink> sinks;

	private CompositeFailureSink(List<FailureSink> sinks) {
		this.sinks = List.copyOf(sinks);
	}

	public static CompositeFailureSink of(FailureSink... sinks) {
		return new CompositeFailureSink(Arrays.asList(sinks));
	}

	public static CompositeFailureSink of(Collection<? extends FailureSink> sinks) {
		return new CompositeFailureSink(new ArrayList<>(sinks));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void record(FailureRecord failure) {
		for (FailureSink sink : sinks) {
			try {
				sink.record(failure);
			} catch (RuntimeException e) {
				LOG.warn("FailureSink {} failed to record failure of operation [{}]",
						sink.getClass().getName(), failure.operation(), e);
			}
		}
	}

	/**
	 * Returns the number of sinks in this composite.
	 */
	public int size() {
		return sinks.size();
	}

	/**
	 * Builder for creating a {@link CompositeFailureSink}. Null sinks are ignored.
	 */
	public static final class Builder {
		private final List<FailureSink> sinks = new ArrayList<>();

		private Builder() {}

		public Builder add(FailureSink sink) {
			if (sink != null) {
				sinks.add(sink);
			}
			return this;
		}

		public Builder addAll(Collection<? extends FailureSink> sinks) {
			for (FailureSink sink : sinks) {
				add(sink);
			}
			return this;
		}

		/**
		 * Adds the sink only when {@code condition} holds.
		 */
		public Builder addIf(boolean condition, FailureSink sink) {
			if (condition) {
				add(sink);
			}
			return this;
		}

		public CompositeFailureSink build() {
			return new CompositeFailureSink(sinks);
		}
	}
}
