package org.javai.backoff.ops;

import org.javai.backoff.retry.Termination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A {@link RetryReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is caught and logged, allowing remaining reporters to execute.
 *
 * <p>Example usage:
 * <pre>{@code
 * RetryReporter reporter = CompositeRetryReporter.of(
 *     new Log4jRetryReporter(),
 *     new MetricsRetryReporter("myapp")
 * );
 *
 * // Or using the builder for more control:
 * RetryReporter reporter = CompositeRetryReporter.builder()
 *     .add(new Log4jRetryReporter())
 *     .addIf(metricsEnabled, new MetricsRetryReporter())
 *     .build();
 * }</pre>
 */
public final class CompositeRetryReporter implements RetryReporter {

	private static final Logger LOG = LoggerFactory.getLogger(CompositeRetryReporter.class);

	private final List<RetryReporter> reporters;

	private CompositeRetryReporter(List<RetryReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeRetryReporter of(RetryReporter... reporters) {
		return new CompositeRetryReporter(Arrays.asList(reporters));
	}

	/**
	 * Creates a composite reporter from a collection of reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeRetryReporter of(Collection<? extends RetryReporter> reporters) {
		return new CompositeRetryReporter(new ArrayList<>(reporters));
	}

	/**
	 * Creates a builder for constructing a composite reporter.
	 *
	 * @return a new builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void reportRetryAttempt(String operation, Object error, int attemptNumber, Duration delay) {
		for (RetryReporter reporter : reporters) {
			try {
				reporter.reportRetryAttempt(operation, error, attemptNumber, delay);
			} catch (Exception e) {
				logReporterError("reportRetryAttempt", reporter, e);
			}
		}
	}

	@Override
	public void reportTerminated(String operation, Termination termination, int totalAttempts, Object lastError) {
		for (RetryReporter reporter : reporters) {
			try {
				reporter.reportTerminated(operation, termination, totalAttempts, lastError);
			} catch (Exception e) {
				logReporterError("reportTerminated", reporter, e);
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private static void logReporterError(String method, RetryReporter reporter, Exception e) {
		LOG.warn("RetryReporter.{} failed for {}", method, reporter.getClass().getName(), e);
	}

	/**
	 * Builder for creating a {@link CompositeRetryReporter}.
	 */
	public static final class Builder {
		private final List<RetryReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter to the composite. Null reporters are ignored.
		 *
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder add(RetryReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		/**
		 * Adds multiple reporters to the composite.
		 *
		 * @param reporters the reporters to add
		 * @return this builder
		 */
		public Builder addAll(Collection<? extends RetryReporter> reporters) {
			for (RetryReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Conditionally adds a reporter based on a flag.
		 *
		 * @param condition if true, the reporter is added
		 * @param reporter the reporter to add
		 * @return this builder
		 */
		public Builder addIf(boolean condition, RetryReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Builds the composite reporter.
		 *
		 * @return the composite reporter
		 */
		public CompositeRetryReporter build() {
			return new CompositeRetryReporter(reporters);
		}
	}
}
