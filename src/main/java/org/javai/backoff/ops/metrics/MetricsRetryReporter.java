package org.javai.backoff.ops.metrics;

import org.javai.backoff.ops.RetryReporter;
import org.javai.backoff.ops.RetryReporterUtils;
import org.javai.backoff.retry.Termination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;

/**
 * Reports retry events as JSON-lines metrics via SLF4J.
 *
 * <p>Outputs one JSON object per event, suitable for metrics aggregation and analysis
 * pipelines. The tracking key is the operation name, prefixed with a configurable namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"myapp.user.fetch","attemptNumber":"1","delayMs":"100",...}
 * {"eventType":"retry_terminated","timestamp":"2024-01-20T10:30:01Z","trackingKey":"myapp.user.fetch","termination":"EXHAUSTED","totalAttempts":"4",...}
 * }</pre>
 *
 * <p>Constructor options:</p>
 * <ul>
 *   <li>{@link #MetricsRetryReporter()} - no namespace, default logger</li>
 *   <li>{@link #MetricsRetryReporter(String)} - with namespace, default logger</li>
 *   <li>{@link #MetricsRetryReporter(String, String)} - with namespace and custom logger name</li>
 *   <li>{@link #fromEnvironment()} - namespace from {@value #NAMESPACE_PROPERTY} or {@value #NAMESPACE_ENV}</li>
 * </ul>
 */
public class MetricsRetryReporter implements RetryReporter {

	public static final String NAMESPACE_PROPERTY = "backoff.metrics.namespace";
	public static final String NAMESPACE_ENV = "BACKOFF_METRICS_NAMESPACE";

	private static final String DEFAULT_LOGGER_NAME = "org.javai.backoff.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final Logger LOG = LoggerFactory.getLogger(MetricsRetryReporter.class);

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a MetricsRetryReporter with no namespace and the default logger.
	 */
	public MetricsRetryReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsRetryReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsRetryReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsRetryReporter with the specified namespace and custom logger name.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsRetryReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Creates a MetricsRetryReporter with explicit configuration.
	 * Package-private for testing.
	 */
	MetricsRetryReporter(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	/**
	 * Creates a reporter whose namespace is read from the {@value #NAMESPACE_PROPERTY} system
	 * property or the {@value #NAMESPACE_ENV} environment variable. Neither being set means no namespace.
	 */
	public static MetricsRetryReporter fromEnvironment() {
		return new MetricsRetryReporter(RetryReporterUtils.resolveOptionalConfig(NAMESPACE_PROPERTY, NAMESPACE_ENV));
	}

	@Override
	public void reportRetryAttempt(String operation, Object error, int attemptNumber, Duration delay) {
		try {
			logger.info(buildRetryAttemptJson(operation, error, attemptNumber, delay));
		} catch (Exception e) {
			// Reporting should not break the retry loop
			LOG.debug("Could not emit retry_attempt event for [{}]", operation, e);
		}
	}

	@Override
	public void reportTerminated(String operation, Termination termination, int totalAttempts, Object lastError) {
		try {
			logger.info(buildTerminatedJson(operation, termination, totalAttempts, lastError));
		} catch (Exception e) {
			// Reporting should not break the retry loop
			LOG.debug("Could not emit retry_terminated event for [{}]", operation, e);
		}
	}

	private String buildRetryAttemptJson(String operation, Object error, int attemptNumber, Duration delay) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", "retry_attempt", true);
		appendField(sb, "timestamp", ISO_FORMATTER.format(clock.instant()), false);
		appendField(sb, "trackingKey", buildTrackingKey(operation), false);
		appendField(sb, "attemptNumber", String.valueOf(attemptNumber), false);
		appendField(sb, "delayMs", String.valueOf(delay.toMillis()), false);
		appendField(sb, "errorType", RetryReporterUtils.errorType(error), false);
		appendField(sb, "error", RetryReporterUtils.describeError(error), false);
		appendField(sb, "operation", operation, false);
		sb.append("}");
		return sb.toString();
	}

	private String buildTerminatedJson(String operation, Termination termination, int totalAttempts, Object lastError) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", "retry_terminated", true);
		appendField(sb, "timestamp", ISO_FORMATTER.format(clock.instant()), false);
		appendField(sb, "trackingKey", buildTrackingKey(operation), false);
		appendField(sb, "termination", termination.name(), false);
		appendField(sb, "totalAttempts", String.valueOf(totalAttempts), false);
		if (lastError != null) {
			appendField(sb, "errorType", RetryReporterUtils.errorType(lastError), false);
		}
		appendField(sb, "operation", operation, false);
		sb.append("}");
		return sb.toString();
	}

	String buildTrackingKey(String operation) {
		if (namespace == null) {
			return operation;
		}
		return namespace + "." + operation;
	}

	private void appendField(StringBuilder sb, String key, String value, boolean first) {
		if (!first) {
			sb.append(",");
		}
		sb.append("\"").append(key).append("\":\"").append(RetryReporterUtils.escapeJson(value)).append("\"");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
