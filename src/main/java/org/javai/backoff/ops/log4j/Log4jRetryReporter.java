package org.javai.backoff.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.backoff.ops.RetryReporter;
import org.javai.backoff.ops.RetryReporterUtils;
import org.javai.backoff.retry.Termination;

import java.time.Duration;

/**
 * Reports retry events using Log4j2 structured logging.
 *
 * <p>Events are logged with levels chosen by how the run is going:
 * <ul>
 *   <li>retry attempt → INFO, marker {@code RETRY}</li>
 *   <li>run succeeded → DEBUG, marker {@code RETRY_SUCCEEDED}</li>
 *   <li>run exhausted or interrupted → WARN, marker {@code RETRY_EXHAUSTED}</li>
 *   <li>error rejected as not retryable → WARN, marker {@code RETRY_REJECTED}</li>
 *   <li>run cancelled → INFO, marker {@code RETRY_CANCELLED}</li>
 *   <li>attempt or hook threw → ERROR, marker {@code RETRY_FAULTED}</li>
 * </ul>
 */
public class Log4jRetryReporter implements RetryReporter {

	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker SUCCEEDED_MARKER = MarkerManager.getMarker("RETRY_SUCCEEDED");
	private static final Marker EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");
	private static final Marker REJECTED_MARKER = MarkerManager.getMarker("RETRY_REJECTED");
	private static final Marker CANCELLED_MARKER = MarkerManager.getMarker("RETRY_CANCELLED");
	private static final Marker FAULTED_MARKER = MarkerManager.getMarker("RETRY_FAULTED");

	private final Logger logger;

	/**
	 * Creates a Log4jRetryReporter using the default logger name.
	 */
	public Log4jRetryReporter() {
		this(LogManager.getLogger("org.javai.backoff.RetryReporter"));
	}

	/**
	 * Creates a Log4jRetryReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jRetryReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jRetryReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jRetryReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void reportRetryAttempt(String operation, Object error, int attemptNumber, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Attempt {} of operation [{}] failed, retrying in {} ms. Error: {}",
				attemptNumber,
				operation,
				delay.toMillis(),
				RetryReporterUtils.describeError(error));
	}

	@Override
	public void reportTerminated(String operation, Termination termination, int totalAttempts, Object lastError) {
		logger.atLevel(levelFor(termination))
			.withMarker(markerFor(termination))
			.log("Operation [{}] finished as {} after {} attempts{}",
				operation,
				termination,
				totalAttempts,
				lastError != null ? ". Last error: " + RetryReporterUtils.describeError(lastError) : "");
	}

	private static Level levelFor(Termination termination) {
		if (termination == Termination.FAULTED) {
			return Level.ERROR;
		}
		if (termination.gaveUp()) {
			return Level.WARN;
		}
		return termination == Termination.SUCCEEDED ? Level.DEBUG : Level.INFO;
	}

	private static Marker markerFor(Termination termination) {
		return switch (termination) {
			case SUCCEEDED -> SUCCEEDED_MARKER;
			case REJECTED -> REJECTED_MARKER;
			case EXHAUSTED, INTERRUPTED -> EXHAUSTED_MARKER;
			case CANCELLED -> CANCELLED_MARKER;
			case FAULTED -> FAULTED_MARKER;
		};
	}
}
