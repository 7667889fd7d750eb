package org.javai.backoff.ops;

/**
 * Shared utilities for RetryReporter implementations.
 */
public final class RetryReporterUtils {

	private RetryReporterUtils() {
		// Utility class
	}

	/**
	 * Resolves optional configuration from a system property, falling back to an environment variable.
	 *
	 * @param sysProp the system property name
	 * @param envVar the environment variable name
	 * @return the resolved value, or null if neither is set
	 */
	public static String resolveOptionalConfig(String sysProp, String envVar) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		if (value == null || value.isBlank()) {
			return null;
		}
		return value.trim();
	}

	/**
	 * Short, single-line description of an arbitrary error value.
	 * Throwables render as {@code SimpleName: message}; anything else through {@code toString()}.
	 */
	public static String describeError(Object error) {
		if (error == null) {
			return "";
		}
		if (error instanceof Throwable throwable) {
			String message = throwable.getMessage();
			String type = throwable.getClass().getSimpleName();
			return message == null ? type : type + ": " + message;
		}
		return String.valueOf(error);
	}

	/**
	 * The type name used to classify an error value in reports.
	 */
	public static String errorType(Object error) {
		return error == null ? "" : error.getClass().getName();
	}

	/**
	 * Escapes special characters for JSON string values.
	 */
	public static String escapeJson(String s) {
		if (s == null) return "";
		return s.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\r", "\\r")
				.replace("\t", "\\t");
	}
}
