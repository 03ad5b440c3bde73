package org.javai.crashreport.ops;

/**
 * Resolves configuration from system properties, falling back to environment variables.
 */
public final class ConfigResolver {

	private ConfigResolver() {
		// Utility class
	}

	/**
	 * Resolves a required value.
	 *
	 * @param sysProp the system property name
	 * @param envVar the environment variable name
	 * @return the resolved value
	 * @throws IllegalStateException if neither is set
	 */
	public static String resolveConfig(String sysProp, String envVar) {
		String value = resolveConfig(sysProp, envVar, null);
		if (value == null) {
			throw new IllegalStateException(
				"Missing required configuration: set system property '" + sysProp +
				"' or environment variable '" + envVar + "'"
			);
		}
		return value;
	}

	/**
	 * Resolves an optional value.
	 *
	 * @param sysProp the system property name
	 * @param envVar the environment variable name
	 * @param defaultValue returned when neither is set (may be null)
	 * @return the resolved value, or {@code defaultValue}
	 */
	public static String resolveConfig(String sysProp, String envVar, String defaultValue) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		if (value == null || value.isBlank()) {
			return defaultValue;
		}
		return value.trim();
	}
}
