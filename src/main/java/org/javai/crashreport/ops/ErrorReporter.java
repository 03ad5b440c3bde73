package org.javai.crashreport.ops;

import org.javai.crashreport.ExceptionReport;

/**
 * Receives finished reports. Implementations might log them, emit metrics, or hand them to a
 * delivery layer.
 */
@FunctionalInterface
public interface ErrorReporter {

	/**
	 * Accepts a report. Returning normally marks the report as completed.
	 */
	void report(ExceptionReport report);

	/**
	 * A reporter that does nothing. Useful for testing.
	 */
	static ErrorReporter noOp() {
		return report -> {};
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite reporter
	 */
	static ErrorReporter composite(ErrorReporter... reporters) {
		return CompositeErrorReporter.of(reporters);
	}
}
