package org.javai.crashreport.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.crashreport.ExceptionRecord;
import org.javai.crashreport.ExceptionReport;
import org.javai.crashreport.HandledState;
import org.javai.crashreport.ops.ErrorReporter;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reports crash reports using Log4j2 logging.
 *
 * <p>Reports are logged with a level derived from their {@link HandledState}:
 * <ul>
 *   <li>unhandled → ERROR</li>
 *   <li>handled ERROR → ERROR</li>
 *   <li>handled WARNING → WARN</li>
 *   <li>handled INFO → INFO</li>
 * </ul>
 */
public class Log4jErrorReporter implements ErrorReporter {

	private static final Marker CRASH_REPORT_MARKER = MarkerManager.getMarker("CRASH_REPORT");

	private final Logger logger;

	/**
	 * Creates a Log4jErrorReporter using the default logger name.
	 */
	public Log4jErrorReporter() {
		this(LogManager.getLogger("org.javai.crashreport.ErrorReporter"));
	}

	/**
	 * Creates a Log4jErrorReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jErrorReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jErrorReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jErrorReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(ExceptionReport report) {
		logger.atLevel(levelFor(report.handledState()))
			.withMarker(CRASH_REPORT_MARKER)
			.log(formatReport(report));
	}

	static String formatReport(ExceptionReport report) {
		HandledState state = report.handledState();
		return """
			%s [%s] | unhandled=%s, severityReason=%s, exceptions=%d%s\
			""".formatted(
				formatPrimary(report),
				state.severity().wireValue(),
				state.unhandled(),
				state.severityReason().type().wireValue(),
				report.exceptions().size(),
				formatMetadata(report.metadata())
			).trim();
	}

	private static String formatPrimary(ExceptionReport report) {
		if (report.exceptions().isEmpty()) {
			return "(no exceptions)";
		}
		ExceptionRecord primary = report.exceptions().get(0);
		return primary.message().isEmpty()
			? primary.errorClass()
			: primary.errorClass() + ": " + primary.message();
	}

	private static String formatMetadata(Map<String, String> metadata) {
		if (metadata.isEmpty()) {
			return "";
		}
		return ", metaData={" + metadata.entrySet().stream()
				.sorted(Map.Entry.comparingByKey())
				.map(e -> e.getKey() + "=" + e.getValue())
				.collect(Collectors.joining(", ")) + "}";
	}

	static Level levelFor(HandledState state) {
		if (state.unhandled()) {
			return Level.ERROR;
		}
		return switch (state.severity()) {
			case ERROR -> Level.ERROR;
			case WARNING -> Level.WARN;
			case INFO -> Level.INFO;
		};
	}
}
