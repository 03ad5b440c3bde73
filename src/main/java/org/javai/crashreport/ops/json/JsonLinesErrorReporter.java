package org.javai.crashreport.ops.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.javai.crashreport.ExceptionReport;
import org.javai.crashreport.ops.ErrorReporter;
import org.javai.crashreport.payload.PayloadSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each report as one line of JSON via SLF4J.
 *
 * <p>The line is the report payload produced by {@link PayloadSerializer}, suitable for log
 * shipping pipelines that forward it to a crash-reporting backend.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"exceptions":[{"errorClass":"IllegalStateException","message":"boom","stacktrace":[...]}],"unhandled":true,"severity":"error",...}
 * }</pre>
 */
public class JsonLinesErrorReporter implements ErrorReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.crashreport.Reports";

	private final PayloadSerializer serializer;
	private final Logger logger;

	/**
	 * Creates a reporter writing to the default logger.
	 */
	public JsonLinesErrorReporter() {
		this(new PayloadSerializer(), LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a reporter writing to the named logger.
	 *
	 * @param loggerName the logger name
	 */
	public JsonLinesErrorReporter(String loggerName) {
		this(new PayloadSerializer(), LoggerFactory.getLogger(loggerName));
	}

	/**
	 * Creates a reporter with explicit configuration.
	 * Package-private for testing.
	 */
	JsonLinesErrorReporter(PayloadSerializer serializer, Logger logger) {
		this.serializer = serializer;
		this.logger = logger;
	}

	@Override
	public void report(ExceptionReport report) {
		String json;
		try {
			json = serializer.toJson(report);
		} catch (JsonProcessingException e) {
			LoggerFactory.getLogger(JsonLinesErrorReporter.class)
				.warn("Could not serialize report: {}", e.getOriginalMessage(), e);
			return;
		}
		logger.info(json);
	}
}
