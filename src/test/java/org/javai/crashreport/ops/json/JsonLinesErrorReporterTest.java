package org.javai.crashreport.ops.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.crashreport.ExceptionRecord;
import org.javai.crashreport.ExceptionReport;
import org.javai.crashreport.HandledState;
import org.javai.crashreport.StackFrame;
import org.javai.crashreport.payload.PayloadSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.LegacyAbstractLogger;
import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class JsonLinesErrorReporterTest {

	private final ObjectMapper mapper = new ObjectMapper();
	private List<String> capturedMessages;
	private JsonLinesErrorReporter reporter;

	@BeforeEach
	void setUp() {
		capturedMessages = new ArrayList<>();
		reporter = new JsonLinesErrorReporter(new PayloadSerializer(mapper), new CapturingLogger(capturedMessages));
	}

	@Test
	void report_emitsOneJsonLine() throws Exception {
		ExceptionReport report = new ExceptionReport(List.of(
				new ExceptionRecord("IllegalStateException", "boom\nsecond line", List.of(
						StackFrame.of("com.example.Service.run", "Service.java", 21)))),
				HandledState.forUnhandledException());

		reporter.report(report);

		assertThat(capturedMessages).hasSize(1);
		String line = capturedMessages.get(0);
		assertThat(line).doesNotContain("\n");
		JsonNode json = mapper.readTree(line);
		assertThat(json.get("exceptions").get(0).get("message").asText()).isEqualTo("boom\nsecond line");
		assertThat(json.get("unhandled").asBoolean()).isTrue();
	}

	@Test
	void constructors_defaultLoggerName() {
		assertThatCode(() -> new JsonLinesErrorReporter()).doesNotThrowAnyException();
		assertThatCode(() -> new JsonLinesErrorReporter("custom.reports")).doesNotThrowAnyException();
	}

	/**
	 * Captures info messages for assertions.
	 */
	private static class CapturingLogger extends LegacyAbstractLogger {
		private final List<String> messages;

		CapturingLogger(List<String> messages) {
			this.name = "test";
			this.messages = messages;
		}

		@Override
		public boolean isTraceEnabled() { return false; }

		@Override
		public boolean isDebugEnabled() { return false; }

		@Override
		public boolean isInfoEnabled() { return true; }

		@Override
		public boolean isWarnEnabled() { return false; }

		@Override
		public boolean isErrorEnabled() { return false; }

		@Override
		protected String getFullyQualifiedCallerName() { return null; }

		@Override
		protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
				Object[] arguments, Throwable throwable) {
			if (level == Level.INFO) {
				messages.add(MessageFormatter.basicArrayFormat(messagePattern, arguments));
			}
		}
	}
}
