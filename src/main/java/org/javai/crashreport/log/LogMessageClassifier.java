package org.javai.crashreport.log;

import org.javai.crashreport.ExceptionRecord;
import org.javai.crashreport.ExceptionReport;
import org.javai.crashreport.HandledState;
import org.javai.crashreport.LogMessage;
import org.javai.crashreport.ReportingContext;
import org.javai.crashreport.Severity;
import org.javai.crashreport.StackFrame;
import org.javai.crashreport.stacktrace.StackTraceFormat;
import org.javai.crashreport.stacktrace.StackTraces;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses free-text log messages into a single {@link ExceptionRecord}.
 *
 * <p>A condition of the form {@code "ErrorClass: message"} yields that class and message.
 * Anything else becomes a synthetic class built from the prefix and the log type, e.g.
 * {@code UnityLogError}, with the whole condition as the message.
 *
 * <p>When the class is the sentinel of the configured {@link WrappedExceptionConvention},
 * the message is parsed again to recover the native exception. Such reports are always
 * unhandled, since a native exception reaching the log means the native side crashed.
 *
 * <p>{@link #shouldSend(LogMessage)} must be checked before {@link #classify}: it filters out
 * native crashes that the native agent has already reported.
 */
public class LogMessageClassifier {

    public static final String DEFAULT_SYNTHETIC_PREFIX = "UnityLog";

    private static final Pattern ERROR_CLASS_MESSAGE =
            Pattern.compile("^(?<errorClass>\\S+):\\s*(?<message>.*)$", Pattern.DOTALL);

    private final WrappedExceptionConvention convention;
    private final StackTraceFormat traceFormat;
    private final String syntheticPrefix;

    public LogMessageClassifier() {
        this(WrappedExceptionConvention.androidJava());
    }

    public LogMessageClassifier(WrappedExceptionConvention convention) {
        this(convention, StackTraceFormat.UNITY, DEFAULT_SYNTHETIC_PREFIX);
    }

    /**
     * @param convention Wrapped native exception handling
     * @param traceFormat Layout of ordinary log trace text
     * @param syntheticPrefix Prefix of the class given to unstructured messages
     */
    public LogMessageClassifier(WrappedExceptionConvention convention, StackTraceFormat traceFormat, String syntheticPrefix) {
        this.convention = Objects.requireNonNull(convention, "convention must not be null");
        this.traceFormat = Objects.requireNonNull(traceFormat, "traceFormat must not be null");
        this.syntheticPrefix = Objects.requireNonNull(syntheticPrefix, "syntheticPrefix must not be null");
    }

    /**
     * Classifies a log message reported at its type's default severity.
     */
    public ExceptionReport classify(LogMessage log, List<StackFrame> fallback) {
        return classify(log, fallback, log.type().defaultSeverity(), false);
    }

    /**
     * Classifies a log message.
     *
     * @param log The message to classify
     * @param fallback Frames to use when the message's own trace has none (may be null)
     * @param severity Severity of the log event
     * @param forceUnhandled Report as an unhandled crash whatever the severity
     * @return a report holding exactly one record
     */
    public ExceptionReport classify(LogMessage log, List<StackFrame> fallback, Severity severity, boolean forceUnhandled) {
        Objects.requireNonNull(log, "log must not be null");

        HandledState handledState = forceUnhandled
                ? HandledState.classify(ReportingContext.FORCED_UNHANDLED, severity)
                : HandledState.classify(ReportingContext.LOG_EVENT, severity);
        List<StackFrame> frames = StackTraces.orFallback(traceFormat.parse(log.stackTrace()), fallback);

        Matcher match = ERROR_CLASS_MESSAGE.matcher(log.condition());
        if (!match.matches()) {
            ExceptionRecord record = new ExceptionRecord(syntheticPrefix + log.type().tag(), log.condition(), frames);
            return new ExceptionReport(List.of(record), handledState);
        }

        String errorClass = match.group("errorClass");
        String message = match.group("message").trim();

        if (convention.isWrapped(errorClass)) {
            Matcher nested = ERROR_CLASS_MESSAGE.matcher(message);
            if (nested.matches()) {
                errorClass = nested.group("errorClass");
                message = nested.group("message").trim();
            } else if (!message.isEmpty()) {
                // Only the native class name was logged. With no native text at all the sentinel
                // stays the class, so a record never has an empty class name.
                errorClass = message;
                message = "";
            }
            frames = StackTraces.orFallback(convention.traceFormat().parse(log.stackTrace()), fallback);
            handledState = HandledState.forUnhandledException();
        }

        return new ExceptionReport(List.of(new ExceptionRecord(errorClass, message, frames)), handledState);
    }

    /**
     * Decides whether a log message should be reported at all.
     *
     * @return false only for a wrapped native exception whose trace carries the native agent's
     *         marker, meaning the native agent already reported it; true otherwise
     */
    public boolean shouldSend(LogMessage log) {
        Objects.requireNonNull(log, "log must not be null");
        if (convention.nativeAgentMarker() == null) {
            return true;
        }
        Matcher match = ERROR_CLASS_MESSAGE.matcher(log.condition());
        if (match.matches() && convention.isWrapped(match.group("errorClass"))) {
            return !log.hasStackTrace() || !log.stackTrace().contains(convention.nativeAgentMarker());
        }
        return true;
    }
}
