package org.javai.crashreport;

import org.javai.crashreport.exception.ExceptionFlattener;
import org.javai.crashreport.log.LogMessageClassifier;
import org.javai.crashreport.ops.ErrorReporter;
import org.javai.crashreport.ops.UncaughtExceptionReporter;
import org.javai.crashreport.session.Session;
import org.javai.crashreport.stacktrace.StackTraceFormat;
import org.javai.crashreport.stacktrace.StackTraces;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point: turns exceptions and log messages into reports, hands them to an
 * {@link ErrorReporter}, and counts them against the current {@link Session}.
 *
 * <pre>{@code
 * CrashReporter crashReporter = new CrashReporter(CrashReporterOptions.fromEnvironment(), new Log4jErrorReporter());
 *
 * try {
 *     riskyOperation();
 * } catch (Exception e) {
 *     crashReporter.notify(e);
 * }
 *
 * // From the platform's log callback
 * crashReporter.onLogMessage(new LogMessage(condition, stackTrace, LogType.EXCEPTION));
 * }</pre>
 *
 * <p>Safe for concurrent use.
 */
public final class CrashReporter {

    private static final Logger log = LoggerFactory.getLogger(CrashReporter.class);

    private final CrashReporterOptions options;
    private final ErrorReporter reporter;
    private final ExceptionFlattener flattener;
    private final LogMessageClassifier logClassifier;
    private volatile Session session;

    public CrashReporter(CrashReporterOptions options, ErrorReporter reporter) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.flattener = new ExceptionFlattener(options.exceptionSource());
        this.logClassifier = new LogMessageClassifier(
                options.wrappedExceptionConvention(),
                StackTraceFormat.UNITY,
                options.syntheticLogPrefix());
        this.session = Session.start();
    }

    /**
     * Reports a caught exception at WARNING severity.
     *
     * @return the delivered report, or null if nothing was reported
     */
    public ExceptionReport notify(Throwable throwable) {
        return notify(throwable, null);
    }

    /**
     * Reports a caught exception.
     *
     * @param severity the severity, WARNING when null
     * @return the delivered report, or null if nothing was reported
     */
    public ExceptionReport notify(Throwable throwable, Severity severity) {
        return notifyWith(throwable, HandledState.classify(ReportingContext.EXPLICIT_HANDLED_REPORT, severity), Map.of());
    }

    /**
     * Reports an exception as an unhandled crash.
     *
     * @return the delivered report, or null if nothing was reported
     */
    public ExceptionReport notifyUnhandled(Throwable throwable) {
        return notifyUnhandled(throwable, Map.of());
    }

    /**
     * Reports an exception as an unhandled crash, with extra metadata for this report only.
     *
     * @return the delivered report, or null if nothing was reported
     */
    public ExceptionReport notifyUnhandled(Throwable throwable, Map<String, String> metadata) {
        return notifyWith(throwable, HandledState.forUnhandledException(), metadata);
    }

    /**
     * Handles a message from the platform log channel.
     *
     * <p>Messages below the notify level, and native crashes the native agent already reported,
     * are dropped.
     *
     * @return the delivered report, or null if the message was dropped
     */
    public ExceptionReport onLogMessage(LogMessage message) {
        Objects.requireNonNull(message, "message must not be null");
        if (!message.type().isAtLeast(options.notifyLevel())) {
            log.debug("Ignoring {} log message below notify level {}", message.type(), options.notifyLevel());
            return null;
        }
        if (!logClassifier.shouldSend(message)) {
            log.debug("Ignoring log message already reported by the native agent: {}", message.condition());
            return null;
        }
        ExceptionReport report = logClassifier.classify(
                message,
                callSite(),
                options.severityFor(message.type()),
                false);
        return deliver(report, Map.of());
    }

    /**
     * Replaces the current session with a fresh one.
     */
    public Session startSession() {
        Session started = Session.start();
        this.session = started;
        log.debug("Started session {}", started.id());
        return started;
    }

    public Session session() {
        return session;
    }

    public CrashReporterOptions options() {
        return options;
    }

    private ExceptionReport notifyWith(Throwable throwable, HandledState handledState, Map<String, String> metadata) {
        if (throwable == null) {
            log.debug("Ignoring null throwable");
            return null;
        }
        return deliver(flattener.report(throwable, callSite(), handledState), metadata);
    }

    private ExceptionReport deliver(ExceptionReport report, Map<String, String> metadata) {
        ExceptionReport enriched = report
                .withMetadata(options.metadata())
                .withMetadata(metadata);
        try {
            reporter.report(enriched);
        } catch (RuntimeException e) {
            // Undelivered reports are not counted
            log.warn("Failed to deliver report for {}", describe(enriched), e);
            return null;
        }
        session.addException(enriched);
        return enriched;
    }

    private static List<StackFrame> callSite() {
        return StackTraces.callSite(CrashReporter.class, UncaughtExceptionReporter.class);
    }

    private static String describe(ExceptionReport report) {
        return report.exceptions().isEmpty() ? "empty report" : report.exceptions().get(0).errorClass();
    }
}
