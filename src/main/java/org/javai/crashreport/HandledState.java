package org.javai.crashreport;

import java.util.Objects;

/**
 * Whether a reported event was handled, how severe it is, and why.
 *
 * <p>One HandledState describes a whole report. Every exception flattened out of a single
 * event shares it, because it belongs to the reporting event rather than to any one cause.
 *
 * @param unhandled True if the event counts as a crash
 * @param severity The severity of the event
 * @param severityReason Why this severity and handled status were assigned
 */
public record HandledState(boolean unhandled, Severity severity, SeverityReason severityReason) {

    public HandledState {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(severityReason, "severityReason must not be null");
    }

    /**
     * Classifies a reporting event.
     *
     * <ul>
     *   <li>{@code EXPLICIT_HANDLED_REPORT}: handled, the given severity or WARNING when null</li>
     *   <li>{@code LOG_EVENT}: unhandled only for ERROR, reason LOG at that severity (ERROR when null)</li>
     *   <li>{@code FORCED_UNHANDLED}: unhandled ERROR, the severity argument is ignored</li>
     * </ul>
     */
    public static HandledState classify(ReportingContext context, Severity severity) {
        Objects.requireNonNull(context, "context must not be null");
        return switch (context) {
            case EXPLICIT_HANDLED_REPORT -> new HandledState(
                    false,
                    severity != null ? severity : Severity.WARNING,
                    SeverityReason.handledException());
            case LOG_EVENT -> {
                Severity level = severity != null ? severity : Severity.ERROR;
                yield new HandledState(level == Severity.ERROR, level, SeverityReason.log(level));
            }
            case FORCED_UNHANDLED -> new HandledState(true, Severity.ERROR, SeverityReason.unhandledException());
        };
    }

    public static HandledState forHandledException() {
        return classify(ReportingContext.EXPLICIT_HANDLED_REPORT, null);
    }

    public static HandledState forHandledException(Severity severity) {
        return classify(ReportingContext.EXPLICIT_HANDLED_REPORT, severity);
    }

    public static HandledState forLogMessage(Severity severity) {
        return classify(ReportingContext.LOG_EVENT, severity);
    }

    public static HandledState forUnhandledException() {
        return classify(ReportingContext.FORCED_UNHANDLED, null);
    }
}
