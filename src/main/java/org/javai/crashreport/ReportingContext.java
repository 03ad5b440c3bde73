package org.javai.crashreport;

/**
 * The situation in which an error was reported. Drives {@link HandledState#classify}.
 */
public enum ReportingContext {
    /**
     * Caught by the application and passed to the reporter.
     */
    EXPLICIT_HANDLED_REPORT,

    /**
     * Surfaced through the platform log channel.
     */
    LOG_EVENT,

    /**
     * Treated as a crash no matter what the severity says.
     */
    FORCED_UNHANDLED
}
