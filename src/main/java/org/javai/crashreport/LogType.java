package org.javai.crashreport;

/**
 * Category of a platform log message, in ascending order of seriousness.
 */
public enum LogType {
    LOG("Log", Severity.INFO),
    WARNING("Warning", Severity.WARNING),
    ASSERT("Assert", Severity.ERROR),
    ERROR("Error", Severity.ERROR),
    EXCEPTION("Exception", Severity.ERROR);

    private final String tag;
    private final Severity defaultSeverity;

    LogType(String tag, Severity defaultSeverity) {
        this.tag = tag;
        this.defaultSeverity = defaultSeverity;
    }

    /**
     * The tag appended to synthetic error classes, e.g. "Error" in "UnityLogError".
     */
    public String tag() {
        return tag;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    /**
     * True if this type is at least as serious as {@code threshold}.
     */
    public boolean isAtLeast(LogType threshold) {
        return compareTo(threshold) >= 0;
    }

    /**
     * Parses a type by name or tag, ignoring case.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static LogType parse(String value) {
        for (LogType type : values()) {
            if (type.name().equalsIgnoreCase(value) || type.tag.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown log type: " + value);
    }
}
