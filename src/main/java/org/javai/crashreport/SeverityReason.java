package org.javai.crashreport;

import java.util.Objects;

/**
 * Explains why a report was given its severity and handled status.
 *
 * @param type The kind of reason
 * @param level The log severity that produced the report (only for {@link Type#LOG}, otherwise null)
 */
public record SeverityReason(Type type, Severity level) {

    public SeverityReason {
        Objects.requireNonNull(type, "type must not be null");
        if (type == Type.LOG) {
            Objects.requireNonNull(level, "level must not be null for a log reason");
        } else if (level != null) {
            throw new IllegalArgumentException("level only applies to log reasons");
        }
    }

    public static SeverityReason handledException() {
        return new SeverityReason(Type.HANDLED_EXCEPTION, null);
    }

    public static SeverityReason unhandledException() {
        return new SeverityReason(Type.UNHANDLED_EXCEPTION, null);
    }

    public static SeverityReason log(Severity level) {
        return new SeverityReason(Type.LOG, level);
    }

    public enum Type {
        /**
         * The application caught the exception and reported it explicitly.
         */
        HANDLED_EXCEPTION("handledException"),

        /**
         * The exception escaped the application, or was forced to count as a crash.
         */
        UNHANDLED_EXCEPTION("unhandledException"),

        /**
         * The report was produced from a platform log message.
         */
        LOG("log");

        private final String wireValue;

        Type(String wireValue) {
            this.wireValue = wireValue;
        }

        public String wireValue() {
            return wireValue;
        }
    }
}
