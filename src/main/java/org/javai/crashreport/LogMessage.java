package org.javai.crashreport;

import java.util.Objects;

/**
 * A message received from the platform log channel.
 *
 * @param condition The free-text log line, often "ErrorClass: message"
 * @param stackTrace The raw, possibly multi-line, trace text (may be null or empty)
 * @param type The log category
 */
public record LogMessage(String condition, String stackTrace, LogType type) {

    public LogMessage {
        Objects.requireNonNull(type, "type must not be null");
        condition = condition == null ? "" : condition;
    }

    public boolean hasStackTrace() {
        return stackTrace != null && !stackTrace.isBlank();
    }
}
