package org.javai.crashreport;

/**
 * How serious a reported event is.
 */
public enum Severity {
    /**
     * A crash or an error-level condition.
     */
    ERROR("error"),

    /**
     * Something went wrong but the application carried on. Default for handled exceptions.
     */
    WARNING("warning"),

    /**
     * Informational event.
     */
    INFO("info");

    private final String wireValue;

    Severity(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * The value used in report payloads.
     */
    public String wireValue() {
        return wireValue;
    }
}
