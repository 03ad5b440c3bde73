package org.javai.crashreport;

import java.util.List;
import java.util.Objects;

/**
 * One normalized exception within a report.
 *
 * <p>The stack trace is fixed at construction. The error class and message may be changed
 * before the report is sent, for post-hoc enrichment.
 */
public final class ExceptionRecord {

    private String errorClass;
    private String message;
    private final List<StackFrame> stackTrace;

    public ExceptionRecord(String errorClass, String message, List<StackFrame> stackTrace) {
        this.errorClass = Objects.requireNonNull(errorClass, "errorClass must not be null");
        this.message = message == null ? "" : message;
        this.stackTrace = stackTrace == null ? List.of() : List.copyOf(stackTrace);
    }

    public String errorClass() {
        return errorClass;
    }

    public String message() {
        return message;
    }

    public List<StackFrame> stackTrace() {
        return stackTrace;
    }

    public void setErrorClass(String errorClass) {
        this.errorClass = Objects.requireNonNull(errorClass, "errorClass must not be null");
    }

    public void setMessage(String message) {
        this.message = Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return errorClass + (message.isEmpty() ? "" : ": " + message) + " (" + stackTrace.size() + " frames)";
    }
}
