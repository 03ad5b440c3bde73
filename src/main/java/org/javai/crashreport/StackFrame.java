package org.javai.crashreport;

import java.util.Objects;

/**
 * A single resolved frame of a stack trace.
 *
 * @param method The fully qualified method (e.g., "com.example.Player.update")
 * @param file The source file name (may be null)
 * @param lineNumber The line within the file (may be null)
 */
public record StackFrame(String method, String file, Integer lineNumber) {

    public StackFrame {
        Objects.requireNonNull(method, "method must not be null");
    }

    /**
     * Builds a frame from a JVM {@link StackTraceElement}.
     */
    public static StackFrame from(StackTraceElement element) {
        Objects.requireNonNull(element, "element must not be null");
        Integer line = element.getLineNumber() > 0 ? element.getLineNumber() : null;
        return new StackFrame(element.getClassName() + "." + element.getMethodName(), element.getFileName(), line);
    }

    public static StackFrame of(String method, String file, Integer lineNumber) {
        return new StackFrame(method, file, lineNumber);
    }
}
