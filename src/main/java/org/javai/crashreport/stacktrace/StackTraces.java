package org.javai.crashreport.stacktrace;

import org.javai.crashreport.StackFrame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds {@link StackFrame} sequences from JVM stack traces.
 */
public final class StackTraces {

    private StackTraces() {
        // Utility class
    }

    /**
     * Converts JVM trace elements, keeping their order.
     */
    public static List<StackFrame> fromElements(StackTraceElement[] elements) {
        if (elements == null || elements.length == 0) {
            return List.of();
        }
        return Arrays.stream(elements)
                .map(StackFrame::from)
                .toList();
    }

    /**
     * The frames a throwable carries, or an empty list for null.
     */
    public static List<StackFrame> of(Throwable t) {
        return t == null ? List.of() : fromElements(t.getStackTrace());
    }

    /**
     * Returns {@code primary} unless it is empty, in which case {@code fallback} is returned whole.
     */
    public static List<StackFrame> orFallback(List<StackFrame> primary, List<StackFrame> fallback) {
        if (primary != null && !primary.isEmpty()) {
            return primary;
        }
        return fallback == null ? List.of() : fallback;
    }

    /**
     * Captures the calling thread's frames, for use as a fallback trace.
     *
     * <p>{@code Thread.getStackTrace} and any leading frames belonging to {@code skipped}
     * classes (the reporting machinery) are dropped, so the result starts at the call site.
     */
    public static List<StackFrame> callSite(Class<?>... skipped) {
        Set<String> skippedNames = Arrays.stream(skipped)
                .map(Class::getName)
                .collect(Collectors.toCollection(HashSet::new));
        skippedNames.add(Thread.class.getName());
        skippedNames.add(StackTraces.class.getName());

        StackTraceElement[] elements = Thread.currentThread().getStackTrace();
        int start = 0;
        while (start < elements.length && skippedNames.contains(elements[start].getClassName())) {
            start++;
        }
        List<StackFrame> frames = new ArrayList<>(elements.length - start);
        for (int i = start; i < elements.length; i++) {
            frames.add(StackFrame.from(elements[i]));
        }
        return List.copyOf(frames);
    }
}
