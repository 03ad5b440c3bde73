package org.javai.crashreport.stacktrace;

import org.javai.crashreport.StackFrame;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text layouts in which platform log channels deliver stack traces.
 *
 * <p>Each line of the trace text is matched on its own. Lines that do not look like a frame
 * (exception headers, blank lines, "... N more" markers) are skipped.
 */
public enum StackTraceFormat {

    /**
     * Managed engine traces, e.g. {@code Game.Player:Update () (at Assets/Player.cs:42)}.
     */
    UNITY(Pattern.compile(
            "^\\s*(?<method>[^\\s(]+)\\s*(?:\\([^)]*\\))?\\s*(?:\\(at (?<file>.+):(?<line>\\d+)\\))?\\s*$")),

    /**
     * JVM traces as printed on Android, e.g. {@code at com.foo.Bar.baz(Bar.java:12)}.
     */
    ANDROID_JAVA(Pattern.compile(
            "^\\s*(?:at\\s+)?(?<method>[^\\s(]+)\\((?<file>[^:)]*)(?::(?<line>\\d+))?\\)\\s*$"));

    private final Pattern framePattern;

    StackTraceFormat(Pattern framePattern) {
        this.framePattern = framePattern;
    }

    /**
     * Parses trace text into frames, in the order they appear.
     *
     * @return the frames, or an empty list if the text is null, blank, or has no recognizable frames
     */
    public List<StackFrame> parse(String traceText) {
        if (traceText == null || traceText.isBlank()) {
            return List.of();
        }
        List<StackFrame> frames = new ArrayList<>();
        for (String line : traceText.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            Matcher matcher = framePattern.matcher(line);
            if (matcher.matches()) {
                frames.add(toFrame(matcher));
            }
        }
        return List.copyOf(frames);
    }

    private static StackFrame toFrame(Matcher matcher) {
        String file = matcher.group("file");
        if (file != null && file.isBlank()) {
            file = null;
        }
        String line = matcher.group("line");
        Integer lineNumber = null;
        if (line != null) {
            try {
                int parsed = Integer.parseInt(line);
                lineNumber = parsed > 0 ? parsed : null;
            } catch (NumberFormatException e) {
                // More digits than an int holds: keep the frame without a line
                lineNumber = null;
            }
        }
        return new StackFrame(matcher.group("method"), file, lineNumber);
    }
}
