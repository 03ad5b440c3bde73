package org.javai.crashreport.log;

import org.javai.crashreport.stacktrace.StackTraceFormat;

import java.util.Locale;
import java.util.Objects;

/**
 * A platform convention for native exceptions that reach the log channel wrapped inside
 * a managed one, with the native "class: message" pair embedded in the outer message.
 *
 * @param sentinelClass The outer error class that marks a wrapped native exception
 * @param traceFormat The layout of the native trace text
 * @param nativeAgentMarker Substring present in traces already reported by the native agent
 *                          (null disables duplicate suppression)
 */
public record WrappedExceptionConvention(
        String sentinelClass,
        StackTraceFormat traceFormat,
        String nativeAgentMarker
) {

    public static final String ANDROID_JAVA_SENTINEL = "AndroidJavaException";
    public static final String DEFAULT_NATIVE_AGENT_MARKER = "libbugsnag";

    private static final WrappedExceptionConvention NONE = new WrappedExceptionConvention(null, null, null);

    public WrappedExceptionConvention {
        if (sentinelClass != null) {
            if (sentinelClass.isBlank()) {
                throw new IllegalArgumentException("sentinelClass must not be blank");
            }
            Objects.requireNonNull(traceFormat, "traceFormat must not be null");
        }
        if (nativeAgentMarker != null && nativeAgentMarker.isEmpty()) {
            nativeAgentMarker = null;
        }
    }

    /**
     * Java exceptions surfacing through the Unity log on Android.
     */
    public static WrappedExceptionConvention androidJava() {
        return androidJava(DEFAULT_NATIVE_AGENT_MARKER);
    }

    public static WrappedExceptionConvention androidJava(String nativeAgentMarker) {
        return new WrappedExceptionConvention(ANDROID_JAVA_SENTINEL, StackTraceFormat.ANDROID_JAVA, nativeAgentMarker);
    }

    /**
     * No wrapped exceptions: every log message is classified by its outer class only.
     */
    public static WrappedExceptionConvention none() {
        return NONE;
    }

    /**
     * Looks up a convention by its configuration name ({@code android-java} or {@code none}).
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static WrappedExceptionConvention named(String name, String nativeAgentMarker) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "android-java" -> androidJava(nativeAgentMarker);
            case "none" -> none();
            default -> throw new IllegalArgumentException("Unknown wrapped exception convention: " + name);
        };
    }

    public boolean isEnabled() {
        return sentinelClass != null;
    }

    public boolean isWrapped(String errorClass) {
        return sentinelClass != null && sentinelClass.equals(errorClass);
    }
}
