package org.javai.crashreport;

import org.javai.crashreport.exception.ExceptionSource;
import org.javai.crashreport.exception.JvmExceptionSource;
import org.javai.crashreport.log.LogMessageClassifier;
import org.javai.crashreport.log.WrappedExceptionConvention;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import static org.javai.crashreport.ops.ConfigResolver.resolveConfig;

/**
 * Configuration for a {@link CrashReporter}.
 *
 * <p>Build explicitly:
 * <pre>{@code
 * CrashReporterOptions options = CrashReporterOptions.builder()
 *     .notifyLevel(LogType.ERROR)
 *     .metadata(Map.of("appVersion", "1.4.2"))
 *     .build();
 * }</pre>
 *
 * <p>or from system properties with environment variable fallbacks:
 * <ul>
 *   <li>{@code crashreport.notify.level} / {@code CRASHREPORT_NOTIFY_LEVEL} - least serious log type reported</li>
 *   <li>{@code crashreport.native.marker} / {@code CRASHREPORT_NATIVE_MARKER} - native agent trace marker</li>
 *   <li>{@code crashreport.wrapped.convention} / {@code CRASHREPORT_WRAPPED_CONVENTION} - {@code android-java} or {@code none}</li>
 *   <li>{@code crashreport.log.prefix} / {@code CRASHREPORT_LOG_PREFIX} - prefix of synthetic log error classes</li>
 * </ul>
 */
public final class CrashReporterOptions {

    public static final LogType DEFAULT_NOTIFY_LEVEL = LogType.EXCEPTION;

    private final LogType notifyLevel;
    private final WrappedExceptionConvention wrappedExceptionConvention;
    private final String syntheticLogPrefix;
    private final Map<LogType, Severity> logSeverities;
    private final Map<String, String> metadata;
    private final ExceptionSource exceptionSource;

    private CrashReporterOptions(Builder builder) {
        this.notifyLevel = builder.notifyLevel;
        this.wrappedExceptionConvention = builder.wrappedExceptionConvention;
        this.syntheticLogPrefix = builder.syntheticLogPrefix;
        this.logSeverities = Map.copyOf(builder.logSeverities);
        this.metadata = Map.copyOf(builder.metadata);
        this.exceptionSource = builder.exceptionSource;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CrashReporterOptions defaults() {
        return builder().build();
    }

    /**
     * Reads options from system properties and environment variables.
     *
     * @throws IllegalArgumentException if a configured value is not recognized
     */
    public static CrashReporterOptions fromEnvironment() {
        String marker = resolveConfig("crashreport.native.marker", "CRASHREPORT_NATIVE_MARKER",
                WrappedExceptionConvention.DEFAULT_NATIVE_AGENT_MARKER);
        String convention = resolveConfig("crashreport.wrapped.convention", "CRASHREPORT_WRAPPED_CONVENTION",
                "android-java");
        return builder()
                .notifyLevel(LogType.parse(resolveConfig("crashreport.notify.level", "CRASHREPORT_NOTIFY_LEVEL",
                        DEFAULT_NOTIFY_LEVEL.name())))
                .wrappedExceptionConvention(WrappedExceptionConvention.named(convention, marker))
                .syntheticLogPrefix(resolveConfig("crashreport.log.prefix", "CRASHREPORT_LOG_PREFIX",
                        LogMessageClassifier.DEFAULT_SYNTHETIC_PREFIX))
                .build();
    }

    public LogType notifyLevel() {
        return notifyLevel;
    }

    public WrappedExceptionConvention wrappedExceptionConvention() {
        return wrappedExceptionConvention;
    }

    public String syntheticLogPrefix() {
        return syntheticLogPrefix;
    }

    /**
     * The severity given to log messages of {@code type}: the configured override, or the type's default.
     */
    public Severity severityFor(LogType type) {
        return logSeverities.getOrDefault(type, type.defaultSeverity());
    }

    public Map<String, String> metadata() {
        return metadata;
    }

    public ExceptionSource exceptionSource() {
        return exceptionSource;
    }

    public static final class Builder {
        private LogType notifyLevel = DEFAULT_NOTIFY_LEVEL;
        private WrappedExceptionConvention wrappedExceptionConvention = WrappedExceptionConvention.androidJava();
        private String syntheticLogPrefix = LogMessageClassifier.DEFAULT_SYNTHETIC_PREFIX;
        private final Map<LogType, Severity> logSeverities = new EnumMap<>(LogType.class);
        private final Map<String, String> metadata = new HashMap<>();
        private ExceptionSource exceptionSource = new JvmExceptionSource();

        private Builder() {}

        /**
         * Least serious log type that is reported. Default: {@code EXCEPTION}.
         */
        public Builder notifyLevel(LogType notifyLevel) {
            this.notifyLevel = Objects.requireNonNull(notifyLevel, "notifyLevel must not be null");
            return this;
        }

        public Builder wrappedExceptionConvention(WrappedExceptionConvention convention) {
            this.wrappedExceptionConvention = Objects.requireNonNull(convention, "convention must not be null");
            return this;
        }

        public Builder syntheticLogPrefix(String prefix) {
            this.syntheticLogPrefix = Objects.requireNonNull(prefix, "prefix must not be null");
            return this;
        }

        /**
         * Overrides the severity of one log type.
         */
        public Builder logSeverity(LogType type, Severity severity) {
            logSeverities.put(Objects.requireNonNull(type), Objects.requireNonNull(severity));
            return this;
        }

        /**
         * Opaque device and application data merged into every report.
         */
        public Builder metadata(Map<String, String> metadata) {
            if (metadata != null) {
                metadata.forEach((key, value) -> {
                    if (key != null && value != null) {
                        this.metadata.put(key, value);
                    }
                });
            }
            return this;
        }

        public Builder exceptionSource(ExceptionSource source) {
            this.exceptionSource = Objects.requireNonNull(source, "source must not be null");
            return this;
        }

        public CrashReporterOptions build() {
            return new CrashReporterOptions(this);
        }
    }
}
