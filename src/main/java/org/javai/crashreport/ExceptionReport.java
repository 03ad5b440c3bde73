package org.javai.crashreport;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The exceptions produced from one reporting event, with the handled state they share.
 *
 * @param exceptions The normalized exceptions, root first
 * @param handledState Classification of the event as a whole
 * @param metadata Opaque key/value data merged in from outside collaborators (device, app)
 */
public record ExceptionReport(
        List<ExceptionRecord> exceptions,
        HandledState handledState,
        Map<String, String> metadata
) {

    public ExceptionReport {
        Objects.requireNonNull(handledState, "handledState must not be null");
        exceptions = exceptions == null ? List.of() : List.copyOf(exceptions);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public ExceptionReport(List<ExceptionRecord> exceptions, HandledState handledState) {
        this(exceptions, handledState, null);
    }

    public boolean isUnhandled() {
        return handledState.unhandled();
    }

    /**
     * Returns a report with the given entries added to the metadata. Existing keys are overwritten.
     */
    public ExceptionReport withMetadata(Map<String, String> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new HashMap<>(metadata);
        extra.forEach((key, value) -> {
            if (key != null && value != null) {
                merged.put(key, value);
            }
        });
        return new ExceptionReport(exceptions, handledState, merged);
    }
}
