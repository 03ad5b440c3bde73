package org.javai.crashreport.exception;

import java.util.List;
import java.util.Objects;

/**
 * An exception that bundles several independent failures instead of one linear cause,
 * e.g. every class that failed to load during a single scan.
 *
 * <p>Flattening reports each bundled failure, with its own causes, in bundle order.
 */
public class AggregateException extends RuntimeException {

    private final List<Throwable> failures;

    public AggregateException(String message, List<? extends Throwable> failures) {
        super(message);
        this.failures = failures == null
                ? List.of()
                : failures.stream().filter(Objects::nonNull).map(Throwable.class::cast).toList();
    }

    /**
     * The bundled failures, in the order they occurred.
     */
    public List<Throwable> failures() {
        return failures;
    }
}
