package org.javai.crashreport.session;

/**
 * A point-in-time reading of a session's event counters.
 *
 * <p>The two values are read independently and need not be consistent with each other.
 *
 * @param handled Number of handled events reported in the session
 * @param unhandled Number of unhandled events reported in the session
 */
public record SessionCounts(int handled, int unhandled) {

    public SessionCounts {
        if (handled < 0) {
            throw new IllegalArgumentException("handled must not be negative");
        }
        if (unhandled < 0) {
            throw new IllegalArgumentException("unhandled must not be negative");
        }
    }
}
