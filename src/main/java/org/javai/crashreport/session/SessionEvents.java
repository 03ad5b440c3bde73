package org.javai.crashreport.session;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handled and unhandled event counters for one session.
 *
 * <p>The counters only go up and stop at {@link Integer#MAX_VALUE}. Each is updated atomically
 * on its own, so incrementing one never waits on the other and no ordering holds between them.
 */
public final class SessionEvents {

    private final AtomicInteger handled;
    private final AtomicInteger unhandled;

    public SessionEvents() {
        this(0, 0);
    }

    /**
     * @param handled Initial handled count, e.g. restored from a persisted session
     * @param unhandled Initial unhandled count
     */
    public SessionEvents(int handled, int unhandled) {
        if (handled < 0 || unhandled < 0) {
            throw new IllegalArgumentException("initial counts must not be negative");
        }
        this.handled = new AtomicInteger(handled);
        this.unhandled = new AtomicInteger(unhandled);
    }

    public int incrementHandled() {
        return handled.updateAndGet(SessionEvents::saturatingIncrement);
    }

    public int incrementUnhandled() {
        return unhandled.updateAndGet(SessionEvents::saturatingIncrement);
    }

    public int handled() {
        return handled.get();
    }

    public int unhandled() {
        return unhandled.get();
    }

    public SessionCounts snapshot() {
        return new SessionCounts(handled.get(), unhandled.get());
    }

    private static int saturatingIncrement(int count) {
        return count == Integer.MAX_VALUE ? count : count + 1;
    }
}
