package org.javai.crashreport.session;

import org.javai.crashreport.ExceptionReport;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A period of application execution over which reported events are counted.
 *
 * <p>The session owns its {@link SessionEvents} for its whole lifetime. When a session starts
 * and stops is decided elsewhere.
 */
public final class Session {

    private final UUID id;
    private final Instant startedAt;
    private final SessionEvents events;

    private Session(UUID id, Instant startedAt, SessionEvents events) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
        this.events = events;
    }

    /**
     * Starts a new session now, with both counters at zero.
     */
    public static Session start() {
        return new Session(UUID.randomUUID(), Instant.now(), new SessionEvents());
    }

    /**
     * Restores a previously persisted session with its known counts.
     */
    public static Session resume(UUID id, Instant startedAt, int handled, int unhandled) {
        return new Session(id, startedAt, new SessionEvents(handled, unhandled));
    }

    /**
     * Counts a completed report against this session.
     */
    public void addException(ExceptionReport report) {
        Objects.requireNonNull(report, "report must not be null");
        if (report.isUnhandled()) {
            events.incrementUnhandled();
        } else {
            events.incrementHandled();
        }
    }

    public UUID id() {
        return id;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public SessionEvents events() {
        return events;
    }
}
