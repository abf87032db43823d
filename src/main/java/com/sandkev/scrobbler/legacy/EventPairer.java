package com.sandkev.scrobbler.legacy;

import com.sandkev.scrobbler.listen.Listen;

import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Reconstructs listens from an ordered stream of started/completed events.
 * <p>
 * Only the previous event is remembered. A listen is produced when a {@code started} event is
 * directly followed by the {@code completed} event of the same queue entry and track, the
 * track played for about as long as it lasts (within 10 seconds), and the track is longer than
 * 30 seconds. A started event without completion (skipped, stopped) produces nothing.
 */
public final class EventPairer implements Iterator<Listen> {

    static final Duration MAX_DURATION_MISMATCH = Duration.ofSeconds(10);
    static final int MIN_DURATION_SECONDS = 30;

    private final Iterator<LegacyEvent> events;
    private LegacyEvent previous;
    private Listen next;

    public EventPairer(Iterator<LegacyEvent> events) {
        this.events = events;
    }

    @Override
    public boolean hasNext() {
        while (next == null && events.hasNext()) {
            LegacyEvent current = events.next();
            if (previous != null && pairs(previous, current)) {
                next = toListen(previous, current);
            }
            previous = current;
        }
        return next != null;
    }

    @Override
    public Listen next() {
        if (!hasNext()) throw new NoSuchElementException();
        Listen out = next;
        next = null;
        return out;
    }

    static boolean pairs(LegacyEvent started, LegacyEvent completed) {
        if (started.type() != EventType.STARTED || completed.type() != EventType.COMPLETED) return false;
        if (!Objects.equals(started.queueId(), completed.queueId())) return false;
        if (started.trackId() != completed.trackId()) return false;
        if (started.durationSeconds() <= MIN_DURATION_SECONDS) return false;

        Duration played = Duration.between(started.timestamp(), completed.timestamp());
        Duration declared = Duration.ofSeconds(started.durationSeconds());
        return played.minus(declared).abs().compareTo(MAX_DURATION_MISMATCH) <= 0;
    }

    /** Submission needs the start time, so the metadata comes from the started event. */
    private static Listen toListen(LegacyEvent started, LegacyEvent completed) {
        return new Listen(
                null,
                started.timestamp(),
                completed.timestamp(),
                started.trackTitle(),
                started.albumTitle(),
                started.trackArtist(),
                started.albumArtist(),
                started.durationSeconds(),
                started.trackNumber(),
                started.discNumber(),
                started.queueId(),
                started.trackId(),
                started.albumId(),
                started.albumArtistId()
        );
    }
}
