package com.sandkev.scrobbler.listen;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * A completed playback of one track, as recorded in the Musium listens table.
 * <p>
 * Both timestamps carry an explicit UTC offset. The id is assigned by the store;
 * it is only null for listens that were reconstructed but not persisted yet.
 */
public record Listen(
        @Nullable Long id,
        OffsetDateTime startedAt,
        OffsetDateTime completedAt,
        String trackTitle,
        String albumTitle,
        String trackArtist,
        String albumArtist,
        int durationSeconds,
        @Nullable Integer trackNumber,
        @Nullable Integer discNumber,
        @Nullable Long queueId,
        long trackId,
        long albumId,
        long albumArtistId
) {

    public Listen {
        Objects.requireNonNull(startedAt, "startedAt must have a UTC offset");
        Objects.requireNonNull(completedAt, "completedAt must have a UTC offset");
        Objects.requireNonNull(trackTitle, "trackTitle");
        Objects.requireNonNull(albumTitle, "albumTitle");
        Objects.requireNonNull(trackArtist, "trackArtist");
        Objects.requireNonNull(albumArtist, "albumArtist");
    }

    /** Time between start and completion; what the eligibility rule measures. */
    public Duration playedFor() {
        return Duration.between(startedAt, completedAt);
    }

    public long startedAtEpochSecond() {
        return startedAt.toEpochSecond();
    }

    public Listen withId(long newId) {
        return new Listen(newId, startedAt, completedAt, trackTitle, albumTitle, trackArtist, albumArtist,
                durationSeconds, trackNumber, discNumber, queueId, trackId, albumId, albumArtistId);
    }

    /**
     * Parses an ISO-8601 timestamp as stored by Musium, e.g. {@code 2023-04-01T18:02:11.5+02:00}
     * or {@code 2023-04-01T16:02:11Z}. Timestamps without an offset are rejected.
     */
    public static OffsetDateTime parseTimestamp(String value) {
        try {
            return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Timestamp must be ISO-8601 with a UTC offset: " + value, e);
        }
    }

    public static String formatTimestamp(OffsetDateTime value) {
        return value.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
