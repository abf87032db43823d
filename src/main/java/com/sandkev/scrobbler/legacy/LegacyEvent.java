package com.sandkev.scrobbler.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sandkev.scrobbler.listen.Listen;
import org.springframework.lang.Nullable;

import java.time.OffsetDateTime;

/**
 * One line of the pre-database playback log, e.g.
 * <pre>
 * {"event": "started", "time": "2021-03-04T21:13:09+01:00", "queue_id": 12, "track_id": 4331,
 *  "album_id": 172, "album_artist_id": 53, "track_title": "...", "album_title": "...",
 *  "track_artist": "...", "album_artist": "...", "duration_seconds": 241,
 *  "track_number": 3, "disc_number": 1}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyEvent(
        @JsonProperty("event") EventType type,
        @JsonProperty("time") String time,
        @JsonProperty("queue_id") @Nullable Long queueId,
        @JsonProperty("track_id") long trackId,
        @JsonProperty("album_id") long albumId,
        @JsonProperty("album_artist_id") long albumArtistId,
        @JsonProperty("track_title") String trackTitle,
        @JsonProperty("album_title") String albumTitle,
        @JsonProperty("track_artist") String trackArtist,
        @JsonProperty("album_artist") String albumArtist,
        @JsonProperty("duration_seconds") int durationSeconds,
        @JsonProperty("track_number") @Nullable Integer trackNumber,
        @JsonProperty("disc_number") @Nullable Integer discNumber
) {

    public OffsetDateTime timestamp() {
        return Listen.parseTimestamp(time);
    }
}
