package com.sandkev.scrobbler.listen;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcListenWriter implements ListenWriter {

    static final String SOURCE_MUSIUM = "musium";

    private final JdbcTemplate jdbc;

    /**
     * Idempotent insert. The store has a unique index on the start time truncated to
     * seconds, so a listen that was already recorded is ignored.
     */
    @Override
    public boolean insertIfAbsent(Listen l) {
        int n = jdbc.update("""
            insert or ignore into listens
              ( started_at, completed_at, queue_id, track_id, album_id, album_artist_id
              , track_title, album_title, track_artist, album_artist
              , duration_seconds, track_number, disc_number, source )
            values (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        """,
                Listen.formatTimestamp(l.startedAt()), Listen.formatTimestamp(l.completedAt()),
                l.queueId(), l.trackId(), l.albumId(), l.albumArtistId(),
                l.trackTitle(), l.albumTitle(), l.trackArtist(), l.albumArtist(),
                l.durationSeconds(), l.trackNumber(), l.discNumber(), SOURCE_MUSIUM
        );
        return n > 0;
    }
}
