package com.sandkev.scrobbler.listen;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Pages through eligible listens with an id cursor, so no statement stays open
 * while the marker updates rows in between pages.
 */
@Repository
@RequiredArgsConstructor
public class JdbcListenSource implements ListenSource {

    static final int PAGE_SIZE = 500;

    private static final String SELECT_ELIGIBLE = """
            select
              id, started_at, completed_at,
              track_title, album_title, track_artist, album_artist,
              duration_seconds, track_number, disc_number,
              queue_id, track_id, album_id, album_artist_id
            from
              listens
            where
              scrobbled_at is null
              and source = 'musium'
              and cast(strftime('%s', completed_at) as integer)
                - cast(strftime('%s', started_at) as integer) > ?
              and id > ?
            """;

    private static final RowMapper<Listen> LISTEN_ROW = (rs, i) -> new Listen(
            rs.getLong("id"),
            Listen.parseTimestamp(rs.getString("started_at")),
            Listen.parseTimestamp(rs.getString("completed_at")),
            rs.getString("track_title"),
            rs.getString("album_title"),
            rs.getString("track_artist"),
            rs.getString("album_artist"),
            rs.getInt("duration_seconds"),
            rs.getObject("track_number") == null ? null : rs.getInt("track_number"),
            rs.getObject("disc_number") == null ? null : rs.getInt("disc_number"),
            rs.getObject("queue_id") == null ? null : rs.getLong("queue_id"),
            rs.getLong("track_id"),
            rs.getLong("album_id"),
            rs.getLong("album_artist_id")
    );

    private final JdbcTemplate jdbc;

    @Override
    public Iterator<Listen> eligible(@Nullable Instant startedAfter) {
        return new IdCursor(startedAfter);
    }

    List<Listen> page(long afterId, @Nullable Instant startedAfter) {
        long minPlayed = MIN_PLAYED.toSeconds();
        if (startedAfter == null) {
            return jdbc.query(SELECT_ELIGIBLE + " order by id asc limit ?",
                    LISTEN_ROW, minPlayed, afterId, PAGE_SIZE);
        }
        return jdbc.query(SELECT_ELIGIBLE + """
                  and cast(strftime('%s', started_at) as integer) > ?
                order by id asc limit ?
                """,
                LISTEN_ROW, minPlayed, afterId, startedAfter.getEpochSecond(), PAGE_SIZE);
    }

    private final class IdCursor implements Iterator<Listen> {
        private final Instant startedAfter;
        private final Deque<Listen> buffer = new ArrayDeque<>();
        private long lastId = 0;
        private boolean exhausted;

        IdCursor(@Nullable Instant startedAfter) {
            this.startedAfter = startedAfter;
        }

        @Override
        public boolean hasNext() {
            if (buffer.isEmpty() && !exhausted) {
                List<Listen> rows = new ArrayList<>(page(lastId, startedAfter));
                if (rows.size() < PAGE_SIZE) exhausted = true;
                if (!rows.isEmpty()) lastId = rows.get(rows.size() - 1).id();
                buffer.addAll(rows);
            }
            return !buffer.isEmpty();
        }

        @Override
        public Listen next() {
            if (!hasNext()) throw new NoSuchElementException();
            return buffer.removeFirst();
        }
    }
}
