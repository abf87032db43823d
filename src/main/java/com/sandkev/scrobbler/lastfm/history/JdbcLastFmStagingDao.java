package com.sandkev.scrobbler.lastfm.history;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class JdbcLastFmStagingDao implements LastFmStagingDao {

    private final JdbcTemplate jdbc;

    @Override
    public int upsert(List<StagedScrobble> rows) {
        if (rows.isEmpty()) return 0;
        List<Object[]> args = new ArrayList<>(rows.size());
        for (StagedScrobble r : rows) {
            args.add(new Object[]{
                    r.secondsSinceEpoch(), r.trackTitle(), r.trackArtist(), r.albumTitle(),
                    r.trackMbid(), r.artistMbid(), r.albumMbid()
            });
        }
        int[] counts = jdbc.batchUpdate("""
            insert or ignore into lastfm_import
              ( seconds_since_epoch, track_title, track_artist, album_title
              , track_mbid, artist_mbid, album_mbid )
            values (?, ?, ?, ?, ?, ?, ?)
        """, args);
        return Arrays.stream(counts).map(c -> Math.max(c, 0)).sum();
    }

    @Override
    public long countAfter(@Nullable Instant after) {
        Long n = after == null
                ? jdbc.queryForObject("select count(*) from lastfm_import", Long.class)
                : jdbc.queryForObject("select count(*) from lastfm_import where seconds_since_epoch > ?",
                        Long.class, after.getEpochSecond());
        return n == null ? 0L : n;
    }

    @Override
    public Optional<Instant> latest() {
        Long max = jdbc.queryForObject("select max(seconds_since_epoch) from lastfm_import", Long.class);
        return Optional.ofNullable(max).map(Instant::ofEpochSecond);
    }
}
