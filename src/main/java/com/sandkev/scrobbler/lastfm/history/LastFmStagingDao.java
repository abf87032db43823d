package com.sandkev.scrobbler.lastfm.history;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface LastFmStagingDao {

    /** Insert-or-ignore on the natural key; returns how many rows were new. */
    int upsert(List<StagedScrobble> rows);

    /** Rows with a timestamp strictly after {@code after}, or all rows when it is null. */
    long countAfter(@Nullable Instant after);

    Optional<Instant> latest();
}
