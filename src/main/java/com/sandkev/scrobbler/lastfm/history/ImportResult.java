package com.sandkev.scrobbler.lastfm.history;

import org.springframework.lang.Nullable;

import java.time.Instant;

/** Outcome of one history import run. */
public record ImportResult(
        @Nullable Instant lowerBound,
        int pagesFetched,
        int rowsInserted,
        long localCount,
        long remoteTotal
) {
    public boolean reconciled() {
        return localCount == remoteTotal;
    }
}
