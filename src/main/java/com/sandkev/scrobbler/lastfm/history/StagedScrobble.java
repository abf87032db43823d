package com.sandkev.scrobbler.lastfm.history;

import org.springframework.lang.Nullable;

/** A listen as Last.fm recorded it; (secondsSinceEpoch, trackTitle, trackArtist, albumTitle) is the key. */
public record StagedScrobble(
        long secondsSinceEpoch,
        String trackTitle,
        String trackArtist,
        String albumTitle,
        @Nullable String trackMbid,
        @Nullable String artistMbid,
        @Nullable String albumMbid
) {

    static StagedScrobble from(RecentTracksPage.Track t) {
        return new StagedScrobble(
                t.date().uts(),
                Mojibake.repair(nz(t.name())),
                Mojibake.repair(t.artist() == null ? "" : nz(t.artist().text())),
                Mojibake.repair(t.album() == null ? "" : nz(t.album().text())),
                blankToNull(t.mbid()),
                t.artist() == null ? null : blankToNull(t.artist().mbid()),
                t.album() == null ? null : blankToNull(t.album().mbid())
        );
    }

    private static String nz(String s) { return s == null ? "" : s; }

    private static String blankToNull(String s) { return s == null || s.isBlank() ? null : s; }
}
