package com.sandkev.scrobbler.lastfm.history;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of {@code user.getRecentTracks}, most recent first.
 * Like the scrobble response, a page with a single track has a bare object instead of a list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecentTracksPage(RecentTracks recenttracks) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RecentTracks(
            @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<Track> track,
            @JsonProperty("@attr") Attr attr
    ) {
        public List<Track> tracks() {
            return track == null ? List.of() : track;
        }
    }

    /** Last.fm sends these numbers as strings. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Attr(String user, int page, int perPage, int totalPages, int total) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Track(
            Named artist,
            Named album,
            String name,
            String mbid,
            Date date,
            @JsonProperty("@attr") TrackAttr attr
    ) {
        /** The track that is playing right now has no date and is not a scrobble yet. */
        public boolean nowPlaying() {
            return (attr != null && attr.nowplaying()) || date == null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Named(String mbid, @JsonProperty("#text") String text) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Date(long uts) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TrackAttr(boolean nowplaying) {}

    public Attr attr() {
        return recenttracks.attr();
    }

    public List<Track> tracks() {
        return recenttracks.tracks();
    }
}
