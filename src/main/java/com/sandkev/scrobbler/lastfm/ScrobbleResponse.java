package com.sandkev.scrobbler.lastfm;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response of {@code track.scrobble}.
 * <pre>
 * {"scrobbles": {"@attr": {"accepted": 2, "ignored": 0},
 *                "scrobble": [ {"track": {...}, "ignoredMessage": {"code": "0", "#text": ""}, ...}, ... ]}}
 * </pre>
 * Last.fm derives its json from xml: a repeated element becomes a list, but a single one is
 * a bare object. {@code ACCEPT_SINGLE_VALUE_AS_ARRAY} turns the single object back into a list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScrobbleResponse(Scrobbles scrobbles) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Scrobbles(
            @JsonProperty("@attr") Counts attr,
            @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<Item> scrobble
    ) {
        public List<Item> items() {
            return scrobble == null ? List.of() : scrobble;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Counts(int accepted, int ignored) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(
            Text track,
            Text artist,
            Text album,
            Text albumArtist,
            String timestamp,
            Text ignoredMessage
    ) {
        /** Rejected items carry a nonzero code; the code itself is not reliable enough to act on. */
        public boolean accepted() {
            return ignoredMessage != null && "0".equals(ignoredMessage.code());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Text(String code, String corrected, @JsonProperty("#text") String text) {}
}
