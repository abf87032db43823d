package com.sandkev.scrobbler.listenbrainz;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sandkev.scrobbler.listen.Listen;

import java.util.List;

/**
 * Body of {@code POST /1/submit-listens}, see
 * https://listenbrainz.readthedocs.io/en/latest/users/json.html.
 */
public record ListenBrainzPayload(
        @JsonProperty("listen_type") String listenType,
        List<Submission> payload
) {

    public static ListenBrainzPayload importOf(List<Listen> listens) {
        return new ListenBrainzPayload("import", listens.stream().map(Submission::of).toList());
    }

    public record Submission(
            @JsonProperty("listened_at") long listenedAt,
            @JsonProperty("track_metadata") TrackMetadata trackMetadata
    ) {
        static Submission of(Listen l) {
            return new Submission(l.startedAtEpochSecond(), new TrackMetadata(
                    new AdditionalInfo("Musium", l.trackNumber()),
                    l.trackArtist(),
                    l.trackTitle(),
                    l.albumTitle()
            ));
        }
    }

    // TODO: add recording/release MBIDs once the listens table stores them
    public record TrackMetadata(
            @JsonProperty("additional_info") AdditionalInfo additionalInfo,
            @JsonProperty("artist_name") String artistName,
            @JsonProperty("track_name") String trackName,
            @JsonProperty("release_name") String releaseName
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AdditionalInfo(
            @JsonProperty("listening_from") String listeningFrom,
            @JsonProperty("tracknumber") Integer trackNumber
    ) {}
}
