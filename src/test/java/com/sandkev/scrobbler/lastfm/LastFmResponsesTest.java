package com.sandkev.scrobbler.lastfm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.scrobbler.lastfm.history.RecentTracksPage;
import com.sandkev.scrobbler.shared.error.ProtocolInvariantException;
import com.sandkev.scrobbler.shared.error.RemoteServiceException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LastFmResponsesTest {

    private final LastFmResponses responses = new LastFmResponses(new ObjectMapper());

    @Test
    void singleScrobbleObjectBecomesAOneElementList() {
        ScrobbleResponse r = responses.scrobbles("""
                {"scrobbles": {"scrobble": {"artist": {"corrected": "0", "#text": "Björk"},
                                             "track": {"corrected": "0", "#text": "Jóga"},
                                             "timestamp": "1700000000",
                                             "ignoredMessage": {"code": "0", "#text": ""}},
                               "@attr": {"ignored": 0, "accepted": 1}}}
                """);

        assertThat(r.scrobbles().items()).hasSize(1);
        assertThat(r.scrobbles().items().get(0).accepted()).isTrue();
        assertThat(r.scrobbles().items().get(0).artist().text()).isEqualTo("Björk");
        assertThat(r.scrobbles().attr().accepted()).isEqualTo(1);
    }

    @Test
    void listOfScrobblesWithARejection() {
        ScrobbleResponse r = responses.scrobbles("""
                {"scrobbles": {"scrobble": [
                   {"ignoredMessage": {"code": "0", "#text": ""}},
                   {"ignoredMessage": {"code": "1", "#text": "Artist was ignored"}}
                 ], "@attr": {"ignored": "1", "accepted": "1"}}}
                """);

        assertThat(r.scrobbles().items()).extracting(ScrobbleResponse.Item::accepted).containsExactly(true, false);
        assertThat(r.scrobbles().attr().ignored()).isEqualTo(1);
    }

    @Test
    void errorPayloadIsARemoteError() {
        assertThatThrownBy(() -> responses.scrobbles("{\"error\": 9, \"message\": \"Invalid session key\"}"))
                .isInstanceOf(RemoteServiceException.class)
                .hasMessageContaining("Invalid session key");
    }

    @Test
    void garbageIsAProtocolViolationCarryingTheBody() {
        assertThatThrownBy(() -> responses.scrobbles("<html>oops</html>"))
                .isInstanceOfSatisfying(ProtocolInvariantException.class,
                        e -> assertThat(e.getResponseBody()).isEqualTo("<html>oops</html>"));
    }

    @Test
    void tokenAndSession() {
        assertThat(responses.token("{\"token\": \"abc123\"}")).isEqualTo("abc123");
        LastFmSession s = responses.session("{\"session\": {\"name\": \"ruud\", \"key\": \"sk-1\", \"subscriber\": 0}}");
        assertThat(s).isEqualTo(new LastFmSession("ruud", "sk-1"));
    }

    @Test
    void recentTracksWithASingleTrackAndNowPlaying() {
        RecentTracksPage page = responses.recentTracks("""
                {"recenttracks": {
                   "track": {"artist": {"mbid": "", "#text": "Sigur Rós"}, "name": "Glósóli",
                             "album": {"mbid": "", "#text": "Takk..."}, "mbid": "",
                             "@attr": {"nowplaying": "true"}},
                   "@attr": {"user": "ruud", "totalPages": "3", "page": "1", "perPage": "200", "total": "401"}}}
                """);

        assertThat(page.tracks()).hasSize(1);
        assertThat(page.tracks().get(0).nowPlaying()).isTrue();
        assertThat(page.attr().totalPages()).isEqualTo(3);
        assertThat(page.attr().total()).isEqualTo(401);
    }
}
