package com.sandkev.scrobbler.listenbrainz;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.scrobbler.config.ListenBrainzClientConfig.ListenBrainzClientProperties;
import com.sandkev.scrobbler.listen.Listen;
import com.sandkev.scrobbler.shared.error.RemoteServiceException;
import com.sandkev.scrobbler.shared.http.RateLimit;
import com.sandkev.scrobbler.testsupport.CapturingListenMarker;
import com.sandkev.scrobbler.testsupport.InMemoryListenSource;
import com.sandkev.scrobbler.testsupport.Listens;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListenBrainzSubmitServiceTest {

    private final ObjectMapper om = new ObjectMapper();
    private final ListenBrainzClientProperties props =
            new ListenBrainzClientProperties("http://unused", "token", 5_000, 10_240, 215, 5);
    private final CapturingListenMarker marker = new CapturingListenMarker();
    private final List<Duration> sleeps = new ArrayList<>();
    private final List<byte[]> bodies = new ArrayList<>();

    @Test
    void submitsEverythingInBodiesUnderTheLimit() throws Exception {
        var source = new InMemoryListenSource(Listens.listens(300));

        int submitted = service(body -> {
            bodies.add(body);
            return new HttpHeaders();
        }, source).submitPending();

        assertThat(submitted).isEqualTo(300);
        assertThat(bodies).allSatisfy(b -> assertThat(b.length).isLessThanOrEqualTo(10_240));
        assertThat(marker.markedIds()).containsExactlyElementsOf(
                Listens.listens(300).stream().map(Listen::id).toList());
        assertThat(source.requestedBounds()).containsExactly((Instant) null);

        int inBodies = 0;
        for (byte[] b : bodies) {
            JsonNode root = om.readTree(b);
            assertThat(root.get("listen_type").asText()).isEqualTo("import");
            inBodies += root.get("payload").size();
        }
        assertThat(inBodies).isEqualTo(300);
    }

    @Test
    void payloadCarriesTrackMetadata() throws Exception {
        Listen listen = Listens.listen(1);

        JsonNode submission = om.readTree(service(b -> new HttpHeaders(), new InMemoryListenSource(List.of()))
                .encode(List.of(listen))).get("payload").get(0);

        assertThat(submission.get("listened_at").asLong()).isEqualTo(listen.startedAt().toEpochSecond());
        JsonNode meta = submission.get("track_metadata");
        assertThat(meta.get("track_name").asText()).isEqualTo("Track 1");
        assertThat(meta.get("artist_name").asText()).isEqualTo("Artist");
        assertThat(meta.get("release_name").asText()).isEqualTo("Album");
        assertThat(meta.get("additional_info").get("listening_from").asText()).isEqualTo("Musium");
        assertThat(meta.get("additional_info").get("tracknumber").asInt()).isEqualTo(listen.trackNumber());
    }

    @Test
    void rejectionEndsTheRunAndLeavesTheBatchUnmarked() {
        var source = new InMemoryListenSource(Listens.listens(300));
        int[] calls = {0};

        assertThatThrownBy(() -> service(body -> {
            if (++calls[0] == 2) throw new RemoteServiceException("ListenBrainz", 400, "{\"code\": 400, \"error\": \"bad\"}");
            return new HttpHeaders();
        }, source).submitPending())
                .isInstanceOf(RemoteServiceException.class);

        // only the first request was accepted
        assertThat(marker.calls()).hasSize(1);
        assertThat(marker.markedIds()).startsWith(1L, 2L, 3L).doesNotContain(300L);
    }

    @Test
    void pausesWhenTheQuotaRunsOut() {
        var source = new InMemoryListenSource(Listens.listens(10));

        service(body -> {
            var h = new HttpHeaders();
            h.add(RateLimit.REMAINING, "1");
            h.add(RateLimit.RESET_IN, "2");
            return h;
        }, source).submitPending();

        assertThat(sleeps).containsExactly(Duration.ofSeconds(2));
    }

    @Test
    void nothingEligibleMeansNoRequests() {
        int submitted = service(body -> {
            bodies.add(body);
            return new HttpHeaders();
        }, new InMemoryListenSource(List.of())).submitPending();

        assertThat(submitted).isZero();
        assertThat(bodies).isEmpty();
        assertThat(marker.calls()).isEmpty();
    }

    private ListenBrainzSubmitService service(ListenBrainzClient client, InMemoryListenSource source) {
        return new ListenBrainzSubmitService(client, source, marker, new RateLimit(sleeps::add), props, om,
                Clock.fixed(Instant.parse("2024-05-10T12:00:00Z"), ZoneOffset.UTC));
    }
}
