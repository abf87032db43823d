package com.sandkev.scrobbler.listenbrainz;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.sandkev.scrobbler.config.ListenBrainzClientConfig;
import com.sandkev.scrobbler.config.ListenBrainzClientConfig.ListenBrainzClientProperties;
import com.sandkev.scrobbler.shared.error.RemoteServiceException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;

import java.nio.charset.StandardCharsets;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListenBrainzClientImplTest {

    private WireMockServer wm;
    private ListenBrainzClient client;

    @BeforeEach
    void setUp() {
        wm = new WireMockServer(0);
        wm.start();
        var props = new ListenBrainzClientProperties("http://localhost:" + wm.port(), "user-token", 5_000, 10_240, 215, 5);
        var config = new ListenBrainzClientConfig(props);
        client = config.listenBrainzClient(config.listenBrainzWebClient());
    }

    @AfterEach
    void tearDown() {
        wm.stop();
    }

    @Test
    void postsJsonWithTokenAndReturnsHeaders() {
        wm.stubFor(post(urlEqualTo("/1/submit-listens")).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "application/json")
                .withHeader("X-RateLimit-Remaining", "1")
                .withHeader("X-RateLimit-Reset-In", "3")
                .withBody("{\"status\": \"ok\"}")));

        HttpHeaders headers = client.submitListens("{\"listen_type\":\"import\",\"payload\":[]}".getBytes(StandardCharsets.UTF_8));

        assertThat(headers.getFirst("X-RateLimit-Remaining")).isEqualTo("1");
        var req = wm.getAllServeEvents().get(0).getRequest();
        assertThat(req.getHeader("Authorization")).isEqualTo("Token user-token");
        assertThat(req.getHeader("Content-Type")).startsWith("application/json");
        assertThat(req.getBodyAsString()).isEqualTo("{\"listen_type\":\"import\",\"payload\":[]}");
    }

    @Test
    void tooManyRequestsSurfacesWithBody() {
        wm.stubFor(post(urlEqualTo("/1/submit-listens")).willReturn(aResponse()
                .withStatus(429).withBody("{\"code\": 429, \"error\": \"Too many requests\"}")));

        assertThatThrownBy(() -> client.submitListens(new byte[]{'{', '}'}))
                .isInstanceOfSatisfying(RemoteServiceException.class, e -> {
                    assertThat(e.getService()).isEqualTo("ListenBrainz");
                    assertThat(e.getStatus()).isEqualTo(429);
                    assertThat(e.getResponseBody()).contains("Too many requests");
                });
    }

    @Test
    void rejectedBodySurfacesWithStatus() {
        wm.stubFor(post(urlEqualTo("/1/submit-listens")).willReturn(aResponse()
                .withStatus(400).withBody("{\"code\": 400, \"error\": \"JSON document is too large.\"}")));

        assertThatThrownBy(() -> client.submitListens(new byte[]{'{', '}'}))
                .isInstanceOf(RemoteServiceException.class)
                .hasMessageContaining("status 400")
                .hasMessageContaining("too large");
    }

    @Test
    void nonOkSuccessStatusIsAnError() {
        wm.stubFor(post(urlEqualTo("/1/submit-listens")).willReturn(aResponse().withStatus(204)));

        assertThatThrownBy(() -> client.submitListens(new byte[]{'{', '}'}))
                .isInstanceOfSatisfying(RemoteServiceException.class, e -> assertThat(e.getStatus()).isEqualTo(204));
    }
}
