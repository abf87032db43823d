package com.sandkev.scrobbler.lastfm;

import com.sandkev.scrobbler.config.LastFmClientConfig.LastFmClientProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Desktop-style authentication, https://www.last.fm/api/desktopauth:
 * fetch a token, let the user authorize it in a browser, then trade it for a session key.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LastFmAuthService {

    private final LastFmSignedClient client;
    private final LastFmResponses responses;
    private final LastFmClientProperties props;

    public String requestToken() {
        if (!StringUtils.hasText(props.apiKey())) log.warn("lastfm.client.api-key is not set, authentication will fail.");
        if (!StringUtils.hasText(props.secret())) log.warn("lastfm.client.secret is not set, authentication will fail.");
        return responses.token(client.get(Map.of("method", "auth.getToken")));
    }

    public String authorizeUrl(String token) {
        return UriComponentsBuilder.fromHttpUrl(props.authUrl())
                .queryParam("api_key", props.apiKey())
                .queryParam("token", token)
                .toUriString();
    }

    /** Only succeeds after the user authorized the token. */
    public LastFmSession fetchSession(String token) {
        return responses.session(client.get(Map.of("method", "auth.getSession", "token", token)));
    }
}
