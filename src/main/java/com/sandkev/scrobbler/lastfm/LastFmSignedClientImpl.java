package com.sandkev.scrobbler.lastfm;

import com.sandkev.scrobbler.shared.error.RemoteServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * All Last.fm API methods live on a single endpoint and are selected with the
 * {@code method} parameter. Write methods are POSTed as a form body; reads use the query string.
 */
@Slf4j
@RequiredArgsConstructor
public class LastFmSignedClientImpl implements LastFmSignedClient {

    private static final String SERVICE = "Last.fm";

    private final WebClient lastFmWebClient;
    private final LastFmRequestSigner signer;
    private final String baseUrl;

    @Override
    public String post(Map<String, String> params) {
        String body = LastFmRequestSigner.encode(signer.sign(params));
        log.debug("Last.fm signed POST: method={}", params.get("method"));

        return lastFmWebClient.post()
                .uri(URI.create(baseUrl))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .bodyValue(body)
                .retrieve()
                .onStatus(s -> s.value() >= 400, r -> r.bodyToMono(String.class).defaultIfEmpty("")
                        .map(err -> new RemoteServiceException(SERVICE, r.statusCode().value(), err)))
                .bodyToMono(String.class)
                .block();
    }

    @Override
    public String get(Map<String, String> params) {
        log.debug("Last.fm signed GET: method={}", params.get("method"));
        return doGet(LastFmRequestSigner.encode(signer.sign(params)));
    }

    @Override
    public String getPublic(Map<String, String> params) {
        var all = new LinkedHashMap<String, String>(params);
        all.put("api_key", signer.apiKey());
        all.put("format", "json");
        log.debug("Last.fm public GET: method={} page={}", params.get("method"), params.get("page"));
        return doGet(LastFmRequestSigner.encode(all));
    }

    private String doGet(String query) {
        // the query is already encoded, URI.create keeps it as is
        return lastFmWebClient.get()
                .uri(URI.create(baseUrl + "?" + query))
                .retrieve()
                .onStatus(s -> s.value() >= 400, r -> r.bodyToMono(String.class).defaultIfEmpty("")
                        .map(err -> new RemoteServiceException(SERVICE, r.statusCode().value(), err)))
                .bodyToMono(String.class)
                .block();
    }
}
