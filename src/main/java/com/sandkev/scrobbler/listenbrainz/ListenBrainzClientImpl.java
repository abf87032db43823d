package com.sandkev.scrobbler.listenbrainz;

import com.sandkev.scrobbler.shared.error.RemoteServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.charset.StandardCharsets;

/** The Authorization: Token header is set on the WebClient, see ListenBrainzClientConfig. */
@Slf4j
@RequiredArgsConstructor
public class ListenBrainzClientImpl implements ListenBrainzClient {

    static final String SUBMIT_LISTENS = "/1/submit-listens";

    private final WebClient listenBrainzWebClient;

    @Override
    public HttpHeaders submitListens(byte[] jsonBody) {
        log.debug("ListenBrainz POST {} ({} bytes)", SUBMIT_LISTENS, jsonBody.length);
        ResponseEntity<String> response = listenBrainzWebClient.post()
                .uri(SUBMIT_LISTENS)
                .contentType(new MediaType(MediaType.APPLICATION_JSON, StandardCharsets.UTF_8))
                .bodyValue(jsonBody)
                .retrieve()
                .onStatus(s -> s.value() >= 400, r -> r.bodyToMono(String.class).defaultIfEmpty("")
                        .map(err -> new RemoteServiceException("ListenBrainz", r.statusCode().value(), err)))
                .toEntity(String.class)
                .block();

        if (response == null) {
            throw new RemoteServiceException("ListenBrainz", 0, "no response");
        }
        if (response.getStatusCode().value() != HttpStatus.OK.value()) {
            throw new RemoteServiceException("ListenBrainz", response.getStatusCode().value(),
                    response.getBody() == null ? "" : response.getBody());
        }
        return response.getHeaders();
    }
}
