package com.sandkev.scrobbler.lastfm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.scrobbler.lastfm.history.RecentTracksPage;
import com.sandkev.scrobbler.shared.error.ProtocolInvariantException;
import com.sandkev.scrobbler.shared.error.RemoteServiceException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns Last.fm response bodies into typed values before anything acts on them.
 * An {@code {"error": n, "message": ...}} payload becomes a {@link RemoteServiceException},
 * also when it arrives with status 200.
 */
@Component
@RequiredArgsConstructor
public class LastFmResponses {

    private final ObjectMapper om;

    public ScrobbleResponse scrobbles(String body) {
        JsonNode root = parse(body);
        if (!root.path("scrobbles").isObject()) {
            throw new ProtocolInvariantException("Last.fm scrobble response has no 'scrobbles' object", body);
        }
        return convert(root, ScrobbleResponse.class, body);
    }

    public String token(String body) {
        String token = parse(body).path("token").asText("");
        if (token.isEmpty()) throw new ProtocolInvariantException("Last.fm response has no token", body);
        return token;
    }

    public LastFmSession session(String body) {
        JsonNode session = parse(body).path("session");
        if (!session.isObject()) throw new ProtocolInvariantException("Last.fm response has no session", body);
        return convert(session, LastFmSession.class, body);
    }

    public RecentTracksPage recentTracks(String body) {
        JsonNode root = parse(body);
        if (!root.path("recenttracks").isObject()) {
            throw new ProtocolInvariantException("Last.fm response has no 'recenttracks' object", body);
        }
        return convert(root, RecentTracksPage.class, body);
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            throw new ProtocolInvariantException("Empty Last.fm response", "");
        }
        JsonNode root;
        try {
            root = om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProtocolInvariantException("Last.fm response is not json: " + e.getOriginalMessage(), body);
        }
        if (root.has("error")) {
            throw new RemoteServiceException("Last.fm", 200, body);
        }
        return root;
    }

    private <T> T convert(JsonNode node, Class<T> type, String body) {
        try {
            return om.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new ProtocolInvariantException("Unexpected Last.fm response shape: " + e.getOriginalMessage(), body);
        }
    }
}
