package com.sandkev.scrobbler.lastfm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.scrobbler.batch.FixedCountBatcher;
import com.sandkev.scrobbler.config.LastFmClientConfig.LastFmClientProperties;
import com.sandkev.scrobbler.listen.Listen;
import com.sandkev.scrobbler.listen.ListenMarker;
import com.sandkev.scrobbler.listen.ListenSource;
import com.sandkev.scrobbler.shared.error.ProtocolInvariantException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class LastFmScrobbleService {

    /** Last.fm accepts at most 50 scrobbles per track.scrobble call. */
    public static final int MAX_BATCH = 50;

    /** Last.fm ignores scrobbles whose timestamp is more than 14 days in the past. */
    public static final Duration MAX_BACKDATE = Duration.ofDays(14);

    private final LastFmSignedClient client;
    private final LastFmResponses responses;
    private final ListenSource listens;
    private final ListenMarker marker;
    private final LastFmClientProperties props;
    private final Clock clock;
    private final ObjectMapper om;

    /**
     * Scrobbles all eligible listens from the last 14 days, 50 at a time. Returns how many were accepted.
     * A batch whose per-item results disagree with the accepted count aborts the run before
     * anything of that batch is marked.
     */
    public int scrobblePending() {
        warnIfMissing("api-key", props.apiKey());
        warnIfMissing("secret", props.secret());
        warnIfMissing("session-key", props.sessionKey());

        OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
        Iterator<Listen> eligible = listens.eligible(now.toInstant().minus(MAX_BACKDATE));

        int total = 0;
        var batches = new FixedCountBatcher<>(eligible, MAX_BATCH);
        while (batches.hasNext()) {
            List<Listen> batch = batches.next();
            String body = client.post(scrobbleParams(batch));
            List<Long> accepted = acceptedIds(batch, responses.scrobbles(body), body);

            marker.markScrobbled(accepted, now);
            total += accepted.size();
            log.info("Scrobbled {} listens.", accepted.size());
        }
        return total;
    }

    Map<String, String> scrobbleParams(List<Listen> batch) {
        if (batch.size() > MAX_BATCH) {
            throw new IllegalArgumentException("Last.fm allows at most " + MAX_BATCH + " scrobbles per batch");
        }
        var params = new LinkedHashMap<String, String>();
        params.put("method", "track.scrobble");
        params.put("sk", props.sessionKey());
        for (int i = 0; i < batch.size(); i++) {
            Listen l = batch.get(i);
            params.put("artist[" + i + "]", l.trackArtist());
            params.put("track[" + i + "]", l.trackTitle());
            params.put("timestamp[" + i + "]", String.valueOf(l.startedAtEpochSecond()));
            params.put("album[" + i + "]", l.albumTitle());
            if (l.trackNumber() != null) params.put("trackNumber[" + i + "]", String.valueOf(l.trackNumber()));
            params.put("duration[" + i + "]", String.valueOf(l.durationSeconds()));
            // Last.fm documents albumArtist as optional, but echoes back "" when we leave it out
            params.put("albumArtist[" + i + "]", l.albumArtist());
        }
        return params;
    }

    /**
     * Pairs the submitted listens with the per-item results (same order) and returns the ids
     * Last.fm accepted.
     */
    List<Long> acceptedIds(List<Listen> batch, ScrobbleResponse response, String rawBody) {
        ScrobbleResponse.Scrobbles s = response.scrobbles();
        List<ScrobbleResponse.Item> items = s.items();
        if (items.size() != batch.size()) {
            throw new ProtocolInvariantException("Submitted " + batch.size()
                    + " scrobbles but Last.fm returned " + items.size() + " results", rawBody);
        }
        if (s.attr() == null) {
            throw new ProtocolInvariantException("Last.fm response has no accepted count", rawBody);
        }

        List<Long> accepted = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            Listen listen = batch.get(i);
            ScrobbleResponse.Item item = items.get(i);
            if (item.accepted()) {
                accepted.add(listen.id());
            } else {
                log.error("Last.fm rejected {}, response: {}", listen, toJson(item));
            }
        }

        if (accepted.size() != s.attr().accepted()) {
            throw new ProtocolInvariantException("Last.fm reported " + s.attr().accepted()
                    + " accepted scrobbles, per-item results say " + accepted.size(), rawBody);
        }
        return accepted;
    }

    private String toJson(ScrobbleResponse.Item item) {
        try {
            return om.writeValueAsString(item);
        } catch (JsonProcessingException e) {
            return String.valueOf(item);
        }
    }

    private static void warnIfMissing(String name, String value) {
        if (!StringUtils.hasText(value)) {
            log.warn("lastfm.client.{} is not set, authentication will fail.", name);
        }
    }
}
