package com.sandkev.scrobbler.listenbrainz;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandkev.scrobbler.batch.AdaptiveBatcher;
import com.sandkev.scrobbler.batch.EncodedBatch;
import com.sandkev.scrobbler.config.ListenBrainzClientConfig.ListenBrainzClientProperties;
import com.sandkev.scrobbler.listen.Listen;
import com.sandkev.scrobbler.listen.ListenMarker;
import com.sandkev.scrobbler.listen.ListenSource;
import com.sandkev.scrobbler.shared.error.RemoteServiceException;
import com.sandkev.scrobbler.shared.http.RateLimit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ListenBrainzSubmitService {

    private final ListenBrainzClient client;
    private final ListenSource listens;
    private final ListenMarker marker;
    private final RateLimit rateLimit;
    private final ListenBrainzClientProperties props;
    private final ObjectMapper om;
    private final Clock clock;

    /**
     * Submits all eligible listens, in requests that stay under the body size limit.
     * A request is accepted or rejected as a whole; a rejection ends the run.
     */
    public int submitPending() {
        if (!StringUtils.hasText(props.userToken())) {
            log.warn("listenbrainz.client.user-token is not set, authorization will fail.");
        }
        OffsetDateTime now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);

        var batches = new AdaptiveBatcher<>(
                listens.eligible(null),
                this::encode,
                props.maxBodyBytes(),
                props.assumedListenBytes(),
                props.batchGrowth());

        int total = 0;
        while (batches.hasNext()) {
            EncodedBatch<Listen> batch = batches.next();
            HttpHeaders headers;
            try {
                headers = client.submitListens(batch.body());
            } catch (RemoteServiceException e) {
                log.error("Unexpected response, status {}:\n{}", e.getStatus(), prettyPrint(e.getResponseBody()));
                throw e;
            }
            List<Long> ids = batch.items().stream().map(Listen::id).toList();
            marker.markScrobbled(ids, now);
            total += ids.size();
            log.info("Submitted {} listens.", ids.size());

            rateLimit.afterSuccess(headers);
        }
        return total;
    }

    byte[] encode(List<Listen> batch) {
        try {
            return om.writeValueAsBytes(ListenBrainzPayload.importOf(batch));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private String prettyPrint(String body) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(om.readTree(body));
        } catch (JsonProcessingException e) {
            return body;
        }
    }
}
