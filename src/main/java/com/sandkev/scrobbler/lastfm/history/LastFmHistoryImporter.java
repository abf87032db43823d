package com.sandkev.scrobbler.lastfm.history;

import com.sandkev.scrobbler.config.LastFmClientConfig.LastFmClientProperties;
import com.sandkev.scrobbler.config.LastFmClientConfig.LastFmImportProperties;
import com.sandkev.scrobbler.lastfm.LastFmResponses;
import com.sandkev.scrobbler.lastfm.LastFmSignedClient;
import com.sandkev.scrobbler.shared.error.ImportAbortedException;
import com.sandkev.scrobbler.shared.error.ProtocolInvariantException;
import com.sandkev.scrobbler.shared.http.Sleeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pulls the user's Last.fm history into the {@code lastfm_import} staging table.
 * <p>
 * Pages arrive most recent first. After every page we compare the number of staged rows in the
 * imported range with the total Last.fm reports, and stop as soon as they agree or the last page
 * is done. The two counts can be off by a few for reasons on Last.fm's side, hence both conditions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LastFmHistoryImporter {

    private final LastFmSignedClient client;
    private final LastFmResponses responses;
    private final LastFmStagingDao staging;
    private final TransactionTemplate tx;
    private final LastFmClientProperties clientProps;
    private final LastFmImportProperties props;
    private final Sleeper sleeper;
    private final Clock clock;

    /** Imports everything Last.fm has. */
    public ImportResult importFull() {
        return importSince(null);
    }

    /**
     * Imports the recent window only, or less when we already staged listens inside that window.
     */
    public ImportResult importIncremental() {
        Instant windowStart = clock.instant().minus(props.incrementalWindow());
        Instant bound = staging.latest()
                .filter(latest -> latest.isAfter(windowStart))
                .orElse(windowStart);
        return importSince(bound);
    }

    ImportResult importSince(@Nullable Instant lowerBound) {
        if (!StringUtils.hasText(clientProps.user())) log.warn("lastfm.client.user is not set, the import will fail.");
        if (!StringUtils.hasText(clientProps.apiKey())) log.warn("lastfm.client.api-key is not set, the import will fail.");
        log.info("Importing Last.fm history of {} {}", clientProps.user(),
                lowerBound == null ? "(full)" : "after " + lowerBound);

        int page = 1;
        int pagesFetched = 0;
        int inserted = 0;
        int consecutiveErrors = 0;

        while (true) {
            PageOutcome outcome;
            try {
                outcome = importPage(page, lowerBound);
            } catch (RuntimeException e) {
                consecutiveErrors++;
                log.warn("Page {} failed ({}/{}): {}", page, consecutiveErrors, props.maxConsecutiveErrors(), e.toString());
                if (consecutiveErrors >= props.maxConsecutiveErrors()) {
                    throw new ImportAbortedException(page, consecutiveErrors, e);
                }
                sleeper.sleep(props.retryBackoff());
                continue;
            }
            consecutiveErrors = 0;
            pagesFetched++;
            inserted += outcome.inserted();

            RecentTracksPage.Attr attr = outcome.attr();
            long localCount = staging.countAfter(lowerBound);
            log.info("Imported page {} of {}: {} new, {} of {} listens staged",
                    page, attr.totalPages(), outcome.inserted(), localCount, attr.total());

            if (localCount == attr.total() || page >= attr.totalPages()) {
                return new ImportResult(lowerBound, pagesFetched, inserted, localCount, attr.total());
            }
            page++;
        }
    }

    private PageOutcome importPage(int page, @Nullable Instant lowerBound) {
        String body = client.getPublic(pageParams(page, lowerBound));
        RecentTracksPage decoded = responses.recentTracks(body);
        if (decoded.attr() == null) {
            throw new ProtocolInvariantException("Last.fm page " + page + " has no paging attributes", body);
        }
        List<StagedScrobble> rows = decoded.tracks().stream()
                .filter(t -> !t.nowPlaying())
                .map(StagedScrobble::from)
                .toList();

        // a failure here rolls back the whole page
        Integer n = tx.execute(status -> staging.upsert(rows));
        return new PageOutcome(decoded.attr(), n == null ? 0 : n);
    }

    private Map<String, String> pageParams(int page, @Nullable Instant lowerBound) {
        var p = new LinkedHashMap<String, String>();
        p.put("method", "user.getRecentTracks");
        p.put("user", clientProps.user());
        p.put("limit", String.valueOf(props.pageSize()));
        p.put("page", String.valueOf(page));
        if (lowerBound != null) p.put("from", String.valueOf(lowerBound.getEpochSecond()));
        return p;
    }

    private record PageOutcome(RecentTracksPage.Attr attr, int inserted) {}
}
