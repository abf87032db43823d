package com.sandkev.scrobbler.shared.http;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Obeys the quota a service advertises in its response headers, see
 * https://listenbrainz.readthedocs.io/en/latest/users/api/index.html#rate-limiting.
 * We never let the number of remaining calls drop to 0.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimit {

    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET_IN = "X-RateLimit-Reset-In";

    static final int DEFAULT_REMAINING = 10;
    static final double DEFAULT_RESET_IN_SECONDS = 1.0;

    private final Sleeper sleeper;

    /** Call after every successful request; returns how long we paused (zero when not throttled). */
    public Duration afterSuccess(HttpHeaders headers) {
        int remaining = parseInt(headers.getFirst(REMAINING), DEFAULT_REMAINING);
        if (remaining > 1) return Duration.ZERO;

        double resetIn = parseDouble(headers.getFirst(RESET_IN), DEFAULT_RESET_IN_SECONDS);
        Duration pause = Duration.ofMillis(Math.max(0L, Math.round(resetIn * 1000.0)));
        log.info("Rate limit remaining={}, pausing {} ms", remaining, pause.toMillis());
        sleeper.sleep(pause);
        return pause;
    }

    private static int parseInt(String v, int fallback) {
        if (v == null || v.isBlank()) return fallback;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed {} header '{}'", REMAINING, v);
            return fallback;
        }
    }

    private static double parseDouble(String v, double fallback) {
        if (v == null || v.isBlank()) return fallback;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed {} header '{}'", RESET_IN, v);
            return fallback;
        }
    }
}
