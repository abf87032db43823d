package com.sandkev.scrobbler.shared.http;

import java.time.Duration;

/** Blocking pause between remote calls. Tests substitute a recording implementation. */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration);

    static Sleeper threadSleep() {
        return d -> {
            try {
                Thread.sleep(d.toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        };
    }
}
