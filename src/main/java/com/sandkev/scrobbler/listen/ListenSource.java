package com.sandkev.scrobbler.listen;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;

/** Read side of the listens store: listens that still need to be submitted. */
public interface ListenSource {

    /** Listens shorter than this are never submitted (Last.fm scrobbling guideline). */
    Duration MIN_PLAYED = Duration.ofSeconds(30);

    /**
     * Unsubmitted listens produced by Musium itself, played for more than {@link #MIN_PLAYED},
     * in ascending id order. The iterator is lazy and single-pass.
     *
     * @param startedAfter when set, only listens that started strictly after this instant
     */
    Iterator<Listen> eligible(@Nullable Instant startedAfter);
}
