package com.sandkev.scrobbler.listen;

import java.time.OffsetDateTime;
import java.util.Collection;

public interface ListenMarker {

    /**
     * Records that the given listens were accepted by the remote service at {@code at}.
     * Listens that already carry a marker keep their original one. Returns the number of rows changed.
     */
    int markScrobbled(Collection<Long> listenIds, OffsetDateTime at);
}
