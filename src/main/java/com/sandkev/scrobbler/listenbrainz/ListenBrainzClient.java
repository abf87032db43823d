package com.sandkev.scrobbler.listenbrainz;

import org.springframework.http.HttpHeaders;

public interface ListenBrainzClient {

    /**
     * POSTs an already encoded submit-listens body. Returns the response headers of a 200 response;
     * any error status surfaces as a {@link com.sandkev.scrobbler.shared.error.RemoteServiceException}.
     */
    HttpHeaders submitListens(byte[] jsonBody);
}
