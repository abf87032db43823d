package com.sandkev.scrobbler.shared.error;

import lombok.Getter;

/** The remote service answered with an error status or an error payload. */
@Getter
public class RemoteServiceException extends ScrobblerException {

    private final String service;
    private final int status;
    private final String responseBody;

    public RemoteServiceException(String service, int status, String responseBody) {
        super(service + " returned an error, status " + status + ": " + responseBody);
        this.service = service;
        this.status = status;
        this.responseBody = responseBody;
    }
}
