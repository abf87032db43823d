package com.sandkev.scrobbler.shared.error;

import lombok.Getter;

/**
 * The remote response contradicts itself (e.g. per-item results do not add up to the
 * reported accepted count). Not retryable: it means the protocol changed or we have a bug.
 */
@Getter
public class ProtocolInvariantException extends ScrobblerException {

    private final String responseBody;

    public ProtocolInvariantException(String message, String responseBody) {
        super(message);
        this.responseBody = responseBody;
    }
}
