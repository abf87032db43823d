package com.sandkev.scrobbler.shared.error;

/** A single item serializes to more bytes than the remote accepts in one request. */
public class BatchTooLargeException extends ScrobblerException {

    public BatchTooLargeException(int itemBytes, int maxBytes) {
        super("A single item encodes to " + itemBytes + " bytes, the limit is " + maxBytes + " bytes");
    }
}
