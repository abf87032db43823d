package com.sandkev.scrobbler.shared.error;

/**
 * Base of the failures that end a submission or import run.
 * Anything thrown as a subclass of this is reported and turned into a nonzero exit code.
 */
public abstract class ScrobblerException extends RuntimeException {

    protected ScrobblerException(String message) {
        super(message);
    }

    protected ScrobblerException(String message, Throwable cause) {
        super(message, cause);
    }
}
