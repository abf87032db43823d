package com.sandkev.scrobbler.shared.error;

import lombok.Getter;

@Getter
public class ImportAbortedException extends ScrobblerException {

    private final int page;

    public ImportAbortedException(int page, int attempts, Throwable lastFailure) {
        super("Giving up on page " + page + " after " + attempts + " consecutive failures", lastFailure);
        this.page = page;
    }
}
