package com.sandkev.scrobbler.batch;

import java.util.List;

/** Items of one request together with the exact body that was measured against the budget. */
public record EncodedBatch<T>(List<T> items, byte[] body) {

    public int size() {
        return items.size();
    }
}
