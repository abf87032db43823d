package com.sandkev.scrobbler.batch;

import com.sandkev.scrobbler.shared.error.BatchTooLargeException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Splits a stream of items into request bodies that fit a byte budget, without knowing the
 * encoded size of an item up front.
 * <p>
 * We start from a guess ({@code maxBytes / assumedItemBytes} items per batch). When a tentative
 * batch encodes too large, the batch size shrinks by one and we try again; every batch that fits
 * grows the size for the next round by {@code growth}. Most batches fit, so the one-at-a-time
 * shrinking is rare.
 */
@Slf4j
public final class AdaptiveBatcher<T> implements Iterator<EncodedBatch<T>> {

    private final Iterator<T> upstream;
    private final Function<List<T>, byte[]> encoder;
    private final int maxBytes;
    private final int growth;

    private final List<T> buffer = new ArrayList<>();
    private boolean upstreamDone;
    private int n;
    private EncodedBatch<T> pending;

    public AdaptiveBatcher(Iterator<T> upstream,
                           Function<List<T>, byte[]> encoder,
                           int maxBytes,
                           int assumedItemBytes,
                           int growth) {
        if (maxBytes < 1 || assumedItemBytes < 1) {
            throw new IllegalArgumentException("maxBytes and assumedItemBytes must be positive");
        }
        if (growth < 0) throw new IllegalArgumentException("growth must not be negative: " + growth);
        this.upstream = upstream;
        this.encoder = encoder;
        this.maxBytes = maxBytes;
        this.growth = growth;
        this.n = Math.max(1, maxBytes / assumedItemBytes);
    }

    /** Batch size the next tentative batch starts from. */
    public int targetSize() {
        return n;
    }

    @Override
    public boolean hasNext() {
        if (pending == null) pending = advance();
        return pending != null;
    }

    @Override
    public EncodedBatch<T> next() {
        if (!hasNext()) throw new NoSuchElementException();
        EncodedBatch<T> out = pending;
        pending = null;
        return out;
    }

    private EncodedBatch<T> advance() {
        replenish();
        if (buffer.isEmpty()) return null;

        while (true) {
            int take = Math.min(n, buffer.size());
            List<T> tentative = List.copyOf(buffer.subList(0, take));
            byte[] body = encoder.apply(tentative);

            if (body.length <= maxBytes) {
                buffer.subList(0, take).clear();
                n = n + growth;
                return new EncodedBatch<>(tentative, body);
            }

            if (take <= 1) throw new BatchTooLargeException(body.length, maxBytes);
            // shrink below what we just tried, also when the buffer was shorter than n
            n = take - 1;
            log.debug("Batch of {} items is {} bytes, over the {} byte limit; retrying with {}",
                    take, body.length, maxBytes, n);
        }
    }

    private void replenish() {
        while (!upstreamDone && buffer.size() < 2 * n) {
            if (upstream.hasNext()) {
                buffer.add(upstream.next());
            } else {
                upstreamDone = true;
            }
        }
    }
}
