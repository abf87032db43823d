package com.sandkev.scrobbler.batch;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Chunks of {@code size} items from the upstream iterator; the last chunk may be smaller.
 * Only one chunk is buffered at a time.
 */
public final class FixedCountBatcher<T> implements Iterator<List<T>> {

    private final Iterator<T> upstream;
    private final int size;

    public FixedCountBatcher(Iterator<T> upstream, int size) {
        if (size < 1) throw new IllegalArgumentException("batch size must be positive: " + size);
        this.upstream = upstream;
        this.size = size;
    }

    @Override
    public boolean hasNext() {
        return upstream.hasNext();
    }

    @Override
    public List<T> next() {
        if (!upstream.hasNext()) throw new NoSuchElementException();
        List<T> chunk = new ArrayList<>(size);
        while (chunk.size() < size && upstream.hasNext()) {
            chunk.add(upstream.next());
        }
        return chunk;
    }
}
