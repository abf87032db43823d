package com.sandkev.scrobbler.listen;

public interface ListenWriter {

    /** Inserts a Musium-produced listen; returns false when a listen with the same start already exists. */
    boolean insertIfAbsent(Listen listen);
}
