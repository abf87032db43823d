package com.sandkev.scrobbler.legacy;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;

/** Streams a json-lines event log, one {@link LegacyEvent} per line, without loading the whole file. */
@Component
@RequiredArgsConstructor
public class EventLogReader {

    private final ObjectMapper om;

    /** The caller closes the returned iterator, which closes the reader. */
    public MappingIterator<LegacyEvent> read(Reader log) throws IOException {
        return om.readerFor(LegacyEvent.class).readValues(log);
    }
}
