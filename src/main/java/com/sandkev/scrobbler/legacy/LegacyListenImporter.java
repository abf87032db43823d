package com.sandkev.scrobbler.legacy;

import com.fasterxml.jackson.databind.MappingIterator;
import com.sandkev.scrobbler.listen.Listen;
import com.sandkev.scrobbler.listen.ListenWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads listens from the old event log into the listens table. From there they are picked up
 * by the regular submission runs, like any other listen Musium recorded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LegacyListenImporter {

    private final EventLogReader reader;
    private final ListenWriter writer;

    public int importLog(Path eventLog) throws IOException {
        int paired = 0;
        int inserted = 0;
        try (Reader in = Files.newBufferedReader(eventLog, StandardCharsets.UTF_8);
             MappingIterator<LegacyEvent> events = reader.read(in)) {
            var listens = new EventPairer(events);
            while (listens.hasNext()) {
                Listen listen = listens.next();
                paired++;
                if (writer.insertIfAbsent(listen)) inserted++;
            }
        }
        log.info("Reconstructed {} listens from {}, {} were new.", paired, eventLog, inserted);
        return inserted;
    }
}
