package com.sandkev.scrobbler.listen;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class JdbcListenMarker implements ListenMarker {

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;

    /**
     * The store checks {@code started_at < scrobbled_at} on the text, so the marker is written
     * in the offset of the listen's own start time.
     */
    @Override
    public int markScrobbled(Collection<Long> listenIds, OffsetDateTime at) {
        if (listenIds.isEmpty()) return 0;

        Integer changed = tx.execute(status -> {
            List<Object[]> args = new ArrayList<>(listenIds.size());
            for (Long id : listenIds) {
                // "is null" keeps the first marker: marking twice is the same as marking once
                List<String> startedAt = jdbc.queryForList(
                        "select started_at from listens where id = ? and scrobbled_at is null", String.class, id);
                if (startedAt.isEmpty()) continue;
                var offset = Listen.parseTimestamp(startedAt.get(0)).getOffset();
                args.add(new Object[]{Listen.formatTimestamp(at.withOffsetSameInstant(offset)), id});
            }
            if (args.isEmpty()) return 0;
            return Arrays.stream(jdbc.batchUpdate(
                    "update listens set scrobbled_at = ? where id = ? and scrobbled_at is null", args)
            ).sum();
        });
        return changed == null ? 0 : changed;
    }
}
