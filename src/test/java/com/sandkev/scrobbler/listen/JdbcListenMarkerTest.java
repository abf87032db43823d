package com.sandkev.scrobbler.listen;

import com.sandkev.scrobbler.testsupport.SqliteStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcListenMarkerTest {

    private static final OffsetDateTime T0 = OffsetDateTime.of(2024, 3, 10, 9, 0, 0, 0, ZoneOffset.UTC);
    private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 3, 12, 18, 30, 0, 0, ZoneOffset.UTC);

    @TempDir
    Path dir;

    private SqliteStore store;
    private JdbcListenMarker marker;

    @BeforeEach
    void setUp() {
        store = new SqliteStore(dir);
        marker = new JdbcListenMarker(store.jdbc, store.tx);
    }

    @Test
    void marksExactlyTheGivenIds() {
        long a = store.insertEligible(T0);
        long b = store.insertEligible(T0.plusMinutes(10));
        long c = store.insertEligible(T0.plusMinutes(20));

        int changed = marker.markScrobbled(List.of(a, c), NOW);

        assertThat(changed).isEqualTo(2);
        assertThat(store.scrobbledAt(a)).isEqualTo("2024-03-12T18:30:00Z");
        assertThat(store.scrobbledAt(b)).isNull();
        assertThat(store.scrobbledAt(c)).isEqualTo("2024-03-12T18:30:00Z");
    }

    @Test
    void markingTwiceLeavesTheSameStateAsMarkingOnce() {
        long a = store.insertEligible(T0);
        long b = store.insertEligible(T0.plusMinutes(10));

        marker.markScrobbled(List.of(a, b), NOW);
        List<Map<String, Object>> once = store.jdbc.queryForList("select * from listens order by id");

        int changedAgain = marker.markScrobbled(List.of(a, b), NOW.plusHours(1));
        List<Map<String, Object>> twice = store.jdbc.queryForList("select * from listens order by id");

        assertThat(changedAgain).isZero();
        assertThat(store.scrobbledAt(a)).isEqualTo("2024-03-12T18:30:00Z");
        assertThat(store.scrobbledAt(b)).isEqualTo("2024-03-12T18:30:00Z");
        assertThat(twice).isEqualTo(once);
    }

    @Test
    void idsAreDistinctRows() {
        long a = store.insertEligible(T0);
        long b = store.insertEligible(T0.plusMinutes(10));

        assertThat(a).isNotEqualTo(b);
        assertThat(store.jdbc.queryForList("select id from listens order by id", Long.class)).containsExactly(a, b);
    }

    @Test
    void marksListensStoredWithAPositiveOffsetShortlyAfterTheyStarted() {
        // 11:30Z, stored as local time; 12:00Z written with a Z would sort before it as text
        long a = store.insertEligible(OffsetDateTime.of(2024, 5, 10, 13, 30, 0, 0, ZoneOffset.ofHours(2)));
        long b = store.insertEligible(T0);

        int changed = marker.markScrobbled(List.of(a, b), OffsetDateTime.of(2024, 5, 10, 12, 0, 0, 0, ZoneOffset.UTC));

        assertThat(changed).isEqualTo(2);
        assertThat(store.scrobbledAt(a)).isEqualTo("2024-05-10T14:00:00+02:00");
        assertThat(store.scrobbledAt(b)).isEqualTo("2024-05-10T12:00:00Z");
    }

    @Test
    void emptySetIsANoOp() {
        long a = store.insertEligible(T0);

        assertThat(marker.markScrobbled(List.of(), NOW)).isZero();
        assertThat(store.scrobbledAt(a)).isNull();
    }

    @Test
    void unknownIdsChangeNothing() {
        long a = store.insertEligible(T0);

        assertThat(marker.markScrobbled(List.of(a + 100), NOW)).isZero();
        assertThat(store.scrobbledAt(a)).isNull();
    }
}
