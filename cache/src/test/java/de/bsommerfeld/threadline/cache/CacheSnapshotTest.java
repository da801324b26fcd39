package de.bsommerfeld.threadline.cache;

import de.bsommerfeld.threadline.core.domain.PostFact;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CacheSnapshotTest {

    @Test
    void empty_shouldHoldNothing() {
        CacheSnapshot snapshot = CacheSnapshot.empty();

        assertEquals(0, snapshot.size());
        assertEquals(0L, snapshot.version());
        assertTrue(snapshot.get("at://p/1").isEmpty());
    }

    @Test
    void of_shouldMergeDuplicateUris() {
        CacheSnapshot snapshot = CacheSnapshot.of(3L,
                new PostFact("at://p/1", "at://p/0", null),
                new PostFact("at://p/1", null, "at://p/root"));

        PostFact fact = snapshot.get("at://p/1").orElseThrow();
        assertEquals(1, snapshot.size());
        assertEquals("at://p/0", fact.parentUri());
        assertEquals("at://p/root", fact.rootUri());
        assertEquals(3L, snapshot.version());
    }

    @Test
    void getAndContains_shouldTolerateNull() {
        CacheSnapshot snapshot = CacheSnapshot.of(1L, new PostFact("at://p/1", null, null));

        assertFalse(snapshot.contains(null));
        assertTrue(snapshot.get(null).isEmpty());
    }

    @Test
    void lookup_shouldReportCompleteWhenEverythingIsCached() {
        CacheSnapshot snapshot = CacheSnapshot.of(1L,
                new PostFact("at://p/1", null, null),
                new PostFact("at://p/2", null, null));

        LookupResult result = snapshot.lookup(List.of("at://p/2", "at://p/1"));

        assertTrue(result.isComplete());
        assertEquals("at://p/2", result.found().get(0).uri());
    }
}
