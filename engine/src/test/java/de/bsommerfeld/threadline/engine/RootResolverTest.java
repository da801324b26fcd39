package de.bsommerfeld.threadline.engine;

import de.bsommerfeld.threadline.cache.CacheSnapshot;
import de.bsommerfeld.threadline.core.domain.Actor;
import de.bsommerfeld.threadline.core.domain.NotificationEvent;
import de.bsommerfeld.threadline.core.domain.PostFact;
import de.bsommerfeld.threadline.core.domain.Reason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RootResolverTest {

    private static final Instant T0 = Instant.parse("2024-05-01T09:00:00Z");

    private RootResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new RootResolver();
    }

    @Test
    void resolve_shouldTreatUnknownReplyWithoutSubjectAsOrphan() {
        assertEquals("R1", resolver.resolve(reply("R1", null), CacheSnapshot.empty()));
    }

    @Test
    void resolve_shouldUseSubjectAsProvisionalRoot() {
        assertEquals("S", resolver.resolve(reply("R1", "S"), CacheSnapshot.empty()));
    }

    @Test
    void resolve_shouldImproveOnceRootFactArrives() {
        NotificationEvent r1 = reply("R1", null);
        assertEquals("R1", resolver.resolve(r1, CacheSnapshot.empty()));

        CacheSnapshot enriched = CacheSnapshot.of(1L, new PostFact("R1", null, "P0"));

        assertEquals("P0", resolver.resolve(r1, enriched));
    }

    @Test
    void resolve_shouldReplaceSubjectGuessWithDeclaredRoot() {
        NotificationEvent r1 = reply("R1", "S");
        assertEquals("S", resolver.resolve(r1, CacheSnapshot.empty()));

        assertEquals("P0", resolver.resolve(r1, CacheSnapshot.of(1L, new PostFact("R1", "S", "P0"))));
    }

    @Test
    void resolve_shouldKeepSubjectWhenOwnFactCannotBeWalked() {
        // R1 is cached, but its parent is not: the walk stays at R1
        CacheSnapshot snapshot = CacheSnapshot.of(1L, new PostFact("R1", "X", null));
        assertEquals("S", resolver.resolve(reply("R1", "S"), snapshot));
    }

    @Test
    void resolve_shouldWalkParentsToTopmostCachedAncestor() {
        CacheSnapshot snapshot = CacheSnapshot.of(1L,
                new PostFact("R3", "R2", null),
                new PostFact("R2", "R1", null),
                new PostFact("R1", null, null));

        assertEquals("R1", resolver.resolve(reply("R3", null), snapshot));
    }

    @Test
    void resolve_shouldShortCircuitOnAncestorDeclaringRoot() {
        CacheSnapshot snapshot = CacheSnapshot.of(1L,
                new PostFact("R3", "R2", null),
                new PostFact("R2", "R1", "P0"),
                new PostFact("R1", "P0", null));

        assertEquals("P0", resolver.resolve(reply("R3", null), snapshot));
    }

    @Test
    void resolve_shouldTerminateOnCycle() {
        CacheSnapshot snapshot = CacheSnapshot.of(1L,
                new PostFact("A", "B", null),
                new PostFact("B", "A", null));

        String root = resolver.resolve(reply("A", null), snapshot);

        assertTrue(Set.of("A", "B").contains(root));
    }

    @Test
    void resolve_shouldTerminateOnSelfParent() {
        CacheSnapshot snapshot = CacheSnapshot.of(1L, new PostFact("A", "A", null));
        assertEquals("A", resolver.resolve(reply("A", null), snapshot));
    }

    @Test
    void walkToRoot_shouldStopWithinChainLengthOnLongCycle() {
        List<PostFact> facts = new ArrayList<>();
        int length = 500;
        for (int i = 0; i < length; i++) {
            facts.add(new PostFact("N" + i, "N" + ((i + 1) % length), null));
        }
        Set<String> visited = new HashSet<>();

        String root = RootResolver.walkToRoot("N0", CacheSnapshot.of(1L, facts), visited);

        assertEquals("N0", root);
        assertEquals(length, visited.size());
    }

    @Test
    void resolve_shouldWalkFromCachedSubjectWhenReplyIsUnknown() {
        CacheSnapshot snapshot = CacheSnapshot.of(1L,
                new PostFact("R1", "S", "P0"),
                new PostFact("S", "P0", "P0"));

        assertEquals("P0", resolver.resolve(reply("R2", "S"), snapshot));
    }

    @Test
    void resolve_shouldWalkSubjectAncestryWithoutDeclaredRoot() {
        CacheSnapshot snapshot = CacheSnapshot.of(1L,
                new PostFact("S", "Q", null),
                new PostFact("Q", null, null));

        assertEquals("Q", resolver.resolve(reply("R2", "S"), snapshot));
    }

    @Test
    void resolve_shouldNotReuseAnswerAcrossSnapshotsSharingVersion() {
        NotificationEvent r1 = reply("R1", null);
        assertEquals("R1", resolver.resolve(r1, CacheSnapshot.of(1L)));

        CacheSnapshot sameVersion = CacheSnapshot.of(1L, new PostFact("R1", null, "P0"));

        assertEquals("P0", resolver.resolve(r1, sameVersion));
    }

    @Test
    void resolve_shouldMemoizePerSnapshot() {
        CacheSnapshot v1 = CacheSnapshot.of(1L, new PostFact("R1", null, "P0"));
        resolver.resolve(reply("R1", null), v1);
        resolver.resolve(reply("R2", null), v1);
        assertEquals(2, resolver.memoSize());

        CacheSnapshot v2 = CacheSnapshot.of(2L, new PostFact("R1", null, "P1"));
        assertEquals("P1", resolver.resolve(reply("R1", null), v2));
        assertEquals(1, resolver.memoSize());
    }

    @Test
    void resolveUncached_shouldMatchMemoizedResolution() {
        CacheSnapshot snapshot = CacheSnapshot.of(4L,
                new PostFact("R2", "R1", null),
                new PostFact("R1", null, null));

        assertEquals(RootResolver.resolveUncached("R2", "S", snapshot),
                resolver.resolve(reply("R2", "S"), snapshot));
    }

    private static NotificationEvent reply(String uri, String subject) {
        return new NotificationEvent(Reason.REPLY, new Actor("did:a", "a.test"), uri, subject, T0, false);
    }
}
