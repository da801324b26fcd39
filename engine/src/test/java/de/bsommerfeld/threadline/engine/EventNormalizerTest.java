package de.bsommerfeld.threadline.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.threadline.core.domain.Actor;
import de.bsommerfeld.threadline.core.domain.NotificationEvent;
import de.bsommerfeld.threadline.core.domain.Reason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventNormalizerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EventNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new EventNormalizer();
    }

    @Test
    void normalize_shouldParseWellFormedRecord() throws Exception {
        JsonNode record = MAPPER.readTree("""
                {
                  "uri": "at://did:plc:alice/app.bsky.feed.like/1",
                  "reason": "like",
                  "reasonSubject": "at://did:plc:me/app.bsky.feed.post/9",
                  "author": {"did": "did:plc:alice", "handle": "alice.test", "displayName": "Alice"},
                  "indexedAt": "2024-05-01T09:00:00.000Z",
                  "isRead": true
                }
                """);

        NormalizationResult result = normalizer.normalize(List.of(record));

        assertEquals(1, result.events().size());
        NotificationEvent event = result.events().get(0);
        assertEquals(Reason.LIKE, event.reason());
        assertEquals("at://did:plc:me/app.bsky.feed.post/9", event.subjectUri());
        assertEquals(new Actor("did:plc:alice", "alice.test", "Alice", null), event.actor());
        assertEquals(Instant.parse("2024-05-01T09:00:00Z"), event.indexedAt());
        assertTrue(event.isRead());
        assertEquals(0, result.dropped());
    }

    @Test
    void normalize_shouldDropRecordsMissingRequiredFields() {
        List<JsonNode> records = List.of(
                record(null, "like", "2024-05-01T09:00:00Z", false),
                record("at://x/1", null, "2024-05-01T09:00:00Z", false),
                record("at://x/2", "like", null, false),
                record("at://x/3", "like", "2024-05-01T09:00:00Z", false));

        NormalizationResult result = normalizer.normalize(records);

        assertEquals(1, result.events().size());
        assertEquals(3, result.dropped());
    }

    @Test
    void normalize_shouldDropUnknownReasons() {
        NormalizationResult result = normalizer.normalize(List.of(
                record("at://x/1", "starterpack-joined", "2024-05-01T09:00:00Z", false)));

        assertTrue(result.events().isEmpty());
        assertEquals(1, result.dropped());
    }

    @Test
    void normalize_shouldDropNonObjectRecords() {
        NormalizationResult result = normalizer.normalize(List.of(
                MAPPER.getNodeFactory().textNode("garbage"),
                record("at://x/1", "like", "2024-05-01T09:00:00Z", false)));

        assertEquals(1, result.events().size());
        assertEquals(1, result.dropped());
    }

    @Test
    void normalize_shouldKeepUnparsableTimestampAsListingOnly() {
        NormalizationResult result = normalizer.normalize(List.of(
                record("at://x/1", "mention", "yesterday-ish", false)));

        assertTrue(result.events().isEmpty());
        assertEquals(1, result.listingOnly().size());
        assertNull(result.listingOnly().get(0).indexedAt());
        assertEquals(1, result.accepted());
        assertEquals(0, result.dropped());
    }

    @Test
    void normalize_shouldPreferTimedCopyOverListingOnlyCopy() {
        NormalizationResult result = normalizer.normalize(List.of(
                record("at://x/1", "like", "not-a-date", false),
                record("at://x/1", "like", "2024-05-01T09:00:00Z", false)));

        assertEquals(1, result.events().size());
        assertTrue(result.listingOnly().isEmpty());
    }

    @Test
    void normalize_shouldCollapseDuplicatesAndKeepReadFlagRegardlessOfOrder() {
        JsonNode unread = record("at://x/1", "like", "2024-05-01T09:00:00Z", false);
        JsonNode read = record("at://x/1", "like", "2024-05-01T09:00:00Z", true);

        NormalizationResult readFirst = normalizer.normalize(List.of(read, unread));
        NormalizationResult unreadFirst = normalizer.normalize(List.of(unread, read));

        assertEquals(1, readFirst.events().size());
        assertTrue(readFirst.events().get(0).isRead());
        assertEquals(readFirst.events(), unreadFirst.events());
    }

    @Test
    void normalize_shouldAcceptOffsetTimestamps() {
        NormalizationResult result = normalizer.normalize(List.of(
                record("at://x/1", "follow", "2024-05-01T11:00:00+02:00", false)));

        assertEquals(Instant.parse("2024-05-01T09:00:00Z"), result.events().get(0).indexedAt());
    }

    @Test
    void parse_shouldFallBackToUnknownActor() {
        var event = normalizer.parse(record("at://x/1", "like", "2024-05-01T09:00:00Z", false)).orElseThrow();
        assertEquals(Actor.unknown(), event.actor());
    }

    @Test
    void parse_shouldUseHandleAsIdWhenDidMissing() throws Exception {
        JsonNode record = MAPPER.readTree("""
                {"uri": "at://x/1", "reason": "reply", "indexedAt": "2024-05-01T09:00:00Z",
                 "author": {"handle": "bob.test"}}
                """);

        var event = normalizer.parse(record).orElseThrow();

        assertEquals("bob.test", event.actor().id());
        assertEquals("bob.test", event.actor().handle());
    }

    @Test
    void parse_shouldTreatBlankSubjectAsAbsent() throws Exception {
        JsonNode record = MAPPER.readTree("""
                {"uri": "at://x/1", "reason": "like", "reasonSubject": "  ", "indexedAt": "2024-05-01T09:00:00Z"}
                """);

        assertNull(normalizer.parse(record).orElseThrow().subjectUri());
    }

    @Test
    void normalize_shouldIgnoreMalformedRecordsWithoutFailingPage() {
        List<JsonNode> records = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            records.add(record("at://x/" + i, i % 2 == 0 ? "like" : "bogus", "2024-05-01T09:00:00Z", false));
        }

        NormalizationResult result = normalizer.normalize(records);

        assertEquals(5, result.events().size());
        assertEquals(5, result.dropped());
    }

    private static JsonNode record(String uri, String reason, String indexedAt, boolean read) {
        var node = MAPPER.createObjectNode();
        if (uri != null) {
            node.put("uri", uri);
        }
        if (reason != null) {
            node.put("reason", reason);
        }
        if (indexedAt != null) {
            node.put("indexedAt", indexedAt);
        }
        node.put("isRead", read);
        return node;
    }
}
