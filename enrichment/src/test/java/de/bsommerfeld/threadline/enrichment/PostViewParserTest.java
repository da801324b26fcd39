package de.bsommerfeld.threadline.enrichment;

import de.bsommerfeld.threadline.core.domain.PostFact;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PostViewParserTest {

    private PostViewParser parser;

    @BeforeEach
    void setUp() {
        parser = new PostViewParser();
    }

    @Test
    void parseResponse_shouldExtractAncestryAndContent() throws Exception {
        String body = """
                {"posts": [{
                  "uri": "at://did:plc:bob/app.bsky.feed.post/2",
                  "author": {"did": "did:plc:bob", "handle": "bob.test"},
                  "record": {
                    "text": "agreed",
                    "createdAt": "2024-05-01T09:00:00.000Z",
                    "reply": {
                      "root": {"uri": "at://did:plc:me/app.bsky.feed.post/0"},
                      "parent": {"uri": "at://did:plc:alice/app.bsky.feed.post/1"}
                    }
                  }
                }]}
                """;

        List<PostFact> facts = parser.parseResponse(body);

        assertEquals(1, facts.size());
        PostFact fact = facts.get(0);
        assertEquals("at://did:plc:alice/app.bsky.feed.post/1", fact.parentUri());
        assertEquals("at://did:plc:me/app.bsky.feed.post/0", fact.rootUri());
        assertEquals("agreed", fact.content());
        assertEquals("bob.test", fact.authorHandle());
        assertEquals(Instant.parse("2024-05-01T09:00:00Z"), fact.createdAt());
    }

    @Test
    void parseResponse_shouldTreatPostWithoutReplyAsTopLevel() throws Exception {
        List<PostFact> facts = parser.parseResponse("""
                {"posts": [{"uri": "at://p/0", "record": {"text": "hello"}}]}
                """);

        assertFalse(facts.get(0).isReply());
        assertNull(facts.get(0).authorHandle());
    }

    @Test
    void parseResponse_shouldAcceptBareArray() throws Exception {
        List<PostFact> facts = parser.parseResponse("[{\"uri\": \"at://p/1\"}, {\"uri\": \"at://p/2\"}]");
        assertEquals(2, facts.size());
    }

    @Test
    void parseResponse_shouldSkipViewsWithoutUri() throws Exception {
        List<PostFact> facts = parser.parseResponse("{\"posts\": [{\"record\": {}}, {\"uri\": \"at://p/1\"}]}");

        assertEquals(1, facts.size());
        assertEquals("at://p/1", facts.get(0).uri());
    }

    @Test
    void parseResponse_shouldReturnEmptyWhenPostsArrayMissing() throws Exception {
        assertTrue(parser.parseResponse("{\"error\": \"NotFound\"}").isEmpty());
    }

    @Test
    void parseResponse_shouldIgnoreUnparsableCreatedAt() throws Exception {
        List<PostFact> facts = parser.parseResponse(
                "{\"posts\": [{\"uri\": \"at://p/1\", \"record\": {\"createdAt\": \"soon\"}}]}");

        assertNull(facts.get(0).createdAt());
    }

    @Test
    void parseResponse_shouldThrowOnInvalidJson() {
        assertThrows(PostFetchException.class, () -> parser.parseResponse("{\"posts\": [ "));
    }
}
