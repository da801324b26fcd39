package de.bsommerfeld.threadline.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.threadline.core.domain.PostFact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts protocol post views into {@link PostFact}s, for {@link PostFetcher}
 * implementations that receive raw JSON.
 *
 * <h3>Shape</h3>
 *
 * <pre>
 * { "posts": [ {
 *     "uri": "at://...",
 *     "author": { "handle": "alice.example" },
 *     "record": {
 *       "text": "...",
 *       "createdAt": "2024-05-01T09:00:00Z",
 *       "reply": { "root": { "uri": "..." }, "parent": { "uri": "..." } }
 *     }
 * } ] }
 * </pre>
 *
 * Views without a {@code uri} are skipped. Missing nested fields simply leave
 * the corresponding fact field {@code null}.
 */
public class PostViewParser {

    private static final Logger LOG = LoggerFactory.getLogger(PostViewParser.class);

    /** Jackson's mapper is thread-safe for reading; one instance is shared. */
    private final ObjectMapper mapper;

    public PostViewParser() {
        this(new ObjectMapper());
    }

    public PostViewParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Parses a full lookup response body.
     *
     * @throws PostFetchException if the body is not valid JSON
     */
    public List<PostFact> parseResponse(String body) throws PostFetchException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PostFetchException("Unparsable post lookup response", e);
        }
        JsonNode posts = root != null && root.isArray() ? root : root == null ? null : root.get("posts");
        List<PostFact> facts = new ArrayList<>();
        if (posts == null || !posts.isArray()) {
            LOG.warn("Post lookup response carries no 'posts' array");
            return facts;
        }
        for (JsonNode view : posts) {
            parseView(view).ifPresent(facts::add);
        }
        return facts;
    }

    public Optional<PostFact> parseView(JsonNode view) {
        String uri = text(view.path("uri"));
        if (uri == null) {
            LOG.debug("Skipping post view without uri");
            return Optional.empty();
        }
        JsonNode record = view.path("record");
        JsonNode reply = record.path("reply");
        return Optional.of(new PostFact(
                uri,
                text(reply.path("parent").path("uri")),
                text(reply.path("root").path("uri")),
                text(record.path("text")),
                text(view.path("author").path("handle")),
                timestamp(text(record.path("createdAt")))));
    }

    private static String text(JsonNode node) {
        if (node.isMissingNode() || node.isNull() || !node.isValueNode()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    private static Instant timestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            LOG.debug("Ignoring unparsable createdAt '{}'", value);
            return null;
        }
    }
}
