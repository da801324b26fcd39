package de.bsommerfeld.threadline.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * What is known about a post from the network. Every field except the URI
 * may be missing: a post that is not a reply has neither parent nor root, and
 * partial responses may omit content.
 *
 * @param uri          post URI
 * @param parentUri    URI of the post this one directly replies to
 * @param rootUri      URI of the conversation's top-level post, as declared
 *                     by the post itself
 * @param content      post text
 * @param authorHandle handle of the post's author
 * @param createdAt    creation time declared by the record
 */
public record PostFact(
        String uri,
        String parentUri,
        String rootUri,
        String content,
        String authorHandle,
        Instant createdAt) {

    public PostFact {
        Objects.requireNonNull(uri, "uri");
    }

    public PostFact(String uri, String parentUri, String rootUri) {
        this(uri, parentUri, rootUri, null, null, null);
    }

    public boolean isReply() {
        return parentUri != null || rootUri != null;
    }

    /**
     * Combines this fact with a newer one for the same URI. Fields the newer
     * fact knows win; fields it lacks are kept, so merging never loses
     * ancestry that was already known.
     */
    public PostFact mergeWith(PostFact newer) {
        if (!uri.equals(newer.uri)) {
            throw new IllegalArgumentException("Cannot merge facts of " + uri + " and " + newer.uri);
        }
        return new PostFact(
                uri,
                newer.parentUri != null ? newer.parentUri : parentUri,
                newer.rootUri != null ? newer.rootUri : rootUri,
                newer.content != null ? newer.content : content,
                newer.authorHandle != null ? newer.authorHandle : authorHandle,
                newer.createdAt != null ? newer.createdAt : createdAt);
    }
}
