package de.bsommerfeld.threadline.core.domain;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reply notifications grouped under the conversation they belong to.
 *
 * <p>
 * A thread is a projection: it is rebuilt from the reply events and the
 * post facts known at that moment and has no identity beyond its
 * {@code rootUri}. Every reply in {@code replies} resolved to that root.
 *
 * @param rootUri           URI of the best known conversation root
 * @param rootPost          cached fact for the root, {@code null} while unknown
 * @param replies           replies, newest first
 * @param participantHandles handles of reply authors, in reply order
 * @param latestReply       newest reply
 * @param totalReplies      number of replies
 */
public record ConversationThread(
        String rootUri,
        PostFact rootPost,
        List<NotificationEvent> replies,
        Set<String> participantHandles,
        NotificationEvent latestReply,
        int totalReplies) {

    public ConversationThread {
        Objects.requireNonNull(rootUri, "rootUri");
        Objects.requireNonNull(latestReply, "latestReply");
        replies = ImmutableList.copyOf(replies);
        participantHandles = ImmutableSet.copyOf(participantHandles);
    }

    /**
     * True when nothing beyond the reply itself is known: a single reply
     * that resolved to its own URI.
     */
    public boolean isOrphan() {
        return rootPost == null && totalReplies == 1 && rootUri.equals(latestReply.uri());
    }

    public boolean hasUnread() {
        return replies.stream().anyMatch(r -> !r.isRead());
    }
}
