package de.bsommerfeld.threadline.engine;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.threadline.cache.CacheSnapshot;
import de.bsommerfeld.threadline.core.domain.ConversationThread;
import de.bsommerfeld.threadline.core.domain.NotificationEvent;
import de.bsommerfeld.threadline.core.domain.PostFact;
import de.bsommerfeld.threadline.core.domain.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Buckets reply notifications under their resolved conversation root.
 *
 * <p>
 * Threads are rebuilt from scratch on every call. Thread membership is a
 * view over (replies, snapshot), not state with a lifecycle, so a reply
 * whose root improved from a provisional subject to the real root simply
 * lands in a different bucket next time.
 */
@Singleton
public class ConversationGrouper {

    private static final Logger LOG = LoggerFactory.getLogger(ConversationGrouper.class);

    private static final Comparator<ConversationThread> LATEST_ACTIVITY_FIRST = Comparator
            .comparing((ConversationThread t) -> t.latestReply().indexedAt(), Comparator.reverseOrder())
            .thenComparing(ConversationThread::rootUri);

    private final RootResolver rootResolver;

    @Inject
    public ConversationGrouper(RootResolver rootResolver) {
        this.rootResolver = rootResolver;
    }

    /**
     * @param replyEvents reply notifications; other reasons and events
     *                    without timestamp are ignored
     * @param snapshot    post facts to resolve against
     * @return threads ordered by most recent reply
     */
    public List<ConversationThread> buildConversations(Collection<NotificationEvent> replyEvents,
            CacheSnapshot snapshot) {
        Map<String, List<NotificationEvent>> byRoot = new TreeMap<>();
        int provisional = 0;

        for (NotificationEvent reply : replyEvents) {
            if (reply.reason() != Reason.REPLY || !reply.hasTimestamp()) {
                continue;
            }
            String root = rootResolver.resolve(reply, snapshot);
            if (!snapshot.contains(root)) {
                provisional++;
            }
            byRoot.computeIfAbsent(root, k -> new ArrayList<>()).add(reply);
        }

        List<ConversationThread> threads = new ArrayList<>(byRoot.size());
        for (Map.Entry<String, List<NotificationEvent>> entry : byRoot.entrySet()) {
            threads.add(toThread(entry.getKey(), entry.getValue(), snapshot));
        }
        threads.sort(LATEST_ACTIVITY_FIRST);

        LOG.debug("Grouped replies into {} conversations ({} without cached root, snapshot v{})",
                threads.size(), provisional, snapshot.version());
        return threads;
    }

    private static ConversationThread toThread(String rootUri, List<NotificationEvent> replies,
            CacheSnapshot snapshot) {
        replies.sort(EventOrder.NEWEST_FIRST);
        Set<String> participants = new LinkedHashSet<>();
        for (NotificationEvent reply : replies) {
            participants.add(reply.actor().handle());
        }
        PostFact rootPost = snapshot.get(rootUri).orElse(null);
        return new ConversationThread(rootUri, rootPost, replies, participants, replies.get(0), replies.size());
    }
}
