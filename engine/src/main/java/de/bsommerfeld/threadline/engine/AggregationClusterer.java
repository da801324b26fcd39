package de.bsommerfeld.threadline.engine;

import com.google.inject.Singleton;
import de.bsommerfeld.threadline.core.domain.AggregatedCluster;
import de.bsommerfeld.threadline.core.domain.FeedItem;
import de.bsommerfeld.threadline.core.domain.NotificationEvent;
import de.bsommerfeld.threadline.core.domain.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses bursts of same-type notifications about the same target into
 * {@link AggregatedCluster}s for a denser feed.
 *
 * <h3>Grouping key</h3>
 * All follows share one key ({@value #FOLLOW_KEY}), since they all target the
 * user. Likes, reposts and quotes key on reason plus subject post.
 * Replies and mentions are never grouped.
 *
 * <h3>Chains, not buckets</h3>
 * Within a key group, events sorted newest first are split wherever two
 * neighbours are more than {@link #AGGREGATION_WINDOW} apart. Two bursts of
 * likes on the same post three days apart stay two separate rows. A chain
 * becomes a cluster only if it reaches {@link Reason#minClusterSize()};
 * shorter chains are emitted event by event.
 *
 * <pre>
 * like/P  09:00 09:10 09:20 | (3 days) | 09:00 09:10
 *         └──── cluster ───┘            └ 2 singles ┘
 * </pre>
 */
@Singleton
public class AggregationClusterer {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationClusterer.class);

    /** Maximum gap between two consecutive members of one chain. */
    public static final Duration AGGREGATION_WINDOW = Duration.ofHours(24);

    static final String FOLLOW_KEY = "follow-all";

    /**
     * Builds the aggregated feed.
     *
     * @param events normalized events; events without a timestamp are ignored
     * @return clusters and single events, newest first
     */
    public List<FeedItem> processAggregation(Collection<NotificationEvent> events) {
        List<FeedItem> processed = new ArrayList<>();
        Map<String, List<NotificationEvent>> groups = new LinkedHashMap<>();

        for (NotificationEvent event : events) {
            if (!event.hasTimestamp()) {
                continue;
            }
            if (event.reason().isAggregable()) {
                groups.computeIfAbsent(groupingKey(event), k -> new ArrayList<>()).add(event);
            } else {
                processed.add(event);
            }
        }

        int clusters = 0;
        for (Map.Entry<String, List<NotificationEvent>> group : groups.entrySet()) {
            List<NotificationEvent> sorted = new ArrayList<>(group.getValue());
            sorted.sort(EventOrder.NEWEST_FIRST);

            for (List<NotificationEvent> chain : splitIntoChains(sorted)) {
                Reason reason = chain.get(0).reason();
                if (chain.size() >= reason.minClusterSize()) {
                    processed.add(AggregatedCluster.of(reason, group.getKey(), chain));
                    clusters++;
                } else {
                    processed.addAll(chain);
                }
            }
        }

        processed.sort(EventOrder.FEED);
        LOG.debug("Aggregated {} events into {} feed items ({} clusters)", events.size(), processed.size(), clusters);
        return processed;
    }

    static String groupingKey(NotificationEvent event) {
        if (event.reason() == Reason.FOLLOW) {
            return FOLLOW_KEY;
        }
        String subject = event.subjectUri() != null ? event.subjectUri() : "no-subject";
        return event.reason().wireValue() + "-" + subject;
    }

    /**
     * Splits a newest-first list wherever the gap to the previous event
     * exceeds the window. A gap of exactly the window still chains.
     */
    static List<List<NotificationEvent>> splitIntoChains(List<NotificationEvent> sorted) {
        List<List<NotificationEvent>> chains = new ArrayList<>();
        if (sorted.isEmpty()) {
            return chains;
        }
        List<NotificationEvent> current = new ArrayList<>();
        current.add(sorted.get(0));
        for (int i = 1; i < sorted.size(); i++) {
            NotificationEvent previous = sorted.get(i - 1);
            NotificationEvent next = sorted.get(i);
            Duration gap = Duration.between(next.indexedAt(), previous.indexedAt());
            if (gap.compareTo(AGGREGATION_WINDOW) > 0) {
                chains.add(current);
                current = new ArrayList<>();
            }
            current.add(next);
        }
        chains.add(current);
        return chains;
    }
}
