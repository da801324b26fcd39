package de.bsommerfeld.threadline.core.domain;

import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A run of same-reason notifications about the same target, collapsed into
 * one feed row ("12 people liked your post").
 *
 * <p>
 * Members are ordered newest first and every two consecutive members lie
 * within the aggregation window of each other. The window is not transitive:
 * the first and last member may be far apart if activity was continuous.
 *
 * @param reason          shared reason of all members
 * @param targetKey       grouping key the members share (reason plus subject,
 *                        or {@code follow-all})
 * @param members         member events, newest first
 * @param latestTimestamp timestamp of the newest member
 * @param actors          distinct actors by id in first-seen order
 */
public record AggregatedCluster(
        Reason reason,
        String targetKey,
        List<NotificationEvent> members,
        Instant latestTimestamp,
        List<Actor> actors) implements FeedItem {

    public AggregatedCluster {
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(targetKey, "targetKey");
        members = ImmutableList.copyOf(members);
        actors = ImmutableList.copyOf(actors);
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Cluster " + targetKey + " has no members");
        }
    }

    /**
     * Builds a cluster from an already time-descending chain. The newest
     * member supplies the cluster timestamp; actors are de-duplicated by id
     * keeping the first (most recent) occurrence.
     */
    public static AggregatedCluster of(Reason reason, String targetKey, List<NotificationEvent> chain) {
        Map<String, Actor> distinct = new LinkedHashMap<>();
        for (NotificationEvent event : chain) {
            distinct.putIfAbsent(event.actor().id(), event.actor());
        }
        return new AggregatedCluster(reason, targetKey, chain, chain.get(0).indexedAt(),
                List.copyOf(distinct.values()));
    }

    public int count() {
        return members.size();
    }

    public boolean hasUnread() {
        return members.stream().anyMatch(m -> !m.isRead());
    }

    @Override
    public Instant effectiveTimestamp() {
        return latestTimestamp;
    }

    @Override
    public String sortKey() {
        return members.get(0).uri();
    }
}
