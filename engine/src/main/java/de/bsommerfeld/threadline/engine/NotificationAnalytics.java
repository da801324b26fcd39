package de.bsommerfeld.threadline.engine;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import de.bsommerfeld.threadline.core.domain.Actor;
import de.bsommerfeld.threadline.core.domain.NotificationEvent;
import de.bsommerfeld.threadline.core.domain.Reason;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Aggregate counts over the notification history: totals per reason and
 * the accounts that interact most. Events without a known actor count
 * towards the totals but never appear among the top accounts.
 */
public final class NotificationAnalytics {

    private static final Comparator<AccountActivity> MOST_ACTIVE_FIRST = Comparator
            .comparingInt(AccountActivity::interactionCount).reversed()
            .thenComparing(AccountActivity::latestInteraction, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(a -> a.actor().id());

    private NotificationAnalytics() {
    }

    /**
     * Interaction profile of one account.
     *
     * @param actor             the account, as it appeared most recently
     * @param interactionCount  notifications caused by this account
     * @param byReason          count per reason, only reasons that occurred
     * @param latestInteraction newest timestamp, {@code null} if none parsed
     */
    public record AccountActivity(
            Actor actor,
            int interactionCount,
            Map<Reason, Integer> byReason,
            Instant latestInteraction) {

        public AccountActivity {
            byReason = ImmutableMap.copyOf(byReason);
        }
    }

    /**
     * @param total       number of notifications
     * @param unread      number of unread notifications
     * @param byReason    count per reason, every reason present
     * @param topAccounts most active accounts, highest count first
     */
    public record NotificationStats(
            int total,
            int unread,
            Map<Reason, Integer> byReason,
            List<AccountActivity> topAccounts) {

        public NotificationStats {
            byReason = ImmutableMap.copyOf(byReason);
            topAccounts = ImmutableList.copyOf(topAccounts);
        }
    }

    public static NotificationStats summarize(Collection<NotificationEvent> events, int topLimit) {
        Map<Reason, Integer> byReason = new EnumMap<>(Reason.class);
        for (Reason reason : Reason.values()) {
            byReason.put(reason, 0);
        }

        Map<String, Actor> actors = new HashMap<>();
        Map<String, Map<Reason, Integer>> perActor = new HashMap<>();
        Map<String, Instant> latest = new HashMap<>();
        int unread = 0;

        List<NotificationEvent> ordered = events.stream()
                .sorted(EventOrder.NEWEST_FIRST_UNTIMED_LAST)
                .collect(Collectors.toList());

        for (NotificationEvent event : ordered) {
            byReason.merge(event.reason(), 1, Integer::sum);
            if (!event.isRead()) {
                unread++;
            }
            if (event.actor().isUnknown()) {
                continue;
            }
            String id = event.actor().id();
            actors.putIfAbsent(id, event.actor());
            perActor.computeIfAbsent(id, k -> new EnumMap<>(Reason.class)).merge(event.reason(), 1, Integer::sum);
            if (event.hasTimestamp()) {
                latest.merge(id, event.indexedAt(), (a, b) -> a.isAfter(b) ? a : b);
            }
        }

        List<AccountActivity> top = perActor.entrySet().stream()
                .map(e -> new AccountActivity(
                        actors.get(e.getKey()),
                        e.getValue().values().stream().mapToInt(Integer::intValue).sum(),
                        e.getValue(),
                        latest.get(e.getKey())))
                .sorted(MOST_ACTIVE_FIRST)
                .limit(Math.max(0, topLimit))
                .collect(Collectors.toList());

        return new NotificationStats(events.size(), unread, byReason, top);
    }
}
