package de.bsommerfeld.threadline.session;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.threadline.cache.CacheSnapshot;
import de.bsommerfeld.threadline.cache.PostFactCache;
import de.bsommerfeld.threadline.core.config.ThreadlineConfig;
import de.bsommerfeld.threadline.core.domain.ConversationThread;
import de.bsommerfeld.threadline.core.domain.FeedItem;
import de.bsommerfeld.threadline.core.domain.NotificationEvent;
import de.bsommerfeld.threadline.core.domain.Reason;
import de.bsommerfeld.threadline.core.event.ApplicationEventBus;
import de.bsommerfeld.threadline.core.event.EngineEvents.ConversationsUpdatedEvent;
import de.bsommerfeld.threadline.engine.AggregationClusterer;
import de.bsommerfeld.threadline.engine.ConversationFilter;
import de.bsommerfeld.threadline.engine.ConversationGrouper;
import de.bsommerfeld.threadline.engine.EventNormalizer;
import de.bsommerfeld.threadline.engine.EventOrder;
import de.bsommerfeld.threadline.engine.NormalizationResult;
import de.bsommerfeld.threadline.engine.NotificationAnalytics;
import de.bsommerfeld.threadline.engine.NotificationAnalytics.NotificationStats;
import de.bsommerfeld.threadline.enrichment.EnrichmentCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Entry point for the rendering layer. Accumulates notification pages and
 * serves the derived views on demand.
 *
 * <h3>State</h3>
 * The only state held here is the event set (keyed by URI) and the
 * pagination cursor. Feed, conversations and statistics are recomputed
 * from that set and the current cache snapshot on every call, so pages and
 * post facts may arrive in any interleaving and the views converge to the
 * same result once everything has arrived.
 *
 * <pre>
 * loadNextPage() ─► NotificationSource ─► ingest() ─► event set
 *                                                        │
 *            feed() ◄── AggregationClusterer ◄───────────┤
 *   conversations() ◄── ConversationGrouper ◄── snapshot ┤
 * refreshConversations() ─► EnrichmentCoordinator ─► cache
 * </pre>
 */
@Singleton
public class NotificationSession {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationSession.class);

    private final EventNormalizer normalizer;
    private final AggregationClusterer clusterer;
    private final ConversationGrouper grouper;
    private final EnrichmentCoordinator coordinator;
    private final PostFactCache cache;
    private final NotificationSource source;
    private final ApplicationEventBus eventBus;
    private final int topAccountsLimit;

    private final Map<String, NotificationEvent> events = new ConcurrentHashMap<>();
    private final Map<String, NotificationEvent> listingOnly = new ConcurrentHashMap<>();
    private final AtomicInteger dropped = new AtomicInteger();

    private volatile String cursor;
    private volatile boolean exhausted;

    @Inject
    public NotificationSession(EventNormalizer normalizer, AggregationClusterer clusterer,
            ConversationGrouper grouper, EnrichmentCoordinator coordinator, PostFactCache cache,
            NotificationSource source, ApplicationEventBus eventBus, ThreadlineConfig config) {
        this.normalizer = normalizer;
        this.clusterer = clusterer;
        this.grouper = grouper;
        this.coordinator = coordinator;
        this.cache = cache;
        this.source = source;
        this.eventBus = eventBus;
        this.topAccountsLimit = config.getAggregation().getTopAccountsLimit();
    }

    // -- Ingestion --

    /**
     * Normalizes a page and adds its events to the session. Pages may be
     * ingested in any order and more than once.
     */
    public NormalizationResult ingest(EventPage page) {
        NormalizationResult result = normalizer.normalize(page.events());
        for (NotificationEvent event : result.events()) {
            events.merge(event.uri(), event, NotificationSession::combine);
            listingOnly.remove(event.uri());
        }
        for (NotificationEvent event : result.listingOnly()) {
            if (!events.containsKey(event.uri())) {
                listingOnly.merge(event.uri(), event, NotificationSession::combine);
            }
        }
        dropped.addAndGet(result.dropped());
        LOG.debug("Ingested page: {} of {} records accepted, {} events held, {} listing-only",
                result.accepted(), page.events().size(), events.size(), listingOnly.size());
        return result;
    }

    /**
     * Fetches and ingests the page after the last one loaded.
     *
     * @return whether further pages remain; completes exceptionally if the
     *         source failed, leaving the cursor untouched for a retry
     */
    public CompletableFuture<Boolean> loadNextPage() {
        if (exhausted) {
            return CompletableFuture.completedFuture(false);
        }
        return source.fetchEvents(cursor).thenApply(page -> {
            ingest(page);
            cursor = page.cursor();
            exhausted = page.isLast();
            if (exhausted) {
                LOG.info("Reached end of notification history ({} events)", events.size());
            }
            return !exhausted;
        });
    }

    // -- Views --

    /** Usable events, newest first. */
    public List<NotificationEvent> events() {
        List<NotificationEvent> sorted = new ArrayList<>(events.values());
        sorted.sort(EventOrder.NEWEST_FIRST);
        return sorted;
    }

    /** Events kept only for plain listing because their timestamp was unusable, by URI. */
    public List<NotificationEvent> listingOnly() {
        return listingOnly.values().stream()
                .sorted((a, b) -> a.uri().compareTo(b.uri()))
                .collect(Collectors.toList());
    }

    public List<NotificationEvent> replies() {
        return events().stream()
                .filter(e -> e.reason() == Reason.REPLY)
                .collect(Collectors.toList());
    }

    public List<FeedItem> feed() {
        return clusterer.processAggregation(events.values());
    }

    public List<ConversationThread> conversations() {
        return grouper.buildConversations(replies(), cache.snapshot());
    }

    public List<ConversationThread> searchConversations(String query) {
        CacheSnapshot snapshot = cache.snapshot();
        return ConversationFilter.filter(grouper.buildConversations(replies(), snapshot), query, snapshot);
    }

    /** URIs the next enrichment pass would fetch. */
    public List<String> frontier() {
        return coordinator.getFrontier(cache.snapshot(), replies());
    }

    /**
     * Fetches missing ancestry until the frontier is exhausted, then rebuilds
     * the conversations against the enriched cache.
     */
    public CompletableFuture<List<ConversationThread>> refreshConversations() {
        List<NotificationEvent> replies = replies();
        return coordinator.enrichUntilStable(replies).thenApply(report -> {
            CacheSnapshot snapshot = cache.snapshot();
            List<ConversationThread> threads = grouper.buildConversations(replies(), snapshot);
            LOG.info("Conversations rebuilt: {} threads from {} replies ({} fetched, {} failed)",
                    threads.size(), replies.size(), report.resolved(), report.failed());
            eventBus.post(new ConversationsUpdatedEvent(threads.size(), snapshot.version()));
            return threads;
        });
    }

    public NotificationStats stats() {
        return stats(topAccountsLimit);
    }

    /** Counts include listing-only events; only top-account recency needs timestamps. */
    public NotificationStats stats(int topLimit) {
        List<NotificationEvent> all = new ArrayList<>(events.values());
        all.addAll(listingOnly.values());
        return NotificationAnalytics.summarize(all, topLimit);
    }

    public int droppedCount() {
        return dropped.get();
    }

    public boolean hasMorePages() {
        return !exhausted;
    }

    private static NotificationEvent combine(NotificationEvent existing, NotificationEvent incoming) {
        return incoming.isRead() ? existing.markedRead() : existing;
    }
}
