package de.bsommerfeld.threadline.enrichment;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.threadline.cache.CacheSnapshot;
import de.bsommerfeld.threadline.cache.PostFactCache;
import de.bsommerfeld.threadline.core.config.EnrichmentConfig;
import de.bsommerfeld.threadline.core.domain.NotificationEvent;
import de.bsommerfeld.threadline.core.domain.PostFact;
import de.bsommerfeld.threadline.core.event.ApplicationEventBus;
import de.bsommerfeld.threadline.core.event.EngineEvents.EnrichmentPassEvent;
import de.bsommerfeld.threadline.core.event.EngineEvents.PostFactsMergedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Keeps the {@link PostFactCache} supplied with the ancestry that root
 * resolution needs.
 *
 * <h3>Pass</h3>
 *
 * <pre>
 * snapshot ─► FrontierScanner ─► claim UNKNOWN → REQUESTED
 *                                   └► partition (≤ batch size)
 *                                        └► PostFetcher (fetch executor)
 *                                             ├ ok    → cache.merge, RESOLVED
 *                                             │         (absent from response → FAILED)
 *                                             └ error → FAILED
 * </pre>
 *
 * <h3>De-duplication</h3>
 * Claiming is an atomic {@code putIfAbsent} on the state map, so two passes
 * running concurrently over overlapping frontiers never request the same
 * URI twice.
 *
 * <h3>Failures</h3>
 * A failed URI stays failed for the rest of the session; deleted or
 * unreachable ancestors would otherwise be re-requested on every pass.
 * {@link #resetFailures()} is the explicit way back, meant for a session
 * boundary. Fetch errors never escape this class: the returned futures
 * always complete normally.
 *
 * <h3>Staleness</h3>
 * Batches are never cancelled. A response arriving after the frontier moved
 * on is merged like any other; the cache only grows, so late data can only
 * improve later resolutions.
 */
@Singleton
public class EnrichmentCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(EnrichmentCoordinator.class);

    private final PostFactCache cache;
    private final PostFetcher fetcher;
    private final ApplicationEventBus eventBus;
    private final int batchSize;
    private final int maxRounds;
    private final ExecutorService fetchExecutor;

    private final Map<String, FetchState> states = new ConcurrentHashMap<>();

    @Inject
    public EnrichmentCoordinator(PostFactCache cache, PostFetcher fetcher, ApplicationEventBus eventBus,
            EnrichmentConfig config) {
        this.cache = cache;
        this.fetcher = fetcher;
        this.eventBus = eventBus;
        this.batchSize = config.getBatchSize();
        this.maxRounds = config.getMaxRounds();
        this.fetchExecutor = Executors.newFixedThreadPool(config.getFetchThreads(),
                new ThreadFactoryBuilder().setNameFormat("threadline-fetch-%d").setDaemon(true).build());
    }

    /**
     * URIs the next pass would request for this snapshot: the pure frontier
     * minus everything already requested, resolved or failed.
     */
    public List<String> getFrontier(CacheSnapshot snapshot) {
        return untracked(FrontierScanner.scan(snapshot));
    }

    public List<String> getFrontier(CacheSnapshot snapshot, Collection<NotificationEvent> replies) {
        return untracked(FrontierScanner.scan(snapshot, replies));
    }

    public FetchState stateOf(String uri) {
        return states.getOrDefault(uri, FetchState.UNKNOWN);
    }

    /**
     * Runs a single pass against the current cache contents.
     *
     * @param replies reply events whose own posts and subjects seed the frontier
     * @return counters of this pass; never completes exceptionally
     */
    public CompletableFuture<EnrichmentReport> runPass(Collection<NotificationEvent> replies) {
        CacheSnapshot snapshot = cache.snapshot();
        List<String> claimed = claim(FrontierScanner.scan(snapshot, replies));
        if (claimed.isEmpty()) {
            LOG.debug("Frontier empty for snapshot v{}", snapshot.version());
            return CompletableFuture.completedFuture(new EnrichmentReport(0, 0, 0, 1));
        }

        List<List<String>> batches = Lists.partition(claimed, batchSize);
        LOG.info("Enrichment pass: requesting {} URIs in {} batches (snapshot v{})",
                claimed.size(), batches.size(), snapshot.version());

        List<CompletableFuture<EnrichmentReport>> futures = batches.stream()
                .map(batch -> fetchBatch(ImmutableList.copyOf(batch)))
                .collect(Collectors.toList());

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    EnrichmentReport report = futures.stream()
                            .map(CompletableFuture::join)
                            .reduce(EnrichmentReport.EMPTY, EnrichmentReport::plus);
                    report = new EnrichmentReport(report.requested(), report.resolved(), report.failed(), 1);
                    eventBus.post(new EnrichmentPassEvent(report.requested(), report.resolved(), report.failed()));
                    return report;
                });
    }

    /**
     * Repeats passes until one claims nothing or the configured round limit
     * is hit. Each merged fact can reveal a further ancestor, so a chain of
     * depth N needs about N rounds.
     */
    public CompletableFuture<EnrichmentReport> enrichUntilStable(Collection<NotificationEvent> replies) {
        return enrichUntilStable(replies, maxRounds);
    }

    public CompletableFuture<EnrichmentReport> enrichUntilStable(Collection<NotificationEvent> replies, int roundLimit) {
        List<NotificationEvent> seed = List.copyOf(replies);
        return runRounds(seed, 1, Math.max(1, roundLimit), EnrichmentReport.EMPTY);
    }

    private CompletableFuture<EnrichmentReport> runRounds(List<NotificationEvent> replies, int round, int roundLimit,
            EnrichmentReport total) {
        return runPass(replies).thenCompose(report -> {
            EnrichmentReport sum = total.plus(report);
            if (report.requested() == 0) {
                LOG.info("Enrichment stable after {} rounds: {} resolved, {} failed",
                        round, sum.resolved(), sum.failed());
                return CompletableFuture.completedFuture(sum);
            }
            if (round >= roundLimit) {
                LOG.info("Enrichment stopped at round limit {}: {} resolved, {} failed, {} URIs still open",
                        roundLimit, sum.resolved(), sum.failed(), getFrontier(cache.snapshot(), replies).size());
                return CompletableFuture.completedFuture(sum);
            }
            return runRounds(replies, round + 1, roundLimit, sum);
        });
    }

    /**
     * Returns every failed URI to {@code UNKNOWN} so the next pass may try
     * it again.
     *
     * @return number of URIs reset
     */
    public int resetFailures() {
        List<String> failed = states.entrySet().stream()
                .filter(e -> e.getValue() == FetchState.FAILED)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        failed.forEach(uri -> states.remove(uri, FetchState.FAILED));
        if (!failed.isEmpty()) {
            LOG.info("Reset {} failed URIs", failed.size());
        }
        return failed.size();
    }

    /**
     * Stops the fetch executor, giving in-flight batches up to 30s to land
     * in the cache.
     */
    public void shutdown() {
        LOG.info("Shutting down EnrichmentCoordinator...");
        fetchExecutor.shutdown();
        try {
            if (!fetchExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                fetchExecutor.shutdownNow();
                LOG.warn("EnrichmentCoordinator forced shutdown (timed out).");
            }
        } catch (InterruptedException e) {
            fetchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private List<String> untracked(List<String> frontier) {
        return frontier.stream()
                .filter(uri -> !states.containsKey(uri))
                .collect(Collectors.toList());
    }

    private List<String> claim(List<String> frontier) {
        List<String> claimed = new ArrayList<>();
        for (String uri : frontier) {
            if (states.putIfAbsent(uri, FetchState.REQUESTED) == null) {
                claimed.add(uri);
            }
        }
        return claimed;
    }

    private CompletableFuture<EnrichmentReport> fetchBatch(List<String> batch) {
        CompletableFuture<List<PostFact>> fetch;
        try {
            fetch = CompletableFuture.supplyAsync(() -> {
                try {
                    return fetcher.fetchPostsByUri(batch);
                } catch (PostFetchException e) {
                    throw new CompletionException(e);
                }
            }, fetchExecutor);
        } catch (RejectedExecutionException e) {
            // Executor already shut down; the claimed URIs must not stay REQUESTED
            return CompletableFuture.completedFuture(onBatchFailed(batch, e));
        }
        return fetch.handle((posts, error) -> error == null
                ? onBatchFetched(batch, posts)
                : onBatchFailed(batch, error));
    }

    private EnrichmentReport onBatchFetched(List<String> batch, List<PostFact> posts) {
        List<PostFact> received = posts == null ? List.of()
                : posts.stream().filter(Objects::nonNull).collect(Collectors.toList());
        int merged = cache.merge(received);
        if (merged > 0) {
            eventBus.post(new PostFactsMergedEvent(merged, cache.version()));
        }

        Set<String> returned = received.stream().map(PostFact::uri).collect(Collectors.toCollection(HashSet::new));
        int resolved = 0;
        int missing = 0;
        for (String uri : batch) {
            if (returned.contains(uri)) {
                states.replace(uri, FetchState.REQUESTED, FetchState.RESOLVED);
                resolved++;
            } else {
                states.replace(uri, FetchState.REQUESTED, FetchState.FAILED);
                missing++;
            }
        }
        if (missing > 0) {
            LOG.debug("{} of {} requested posts were not returned, marking them failed", missing, batch.size());
        }
        return new EnrichmentReport(batch.size(), resolved, missing, 0);
    }

    private EnrichmentReport onBatchFailed(List<String> batch, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        LOG.warn("Failed to fetch batch of {} posts, marking them failed: {}", batch.size(), cause.toString());
        batch.forEach(uri -> states.replace(uri, FetchState.REQUESTED, FetchState.FAILED));
        return new EnrichmentReport(batch.size(), 0, batch.size(), 0);
    }
}
