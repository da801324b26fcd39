package de.bsommerfeld.threadline.core.domain;

import java.time.Instant;

/**
 * One row of the aggregated notification feed: either a single
 * {@link NotificationEvent} or an {@link AggregatedCluster}.
 */
public sealed interface FeedItem permits NotificationEvent, AggregatedCluster {

    /** Timestamp the feed is ordered by, newest first. */
    Instant effectiveTimestamp();

    /** Secondary ordering key for items with identical timestamps. */
    String sortKey();
}
