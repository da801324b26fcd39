package de.bsommerfeld.threadline.session;

import com.google.inject.AbstractModule;
import de.bsommerfeld.threadline.cache.InMemoryPostFactCache;
import de.bsommerfeld.threadline.cache.PostFactCache;
import de.bsommerfeld.threadline.core.config.AggregationConfig;
import de.bsommerfeld.threadline.core.config.ConfigurationLoader;
import de.bsommerfeld.threadline.core.config.EnrichmentConfig;
import de.bsommerfeld.threadline.core.config.ThreadlineConfig;
import de.bsommerfeld.threadline.core.util.StorageUtils;
import de.bsommerfeld.threadline.enrichment.PostFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Guice module wiring the engine. The two network collaborators come from
 * the host application; everything else is bound here.
 */
public class ThreadlineModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(ThreadlineModule.class);

    private final Path configPath;
    private final PostFetcher postFetcher;
    private final NotificationSource notificationSource;

    public ThreadlineModule(PostFetcher postFetcher, NotificationSource notificationSource) {
        this(StorageUtils.defaultConfigFile(), postFetcher, notificationSource);
    }

    public ThreadlineModule(Path configPath, PostFetcher postFetcher, NotificationSource notificationSource) {
        this.configPath = Objects.requireNonNull(configPath, "configPath");
        this.postFetcher = Objects.requireNonNull(postFetcher, "postFetcher");
        this.notificationSource = Objects.requireNonNull(notificationSource, "notificationSource");
    }

    @Override
    protected void configure() {
        LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
        // Fails fast with ConfigurationException, the engine cannot run without it
        ThreadlineConfig config = ConfigurationLoader.load(configPath);

        bind(ThreadlineConfig.class).toInstance(config);
        bind(AggregationConfig.class).toInstance(config.getAggregation());
        bind(EnrichmentConfig.class).toInstance(config.getEnrichment());

        bind(PostFactCache.class).to(InMemoryPostFactCache.class);
        bind(PostFetcher.class).toInstance(postFetcher);
        bind(NotificationSource.class).toInstance(notificationSource);
    }
}
