package com.ownership.graph.api;

import com.ownership.graph.aggregate.PortfolioAggregator;
import com.ownership.graph.aggregate.PortfolioResult;
import com.ownership.graph.core.model.PropertyId;
import com.ownership.graph.crawl.CrawlDeadline;
import com.ownership.graph.crawl.CrawlResult;
import com.ownership.graph.crawl.FrontierCrawler;
import com.ownership.graph.crawl.LookupGuard;
import com.ownership.graph.extract.ComponentExtractor;
import com.ownership.graph.extract.OwnershipSubgraph;
import com.ownership.graph.logging.LogContext;
import com.ownership.graph.metrics.MetricsService;
import com.ownership.graph.metrics.NoOpMetricsService;
import com.ownership.graph.rules.DefaultNormalizationRules;
import com.ownership.graph.rules.EntityClassifier;
import com.ownership.graph.rules.Normalizer;
import com.ownership.graph.source.ContactSource;
import com.ownership.graph.source.EnrichmentSource;
import com.ownership.graph.source.RegistrationSource;
import com.ownership.graph.source.SocrataHousingDataSource;
import com.ownership.graph.store.GraphStore;
import com.ownership.graph.tracing.NoOpTracingService;
import com.ownership.graph.tracing.Span;
import com.ownership.graph.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for ownership graph requests.
 *
 * <p>Each request validates the seed, crawls outward from it under a deadline, keeps the
 * connected component containing the seed and aggregates it into a {@link PortfolioResult}.
 * All crawl state is created per request; the service itself only holds the data sources,
 * options and the executor the lookups run on.</p>
 *
 * <pre>
 * try (OwnershipGraphService service = OwnershipGraphService.builder()
 *         .housingDataSource(SocrataHousingDataSource.createDefault())
 *         .build()) {
 *     PortfolioResult result = service.buildOwnershipGraph(PropertyId.of("1", "1234", "56"), 2);
 * }
 * </pre>
 */
public class OwnershipGraphService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OwnershipGraphService.class);

    private final CrawlOptions options;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final FrontierCrawler crawler;
    private final ComponentExtractor extractor;
    private final PortfolioAggregator aggregator;

    private OwnershipGraphService(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownsExecutor = false;
        } else {
            this.executor = Executors.newFixedThreadPool(options.getCrawlParallelism(), new CrawlThreadFactory());
            this.ownsExecutor = true;
        }

        Normalizer normalizer = builder.normalizer;
        if (normalizer == null) {
            normalizer = builder.classifier != null
                    ? new Normalizer(DefaultNormalizationRules.createDefaultEngine(), builder.classifier)
                    : new Normalizer();
        }

        LookupGuard lookupGuard = new LookupGuard(options.getMaxLookupAttempts(), metricsService);
        this.crawler = new FrontierCrawler(builder.registrationSource, builder.contactSource, normalizer,
                options, executor, lookupGuard, metricsService, tracingService);
        this.extractor = new ComponentExtractor();
        this.aggregator = new PortfolioAggregator(builder.enrichmentSource, options, executor, lookupGuard);

        log.info("OwnershipGraphService initialized: {}", options);
    }

    /**
     * Builds the ownership graph around {@code seed} using the configured default depth.
     */
    public PortfolioResult buildOwnershipGraph(PropertyId seed) {
        return buildOwnershipGraph(seed, options.getDefaultMaxDepth());
    }

    /**
     * Builds the ownership graph around {@code seed}, expanding at most {@code maxDepth} rounds.
     *
     * <p>Lookup failures do not fail the request; the branch that failed contributes nothing.
     * When the crawl deadline passes, the graph discovered so far is returned with
     * {@code deadlineExceeded} set.</p>
     *
     * @throws IllegalArgumentException if the seed or depth is malformed
     */
    public PortfolioResult buildOwnershipGraph(PropertyId seed, int maxDepth) {
        SeedValidator.validate(seed, maxDepth, options);

        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forCrawl(LogContext.generateCorrelationId(), seed.key());
             Span span = tracingService.startCrawlSpan(seed, maxDepth)) {
            log.info("crawl.started maxDepth={} timeout={}", maxDepth, options.getCrawlTimeout());
            try {
                CrawlDeadline deadline = CrawlDeadline.after(options.getCrawlTimeout());
                CrawlResult crawl = crawler.crawl(seed, maxDepth, deadline);

                GraphStore store = crawl.store();
                OwnershipSubgraph subgraph = extractor.extract(crawl.seedNodeId(), store.nodes(), store.edges());
                PortfolioResult result = aggregator.aggregate(subgraph, crawl.roundsRun(), crawl.deadlineExceeded());

                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                metricsService.recordCrawlDuration(elapsed, crawl.deadlineExceeded());
                metricsService.recordRoundsRun(crawl.roundsRun());
                metricsService.recordGraphSize(subgraph.nodeCount(), subgraph.edgeCount());

                span.setAttribute("nodes", subgraph.nodeCount());
                span.setAttribute("edges", subgraph.edgeCount());
                span.setStatus(Span.SpanStatus.OK);
                log.info("crawl.finished rounds={} nodes={} edges={} properties={} people={} entities={} deadlineExceeded={} durationMs={}",
                        crawl.roundsRun(), subgraph.nodeCount(), subgraph.edgeCount(), result.properties().size(),
                        result.people().size(), result.entities().size(), crawl.deadlineExceeded(),
                        elapsed.toMillis());
                return result;
            } catch (RuntimeException e) {
                span.setStatus(Span.SpanStatus.ERROR);
                span.recordException(e);
                log.error("crawl.failed: {}", e.getMessage(), e);
                throw e;
            }
        }
    }

    public CrawlOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    private static final class CrawlThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "ownership-crawl-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    public static class Builder {
        private RegistrationSource registrationSource;
        private ContactSource contactSource;
        private EnrichmentSource enrichmentSource;
        private Normalizer normalizer;
        private EntityClassifier classifier;
        private CrawlOptions options = CrawlOptions.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;
        private ExecutorService executor;

        /**
         * Uses one adapter for registrations, contacts and enrichment.
         */
        public Builder housingDataSource(SocrataHousingDataSource dataSource) {
            this.registrationSource = dataSource;
            this.contactSource = dataSource;
            this.enrichmentSource = dataSource;
            return this;
        }

        public Builder registrationSource(RegistrationSource registrationSource) {
            this.registrationSource = registrationSource;
            return this;
        }

        public Builder contactSource(ContactSource contactSource) {
            this.contactSource = contactSource;
            return this;
        }

        public Builder enrichmentSource(EnrichmentSource enrichmentSource) {
            this.enrichmentSource = enrichmentSource;
            return this;
        }

        /**
         * Sets a custom normalizer. Takes precedence over {@link #entityClassifier}.
         */
        public Builder normalizer(Normalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        /**
         * Sets the person/entity classifier used with the default normalization rules.
         * Defaults to the keyword classifier.
         */
        public Builder entityClassifier(EntityClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder options(CrawlOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Sets a custom metrics service. Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets a custom tracing service. Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Runs lookups on the given executor. The caller keeps ownership of it; when not set
         * the service creates a fixed pool of {@code crawlParallelism} threads and shuts it down on close.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public OwnershipGraphService build() {
            if (registrationSource == null) {
                throw new IllegalStateException("RegistrationSource is required");
            }
            if (contactSource == null) {
                throw new IllegalStateException("ContactSource is required");
            }
            if (enrichmentSource == null) {
                throw new IllegalStateException("EnrichmentSource is required");
            }
            if (options == null) {
                throw new IllegalStateException("CrawlOptions is required");
            }
            return new OwnershipGraphService(this);
        }
    }
}
