package com.ownership.graph.crawl;

import com.ownership.graph.api.CrawlOptions;
import com.ownership.graph.core.model.BusinessAddress;
import com.ownership.graph.core.model.GraphEdge;
import com.ownership.graph.core.model.GraphNode;
import com.ownership.graph.core.model.NodeKind;
import com.ownership.graph.core.model.PropertyId;
import com.ownership.graph.metrics.NoOpMetricsService;
import com.ownership.graph.rules.Normalizer;
import com.ownership.graph.source.InMemoryHousingDataSource;
import com.ownership.graph.tracing.NoOpTracingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FrontierCrawler Tests")
class FrontierCrawlerTest {

    private static final PropertyId SEED = PropertyId.of("1", "100", "1");

    private InMemoryHousingDataSource data;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        data = new InMemoryHousingDataSource();
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private FrontierCrawler crawler(CrawlOptions options) {
        NoOpMetricsService metrics = new NoOpMetricsService();
        return new FrontierCrawler(data, data, new Normalizer(), options, executor,
                new LookupGuard(options.getMaxLookupAttempts(), metrics), metrics, new NoOpTracingService());
    }

    private CrawlResult crawl(CrawlOptions options, int maxDepth) {
        return crawler(options).crawl(SEED, maxDepth, CrawlDeadline.after(Duration.ofSeconds(30)));
    }

    /**
     * One entity registered as owner on {@code count} properties, R1 being the seed.
     */
    private void portfolioOf(int count) {
        for (int i = 1; i <= count; i++) {
            PropertyId property = i == 1 ? SEED : PropertyId.of("1", String.valueOf(100 + i), "1");
            data.register("R" + i, property, String.valueOf(i), "MAIN STREET")
                    .organization("R" + i, "Owner", "Acme Holdings LLC", BusinessAddress.EMPTY);
        }
    }

    private static Set<String> nodeIds(CrawlResult result) {
        return result.store().nodes().stream().map(GraphNode::getId).collect(Collectors.toSet());
    }

    @Nested
    @DisplayName("Rounds")
    class Rounds {

        @Test
        @DisplayName("Should expand the seed, then its owner, then the owner's properties")
        void breadthFirst() {
            portfolioOf(3);

            CrawlResult result = crawl(CrawlOptions.defaults(), 3);

            assertEquals(3, result.roundsRun());
            assertEquals(Set.of("property:1-100-1", "property:1-102-1", "property:1-103-1",
                    "entity:ACME HOLDINGS LLC"), nodeIds(result));
            // round 1 for the seed, round 3 for the two properties found in round 2
            assertEquals(3, data.callCount("findByProperty"));
            assertEquals(1, data.callCount("findByName"));
        }

        @Test
        @DisplayName("Registrations found by name should link with the registration role")
        void registrationEdges() {
            portfolioOf(2);

            CrawlResult result = crawl(CrawlOptions.defaults(), 2);

            List<GraphEdge> registrationEdges = result.store().edges().stream()
                    .filter(e -> GraphEdge.ROLE_REGISTRATION.equals(e.role()))
                    .toList();
            assertEquals(List.of(new GraphEdge("entity:ACME HOLDINGS LLC", "property:1-102-1", "HPD",
                    GraphEdge.ROLE_REGISTRATION)), registrationEdges);
        }

        @Test
        @DisplayName("Property nodes should carry the registration address")
        void propertyAttributes() {
            portfolioOf(2);

            CrawlResult result = crawl(CrawlOptions.defaults(), 2);

            GraphNode other = result.store().getNode("property:1-102-1").orElseThrow();
            assertEquals("2 MAIN STREET", other.attribute(GraphNode.ATTR_STREET_ADDRESS));
            assertEquals("10001", other.attribute(GraphNode.ATTR_ZIP));
            assertEquals("102", other.attribute(GraphNode.ATTR_BLOCK));
        }

        @Test
        @DisplayName("Repeated crawls should discover the same graph")
        void deterministic() {
            portfolioOf(6);

            CrawlResult first = crawl(CrawlOptions.defaults(), 3);
            CrawlResult second = crawl(CrawlOptions.defaults(), 3);

            assertEquals(nodeIds(first), nodeIds(second));
            assertEquals(first.store().edgeCount(), second.store().edgeCount());
        }

        @Test
        @DisplayName("Names shorter than the minimum should be skipped")
        void shortNames() {
            data.register("R1", SEED, "1", "MAIN STREET")
                    .person("R1", "Officer", "", "LI", BusinessAddress.EMPTY)
                    .person("R1", "Officer", "", "LIU", BusinessAddress.EMPTY);

            CrawlResult result = crawl(CrawlOptions.defaults(), 1);

            assertEquals(Set.of("property:1-100-1", "person:LIU"), nodeIds(result));
        }

        @Test
        @DisplayName("Short business address keys should not become address nodes")
        void shortAddressKeys() {
            data.register("R1", SEED, "1", "MAIN STREET")
                    .organization("R1", "Owner", "Acme Holdings LLC", new BusinessAddress("1", "A ST", "", "", "", ""));

            CrawlResult result = crawl(CrawlOptions.defaults(), 1);

            assertTrue(result.store().nodes().stream().noneMatch(n -> n.getKind() == NodeKind.ADDRESS));
        }
    }

    @Nested
    @DisplayName("Caps")
    class Caps {

        @Test
        @DisplayName("Should expand at most maxPropertyTasksPerRound properties in a round")
        void propertyTaskCap() {
            portfolioOf(10);

            crawl(CrawlOptions.defaults(), 3);

            // seed in round 1, then 8 of the 9 properties found in round 2
            assertEquals(9, data.callCount("findByProperty"));
        }

        @Test
        @DisplayName("Should fetch at most registrationBatchSize registrations per name")
        void registrationBatchCap() {
            portfolioOf(6);

            CrawlResult result = crawl(CrawlOptions.builder().registrationBatchSize(2).build(), 2);

            long properties = result.store().nodes().stream().filter(n -> n.getKind() == NodeKind.PROPERTY).count();
            assertEquals(3, properties);
        }
    }

    @Nested
    @DisplayName("Deadline")
    class Deadline {

        @Test
        @DisplayName("An expired deadline should stop before the first round and seal the store")
        void expiredBeforeStart() {
            portfolioOf(2);

            CrawlResult result = crawler(CrawlOptions.defaults()).crawl(SEED, 2, CrawlDeadline.after(Duration.ZERO));

            assertTrue(result.deadlineExceeded());
            assertEquals(0, result.roundsRun());
            assertEquals(Set.of("property:1-100-1"), nodeIds(result));
            assertTrue(result.store().isSealed());
            assertEquals(0, data.callCount("findByProperty"));
        }

        @Test
        @DisplayName("A slow round should be abandoned with the graph found so far")
        void slowRound() {
            portfolioOf(2);
            data.delay("findByName", 1_000);

            CrawlResult result = crawler(CrawlOptions.defaults())
                    .crawl(SEED, 3, CrawlDeadline.after(Duration.ofMillis(200)));

            assertTrue(result.deadlineExceeded());
            assertEquals(2, result.roundsRun());
            assertEquals(Set.of("property:1-100-1", "entity:ACME HOLDINGS LLC"), nodeIds(result));
        }
    }
}
