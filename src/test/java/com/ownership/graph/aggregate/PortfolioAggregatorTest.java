package com.ownership.graph.aggregate;

import com.ownership.graph.api.CrawlOptions;
import com.ownership.graph.core.model.GraphEdge;
import com.ownership.graph.core.model.GraphNode;
import com.ownership.graph.core.model.NodeKind;
import com.ownership.graph.core.model.PropertyEnrichment;
import com.ownership.graph.core.model.PropertyId;
import com.ownership.graph.crawl.LookupGuard;
import com.ownership.graph.extract.OwnershipSubgraph;
import com.ownership.graph.metrics.NoOpMetricsService;
import com.ownership.graph.source.EnrichmentSource;
import com.ownership.graph.source.InMemoryHousingDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("PortfolioAggregator Tests")
class PortfolioAggregatorTest {

    private static final PropertyId P1 = PropertyId.of("1", "100", "1");
    private static final PropertyId P2 = PropertyId.of("3", "200", "2");
    private static final PropertyId P3 = PropertyId.of("3", "300", "3");

    private final GraphNode seed = GraphNode.property(P1);
    private final GraphNode brooklynA = GraphNode.property(P2);
    private final GraphNode brooklynB = GraphNode.property(P3);
    private final GraphNode acme = named(NodeKind.ENTITY, "ACME LLC");
    private final GraphNode beta = named(NodeKind.ENTITY, "BETA LLC");
    private final GraphNode jane = named(NodeKind.PERSON, "JANE DOE");
    private final GraphNode office = named(NodeKind.ADDRESS, "123 MAIN ST NEW YORK NY 10001");
    private final GraphNode annex = named(NodeKind.ADDRESS, "9 ELM ST NEW YORK NY 10002");

    private InMemoryHousingDataSource data;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        data = new InMemoryHousingDataSource();
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static GraphNode named(NodeKind kind, String label) {
        return GraphNode.builder().kind(kind).label(label).build();
    }

    private static GraphEdge edge(GraphNode from, GraphNode to, String role) {
        return new GraphEdge(from.getId(), to.getId(), "HPD", role);
    }

    private PortfolioAggregator aggregator(EnrichmentSource source, CrawlOptions options) {
        return new PortfolioAggregator(source, options, executor, new LookupGuard(1, new NoOpMetricsService()));
    }

    private OwnershipSubgraph portfolio() {
        List<GraphEdge> edges = List.of(
                edge(acme, seed, "Head Officer"),
                edge(acme, seed, "Corporation"),
                edge(acme, office, GraphEdge.ROLE_BUSINESS_ADDRESS),
                edge(beta, office, GraphEdge.ROLE_SHARED_BUSINESS_ADDRESS),
                edge(beta, brooklynA, GraphEdge.ROLE_REGISTRATION),
                edge(beta, brooklynB, GraphEdge.ROLE_REGISTRATION),
                edge(jane, seed, "Officer"),
                edge(jane, annex, GraphEdge.ROLE_BUSINESS_ADDRESS));
        return new OwnershipSubgraph(seed.getId(),
                List.of(seed, acme, office, beta, brooklynA, brooklynB, jane, annex), edges);
    }

    @Nested
    @DisplayName("Properties")
    class Properties {

        @Test
        @DisplayName("Should sort properties by assessed value, highest first")
        void sortedByAssessedValue() {
            data.enrich(P1, new PropertyEnrichment("1 MAIN ST", "ACME LLC", 10, 1920, 500_000L, 4, 9_000L, "R6"))
                    .enrich(P2, new PropertyEnrichment("2 ELM ST", "BETA LLC", 20, 1960, 2_000_000L, 8, 30_000L, "C4"));

            PortfolioResult result = aggregator(data, CrawlOptions.defaults()).aggregate(portfolio(), 3, false);

            List<String> order = result.properties().stream().map(PortfolioProperty::bbl).toList();
            assertEquals(List.of("3002000002", "1001000001", "3003000003"), order);
            assertEquals("Brooklyn", result.properties().get(0).borough());
            assertEquals(0L, result.properties().get(2).assessedValue());
        }

        @Test
        @DisplayName("Should batch enrichment lookups per borough")
        void batchedByBorough() {
            EnrichmentSource source = mock(EnrichmentSource.class);
            when(source.findByBorough(anyString(), anyList())).thenReturn(Map.of());

            aggregator(source, CrawlOptions.builder().enrichmentBatchSize(1).build()).aggregate(portfolio(), 3, false);

            verify(source).findByBorough("1", List.of(P1));
            verify(source).findByBorough("3", List.of(P2));
            verify(source).findByBorough("3", List.of(P3));
            verifyNoMoreInteractions(source);
        }

        @Test
        @DisplayName("connectedVia should list distinct neighbours up to the limit")
        void connectedVia() {
            PortfolioResult result = aggregator(data, CrawlOptions.builder().connectedViaLimit(1).build())
                    .aggregate(portfolio(), 3, false);

            PortfolioProperty seedProperty = result.properties().stream()
                    .filter(p -> p.bbl().equals("1001000001"))
                    .findFirst()
                    .orElseThrow();
            assertEquals(List.of("ACME LLC"), seedProperty.connectedVia());

            PortfolioResult unlimited = aggregator(data, CrawlOptions.defaults()).aggregate(portfolio(), 3, false);
            PortfolioProperty seedAgain = unlimited.properties().stream()
                    .filter(p -> p.bbl().equals("1001000001"))
                    .findFirst()
                    .orElseThrow();
            assertEquals(List.of("ACME LLC", "JANE DOE"), seedAgain.connectedVia());
        }
    }

    @Nested
    @DisplayName("Owners")
    class Owners {

        @Test
        @DisplayName("Should split people from entities and rank them by property edges")
        void ownerSummaries() {
            PortfolioResult result = aggregator(data, CrawlOptions.defaults()).aggregate(portfolio(), 3, false);

            assertEquals(List.of("ACME LLC", "BETA LLC"), result.entities().stream().map(OwnerSummary::name).toList());
            OwnerSummary acmeSummary = result.entities().get(0);
            assertEquals(2, acmeSummary.propertyCount());
            assertEquals(List.of("Head Officer", "Corporation", GraphEdge.ROLE_BUSINESS_ADDRESS), acmeSummary.roles());
            assertEquals(List.of("123 MAIN ST NEW YORK NY 10001"), acmeSummary.addresses());

            assertEquals(1, result.people().size());
            assertEquals("JANE DOE", result.people().get(0).name());
            assertEquals(List.of("9 ELM ST NEW YORK NY 10002"), result.people().get(0).addresses());
        }

        @Test
        @DisplayName("Should rank business addresses by incident edges")
        void commonAddresses() {
            PortfolioResult result = aggregator(data, CrawlOptions.defaults()).aggregate(portfolio(), 3, false);

            assertEquals(List.of(
                    new CommonAddress("123 MAIN ST NEW YORK NY 10001", 2),
                    new CommonAddress("9 ELM ST NEW YORK NY 10002", 1)), result.commonAddresses());
        }

        @Test
        @DisplayName("Should cap common addresses")
        void commonAddressCap() {
            PortfolioResult result = aggregator(data, CrawlOptions.builder().maxCommonAddresses(1).build())
                    .aggregate(portfolio(), 3, false);

            assertEquals(1, result.commonAddresses().size());
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("An isolated seed should produce empty portfolio lists")
        void isolatedSeed() {
            EnrichmentSource source = mock(EnrichmentSource.class);
            OwnershipSubgraph subgraph = new OwnershipSubgraph(seed.getId(), List.of(seed), List.of());

            PortfolioResult result = aggregator(source, CrawlOptions.defaults()).aggregate(subgraph, 1, false);

            assertTrue(result.isEmpty());
            assertTrue(result.commonAddresses().isEmpty());
            assertEquals(new GraphStats(1, 0, 1, false), result.graph());
            verifyNoInteractions(source);
        }

        @Test
        @DisplayName("Graph stats should describe the component")
        void graphStats() {
            PortfolioResult result = aggregator(data, CrawlOptions.defaults()).aggregate(portfolio(), 2, true);

            assertEquals(new GraphStats(8, 8, 2, true), result.graph());
        }

        @Test
        @DisplayName("A failing enrichment source should leave properties zeroed")
        void failingEnrichment() {
            EnrichmentSource source = mock(EnrichmentSource.class);
            when(source.findByBorough(anyString(), anyList())).thenThrow(new IllegalStateException("down"));

            PortfolioResult result = aggregator(source, CrawlOptions.defaults()).aggregate(portfolio(), 3, false);

            assertEquals(3, result.properties().size());
            assertTrue(result.properties().stream().allMatch(p -> p.assessedValue() == 0L && p.units() == 0));
        }
    }

    @ParameterizedTest
    @DisplayName("Borough codes should map to names")
    @CsvSource({"1,Manhattan", "2,Bronx", "3,Brooklyn", "4,Queens", "5,Staten Island", "6,''", "x,''"})
    void boroughNames(String code, String expected) {
        assertEquals(expected, Boroughs.name(code));
    }

    @Test
    @DisplayName("Null borough code should map to an empty name")
    void nullBorough() {
        assertEquals("", Boroughs.name(null));
    }
}
