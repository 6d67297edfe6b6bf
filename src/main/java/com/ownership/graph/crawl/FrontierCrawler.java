package com.ownership.graph.crawl;

import com.ownership.graph.api.CrawlOptions;
import com.ownership.graph.core.model.Contact;
import com.ownership.graph.core.model.GraphEdge;
import com.ownership.graph.core.model.GraphNode;
import com.ownership.graph.core.model.NodeKind;
import com.ownership.graph.core.model.PropertyId;
import com.ownership.graph.core.model.Registration;
import com.ownership.graph.logging.LogContext;
import com.ownership.graph.metrics.MetricsService;
import com.ownership.graph.rules.Normalizer;
import com.ownership.graph.source.ContactSource;
import com.ownership.graph.source.RegistrationSource;
import com.ownership.graph.store.GraphStore;
import com.ownership.graph.tracing.Span;
import com.ownership.graph.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Breadth-first crawler over housing registrations.
 *
 * <p>Starting from a seed property, each round expands the current frontier: property tasks
 * yield the contacts registered for the property, name tasks yield the other properties a
 * name is registered on and the names sharing its business address. The tasks of a round run
 * in parallel and are joined before the next round starts, because the next frontier is
 * exactly what the round discovered.</p>
 *
 * <p>Discoveries are merged into the next frontier after the round barrier, in task order, so
 * the frontier of a round does not depend on which lookup finished first.</p>
 */
public class FrontierCrawler {
    private static final Logger log = LoggerFactory.getLogger(FrontierCrawler.class);

    private final RegistrationSource registrationSource;
    private final ContactSource contactSource;
    private final Normalizer normalizer;
    private final CrawlOptions options;
    private final ExecutorService executor;
    private final LookupGuard lookupGuard;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public FrontierCrawler(RegistrationSource registrationSource,
                           ContactSource contactSource,
                           Normalizer normalizer,
                           CrawlOptions options,
                           ExecutorService executor,
                           LookupGuard lookupGuard,
                           MetricsService metricsService,
                           TracingService tracingService) {
        this.registrationSource = registrationSource;
        this.contactSource = contactSource;
        this.normalizer = normalizer;
        this.options = options;
        this.executor = executor;
        this.lookupGuard = lookupGuard;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    /**
     * Crawls outward from {@code seed} for at most {@code maxDepth} rounds or until the deadline passes.
     */
    public CrawlResult crawl(PropertyId seed, int maxDepth, CrawlDeadline deadline) {
        GraphStore store = new GraphStore();
        CrawlState state = new CrawlState();

        GraphNode seedNode = store.upsert(GraphNode.property(seed));
        state.markProperty(seed.key());

        List<FrontierTask> frontier = List.of(new FrontierTask.PropertyTask(seed));
        int round = 0;
        boolean deadlineExceeded = false;

        while (!frontier.isEmpty() && round < maxDepth) {
            if (deadline.isExpired()) {
                deadlineExceeded = true;
                break;
            }
            round++;
            try (LogContext ctx = LogContext.forRound(round);
                 Span span = tracingService.startRoundSpan(round, frontier.size())) {
                log.debug("crawl.round.started frontier={}", frontier.size());
                metricsService.recordFrontierSize(frontier.size());

                RoundContext roundContext = new RoundContext(round, maxDepth, store, state, deadline);
                List<FrontierTask> discovered = runRound(frontier, roundContext);
                if (roundContext.timedOut) {
                    deadlineExceeded = true;
                    span.setStatus(Span.SpanStatus.ERROR);
                    log.warn("crawl.round.deadline round={} deadline={}", round, deadline.getTimeout());
                    break;
                }

                frontier = nextFrontier(discovered, state);
                span.setAttribute("discovered", frontier.size());
                span.setStatus(Span.SpanStatus.OK);
                log.debug("crawl.round.completed nodes={} edges={} next={}",
                        store.nodeCount(), store.edgeCount(), frontier.size());
            }
        }

        if (deadlineExceeded) {
            store.seal();
        }
        log.info("crawl.completed rounds={} nodes={} edges={} properties={} registrations={} names={} deadlineExceeded={}",
                round, store.nodeCount(), store.edgeCount(), state.visitedPropertyCount(),
                state.visitedRegistrationCount(), state.visitedNameCount(), deadlineExceeded);
        return new CrawlResult(store, seedNode.getId(), round, deadlineExceeded);
    }

    // ========== Round ==========

    private List<FrontierTask> runRound(List<FrontierTask> frontier, RoundContext round) {
        List<FrontierTask.PropertyTask> propertyTasks = frontier.stream()
                .filter(FrontierTask.PropertyTask.class::isInstance)
                .map(FrontierTask.PropertyTask.class::cast)
                .limit(options.getMaxPropertyTasksPerRound())
                .toList();
        List<FrontierTask.NameTask> nameTasks = frontier.stream()
                .filter(FrontierTask.NameTask.class::isInstance)
                .map(FrontierTask.NameTask.class::cast)
                .limit(options.getMaxNameTasksPerRound())
                .toList();

        List<CompletableFuture<List<FrontierTask>>> futures = new ArrayList<>();
        for (FrontierTask.PropertyTask task : propertyTasks) {
            futures.add(submit(() -> expandProperty(task, round)));
        }
        for (FrontierTask.NameTask task : nameTasks) {
            futures.add(submit(() -> expandName(task, round)));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(round.deadline.remainingMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            round.timedOut = true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            round.timedOut = true;
        } catch (ExecutionException | CancellationException e) {
            log.error("crawl.round.failed: {}", e.getMessage(), e);
        }

        if (round.timedOut) {
            futures.forEach(f -> f.cancel(true));
            return List.of();
        }

        List<FrontierTask> discovered = new ArrayList<>();
        for (CompletableFuture<List<FrontierTask>> future : futures) {
            discovered.addAll(joinQuietly(future));
        }
        return discovered;
    }

    private CompletableFuture<List<FrontierTask>> submit(Supplier<List<FrontierTask>> work) {
        return CompletableFuture.supplyAsync(LogContext.propagate(work), executor);
    }

    private static List<FrontierTask> joinQuietly(CompletableFuture<List<FrontierTask>> future) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            return List.of();
        }
    }

    /**
     * Keeps each discovered task whose key is new to its visited set, in discovery order.
     */
    private static List<FrontierTask> nextFrontier(List<FrontierTask> discovered, CrawlState state) {
        List<FrontierTask> next = new ArrayList<>();
        for (FrontierTask task : discovered) {
            if (state.accept(task)) {
                next.add(task);
            }
        }
        return next;
    }

    // ========== Property branch ==========

    List<FrontierTask> expandProperty(FrontierTask.PropertyTask task, RoundContext round) {
        List<FrontierTask> discovered = new ArrayList<>();
        PropertyId propertyId = task.propertyId();
        try {
            List<Registration> registrations = lookupGuard.call("registrations.byProperty",
                    () -> registrationSource.findByProperty(propertyId), List.of());

            for (Registration registration : registrations) {
                if (round.deadline.isExpired()) {
                    break;
                }
                String registrationId = registration.registrationId();
                if (registrationId.isBlank() || !round.state.markRegistration(registrationId)) {
                    continue;
                }

                List<Contact> contacts = lookupGuard.call("contacts.byRegistration",
                        () -> contactSource.findByRegistration(registrationId), List.of());

                for (Contact contact : contacts) {
                    if (contact.isSiteManager()) {
                        continue;
                    }
                    String name = normalizer.normalizeName(contact.displayName());
                    if (name.length() < options.getMinNameLength()) {
                        continue;
                    }

                    GraphNode nameNode = upsertNamed(round.store, name);
                    GraphNode propertyNode = round.store.upsert(propertyNode(propertyId, registration));
                    round.store.addEdge(new GraphEdge(nameNode.getId(), propertyNode.getId(),
                            registrationSource.sourceName(), contact.role()));

                    String addressKey = normalizer.addressKey(contact.businessAddress());
                    if (addressKey.length() >= options.getMinAddressKeyLength()) {
                        GraphNode addressNode = upsertAddress(round.store, addressKey);
                        round.store.addEdge(new GraphEdge(nameNode.getId(), addressNode.getId(),
                                contactSource.sourceName(), GraphEdge.ROLE_BUSINESS_ADDRESS));
                    }

                    discovered.add(new FrontierTask.NameTask(name));
                }
            }
        } catch (RuntimeException e) {
            log.warn("crawl.property.failed bbl={}: {}", propertyId.key(), e.getMessage(), e);
        }
        return discovered;
    }

    // ========== Name branch ==========

    List<FrontierTask> expandName(FrontierTask.NameTask task, RoundContext round) {
        List<FrontierTask> discovered = new ArrayList<>();
        String name = task.normalizedName();
        try {
            NodeKind kind = normalizer.getClassifier().classify(name);
            ContactSource.NameField field = kind == NodeKind.ENTITY
                    ? ContactSource.NameField.BUSINESS_NAME : ContactSource.NameField.LAST_NAME;
            String searchTerm = kind == NodeKind.ENTITY ? name : lastToken(name);

            List<Contact> matches = lookupGuard.call("contacts.byName",
                    () -> contactSource.findByName(searchTerm, field), List.of());
            if (matches.isEmpty()) {
                return discovered;
            }

            discoverRegisteredProperties(name, matches, round, discovered);

            if (!round.deadline.isExpired()) {
                discoverSharedAddresses(matches, round, discovered);
            }
        } catch (RuntimeException e) {
            log.warn("crawl.name.failed name={}: {}", name, e.getMessage(), e);
        }
        return discovered;
    }

    private void discoverRegisteredProperties(String name, List<Contact> matches, RoundContext round,
                                              List<FrontierTask> discovered) {
        List<String> registrationIds = matches.stream()
                .map(Contact::registrationId)
                .filter(id -> !id.isBlank())
                .distinct()
                .filter(id -> !round.state.isRegistrationVisited(id))
                .limit(options.getRegistrationBatchSize())
                .toList();
        if (registrationIds.isEmpty()) {
            return;
        }

        List<Registration> registrations = lookupGuard.call("registrations.byIds",
                () -> registrationSource.findByIds(registrationIds), List.of());
        if (registrations.isEmpty()) {
            return;
        }

        GraphNode nameNode = upsertNamed(round.store, name);
        for (Registration registration : registrations) {
            round.state.markRegistration(registration.registrationId());
            PropertyId propertyId = registration.propertyId();
            GraphNode propertyNode = round.store.upsert(propertyNode(propertyId, registration));
            round.store.addEdge(new GraphEdge(nameNode.getId(), propertyNode.getId(),
                    registrationSource.sourceName(), GraphEdge.ROLE_REGISTRATION));
            discovered.add(new FrontierTask.PropertyTask(propertyId));
        }
    }

    private void discoverSharedAddresses(List<Contact> matches, RoundContext round, List<FrontierTask> discovered) {
        Set<String> addressKeys = new LinkedHashSet<>();
        for (Contact contact : matches) {
            String key = normalizer.addressKey(contact.businessAddress());
            if (key.length() >= options.getMinAddressKeyLength()) {
                addressKeys.add(key);
            }
        }

        addressKeys.stream()
                .limit(options.getMaxSharedAddressExpansions())
                .forEach(addressKey -> expandSharedAddress(addressKey, round, discovered));
    }

    private void expandSharedAddress(String addressKey, RoundContext round, List<FrontierTask> discovered) {
        String[] parts = addressKey.split(" ");
        if (parts.length < 2) {
            return;
        }
        String streetNumber = parts[0];
        String streetNamePrefix = String.join(" ", Arrays.copyOfRange(parts, 1, Math.min(3, parts.length)));

        List<Contact> sharers = lookupGuard.call("contacts.byAddress",
                () -> contactSource.findByAddress(streetNumber, streetNamePrefix), List.of());

        Set<String> seen = new LinkedHashSet<>();
        for (Contact contact : sharers) {
            if (contact.isSiteManager()) {
                continue;
            }
            String otherName = normalizer.normalizeName(contact.displayName());
            if (otherName.length() < options.getMinNameLength() || !seen.add(otherName)) {
                continue;
            }
            GraphNode otherNode = upsertNamed(round.store, otherName);
            GraphNode addressNode = upsertAddress(round.store, addressKey);
            round.store.addEdge(new GraphEdge(otherNode.getId(), addressNode.getId(),
                    contactSource.sourceName(), GraphEdge.ROLE_SHARED_BUSINESS_ADDRESS));
            if (round.hasFurtherRound()) {
                discovered.add(new FrontierTask.NameTask(otherName));
            }
        }
    }

    // ========== Nodes ==========

    private GraphNode upsertNamed(GraphStore store, String normalizedName) {
        NodeKind kind = normalizer.getClassifier().classify(normalizedName);
        return store.upsert(GraphNode.builder()
                .id(normalizer.makeNodeId(kind, normalizedName))
                .kind(kind)
                .label(normalizedName)
                .build());
    }

    private GraphNode upsertAddress(GraphStore store, String addressKey) {
        return store.upsert(GraphNode.builder()
                .id(normalizer.makeNodeId(NodeKind.ADDRESS, addressKey))
                .kind(NodeKind.ADDRESS)
                .label(addressKey)
                .build());
    }

    private static GraphNode propertyNode(PropertyId propertyId, Registration registration) {
        GraphNode base = GraphNode.property(propertyId);
        Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put(GraphNode.ATTR_BOROUGH, registration.borough());
        attrs.put(GraphNode.ATTR_STREET_ADDRESS, registration.streetAddress());
        attrs.put(GraphNode.ATTR_ZIP, registration.zip());
        return base.mergedWith(attrs);
    }

    private static String lastToken(String name) {
        int space = name.lastIndexOf(' ');
        return space >= 0 ? name.substring(space + 1) : name;
    }

    /**
     * Per-round view shared by the tasks of one round.
     */
    static final class RoundContext {
        final int round;
        final int maxDepth;
        final GraphStore store;
        final CrawlState state;
        final CrawlDeadline deadline;
        volatile boolean timedOut;

        RoundContext(int round, int maxDepth, GraphStore store, CrawlState state, CrawlDeadline deadline) {
            this.round = round;
            this.maxDepth = maxDepth;
            this.store = store;
            this.state = state;
            this.deadline = deadline;
        }

        boolean hasFurtherRound() {
            return round < maxDepth;
        }
    }
}
