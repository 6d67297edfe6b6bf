package com.ownership.graph.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ownership.graph.core.model.Contact;
import com.ownership.graph.core.model.PropertyEnrichment;
import com.ownership.graph.core.model.PropertyId;
import com.ownership.graph.core.model.Registration;
import com.ownership.graph.source.ContactSource;
import com.ownership.graph.source.EnrichmentSource;
import com.ownership.graph.source.RegistrationSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Caffeine-backed decorator over the housing lookups.
 * Only successful adapter responses are cached; a lookup that throws is not remembered.
 * Batch lookups are served from cached entries first and only the missing keys are fetched.
 */
public class CachingHousingDataSource implements RegistrationSource, ContactSource, EnrichmentSource {
    private static final Logger log = LoggerFactory.getLogger(CachingHousingDataSource.class);

    private final RegistrationSource registrations;
    private final ContactSource contacts;
    private final EnrichmentSource enrichment;

    private final Cache<PropertyId, List<Registration>> registrationsByProperty;
    private final Cache<String, Registration> registrationsById;
    private final Cache<String, List<Contact>> contactsByRegistration;
    private final Cache<NameQuery, List<Contact>> contactsByName;
    private final Cache<AddressQuery, List<Contact>> contactsByAddress;
    private final Cache<PropertyId, PropertyEnrichment> enrichmentById;

    public CachingHousingDataSource(RegistrationSource registrations, ContactSource contacts,
                                    EnrichmentSource enrichment, CacheConfig config) {
        this.registrations = Objects.requireNonNull(registrations, "registrations is required");
        this.contacts = Objects.requireNonNull(contacts, "contacts is required");
        this.enrichment = Objects.requireNonNull(enrichment, "enrichment is required");
        Objects.requireNonNull(config, "config is required");
        this.registrationsByProperty = newCache(config);
        this.registrationsById = newCache(config);
        this.contactsByRegistration = newCache(config);
        this.contactsByName = newCache(config);
        this.contactsByAddress = newCache(config);
        this.enrichmentById = newCache(config);
        log.info("CachingHousingDataSource initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    private static <K, V> Cache<K, V> newCache(CacheConfig config) {
        return Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
    }

    // ========== Registrations ==========

    @Override
    public List<Registration> findByProperty(PropertyId propertyId) {
        return registrationsByProperty.get(propertyId, registrations::findByProperty);
    }

    @Override
    public List<Registration> findByIds(List<String> registrationIds) {
        List<Registration> found = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String id : registrationIds) {
            Registration cached = registrationsById.getIfPresent(id);
            if (cached != null) {
                found.add(cached);
            } else {
                missing.add(id);
            }
        }
        if (!missing.isEmpty()) {
            for (Registration registration : registrations.findByIds(missing)) {
                registrationsById.put(registration.registrationId(), registration);
                found.add(registration);
            }
        }
        return found;
    }

    // ========== Contacts ==========

    @Override
    public List<Contact> findByRegistration(String registrationId) {
        return contactsByRegistration.get(registrationId, contacts::findByRegistration);
    }

    @Override
    public List<Contact> findByName(String pattern, NameField field) {
        return contactsByName.get(new NameQuery(pattern, field), q -> contacts.findByName(q.pattern(), q.field()));
    }

    @Override
    public List<Contact> findByAddress(String streetNumber, String streetNamePrefix) {
        return contactsByAddress.get(new AddressQuery(streetNumber, streetNamePrefix),
                q -> contacts.findByAddress(q.streetNumber(), q.streetNamePrefix()));
    }

    // ========== Enrichment ==========

    @Override
    public Map<PropertyId, PropertyEnrichment> findByBorough(String boroCode, List<PropertyId> propertyIds) {
        Map<PropertyId, PropertyEnrichment> found = new LinkedHashMap<>();
        List<PropertyId> missing = new ArrayList<>();
        for (PropertyId id : propertyIds) {
            PropertyEnrichment cached = enrichmentById.getIfPresent(id);
            if (cached != null) {
                found.put(id, cached);
            } else {
                missing.add(id);
            }
        }
        if (!missing.isEmpty()) {
            Map<PropertyId, PropertyEnrichment> fetched = enrichment.findByBorough(boroCode, missing);
            enrichmentById.putAll(fetched);
            found.putAll(fetched);
        }
        return found;
    }

    // ========== Provenance ==========

    @Override
    public String sourceName() {
        return registrations.sourceName();
    }

    @Override
    public String enrichmentSourceName() {
        return enrichment.enrichmentSourceName();
    }

    /**
     * Drops every cached response.
     */
    public void invalidateAll() {
        caches().forEach(Cache::invalidateAll);
        log.debug("Invalidated all cached lookups");
    }

    public CacheStats getStats() {
        return caches()
                .map(cache -> {
                    com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
                    return new CacheStats(stats.hitCount(), stats.missCount(),
                            stats.evictionCount(), cache.estimatedSize());
                })
                .reduce(new CacheStats(0, 0, 0, 0), CacheStats::plus);
    }

    /**
     * Estimated number of cached entries. Call {@link #cleanUp()} first for an exact figure.
     */
    public long size() {
        return caches().mapToLong(Cache::estimatedSize).sum();
    }

    public void cleanUp() {
        caches().forEach(Cache::cleanUp);
    }

    private Stream<Cache<?, ?>> caches() {
        return Stream.of(registrationsByProperty, registrationsById, contactsByRegistration,
                contactsByName, contactsByAddress, enrichmentById);
    }

    private record NameQuery(String pattern, NameField field) {
    }

    private record AddressQuery(String streetNumber, String streetNamePrefix) {
    }
}
