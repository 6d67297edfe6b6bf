package com.ownership.graph.source;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection and row-limit settings for {@link SocrataHousingDataSource}.
 *
 * @param baseUrl                resource root, e.g. {@code https://data.cityofnewyork.us/resource}
 * @param appToken               optional Socrata application token, sent as {@code X-App-Token}
 * @param requestTimeout         per-request timeout
 * @param registrationLimit      rows returned for a property's registrations
 * @param contactLimit           rows returned for a registration's contacts
 * @param nameSearchLimit        rows returned by a name search
 * @param addressSearchLimit     rows returned by an address search
 * @param registrationBatchLimit rows returned by a registration id batch
 * @param enrichmentLimit        rows returned by a tax lot batch
 */
public record SocrataConfig(
        String baseUrl,
        String appToken,
        Duration requestTimeout,
        int registrationLimit,
        int contactLimit,
        int nameSearchLimit,
        int addressSearchLimit,
        int registrationBatchLimit,
        int enrichmentLimit
) {
    public static final String NYC_OPEN_DATA = "https://data.cityofnewyork.us/resource";

    public SocrataConfig {
        Objects.requireNonNull(baseUrl, "baseUrl is required");
        Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        requirePositive(registrationLimit, "registrationLimit");
        requirePositive(contactLimit, "contactLimit");
        requirePositive(nameSearchLimit, "nameSearchLimit");
        requirePositive(addressSearchLimit, "addressSearchLimit");
        requirePositive(registrationBatchLimit, "registrationBatchLimit");
        requirePositive(enrichmentLimit, "enrichmentLimit");
    }

    public static SocrataConfig defaults() {
        return new SocrataConfig(NYC_OPEN_DATA, null, Duration.ofSeconds(15), 5, 20, 30, 15, 50, 50);
    }

    public SocrataConfig withAppToken(String token) {
        return new SocrataConfig(baseUrl, token, requestTimeout, registrationLimit, contactLimit,
                nameSearchLimit, addressSearchLimit, registrationBatchLimit, enrichmentLimit);
    }

    public SocrataConfig withBaseUrl(String url) {
        return new SocrataConfig(url, appToken, requestTimeout, registrationLimit, contactLimit,
                nameSearchLimit, addressSearchLimit, registrationBatchLimit, enrichmentLimit);
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
