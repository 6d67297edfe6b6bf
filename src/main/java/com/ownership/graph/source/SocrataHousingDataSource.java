package com.ownership.graph.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ownership.graph.core.model.BusinessAddress;
import com.ownership.graph.core.model.Contact;
import com.ownership.graph.core.model.ContactName;
import com.ownership.graph.core.model.PropertyEnrichment;
import com.ownership.graph.core.model.PropertyId;
import com.ownership.graph.core.model.Registration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Housing data adapter over the NYC Open Data (Socrata) API.
 *
 * <ul>
 *   <li>HPD registrations: {@value #HPD_REGISTRATIONS}</li>
 *   <li>HPD registration contacts: {@value #HPD_CONTACTS}</li>
 *   <li>PLUTO tax lots: {@value #PLUTO}</li>
 * </ul>
 *
 * Usage:
 * <pre>
 * SocrataHousingDataSource source = SocrataHousingDataSource.builder()
 *     .config(SocrataConfig.defaults().withAppToken(token))
 *     .build();
 *
 * OwnershipGraphService service = OwnershipGraphService.builder()
 *     .housingDataSource(source)
 *     .build();
 * </pre>
 */
public class SocrataHousingDataSource implements RegistrationSource, ContactSource, EnrichmentSource {
    private static final Logger log = LoggerFactory.getLogger(SocrataHousingDataSource.class);

    public static final String HPD_REGISTRATIONS = "tesw-yqqr";
    public static final String HPD_CONTACTS = "feu5-w2e2";
    public static final String PLUTO = "64uk-42ks";

    private static final String PLUTO_COLUMNS =
            "block,lot,address,ownername,unitsres,yearbuilt,assesstot,numfloors,bldgarea,zonedist1";

    private final SocrataConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private SocrataHousingDataSource(Builder builder) {
        this.config = builder.config != null ? builder.config : SocrataConfig.defaults();
        this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
                .connectTimeout(config.requestTimeout())
                .build();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
    }

    // ========== Registrations ==========

    @Override
    public List<Registration> findByProperty(PropertyId propertyId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("$where", "boroid=" + SoqlSanitizer.quote(propertyId.boroCode())
                + " AND block=" + SoqlSanitizer.quote(propertyId.block())
                + " AND lot=" + SoqlSanitizer.quote(propertyId.lot()));
        params.put("$order", "registrationenddate DESC");
        params.put("$limit", String.valueOf(config.registrationLimit()));
        return query(HPD_REGISTRATIONS, params, RegistrationRow.class).stream()
                .map(RegistrationRow::toRegistration)
                .toList();
    }

    @Override
    public List<Registration> findByIds(List<String> registrationIds) {
        if (registrationIds == null || registrationIds.isEmpty()) {
            return List.of();
        }
        String ids = registrationIds.stream()
                .map(SoqlSanitizer::quote)
                .collect(Collectors.joining(","));
        Map<String, String> params = new LinkedHashMap<>();
        params.put("$where", "registrationid in(" + ids + ")");
        params.put("$limit", String.valueOf(config.registrationBatchLimit()));
        return query(HPD_REGISTRATIONS, params, RegistrationRow.class).stream()
                .map(RegistrationRow::toRegistration)
                .toList();
    }

    // ========== Contacts ==========

    @Override
    public List<Contact> findByRegistration(String registrationId) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("$where", "registrationid=" + SoqlSanitizer.quote(registrationId));
        params.put("$limit", String.valueOf(config.contactLimit()));
        return contacts(params);
    }

    @Override
    public List<Contact> findByName(String pattern, NameField field) {
        String column = field == NameField.BUSINESS_NAME ? "corporationname" : "lastname";
        Map<String, String> params = new LinkedHashMap<>();
        params.put("$where", "upper(" + column + ") like "
                + SoqlSanitizer.containsPattern(pattern.toUpperCase(Locale.ROOT)));
        params.put("$limit", String.valueOf(config.nameSearchLimit()));
        return contacts(params);
    }

    @Override
    public List<Contact> findByAddress(String streetNumber, String streetNamePrefix) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("$where", "businesshousenumber=" + SoqlSanitizer.quote(streetNumber)
                + " AND upper(businessstreetname) like "
                + SoqlSanitizer.containsPattern(streetNamePrefix.toUpperCase(Locale.ROOT)));
        params.put("$limit", String.valueOf(config.addressSearchLimit()));
        return contacts(params);
    }

    private List<Contact> contacts(Map<String, String> params) {
        return query(HPD_CONTACTS, params, ContactRow.class).stream()
                .map(ContactRow::toContact)
                .toList();
    }

    // ========== Enrichment ==========

    @Override
    public Map<PropertyId, PropertyEnrichment> findByBorough(String boroCode, List<PropertyId> propertyIds) {
        if (propertyIds == null || propertyIds.isEmpty()) {
            return Map.of();
        }
        String lots = propertyIds.stream()
                .map(p -> "(block=" + SoqlSanitizer.quote(p.block()) + " AND lot=" + SoqlSanitizer.quote(p.lot()) + ")")
                .collect(Collectors.joining(" OR "));
        Map<String, String> params = new LinkedHashMap<>();
        params.put("$where", "borocode=" + SoqlSanitizer.quote(boroCode) + " AND (" + lots + ")");
        params.put("$select", PLUTO_COLUMNS);
        params.put("$limit", String.valueOf(config.enrichmentLimit()));

        List<TaxLotRow> rows = query(PLUTO, params, TaxLotRow.class);
        Map<PropertyId, PropertyEnrichment> result = new LinkedHashMap<>();
        for (PropertyId requested : propertyIds) {
            rows.stream()
                    .filter(row -> sameNumber(row.block(), requested.block()) && sameNumber(row.lot(), requested.lot()))
                    .findFirst()
                    .ifPresent(row -> result.put(requested, row.toEnrichment()));
        }
        return result;
    }

    // ========== HTTP ==========

    <T> List<T> query(String dataset, Map<String, String> params, Class<T> rowType) {
        URI uri = buildUri(dataset, params);
        log.debug("Socrata query: {}", uri);

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(config.requestTimeout())
                .header("Accept", "application/json")
                .GET();
        if (config.appToken() != null && !config.appToken().isBlank()) {
            request.header("X-App-Token", config.appToken());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DataSourceException("Socrata request failed for dataset " + dataset + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataSourceException("Socrata request interrupted for dataset " + dataset, e);
        }

        if (response.statusCode() != 200) {
            throw new DataSourceException("Socrata returned status " + response.statusCode()
                    + " for dataset " + dataset + ": " + response.body());
        }

        try {
            JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, rowType);
            List<T> rows = objectMapper.readValue(response.body(), listType);
            return rows != null ? rows : List.of();
        } catch (JsonProcessingException e) {
            throw new DataSourceException("Unparseable Socrata response for dataset " + dataset, e);
        }
    }

    /**
     * Registrations and contacts both come from the HPD registration datasets.
     */
    @Override
    public String sourceName() {
        return "HPD";
    }

    URI buildUri(String dataset, Map<String, String> params) {
        String queryString = params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        return URI.create(config.baseUrl() + "/" + dataset + ".json?" + queryString);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static boolean sameNumber(String a, String b) {
        return stripLeadingZeros(a).equals(stripLeadingZeros(b));
    }

    private static String stripLeadingZeros(String s) {
        if (s == null) {
            return "";
        }
        String trimmed = s.trim();
        int i = 0;
        while (i < trimmed.length() - 1 && trimmed.charAt(i) == '0') {
            i++;
        }
        return trimmed.substring(i);
    }

    static int parseInt(String value) {
        return (int) parseLong(value);
    }

    static long parseLong(String value) {
        if (value == null || value.isBlank()) {
            return 0L;
        }
        try {
            return (long) Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Could not parse number: {}", value);
            return 0L;
        }
    }

    public SocrataConfig getConfig() {
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SocrataHousingDataSource createDefault() {
        return builder().build();
    }

    public static class Builder {
        private SocrataConfig config;
        private HttpClient httpClient;
        private ObjectMapper objectMapper;

        public Builder config(SocrataConfig config) {
            this.config = config;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public SocrataHousingDataSource build() {
            return new SocrataHousingDataSource(this);
        }
    }

    // Row DTOs; Socrata serializes every column as a string
    @JsonIgnoreProperties(ignoreUnknown = true)
    record RegistrationRow(
            String registrationid,
            String boroid,
            String boro,
            String block,
            String lot,
            String housenumber,
            String streetname,
            String zip
    ) {
        Registration toRegistration() {
            return new Registration(registrationid, boroid, block, lot, boro, housenumber, streetname, zip);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ContactRow(
            String registrationid,
            String type,
            String contactdescription,
            String corporationname,
            String firstname,
            String lastname,
            String businesshousenumber,
            String businessstreetname,
            String businessapartment,
            String businesscity,
            String businessstate,
            String businesszip
    ) {
        Contact toContact() {
            String role = type != null && !type.isBlank() ? type : contactdescription;
            BusinessAddress address = new BusinessAddress(businesshousenumber, businessstreetname,
                    businessapartment, businesscity, businessstate, businesszip);
            return new Contact(registrationid, role, ContactName.of(corporationname, firstname, lastname), address);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TaxLotRow(
            String block,
            String lot,
            String address,
            String ownername,
            String unitsres,
            String yearbuilt,
            String assesstot,
            String numfloors,
            String bldgarea,
            String zonedist1
    ) {
        PropertyEnrichment toEnrichment() {
            return new PropertyEnrichment(address, ownername, parseInt(unitsres), parseInt(yearbuilt),
                    parseLong(assesstot), parseInt(numfloors), parseLong(bldgarea), zonedist1);
        }
    }
}
