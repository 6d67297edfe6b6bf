package com.ownership.graph.source;

import com.ownership.graph.core.model.Contact;

import java.util.List;

/**
 * Lookup of registration contacts, by registration, by name and by business address.
 * Implementations return an empty list when nothing matches and throw
 * {@link DataSourceException} when the lookup itself fails.
 */
public interface ContactSource {

    /**
     * Which name column a name search runs against.
     */
    enum NameField {
        /** Corporation name, used for business entities. */
        BUSINESS_NAME,
        /** Last name, used for people. */
        LAST_NAME
    }

    List<Contact> findByRegistration(String registrationId);

    /**
     * Contacts whose {@code field} contains {@code pattern}, compared case-insensitively.
     */
    List<Contact> findByName(String pattern, NameField field);

    /**
     * Contacts whose business address has exactly this house number and a street name
     * containing {@code streetNamePrefix}.
     */
    List<Contact> findByAddress(String streetNumber, String streetNamePrefix);

    default String sourceName() {
        return "HPD";
    }
}
