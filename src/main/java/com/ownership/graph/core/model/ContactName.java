package com.ownership.graph.core.model;

/**
 * Name printed on a registration contact row, decided once at ingestion:
 * either an individual's first/last name or an organization's name.
 */
public sealed interface ContactName permits ContactName.PersonName, ContactName.OrganizationName {

    /**
     * The human-readable name used for classification and node labels.
     */
    String displayName();

    /**
     * Picks the organization name when present, otherwise the individual's name.
     */
    static ContactName of(String organizationName, String firstName, String lastName) {
        if (organizationName != null && !organizationName.isBlank()) {
            return new OrganizationName(organizationName.trim());
        }
        return new PersonName(firstName, lastName);
    }

    record PersonName(String first, String last) implements ContactName {

        public PersonName {
            first = first != null ? first.trim() : "";
            last = last != null ? last.trim() : "";
        }

        @Override
        public String displayName() {
            if (first.isEmpty()) {
                return last;
            }
            if (last.isEmpty()) {
                return first;
            }
            return first + " " + last;
        }
    }

    record OrganizationName(String name) implements ContactName {

        public OrganizationName {
            name = name != null ? name.trim() : "";
        }

        @Override
        public String displayName() {
            return name;
        }
    }
}
