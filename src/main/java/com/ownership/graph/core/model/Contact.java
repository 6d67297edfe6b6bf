package com.ownership.graph.core.model;

import java.util.Locale;

/**
 * One contact row of a housing registration.
 *
 * @param registrationId  registration the contact was filed under
 * @param role            contact type or description, e.g. "Head Officer"
 * @param name            person or organization name
 * @param businessAddress business mailing address, {@link BusinessAddress#EMPTY} when absent
 */
public record Contact(String registrationId, String role, ContactName name, BusinessAddress businessAddress) {

    private static final String SITE_MANAGER = "site manager";

    public Contact {
        registrationId = registrationId != null ? registrationId : "";
        role = role != null ? role.trim() : "";
        name = name != null ? name : new ContactName.PersonName("", "");
        businessAddress = businessAddress != null ? businessAddress : BusinessAddress.EMPTY;
    }

    /**
     * Site managers run the building day to day and carry no ownership signal.
     */
    public boolean isSiteManager() {
        return role.toLowerCase(Locale.ROOT).contains(SITE_MANAGER);
    }

    public String displayName() {
        return name.displayName();
    }
}
