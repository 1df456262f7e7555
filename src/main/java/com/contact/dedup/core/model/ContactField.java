package com.contact.dedup.core.model;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * The scalar fields of a {@link ContactRecord}, with their wire names and accessors.
 * Used by the merger to walk a record generically.
 */
public enum ContactField {
    EMAIL("email", true, ContactRecord::getEmail, ContactRecord.Builder::email),
    DOMAIN("domain", true, ContactRecord::getDomain, ContactRecord.Builder::domain),
    WEBSITE("website", true, ContactRecord::getWebsite, ContactRecord.Builder::website),
    PROFESSIONAL_PROFILE_URL("professional_profile_url", true,
            ContactRecord::getProfessionalProfileUrl, ContactRecord.Builder::professionalProfileUrl),
    PHONE("phone", true, ContactRecord::getPhone, ContactRecord.Builder::phone),
    COMPANY_NAME("company_name", true, ContactRecord::getCompanyName, ContactRecord.Builder::companyName),
    FIRST_NAME("first_name", false, ContactRecord::getFirstName, ContactRecord.Builder::firstName),
    LAST_NAME("last_name", false, ContactRecord::getLastName, ContactRecord.Builder::lastName),
    TITLE("title", false, ContactRecord::getTitle, ContactRecord.Builder::title);

    private final String fieldName;
    private final boolean identifying;
    private final Function<ContactRecord, String> getter;
    private final BiConsumer<ContactRecord.Builder, String> setter;

    ContactField(String fieldName, boolean identifying,
                 Function<ContactRecord, String> getter,
                 BiConsumer<ContactRecord.Builder, String> setter) {
        this.fieldName = fieldName;
        this.identifying = identifying;
        this.getter = getter;
        this.setter = setter;
    }

    public String fieldName() {
        return fieldName;
    }

    /**
     * Whether this field takes part in duplicate matching.
     */
    public boolean isIdentifying() {
        return identifying;
    }

    public String get(ContactRecord record) {
        return getter.apply(record);
    }

    public void set(ContactRecord.Builder builder, String value) {
        setter.accept(builder, value);
    }
}
