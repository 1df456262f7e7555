package com.contact.dedup.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A business contact or lead record, the unit of comparison and of merge.
 *
 * <p>Identifying attributes (email, domain, website, profile URL, phone, company name)
 * feed the field comparators. Descriptive attributes and the {@link #getAttributes()}
 * payload (enrichment results, external system ids) are carried opaquely and only
 * take part in merges.</p>
 *
 * <p>Instances are immutable, nested payload maps and collections included.
 * Use {@link #toBuilder()} to derive a modified copy.</p>
 */
public final class ContactRecord {
    private final String id;
    private final String email;
    private final String domain;
    private final String website;
    private final String professionalProfileUrl;
    private final String phone;
    private final String companyName;
    private final String firstName;
    private final String lastName;
    private final String title;
    private final Instant updatedAt;
    private final Map<String, Object> attributes;

    private ContactRecord(Builder builder) {
        this.id = builder.id;
        this.email = builder.email;
        this.domain = builder.domain;
        this.website = builder.website;
        this.professionalProfileUrl = builder.professionalProfileUrl;
        this.phone = builder.phone;
        this.companyName = builder.companyName;
        this.firstName = builder.firstName;
        this.lastName = builder.lastName;
        this.title = builder.title;
        this.updatedAt = builder.updatedAt;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
    }

    /**
     * A record with no values at all.
     */
    public static ContactRecord empty() {
        return builder().build();
    }

    public String getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    /**
     * The explicitly supplied domain, if any. The domain used for matching falls back
     * to the email and website when this is absent.
     */
    public String getDomain() {
        return domain;
    }

    public String getWebsite() {
        return website;
    }

    public String getProfessionalProfileUrl() {
        return professionalProfileUrl;
    }

    public String getPhone() {
        return phone;
    }

    public String getCompanyName() {
        return companyName;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public String getTitle() {
        return title;
    }

    /**
     * Last-updated marker used by recency-based merge and ranking. May be null.
     */
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Arbitrary non-identifying payload in insertion order. Values are maps, lists or scalars.
     */
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /**
     * Returns true if at least one identifying attribute carries a non-blank value.
     */
    public boolean hasIdentifyingFields() {
        for (ContactField field : ContactField.values()) {
            if (field.isIdentifying() && !isBlank(field.get(this))) {
                return true;
            }
        }
        return false;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .email(email)
                .domain(domain)
                .website(website)
                .professionalProfileUrl(professionalProfileUrl)
                .phone(phone)
                .companyName(companyName)
                .firstName(firstName)
                .lastName(lastName)
                .title(title)
                .updatedAt(updatedAt)
                .attributes(attributes);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContactRecord that = (ContactRecord) o;
        return Objects.equals(id, that.id)
                && Objects.equals(email, that.email)
                && Objects.equals(domain, that.domain)
                && Objects.equals(website, that.website)
                && Objects.equals(professionalProfileUrl, that.professionalProfileUrl)
                && Objects.equals(phone, that.phone)
                && Objects.equals(companyName, that.companyName)
                && Objects.equals(firstName, that.firstName)
                && Objects.equals(lastName, that.lastName)
                && Objects.equals(title, that.title)
                && Objects.equals(updatedAt, that.updatedAt)
                && Objects.equals(attributes, that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, email, domain, website, professionalProfileUrl, phone, companyName,
                firstName, lastName, title, updatedAt, attributes);
    }

    @Override
    public String toString() {
        return "ContactRecord{" +
                "id='" + id + '\'' +
                ", email='" + email + '\'' +
                ", domain='" + domain + '\'' +
                ", companyName='" + companyName + '\'' +
                ", phone='" + phone + '\'' +
                ", updatedAt=" + updatedAt +
                ", attributes=" + attributes.keySet() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String email;
        private String domain;
        private String website;
        private String professionalProfileUrl;
        private String phone;
        private String companyName;
        private String firstName;
        private String lastName;
        private String title;
        private Instant updatedAt;
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder website(String website) {
            this.website = website;
            return this;
        }

        public Builder professionalProfileUrl(String professionalProfileUrl) {
            this.professionalProfileUrl = professionalProfileUrl;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder companyName(String companyName) {
            this.companyName = companyName;
            return this;
        }

        public Builder firstName(String firstName) {
            this.firstName = firstName;
            return this;
        }

        public Builder lastName(String lastName) {
            this.lastName = lastName;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        /**
         * Replaces the whole attribute payload. Null values are dropped.
         */
        public Builder attributes(Map<String, ?> attributes) {
            this.attributes.clear();
            if (attributes != null) {
                attributes.forEach(this::attribute);
            }
            return this;
        }

        public Builder attribute(String key, Object value) {
            Objects.requireNonNull(key, "attribute key is required");
            if (value == null) {
                this.attributes.remove(key);
            } else {
                this.attributes.put(key, immutableCopy(value));
            }
            return this;
        }

        /**
         * Nested maps, sets and lists become unmodifiable copies, keeping iteration order.
         */
        private static Object immutableCopy(Object value) {
            if (value instanceof Map<?, ?> map) {
                Map<Object, Object> copy = new LinkedHashMap<>();
                map.forEach((k, v) -> copy.put(k, immutableCopy(v)));
                return Collections.unmodifiableMap(copy);
            }
            if (value instanceof Set<?> set) {
                Set<Object> copy = new LinkedHashSet<>();
                set.forEach(item -> copy.add(immutableCopy(item)));
                return Collections.unmodifiableSet(copy);
            }
            if (value instanceof Collection<?> collection) {
                List<Object> copy = new ArrayList<>(collection.size());
                collection.forEach(item -> copy.add(immutableCopy(item)));
                return Collections.unmodifiableList(copy);
            }
            return value;
        }

        public ContactRecord build() {
            return new ContactRecord(this);
        }
    }
}
