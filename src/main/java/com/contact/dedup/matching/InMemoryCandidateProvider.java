package com.contact.dedup.matching;

import com.contact.dedup.core.model.ContactRecord;
import com.contact.dedup.rules.CompanyNameRules;
import com.contact.dedup.rules.ContactNormalizer;
import com.contact.dedup.rules.NormalizationEngine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link CandidateProvider} for tests and embedded use.
 * A stored record is a candidate when it shares the email, domain, profile URL,
 * phone digits (ignoring a leading {@code 1}) or normalized company name.
 */
public class InMemoryCandidateProvider implements CandidateProvider {

    public static final int DEFAULT_MAX_CANDIDATES = 1000;

    private final List<ContactRecord> records = new CopyOnWriteArrayList<>();
    private final NormalizationEngine companyEngine = CompanyNameRules.createDefaultEngine();
    private final int maxCandidates;

    public InMemoryCandidateProvider() {
        this(DEFAULT_MAX_CANDIDATES);
    }

    public InMemoryCandidateProvider(int maxCandidates) {
        if (maxCandidates <= 0) {
            throw new IllegalArgumentException("maxCandidates must be positive");
        }
        this.maxCandidates = maxCandidates;
    }

    public void add(ContactRecord record) {
        records.add(Objects.requireNonNull(record, "record is required"));
    }

    public void addAll(Collection<ContactRecord> newRecords) {
        newRecords.forEach(this::add);
    }

    public int size() {
        return records.size();
    }

    public void clear() {
        records.clear();
    }

    @Override
    public List<ContactRecord> findPlausibleCandidates(ContactRecord record) {
        List<ContactRecord> result = new ArrayList<>();
        if (!record.hasIdentifyingFields()) {
            return result;
        }
        for (ContactRecord stored : records) {
            if (result.size() >= maxCandidates) {
                break;
            }
            if (isPlausible(record, stored)) {
                result.add(stored);
            }
        }
        return result;
    }

    private boolean isPlausible(ContactRecord incoming, ContactRecord stored) {
        return sameValue(ContactNormalizer.normalizeEmail(incoming.getEmail()),
                        ContactNormalizer.normalizeEmail(stored.getEmail()))
                || sameValue(ContactNormalizer.domainOf(incoming), ContactNormalizer.domainOf(stored))
                || sameValue(ContactNormalizer.normalizeProfileUrl(incoming.getProfessionalProfileUrl()),
                        ContactNormalizer.normalizeProfileUrl(stored.getProfessionalProfileUrl()))
                || sameValue(phoneKey(incoming.getPhone()), phoneKey(stored.getPhone()))
                || sameValue(emptyToNull(companyEngine.normalize(incoming.getCompanyName())),
                        emptyToNull(companyEngine.normalize(stored.getCompanyName())));
    }

    private static String phoneKey(String phone) {
        String digits = ContactNormalizer.normalizePhone(phone);
        if (digits != null && digits.length() > 1 && digits.charAt(0) == '1') {
            return digits.substring(1);
        }
        return digits;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static boolean sameValue(String a, String b) {
        return a != null && a.equals(b);
    }
}
