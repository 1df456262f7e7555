package com.contact.dedup.matching;

import com.contact.dedup.core.model.ContactRecord;

import java.util.List;

/**
 * Storage-side lookup of existing records plausibly related to an incoming one,
 * e.g. by shared email or domain. Narrows the comparison scope so that a duplicate
 * check never scans the whole store.
 *
 * <p>This is the only call in a duplicate check that may block on I/O. It must return
 * a finite list, possibly empty, and never null.</p>
 */
@FunctionalInterface
public interface CandidateProvider {

    List<ContactRecord> findPlausibleCandidates(ContactRecord record);
}
