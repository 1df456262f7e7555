package com.contact.dedup.cache;

import com.contact.dedup.core.model.ContactRecord;

/**
 * Listener for completed merges, e.g. to drop cached decisions that mention a merged record.
 */
public interface MergeListener {

    /**
     * Called after a merge result has been produced.
     *
     * @param existing the record merged into
     * @param incoming the record merged from
     */
    void onMerge(ContactRecord existing, ContactRecord incoming);
}
