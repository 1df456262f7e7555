package com.contact.dedup.merge;

import com.contact.dedup.audit.MergeRule;

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
 * Decides the merged value of one field under a strategy. Mappings are merged key by key
 * with the same strategy, lists and sets by de-duplicated union; everything else is a scalar.
 * One instance serves a single merge call.
 */
class FieldResolver {

    private final MergeStrategy strategy;
    private final Instant existingUpdatedAt;
    private final Instant incomingUpdatedAt;

    FieldResolver(MergeStrategy strategy, Instant existingUpdatedAt, Instant incomingUpdatedAt) {
        this.strategy = strategy;
        this.existingUpdatedAt = existingUpdatedAt;
        this.incomingUpdatedAt = incomingUpdatedAt;
    }

    record Resolution(Object value, MergeRule rule, String reason) {
    }

    Resolution resolve(Object existing, Object incoming) {
        boolean existingEmpty = isEmpty(existing);
        boolean incomingEmpty = isEmpty(incoming);

        if (existingEmpty && incomingEmpty) {
            return existing != null
                    ? new Resolution(existing, MergeRule.ONLY_EXISTING, "Both values empty; kept existing")
                    : new Resolution(incoming, MergeRule.ONLY_INCOMING, "Both values empty; took incoming");
        }
        if (existingEmpty) {
            return new Resolution(incoming, MergeRule.ONLY_INCOMING, "Added new value (existing was empty)");
        }
        if (incomingEmpty) {
            return new Resolution(existing, MergeRule.ONLY_EXISTING, "Kept existing value (incoming was empty)");
        }
        if (existing.equals(incoming)) {
            return new Resolution(existing, MergeRule.IDENTICAL, "Values are identical");
        }
        if (existing instanceof Map<?, ?> existingMap && incoming instanceof Map<?, ?> incomingMap) {
            return deepMerge(existingMap, incomingMap);
        }
        if (existing instanceof Collection<?> existingList && incoming instanceof Collection<?> incomingList) {
            return union(existingList, incomingList);
        }
        return resolveConflict(existing, incoming);
    }

    private Resolution deepMerge(Map<?, ?> existing, Map<?, ?> incoming) {
        Map<Object, Object> merged = new LinkedHashMap<>();
        List<String> nestedNotes = new ArrayList<>();
        for (Map.Entry<?, ?> entry : existing.entrySet()) {
            Object key = entry.getKey();
            Object value = entry.getValue();
            if (incoming.containsKey(key)) {
                Resolution nested = resolve(value, incoming.get(key));
                value = nested.value();
                if (isDecision(nested.rule())) {
                    nestedNotes.add(key + ": " + nested.rule() + " (" + nested.reason() + ")");
                }
            }
            merged.put(key, value);
        }
        int added = 0;
        for (Map.Entry<?, ?> entry : incoming.entrySet()) {
            if (!merged.containsKey(entry.getKey())) {
                merged.put(entry.getKey(), entry.getValue());
                added++;
            }
        }
        StringBuilder reason = new StringBuilder("Merged mappings key by key using ")
                .append(strategy).append(" (").append(plural(added, "new key")).append(')');
        if (!nestedNotes.isEmpty()) {
            reason.append("; ").append(String.join("; ", nestedNotes));
        }
        return new Resolution(Collections.unmodifiableMap(merged), MergeRule.DEEP_MERGE, reason.toString());
    }

    /**
     * Rules that picked between two differing values, as opposed to taking the only value present.
     */
    private static boolean isDecision(MergeRule rule) {
        return rule != MergeRule.IDENTICAL && rule != MergeRule.ONLY_EXISTING && rule != MergeRule.ONLY_INCOMING;
    }

    private Resolution union(Collection<?> existing, Collection<?> incoming) {
        Collection<Object> merged = existing instanceof Set<?> ? new LinkedHashSet<>() : new ArrayList<>();
        for (Object item : existing) {
            if (!merged.contains(item)) {
                merged.add(item);
            }
        }
        int added = 0;
        for (Object item : incoming) {
            if (!merged.contains(item)) {
                merged.add(item);
                added++;
            }
        }
        if (added == 0) {
            return new Resolution(existing, MergeRule.LIST_UNION, "Incoming items already present");
        }
        Object value = merged instanceof Set<Object> set
                ? Collections.unmodifiableSet(set)
                : Collections.unmodifiableList((List<Object>) merged);
        return new Resolution(value, MergeRule.LIST_UNION, "Union of list values (" + plural(added, "new item") + ")");
    }

    private static String plural(int count, String noun) {
        return count + " " + (count == 1 ? noun : noun + "s");
    }

    private Resolution resolveConflict(Object existing, Object incoming) {
        return switch (strategy) {
            case PREFER_EXISTING -> new Resolution(existing, MergeRule.PREFER_EXISTING,
                    "PREFER_EXISTING strategy - kept existing value");
            case PREFER_INCOMING -> new Resolution(incoming, MergeRule.PREFER_INCOMING,
                    "PREFER_INCOMING strategy - used incoming value");
            case MOST_RECENT -> mostRecent(existing, incoming);
            case MOST_COMPLETE -> mostComplete(existing, incoming);
        };
    }

    private Resolution mostComplete(Object existing, Object incoming) {
        if (existing instanceof CharSequence && incoming instanceof CharSequence) {
            int existingLength = existing.toString().trim().length();
            int incomingLength = incoming.toString().trim().length();
            if (incomingLength > existingLength) {
                return new Resolution(incoming, MergeRule.MOST_COMPLETE,
                        "Incoming value is more complete (" + incomingLength + " vs " + existingLength + " chars)");
            }
            if (existingLength > incomingLength) {
                return new Resolution(existing, MergeRule.MOST_COMPLETE,
                        "Existing value is more complete (" + existingLength + " vs " + incomingLength + " chars)");
            }
        }
        return mostRecent(existing, incoming);
    }

    private Resolution mostRecent(Object existing, Object incoming) {
        if (existingUpdatedAt == null || incomingUpdatedAt == null) {
            return new Resolution(existing, MergeRule.RECENCY_FALLBACK,
                    "Last-updated marker missing on at least one record; fell back to PREFER_EXISTING");
        }
        if (incomingUpdatedAt.isAfter(existingUpdatedAt)) {
            return new Resolution(incoming, MergeRule.MOST_RECENT,
                    "Incoming value is more recent (" + incomingUpdatedAt + ")");
        }
        return new Resolution(existing, MergeRule.MOST_RECENT,
                "Existing value is at least as recent (" + existingUpdatedAt + ")");
    }

    static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.toString().isBlank();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        return false;
    }

    static boolean changed(Object before, Object after) {
        return !Objects.equals(before, after);
    }
}
