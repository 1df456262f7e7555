package com.contact.dedup.comparator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered, immutable set of named field comparators.
 * New identifying fields are added by registering a comparator; the aggregator never changes.
 */
public final class ComparatorRegistry {

    private final Map<String, FieldComparator> comparators;

    private ComparatorRegistry(Map<String, FieldComparator> comparators) {
        this.comparators = comparators;
    }

    /**
     * The five built-in comparators with the default company-name similarity floor.
     */
    public static ComparatorRegistry defaults() {
        return defaults(CompanyNameComparator.DEFAULT_SIMILARITY_FLOOR);
    }

    /**
     * The five built-in comparators, cheapest first, with a custom company-name similarity floor.
     */
    public static ComparatorRegistry defaults(double companySimilarityFloor) {
        return of(List.of(
                new EmailComparator(),
                new DomainComparator(),
                new ProfileUrlComparator(),
                new PhoneComparator(),
                new CompanyNameComparator(companySimilarityFloor)
        ));
    }

    public static ComparatorRegistry of(Collection<? extends FieldComparator> comparators) {
        Map<String, FieldComparator> map = new LinkedHashMap<>();
        for (FieldComparator comparator : comparators) {
            register(map, comparator);
        }
        return new ComparatorRegistry(map);
    }

    /**
     * Returns a registry with the given comparator added, replacing any comparator
     * registered under the same field name.
     */
    public ComparatorRegistry with(FieldComparator comparator) {
        Map<String, FieldComparator> copy = new LinkedHashMap<>(comparators);
        register(copy, comparator);
        return new ComparatorRegistry(copy);
    }

    /**
     * Returns a registry without the comparator for the given field.
     */
    public ComparatorRegistry without(String fieldName) {
        Map<String, FieldComparator> copy = new LinkedHashMap<>(comparators);
        copy.remove(fieldName);
        return new ComparatorRegistry(copy);
    }

    public Optional<FieldComparator> get(String fieldName) {
        return Optional.ofNullable(comparators.get(fieldName));
    }

    public List<FieldComparator> comparators() {
        return List.copyOf(comparators.values());
    }

    public List<String> fieldNames() {
        return new ArrayList<>(comparators.keySet());
    }

    public int size() {
        return comparators.size();
    }

    private static void register(Map<String, FieldComparator> map, FieldComparator comparator) {
        Objects.requireNonNull(comparator, "comparator is required");
        Objects.requireNonNull(comparator.fieldName(), "comparator fieldName is required");
        map.put(comparator.fieldName(), comparator);
    }
}
