package com.realtimeanalytics.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;

/**
 * Immutable identity of a metric series: a name plus a tag set.
 *
 * <p>
 * Equality is defined by the canonical string produced by
 * {@link MetricKeyCodec#canonicalKey(String, Map)}, so keys built from the
 * same tags in a different insertion order are equal.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricKey {

    private final String name;
    private final SortedMap<String, String> tags;
    private final String canonical;

    private MetricKey(String name, SortedMap<String, String> tags) {
        this.name = name;
        this.tags = Collections.unmodifiableSortedMap(tags);
        this.canonical = MetricKeyCodec.canonicalKey(name, tags);
    }

    /**
     * Create a key.
     *
     * @param name metric name; must not be {@code null} or blank
     * @param tags tags, may be {@code null}
     * @return the key
     * @throws IllegalArgumentException if the name is blank or a tag is
     *                                  {@code null}
     */
    public static MetricKey of(String name, Map<String, String> tags) {
        MetricKeyCodec.requireName(name);
        return new MetricKey(name, MetricKeyCodec.sortedCopy(tags));
    }

    /**
     * Create a key without tags.
     *
     * @param name metric name
     * @return the key
     */
    public static MetricKey of(String name) {
        return of(name, null);
    }

    public String getName() {
        return name;
    }

    /**
     * @return unmodifiable tags, sorted by key
     */
    public SortedMap<String, String> getTags() {
        return tags;
    }

    /**
     * @return the canonical string form
     */
    public String asString() {
        return canonical;
    }

    /**
     * Whether this key's tags contain every entry of {@code filter}.
     *
     * @param filter required tags, may be {@code null}; its keys and values
     *               must not be {@code null}
     * @return {@code true} if all filter entries are present with equal values
     * @throws IllegalArgumentException if the filter holds a {@code null} key
     *                                  or value
     */
    public boolean hasTags(Map<String, String> filter) {
        if (filter == null) {
            return true;
        }
        for (Map.Entry<String, String> entry : filter.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("Tag filter keys and values must not be null: " + filter);
            }
            if (!entry.getValue().equals(tags.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricKey that))
            return false;
        return canonical.equals(that.canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public String toString() {
        return canonical;
    }
}
