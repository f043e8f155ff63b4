package com.realtimeanalytics.core.model;

import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Converts a metric name plus tag set into the canonical string form used as
 * the storage bucket for a series, and back.
 *
 * <h3>Format</h3>
 *
 * <pre>
 *   name:key1:value1,key2:value2
 * </pre>
 * <p>
 * Tags are sorted by key, so two tag maps with the same entries always
 * produce the same key regardless of insertion order. A metric without tags
 * ends in a bare separator ({@code "name:"}). The characters {@code \},
 * {@code :} and {@code ,} inside names, tag keys and tag values are escaped
 * with a backslash so that {@link #parseTags(String)} is the exact inverse of
 * the tag half of {@link #canonicalKey(String, Map)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricKeyCodec {

    static final char NAME_SEPARATOR = ':';
    static final char PAIR_SEPARATOR = ':';
    static final char TAG_SEPARATOR = ',';
    private static final char ESCAPE = '\\';

    private MetricKeyCodec() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Forward
    // ---------------------------------------------------------------

    /**
     * Build the canonical key for a metric name and its tags.
     *
     * @param metricName metric name; must not be {@code null} or blank
     * @param tags       tag map, may be {@code null} or empty; keys and values
     *                   must not be {@code null}
     * @return canonical key string
     * @throws IllegalArgumentException if the name is blank or a tag key or
     *                                  value is {@code null}
     */
    public static String canonicalKey(String metricName, Map<String, String> tags) {
        requireName(metricName);
        return escape(metricName) + NAME_SEPARATOR + serializeTags(tags);
    }

    /**
     * Serialize only the tag half of a canonical key.
     *
     * @param tags tag map, may be {@code null}
     * @return sorted {@code key:value} pairs joined by commas; empty for no tags
     */
    public static String serializeTags(Map<String, String> tags) {
        SortedMap<String, String> sorted = sortedCopy(tags);
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : sorted.entrySet()) {
            if (sb.length() > 0) {
                sb.append(TAG_SEPARATOR);
            }
            sb.append(escape(entry.getKey()))
                    .append(PAIR_SEPARATOR)
                    .append(escape(entry.getValue()));
        }
        return sb.toString();
    }

    // ---------------------------------------------------------------
    // Inverse
    // ---------------------------------------------------------------

    /**
     * Parse a tag string produced by {@link #serializeTags(Map)}.
     *
     * @param tagString serialized tags; {@code null} or empty yields no tags
     * @return sorted, mutable tag map
     * @throws IllegalArgumentException if a pair has no separator or the string
     *                                  ends in a dangling escape
     */
    public static SortedMap<String, String> parseTags(String tagString) {
        SortedMap<String, String> tags = new TreeMap<>();
        if (tagString == null || tagString.isEmpty()) {
            return tags;
        }

        StringBuilder key = new StringBuilder();
        StringBuilder value = new StringBuilder();
        boolean inValue = false;
        boolean escaped = false;

        for (int i = 0; i < tagString.length(); i++) {
            char c = tagString.charAt(i);
            StringBuilder current = inValue ? value : key;
            if (escaped) {
                current.append(c);
                escaped = false;
            } else if (c == ESCAPE) {
                escaped = true;
            } else if (c == PAIR_SEPARATOR && !inValue) {
                inValue = true;
            } else if (c == TAG_SEPARATOR) {
                putPair(tags, key, value, inValue, tagString);
                key.setLength(0);
                value.setLength(0);
                inValue = false;
            } else {
                current.append(c);
            }
        }
        if (escaped) {
            throw new IllegalArgumentException("Dangling escape in tag string: " + tagString);
        }
        putPair(tags, key, value, inValue, tagString);
        return tags;
    }

    /**
     * Split a canonical key into its parts.
     *
     * @param canonicalKey a key produced by {@link #canonicalKey(String, Map)}
     * @return the decoded key
     * @throws IllegalArgumentException if the string has no name separator
     */
    public static MetricKey parseKey(String canonicalKey) {
        Objects.requireNonNull(canonicalKey, "Canonical key must not be null");
        int separator = indexOfUnescaped(canonicalKey, NAME_SEPARATOR);
        if (separator < 0) {
            throw new IllegalArgumentException("Not a canonical metric key: " + canonicalKey);
        }
        String name = unescape(canonicalKey.substring(0, separator));
        return MetricKey.of(name, parseTags(canonicalKey.substring(separator + 1)));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static void requireName(String metricName) {
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("Metric name must not be null or blank");
        }
    }

    static SortedMap<String, String> sortedCopy(Map<String, String> tags) {
        SortedMap<String, String> sorted = new TreeMap<>();
        if (tags == null) {
            return sorted;
        }
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("Tag keys and values must not be null: " + tags);
            }
            sorted.put(entry.getKey(), entry.getValue());
        }
        return sorted;
    }

    private static void putPair(Map<String, String> tags, StringBuilder key, StringBuilder value,
            boolean inValue, String source) {
        if (!inValue) {
            throw new IllegalArgumentException("Malformed tag pair '" + key + "' in: " + source);
        }
        tags.put(key.toString(), value.toString());
    }

    private static String escape(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c == ESCAPE || c == NAME_SEPARATOR || c == TAG_SEPARATOR) {
                sb.append(ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static String unescape(String escaped) {
        StringBuilder sb = new StringBuilder(escaped.length());
        boolean pending = false;
        for (int i = 0; i < escaped.length(); i++) {
            char c = escaped.charAt(i);
            if (!pending && c == ESCAPE) {
                pending = true;
            } else {
                sb.append(c);
                pending = false;
            }
        }
        return sb.toString();
    }

    private static int indexOfUnescaped(String s, char target) {
        boolean escaped = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == ESCAPE) {
                escaped = true;
            } else if (c == target) {
                return i;
            }
        }
        return -1;
    }
}
