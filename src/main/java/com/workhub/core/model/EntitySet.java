package com.workhub.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Entity hints extracted from one message, keyed by category.
 * <p>
 * A category is present only when at least one match was found; it is never
 * mapped to an empty list. Values keep the order in which they appear in the text.
 */
public final class EntitySet implements Serializable {

    private static final EntitySet EMPTY = new EntitySet(new EnumMap<>(EntityCategory.class));

    private final Map<EntityCategory, List<String>> entries;

    private EntitySet(EnumMap<EntityCategory, List<String>> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static EntitySet empty() {
        return EMPTY;
    }

    public static EntitySet of(Map<EntityCategory, List<String>> matches) {
        var copy = new EnumMap<EntityCategory, List<String>>(EntityCategory.class);
        matches.forEach((category, values) -> {
            if (values != null && !values.isEmpty()) {
                copy.put(category, List.copyOf(values));
            }
        });
        return copy.isEmpty() ? EMPTY : new EntitySet(copy);
    }

    public List<String> get(EntityCategory category) {
        return entries.getOrDefault(category, List.of());
    }

    public boolean contains(EntityCategory category) {
        return entries.containsKey(category);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Case-insensitive substring test against the values of one category.
     */
    public boolean mentions(EntityCategory category, String needle) {
        String lowerNeedle = needle.toLowerCase(Locale.ROOT);
        return get(category).stream()
                .anyMatch(value -> value.toLowerCase(Locale.ROOT).contains(lowerNeedle));
    }

    /** Category keys as used on the wire, e.g. {@code {"urgency": ["urgent"]}}. */
    @JsonValue
    public Map<String, List<String>> asMap() {
        var map = new LinkedHashMap<String, List<String>>();
        entries.forEach((category, values) -> map.put(category.key(), values));
        return map;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EntitySet other && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
