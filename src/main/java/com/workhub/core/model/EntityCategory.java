package com.workhub.core.model;

/**
 * Semantic categories recognised by the entity extractor.
 */
public enum EntityCategory {
    TIME_MENTIONS("time_mentions"),
    LOCATIONS("locations"),
    EQUIPMENT("equipment"),
    URGENCY("urgency");

    private final String key;

    EntityCategory(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
