package com.aquiferai.gateway;

/**
 * Logical callers of the model gateway. Each role maps to its own model id and sampling settings.
 */
public enum ModelRole {
    PLANNER("planner"),
    QUERY_WRITER("query-writer"),
    HEALER("healer"),
    SYNTHESIZER("synthesizer");

    private final String wireName;

    ModelRole(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
