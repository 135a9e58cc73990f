package com.aquiferai.pipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum VisualizationType {
    TABLE,
    MAP,
    CHART,
    STATS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VisualizationType fromWireName(String value) {
        if (value == null) {
            return TABLE;
        }
        for (VisualizationType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return TABLE;
    }
}
