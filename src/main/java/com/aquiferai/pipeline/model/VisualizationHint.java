package com.aquiferai.pipeline.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record VisualizationHint(
        VisualizationType type,
        String dataKey,
        Map<String, Object> config
) {

    public VisualizationHint {
        type = type != null ? type : VisualizationType.TABLE;
        config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
    }
}
