package com.aquiferai.api;

public record HealthResponse(
        String status,
        boolean graphStoreAvailable,
        String modelBackend
) {
}
