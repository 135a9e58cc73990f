package com.aquiferai.session;

import java.time.OffsetDateTime;

public record SessionSummary(
        String sessionId,
        String title,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
