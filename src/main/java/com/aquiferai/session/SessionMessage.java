package com.aquiferai.session;

import java.time.OffsetDateTime;

public record SessionMessage(
        String role,
        String content,
        OffsetDateTime createdAt
) {
}
