package com.healthsync.vitals.model;

import java.time.Instant;

public record Sample(
        long id,
        String userId,
        DataType dataType,
        Instant timestamp,
        String rawValue
) {
}
