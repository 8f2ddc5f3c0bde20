package com.healthsync.vitals.controller.dto;

import java.time.Instant;

public record OutlierRunResponseDto(
        int runNumber,
        Instant runTimestamp,
        String method,
        int flaggedCount
) {
}
