package com.healthsync.vitals.model;

import java.time.Instant;

public record OutlierRun(
        String userId,
        DataType dataType,
        int runNumber,
        Instant runTimestamp,
        OutlierMethod method,
        int flaggedCount
) {
}
