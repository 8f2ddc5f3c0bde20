package com.healthsync.vitals.model;

import java.time.Instant;

public record Prediction(
        String diagnosisName,
        String result,
        int runNumber,
        Instant runTimestamp
) {
}
