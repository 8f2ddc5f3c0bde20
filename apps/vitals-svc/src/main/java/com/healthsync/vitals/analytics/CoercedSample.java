package com.healthsync.vitals.analytics;

import com.healthsync.vitals.model.SeriesPoint;

/**
 * A stored sample whose raw value resolved to a number, keyed back to its sample id.
 */
public record CoercedSample(long sampleId, double x, double y) {

    public SeriesPoint toPoint() {
        return new SeriesPoint(x, y);
    }
}
