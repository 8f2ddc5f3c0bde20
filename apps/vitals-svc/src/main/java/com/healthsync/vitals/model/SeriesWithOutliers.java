package com.healthsync.vitals.model;

import java.util.List;

public record SeriesWithOutliers(
        List<SeriesPoint> series,
        List<Double> outlierX
) {
    public static SeriesWithOutliers empty() {
        return new SeriesWithOutliers(List.of(), List.of());
    }
}
