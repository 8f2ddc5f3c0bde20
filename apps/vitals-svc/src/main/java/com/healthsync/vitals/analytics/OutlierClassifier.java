package com.healthsync.vitals.analytics;

import com.healthsync.vitals.config.VitalsProperties;
import com.healthsync.vitals.model.OutlierMethod;
import com.healthsync.vitals.model.SeriesPoint;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Flags statistically anomalous points of a series. Stateless apart from its two tuning
 * constants; the input list is never modified.
 */
@Component
public class OutlierClassifier {

    public static final double DEFAULT_IQR_MULTIPLIER = 1.5d;
    public static final double DEFAULT_Z_SCORE_THRESHOLD = 2.0d;

    private final double iqrMultiplier;
    private final double zScoreThreshold;

    public OutlierClassifier() {
        this(DEFAULT_IQR_MULTIPLIER, DEFAULT_Z_SCORE_THRESHOLD);
    }

    @Autowired
    public OutlierClassifier(VitalsProperties properties) {
        this(properties.outliers().iqrMultiplier(), properties.outliers().zScoreThreshold());
    }

    public OutlierClassifier(double iqrMultiplier, double zScoreThreshold) {
        if (iqrMultiplier <= 0 || zScoreThreshold <= 0) {
            throw new IllegalArgumentException("iqrMultiplier and zScoreThreshold must be positive");
        }
        this.iqrMultiplier = iqrMultiplier;
        this.zScoreThreshold = zScoreThreshold;
    }

    public Set<Double> classify(List<SeriesPoint> points, OutlierMethod method) {
        if (points == null) {
            throw new ClassificationException("points must not be null");
        }
        List<Double> values = new ArrayList<>(points.size());
        for (SeriesPoint point : points) {
            if (point == null) {
                throw new ClassificationException("series contains a null point");
            }
            values.add(point.y());
        }
        Set<Double> flagged = new LinkedHashSet<>();
        for (int index : flaggedIndices(values, method)) {
            flagged.add(points.get(index).x());
        }
        return Collections.unmodifiableSet(flagged);
    }

    /**
     * Positions (ascending) of the values flagged by {@code method}.
     */
    public List<Integer> flaggedIndices(List<Double> values, OutlierMethod method) {
        if (method == null) {
            throw new ClassificationException("method must not be null");
        }
        if (values == null) {
            throw new ClassificationException("values must not be null");
        }
        for (Double value : values) {
            if (value == null || !Double.isFinite(value)) {
                throw new ClassificationException("values must be finite numbers");
            }
        }
        if (values.size() < 2) {
            return List.of();
        }
        return switch (method) {
            case IQR -> iqrOutliers(values);
            case Z_SCORE -> zScoreOutliers(values);
        };
    }

    private List<Integer> iqrOutliers(List<Double> values) {
        List<Double> sorted = values.stream().sorted().toList();
        double q1 = percentile(sorted, 25);
        double q3 = percentile(sorted, 75);
        // identical values give lower == upper == the value itself, so nothing is flagged
        double iqr = q3 - q1;
        double lower = q1 - iqrMultiplier * iqr;
        double upper = q3 + iqrMultiplier * iqr;
        List<Integer> flagged = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            double value = values.get(i);
            if (value < lower || value > upper) {
                flagged.add(i);
            }
        }
        return flagged;
    }

    private List<Integer> zScoreOutliers(List<Double> values) {
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0d);
        double variance = values.stream()
                .mapToDouble(value -> Math.pow(value - mean, 2))
                .average()
                .orElse(0d);
        double stdDev = Math.sqrt(variance);
        if (stdDev == 0d) {
            return List.of();
        }
        double limit = zScoreThreshold * stdDev;
        List<Integer> flagged = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            if (Math.abs(values.get(i) - mean) > limit) {
                flagged.add(i);
            }
        }
        return flagged;
    }

    // Linear interpolation between closest ranks.
    static double percentile(List<Double> sortedValues, double percentile) {
        if (sortedValues.isEmpty()) {
            return 0d;
        }
        double index = percentile / 100.0 * (sortedValues.size() - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sortedValues.get(lower);
        }
        double weight = index - lower;
        return sortedValues.get(lower) * (1 - weight) + sortedValues.get(upper) * weight;
    }
}
