package com.healthsync.vitals.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.healthsync.vitals.model.OutlierMethod;
import com.healthsync.vitals.model.SeriesPoint;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class OutlierClassifierTest {

    private final OutlierClassifier classifier = new OutlierClassifier();

    @Test
    void iqrFlagsOnlyTheSpike() {
        List<SeriesPoint> points = series(10, 12, 12, 13, 12, 11, 14, 13, 15, 102);

        assertThat(classifier.classify(points, OutlierMethod.IQR)).containsExactly(10d);
    }

    @Test
    void zScoreFlagsOnlyTheSpike() {
        List<SeriesPoint> points = series(50, 52, 49, 51, 50, 300);

        assertThat(classifier.classify(points, OutlierMethod.Z_SCORE)).containsExactly(6d);
    }

    @ParameterizedTest
    @EnumSource(OutlierMethod.class)
    void identicalValuesFlagNothing(OutlierMethod method) {
        assertThat(classifier.classify(series(72, 72, 72, 72, 72), method)).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(OutlierMethod.class)
    void fewerThanTwoPointsFlagNothing(OutlierMethod method) {
        assertThat(classifier.classify(List.of(), method)).isEmpty();
        assertThat(classifier.classify(series(500), method)).isEmpty();
    }

    @Test
    void zeroInterquartileRangeStillFlagsValuesOutsideTheFences() {
        // readings that cluster on one value: Q1 == Q3 == 98, so the fences collapse onto 98
        List<Double> oxygen = List.of(98d, 98d, 98d, 98d, 98d, 98d, 85d);

        assertThat(classifier.flaggedIndices(oxygen, OutlierMethod.IQR)).containsExactly(6);
    }

    @Test
    void flaggedIndicesKeepsDuplicateTimestampsApart() {
        List<Double> values = List.of(10d, 11d, 12d, 10d, 11d, 12d, 10d, 11d, 12d, 50d);

        assertThat(classifier.flaggedIndices(values, OutlierMethod.Z_SCORE)).containsExactly(9);
    }

    @Test
    void configuredThresholdIsApplied() {
        OutlierClassifier strict = new OutlierClassifier(1.5d, 1.0d);
        List<Double> values = List.of(1d, 2d, 3d, 4d, 5d);

        // mean 3, population std ~1.414: only the two ends exceed one std
        assertThat(strict.flaggedIndices(values, OutlierMethod.Z_SCORE)).containsExactly(0, 4);
        assertThat(classifier.flaggedIndices(values, OutlierMethod.Z_SCORE)).isEmpty();
    }

    @Test
    void inputIsNotModified() {
        List<SeriesPoint> points = new ArrayList<>(series(3, 1, 2, 99, 2, 1, 3, 2));
        List<SeriesPoint> before = List.copyOf(points);

        classifier.classify(points, OutlierMethod.IQR);
        classifier.classify(points, OutlierMethod.Z_SCORE);

        assertThat(points).containsExactlyElementsOf(before);
    }

    @Test
    void repeatedCallsAgree() {
        List<SeriesPoint> points = series(10, 12, 12, 13, 12, 11, 14, 13, 15, 102);

        assertThat(classifier.classify(points, OutlierMethod.IQR))
                .isEqualTo(classifier.classify(points, OutlierMethod.IQR));
    }

    @Test
    void malformedInputIsRejected() {
        assertThatThrownBy(() -> classifier.classify(null, OutlierMethod.IQR))
                .isInstanceOf(ClassificationException.class);
        assertThatThrownBy(() -> classifier.classify(series(1, 2, 3), null))
                .isInstanceOf(ClassificationException.class);
        assertThatThrownBy(() -> classifier.flaggedIndices(Arrays.asList(1d, null, 3d), OutlierMethod.IQR))
                .isInstanceOf(ClassificationException.class);
        assertThatThrownBy(() -> classifier.flaggedIndices(List.of(1d, Double.NaN, 3d), OutlierMethod.Z_SCORE))
                .isInstanceOf(ClassificationException.class);
    }

    @Test
    void percentileInterpolatesBetweenRanks() {
        List<Double> sorted = List.of(10d, 11d, 12d, 12d, 12d, 13d, 13d, 14d, 15d, 102d);

        assertThat(OutlierClassifier.percentile(sorted, 25)).isEqualTo(12d);
        assertThat(OutlierClassifier.percentile(sorted, 75)).isEqualTo(13.75d);
    }

    // x = 1..n
    private static List<SeriesPoint> series(double... ys) {
        List<SeriesPoint> points = new ArrayList<>();
        for (int i = 0; i < ys.length; i++) {
            points.add(new SeriesPoint(i + 1, ys[i]));
        }
        return points;
    }
}
