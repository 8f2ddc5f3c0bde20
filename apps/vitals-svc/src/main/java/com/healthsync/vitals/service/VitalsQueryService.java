package com.healthsync.vitals.service;

import com.healthsync.vitals.analytics.CoercedSample;
import com.healthsync.vitals.analytics.SampleValueParser;
import com.healthsync.vitals.model.DataType;
import com.healthsync.vitals.model.OutlierRun;
import com.healthsync.vitals.model.Prediction;
import com.healthsync.vitals.model.SeriesPoint;
import com.healthsync.vitals.model.SeriesWithOutliers;
import com.healthsync.vitals.repository.IterationLedger;
import com.healthsync.vitals.repository.PredictionLedger;
import com.healthsync.vitals.repository.SampleStore;
import com.healthsync.vitals.security.NotAuthenticatedException;
import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * Read side used by the dashboards: series, series annotated with the latest outlier run, and
 * the latest predictions. All reads are scoped to the given user.
 */
@Service
public class VitalsQueryService {

    private final SampleStore sampleStore;
    private final IterationLedger iterationLedger;
    private final PredictionLedger predictionLedger;
    private final SampleValueParser valueParser;

    public VitalsQueryService(SampleStore sampleStore,
                              IterationLedger iterationLedger,
                              PredictionLedger predictionLedger,
                              SampleValueParser valueParser) {
        this.sampleStore = sampleStore;
        this.iterationLedger = iterationLedger;
        this.predictionLedger = predictionLedger;
        this.valueParser = valueParser;
    }

    public List<SeriesPoint> getSeries(String userId, String dataType) {
        requireUser(userId);
        DataType type = DataType.fromValue(dataType);
        return toPoints(valueParser.coerce(sampleStore.query(userId, type)));
    }

    public List<SeriesPoint> getSeries(String userId, String dataType, Instant fromInclusive, Instant toExclusive) {
        requireUser(userId);
        DataType type = DataType.fromValue(dataType);
        if (fromInclusive == null || toExclusive == null) {
            throw new IllegalArgumentException("from and to must both be provided");
        }
        if (fromInclusive.isAfter(toExclusive)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        return toPoints(valueParser.coerce(sampleStore.query(userId, type, fromInclusive, toExclusive)));
    }

    public SeriesWithOutliers getSeriesWithOutliers(String userId, String dataType) {
        requireUser(userId);
        DataType type = DataType.fromValue(dataType);
        List<CoercedSample> coerced = valueParser.coerce(sampleStore.query(userId, type));
        if (coerced.isEmpty()) {
            return SeriesWithOutliers.empty();
        }
        Optional<Integer> latestRun = iterationLedger.latestRun(userId, type);
        if (latestRun.isEmpty()) {
            return new SeriesWithOutliers(toPoints(coerced), List.of());
        }
        Set<Long> flagged = iterationLedger.flagsForRun(userId, type, latestRun.get());
        // flags of samples that no longer coerce are dropped so every x refers to a returned point
        List<Double> outlierX = coerced.stream()
                .filter(sample -> flagged.contains(sample.sampleId()))
                .map(CoercedSample::x)
                .distinct()
                .sorted()
                .toList();
        return new SeriesWithOutliers(toPoints(coerced), outlierX);
    }

    /**
     * Header of the run that {@link #getSeriesWithOutliers} currently reports.
     *
     * @throws NoSuchElementException when the series was never classified
     */
    public OutlierRun getLatestRun(String userId, String dataType) {
        requireUser(userId);
        DataType type = DataType.fromValue(dataType);
        return iterationLedger.latestRun(userId, type)
                .flatMap(runNumber -> iterationLedger.findRun(userId, type, runNumber))
                .orElseThrow(() -> new NoSuchElementException("no outlier run for " + type.value()));
    }

    public List<Prediction> getPredictions(String userId) {
        requireUser(userId);
        return predictionLedger.latestPredictions(userId);
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new NotAuthenticatedException("user context missing");
        }
    }

    private static List<SeriesPoint> toPoints(List<CoercedSample> coerced) {
        return coerced.stream().map(CoercedSample::toPoint).toList();
    }
}
