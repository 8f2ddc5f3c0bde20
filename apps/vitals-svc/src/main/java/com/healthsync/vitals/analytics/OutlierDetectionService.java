package com.healthsync.vitals.analytics;

import com.healthsync.vitals.config.VitalsProperties;
import com.healthsync.vitals.model.DataType;
import com.healthsync.vitals.model.OutlierMethod;
import com.healthsync.vitals.model.OutlierRun;
import com.healthsync.vitals.repository.IterationLedger;
import com.healthsync.vitals.repository.SampleStore;
import com.healthsync.vitals.security.NotAuthenticatedException;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Classifies a user's current series and records the result as a new numbered run.
 */
@Service
public class OutlierDetectionService {

    private static final Logger log = LoggerFactory.getLogger(OutlierDetectionService.class);

    private final SampleStore sampleStore;
    private final IterationLedger iterationLedger;
    private final SampleValueParser valueParser;
    private final OutlierClassifier classifier;
    private final OutlierMethod defaultMethod;

    public OutlierDetectionService(SampleStore sampleStore,
                                   IterationLedger iterationLedger,
                                   SampleValueParser valueParser,
                                   OutlierClassifier classifier,
                                   VitalsProperties properties) {
        this.sampleStore = sampleStore;
        this.iterationLedger = iterationLedger;
        this.valueParser = valueParser;
        this.classifier = classifier;
        this.defaultMethod = properties.outliers().defaultMethod();
    }

    /**
     * @param method outlier method name; {@code null} selects the configured default
     */
    public OutlierRun runClassification(String userId, String dataType, String method) {
        if (userId == null || userId.isBlank()) {
            throw new NotAuthenticatedException("user context missing");
        }
        DataType type = DataType.fromValue(dataType);
        OutlierMethod resolvedMethod = method == null ? defaultMethod : OutlierMethod.fromValue(method);

        List<CoercedSample> coerced = valueParser.coerce(sampleStore.query(userId, type));
        List<Double> values = coerced.stream().map(CoercedSample::y).toList();
        List<Long> flaggedIds = classifier.flaggedIndices(values, resolvedMethod).stream()
                .map(index -> coerced.get(index).sampleId())
                .toList();
        log.debug("Classified {} {} samples with {}: {} flagged", coerced.size(), type.value(), resolvedMethod, flaggedIds.size());
        return iterationLedger.commitRun(userId, type, flaggedIds, Instant.now(), resolvedMethod);
    }
}
