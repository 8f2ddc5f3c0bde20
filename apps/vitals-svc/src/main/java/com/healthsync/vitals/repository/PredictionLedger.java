package com.healthsync.vitals.repository;

import com.healthsync.vitals.model.Prediction;
import java.util.List;

/**
 * Read side of the predictions written by the external predictor.
 */
public interface PredictionLedger {

    /**
     * Predictions of the user's most recent prediction run, ordered by diagnosis name; empty when
     * the user has none.
     */
    List<Prediction> latestPredictions(String userId);
}
