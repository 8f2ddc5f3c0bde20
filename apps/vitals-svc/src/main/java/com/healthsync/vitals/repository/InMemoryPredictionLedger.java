package com.healthsync.vitals.repository;

import com.healthsync.vitals.model.Prediction;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryPredictionLedger implements PredictionLedger {

    private final Map<String, List<Prediction>> storage = new ConcurrentHashMap<>();

    public void add(String userId, Prediction prediction) {
        storage.computeIfAbsent(userId, key -> new CopyOnWriteArrayList<>()).add(prediction);
    }

    @Override
    public List<Prediction> latestPredictions(String userId) {
        List<Prediction> predictions = storage.getOrDefault(userId, List.of());
        int latest = predictions.stream().mapToInt(Prediction::runNumber).max().orElse(0);
        return predictions.stream()
                .filter(prediction -> prediction.runNumber() == latest)
                .sorted(Comparator.comparing(Prediction::diagnosisName))
                .toList();
    }
}
