package com.healthsync.vitals.repository;

import com.healthsync.vitals.entity.PredictionEntity;
import com.healthsync.vitals.model.Prediction;
import java.util.List;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class JpaPredictionLedger implements PredictionLedger {

    private final JpaPredictionRepository jpaPredictionRepository;

    public JpaPredictionLedger(JpaPredictionRepository jpaPredictionRepository) {
        this.jpaPredictionRepository = jpaPredictionRepository;
    }

    @Override
    public List<Prediction> latestPredictions(String userId) {
        try {
            return jpaPredictionRepository.findLatestIteration(userId).stream()
                    .map(this::toModel)
                    .toList();
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to read predictions", ex);
        }
    }

    private Prediction toModel(PredictionEntity entity) {
        return new Prediction(
                entity.getDiagnosisName(),
                entity.getResultValue(),
                entity.getIterationNum(),
                entity.getIterationTimestamp());
    }
}
