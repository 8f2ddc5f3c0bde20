package com.healthsync.vitals.repository;

import com.healthsync.vitals.entity.SampleEntity;
import com.healthsync.vitals.model.DataType;
import com.healthsync.vitals.model.Sample;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class JpaSampleStore implements SampleStore {

    private final JpaSampleRepository jpaSampleRepository;

    public JpaSampleStore(JpaSampleRepository jpaSampleRepository) {
        this.jpaSampleRepository = jpaSampleRepository;
    }

    @Override
    public Sample append(String userId, DataType dataType, Instant timestamp, String rawValue) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(dataType, "dataType");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(rawValue, "rawValue");
        try {
            SampleEntity saved = jpaSampleRepository.save(
                    new SampleEntity(userId, dataType.value(), timestamp, rawValue, Instant.now()));
            return toModel(saved, dataType);
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to append " + dataType.value() + " sample", ex);
        }
    }

    @Override
    public List<Sample> query(String userId, DataType dataType) {
        try {
            return jpaSampleRepository.findSeries(userId, dataType.value()).stream()
                    .map(entity -> toModel(entity, dataType))
                    .toList();
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to read " + dataType.value() + " samples", ex);
        }
    }

    @Override
    public List<Sample> query(String userId, DataType dataType, Instant fromInclusive, Instant toExclusive) {
        try {
            return jpaSampleRepository.findSeriesInRange(userId, dataType.value(), fromInclusive, toExclusive).stream()
                    .map(entity -> toModel(entity, dataType))
                    .toList();
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to read " + dataType.value() + " samples", ex);
        }
    }

    private Sample toModel(SampleEntity entity, DataType dataType) {
        return new Sample(entity.getId(), entity.getUserId(), dataType, entity.getRecordedAt(), entity.getRawValue());
    }
}
