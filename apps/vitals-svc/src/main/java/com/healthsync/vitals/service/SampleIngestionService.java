package com.healthsync.vitals.service;

import com.healthsync.vitals.model.DataType;
import com.healthsync.vitals.model.Sample;
import com.healthsync.vitals.repository.SampleStore;
import com.healthsync.vitals.security.NotAuthenticatedException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Direct write path for measurements pushed by clients. A batch is stored entirely or not at all.
 */
@Service
public class SampleIngestionService {

    private static final Logger log = LoggerFactory.getLogger(SampleIngestionService.class);

    private final SampleStore sampleStore;

    public SampleIngestionService(SampleStore sampleStore) {
        this.sampleStore = sampleStore;
    }

    public record SampleInput(String time, String value) {
    }

    @Transactional
    public List<Sample> ingest(String userId, String dataType, List<SampleInput> samples) {
        if (userId == null || userId.isBlank()) {
            throw new NotAuthenticatedException("user context missing");
        }
        DataType type = DataType.fromValue(dataType);
        if (samples == null || samples.isEmpty()) {
            throw new IllegalArgumentException("samples must not be empty");
        }
        // validate the whole batch before the first write
        List<Instant> timestamps = new ArrayList<>(samples.size());
        for (SampleInput input : samples) {
            if (input == null || input.value() == null || input.value().isBlank()) {
                throw new IllegalArgumentException("every sample needs a value");
            }
            timestamps.add(parseTimestamp(input.time()));
        }
        List<Sample> stored = new ArrayList<>(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            stored.add(sampleStore.append(userId, type, timestamps.get(i), samples.get(i).value()));
        }
        log.info("Stored {} {} samples", stored.size(), type.value());
        return stored;
    }

    static Instant parseTimestamp(String time) {
        if (time == null || time.isBlank()) {
            throw new IllegalArgumentException("every sample needs a time");
        }
        try {
            return OffsetDateTime.parse(time.trim()).toInstant();
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("time must be an ISO-8601 timestamp with offset: '" + time + "'");
        }
    }
}
