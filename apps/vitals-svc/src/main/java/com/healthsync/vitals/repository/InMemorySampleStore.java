package com.healthsync.vitals.repository;

import com.healthsync.vitals.model.DataType;
import com.healthsync.vitals.model.Sample;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Repository;

@Repository
public class InMemorySampleStore implements SampleStore {

    private static final Comparator<Sample> SERIES_ORDER =
            Comparator.comparing(Sample::timestamp).thenComparingLong(Sample::id);

    private final Map<Long, Sample> storage = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Sample append(String userId, DataType dataType, Instant timestamp, String rawValue) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(dataType, "dataType");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(rawValue, "rawValue");
        Sample sample = new Sample(sequence.incrementAndGet(), userId, dataType, timestamp, rawValue);
        storage.put(sample.id(), sample);
        return sample;
    }

    @Override
    public List<Sample> query(String userId, DataType dataType) {
        return storage.values().stream()
                .filter(sample -> sample.userId().equals(userId) && sample.dataType() == dataType)
                .sorted(SERIES_ORDER)
                .toList();
    }

    @Override
    public List<Sample> query(String userId, DataType dataType, Instant fromInclusive, Instant toExclusive) {
        return query(userId, dataType).stream()
                .filter(sample -> !sample.timestamp().isBefore(fromInclusive) && sample.timestamp().isBefore(toExclusive))
                .toList();
    }
}
