package com.healthsync.vitals.repository;

import com.healthsync.vitals.model.DataType;
import com.healthsync.vitals.model.Sample;
import java.time.Instant;
import java.util.List;

/**
 * Append-only store of raw measurements. Series are returned ascending by timestamp with ties
 * broken by insertion order. Failures surface as {@link StorageException}.
 */
public interface SampleStore {

    Sample append(String userId, DataType dataType, Instant timestamp, String rawValue);

    List<Sample> query(String userId, DataType dataType);

    List<Sample> query(String userId, DataType dataType, Instant fromInclusive, Instant toExclusive);
}
