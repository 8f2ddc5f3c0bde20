package com.healthsync.vitals.repository;

import com.healthsync.vitals.model.DataType;
import com.healthsync.vitals.model.OutlierMethod;
import com.healthsync.vitals.model.OutlierRun;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Numbered classification runs per (user, data type). Run numbers start at 1 and increase by one
 * per committed run; a run and its flags become visible together or not at all.
 */
public interface IterationLedger {

    /**
     * Allocates the next run number of the scope and records one flag per sample id. An empty
     * collection still consumes a run number.
     *
     * @throws StorageException when the run could not be committed; nothing is written in that case
     */
    OutlierRun commitRun(String userId,
                         DataType dataType,
                         Collection<Long> flaggedSampleIds,
                         Instant runTimestamp,
                         OutlierMethod method);

    Optional<Integer> latestRun(String userId, DataType dataType);

    Set<Long> flagsForRun(String userId, DataType dataType, int runNumber);

    Optional<OutlierRun> findRun(String userId, DataType dataType, int runNumber);
}
