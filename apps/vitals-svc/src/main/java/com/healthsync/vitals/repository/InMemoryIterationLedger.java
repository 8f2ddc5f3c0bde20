package com.healthsync.vitals.repository;

import com.healthsync.vitals.model.DataType;
import com.healthsync.vitals.model.OutlierMethod;
import com.healthsync.vitals.model.OutlierRun;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryIterationLedger implements IterationLedger {

    private final Map<Scope, ScopeRuns> scopes = new ConcurrentHashMap<>();

    @Override
    public OutlierRun commitRun(String userId,
                                DataType dataType,
                                Collection<Long> flaggedSampleIds,
                                Instant runTimestamp,
                                OutlierMethod method) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(dataType, "dataType");
        Objects.requireNonNull(flaggedSampleIds, "flaggedSampleIds");
        Objects.requireNonNull(runTimestamp, "runTimestamp");
        Objects.requireNonNull(method, "method");
        Set<Long> flags = Set.copyOf(flaggedSampleIds);
        ScopeRuns runs = scopes.computeIfAbsent(new Scope(userId, dataType), scope -> new ScopeRuns());
        synchronized (runs) {
            OutlierRun run = new OutlierRun(userId, dataType, runs.headers.size() + 1, runTimestamp, method, flags.size());
            runs.headers.add(run);
            runs.flags.add(flags);
            return run;
        }
    }

    @Override
    public Optional<Integer> latestRun(String userId, DataType dataType) {
        ScopeRuns runs = scopes.get(new Scope(userId, dataType));
        if (runs == null) {
            return Optional.empty();
        }
        synchronized (runs) {
            return runs.headers.isEmpty() ? Optional.empty() : Optional.of(runs.headers.size());
        }
    }

    @Override
    public Set<Long> flagsForRun(String userId, DataType dataType, int runNumber) {
        ScopeRuns runs = scopes.get(new Scope(userId, dataType));
        if (runs == null) {
            return Set.of();
        }
        synchronized (runs) {
            if (runNumber < 1 || runNumber > runs.flags.size()) {
                return Set.of();
            }
            return runs.flags.get(runNumber - 1);
        }
    }

    @Override
    public Optional<OutlierRun> findRun(String userId, DataType dataType, int runNumber) {
        ScopeRuns runs = scopes.get(new Scope(userId, dataType));
        if (runs == null) {
            return Optional.empty();
        }
        synchronized (runs) {
            if (runNumber < 1 || runNumber > runs.headers.size()) {
                return Optional.empty();
            }
            return Optional.of(runs.headers.get(runNumber - 1));
        }
    }

    private record Scope(String userId, DataType dataType) {
    }

    private static final class ScopeRuns {
        private final List<OutlierRun> headers = new ArrayList<>();
        private final List<Set<Long>> flags = new ArrayList<>();
    }
}
