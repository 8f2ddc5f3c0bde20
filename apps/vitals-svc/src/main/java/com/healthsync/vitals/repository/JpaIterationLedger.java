package com.healthsync.vitals.repository;

import com.healthsync.vitals.entity.OutlierFlagEntity;
import com.healthsync.vitals.entity.OutlierRunEntity;
import com.healthsync.vitals.model.DataType;
import com.healthsync.vitals.model.OutlierMethod;
import com.healthsync.vitals.model.OutlierRun;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Run numbers come from a counter row per (user, data type). The row is incremented with a
 * row-locking UPDATE in the same transaction that writes the run header and its flags, so
 * concurrent commits of one scope serialize on that row while other scopes proceed independently.
 */
@Repository
@Primary
public class JpaIterationLedger implements IterationLedger {

    private static final Logger log = LoggerFactory.getLogger(JpaIterationLedger.class);

    // seeded from the highest committed run so a recreated counter row keeps numbering gap-free
    private static final String CREATE_COUNTER_SQL = """
            INSERT INTO outlier_run_counters (user_id, data_type, last_run_number)
            SELECT CAST(? AS VARCHAR(320)), CAST(? AS VARCHAR(64)),
                   (SELECT COALESCE(MAX(r.run_number), 0) FROM outlier_runs r WHERE r.user_id = ? AND r.data_type = ?)
            FROM (SELECT 1 AS seed) s
            WHERE NOT EXISTS (SELECT 1 FROM outlier_run_counters c WHERE c.user_id = ? AND c.data_type = ?)
            """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final JpaOutlierRunRepository runRepository;
    private final JpaOutlierFlagRepository flagRepository;
    private final Set<String> knownScopes = ConcurrentHashMap.newKeySet();

    public JpaIterationLedger(JdbcTemplate jdbcTemplate,
                              PlatformTransactionManager transactionManager,
                              JpaOutlierRunRepository runRepository,
                              JpaOutlierFlagRepository flagRepository) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.runRepository = runRepository;
        this.flagRepository = flagRepository;
    }

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
        Set<Long> sampleIds = new LinkedHashSet<>(flaggedSampleIds);
        String scope = scopeKey(userId, dataType);
        try {
            // created in its own transaction so the main one never holds a second connection
            if (!knownScopes.contains(scope)) {
                ensureCounterRow(userId, dataType);
                knownScopes.add(scope);
            }
            OutlierRun run = transactionTemplate.execute(status -> {
                int runNumber = nextRunNumber(userId, dataType);
                runRepository.saveAndFlush(new OutlierRunEntity(
                        userId, dataType.value(), runNumber, runTimestamp, method.name(), sampleIds.size()));
                List<OutlierFlagEntity> flags = sampleIds.stream()
                        .map(sampleId -> new OutlierFlagEntity(sampleId, runNumber, runTimestamp))
                        .toList();
                flagRepository.saveAllAndFlush(flags);
                return new OutlierRun(userId, dataType, runNumber, runTimestamp, method, sampleIds.size());
            });
            log.info("Committed outlier run {} for type={} method={} flagged={}",
                    run.runNumber(), dataType.value(), method, run.flaggedCount());
            return run;
        } catch (EmptyResultDataAccessException ex) {
            // counter row vanished under a cached scope; the next commit recreates it
            knownScopes.remove(scope);
            throw new StorageException("Failed to commit outlier run for " + dataType.value(), ex);
        } catch (DataAccessException | TransactionException ex) {
            throw new StorageException("Failed to commit outlier run for " + dataType.value(), ex);
        }
    }

    @Override
    public Optional<Integer> latestRun(String userId, DataType dataType) {
        try {
            return Optional.ofNullable(runRepository.findLatestRunNumber(userId, dataType.value()));
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to read latest outlier run for " + dataType.value(), ex);
        }
    }

    @Override
    public Set<Long> flagsForRun(String userId, DataType dataType, int runNumber) {
        try {
            return Set.copyOf(flagRepository.findFlaggedSampleIds(userId, dataType.value(), runNumber));
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to read outlier flags for " + dataType.value(), ex);
        }
    }

    @Override
    public Optional<OutlierRun> findRun(String userId, DataType dataType, int runNumber) {
        try {
            return runRepository.findByUserIdAndDataTypeAndRunNumber(userId, dataType.value(), runNumber)
                    .map(entity -> new OutlierRun(
                            entity.getUserId(),
                            dataType,
                            entity.getRunNumber(),
                            entity.getRunTimestamp(),
                            OutlierMethod.valueOf(entity.getMethod()),
                            entity.getFlaggedCount()));
        } catch (DataAccessException ex) {
            throw new StorageException("Failed to read outlier run for " + dataType.value(), ex);
        }
    }

    private void ensureCounterRow(String userId, DataType dataType) {
        try {
            transactionTemplate.executeWithoutResult(status -> jdbcTemplate.update(CREATE_COUNTER_SQL,
                    userId, dataType.value(),
                    userId, dataType.value(),
                    userId, dataType.value()));
        } catch (DataIntegrityViolationException ex) {
            // a concurrent first commit created the row
            log.debug("Counter row for type={} created concurrently", dataType.value());
        }
    }

    private static String scopeKey(String userId, DataType dataType) {
        return dataType.value() + '|' + userId;
    }

    private int nextRunNumber(String userId, DataType dataType) {
        int updated = jdbcTemplate.update(
                "UPDATE outlier_run_counters SET last_run_number = last_run_number + 1 WHERE user_id = ? AND data_type = ?",
                userId, dataType.value());
        if (updated != 1) {
            throw new EmptyResultDataAccessException("Run counter missing for type " + dataType.value(), 1);
        }
        Integer runNumber = jdbcTemplate.queryForObject(
                "SELECT last_run_number FROM outlier_run_counters WHERE user_id = ? AND data_type = ?",
                Integer.class, userId, dataType.value());
        return Objects.requireNonNull(runNumber, "last_run_number");
    }
}
