package com.healthsync.vitals.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;

@Entity
@Table(
        name = "outlier_runs",
        uniqueConstraints = @UniqueConstraint(name = "outlier_runs_scope_run_unique", columnNames = {"user_id", "data_type", "run_number"})
)
public class OutlierRunEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 320)
    private String userId;

    @Column(name = "data_type", nullable = false, updatable = false, length = 64)
    private String dataType;

    @Column(name = "run_number", nullable = false, updatable = false)
    private int runNumber;

    @Column(name = "run_timestamp", nullable = false, updatable = false)
    private Instant runTimestamp;

    @Column(name = "method", nullable = false, updatable = false, length = 16)
    private String method;

    @Column(name = "flagged_count", nullable = false, updatable = false)
    private int flaggedCount;

    protected OutlierRunEntity() {
    }

    public OutlierRunEntity(String userId, String dataType, int runNumber, Instant runTimestamp, String method, int flaggedCount) {
        this.userId = userId;
        this.dataType = dataType;
        this.runNumber = runNumber;
        this.runTimestamp = runTimestamp;
        this.method = method;
        this.flaggedCount = flaggedCount;
    }

    public Long getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public String getDataType() {
        return dataType;
    }

    public int getRunNumber() {
        return runNumber;
    }

    public Instant getRunTimestamp() {
        return runTimestamp;
    }

    public String getMethod() {
        return method;
    }

    public int getFlaggedCount() {
        return flaggedCount;
    }
}
