package com.healthsync.vitals.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;

/**
 * Marks a sample as anomalous in one classification run. Rows are never updated or deleted.
 */
@Entity
@Table(
        name = "outlier_flags",
        uniqueConstraints = @UniqueConstraint(name = "outlier_flags_sample_run_unique", columnNames = {"sample_id", "run_number"})
)
public class OutlierFlagEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "sample_id", nullable = false, updatable = false)
    private Long sampleId;

    @Column(name = "run_number", nullable = false, updatable = false)
    private int runNumber;

    @Column(name = "run_timestamp", nullable = false, updatable = false)
    private Instant runTimestamp;

    protected OutlierFlagEntity() {
    }

    public OutlierFlagEntity(Long sampleId, int runNumber, Instant runTimestamp) {
        this.sampleId = sampleId;
        this.runNumber = runNumber;
        this.runTimestamp = runTimestamp;
    }

    public Long getId() {
        return id;
    }

    public Long getSampleId() {
        return sampleId;
    }

    public int getRunNumber() {
        return runNumber;
    }

    public Instant getRunTimestamp() {
        return runTimestamp;
    }
}
