package com.healthsync.vitals.entity;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Diagnostic prediction written by the external predictor; read-only here.
 */
@Entity
@Table(name = "ml_predictions")
public class PredictionEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 320)
    private String userId;

    @Column(name = "diagnosis_name", nullable = false)
    private String diagnosisName;

    @Column(name = "result_value", nullable = false, length = 64)
    private String resultValue;

    @Column(name = "iteration_num", nullable = false)
    private int iterationNum;

    @Column(name = "iteration_timestamp", nullable = false)
    private Instant iterationTimestamp;

    protected PredictionEntity() {}

    public PredictionEntity(String userId, String diagnosisName, String resultValue, int iterationNum, Instant iterationTimestamp) {
        this.userId = userId;
        this.diagnosisName = diagnosisName;
        this.resultValue = resultValue;
        this.iterationNum = iterationNum;
        this.iterationTimestamp = iterationTimestamp;
    }

    public Long getId() { return id; }

    public String getUserId() { return userId; }

    public String getDiagnosisName() { return diagnosisName; }

    public String getResultValue() { return resultValue; }

    public int getIterationNum() { return iterationNum; }

    public Instant getIterationTimestamp() { return iterationTimestamp; }
}
