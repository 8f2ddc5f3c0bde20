package com.healthsync.vitals.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "samples")
public class SampleEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false, length = 320)
    private String userId;

    @Column(name = "data_type", nullable = false, updatable = false, length = 64)
    private String dataType;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    @Column(name = "raw_value", nullable = false, updatable = false, length = 1024)
    private String rawValue;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    // Default constructor for JPA
    protected SampleEntity() {}

    public SampleEntity(String userId, String dataType, Instant recordedAt, String rawValue, Instant createdAt) {
        this.userId = userId;
        this.dataType = dataType;
        this.recordedAt = recordedAt;
        this.rawValue = rawValue;
        this.createdAt = createdAt;
    }

    public Long getId() { return id; }

    public String getUserId() { return userId; }

    public String getDataType() { return dataType; }

    public Instant getRecordedAt() { return recordedAt; }

    public String getRawValue() { return rawValue; }

    public Instant getCreatedAt() { return createdAt; }
}
