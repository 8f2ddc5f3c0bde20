package com.healthsync.vitals.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "rating_records")
public class RatingEntity {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, unique = true, length = 320)
    private String userId;

    @Column(name = "rating_value", nullable = false)
    private double ratingValue;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected RatingEntity() {}

    public RatingEntity(String userId, double ratingValue, Instant updatedAt) {
        this.userId = userId;
        this.ratingValue = ratingValue;
        this.updatedAt = updatedAt;
    }

    public Long getId() { return id; }

    public String getUserId() { return userId; }

    public double getRatingValue() { return ratingValue; }
    public void setRatingValue(double ratingValue) { this.ratingValue = ratingValue; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
