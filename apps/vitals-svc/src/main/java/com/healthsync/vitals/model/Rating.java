package com.healthsync.vitals.model;

import java.time.Instant;

public record Rating(String userId, double value, Instant updatedAt) {
}
