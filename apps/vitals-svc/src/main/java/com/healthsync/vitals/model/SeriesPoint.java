package com.healthsync.vitals.model;

/**
 * One point of a user's series: x is the unix timestamp in seconds, y the coerced value.
 */
public record SeriesPoint(double x, double y) {
}
