package com.healthsync.vitals.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.healthsync.vitals.model.SeriesPoint;

/**
 * One chart point: unix seconds on X, the measured value on Y.
 */
public record DataRecordDto(
        @JsonProperty("X") double x,
        @JsonProperty("Y") double y
) {
    public static DataRecordDto from(SeriesPoint point) {
        return new DataRecordDto(point.x(), point.y());
    }
}
