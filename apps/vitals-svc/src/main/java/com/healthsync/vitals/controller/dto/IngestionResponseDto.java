package com.healthsync.vitals.controller.dto;

public record IngestionResponseDto(int stored) {
}
