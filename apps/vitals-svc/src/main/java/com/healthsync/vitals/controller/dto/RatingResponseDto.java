package com.healthsync.vitals.controller.dto;

public record RatingResponseDto(String message, double rating) {
}
