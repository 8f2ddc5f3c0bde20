package com.healthsync.vitals.controller.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

public record RatingRequestDto(
        @NotNull @DecimalMin("1") @DecimalMax("5") Double rating
) {
}
