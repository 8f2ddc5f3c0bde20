package com.healthsync.vitals.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

public record IngestionRequestDto(
        @NotBlank String dataType,
        @NotEmpty List<@Valid @NotNull SampleDto> samples
) {
    public record SampleDto(
            @NotBlank String time,
            // samples.raw_value is VARCHAR(1024)
            @NotBlank @Size(max = 1024) String value
    ) {
    }
}
