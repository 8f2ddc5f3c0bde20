package com.healthsync.vitals.controller.dto;

import java.util.List;

public record DataWithOutliersDto(
        List<DataRecordDto> data,
        List<Double> outliersX
) {
}
