package com.healthsync.vitals.controller.dto;

public record PredictionDto(String diagnosisName, String result) {
}
