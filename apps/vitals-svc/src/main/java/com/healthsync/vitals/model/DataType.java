package com.healthsync.vitals.model;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum DataType {
    PULSE("PULSE"),
    BLOOD_OXYGEN("BLOOD_OXYGEN"),
    STRESS_LVL("STRESS_LVL"),
    RESPIRATORY_RATE("RESPIRATORY_RATE"),
    SLEEP_TIME("SLEEP_TIME"),
    STEPS("STEPS"),
    BODY_TEMPERATURE("BODY_TEMPERATURE"),
    SLEEP_SESSION_TIME_DATA("SleepSessionTimeData");

    private final String value;

    DataType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static DataType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("dataType must be provided");
        }
        String trimmed = value.trim();
        for (DataType type : values()) {
            if (type.value.equals(trimmed)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported dataType '" + trimmed + "'. Supported values: " + supportedValues());
    }

    private static String supportedValues() {
        return Arrays.stream(values()).map(DataType::value).collect(Collectors.joining(","));
    }
}
