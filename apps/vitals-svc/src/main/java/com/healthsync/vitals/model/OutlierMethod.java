package com.healthsync.vitals.model;

import java.util.Locale;

public enum OutlierMethod {
    IQR,
    Z_SCORE;

    public static OutlierMethod fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("method must be provided");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("ZSCORE".equals(normalized)) {
            return Z_SCORE;
        }
        try {
            return OutlierMethod.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported outlier method '" + value + "'. Supported values: iqr,z_score");
        }
    }
}
