package com.healthsync.vitals.analytics;

public class ClassificationException extends RuntimeException {

    public ClassificationException(String message) {
        super(message);
    }
}
