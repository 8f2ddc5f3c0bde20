package com.healthsync.vitals.model;

import java.util.OptionalDouble;

/**
 * A raw sample payload resolved into one of the encodings the service understands.
 */
public sealed interface SampleValue permits SampleValue.NumericValue, SampleValue.DurationValue, SampleValue.Unparseable {

    /**
     * Numeric interpretation used on the Y axis; empty for payloads that cannot be analysed.
     */
    OptionalDouble asDouble();

    record NumericValue(double value) implements SampleValue {
        @Override
        public OptionalDouble asDouble() {
            return OptionalDouble.of(value);
        }
    }

    record DurationValue(double seconds) implements SampleValue {
        @Override
        public OptionalDouble asDouble() {
            return OptionalDouble.of(seconds);
        }
    }

    record Unparseable(String raw) implements SampleValue {
        @Override
        public OptionalDouble asDouble() {
            return OptionalDouble.empty();
        }
    }
}
