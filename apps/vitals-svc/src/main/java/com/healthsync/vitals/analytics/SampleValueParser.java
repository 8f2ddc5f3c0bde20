package com.healthsync.vitals.analytics;

import com.healthsync.vitals.model.Sample;
import com.healthsync.vitals.model.SampleValue;
import java.time.Duration;
import java.time.Instant;
import java.time.Period;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves raw sample payloads into numbers. Two encodings are understood: plain decimals and
 * ISO-8601 durations (converted to seconds). Everything else is {@link SampleValue.Unparseable}.
 */
@Component
public class SampleValueParser {

    private static final Logger log = LoggerFactory.getLogger(SampleValueParser.class);
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");
    private static final long SECONDS_PER_DAY = 86_400L;

    public SampleValue parse(String raw) {
        if (raw == null) {
            return new SampleValue.Unparseable(null);
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return new SampleValue.Unparseable(raw);
        }
        if (DECIMAL.matcher(trimmed).matches()) {
            double value = Double.parseDouble(trimmed);
            return Double.isFinite(value) ? new SampleValue.NumericValue(value) : new SampleValue.Unparseable(raw);
        }
        OptionalDouble seconds = parseDurationSeconds(trimmed.toUpperCase(Locale.ROOT));
        if (seconds.isPresent()) {
            return new SampleValue.DurationValue(seconds.getAsDouble());
        }
        return new SampleValue.Unparseable(raw);
    }

    /**
     * Coerces samples in their given order, dropping the ones whose value cannot be read as a number.
     */
    public List<CoercedSample> coerce(List<Sample> samples) {
        List<CoercedSample> coerced = new ArrayList<>(samples.size());
        int skipped = 0;
        for (Sample sample : samples) {
            OptionalDouble value = parse(sample.rawValue()).asDouble();
            if (value.isEmpty() || sample.timestamp() == null) {
                skipped++;
                log.debug("Skipping sample id={} type={} with unparseable value '{}'",
                        sample.id(), sample.dataType(), sample.rawValue());
                continue;
            }
            coerced.add(new CoercedSample(sample.id(), toUnixSeconds(sample.timestamp()), value.getAsDouble()));
        }
        if (skipped > 0) {
            log.warn("Skipped {} of {} samples with unparseable values", skipped, samples.size());
        }
        return coerced;
    }

    static double toUnixSeconds(Instant timestamp) {
        return timestamp.getEpochSecond() + timestamp.getNano() / 1_000_000_000d;
    }

    private OptionalDouble parseDurationSeconds(String text) {
        if (!text.startsWith("P") && !text.startsWith("-P") && !text.startsWith("+P")) {
            return OptionalDouble.empty();
        }
        Optional<Duration> duration = parseExactDuration(text);
        if (duration.isPresent()) {
            Duration value = duration.get();
            return OptionalDouble.of(value.getSeconds() + value.getNano() / 1_000_000_000d);
        }
        // Date-only forms such as P2W or P3D; years and months have no fixed length.
        Optional<Period> period = parsePeriod(text);
        if (period.isPresent() && period.get().getYears() == 0 && period.get().getMonths() == 0) {
            return OptionalDouble.of(period.get().getDays() * (double) SECONDS_PER_DAY);
        }
        return OptionalDouble.empty();
    }

    private Optional<Duration> parseExactDuration(String text) {
        try {
            return Optional.of(Duration.parse(text));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private Optional<Period> parsePeriod(String text) {
        try {
            return Optional.of(Period.parse(text));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
