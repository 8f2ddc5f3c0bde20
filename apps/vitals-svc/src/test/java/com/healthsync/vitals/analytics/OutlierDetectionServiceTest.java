package com.healthsync.vitals.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.healthsync.vitals.config.VitalsProperties;
import com.healthsync.vitals.model.DataType;
import com.healthsync.vitals.model.OutlierMethod;
import com.healthsync.vitals.model.OutlierRun;
import com.healthsync.vitals.model.Sample;
import com.healthsync.vitals.repository.InMemoryIterationLedger;
import com.healthsync.vitals.repository.InMemorySampleStore;
import com.healthsync.vitals.repository.IterationLedger;
import com.healthsync.vitals.repository.StorageException;
import com.healthsync.vitals.security.NotAuthenticatedException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class OutlierDetectionServiceTest {

    private static final String USER = "ada@example.com";
    private static final Instant BASE = Instant.parse("2024-05-01T00:00:00Z");

    @Mock
    private IterationLedger failingLedger;

    private InMemorySampleStore sampleStore;
    private InMemoryIterationLedger iterationLedger;
    private OutlierDetectionService service;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        sampleStore = new InMemorySampleStore();
        iterationLedger = new InMemoryIterationLedger();
        service = newService(iterationLedger);
    }

    @Test
    void commitsFlaggedSampleIdsOfTheDefaultMethod() {
        List<Sample> stored = appendPulse(10, 12, 12, 13, 12, 11, 14, 13, 15, 102);

        OutlierRun run = service.runClassification(USER, "PULSE", null);

        assertThat(run.runNumber()).isEqualTo(1);
        assertThat(run.method()).isEqualTo(OutlierMethod.IQR);
        assertThat(run.flaggedCount()).isEqualTo(1);
        assertThat(iterationLedger.flagsForRun(USER, DataType.PULSE, 1)).containsExactly(stored.get(9).id());
    }

    @Test
    void explicitMethodOverridesDefault() {
        appendPulse(50, 52, 49, 51, 50, 300);

        OutlierRun run = service.runClassification(USER, "PULSE", "zscore");

        assertThat(run.method()).isEqualTo(OutlierMethod.Z_SCORE);
        assertThat(iterationLedger.findRun(USER, DataType.PULSE, 1)).contains(run);
    }

    @Test
    void duplicateTimestampsMapBackToTheRightSample() {
        List<Sample> stored = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            stored.add(sampleStore.append(USER, DataType.PULSE, BASE, String.valueOf(60 + i % 3)));
        }
        stored.add(sampleStore.append(USER, DataType.PULSE, BASE, "180"));

        service.runClassification(USER, "PULSE", "IQR");

        assertThat(iterationLedger.flagsForRun(USER, DataType.PULSE, 1)).containsExactly(stored.get(9).id());
    }

    @Test
    void unparseableSamplesAreNeverFlagged() {
        appendPulse(70, 71, 72);
        sampleStore.append(USER, DataType.PULSE, BASE.plusSeconds(500), "not-a-number");

        OutlierRun run = service.runClassification(USER, "PULSE", "IQR");

        assertThat(run.flaggedCount()).isZero();
    }

    @Test
    void emptyHistoryStillConsumesARunNumber() {
        assertThat(service.runClassification(USER, "STRESS_LVL", null).runNumber()).isEqualTo(1);
        assertThat(service.runClassification(USER, "STRESS_LVL", null).runNumber()).isEqualTo(2);
        assertThat(iterationLedger.latestRun(USER, DataType.STRESS_LVL)).contains(2);
    }

    @Test
    void validatesIdentityBeforeArguments() {
        assertThatThrownBy(() -> service.runClassification(" ", "NOT_A_TYPE", null))
                .isInstanceOf(NotAuthenticatedException.class);
        assertThatThrownBy(() -> service.runClassification(USER, "NOT_A_TYPE", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.runClassification(USER, "PULSE", "median"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invalidArgumentsNeverReachTheLedger() {
        OutlierDetectionService guarded = newService(failingLedger);

        assertThatThrownBy(() -> guarded.runClassification(USER, "PULSE", "median"))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(failingLedger);
    }

    @Test
    void storageFailurePropagates() {
        appendPulse(1, 2, 3);
        when(failingLedger.commitRun(anyString(), eq(DataType.PULSE), anyCollection(), any(Instant.class), any(OutlierMethod.class)))
                .thenThrow(new StorageException("boom", new RuntimeException("db down")));

        assertThatThrownBy(() -> newService(failingLedger).runClassification(USER, "PULSE", null))
                .isInstanceOf(StorageException.class);
    }

    private OutlierDetectionService newService(IterationLedger ledger) {
        return new OutlierDetectionService(
                sampleStore,
                ledger,
                new SampleValueParser(),
                new OutlierClassifier(),
                new VitalsProperties(null, null, null));
    }

    private List<Sample> appendPulse(double... values) {
        List<Sample> stored = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            stored.add(sampleStore.append(USER, DataType.PULSE, BASE.plusSeconds(60L * i), String.valueOf(values[i])));
        }
        return stored;
    }
}
