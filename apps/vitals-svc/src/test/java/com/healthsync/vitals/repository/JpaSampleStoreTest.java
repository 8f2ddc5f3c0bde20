package com.healthsync.vitals.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.healthsync.vitals.model.DataType;
import com.healthsync.vitals.model.Sample;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class JpaSampleStoreTest {

    private static final Instant BASE = Instant.parse("2024-08-01T06:00:00Z");

    @Autowired
    JpaSampleStore sampleStore;

    @Test
    void queryOrdersByTimestampThenInsertion() {
        String user = "store-" + UUID.randomUUID() + "@example.com";
        Sample late = sampleStore.append(user, DataType.PULSE, BASE.plusSeconds(60), "72");
        Sample tieFirst = sampleStore.append(user, DataType.PULSE, BASE, "70");
        Sample tieSecond = sampleStore.append(user, DataType.PULSE, BASE, "71");

        List<Sample> series = sampleStore.query(user, DataType.PULSE);

        assertThat(series).extracting(Sample::id).containsExactly(tieFirst.id(), tieSecond.id(), late.id());
        assertThat(series.get(0).rawValue()).isEqualTo("70");
        assertThat(series.get(0).timestamp()).isEqualTo(BASE);
    }

    @Test
    void appendNeverDeduplicates() {
        String user = "store-" + UUID.randomUUID() + "@example.com";
        sampleStore.append(user, DataType.STEPS, BASE, "1000");
        sampleStore.append(user, DataType.STEPS, BASE, "1000");

        assertThat(sampleStore.query(user, DataType.STEPS)).hasSize(2);
    }

    @Test
    void rangeIsInclusiveExclusiveAndScoped() {
        String user = "store-" + UUID.randomUUID() + "@example.com";
        sampleStore.append(user, DataType.PULSE, BASE, "70");
        sampleStore.append(user, DataType.PULSE, BASE.plusSeconds(3600), "71");
        sampleStore.append(user, DataType.BODY_TEMPERATURE, BASE, "36.6");

        assertThat(sampleStore.query(user, DataType.PULSE, BASE, BASE.plusSeconds(3600)))
                .extracting(Sample::rawValue)
                .containsExactly("70");
    }
}
