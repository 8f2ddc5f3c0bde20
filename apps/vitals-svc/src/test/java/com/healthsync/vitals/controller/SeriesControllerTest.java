package com.healthsync.vitals.controller;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.healthsync.vitals.security.JwtIssuerService;
import com.healthsync.vitals.security.TraceIdFilter;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class SeriesControllerTest {

    private static final Instant BASE = Instant.parse("2024-05-01T00:00:00Z");

    @Autowired
    MockMvc mockMvc;

    @Autowired
    JwtIssuerService jwtIssuerService;

    private String bearer;

    @BeforeEach
    void setUp() {
        bearer = "Bearer " + jwtIssuerService.issue("series-" + UUID.randomUUID() + "@example.com", 300);
    }

    @Test
    void rawDataRequiresAToken() throws Exception {
        mockMvc.perform(get("/get_data/raw_data/PULSE"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().exists(TraceIdFilter.TRACE_HEADER))
                .andExpect(jsonPath("$.error.code").value("UNAUTHORIZED"));
    }

    @Test
    void tamperedTokenIsRejected() throws Exception {
        mockMvc.perform(get("/get_data/raw_data/PULSE").header(HttpHeaders.AUTHORIZATION, bearer + "x"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void ingestedSamplesAreServedAsChartPoints() throws Exception {
        ingest("PULSE", """
                {"time": "2024-05-01T00:01:00Z", "value": "72"},
                {"time": "2024-05-01T00:00:00Z", "value": "70"},
                {"time": "2024-05-01T00:02:00Z", "value": "not-a-number"}
                """, 3);

        mockMvc.perform(get("/get_data/raw_data/PULSE").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].X").value((double) BASE.getEpochSecond()))
                .andExpect(jsonPath("$[0].Y").value(70.0))
                .andExpect(jsonPath("$[1].Y").value(72.0));
    }

    @Test
    void rawDataHonoursTheTimeRange() throws Exception {
        ingest("BLOOD_OXYGEN", """
                {"time": "2024-05-01T00:00:00Z", "value": "97"},
                {"time": "2024-05-02T00:00:00Z", "value": "95"}
                """, 2);

        mockMvc.perform(get("/get_data/raw_data/BLOOD_OXYGEN")
                        .param("from", "2024-05-01T12:00:00Z")
                        .param("to", "2024-05-03T00:00:00Z")
                        .header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].Y").value(95.0));

        mockMvc.perform(get("/get_data/raw_data/BLOOD_OXYGEN")
                        .param("from", "2024-05-01T12:00:00Z")
                        .header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isBadRequest());
    }

    @Test
    void classificationRunFeedsDataWithOutliers() throws Exception {
        ingest("PULSE", """
                {"time": "2024-05-01T00:00:00Z", "value": "10"},
                {"time": "2024-05-01T00:01:00Z", "value": "12"},
                {"time": "2024-05-01T00:02:00Z", "value": "12"},
                {"time": "2024-05-01T00:03:00Z", "value": "13"},
                {"time": "2024-05-01T00:04:00Z", "value": "12"},
                {"time": "2024-05-01T00:05:00Z", "value": "11"},
                {"time": "2024-05-01T00:06:00Z", "value": "14"},
                {"time": "2024-05-01T00:07:00Z", "value": "13"},
                {"time": "2024-05-01T00:08:00Z", "value": "15"},
                {"time": "2024-05-01T00:09:00Z", "value": "102"}
                """, 10);

        mockMvc.perform(get("/get_data/data_with_outliers/PULSE").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(10)))
                .andExpect(jsonPath("$.outliersX", hasSize(0)));

        mockMvc.perform(post("/get_data/outliers/PULSE/runs").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.runNumber").value(1))
                .andExpect(jsonPath("$.method").value("IQR"))
                .andExpect(jsonPath("$.flaggedCount").value(1));

        mockMvc.perform(get("/get_data/data_with_outliers/PULSE").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outliersX", hasSize(1)))
                .andExpect(jsonPath("$.outliersX[0]").value((double) BASE.plusSeconds(540).getEpochSecond()));

        mockMvc.perform(post("/get_data/outliers/PULSE/runs").param("method", "z_score").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.runNumber").value(2))
                .andExpect(jsonPath("$.method").value("Z_SCORE"));

        mockMvc.perform(get("/get_data/outliers/PULSE/runs/latest").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runNumber").value(2))
                .andExpect(jsonPath("$.method").value("Z_SCORE"))
                .andExpect(jsonPath("$.flaggedCount").value(1));
    }

    @Test
    void latestRunIsNotFoundBeforeAnyClassification() throws Exception {
        mockMvc.perform(get("/get_data/outliers/STEPS/runs/latest").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isNotFound());
    }

    @Test
    void emptyHistoryIsNotAnError() throws Exception {
        mockMvc.perform(get("/get_data/data_with_outliers/RESPIRATORY_RATE").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(0)))
                .andExpect(jsonPath("$.outliersX", hasSize(0)));

        mockMvc.perform(get("/get_data/predictions").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }

    @Test
    void unknownDataTypeIsABadRequest() throws Exception {
        mockMvc.perform(get("/get_data/raw_data/GLUCOSE").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"))
                .andExpect(jsonPath("$.traceId").isNotEmpty());

        mockMvc.perform(post("/get_data/outliers/PULSE/runs").param("method", "median").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isBadRequest());
    }

    @Test
    void ingestionValidatesTheBody() throws Exception {
        mockMvc.perform(post("/post_data/samples")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataType\": \"PULSE\", \"samples\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/post_data/samples")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataType\": \"PULSE\", \"samples\": [{\"time\": \"yesterday\", \"value\": \"70\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));

        String oversized = "9".repeat(1025);
        mockMvc.perform(post("/post_data/samples")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataType\": \"PULSE\", \"samples\": [{\"time\": \"2024-05-01T00:00:00Z\", \"value\": \"" + oversized + "\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    private void ingest(String dataType, String samplesJson, int expected) throws Exception {
        String body = "{\"dataType\": \"" + dataType + "\", \"samples\": [" + samplesJson + "]}";
        mockMvc.perform(post("/post_data/samples")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.stored").value(expected));
    }
}
