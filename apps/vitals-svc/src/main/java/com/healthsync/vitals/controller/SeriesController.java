package com.healthsync.vitals.controller;

import com.healthsync.vitals.analytics.OutlierDetectionService;
import com.healthsync.vitals.controller.dto.DataRecordDto;
import com.healthsync.vitals.controller.dto.DataWithOutliersDto;
import com.healthsync.vitals.controller.dto.OutlierRunResponseDto;
import com.healthsync.vitals.controller.dto.PredictionDto;
import com.healthsync.vitals.model.OutlierRun;
import com.healthsync.vitals.model.SeriesPoint;
import com.healthsync.vitals.model.SeriesWithOutliers;
import com.healthsync.vitals.security.AuthenticatedUserProvider;
import com.healthsync.vitals.service.VitalsQueryService;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/get_data")
public class SeriesController {

    private final VitalsQueryService queryService;
    private final OutlierDetectionService outlierDetectionService;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public SeriesController(VitalsQueryService queryService,
                            OutlierDetectionService outlierDetectionService,
                            AuthenticatedUserProvider authenticatedUserProvider) {
        this.queryService = queryService;
        this.outlierDetectionService = outlierDetectionService;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @GetMapping("/raw_data/{dataType}")
    public ResponseEntity<List<DataRecordDto>> rawData(
            @PathVariable("dataType") String dataType,
            @RequestParam(value = "from", required = false) String from,
            @RequestParam(value = "to", required = false) String to
    ) {
        String userId = currentUser();
        List<SeriesPoint> series = (from == null && to == null)
                ? queryService.getSeries(userId, dataType)
                : queryService.getSeries(userId, dataType, parseInstant("from", from), parseInstant("to", to));
        return ResponseEntity.ok(series.stream().map(DataRecordDto::from).toList());
    }

    @GetMapping("/data_with_outliers/{dataType}")
    public ResponseEntity<DataWithOutliersDto> dataWithOutliers(@PathVariable("dataType") String dataType) {
        SeriesWithOutliers result = queryService.getSeriesWithOutliers(currentUser(), dataType);
        return ResponseEntity.ok(new DataWithOutliersDto(
                result.series().stream().map(DataRecordDto::from).toList(),
                result.outlierX()));
    }

    @GetMapping("/predictions")
    public ResponseEntity<List<PredictionDto>> predictions() {
        return ResponseEntity.ok(queryService.getPredictions(currentUser()).stream()
                .map(prediction -> new PredictionDto(prediction.diagnosisName(), prediction.result()))
                .toList());
    }

    @PostMapping("/outliers/{dataType}/runs")
    public ResponseEntity<OutlierRunResponseDto> runClassification(
            @PathVariable("dataType") String dataType,
            @RequestParam(value = "method", required = false) String method
    ) {
        OutlierRun run = outlierDetectionService.runClassification(currentUser(), dataType, method);
        return ResponseEntity.status(HttpStatus.CREATED).body(toRunDto(run));
    }

    @GetMapping("/outliers/{dataType}/runs/latest")
    public ResponseEntity<OutlierRunResponseDto> latestRun(@PathVariable("dataType") String dataType) {
        return ResponseEntity.ok(toRunDto(queryService.getLatestRun(currentUser(), dataType)));
    }

    private static OutlierRunResponseDto toRunDto(OutlierRun run) {
        return new OutlierRunResponseDto(
                run.runNumber(),
                run.runTimestamp(),
                run.method().name(),
                run.flaggedCount());
    }

    private String currentUser() {
        return authenticatedUserProvider.currentUserId().orElse(null);
    }

    private static Instant parseInstant(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must be provided together with the other range bound");
        }
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException(name + " must be an ISO-8601 timestamp with offset");
        }
    }
}
