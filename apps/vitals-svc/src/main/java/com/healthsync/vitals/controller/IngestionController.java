package com.healthsync.vitals.controller;

import com.healthsync.vitals.controller.dto.IngestionRequestDto;
import com.healthsync.vitals.controller.dto.IngestionResponseDto;
import com.healthsync.vitals.security.AuthenticatedUserProvider;
import com.healthsync.vitals.service.SampleIngestionService;
import com.healthsync.vitals.service.SampleIngestionService.SampleInput;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/post_data")
public class IngestionController {

    private final SampleIngestionService ingestionService;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public IngestionController(SampleIngestionService ingestionService,
                               AuthenticatedUserProvider authenticatedUserProvider) {
        this.ingestionService = ingestionService;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @PostMapping("/samples")
    public ResponseEntity<IngestionResponseDto> ingest(@Valid @RequestBody IngestionRequestDto request) {
        List<SampleInput> samples = request.samples().stream()
                .map(sample -> new SampleInput(sample.time(), sample.value()))
                .toList();
        var stored = ingestionService.ingest(
                authenticatedUserProvider.currentUserId().orElse(null),
                request.dataType(),
                samples);
        return ResponseEntity.status(HttpStatus.CREATED).body(new IngestionResponseDto(stored.size()));
    }
}
