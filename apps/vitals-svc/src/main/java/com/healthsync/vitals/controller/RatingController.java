package com.healthsync.vitals.controller;

import com.healthsync.vitals.controller.dto.RatingRequestDto;
import com.healthsync.vitals.controller.dto.RatingResponseDto;
import com.healthsync.vitals.model.Rating;
import com.healthsync.vitals.security.AuthenticatedUserProvider;
import com.healthsync.vitals.service.RatingService;
import jakarta.validation.Valid;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/ratings")
public class RatingController {

    private final RatingService ratingService;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public RatingController(RatingService ratingService, AuthenticatedUserProvider authenticatedUserProvider) {
        this.ratingService = ratingService;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @GetMapping("/my")
    public ResponseEntity<Map<String, Double>> myRating() {
        Rating rating = ratingService.getRating(authenticatedUserProvider.currentUserId().orElse(null));
        return ResponseEntity.ok(Map.of("rating", rating.value()));
    }

    @PostMapping("/submit")
    public ResponseEntity<RatingResponseDto> submit(@Valid @RequestBody RatingRequestDto request) {
        Rating rating = ratingService.submit(authenticatedUserProvider.currentUserId().orElse(null), request.rating());
        return ResponseEntity.ok(new RatingResponseDto("Rating submitted successfully", rating.value()));
    }
}
