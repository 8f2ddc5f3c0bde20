package com.healthsync.vitals.service;

import com.healthsync.vitals.entity.RatingEntity;
import com.healthsync.vitals.model.Rating;
import com.healthsync.vitals.repository.JpaRatingRepository;
import com.healthsync.vitals.security.NotAuthenticatedException;
import java.time.Instant;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * One app rating per user, overwritten on every submission.
 */
@Service
public class RatingService {

    private static final Logger log = LoggerFactory.getLogger(RatingService.class);
    static final double MIN_RATING = 1.0d;
    static final double MAX_RATING = 5.0d;

    private final JpaRatingRepository ratingRepository;

    public RatingService(JpaRatingRepository ratingRepository) {
        this.ratingRepository = ratingRepository;
    }

    @Transactional(readOnly = true)
    public Rating getRating(String userId) {
        requireUser(userId);
        return ratingRepository.findByUserId(userId)
                .map(this::toModel)
                .orElseThrow(() -> new NoSuchElementException("Rating not found"));
    }

    public Rating submit(String userId, double value) {
        requireUser(userId);
        if (!Double.isFinite(value) || value < MIN_RATING || value > MAX_RATING) {
            throw new IllegalArgumentException("rating must be between 1 and 5");
        }
        try {
            return upsert(userId, value);
        } catch (DataIntegrityViolationException ex) {
            // concurrent first submission won the insert; apply ours on top of it
            log.debug("Concurrent rating insert detected, retrying as update");
            return upsert(userId, value);
        }
    }

    private Rating upsert(String userId, double value) {
        Instant now = Instant.now();
        RatingEntity entity = ratingRepository.findByUserId(userId)
                .map(existing -> {
                    existing.setRatingValue(value);
                    existing.setUpdatedAt(now);
                    return existing;
                })
                .orElseGet(() -> new RatingEntity(userId, value, now));
        return toModel(ratingRepository.saveAndFlush(entity));
    }

    private Rating toModel(RatingEntity entity) {
        return new Rating(entity.getUserId(), entity.getRatingValue(), entity.getUpdatedAt());
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new NotAuthenticatedException("user context missing");
        }
    }
}
