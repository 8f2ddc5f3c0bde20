package com.healthsync.vitals.repository;

import com.healthsync.vitals.entity.RatingEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaRatingRepository extends JpaRepository<RatingEntity, Long> {

    Optional<RatingEntity> findByUserId(String userId);
}
