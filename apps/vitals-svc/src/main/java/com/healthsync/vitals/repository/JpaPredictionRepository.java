package com.healthsync.vitals.repository;

import com.healthsync.vitals.entity.PredictionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaPredictionRepository extends JpaRepository<PredictionEntity, Long> {

    @Query("""
            SELECT p FROM PredictionEntity p
            WHERE p.userId = :userId
              AND p.iterationNum = (SELECT MAX(p2.iterationNum) FROM PredictionEntity p2 WHERE p2.userId = :userId)
            ORDER BY p.diagnosisName ASC, p.id ASC
            """)
    List<PredictionEntity> findLatestIteration(@Param("userId") String userId);
}
