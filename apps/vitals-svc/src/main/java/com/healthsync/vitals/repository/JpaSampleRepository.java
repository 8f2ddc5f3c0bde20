package com.healthsync.vitals.repository;

import com.healthsync.vitals.entity.SampleEntity;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaSampleRepository extends JpaRepository<SampleEntity, Long> {

    @Query("SELECT s FROM SampleEntity s WHERE s.userId = :userId AND s.dataType = :dataType ORDER BY s.recordedAt ASC, s.id ASC")
    List<SampleEntity> findSeries(@Param("userId") String userId,
                                  @Param("dataType") String dataType);

    @Query("SELECT s FROM SampleEntity s WHERE s.userId = :userId AND s.dataType = :dataType AND s.recordedAt >= :from AND s.recordedAt < :to ORDER BY s.recordedAt ASC, s.id ASC")
    List<SampleEntity> findSeriesInRange(@Param("userId") String userId,
                                         @Param("dataType") String dataType,
                                         @Param("from") Instant from,
                                         @Param("to") Instant to);
}
