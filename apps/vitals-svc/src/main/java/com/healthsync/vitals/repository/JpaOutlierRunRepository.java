package com.healthsync.vitals.repository;

import com.healthsync.vitals.entity.OutlierRunEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaOutlierRunRepository extends JpaRepository<OutlierRunEntity, Long> {

    @Query("SELECT MAX(r.runNumber) FROM OutlierRunEntity r WHERE r.userId = :userId AND r.dataType = :dataType")
    Integer findLatestRunNumber(@Param("userId") String userId, @Param("dataType") String dataType);

    Optional<OutlierRunEntity> findByUserIdAndDataTypeAndRunNumber(String userId, String dataType, int runNumber);
}
