package com.healthsync.vitals.repository;

import com.healthsync.vitals.entity.OutlierFlagEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaOutlierFlagRepository extends JpaRepository<OutlierFlagEntity, Long> {

    // run numbers are per (user, data type), so the scope comes from the flagged sample
    @Query("""
            SELECT f.sampleId
            FROM OutlierFlagEntity f, SampleEntity s
            WHERE s.id = f.sampleId
              AND s.userId = :userId
              AND s.dataType = :dataType
              AND f.runNumber = :runNumber
            """)
    List<Long> findFlaggedSampleIds(@Param("userId") String userId,
                                    @Param("dataType") String dataType,
                                    @Param("runNumber") int runNumber);
}
