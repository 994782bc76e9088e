package com.riskmodels.repository;

import com.riskmodels.entity.ModelStatus;
import com.riskmodels.entity.ModelVersionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ModelVersionRepository extends JpaRepository<ModelVersionRecord, Long> {

    Optional<ModelVersionRecord> findByModelNameAndVersionId(String modelName, String versionId);

    List<ModelVersionRecord> findByModelNameOrderByCreatedAtDescVersionIdDesc(String modelName);

    List<ModelVersionRecord> findByModelNameAndStatusOrderByCreatedAtDescVersionIdDesc(
        String modelName, ModelStatus status);

    List<ModelVersionRecord> findByModelNameAndVersionIdIn(String modelName, Collection<String> versionIds);

    @Query("SELECT DISTINCT v.modelName FROM ModelVersionRecord v ORDER BY v.modelName")
    List<String> findDistinctModelNames();

    @Query("""
        SELECT v.status, COUNT(v) FROM ModelVersionRecord v
        GROUP BY v.status
    """)
    List<Object[]> countByStatus();
}
