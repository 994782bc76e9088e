package com.riskmodels.repository;

import com.riskmodels.entity.ModelLineage;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ModelLineageRepository extends JpaRepository<ModelLineage, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM ModelLineage l WHERE l.modelName = :modelName")
    Optional<ModelLineage> findForUpdate(@Param("modelName") String modelName);

    long countByProductionVersionIdIsNotNull();
}
