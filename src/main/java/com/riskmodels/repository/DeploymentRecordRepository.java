package com.riskmodels.repository;

import com.riskmodels.entity.DeploymentRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DeploymentRecordRepository extends JpaRepository<DeploymentRecord, Long> {

    List<DeploymentRecord> findByModelNameOrderBySequenceDesc(String modelName, Pageable pageable);

    long countByModelName(String modelName);
}
