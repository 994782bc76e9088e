package com.riskmodels.repository;

import com.riskmodels.entity.DriftReportRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DriftReportRepository extends JpaRepository<DriftReportRecord, Long> {

    List<DriftReportRecord> findByModelNameOrderByCheckedAtDesc(String modelName, Pageable pageable);
}
