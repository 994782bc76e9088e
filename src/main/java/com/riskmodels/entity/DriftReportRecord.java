package com.riskmodels.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(
    name = "drift_reports",
    indexes = @Index(name = "idx_drift_model_checked", columnList = "model_name, checked_at")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DriftReportRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_name", nullable = false, length = 100)
    private String modelName;

    @Column(name = "reference_version_id", length = 64)
    private String referenceVersionId;

    @Column(name = "feature_name", nullable = false, length = 100)
    private String featureName;

    @Column(name = "ks_statistic")
    private double ksStatistic;

    @Column(name = "ks_p_value")
    private double ksPValue;

    private double psi;

    @Column(name = "significance_level")
    private double significanceLevel;

    @Column(name = "psi_threshold")
    private double psiThreshold;

    private boolean exceeded;

    @Column(name = "reference_size")
    private int referenceSize;

    @Column(name = "recent_size")
    private int recentSize;

    @Column(name = "checked_at", nullable = false)
    private Instant checkedAt;
}
