package com.riskmodels.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Entity
@Table(
    name = "model_versions",
    uniqueConstraints = @UniqueConstraint(name = "uq_model_version", columnNames = {"model_name", "version_id"}),
    indexes = {
        @Index(name = "idx_mv_model_created", columnList = "model_name, created_at"),
        @Index(name = "idx_mv_model_status",  columnList = "model_name, status"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelVersionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_name", nullable = false, length = 100)
    private String modelName;

    @Column(name = "version_id", nullable = false, length = 64)
    private String versionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "dataset_ref", length = 255)
    private String datasetRef;

    @Column(name = "dataset_snapshot_at")
    private Instant datasetSnapshotAt;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "model_version_hyperparameters", joinColumns = @JoinColumn(name = "model_version_pk"))
    @MapKeyColumn(name = "param_name", length = 100)
    @Column(name = "param_value", length = 1000)
    private Map<String, String> hyperparameters = new LinkedHashMap<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "model_version_features", joinColumns = @JoinColumn(name = "model_version_pk"))
    @OrderColumn(name = "position")
    @Column(name = "feature_name", length = 100)
    private List<String> featureSchema = new ArrayList<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "model_version_metrics", joinColumns = @JoinColumn(name = "model_version_pk"))
    @MapKeyColumn(name = "metric_name", length = 50)
    @Column(name = "metric_value")
    private Map<String, Double> metrics = new LinkedHashMap<>();

    @Column(name = "training_sample_count")
    private Long trainingSampleCount;

    @Column(name = "artifact_location", nullable = false, length = 512)
    private String artifactLocation;

    @Column(name = "reference_sample_location", length = 512)
    private String referenceSampleLocation;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ModelStatus status;

    @Column(name = "deployed_at")
    private Instant deployedAt;

    @Column(name = "registered_by", length = 100)
    private String registeredBy;
}
