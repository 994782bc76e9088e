package com.riskmodels.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Append-only audit entry for a promotion, staging, archival or rollback.
 */
@Entity
@Immutable
@Table(
    name = "deployment_records",
    uniqueConstraints = @UniqueConstraint(name = "uq_deploy_seq", columnNames = {"model_name", "sequence_no"}),
    indexes = @Index(name = "idx_deploy_model_seq", columnList = "model_name, sequence_no")
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeploymentRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "model_name", nullable = false, length = 100, updatable = false)
    private String modelName;

    @Column(name = "version_id", nullable = false, length = 64, updatable = false)
    private String versionId;

    @Column(name = "sequence_no", nullable = false, updatable = false)
    private long sequence;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private DeploymentAction action;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", nullable = false, length = 20, updatable = false)
    private ModelStatus previousStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", nullable = false, length = 20, updatable = false)
    private ModelStatus newStatus;

    @Column(name = "replaced_version_id", length = 64, updatable = false)
    private String replacedVersionId;

    @Column(nullable = false, length = 100, updatable = false)
    private String actor;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(length = 1000, updatable = false)
    private String reason;
}
