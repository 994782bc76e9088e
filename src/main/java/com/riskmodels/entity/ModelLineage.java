package com.riskmodels.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * One row per model family. Holds the production pointer; every status mutation of the
 * family locks this row, which serializes writers across application instances.
 */
@Entity
@Table(name = "model_lineages")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelLineage {

    @Id
    @Column(name = "model_name", length = 100)
    private String modelName;

    @Column(name = "production_version_id", length = 64)
    private String productionVersionId;

    @Column(name = "deployment_sequence", nullable = false)
    private long deploymentSequence;

    @Version
    private Long revision;

    public long nextSequence() {
        deploymentSequence++;
        return deploymentSequence;
    }
}
