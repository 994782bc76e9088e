package com.riskmodels.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a {@link ModelVersionRecord}.
 *
 * <p>Transitions only move forward. The single exception is an explicit rollback, which is
 * applied by the registry as one atomic swap and never through {@link #canTransitionTo}.
 * {@link #ROLLED_BACK} is an audit marker that behaves like {@link #ARCHIVED}.</p>
 */
public enum ModelStatus {
    REGISTERED,
    STAGING,
    PRODUCTION,
    ARCHIVED,
    ROLLED_BACK;

    public boolean canTransitionTo(ModelStatus target) {
        return allowedTargets().contains(target);
    }

    /** Whether a rollback may bring a version in this status back to PRODUCTION. */
    public boolean isRollbackTarget() {
        return this == ARCHIVED || this == STAGING || this == ROLLED_BACK;
    }

    public boolean isRetired() {
        return this == ARCHIVED || this == ROLLED_BACK;
    }

    private Set<ModelStatus> allowedTargets() {
        return switch (this) {
            case REGISTERED -> EnumSet.of(STAGING, PRODUCTION, ARCHIVED, ROLLED_BACK);
            case STAGING -> EnumSet.of(PRODUCTION, ARCHIVED, ROLLED_BACK);
            case PRODUCTION -> EnumSet.of(ARCHIVED, ROLLED_BACK);
            case ARCHIVED -> EnumSet.of(ROLLED_BACK);
            case ROLLED_BACK -> EnumSet.noneOf(ModelStatus.class);
        };
    }
}
