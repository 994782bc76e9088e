package com.riskmodels.entity;

public enum DeploymentAction {
    PROMOTE,
    STAGE,
    ARCHIVE,
    ROLLBACK,
    MARK_ROLLED_BACK;

    public static DeploymentAction forTarget(ModelStatus target) {
        return switch (target) {
            case PRODUCTION -> PROMOTE;
            case STAGING -> STAGE;
            case ARCHIVED -> ARCHIVE;
            case ROLLED_BACK -> MARK_ROLLED_BACK;
            case REGISTERED -> throw new IllegalArgumentException("REGISTERED is not a deployment target");
        };
    }
}
