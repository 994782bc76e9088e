package com.riskmodels.exception;

import com.riskmodels.entity.ModelStatus;

public class InvalidStatusTransitionException extends ModelLifecycleException {
    public InvalidStatusTransitionException(String versionId, ModelStatus from, ModelStatus to) {
        super("INVALID_STATUS_TRANSITION",
              "Version '" + versionId + "' cannot move from " + from + " to " + to + ".");
    }
}
