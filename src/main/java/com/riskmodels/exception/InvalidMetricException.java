package com.riskmodels.exception;

public class InvalidMetricException extends ModelLifecycleException {
    public InvalidMetricException(String metric, String versionId) {
        super("INVALID_METRIC", "Metric '" + metric + "' is not available for version '" + versionId + "'.");
    }
}
