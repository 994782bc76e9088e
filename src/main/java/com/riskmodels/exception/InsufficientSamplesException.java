package com.riskmodels.exception;

public class InsufficientSamplesException extends ModelLifecycleException {
    public InsufficientSamplesException(String testId, String versionId, long samples, int required) {
        super("INSUFFICIENT_SAMPLES",
              "A/B test '" + testId + "' variant '" + versionId + "' has " + samples
                  + " samples; at least " + required + " are required to select a winner.");
    }
}
