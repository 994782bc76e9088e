package com.riskmodels.exception;

public class ArtifactStorageException extends ModelLifecycleException {
    public ArtifactStorageException(String message, Throwable cause) {
        super("ARTIFACT_STORAGE_ERROR", message, cause);
    }
}
