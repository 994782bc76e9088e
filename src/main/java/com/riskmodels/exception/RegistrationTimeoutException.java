package com.riskmodels.exception;

import java.time.Duration;

public class RegistrationTimeoutException extends ModelLifecycleException {
    public RegistrationTimeoutException(String modelName, Duration budget, Throwable cause) {
        super("REGISTRATION_TIMEOUT",
              "Registration of '" + modelName + "' did not complete within " + budget.toMillis() + " ms.",
              cause);
    }
}
