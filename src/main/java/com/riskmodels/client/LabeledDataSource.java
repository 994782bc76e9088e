package com.riskmodels.client;

import java.time.Instant;

public interface LabeledDataSource {

    /** Number of labeled records ingested for the model's population after {@code since}. */
    long countLabeledRecordsSince(String modelName, Instant since);
}
