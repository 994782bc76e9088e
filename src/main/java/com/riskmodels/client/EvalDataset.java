package com.riskmodels.client;

import java.util.List;
import java.util.Map;

/**
 * Held-out rows with their binary labels (1 = positive risk outcome).
 */
public record EvalDataset(String datasetRef, List<Integer> labels, List<Map<String, Double>> rows) {

    public EvalDataset {
        labels = List.copyOf(labels);
        rows = List.copyOf(rows);
        if (labels.size() != rows.size()) {
            throw new IllegalArgumentException(
                "Label count " + labels.size() + " does not match row count " + rows.size());
        }
    }

    public int size() {
        return labels.size();
    }
}
