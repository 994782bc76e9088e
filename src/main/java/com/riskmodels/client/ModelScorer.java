package com.riskmodels.client;

import com.riskmodels.dto.ModelVersionResponse;

import java.util.List;

/**
 * Produces positive-class probabilities for each dataset row, in row order.
 */
public interface ModelScorer {

    List<Double> score(ModelVersionResponse version, EvalDataset dataset);
}
