package com.riskmodels.client;

public interface EvalDatasetProvider {

    EvalDataset getHeldOutSet(String modelName);
}
