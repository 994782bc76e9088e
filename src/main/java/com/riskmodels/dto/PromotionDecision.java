package com.riskmodels.dto;

public enum PromotionDecision {
    PROMOTED,
    HELD_FOR_REVIEW,
    REJECTED
}
