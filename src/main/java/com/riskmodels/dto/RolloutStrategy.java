package com.riskmodels.dto;

import java.time.Duration;
import java.util.List;

/**
 * How traffic moves from the baseline variant to the candidate variant over time.
 * Each strategy yields the candidate's share of traffic for the elapsed time since the test
 * started; routing only ever sees the resulting weights.
 */
public enum RolloutStrategy {

    IMMEDIATE {
        @Override
        public double candidateShare(Duration elapsed, RolloutPlan plan) {
            return 1.0;
        }
    },

    CANARY {
        @Override
        public double candidateShare(Duration elapsed, RolloutPlan plan) {
            return plan.getCanaryShare();
        }
    },

    GRADUAL {
        @Override
        public double candidateShare(Duration elapsed, RolloutPlan plan) {
            List<Double> steps = plan.getGradualSteps();
            long intervalMillis = Math.max(1L, plan.getStepInterval().toMillis());
            long step = Math.max(0L, elapsed.toMillis()) / intervalMillis;
            int index = (int) Math.min(step, steps.size() - 1L);
            return steps.get(index);
        }
    },

    /** Fixed split across any number of variants, held until a winner is selected. */
    AB {
        @Override
        public double candidateShare(Duration elapsed, RolloutPlan plan) {
            throw new UnsupportedOperationException("AB tests use their configured weights");
        }
    };

    public abstract double candidateShare(Duration elapsed, RolloutPlan plan);
}
