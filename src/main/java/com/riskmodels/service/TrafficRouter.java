package com.riskmodels.service;

import com.riskmodels.dto.AbTestResponse;
import com.riskmodels.dto.AbTestStatus;
import com.riskmodels.dto.CreateAbTestRequest;
import com.riskmodels.dto.ModelVersionResponse;
import com.riskmodels.dto.RolloutPlan;
import com.riskmodels.dto.RolloutStrategy;
import com.riskmodels.dto.RouteDecision;
import com.riskmodels.dto.VariantWeight;
import com.riskmodels.exception.InsufficientSamplesException;
import com.riskmodels.exception.InvalidAbTestException;
import com.riskmodels.exception.ModelNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Splits inference traffic between model versions for A/B tests and staged rollouts.
 *
 * <p>Assignment is sticky: the same routing key always lands in the same bucket, so a
 * customer keeps seeing the same version while the weights are unchanged. Tests live in
 * process memory.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrafficRouter {

    public static final double DEFAULT_CANARY_SHARE = 0.05;
    public static final String DEFAULT_GRADUAL_STEPS = "0.10,0.25,0.50,1.0";
    public static final String DEFAULT_STEP_INTERVAL = "PT1H";
    public static final int DEFAULT_MIN_SAMPLES = 100;

    static final int BUCKETS = 10_000;
    static final double WEIGHT_TOLERANCE = 1e-6;

    private final ModelRegistryService registry;
    private final Promoter promoter;
    private final NotificationService notifications;

    @Value("${lifecycle.routing.canary-share:" + DEFAULT_CANARY_SHARE + "}")
    private double canaryShare = DEFAULT_CANARY_SHARE;

    @Value("${lifecycle.routing.gradual-steps:" + DEFAULT_GRADUAL_STEPS + "}")
    private List<Double> gradualSteps = List.of(0.10, 0.25, 0.50, 1.0);

    @Value("${lifecycle.routing.step-interval:" + DEFAULT_STEP_INTERVAL + "}")
    private Duration stepInterval = Duration.parse(DEFAULT_STEP_INTERVAL);

    @Value("${lifecycle.routing.min-samples:" + DEFAULT_MIN_SAMPLES + "}")
    private int minSamples = DEFAULT_MIN_SAMPLES;

    private Clock clock = Clock.systemUTC();

    private final ConcurrentHashMap<String, AbTest> tests = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> activeByModel = new ConcurrentHashMap<>();

    public AbTestResponse createTest(CreateAbTestRequest request) {
        String modelName = request.getModelName();
        RolloutStrategy strategy = request.getStrategy();
        List<VariantWeight> variants = request.getVariants();
        validateShape(strategy, variants);

        for (VariantWeight v : variants) {
            ModelVersionResponse version = registry.get(modelName, v.getVersionId());
            if (version.getStatus().isRetired() && strategy != RolloutStrategy.AB) {
                throw new InvalidAbTestException(
                    "Version '" + v.getVersionId() + "' is " + version.getStatus() + " and cannot take rollout traffic.");
            }
        }

        RolloutPlan plan = RolloutPlan.builder()
            .canaryShare(request.getCanaryShare() != null ? request.getCanaryShare() : canaryShare)
            .gradualSteps(validSteps(request.getGradualSteps() != null ? request.getGradualSteps() : gradualSteps))
            .stepInterval(request.getStepIntervalMinutes() != null
                ? Duration.ofMinutes(request.getStepIntervalMinutes())
                : stepInterval)
            .build();
        int required = request.getMinSamplesPerVariant() != null ? request.getMinSamplesPerVariant() : minSamples;

        Instant startedAt = clock.instant();
        Instant plannedEndAt = request.getDurationDays() != null
            ? startedAt.plus(Duration.ofDays(request.getDurationDays()))
            : null;
        AbTest test = new AbTest(UUID.randomUUID().toString(), modelName, strategy, plan, required, startedAt,
                                 plannedEndAt, variants.stream().map(v -> new Variant(v.getVersionId(),
                                     v.getWeight() != null ? v.getWeight() : 0.0)).toList());

        if (activeByModel.putIfAbsent(modelName, test.testId) != null) {
            throw new InvalidAbTestException(
                "Model '" + modelName + "' already has an active test '" + activeByModel.get(modelName) + "'.");
        }
        tests.put(test.testId, test);
        log.info("Traffic test started | test={} | model={} | strategy={} | variants={} | plannedEnd={} | createdBy={}",
                 test.testId, modelName, strategy,
                 variants.stream().map(VariantWeight::getVersionId).toList(), plannedEndAt, request.getCreatedBy());
        return test.toResponse(clock.instant());
    }

    /**
     * Picks the version serving a request. Without an active test this is the production
     * version.
     */
    public RouteDecision routeRequest(String modelName, String routingKey) {
        String testId = activeByModel.get(modelName);
        AbTest test = testId != null ? tests.get(testId) : null;
        if (test == null || test.status != AbTestStatus.ACTIVE) {
            ModelVersionResponse production = registry.getProduction(modelName);
            return RouteDecision.builder()
                .modelName(modelName)
                .versionId(production.getVersionId())
                .build();
        }

        int bucket = bucket(routingKey);
        double[] weights = test.currentWeights(clock.instant());
        Variant chosen = test.variants.get(pick(weights, bucket));
        chosen.requests.increment();
        return RouteDecision.builder()
            .modelName(modelName)
            .versionId(chosen.versionId)
            .testId(test.testId)
            .bucket(bucket)
            .build();
    }

    /** Outcomes reported after the test closed are dropped. */
    public void recordOutcome(String testId, String versionId, boolean success, Double metricValue) {
        AbTest test = findTest(testId);
        if (test.status != AbTestStatus.ACTIVE) {
            log.info("Late outcome ignored | test={} | version={} | status={}", testId, versionId, test.status);
            return;
        }
        Variant variant = test.variant(versionId);
        if (success) {
            variant.successes.increment();
        } else {
            variant.failures.increment();
        }
        if (metricValue != null && !metricValue.isNaN()) {
            variant.metricSum.add(metricValue);
            variant.metricCount.increment();
        }
    }

    /**
     * Closes the test and promotes the best variant. Every variant needs at least the
     * configured number of recorded outcomes.
     */
    public String selectWinner(String testId, String actor) {
        AbTest test = findTest(testId);
        Variant winner;
        synchronized (test) {
            if (test.status != AbTestStatus.ACTIVE) {
                throw new InvalidAbTestException("Test '" + testId + "' is already " + test.status + ".");
            }
            for (Variant v : test.variants) {
                long samples = v.samples();
                if (samples < test.minSamples) {
                    throw new InsufficientSamplesException(testId, v.versionId, samples, test.minSamples);
                }
            }
            winner = rank(test.variants);
            test.close(winner.versionId, clock.instant());
            activeByModel.remove(test.modelName, testId);
        }
        log.info("Traffic test completed | test={} | model={} | winner={} | actor={}",
                 testId, test.modelName, winner.versionId, actor);

        promoter.promoteWinner(test.modelName, winner.versionId, actor, testId);
        notifications.abTestCompleted(test.toResponse(clock.instant()));
        return winner.versionId;
    }

    public AbTestResponse getTest(String testId) {
        return findTest(testId).toResponse(clock.instant());
    }

    public AbTestResponse activeTest(String modelName) {
        String testId = activeByModel.get(modelName);
        if (testId == null) {
            throw new ModelNotFoundException("Model '" + modelName + "' has no active traffic test.");
        }
        return getTest(testId);
    }

    public List<AbTestResponse> listTests(String modelName) {
        Instant now = clock.instant();
        return tests.values().stream()
            .filter(t -> modelName == null || t.modelName.equals(modelName))
            .sorted(Comparator.comparing((AbTest t) -> t.startedAt).reversed())
            .map(t -> t.toResponse(now))
            .toList();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    /** Stable bucket in [0, 10000) from the MD5 of the routing key. */
    static int bucket(String routingKey) {
        if (routingKey == null) {
            throw new IllegalArgumentException("Routing key must not be null");
        }
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(routingKey.getBytes(StandardCharsets.UTF_8));
            long value = 0;
            for (int i = 0; i < 8; i++) {
                value = (value << 8) | (digest[i] & 0xFF);
            }
            return (int) Long.remainderUnsigned(value, BUCKETS);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("MD5 not available", ex);
        }
    }

    /** First variant whose cumulative boundary (in basis points) exceeds the bucket. */
    static int pick(double[] weights, int bucket) {
        long cumulative = 0;
        int lastPositive = 0;
        for (int i = 0; i < weights.length; i++) {
            if (weights[i] <= 0.0) {
                continue;
            }
            lastPositive = i;
            cumulative += Math.round(weights[i] * BUCKETS);
            if (bucket < cumulative) {
                return i;
            }
        }
        return lastPositive;
    }

    /** Mean metric when every variant reported one, then success rate, then declaration order. */
    static Variant rank(List<Variant> variants) {
        boolean useMetric = variants.stream().allMatch(v -> v.metricCount.sum() > 0);
        Variant best = variants.get(0);
        for (int i = 1; i < variants.size(); i++) {
            Variant v = variants.get(i);
            int cmp = 0;
            if (useMetric) {
                cmp = Double.compare(v.meanMetric(), best.meanMetric());
            }
            if (cmp == 0) {
                cmp = Double.compare(v.successRate(), best.successRate());
            }
            if (cmp > 0) {
                best = v;
            }
        }
        return best;
    }

    private void validateShape(RolloutStrategy strategy, List<VariantWeight> variants) {
        if (variants == null || variants.isEmpty()) {
            throw new InvalidAbTestException("At least one variant is required.");
        }
        Set<String> ids = new HashSet<>();
        for (VariantWeight v : variants) {
            if (!ids.add(v.getVersionId())) {
                throw new InvalidAbTestException("Variant '" + v.getVersionId() + "' is listed twice.");
            }
        }
        switch (strategy) {
            case AB -> {
                if (variants.size() < 2) {
                    throw new InvalidAbTestException("An A/B test needs at least two variants.");
                }
                double total = 0.0;
                for (VariantWeight v : variants) {
                    if (v.getWeight() == null || v.getWeight() < 0.0) {
                        throw new InvalidAbTestException("Variant '" + v.getVersionId() + "' needs a non-negative weight.");
                    }
                    total += v.getWeight();
                }
                if (Math.abs(total - 1.0) > WEIGHT_TOLERANCE) {
                    throw new InvalidAbTestException("Variant weights sum to " + total + ", expected 1.0.");
                }
            }
            case IMMEDIATE -> {
                if (variants.size() > 2) {
                    throw new InvalidAbTestException("An immediate rollout takes a baseline and a candidate.");
                }
            }
            case CANARY, GRADUAL -> {
                if (variants.size() != 2) {
                    throw new InvalidAbTestException(strategy + " rollout takes exactly a baseline and a candidate.");
                }
            }
        }
    }

    private List<Double> validSteps(List<Double> steps) {
        if (steps.isEmpty()) {
            throw new InvalidAbTestException("Gradual rollout needs at least one step.");
        }
        double previous = 0.0;
        for (Double step : steps) {
            if (step == null || step <= previous - WEIGHT_TOLERANCE || step > 1.0) {
                throw new InvalidAbTestException("Gradual steps must be non-decreasing shares in (0, 1]: " + steps);
            }
            previous = step;
        }
        return List.copyOf(steps);
    }

    private AbTest findTest(String testId) {
        AbTest test = tests.get(testId);
        if (test == null) {
            throw new ModelNotFoundException("Traffic test '" + testId + "' not found.");
        }
        return test;
    }

    static final class Variant {
        final String versionId;
        final double configuredWeight;
        final LongAdder requests = new LongAdder();
        final LongAdder successes = new LongAdder();
        final LongAdder failures = new LongAdder();
        final DoubleAdder metricSum = new DoubleAdder();
        final LongAdder metricCount = new LongAdder();

        Variant(String versionId, double configuredWeight) {
            this.versionId = versionId;
            this.configuredWeight = configuredWeight;
        }

        long samples() {
            return successes.sum() + failures.sum();
        }

        double successRate() {
            long samples = samples();
            return samples == 0 ? 0.0 : (double) successes.sum() / samples;
        }

        double meanMetric() {
            long count = metricCount.sum();
            return count == 0 ? 0.0 : metricSum.sum() / count;
        }
    }

    private static final class AbTest {
        private final String testId;
        private final String modelName;
        private final RolloutStrategy strategy;
        private final RolloutPlan plan;
        private final int minSamples;
        private final Instant startedAt;
        private final Instant plannedEndAt;
        private final List<Variant> variants;
        private volatile AbTestStatus status = AbTestStatus.ACTIVE;
        private volatile Instant endedAt;
        private volatile String winnerVersionId;

        private AbTest(String testId, String modelName, RolloutStrategy strategy, RolloutPlan plan, int minSamples,
                       Instant startedAt, Instant plannedEndAt, List<Variant> variants) {
            this.testId = testId;
            this.modelName = modelName;
            this.strategy = strategy;
            this.plan = plan;
            this.minSamples = minSamples;
            this.startedAt = startedAt;
            this.plannedEndAt = plannedEndAt;
            this.variants = List.copyOf(variants);
        }

        private Variant variant(String versionId) {
            return variants.stream()
                .filter(v -> v.versionId.equals(versionId))
                .findFirst()
                .orElseThrow(() -> new ModelNotFoundException(
                    "Version '" + versionId + "' is not a variant of test '" + testId + "'."));
        }

        private double[] currentWeights(Instant now) {
            double[] weights = new double[variants.size()];
            if (status == AbTestStatus.COMPLETED) {
                for (int i = 0; i < weights.length; i++) {
                    weights[i] = variants.get(i).versionId.equals(winnerVersionId) ? 1.0 : 0.0;
                }
                return weights;
            }
            if (strategy == RolloutStrategy.AB) {
                for (int i = 0; i < weights.length; i++) {
                    weights[i] = variants.get(i).configuredWeight;
                }
                return weights;
            }
            if (weights.length == 1) {
                weights[0] = 1.0;
                return weights;
            }
            double share = strategy.candidateShare(Duration.between(startedAt, now), plan);
            weights[0] = 1.0 - share;
            weights[1] = share;
            return weights;
        }

        private synchronized void close(String winner, Instant at) {
            winnerVersionId = winner;
            endedAt = at;
            status = AbTestStatus.COMPLETED;
        }

        private AbTestResponse toResponse(Instant now) {
            double[] weights = currentWeights(now);
            List<AbTestResponse.VariantStats> stats = new ArrayList<>(variants.size());
            for (int i = 0; i < variants.size(); i++) {
                Variant v = variants.get(i);
                long samples = v.samples();
                long metrics = v.metricCount.sum();
                stats.add(AbTestResponse.VariantStats.builder()
                    .versionId(v.versionId)
                    .weight(weights[i])
                    .requests(v.requests.sum())
                    .successes(v.successes.sum())
                    .failures(v.failures.sum())
                    .successRate(samples == 0 ? null : v.successRate())
                    .meanMetric(metrics == 0 ? null : v.meanMetric())
                    .metricCount(metrics)
                    .build());
            }
            boolean samplesReached = variants.stream().allMatch(v -> v.samples() >= minSamples);
            boolean durationElapsed = plannedEndAt != null && !now.isBefore(plannedEndAt);
            return AbTestResponse.builder()
                .testId(testId)
                .modelName(modelName)
                .strategy(strategy)
                .status(status)
                .startedAt(startedAt)
                .plannedEndAt(plannedEndAt)
                .remainingDays(plannedEndAt == null ? null : Math.max(0L, Duration.between(now, plannedEndAt).toDays()))
                .endedAt(endedAt)
                .minSamplesPerVariant(minSamples)
                .minSamplesReached(samplesReached)
                .durationElapsed(durationElapsed)
                .readyToConclude(status == AbTestStatus.ACTIVE && (samplesReached || durationElapsed))
                .winnerVersionId(winnerVersionId)
                .variants(stats)
                .build();
        }
    }
}
