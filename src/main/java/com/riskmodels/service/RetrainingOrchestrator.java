package com.riskmodels.service;

import com.riskmodels.client.EvalDataset;
import com.riskmodels.client.EvalDatasetProvider;
import com.riskmodels.client.Trainer;
import com.riskmodels.client.TrainingResult;
import com.riskmodels.dto.MetricComparison;
import com.riskmodels.dto.ModelMetadata;
import com.riskmodels.dto.ModelVersionResponse;
import com.riskmodels.dto.PromotionResult;
import com.riskmodels.dto.RetrainingOutcome;
import com.riskmodels.dto.RetrainingStatus;
import com.riskmodels.dto.TrainingOverrides;
import com.riskmodels.dto.TriggerDecision;
import com.riskmodels.exception.ModelLifecycleException;
import com.riskmodels.exception.ModelNotFoundException;
import com.riskmodels.exception.NoBaselineException;
import com.riskmodels.exception.TrainingFailedException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs retraining for one model: train, register, evaluate, then hand the candidate to the
 * {@link Promoter}. At most one run per model is in flight; a trigger arriving while one is
 * running is dropped. A run whose trainer timed out stays in flight until the trainer thread
 * has actually returned.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrainingOrchestrator {

    public static final String ORCHESTRATOR_ACTOR = "retraining-orchestrator";

    private final ModelRegistryService registry;
    private final Trainer trainer;
    private final EvalDatasetProvider datasetProvider;
    private final ModelEvaluator evaluator;
    private final Promoter promoter;
    private final NotificationService notifications;

    @Value("${lifecycle.retraining.pool-size:2}")
    private int poolSize = 2;

    @Value("${lifecycle.retraining.trainer-timeout:PT6H}")
    private Duration trainerTimeout = Duration.ofHours(6);

    @Value("${lifecycle.retraining.dataset-ref:latest}")
    private String defaultDatasetRef = "latest";

    private ExecutorService runExecutor;
    private ExecutorService trainingExecutor;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<String, RetrainingOutcome> lastOutcomes = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, CompletableFuture<Void>> stoppingTrainers = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        runExecutor = Executors.newFixedThreadPool(Math.max(1, poolSize));
        trainingExecutor = Executors.newFixedThreadPool(Math.max(1, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (runExecutor != null) {
            runExecutor.shutdown();
        }
        if (trainingExecutor != null) {
            trainingExecutor.shutdownNow();
        }
    }

    public boolean submit(TriggerDecision decision) {
        return submit(decision, TrainingOverrides.NONE);
    }

    /**
     * Starts a run in the background when the decision fired at least one trigger.
     *
     * @return {@code false} when nothing fired or a run for the model is already in flight
     */
    public boolean submit(TriggerDecision decision, TrainingOverrides overrides) {
        String modelName = decision.getModelName();
        if (!decision.shouldRetrain()) {
            log.debug("Retraining not needed | model={}", modelName);
            return false;
        }
        if (!inFlight.add(modelName)) {
            log.info("Retraining coalesced | model={} | reasons={} | a run is already in flight",
                     modelName, decision.getReasons());
            return false;
        }
        try {
            CompletableFuture.runAsync(() -> {
                try {
                    run(decision, overrides);
                } finally {
                    releaseWhenTrainerStops(modelName);
                }
            }, runExecutor);
        } catch (RuntimeException ex) {
            inFlight.remove(modelName);
            throw ex;
        }
        log.info("Retraining submitted | model={} | reasons={}", modelName, decision.getReasons());
        return true;
    }

    private void releaseWhenTrainerStops(String modelName) {
        CompletableFuture<Void> stopping = stoppingTrainers.get(modelName);
        if (stopping == null) {
            inFlight.remove(modelName);
            return;
        }
        log.warn("Retraining stays in flight until the timed-out trainer returns | model={}", modelName);
        stopping.whenComplete((ignored, ex) -> inFlight.remove(modelName));
    }

    public boolean isRunning(String modelName) {
        return inFlight.contains(modelName);
    }

    public Optional<RetrainingOutcome> lastOutcome(String modelName) {
        return Optional.ofNullable(lastOutcomes.get(modelName));
    }

    /**
     * Executes one run on the calling thread. Does not take part in coalescing; use
     * {@link #submit} for triggered runs.
     */
    public RetrainingOutcome run(TriggerDecision decision, TrainingOverrides overrides) {
        String modelName = decision.getModelName();
        TrainingOverrides effective = overrides != null ? overrides : TrainingOverrides.NONE;
        UUID runId = UUID.randomUUID();
        RetrainingOutcome.RetrainingOutcomeBuilder outcome = RetrainingOutcome.builder()
            .runId(runId)
            .modelName(modelName)
            .triggers(decision.getReasons())
            .startedAt(Instant.now());
        notifications.retrainingStarted(decision, runId);
        log.info("Retraining started | model={} | run={} | reasons={}", modelName, runId, decision.getReasons());

        ModelVersionResponse production = currentProduction(modelName);
        if (production != null) {
            outcome.productionVersionId(production.getVersionId());
        }

        Map<String, String> hyperparameters = hyperparameters(effective, production);
        TrainingResult trained;
        try {
            trained = train(modelName, datasetRef(effective), hyperparameters);
        } catch (TrainingFailedException ex) {
            return fail(outcome, ex);
        }

        String versionId = null;
        try {
            versionId = registry.register(modelName, trained.artifact(), metadata(trained, hyperparameters, decision, runId));
            outcome.versionId(versionId);
            ModelVersionResponse candidate = registry.get(modelName, versionId);

            EvalDataset heldOut = datasetProvider.getHeldOutSet(modelName);
            Map<String, Double> candidateMetrics = evaluator.evaluate(candidate, heldOut);
            registry.recordEvaluationMetrics(modelName, versionId, candidateMetrics);
            outcome.candidateMetrics(candidateMetrics);

            MetricComparison comparison = null;
            if (production != null) {
                Map<String, Double> productionMetrics = productionMetrics(production, heldOut);
                outcome.productionMetrics(productionMetrics);
                try {
                    comparison = evaluator.compare(candidateMetrics, productionMetrics, versionId);
                } catch (NoBaselineException ex) {
                    log.warn("No usable production baseline | model={} | production={} | reason={}",
                             modelName, production.getVersionId(), ex.getMessage());
                }
            }

            PromotionResult promotion = promoter.decide(modelName, versionId, comparison, ORCHESTRATOR_ACTOR);
            RetrainingOutcome completed = outcome
                .promotion(promotion)
                .status(RetrainingStatus.COMPLETED)
                .finishedAt(Instant.now())
                .build();
            lastOutcomes.put(modelName, completed);
            notifications.retrainingCompleted(completed);
            log.info("Retraining completed | model={} | run={} | version={} | decision={}",
                     modelName, runId, versionId, promotion.getDecision());
            return completed;
        } catch (ModelLifecycleException ex) {
            return fail(outcome, ex);
        } catch (RuntimeException ex) {
            log.error("Retraining aborted by unexpected error | model={} | run={} | version={}",
                      modelName, runId, versionId, ex);
            return fail(outcome, ex);
        }
    }

    private TrainingResult train(String modelName, String datasetRef, Map<String, String> hyperparameters) {
        AtomicBoolean started = new AtomicBoolean(false);
        CompletableFuture<Void> finished = new CompletableFuture<>();
        Future<TrainingResult> pending;
        try {
            pending = trainingExecutor.submit(() -> {
                if (!started.compareAndSet(false, true)) {
                    return null;
                }
                try {
                    return trainer.train(modelName, datasetRef, hyperparameters);
                } finally {
                    finished.complete(null);
                }
            });
        } catch (RejectedExecutionException ex) {
            throw new TrainingFailedException("Training of '" + modelName + "' could not be scheduled", ex);
        }
        try {
            return pending.get(trainerTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            stopTrainer(modelName, pending, started, finished);
            throw new TrainingFailedException(
                "Training of '" + modelName + "' exceeded " + trainerTimeout, ex);
        } catch (InterruptedException ex) {
            stopTrainer(modelName, pending, started, finished);
            Thread.currentThread().interrupt();
            throw new TrainingFailedException("Training of '" + modelName + "' was interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof TrainingFailedException failed) {
                throw failed;
            }
            throw new TrainingFailedException(
                "Training of '" + modelName + "' failed: " + (cause != null ? cause.getMessage() : ex.getMessage()),
                cause);
        }
    }

    /**
     * Interrupts the trainer thread. A task that never started is finished right away;
     * otherwise the model is tracked until the trainer returns.
     */
    private void stopTrainer(String modelName, Future<TrainingResult> pending, AtomicBoolean started,
                             CompletableFuture<Void> finished) {
        pending.cancel(true);
        if (started.compareAndSet(false, true)) {
            finished.complete(null);
            return;
        }
        if (!finished.isDone()) {
            stoppingTrainers.put(modelName, finished);
            finished.whenComplete((ignored, ex) -> {
                stoppingTrainers.remove(modelName, finished);
                log.info("Timed-out trainer returned | model={}", modelName);
            });
        }
    }

    private RetrainingOutcome fail(RetrainingOutcome.RetrainingOutcomeBuilder builder, RuntimeException ex) {
        RetrainingOutcome failed = builder
            .status(RetrainingStatus.FAILED)
            .error(ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName())
            .errorCode(ex instanceof ModelLifecycleException lifecycle ? lifecycle.getErrorCode() : "INTERNAL_ERROR")
            .finishedAt(Instant.now())
            .build();
        lastOutcomes.put(failed.getModelName(), failed);
        log.error("Retraining failed | model={} | run={} | version={} | errorCode={} | reason={}",
                  failed.getModelName(), failed.getRunId(), failed.getVersionId(), failed.getErrorCode(),
                  failed.getError());
        notifications.retrainingFailed(failed);
        return failed;
    }

    private ModelVersionResponse currentProduction(String modelName) {
        try {
            return registry.getProduction(modelName);
        } catch (ModelNotFoundException ex) {
            return null;
        }
    }

    /** Production scored on the same held-out set; stored metrics when scoring fails. */
    private Map<String, Double> productionMetrics(ModelVersionResponse production, EvalDataset heldOut) {
        try {
            return evaluator.evaluate(production, heldOut);
        } catch (RuntimeException ex) {
            log.warn("Production re-evaluation failed, using stored metrics | model={} | version={} | reason={}",
                     production.getModelName(), production.getVersionId(), ex.getMessage());
            return production.getMetrics();
        }
    }

    private String datasetRef(TrainingOverrides overrides) {
        return overrides.datasetRef() != null && !overrides.datasetRef().isBlank()
            ? overrides.datasetRef()
            : defaultDatasetRef;
    }

    private Map<String, String> hyperparameters(TrainingOverrides overrides, ModelVersionResponse production) {
        if (overrides.hyperparameters() != null && !overrides.hyperparameters().isEmpty()) {
            return overrides.hyperparameters();
        }
        return production != null && production.getHyperparameters() != null ? production.getHyperparameters() : Map.of();
    }

    private ModelMetadata metadata(TrainingResult trained, Map<String, String> requested, TriggerDecision decision,
                                   UUID runId) {
        return ModelMetadata.builder()
            .datasetRef(trained.datasetRef())
            .datasetSnapshotAt(trained.datasetSnapshotAt())
            .hyperparameters(trained.hyperparameters().isEmpty() ? requested : trained.hyperparameters())
            .featureSchema(trained.featureSchema())
            .metrics(prefixed(trained.trainingMetrics()))
            .trainingSampleCount(trained.trainingSampleCount())
            .referenceSample(trained.referenceSample())
            .registeredBy(decision.getRequestedBy() != null
                ? decision.getRequestedBy()
                : ORCHESTRATOR_ACTOR + ":" + runId)
            .build();
    }

    /** Training-set metrics are kept apart from held-out metrics under a {@code train_} prefix. */
    private static Map<String, Double> prefixed(Map<String, Double> trainingMetrics) {
        Map<String, Double> result = new LinkedHashMap<>();
        trainingMetrics.forEach((k, v) -> result.put("train_" + k, v));
        return result;
    }
}
