package com.riskmodels.service;

import com.riskmodels.client.EvalDataset;
import com.riskmodels.client.EvalDatasetProvider;
import com.riskmodels.client.Trainer;
import com.riskmodels.client.TrainingResult;
import com.riskmodels.dto.MetricComparison;
import com.riskmodels.dto.ModelMetadata;
import com.riskmodels.dto.ModelVersionResponse;
import com.riskmodels.dto.PromotionDecision;
import com.riskmodels.dto.PromotionResult;
import com.riskmodels.dto.RetrainingOutcome;
import com.riskmodels.dto.RetrainingStatus;
import com.riskmodels.dto.TrainingOverrides;
import com.riskmodels.dto.TriggerDecision;
import com.riskmodels.dto.TriggerReason;
import com.riskmodels.entity.ModelStatus;
import com.riskmodels.exception.ModelNotFoundException;
import com.riskmodels.exception.RegistrationTimeoutException;
import com.riskmodels.exception.TrainingFailedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetrainingOrchestratorTest {

    private static final String MODEL = "credit_risk";

    @Mock ModelRegistryService registry;
    @Mock Trainer trainer;
    @Mock EvalDatasetProvider datasetProvider;
    @Mock ModelEvaluator evaluator;
    @Mock Promoter promoter;
    @Mock NotificationService notifications;
    @InjectMocks RetrainingOrchestrator orchestrator;

    private final EvalDataset heldOut = new EvalDataset("holdout", List.of(0, 1), List.of(Map.of(), Map.of()));

    private final ModelVersionResponse production = ModelVersionResponse.builder()
        .modelName(MODEL).versionId("v1").status(ModelStatus.PRODUCTION)
        .hyperparameters(Map.of("max_depth", "6")).metrics(Map.of("roc_auc", 0.80)).build();

    private final ModelVersionResponse candidate = ModelVersionResponse.builder()
        .modelName(MODEL).versionId("v2").status(ModelStatus.REGISTERED).build();

    @BeforeEach
    void setUp() {
        orchestrator.init();
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    private static TriggerDecision decision(TriggerReason... reasons) {
        return TriggerDecision.builder()
            .modelName(MODEL)
            .reasons(reasons.length == 0 ? Set.of() : Set.of(reasons))
            .evaluatedAt(Instant.now())
            .build();
    }

    private static TrainingResult trained() {
        return new TrainingResult(new byte[]{1, 2, 3}, Map.of("roc_auc", 0.95), "snapshot-2025-06",
            Instant.parse("2025-06-01T00:00:00Z"), List.of("income", "age"), 50_000,
            Map.of("max_depth", "6"), Map.of("income", List.of(1.0, 2.0)));
    }

    @Test
    void run_trainsRegistersEvaluatesAndPromotes() {
        when(registry.getProduction(MODEL)).thenReturn(production);
        when(trainer.train(MODEL, "latest", Map.of("max_depth", "6"))).thenReturn(trained());
        when(registry.register(eq(MODEL), any(), any())).thenReturn("v2");
        when(registry.get(MODEL, "v2")).thenReturn(candidate);
        when(datasetProvider.getHeldOutSet(MODEL)).thenReturn(heldOut);
        when(evaluator.evaluate(candidate, heldOut)).thenReturn(Map.of("roc_auc", 0.90));
        when(evaluator.evaluate(production, heldOut)).thenReturn(Map.of("roc_auc", 0.80));
        MetricComparison comparison = MetricComparison.builder()
            .metric("roc_auc").candidateValue(0.90).productionValue(0.80).improvementPct(12.5).build();
        when(evaluator.compare(Map.of("roc_auc", 0.90), Map.of("roc_auc", 0.80), "v2")).thenReturn(comparison);
        when(promoter.decide(MODEL, "v2", comparison, RetrainingOrchestrator.ORCHESTRATOR_ACTOR))
            .thenReturn(PromotionResult.builder().modelName(MODEL).versionId("v2")
                .decision(PromotionDecision.PROMOTED).resultingStatus(ModelStatus.PRODUCTION)
                .replacedVersionId("v1").improvementPct(12.5).thresholdPct(5.0).build());

        RetrainingOutcome outcome = orchestrator.run(decision(TriggerReason.DRIFT), TrainingOverrides.NONE);

        assertThat(outcome.getStatus()).isEqualTo(RetrainingStatus.COMPLETED);
        assertThat(outcome.getVersionId()).isEqualTo("v2");
        assertThat(outcome.getProductionVersionId()).isEqualTo("v1");
        assertThat(outcome.getPromotion().getDecision()).isEqualTo(PromotionDecision.PROMOTED);
        assertThat(outcome.getTriggers()).containsExactly(TriggerReason.DRIFT);

        ArgumentCaptor<ModelMetadata> metadata = ArgumentCaptor.forClass(ModelMetadata.class);
        verify(registry).register(eq(MODEL), any(), metadata.capture());
        assertThat(metadata.getValue().getMetrics()).containsEntry("train_roc_auc", 0.95);
        assertThat(metadata.getValue().getDatasetRef()).isEqualTo("snapshot-2025-06");
        verify(registry).recordEvaluationMetrics(MODEL, "v2", Map.of("roc_auc", 0.90));
        verify(notifications).retrainingStarted(any(), any());
        verify(notifications).retrainingCompleted(outcome);
        verify(notifications, never()).retrainingFailed(any());
        assertThat(orchestrator.lastOutcome(MODEL)).contains(outcome);
    }

    @Test
    void run_withoutProduction_promotesWithoutBaseline() {
        when(registry.getProduction(MODEL)).thenThrow(ModelNotFoundException.production(MODEL));
        when(trainer.train(MODEL, "latest", Map.of())).thenReturn(trained());
        when(registry.register(eq(MODEL), any(), any())).thenReturn("v1");
        when(registry.get(MODEL, "v1")).thenReturn(candidate);
        when(datasetProvider.getHeldOutSet(MODEL)).thenReturn(heldOut);
        when(evaluator.evaluate(candidate, heldOut)).thenReturn(Map.of("roc_auc", 0.75));
        when(promoter.decide(MODEL, "v1", null, RetrainingOrchestrator.ORCHESTRATOR_ACTOR))
            .thenReturn(PromotionResult.builder().decision(PromotionDecision.PROMOTED)
                .resultingStatus(ModelStatus.PRODUCTION).thresholdPct(5.0).build());

        RetrainingOutcome outcome = orchestrator.run(decision(TriggerReason.SCHEDULE), null);

        assertThat(outcome.getStatus()).isEqualTo(RetrainingStatus.COMPLETED);
        assertThat(outcome.getProductionVersionId()).isNull();
        verify(evaluator, never()).compare(any(), any(), any());
    }

    @Test
    void run_overridesReplaceDatasetAndHyperparameters() {
        when(registry.getProduction(MODEL)).thenReturn(production);
        when(trainer.train(MODEL, "snapshot-override", Map.of("max_depth", "8")))
            .thenThrow(new TrainingFailedException("stop here"));

        orchestrator.run(decision(TriggerReason.FORCED),
            new TrainingOverrides("snapshot-override", Map.of("max_depth", "8")));

        verify(trainer).train(MODEL, "snapshot-override", Map.of("max_depth", "8"));
    }

    @Test
    void run_trainerFailure_registersNothing() {
        when(registry.getProduction(MODEL)).thenReturn(production);
        when(trainer.train(any(), any(), any())).thenThrow(new TrainingFailedException("out of memory"));

        RetrainingOutcome outcome = orchestrator.run(decision(TriggerReason.VOLUME), TrainingOverrides.NONE);

        assertThat(outcome.getStatus()).isEqualTo(RetrainingStatus.FAILED);
        assertThat(outcome.getErrorCode()).isEqualTo("TRAINING_FAILED");
        assertThat(outcome.getError()).contains("out of memory");
        assertThat(outcome.getVersionId()).isNull();
        verify(registry, never()).register(any(), any(), any());
        verifyNoInteractions(promoter);
        verify(notifications).retrainingFailed(outcome);
    }

    @Test
    void run_trainerTimeout_failsRunAndInterruptsTrainer() throws Exception {
        ReflectionTestUtils.setField(orchestrator, "trainerTimeout", Duration.ofMillis(100));
        CountDownLatch interrupted = new CountDownLatch(1);
        when(registry.getProduction(MODEL)).thenReturn(production);
        when(trainer.train(any(), any(), any())).thenAnswer(inv -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException ex) {
                interrupted.countDown();
                throw ex;
            }
            return trained();
        });

        RetrainingOutcome outcome = orchestrator.run(decision(TriggerReason.SCHEDULE), TrainingOverrides.NONE);

        assertThat(outcome.getStatus()).isEqualTo(RetrainingStatus.FAILED);
        assertThat(outcome.getErrorCode()).isEqualTo("TRAINING_FAILED");
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
        verify(registry, never()).register(any(), any(), any());
    }

    @Test
    void submit_afterTrainerTimeout_staysInFlightUntilTrainerReturns() throws Exception {
        ReflectionTestUtils.setField(orchestrator, "trainerTimeout", Duration.ofMillis(200));
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        AtomicBoolean sawInterrupt = new AtomicBoolean(false);
        when(registry.getProduction(MODEL)).thenReturn(production);
        when(trainer.train(any(), any(), any())).thenAnswer(inv -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            try {
                while (true) {
                    try {
                        if (release.await(10, TimeUnit.SECONDS)) {
                            break;
                        }
                    } catch (InterruptedException ex) {
                        sawInterrupt.set(true);
                    }
                }
                throw new TrainingFailedException("trainer ignored the deadline");
            } finally {
                active.decrementAndGet();
            }
        });

        assertThat(orchestrator.submit(decision(TriggerReason.DRIFT))).isTrue();
        awaitCondition(() -> orchestrator.lastOutcome(MODEL).isPresent());
        assertThat(orchestrator.lastOutcome(MODEL).get().getStatus()).isEqualTo(RetrainingStatus.FAILED);

        assertThat(orchestrator.isRunning(MODEL)).isTrue();
        assertThat(orchestrator.submit(decision(TriggerReason.VOLUME))).isFalse();
        awaitCondition(sawInterrupt::get);

        release.countDown();
        awaitCondition(() -> !orchestrator.isRunning(MODEL));

        assertThat(orchestrator.submit(decision(TriggerReason.VOLUME))).isTrue();
        awaitCondition(() -> !orchestrator.isRunning(MODEL));
        verify(trainer, times(2)).train(any(), any(), any());
        assertThat(maxActive.get()).isEqualTo(1);
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(condition.getAsBoolean()).isTrue();
    }

    @Test
    void run_registryFailureAfterTraining_failsWithoutPromotion() {
        when(registry.getProduction(MODEL)).thenReturn(production);
        when(trainer.train(any(), any(), any())).thenReturn(trained());
        when(registry.register(eq(MODEL), any(), any()))
            .thenThrow(new RegistrationTimeoutException(MODEL, Duration.ofSeconds(5), null));

        RetrainingOutcome outcome = orchestrator.run(decision(TriggerReason.DRIFT), TrainingOverrides.NONE);

        assertThat(outcome.getStatus()).isEqualTo(RetrainingStatus.FAILED);
        assertThat(outcome.getErrorCode()).isEqualTo("REGISTRATION_TIMEOUT");
        verifyNoInteractions(promoter);
        verify(notifications).retrainingFailed(outcome);
    }

    @Test
    void submit_nothingFired_isNoOp() {
        assertThat(orchestrator.submit(decision())).isFalse();
        verifyNoInteractions(trainer, registry, notifications);
    }

    @Test
    void submit_whileRunInFlight_isCoalesced() throws Exception {
        CountDownLatch trainingStarted = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(registry.getProduction(MODEL)).thenReturn(production);
        when(trainer.train(any(), any(), any())).thenAnswer(inv -> {
            trainingStarted.countDown();
            release.await(10, TimeUnit.SECONDS);
            throw new TrainingFailedException("released");
        });

        assertThat(orchestrator.submit(decision(TriggerReason.DRIFT))).isTrue();
        assertThat(trainingStarted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(orchestrator.isRunning(MODEL)).isTrue();

        assertThat(orchestrator.submit(decision(TriggerReason.VOLUME))).isFalse();

        release.countDown();
        long deadline = System.currentTimeMillis() + 5_000;
        while (orchestrator.isRunning(MODEL) && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(orchestrator.isRunning(MODEL)).isFalse();
        verify(trainer, times(1)).train(any(), any(), any());
    }
}
