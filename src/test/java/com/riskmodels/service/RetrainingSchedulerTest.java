package com.riskmodels.service;

import com.riskmodels.client.LabeledDataSource;
import com.riskmodels.dto.DriftCheckResult;
import com.riskmodels.dto.DriftReport;
import com.riskmodels.dto.ModelVersionResponse;
import com.riskmodels.dto.TrainingOverrides;
import com.riskmodels.dto.TriggerDecision;
import com.riskmodels.dto.TriggerReason;
import com.riskmodels.entity.DriftReportRecord;
import com.riskmodels.entity.ModelStatus;
import com.riskmodels.exception.InsufficientDataException;
import com.riskmodels.exception.MlServiceUnavailableException;
import com.riskmodels.exception.ModelNotFoundException;
import com.riskmodels.repository.DriftReportRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetrainingSchedulerTest {

    private static final String MODEL = "credit_risk";

    @Mock ModelRegistryService registry;
    @Mock DriftDetector driftDetector;
    @Mock FeatureWindowService featureWindows;
    @Mock LabeledDataSource labeledDataSource;
    @Spy TriggerEvaluator triggerEvaluator = new TriggerEvaluator();
    @Mock RetrainingOrchestrator orchestrator;
    @Mock NotificationService notifications;
    @Mock DriftReportRepository driftReportRepository;
    @InjectMocks RetrainingScheduler scheduler;

    private final ModelVersionResponse production = ModelVersionResponse.builder()
        .modelName(MODEL).versionId("v1").status(ModelStatus.PRODUCTION)
        .createdAt(Instant.now().minus(Duration.ofDays(2))).build();

    private final Map<String, double[]> reference = Map.of("income", new double[]{1.0, 2.0, 3.0});
    private final Map<String, double[]> recent = Map.of("income", new double[]{4.0, 5.0});

    private void trainedDaysAgo(String modelName, int days) {
        when(registry.listVersions(modelName, null)).thenReturn(List.of(ModelVersionResponse.builder()
            .modelName(modelName).versionId("v1").status(ModelStatus.PRODUCTION)
            .createdAt(Instant.now().minus(Duration.ofDays(days))).build()));
    }

    private void liveWindow() {
        when(registry.getProduction(MODEL)).thenReturn(production);
        when(registry.loadReferenceSample(production)).thenReturn(reference);
        when(featureWindows.snapshot(MODEL)).thenReturn(recent);
    }

    private TriggerDecision submittedDecision() {
        ArgumentCaptor<TriggerDecision> decision = ArgumentCaptor.forClass(TriggerDecision.class);
        verify(orchestrator).submit(decision.capture(), eq(TrainingOverrides.NONE));
        return decision.getValue();
    }

    private static DriftReport report(String feature, boolean exceeded) {
        return DriftReport.builder()
            .modelName(MODEL).featureName(feature)
            .ksStatistic(exceeded ? 0.4 : 0.02).ksPValue(exceeded ? 1e-9 : 0.8).psi(exceeded ? 0.5 : 0.01)
            .significanceLevel(0.05).psiThreshold(0.2).exceeded(exceeded)
            .referenceSize(3).recentSize(2).timestamp(Instant.now())
            .build();
    }

    @Test
    void insufficientDriftData_isNoSignalWhileVolumeStillFires() {
        when(registry.listModelNames()).thenReturn(List.of(MODEL));
        trainedDaysAgo(MODEL, 2);
        liveWindow();
        when(driftDetector.detect(MODEL, reference, recent))
            .thenThrow(new InsufficientDataException("only 2 recent observations"));
        when(labeledDataSource.countLabeledRecordsSince(eq(MODEL), any())).thenReturn(5_000L);
        when(orchestrator.submit(any(), any())).thenReturn(true);

        scheduler.runScheduledChecks();

        TriggerDecision decision = submittedDecision();
        assertThat(decision.getReasons()).containsExactly(TriggerReason.VOLUME);
        assertThat(decision.isDriftVerdictAvailable()).isFalse();
        assertThat(decision.getRequestedBy()).isEqualTo(RetrainingScheduler.SCHEDULER_ACTOR);
        verifyNoInteractions(driftReportRepository);
        verify(notifications, never()).driftDetected(any());
    }

    @Test
    void failingLabeledCount_doesNotBlockScheduleSignal() {
        when(registry.listModelNames()).thenReturn(List.of(MODEL));
        trainedDaysAgo(MODEL, 40);
        when(registry.getProduction(MODEL)).thenThrow(ModelNotFoundException.production(MODEL));
        when(labeledDataSource.countLabeledRecordsSince(eq(MODEL), any()))
            .thenThrow(new MlServiceUnavailableException(new RuntimeException("connection refused")));
        when(orchestrator.submit(any(), any())).thenReturn(true);

        scheduler.runScheduledChecks();

        TriggerDecision decision = submittedDecision();
        assertThat(decision.getReasons()).containsExactly(TriggerReason.SCHEDULE);
        assertThat(decision.getNewRecordCount()).isNull();
    }

    @Test
    void failureOnOneModel_doesNotStopSweep() {
        when(registry.listModelNames()).thenReturn(List.of("broken", MODEL));
        when(registry.listVersions("broken", null)).thenThrow(new IllegalStateException("database unavailable"));
        trainedDaysAgo(MODEL, 2);
        when(registry.getProduction(MODEL)).thenThrow(ModelNotFoundException.production(MODEL));
        when(labeledDataSource.countLabeledRecordsSince(eq(MODEL), any())).thenReturn(2_500L);
        when(orchestrator.submit(any(), any())).thenReturn(true);

        scheduler.runScheduledChecks();

        TriggerDecision decision = submittedDecision();
        assertThat(decision.getModelName()).isEqualTo(MODEL);
        assertThat(decision.getReasons()).containsExactly(TriggerReason.VOLUME);
    }

    @Test
    void detectedDrift_isPersistedNotifiedAndTriggersRetraining() {
        when(registry.listModelNames()).thenReturn(List.of(MODEL));
        trainedDaysAgo(MODEL, 2);
        liveWindow();
        when(driftDetector.detect(MODEL, reference, recent)).thenReturn(DriftCheckResult.builder()
            .modelName(MODEL)
            .reports(List.of(report("income", true), report("age", false)))
            .driftDetected(true)
            .checkedAt(Instant.now())
            .build());
        when(labeledDataSource.countLabeledRecordsSince(eq(MODEL), any())).thenReturn(10L);
        when(orchestrator.submit(any(), any())).thenReturn(true);

        scheduler.runScheduledChecks();

        ArgumentCaptor<DriftReportRecord> saved = ArgumentCaptor.forClass(DriftReportRecord.class);
        verify(driftReportRepository, times(2)).save(saved.capture());
        assertThat(saved.getAllValues()).extracting(DriftReportRecord::getReferenceVersionId).containsOnly("v1");
        assertThat(saved.getAllValues()).extracting(DriftReportRecord::isExceeded).containsExactly(true, false);
        verify(notifications).driftDetected(argThat(r -> "v1".equals(r.getReferenceVersionId())));
        assertThat(submittedDecision().getReasons()).containsExactly(TriggerReason.DRIFT);
    }

    @Test
    void noTriggerFired_submitsNothing() {
        when(registry.listModelNames()).thenReturn(List.of(MODEL));
        trainedDaysAgo(MODEL, 2);
        when(registry.getProduction(MODEL)).thenThrow(ModelNotFoundException.production(MODEL));
        when(labeledDataSource.countLabeledRecordsSince(eq(MODEL), any())).thenReturn(10L);

        scheduler.runScheduledChecks();

        verifyNoInteractions(orchestrator);
    }
}
