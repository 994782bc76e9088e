package com.riskmodels.service;

import com.riskmodels.dto.DriftCheckResult;
import com.riskmodels.dto.DriftReport;
import com.riskmodels.exception.InsufficientDataException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Arrays;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class DriftDetectorTest {

    private DriftDetector detector;

    @BeforeEach
    void setUp() {
        detector = new DriftDetector();
    }

    private static double[] normal(Random random, int n, double mean, double sd) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = mean + sd * random.nextGaussian();
        }
        return values;
    }

    @Test
    void identicalSamples_noDrift() {
        double[] reference = normal(new Random(1), 1000, 0.0, 1.0);
        DriftCheckResult result = detector.detect("credit_risk",
            Map.of("income", reference), Map.of("income", reference.clone()));

        assertThat(result.isDriftDetected()).isFalse();
        DriftReport report = result.getReports().get(0);
        assertThat(report.getKsStatistic()).isZero();
        assertThat(report.getKsPValue()).isEqualTo(1.0);
        assertThat(report.getPsi()).isCloseTo(0.0, within(1e-12));
        assertThat(report.getSignificanceLevel()).isEqualTo(DriftDetector.DEFAULT_SIGNIFICANCE);
        assertThat(report.getPsiThreshold()).isEqualTo(DriftDetector.DEFAULT_PSI_THRESHOLD);
    }

    @Test
    void shiftedMean_flagsDriftOnBothStatistics() {
        Random random = new Random(2);
        DriftReport report = detector.detectFeature("credit_risk", "income",
            normal(random, 1000, 0.0, 1.0), normal(random, 500, 1.0, 1.0));

        assertThat(report.isExceeded()).isTrue();
        assertThat(report.ksExceeded()).isTrue();
        assertThat(report.psiExceeded()).isTrue();
        assertThat(report.getKsPValue()).isLessThan(1e-6);
        assertThat(report.getReferenceSize()).isEqualTo(1000);
        assertThat(report.getRecentSize()).isEqualTo(500);
    }

    @Test
    void modelDriftIsAnyFeatureDrift() {
        Random random = new Random(3);
        double[] stable = normal(random, 800, 0.0, 1.0);
        DriftCheckResult result = detector.detect("credit_risk",
            Map.of("age", stable, "utilization", normal(random, 800, 0.3, 0.1)),
            Map.of("age", stable.clone(), "utilization", normal(random, 400, 0.7, 0.1)));

        assertThat(result.isDriftDetected()).isTrue();
        assertThat(result.getReports()).hasSize(2);
        assertThat(result.driftedFeatures()).extracting(DriftReport::getFeatureName).containsExactly("utilization");
    }

    @Test
    void featuresMissingFromRecentWindow_areSkipped() {
        double[] values = normal(new Random(4), 200, 0.0, 1.0);
        DriftCheckResult result = detector.detect("credit_risk",
            Map.of("age", values, "tenure", values), Map.of("age", values.clone()));

        assertThat(result.getReports()).extracting(DriftReport::getFeatureName).containsExactly("age");
    }

    @Test
    void falsePositiveRate_matchesSignificanceLevel() {
        Random random = new Random(20240601L);
        int trials = 1000;
        int rejections = 0;
        for (int t = 0; t < trials; t++) {
            double[] a = normal(random, 200, 0.0, 1.0);
            double[] b = normal(random, 200, 0.0, 1.0);
            Arrays.sort(a);
            Arrays.sort(b);
            double d = DriftDetector.ksStatistic(a, b);
            if (DriftDetector.ksPValue(d, a.length, b.length) < DriftDetector.DEFAULT_SIGNIFICANCE) {
                rejections++;
            }
        }
        double rate = (double) rejections / trials;
        assertThat(rate).isBetween(0.025, 0.08);
    }

    @Test
    void ksStatistic_disjointSamplesIsOne() {
        assertThat(DriftDetector.ksStatistic(new double[]{1, 2, 3, 4}, new double[]{5, 6, 7, 8})).isEqualTo(1.0);
        assertThat(DriftDetector.ksStatistic(new double[]{1, 2, 3, 4}, new double[]{1, 2, 3, 4})).isZero();
        assertThat(DriftDetector.ksStatistic(new double[]{1, 2, 3, 4}, new double[]{3, 4, 5, 6})).isEqualTo(0.5);
    }

    @Test
    void ksPValue_isMonotoneInStatistic() {
        double small = DriftDetector.ksPValue(0.05, 500, 500);
        double large = DriftDetector.ksPValue(0.2, 500, 500);
        assertThat(small).isGreaterThan(large);
        assertThat(DriftDetector.ksPValue(0.0, 500, 500)).isEqualTo(1.0);
        assertThat(large).isBetween(0.0, 1e-6);
    }

    @Test
    void psi_emptyBinsAreFlooredSoResultIsFinite() {
        double[] reference = new double[100];
        double[] recent = new double[100];
        for (int i = 0; i < 100; i++) {
            reference[i] = i;
            recent[i] = 1000 + i;
        }
        double psi = DriftDetector.psi(reference, recent);
        assertThat(psi).isFinite().isGreaterThan(DriftDetector.DEFAULT_PSI_THRESHOLD);
    }

    @Test
    void tooFewRecentObservations_throwsInsufficientData() {
        Random random = new Random(5);
        assertThatThrownBy(() -> detector.detect("credit_risk",
                Map.of("income", normal(random, 500, 0, 1)), Map.of("income", normal(random, 29, 0, 1))))
            .isInstanceOf(InsufficientDataException.class)
            .hasMessageContaining("29");
    }

    @Test
    void sparseFeature_isSkippedWhileOtherFeatureStillDrifts() {
        Random random = new Random(7);
        DriftCheckResult result = detector.detect("credit_risk",
            Map.of("income", normal(random, 800, 0.0, 1.0), "secondary_income", normal(random, 800, 0.0, 1.0)),
            Map.of("income", normal(random, 400, 1.5, 1.0), "secondary_income", normal(random, 12, 0.0, 1.0)));

        assertThat(result.isDriftDetected()).isTrue();
        assertThat(result.getReports()).extracting(DriftReport::getFeatureName).containsExactly("income");
    }

    @Test
    void emptyReference_throwsInsufficientData() {
        assertThatThrownBy(() -> detector.detect("credit_risk", Map.of(), Map.of("income", new double[50])))
            .isInstanceOf(InsufficientDataException.class);
        assertThatThrownBy(() -> detector.detect("credit_risk",
                Map.of("income", new double[0]), Map.of("income", new double[50])))
            .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void minimumSampleSizeIsConfigurable() {
        ReflectionTestUtils.setField(detector, "minSamples", 5);
        Random random = new Random(6);
        DriftReport report = detector.detectFeature("credit_risk", "income",
            normal(random, 100, 0, 1), normal(random, 10, 0, 1));
        assertThat(report.getRecentSize()).isEqualTo(10);
    }
}
