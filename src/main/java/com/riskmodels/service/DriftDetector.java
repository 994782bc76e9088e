package com.riskmodels.service;

import com.riskmodels.dto.DriftCheckResult;
import com.riskmodels.dto.DriftReport;
import com.riskmodels.exception.InsufficientDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Compares the live feature distribution with the training-time reference sample.
 *
 * <p>Each feature gets a two-sample Kolmogorov-Smirnov test and a Population Stability
 * Index. A feature drifts when the KS p-value falls below the significance level or the
 * PSI exceeds its threshold; the model drifts when any feature does.</p>
 */
@Slf4j
@Service
public class DriftDetector {

    public static final double DEFAULT_SIGNIFICANCE = 0.05;
    public static final double DEFAULT_PSI_THRESHOLD = 0.2;
    public static final int DEFAULT_MIN_SAMPLES = 30;

    static final int PSI_BINS = 10;
    static final double PSI_FLOOR = 0.0001;

    @Value("${lifecycle.drift.significance:" + DEFAULT_SIGNIFICANCE + "}")
    private double significance = DEFAULT_SIGNIFICANCE;

    @Value("${lifecycle.drift.psi-threshold:" + DEFAULT_PSI_THRESHOLD + "}")
    private double psiThreshold = DEFAULT_PSI_THRESHOLD;

    @Value("${lifecycle.drift.min-samples:" + DEFAULT_MIN_SAMPLES + "}")
    private int minSamples = DEFAULT_MIN_SAMPLES;

    /**
     * Checks every feature present in both samples. A feature whose recent window is below the
     * minimum sample size is skipped.
     *
     * @throws InsufficientDataException when the reference is empty, no feature is shared,
     *         or no shared feature has enough recent observations
     */
    public DriftCheckResult detect(String modelName, Map<String, double[]> reference, Map<String, double[]> recent) {
        if (reference == null || reference.isEmpty()) {
            throw new InsufficientDataException("No reference sample stored for '" + modelName + "'.");
        }
        if (recent == null || recent.isEmpty()) {
            throw new InsufficientDataException("No recent observations for '" + modelName + "'.");
        }

        Instant now = Instant.now();
        List<DriftReport> reports = new ArrayList<>();
        List<String> undersampled = new ArrayList<>();
        for (Map.Entry<String, double[]> entry : reference.entrySet()) {
            double[] live = recent.get(entry.getKey());
            if (live == null) {
                continue;
            }
            if (live.length < minSamples) {
                undersampled.add(entry.getKey() + "=" + live.length);
                continue;
            }
            reports.add(detectFeature(modelName, entry.getKey(), entry.getValue(), live, now));
        }
        if (reports.isEmpty() && !undersampled.isEmpty()) {
            throw new InsufficientDataException("No feature of '" + modelName + "' has " + minSamples
                + " recent observations: " + undersampled + ".");
        }
        if (reports.isEmpty()) {
            throw new InsufficientDataException(
                "Reference and recent samples of '" + modelName + "' share no feature.");
        }
        if (!undersampled.isEmpty()) {
            log.info("Features skipped for lack of recent observations | model={} | features={} | minSamples={}",
                     modelName, undersampled, minSamples);
        }

        boolean drift = reports.stream().anyMatch(DriftReport::isExceeded);
        if (drift) {
            reports.stream().filter(DriftReport::isExceeded).forEach(r ->
                log.warn("Feature drift | model={} | feature={} | ks={} | pValue={} | psi={}",
                         modelName, r.getFeatureName(), round(r.getKsStatistic()), round(r.getKsPValue()), round(r.getPsi())));
        } else {
            log.info("Drift check passed | model={} | features={}", modelName, reports.size());
        }

        return DriftCheckResult.builder()
            .modelName(modelName)
            .reports(List.copyOf(reports))
            .driftDetected(drift)
            .checkedAt(now)
            .build();
    }

    public DriftReport detectFeature(String modelName, String feature, double[] reference, double[] recent) {
        return detectFeature(modelName, feature, reference, recent, Instant.now());
    }

    private DriftReport detectFeature(String modelName, String feature, double[] reference, double[] recent,
                                      Instant now) {
        if (reference == null || reference.length == 0) {
            throw new InsufficientDataException(
                "Reference sample of feature '" + feature + "' for '" + modelName + "' is empty.");
        }
        if (recent == null || recent.length < minSamples) {
            throw new InsufficientDataException(
                "Feature '" + feature + "' of '" + modelName + "' has " + (recent == null ? 0 : recent.length)
                    + " recent observations; at least " + minSamples + " are required.");
        }

        double[] ref = sorted(reference);
        double[] cur = sorted(recent);
        double d = ksStatistic(ref, cur);
        double pValue = ksPValue(d, ref.length, cur.length);
        double psi = psi(ref, cur);

        return DriftReport.builder()
            .modelName(modelName)
            .featureName(feature)
            .ksStatistic(d)
            .ksPValue(pValue)
            .psi(psi)
            .significanceLevel(significance)
            .psiThreshold(psiThreshold)
            .exceeded(pValue < significance || psi > psiThreshold)
            .referenceSize(ref.length)
            .recentSize(cur.length)
            .timestamp(now)
            .build();
    }

    // ---------------------------------------------------------------
    // Statistics (inputs are sorted ascending)
    // ---------------------------------------------------------------

    /** Largest vertical distance between the two empirical CDFs. */
    static double ksStatistic(double[] a, double[] b) {
        int i = 0;
        int j = 0;
        double max = 0.0;
        while (i < a.length && j < b.length) {
            double x = Math.min(a[i], b[j]);
            while (i < a.length && a[i] <= x) {
                i++;
            }
            while (j < b.length && b[j] <= x) {
                j++;
            }
            double gap = Math.abs((double) i / a.length - (double) j / b.length);
            if (gap > max) {
                max = gap;
            }
        }
        return max;
    }

    /**
     * Asymptotic two-sided p-value from the Kolmogorov distribution, with Stephens'
     * correction for the effective sample size.
     */
    static double ksPValue(double d, int n, int m) {
        double effective = (double) n * m / (n + m);
        double sqrtN = Math.sqrt(effective);
        double lambda = (sqrtN + 0.12 + 0.11 / sqrtN) * d;
        if (lambda < 0.27) {
            return 1.0;
        }
        double sum = 0.0;
        for (int k = 1; k <= 100; k++) {
            double term = Math.exp(-2.0 * k * k * lambda * lambda);
            sum += (k % 2 == 1 ? term : -term);
            if (term < 1e-12) {
                break;
            }
        }
        return Math.max(0.0, Math.min(1.0, 2.0 * sum));
    }

    /** PSI over bins cut at the reference deciles. */
    static double psi(double[] reference, double[] recent) {
        double[] edges = new double[PSI_BINS - 1];
        for (int q = 1; q < PSI_BINS; q++) {
            edges[q - 1] = quantile(reference, (double) q / PSI_BINS);
        }
        double[] expected = proportions(reference, edges);
        double[] actual = proportions(recent, edges);
        double psi = 0.0;
        for (int k = 0; k < PSI_BINS; k++) {
            psi += (actual[k] - expected[k]) * Math.log(actual[k] / expected[k]);
        }
        return psi;
    }

    private static double[] proportions(double[] values, double[] edges) {
        double[] counts = new double[edges.length + 1];
        for (double v : values) {
            counts[bin(v, edges)]++;
        }
        for (int k = 0; k < counts.length; k++) {
            counts[k] = Math.max(counts[k] / values.length, PSI_FLOOR);
        }
        return counts;
    }

    private static int bin(double value, double[] edges) {
        int idx = Arrays.binarySearch(edges, value);
        if (idx >= 0) {
            // equal to an edge: first bin whose upper edge is that value
            while (idx > 0 && edges[idx - 1] == value) {
                idx--;
            }
            return idx;
        }
        return -idx - 1;
    }

    /** Linear interpolation between closest ranks. */
    private static double quantile(double[] sorted, double p) {
        double pos = p * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = Math.min(lower + 1, sorted.length - 1);
        return sorted[lower] + (pos - lower) * (sorted[upper] - sorted[lower]);
    }

    private static double[] sorted(double[] values) {
        double[] copy = values.clone();
        Arrays.sort(copy);
        return copy;
    }

    private static double round(double value) {
        return Math.round(value * 10_000d) / 10_000d;
    }
}
