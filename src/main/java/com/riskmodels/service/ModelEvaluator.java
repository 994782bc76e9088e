package com.riskmodels.service;

import com.riskmodels.client.EvalDataset;
import com.riskmodels.client.ModelScorer;
import com.riskmodels.dto.MetricComparison;
import com.riskmodels.dto.ModelVersionResponse;
import com.riskmodels.exception.InvalidMetricException;
import com.riskmodels.exception.NoBaselineException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Held-out evaluation of binary risk classifiers and the candidate-vs-production comparison
 * that drives promotion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelEvaluator {

    public static final String ACCURACY = "accuracy";
    public static final String PRECISION = "precision";
    public static final String RECALL = "recall";
    public static final String F1 = "f1";
    public static final String ROC_AUC = "roc_auc";
    public static final String PR_AUC = "pr_auc";

    static final double DECISION_THRESHOLD = 0.5;

    private final ModelScorer scorer;

    @Value("${lifecycle.promotion.primary-metric:" + ROC_AUC + "}")
    private String primaryMetric = ROC_AUC;

    public Map<String, Double> evaluate(ModelVersionResponse version, EvalDataset dataset) {
        if (dataset.size() == 0) {
            throw new IllegalArgumentException("Held-out set for '" + version.getModelName() + "' is empty");
        }
        List<Double> scores = scorer.score(version, dataset);
        if (scores.size() != dataset.size()) {
            throw new IllegalStateException(
                "Scorer returned " + scores.size() + " scores for " + dataset.size() + " rows");
        }
        Map<String, Double> metrics = computeMetrics(
            dataset.labels().stream().mapToInt(Integer::intValue).toArray(),
            scores.stream().mapToDouble(Double::doubleValue).toArray());
        log.info("Model evaluated | model={} | version={} | dataset={} | rows={} | {}={}",
                 version.getModelName(), version.getVersionId(), dataset.datasetRef(), dataset.size(),
                 primaryMetric, metrics.get(primaryMetric));
        return metrics;
    }

    /**
     * Relative improvement of the candidate over production on the primary metric.
     *
     * @throws NoBaselineException when production has no usable value for the metric
     * @throws InvalidMetricException when the candidate lacks the metric
     */
    public MetricComparison compare(Map<String, Double> candidate, Map<String, Double> production, String candidateVersionId) {
        Double candidateValue = candidate != null ? candidate.get(primaryMetric) : null;
        if (candidateValue == null || candidateValue.isNaN()) {
            throw new InvalidMetricException(primaryMetric, candidateVersionId);
        }
        Double productionValue = production != null ? production.get(primaryMetric) : null;
        if (productionValue == null || productionValue.isNaN() || productionValue <= 0.0) {
            throw new NoBaselineException("Production has no usable '" + primaryMetric + "' baseline.");
        }
        double improvement = (candidateValue - productionValue) / productionValue * 100.0;
        return MetricComparison.builder()
            .metric(primaryMetric)
            .candidateValue(candidateValue)
            .productionValue(productionValue)
            .improvementPct(improvement)
            .build();
    }

    static Map<String, Double> computeMetrics(int[] labels, double[] scores) {
        long tp = 0;
        long fp = 0;
        long tn = 0;
        long fn = 0;
        for (int i = 0; i < labels.length; i++) {
            boolean predicted = scores[i] >= DECISION_THRESHOLD;
            boolean actual = labels[i] == 1;
            if (predicted && actual) tp++;
            else if (predicted) fp++;
            else if (actual) fn++;
            else tn++;
        }
        double precision = tp + fp == 0 ? 0.0 : (double) tp / (tp + fp);
        double recall = tp + fn == 0 ? 0.0 : (double) tp / (tp + fn);
        double f1 = precision + recall == 0 ? 0.0 : 2 * precision * recall / (precision + recall);

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put(ACCURACY, (double) (tp + tn) / labels.length);
        metrics.put(PRECISION, precision);
        metrics.put(RECALL, recall);
        metrics.put(F1, f1);
        metrics.put(ROC_AUC, rocAuc(labels, scores));
        metrics.put(PR_AUC, averagePrecision(labels, scores));
        return metrics;
    }

    /** Mann-Whitney rank statistic; tied scores share their average rank. */
    static double rocAuc(int[] labels, double[] scores) {
        int n = labels.length;
        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> scores[i]));

        double[] ranks = new double[n];
        int i = 0;
        while (i < n) {
            int j = i;
            while (j + 1 < n && scores[order[j + 1]] == scores[order[i]]) {
                j++;
            }
            double avg = (i + j) / 2.0 + 1.0;
            for (int k = i; k <= j; k++) {
                ranks[order[k]] = avg;
            }
            i = j + 1;
        }

        long positives = Arrays.stream(labels).filter(l -> l == 1).count();
        long negatives = n - positives;
        if (positives == 0 || negatives == 0) {
            return 0.5;
        }
        double positiveRankSum = 0.0;
        for (int k = 0; k < n; k++) {
            if (labels[k] == 1) {
                positiveRankSum += ranks[k];
            }
        }
        return (positiveRankSum - positives * (positives + 1) / 2.0) / ((double) positives * negatives);
    }

    /** Average precision over distinct score thresholds, highest first. */
    static double averagePrecision(int[] labels, double[] scores) {
        int n = labels.length;
        long positives = Arrays.stream(labels).filter(l -> l == 1).count();
        if (positives == 0) {
            return 0.0;
        }
        Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> scores[i]).reversed());

        double ap = 0.0;
        double previousRecall = 0.0;
        long tp = 0;
        long seen = 0;
        int i = 0;
        while (i < n) {
            double threshold = scores[order[i]];
            while (i < n && scores[order[i]] == threshold) {
                if (labels[order[i]] == 1) {
                    tp++;
                }
                seen++;
                i++;
            }
            double recall = (double) tp / positives;
            double precision = (double) tp / seen;
            ap += (recall - previousRecall) * precision;
            previousRecall = recall;
        }
        return ap;
    }
}
