package com.riskmodels.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding window of the most recent live feature values per model, used as the recent
 * sample for drift checks.
 */
@Slf4j
@Service
public class FeatureWindowService {

    public static final int DEFAULT_WINDOW_SIZE = 5000;

    @Value("${lifecycle.drift.window-size:" + DEFAULT_WINDOW_SIZE + "}")
    private int windowSize = DEFAULT_WINDOW_SIZE;

    private final ConcurrentHashMap<String, ConcurrentHashMap<String, Deque<Double>>> windows = new ConcurrentHashMap<>();

    public void observe(String modelName, Map<String, Double> features) {
        if (features == null || features.isEmpty()) {
            return;
        }
        Map<String, Deque<Double>> model = windows.computeIfAbsent(modelName, k -> new ConcurrentHashMap<>());
        features.forEach((feature, value) -> {
            if (value == null || value.isNaN() || value.isInfinite()) {
                return;
            }
            Deque<Double> window = model.computeIfAbsent(feature, k -> new ArrayDeque<>());
            synchronized (window) {
                window.addLast(value);
                while (window.size() > windowSize) {
                    window.removeFirst();
                }
            }
        });
    }

    /** Copy of the current window per feature; empty when nothing was observed. */
    public Map<String, double[]> snapshot(String modelName) {
        Map<String, Deque<Double>> model = windows.get(modelName);
        if (model == null) {
            return Map.of();
        }
        Map<String, double[]> copy = new LinkedHashMap<>();
        model.forEach((feature, window) -> {
            synchronized (window) {
                copy.put(feature, window.stream().mapToDouble(Double::doubleValue).toArray());
            }
        });
        return copy;
    }

    public Set<String> monitoredModels() {
        return Collections.unmodifiableSet(windows.keySet());
    }

    /** Drops the window, e.g. after a new version went live. */
    public void reset(String modelName) {
        if (windows.remove(modelName) != null) {
            log.info("Feature window reset | model={}", modelName);
        }
    }
}
