/* (C)2026 */
package com.ammann.riskscore.config;

import com.ammann.riskscore.enumeration.PerformanceMetric;
import com.ammann.riskscore.exception.ValidationException;
import java.util.List;

/**
 * Grid and options of a validation run: every landmark day is evaluated at every horizon.
 */
public record ValidationSettings(
        List<Double> landmarkDays,
        List<Double> horizons,
        List<PerformanceMetric> metrics,
        int thresholdIterations,
        boolean deriveCutPoints,
        int calibrationBins,
        BootstrapSettings bootstrap) {

    public ValidationSettings {
        landmarkDays = List.copyOf(landmarkDays);
        horizons = List.copyOf(horizons);
        metrics = List.copyOf(metrics);
        if (landmarkDays.isEmpty()) {
            throw ValidationException.invalidParameter("validation.landmark-days", landmarkDays, "at least one day");
        }
        for (double day : landmarkDays) {
            if (!(day >= 0.0) || Double.isInfinite(day)) {
                throw ValidationException.invalidParameter("validation.landmark-days", day, "finite values >= 0");
            }
        }
        if (horizons.isEmpty()) {
            throw ValidationException.invalidParameter("validation.horizons", horizons, "at least one horizon");
        }
        for (double horizon : horizons) {
            if (!(horizon > 0.0)) {
                throw ValidationException.invalidParameter("validation.horizons", horizon, "values > 0");
            }
        }
        if (thresholdIterations < 1) {
            throw ValidationException.invalidParameter("validation.threshold.bootstrap-iterations",
                    thresholdIterations, "a value >= 1");
        }
        if (calibrationBins < 1) {
            throw ValidationException.invalidParameter("validation.calibration.bins", calibrationBins, "a value >= 1");
        }
    }

    public static ValidationSettings defaults() {
        return new ValidationSettings(List.of(3.0, 5.0, 7.0), List.of(30.0, 60.0, 90.0),
                List.of(PerformanceMetric.AUC, PerformanceMetric.C_INDEX, PerformanceMetric.BRIER),
                BootstrapSettings.DEFAULT_ITERATIONS, true, 10, BootstrapSettings.defaults());
    }
}
