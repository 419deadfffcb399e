/* (C)2026 */
package com.ammann.riskscore.service;

import com.ammann.riskscore.dto.ConfidenceIntervalDTO;
import com.ammann.riskscore.dto.ThresholdDTO;
import com.ammann.riskscore.enumeration.Direction;
import com.ammann.riskscore.enumeration.OutcomeClass;
import com.ammann.riskscore.exception.InsufficientDataException;
import com.ammann.riskscore.exception.ValidationException;
import com.ammann.riskscore.model.Cohort;
import com.ammann.riskscore.model.Subject;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;
import java.util.SplittableRandom;
import org.jboss.logging.Logger;

/**
 * Youden-index cut point search for continuous predictors.
 *
 * <p>Every distinct observed value is a candidate cut {@code c}. For direction
 * {@link Direction#GREATER} a subject is positive when {@code value > c}, for
 * {@link Direction#LESS} when {@code value < c}. The candidate maximizing
 * {@code sensitivity + specificity - 1} wins; ties go to the candidate closest to the
 * median of the variable, then to the smaller value, so results are reproducible.
 *
 * <p>Candidates are evaluated in a single sweep over the sorted values, O(n log n).
 */
@ApplicationScoped
public class ThresholdOptimizer
{

    private static final Logger LOG = Logger.getLogger(ThresholdOptimizer.class);

    static final int DEFAULT_BOOTSTRAP_ITERATIONS = 1000;
    static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;

    private static final double YOUDEN_TOLERANCE = 1e-12;

    /**
     * Finds the Youden-optimal cut point.
     *
     * @param variable  name reported in the result
     * @param values    observed values
     * @param outcomes  outcome label per value ({@code true} = case)
     * @param direction which side of the cut counts as positive
     * @return optimal threshold without confidence interval
     * @throws InsufficientDataException if either outcome class is empty
     * @throws ValidationException       if a value is NaN or infinite
     */
    public ThresholdDTO findOptimalThreshold(String variable, double[] values, boolean[] outcomes, Direction direction)
    {
        if (values.length != outcomes.length) {
            throw new IllegalArgumentException(String.format(
                    "Got %d values but %d outcome labels for %s", values.length, outcomes.length, variable));
        }
        for (double value : values) {
            if (!Double.isFinite(value)) {
                throw ValidationException.invalidParameter(variable, value, "finite values only");
            }
        }

        int cases = 0;
        for (boolean outcome : outcomes) {
            if (outcome) cases++;
        }
        int controls = outcomes.length - cases;
        if (cases == 0 || controls == 0) {
            throw InsufficientDataException.emptyOutcomeClass("Youden threshold search for " + variable, cases, controls);
        }

        Integer[] order = new Integer[values.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> Double.compare(values[a], values[b]));

        double median = Percentiles.median(values);

        // Cumulative counts of cases and controls with value <= current candidate
        int casesUpTo = 0;
        int controlsUpTo = 0;

        double bestCut = Double.NaN;
        double bestYouden = Double.NEGATIVE_INFINITY;
        double bestSensitivity = 0.0;
        double bestSpecificity = 0.0;

        int i = 0;
        while (i < order.length) {
            double candidate = values[order[i]];
            int casesBelow = casesUpTo;
            int controlsBelow = controlsUpTo;

            while (i < order.length && values[order[i]] == candidate) {
                if (outcomes[order[i]]) casesUpTo++; else controlsUpTo++;
                i++;
            }

            double sensitivity;
            double specificity;
            if (direction == Direction.GREATER) {
                sensitivity = (double) (cases - casesUpTo) / cases;
                specificity = (double) controlsUpTo / controls;
            } else {
                sensitivity = (double) casesBelow / cases;
                specificity = (double) (controls - controlsBelow) / controls;
            }
            double youden = sensitivity + specificity - 1.0;

            if (isBetter(youden, candidate, bestYouden, bestCut, median)) {
                bestYouden = youden;
                bestCut = candidate;
                bestSensitivity = sensitivity;
                bestSpecificity = specificity;
            }
        }

        LOG.debugf("Optimal threshold for %s: %s %.3f (sens=%.3f, spec=%.3f, J=%.3f, %d cases, %d controls)",
                variable, direction.getSymbol(), bestCut, bestSensitivity, bestSpecificity, bestYouden, cases, controls);

        return new ThresholdDTO(variable, bestCut, direction, bestSensitivity, bestSpecificity,
                bestYouden, cases, controls, null, null);
    }

    /**
     * Finds the optimal cut point of a covariate for the outcome "event within horizon".
     * Subjects without a value for the variable, and subjects censored before the horizon
     * without an event, are left out.
     */
    public ThresholdDTO findOptimalThreshold(Cohort cohort, String variable, double horizon, Direction direction)
    {
        Labelled labelled = label(cohort, variable, horizon);
        return findOptimalThreshold(variable, labelled.values(), labelled.outcomes(), direction);
    }

    /**
     * Optimal cut point with a bootstrap percentile interval capturing cut point instability.
     *
     * <p>The cohort is resampled with replacement {@code iterations} times and the optimal cut
     * is recomputed on each resample; resamples with an empty outcome class are skipped.
     * The interval is absent when no resample was usable.
     *
     * @throws InsufficientDataException if the full sample has an empty outcome class
     */
    public ThresholdDTO findOptimalThresholdWithConfidence(String variable,
                                                           double[] values,
                                                           boolean[] outcomes,
                                                           Direction direction,
                                                           int iterations,
                                                           long seed,
                                                           double confidenceLevel)
    {
        if (iterations < 1) {
            throw new IllegalArgumentException("Bootstrap iterations must be positive, got " + iterations);
        }
        ThresholdDTO point = findOptimalThreshold(variable, values, outcomes, direction);

        SplittableRandom random = new SplittableRandom(seed);
        int n = values.length;
        double[] sampleValues = new double[n];
        boolean[] sampleOutcomes = new boolean[n];
        List<Double> cuts = new ArrayList<>(iterations);
        int skipped = 0;

        for (int b = 0; b < iterations; b++) {
            for (int k = 0; k < n; k++) {
                int drawn = random.nextInt(n);
                sampleValues[k] = values[drawn];
                sampleOutcomes[k] = outcomes[drawn];
            }
            OptionalDouble cut = cutOrEmpty(variable, sampleValues, sampleOutcomes, direction);
            if (cut.isPresent()) {
                cuts.add(cut.getAsDouble());
            } else {
                skipped++;
            }
        }

        if (cuts.isEmpty()) {
            LOG.warnf("No usable bootstrap resample for threshold of %s (%d skipped)", variable, skipped);
            return point;
        }
        if (skipped > 0) {
            LOG.debugf("Threshold bootstrap for %s skipped %d of %d resamples", variable, skipped, iterations);
        }

        ConfidenceIntervalDTO interval = Percentiles.interval(Percentiles.toArray(cuts), confidenceLevel);
        LOG.debugf("Threshold %s %s %.3f, %.0f%% CI [%.3f, %.3f] from %d resamples",
                variable, direction.getSymbol(), point.cutPoint(), confidenceLevel * 100,
                interval.lower(), interval.upper(), cuts.size());
        return point.withConfidenceInterval(interval, cuts.size());
    }

    /**
     * Cohort variant of {@link #findOptimalThresholdWithConfidence(String, double[], boolean[], Direction, int, long, double)}.
     */
    public ThresholdDTO findOptimalThresholdWithConfidence(Cohort cohort,
                                                           String variable,
                                                           double horizon,
                                                           Direction direction,
                                                           int iterations,
                                                           long seed,
                                                           double confidenceLevel)
    {
        Labelled labelled = label(cohort, variable, horizon);
        return findOptimalThresholdWithConfidence(variable, labelled.values(), labelled.outcomes(),
                direction, iterations, seed, confidenceLevel);
    }

    /**
     * Direction in which the variable separates cases from controls: {@link Direction#GREATER}
     * when the case mean is at least the control mean.
     *
     * @throws InsufficientDataException if either outcome class is empty
     */
    public Direction detectDirection(double[] values, boolean[] outcomes)
    {
        double caseSum = 0.0;
        double controlSum = 0.0;
        int cases = 0;
        int controls = 0;
        for (int i = 0; i < values.length; i++) {
            if (outcomes[i]) {
                caseSum += values[i];
                cases++;
            } else {
                controlSum += values[i];
                controls++;
            }
        }
        if (cases == 0 || controls == 0) {
            throw InsufficientDataException.emptyOutcomeClass("Direction detection", cases, controls);
        }
        return caseSum / cases >= controlSum / controls ? Direction.GREATER : Direction.LESS;
    }

    private OptionalDouble cutOrEmpty(String variable, double[] values, boolean[] outcomes, Direction direction)
    {
        boolean anyCase = false;
        boolean anyControl = false;
        for (boolean outcome : outcomes) {
            if (outcome) anyCase = true; else anyControl = true;
        }
        if (!anyCase || !anyControl) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(findOptimalThreshold(variable, values, outcomes, direction).cutPoint());
    }

    private static boolean isBetter(double youden, double cut, double bestYouden, double bestCut, double median)
    {
        if (youden > bestYouden + YOUDEN_TOLERANCE) {
            return true;
        }
        if (youden < bestYouden - YOUDEN_TOLERANCE) {
            return false;
        }
        double distance = Math.abs(cut - median);
        double bestDistance = Math.abs(bestCut - median);
        if (distance != bestDistance) {
            return distance < bestDistance;
        }
        return cut < bestCut;
    }

    private static Labelled label(Cohort cohort, String variable, double horizon)
    {
        List<Subject> usable = new ArrayList<>(cohort.size());
        for (Subject subject : cohort.subjects()) {
            if (subject.has(variable) && OutcomeClass.at(subject, horizon).isEvaluable()) {
                usable.add(subject);
            }
        }
        double[] values = new double[usable.size()];
        boolean[] outcomes = new boolean[usable.size()];
        for (int i = 0; i < usable.size(); i++) {
            Subject subject = usable.get(i);
            values[i] = subject.value(variable).getAsDouble();
            outcomes[i] = OutcomeClass.at(subject, horizon) == OutcomeClass.CASE;
        }
        return new Labelled(values, outcomes);
    }

    private record Labelled(double[] values, boolean[] outcomes)
    {
    }
}
