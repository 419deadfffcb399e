/* (C)2026 */
package com.ammann.riskscore.service;

import com.ammann.riskscore.config.BootstrapSettings;
import com.ammann.riskscore.dto.BootstrapReportDTO;
import com.ammann.riskscore.dto.ConfidenceIntervalDTO;
import com.ammann.riskscore.enumeration.PerformanceMetric;
import com.ammann.riskscore.enumeration.SkipReason;
import com.ammann.riskscore.exception.InsufficientDataException;
import com.ammann.riskscore.exception.MissingCovariateException;
import com.ammann.riskscore.exception.RiskScoreException;
import com.ammann.riskscore.exception.UnstableBootstrapException;
import com.ammann.riskscore.model.Cohort;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.SplittableRandom;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.jboss.logging.Logger;

/**
 * Bootstrap internal validation with optimism correction.
 *
 * <p>For each of B iterations a resample of the original cohort's size is drawn with
 * replacement, the model is re-derived on it, and its performance is measured on the resample
 * (apparent) and on the original cohort (test). The mean of {@code apparent - test} is the
 * optimism; the bias-corrected estimate is the original model's performance on the original
 * cohort minus that optimism. The confidence interval is the percentile interval of the test
 * performances.
 *
 * <p>Iterations run on the {@code bootstrap-executor} pool. Every worker owns its accumulator
 * and the accumulators are merged after all workers finished, so no locking is involved. The
 * only shared state is the skip counter and the stop flag: once skipped iterations exceed the
 * tolerance the remaining iterations are abandoned and the run fails.
 *
 * <p>Each iteration draws from its own {@link SplittableRandom} seeded from a stream derived
 * from the configured seed, so results do not depend on the number of workers.
 */
@ApplicationScoped
public class BootstrapValidator {

    private static final Logger LOG = Logger.getLogger(BootstrapValidator.class);

    /**
     * Derives a model, for example score cut points and category risks, from a cohort.
     */
    @FunctionalInterface
    public interface ModelDeriver<M> {
        M derive(Cohort cohort);
    }

    /**
     * Measures the performance of a derived model on a cohort. Empty when the metric is not
     * evaluable on that cohort.
     */
    @FunctionalInterface
    public interface PerformanceEvaluator<M> {
        OptionalDouble evaluate(M model, Cohort cohort);
    }

    private final ExecutorService executor;
    private final MeterRegistry meterRegistry;

    @Inject
    public BootstrapValidator(@Named("bootstrap-executor") ExecutorService executor, MeterRegistry meterRegistry) {
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        if (meterRegistry == null) {
            LOG.warn("MeterRegistry not available - bootstrap metrics disabled");
        }
    }

    /**
     * Runs the bootstrap validation of one metric.
     *
     * @param metric    metric being validated, used for reporting
     * @param original  original cohort; never modified
     * @param deriver   model derivation repeated on every resample
     * @param evaluator performance measure
     * @param settings  iterations, seed, tolerance, confidence level and parallelism
     * @throws InsufficientDataException  if the model cannot be derived or evaluated on the original cohort
     * @throws UnstableBootstrapException if the skip rate exceeds the tolerance or no iteration completed
     */
    public <M> BootstrapReportDTO validate(PerformanceMetric metric,
                                           Cohort original,
                                           ModelDeriver<M> deriver,
                                           PerformanceEvaluator<M> evaluator,
                                           BootstrapSettings settings) {
        long start = System.nanoTime();

        M originalModel = deriver.derive(original);
        OptionalDouble originalPerformance = evaluator.evaluate(originalModel, original);
        if (originalPerformance.isEmpty()) {
            throw new InsufficientDataException(
                    metric + " is not evaluable on the original cohort of " + original.size() + " subjects", 0, 0);
        }

        int iterations = settings.iterations();
        int maxSkips = settings.maxSkips();
        SplittableRandom seedStream = new SplittableRandom(settings.seed());
        long[] seeds = new long[iterations];
        for (int b = 0; b < iterations; b++) {
            seeds[b] = seedStream.nextLong();
        }

        AtomicBoolean stop = new AtomicBoolean(false);
        AtomicInteger skipped = new AtomicInteger();
        int workers = Math.min(settings.parallelism(), iterations);

        LOG.debugf("Bootstrap %s: %d iterations on %d workers (seed %d, tolerance %.3f)",
                metric, iterations, workers, settings.seed(), settings.skipTolerance());

        List<Future<Accumulator>> futures = new ArrayList<>(workers);
        for (int w = 0; w < workers; w++) {
            int first = w;
            futures.add(executor.submit(() -> runWorker(metric, original, deriver, evaluator, seeds,
                    first, workers, maxSkips, stop, skipped)));
        }

        Accumulator total = new Accumulator();
        try {
            for (Future<Accumulator> future : futures) {
                total.merge(future.get());
            }
        } catch (InterruptedException e) {
            stop.set(true);
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new RiskScoreException("Bootstrap validation of " + metric + " was interrupted", e);
        } catch (ExecutionException e) {
            stop.set(true);
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new RiskScoreException("Bootstrap worker failed for " + metric, e.getCause());
        }

        int completed = total.completed();
        int skippedCount = total.skippedCount();
        int attempted = completed + skippedCount;
        Map<String, Long> reasons = total.reasonsByName();

        recordCounts(metric, completed, skippedCount);

        if (stop.get() || skippedCount > maxSkips || completed == 0) {
            LOG.warnf("Bootstrap %s unstable: %d of %d attempted iterations skipped, reasons %s",
                    metric, skippedCount, attempted, reasons);
            recordDuration(metric, start);
            throw new UnstableBootstrapException(metric.name(), iterations, attempted, skippedCount,
                    settings.skipTolerance(), reasons);
        }

        double originalValue = originalPerformance.getAsDouble();
        double meanApparent = total.meanApparent();
        double meanTest = total.meanTest();
        double optimism = total.meanOptimism();
        double biasCorrected = originalValue - optimism;
        ConfidenceIntervalDTO interval = Percentiles.interval(total.testValues(), settings.confidenceLevel());
        double skipRate = (double) skippedCount / attempted;

        recordDuration(metric, start);
        LOG.infof("Bootstrap %s: original %.4f, optimism %.4f, corrected %.4f, %.0f%% CI [%.4f, %.4f] "
                        + "(%d completed, %d skipped)",
                metric, originalValue, optimism, biasCorrected, settings.confidenceLevel() * 100,
                interval.lower(), interval.upper(), completed, skippedCount);

        return new BootstrapReportDTO(metric, iterations, completed, skippedCount, skipRate, reasons,
                originalValue, meanApparent, meanTest, optimism, biasCorrected, interval, settings.seed());
    }

    private <M> Accumulator runWorker(PerformanceMetric metric,
                                      Cohort original,
                                      ModelDeriver<M> deriver,
                                      PerformanceEvaluator<M> evaluator,
                                      long[] seeds,
                                      int first,
                                      int stride,
                                      int maxSkips,
                                      AtomicBoolean stop,
                                      AtomicInteger skipped) {
        Accumulator accumulator = new Accumulator();
        for (int b = first; b < seeds.length; b += stride) {
            if (stop.get() || Thread.currentThread().isInterrupted()) {
                break;
            }

            SkipReason reason = null;
            try {
                Cohort sample = original.resample(new SplittableRandom(seeds[b]));
                M model = deriver.derive(sample);
                OptionalDouble apparent = evaluator.evaluate(model, sample);
                OptionalDouble test = evaluator.evaluate(model, original);
                if (apparent.isPresent() && test.isPresent()) {
                    accumulator.add(apparent.getAsDouble(), test.getAsDouble());
                } else {
                    reason = SkipReason.NON_EVALUABLE;
                }
            } catch (InsufficientDataException e) {
                reason = SkipReason.INSUFFICIENT_DATA;
            } catch (MissingCovariateException e) {
                reason = SkipReason.MISSING_COVARIATE;
            }

            if (reason != null) {
                accumulator.skip(reason);
                LOG.debugf("Bootstrap %s iteration %d skipped: %s", metric, b, reason);
                if (skipped.incrementAndGet() > maxSkips) {
                    stop.set(true);
                }
            }
        }
        return accumulator;
    }

    private void recordCounts(PerformanceMetric metric, int completed, int skippedCount) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("bootstrap_iterations_completed_total")
                .description("Bootstrap iterations that produced apparent and test performance")
                .tag("metric", metric.name())
                .register(meterRegistry)
                .increment(completed);
        Counter.builder("bootstrap_iterations_skipped_total")
                .description("Bootstrap iterations excluded from aggregation")
                .tag("metric", metric.name())
                .register(meterRegistry)
                .increment(skippedCount);
    }

    private void recordDuration(PerformanceMetric metric, long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        Timer.builder("bootstrap_validation_duration")
                .description("Wall time of one bootstrap validation")
                .tag("metric", metric.name())
                .register(meterRegistry)
                .record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    /**
     * Running sums of one worker. Only touched by its own worker until merged.
     */
    private static final class Accumulator {

        private final List<Double> apparent = new ArrayList<>();
        private final List<Double> test = new ArrayList<>();
        private final Map<SkipReason, Long> skips = new EnumMap<>(SkipReason.class);
        private double apparentSum;
        private double testSum;
        private double optimismSum;

        void add(double apparentValue, double testValue) {
            apparent.add(apparentValue);
            test.add(testValue);
            apparentSum += apparentValue;
            testSum += testValue;
            optimismSum += apparentValue - testValue;
        }

        void skip(SkipReason reason) {
            skips.merge(reason, 1L, Long::sum);
        }

        void merge(Accumulator other) {
            apparent.addAll(other.apparent);
            test.addAll(other.test);
            apparentSum += other.apparentSum;
            testSum += other.testSum;
            optimismSum += other.optimismSum;
            other.skips.forEach((reason, count) -> skips.merge(reason, count, Long::sum));
        }

        int completed() {
            return test.size();
        }

        int skippedCount() {
            return (int) skips.values().stream().mapToLong(Long::longValue).sum();
        }

        double meanApparent() {
            return apparentSum / completed();
        }

        double meanTest() {
            return testSum / completed();
        }

        double meanOptimism() {
            return optimismSum / completed();
        }

        double[] testValues() {
            return Percentiles.toArray(test);
        }

        Map<String, Long> reasonsByName() {
            Map<String, Long> byName = new LinkedHashMap<>();
            skips.forEach((reason, count) -> byName.put(reason.name(), count));
            return byName;
        }
    }
}
