/* (C)2026 */
package com.ammann.riskscore.service;

import com.ammann.riskscore.dto.ConfidenceIntervalDTO;
import java.util.Collection;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Percentile helpers shared by the bootstrap procedures. Uses linear interpolation between
 * order statistics (Hyndman-Fan type 7).
 */
final class Percentiles
{
    private Percentiles() {}

    static double percentile(double[] values, double p)
    {
        if (values.length == 0) {
            throw new IllegalArgumentException("Percentile of an empty sample is undefined");
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, p);
    }

    static double median(double[] values)
    {
        return percentile(values, 50.0);
    }

    /**
     * Equal-tailed percentile interval, e.g. 2.5th/97.5th for {@code level = 0.95}.
     */
    static ConfidenceIntervalDTO interval(double[] values, double level)
    {
        double tail = (1.0 - level) / 2.0 * 100.0;
        return new ConfidenceIntervalDTO(percentile(values, tail), percentile(values, 100.0 - tail), level);
    }

    static double[] toArray(Collection<Double> values)
    {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
