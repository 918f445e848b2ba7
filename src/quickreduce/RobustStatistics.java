/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Outlier tolerant summary statistics used throughout the reduction.
 * Percentiles interpolate linearly between order statistics (estimation type
 * R-7), so the median of an even number of values is the mean of the two
 * middle values.
 */
public final class RobustStatistics {

    /**
     * Tuning constant of the biweight location estimator, in units of the
     * median absolute deviation.
     */
    public static final double BIWEIGHT_TUNING = 6.0;

    private RobustStatistics() {
    }

    /**
     * Returns the median of the given values.
     *
     * @param values the values to summarise, must not be empty.
     * @return the median.
     */
    public static double median(double[] values) {
        checkNotEmpty(values);
        return new Median().withEstimationType(EstimationType.R_7).evaluate(values);
    }

    /**
     * Returns the median of every element of a two-dimensional array.
     *
     * @param values the array to summarise, must not be empty.
     * @return the median of all elements.
     */
    public static double median(double[][] values) {
        return median(flatten(values));
    }

    /**
     * Returns a percentile of the given values.
     *
     * @param values the values to summarise, must not be empty.
     * @param percentile the percentile wanted, in the range (0, 100].
     * @return the requested percentile.
     */
    public static double percentile(double[] values, double percentile) {
        checkNotEmpty(values);
        return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, percentile);
    }

    /**
     * Computes the biweight location of the given values: a weighted mean that
     * starts from the median and gives zero weight to values further than
     * {@link #BIWEIGHT_TUNING} median absolute deviations away from it.
     * When the median absolute deviation is zero the median is returned.
     *
     * @param values the values to summarise, must not be empty.
     * @return the biweight location.
     */
    public static double biweightLocation(double[] values) {
        final double median = median(values);

        double[] deviations = new double[values.length];
        for (int index = 0; index < values.length; ++index) {
            deviations[index] = Math.abs(values[index] - median);
        }
        final double mad = median(deviations);
        if (mad == 0.0) {
            return median;
        }

        double numerator = 0.0;
        double denominator = 0.0;
        for (int index = 0; index < values.length; ++index) {
            double difference = values[index] - median;
            double u = difference / (BIWEIGHT_TUNING * mad);
            if (Math.abs(u) < 1.0) {
                double weight = (1.0 - u * u) * (1.0 - u * u);
                numerator += difference * weight;
                denominator += weight;
            }
        }

        return median + numerator / denominator;
    }

    /**
     * Copies a rectangular two-dimensional array into a one-dimensional array,
     * row by row.
     */
    static double[] flatten(double[][] values) {
        if ((values == null) || (values.length == 0)) {
            throw new IllegalArgumentException("Cannot flatten a null or empty array.");
        }
        int total = 0;
        for (double[] row : values) {
            total += row.length;
        }
        double[] flat = new double[total];
        int position = 0;
        for (double[] row : values) {
            System.arraycopy(row, 0, flat, position, row.length);
            position += row.length;
        }
        return flat;
    }

    private static void checkNotEmpty(double[] values) {
        if ((values == null) || (values.length == 0)) {
            throw new IllegalArgumentException("Cannot compute a statistic of a null or empty array.");
        }
    }
}
