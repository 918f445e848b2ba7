/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

/**
 * Turns the dithered science spectra into one intensity per sample.
 *
 * <p>The flat-fielding during extraction divides out the fiber throughput, so
 * the science spectra are first multiplied by the average twilight spectrum of
 * the whole run. Each spectrum is then collapsed to the median flux inside a
 * color channel. Finally the background level of each group of
 * {@link #CHUNK_SIZE} consecutive samples (one amplifier of one exposure) is
 * matched to the run's typical background.</p>
 */
public class FluxNormalizer {

    /**
     * The number of fibers read out by one amplifier.
     */
    public static final int CHUNK_SIZE = 112;

    /**
     * Percentile of a chunk's intensities taken as its background.
     */
    public static final double BACKGROUND_PERCENTILE = 20.0;

    private final WavelengthGrid grid;

    public FluxNormalizer(WavelengthGrid grid) {
        if (grid == null) {
            throw new IllegalArgumentException("Cannot normalize spectra without a wavelength grid.");
        }
        this.grid = grid;
    }

    /**
     * Runs every normalization step on a table.
     *
     * @param table the dithered samples.
     * @param channel the color channel to collapse the spectra over.
     * @return the background flattened intensity of each row of the table.
     */
    public double[] normalize(DitherTable table, ColorChannel channel) {
        if (table.getRowCount() == 0) {
            throw new IllegalArgumentException("Cannot normalize an empty table of samples.");
        }
        double[] average = averageTwilight(table.getTwilightSpectra());
        double[][] science = applyTwilight(table.getScienceSpectra(), average);
        return flattenBackground(channelIntensities(science, channel));
    }

    /**
     * Computes the median twilight spectrum, wavelength bin by wavelength bin.
     *
     * @param twilight the twilight spectra, one row per sample.
     * @return the average twilight spectrum.
     */
    public double[] averageTwilight(double[][] twilight) {
        if ((twilight == null) || (twilight.length == 0)) {
            throw new IllegalArgumentException("Cannot average an empty set of twilight spectra.");
        }
        final int bins = twilight[0].length;
        double[] average = new double[bins];
        double[] column = new double[twilight.length];
        for (int bin = 0; bin < bins; ++bin) {
            for (int row = 0; row < twilight.length; ++row) {
                column[row] = twilight[row][bin];
            }
            average[bin] = RobustStatistics.median(column);
        }
        return average;
    }

    /**
     * Multiplies every science spectrum by the average twilight spectrum.
     *
     * @return new spectra, the input is not modified.
     */
    public double[][] applyTwilight(double[][] science, double[] averageTwilight) {
        double[][] result = new double[science.length][];
        for (int row = 0; row < science.length; ++row) {
            if (science[row].length != averageTwilight.length) {
                throw new IllegalArgumentException("Cannot apply a twilight spectrum of " + averageTwilight.length
                        + " bins to a science spectrum of " + science[row].length + " bins.");
            }
            result[row] = new double[science[row].length];
            for (int bin = 0; bin < science[row].length; ++bin) {
                result[row][bin] = science[row][bin] * averageTwilight[bin];
            }
        }
        return result;
    }

    /**
     * Collapses each spectrum to the median flux inside a color channel.
     *
     * @param spectra spectra on this normalizer's wavelength grid.
     * @param channel the color channel.
     * @return one intensity per spectrum.
     */
    public double[] channelIntensities(double[][] spectra, ColorChannel channel) {
        final int start = channel.getStartIndex(grid);
        final int end = channel.getEndIndex(grid);
        if (end <= start) {
            throw new IllegalArgumentException("The " + channel + " channel does not overlap the wavelength grid.");
        }

        double[] intensities = new double[spectra.length];
        double[] band = new double[end - start];
        for (int row = 0; row < spectra.length; ++row) {
            if (spectra[row].length != grid.size()) {
                throw new IllegalArgumentException("Spectrum " + row + " has " + spectra[row].length
                        + " bins when " + grid.size() + " were expected.");
            }
            System.arraycopy(spectra[row], start, band, 0, band.length);
            intensities[row] = RobustStatistics.median(band);
        }
        return intensities;
    }

    /**
     * Matches the background of each chunk of consecutive intensities to the
     * median background of all chunks. The intensities are split into
     * max(1, n / CHUNK_SIZE) chunks whose lengths differ by at most one (the
     * first n % chunks chunks are one longer); the background of a chunk is its
     * 20th percentile. A chunk whose background is zero or not finite is left
     * as it is.
     *
     * @param intensities the intensities in row order.
     * @return the flattened intensities.
     */
    public double[] flattenBackground(double[] intensities) {
        if ((intensities == null) || (intensities.length == 0)) {
            throw new IllegalArgumentException("Cannot flatten the background of an empty set of intensities.");
        }

        int[] bounds = chunkBounds(intensities.length, CHUNK_SIZE);
        final int chunks = bounds.length - 1;
        double[] backgrounds = new double[chunks];
        for (int chunk = 0; chunk < chunks; ++chunk) {
            double[] values = new double[bounds[chunk + 1] - bounds[chunk]];
            System.arraycopy(intensities, bounds[chunk], values, 0, values.length);
            backgrounds[chunk] = RobustStatistics.percentile(values, BACKGROUND_PERCENTILE);
        }
        final double level = RobustStatistics.median(backgrounds);

        double[] flattened = intensities.clone();
        for (int chunk = 0; chunk < chunks; ++chunk) {
            double background = backgrounds[chunk];
            if ((background == 0.0) || Double.isNaN(background) || Double.isInfinite(background)) {
                System.err.println("Leaving rows " + bounds[chunk] + " to " + (bounds[chunk + 1] - 1)
                        + " unscaled as their background is " + background + ".");
                continue;
            }
            for (int row = bounds[chunk]; row < bounds[chunk + 1]; ++row) {
                flattened[row] = level * intensities[row] / background;
            }
        }
        return flattened;
    }

    /**
     * Splits count rows into max(1, count / chunkSize) contiguous chunks whose
     * lengths differ by at most one, longer chunks first.
     *
     * @return the chunk boundaries: chunk i covers rows bounds[i] to bounds[i+1]-1.
     */
    static int[] chunkBounds(int count, int chunkSize) {
        final int chunks = Math.max(1, count / chunkSize);
        final int base = count / chunks;
        final int extra = count % chunks;

        int[] bounds = new int[chunks + 1];
        for (int chunk = 0; chunk < chunks; ++chunk) {
            bounds[chunk + 1] = bounds[chunk] + base + (chunk < extra ? 1 : 0);
        }
        return bounds;
    }
}
