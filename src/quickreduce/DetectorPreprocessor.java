/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

import java.util.Optional;

/**
 * The DetectorPreprocessor turns a raw amplifier readout into a calibrated
 * flux frame. The steps are: overscan level subtraction, overscan trimming,
 * orientation (wavelength increasing left to right and fibers in the order of
 * the calibration records) and conversion from ADU to electrons.
 */
public class DetectorPreprocessor {

    /**
     * Gain (electrons per ADU) used when the header value is not positive.
     */
    public static final double DEFAULT_GAIN = 0.85;

    /**
     * Read noise (electrons) used when the header value is not positive.
     */
    public static final double DEFAULT_READ_NOISE = 3.0;

    /**
     * Width of the overscan strip for every full block of
     * {@link #COLUMNS_PER_OVERSCAN_BLOCK} columns.
     */
    public static final int OVERSCAN_BLOCK_WIDTH = 32;

    public static final int COLUMNS_PER_OVERSCAN_BLOCK = 1064;

    /**
     * Columns at the inner edge of the overscan strip that are left out of the
     * overscan level estimate.
     */
    static final int OVERSCAN_EDGE_COLUMNS = 2;

    /**
     * Amplifiers whose readout is rotated by 180 degrees.
     */
    static final String[] ROTATED_AMPLIFIERS = {"LU", "RL"};

    /**
     * AMPNAME values whose readout is additionally mirrored left to right.
     */
    static final String[] MIRRORED_AMP_NAMES = {"LR", "UL"};

    /**
     * Performs the full preprocessing of a raw exposure.
     *
     * @param frame the raw exposure.
     * @return the calibrated flux and uncertainty frames.
     */
    public ReducedFrame preprocess(RawFrame frame) {
        if (frame == null) {
            throw new IllegalArgumentException("Cannot preprocess a null frame.");
        }

        final int overscan = overscanWidth(frame.getColumns());

        double[][] image = copy(frame.getPixels());
        if (overscan > 0) {
            double level = overscanLevel(image, overscan);
            for (double[] row : image) {
                for (int column = 0; column < row.length; ++column) {
                    row[column] -= level;
                }
            }
            image = trimOverscan(image, overscan);
        }

        final double gain = effectiveGain(frame.getGain());
        final double readNoise = effectiveReadNoise(frame.getReadNoise());
        final String amplifier = frame.getAmplifier();

        double[][] flux = orient(image, amplifier, frame.getAmpName());
        double[][] error = new double[flux.length][flux[0].length];
        for (int row = 0; row < flux.length; ++row) {
            for (int column = 0; column < flux[row].length; ++column) {
                flux[row][column] *= gain;
                double counts = Math.max(flux[row][column], 0.0);
                error[row][column] = Math.sqrt(readNoise * readNoise + counts);
            }
        }

        return new ReducedFrame(flux, error, gain, readNoise, amplifier);
    }

    /**
     * Gets the width of the overscan strip at the right-hand side of a readout.
     *
     * @param columns the total number of columns in the raw readout.
     * @return the number of overscan columns (zero for readouts narrower than
     *         {@link #COLUMNS_PER_OVERSCAN_BLOCK}).
     */
    public static int overscanWidth(int columns) {
        return OVERSCAN_BLOCK_WIDTH * (columns / COLUMNS_PER_OVERSCAN_BLOCK);
    }

    /**
     * Estimates the overscan level as the biweight location of the outermost
     * overscanWidth - 2 columns of every row.
     *
     * @param image the raw readout.
     * @param overscanWidth the width of the overscan strip.
     * @return the overscan level in ADU.
     */
    public static double overscanLevel(double[][] image, int overscanWidth) {
        final int used = overscanWidth - OVERSCAN_EDGE_COLUMNS;
        if ((used <= 0) || (used > image[0].length)) {
            throw new IllegalArgumentException("Cannot estimate the overscan level from " + used
                    + " columns of a readout with " + image[0].length + " columns.");
        }

        final int firstColumn = image[0].length - used;
        double[] values = new double[image.length * used];
        int position = 0;
        for (double[] row : image) {
            System.arraycopy(row, firstColumn, values, position, used);
            position += used;
        }
        return RobustStatistics.biweightLocation(values);
    }

    /**
     * Removes the overscan strip from the right-hand side of a readout.
     */
    public static double[][] trimOverscan(double[][] image, int overscanWidth) {
        final int width = image[0].length - overscanWidth;
        if (width <= 0) {
            throw new IllegalArgumentException("Cannot trim " + overscanWidth + " overscan columns from a readout with "
                    + image[0].length + " columns.");
        }
        double[][] trimmed = new double[image.length][];
        for (int row = 0; row < image.length; ++row) {
            trimmed[row] = new double[width];
            System.arraycopy(image[row], 0, trimmed[row], 0, width);
        }
        return trimmed;
    }

    public static double effectiveGain(double gain) {
        return gain > 0.0 ? gain : DEFAULT_GAIN;
    }

    public static double effectiveReadNoise(double readNoise) {
        return readNoise > 0.0 ? readNoise : DEFAULT_READ_NOISE;
    }

    /**
     * Orients a readout so that wavelength increases from left to right and
     * fibers are ordered as in the calibration records. Amplifiers LU and RL
     * are rotated by 180 degrees and readouts whose AMPNAME is LR or UL are
     * then mirrored left to right. Applying the orientation twice returns the
     * original pixels.
     *
     * @param image the readout, not modified.
     * @param amplifier the amplifier identity (CCDPOS + CCDHALF).
     * @param ampName the AMPNAME header value, if any.
     * @return a new, oriented array.
     */
    public static double[][] orient(double[][] image, String amplifier, Optional<String> ampName) {
        double[][] oriented = copy(image);

        if (contains(ROTATED_AMPLIFIERS, amplifier)) {
            oriented = flipRows(oriented);
            oriented = mirrorColumns(oriented);
        }
        if (ampName.isPresent() && contains(MIRRORED_AMP_NAMES, ampName.get())) {
            oriented = mirrorColumns(oriented);
        }
        return oriented;
    }

    static double[][] flipRows(double[][] image) {
        double[][] flipped = new double[image.length][];
        for (int row = 0; row < image.length; ++row) {
            flipped[row] = image[image.length - 1 - row];
        }
        return flipped;
    }

    static double[][] mirrorColumns(double[][] image) {
        double[][] mirrored = new double[image.length][];
        for (int row = 0; row < image.length; ++row) {
            final int width = image[row].length;
            mirrored[row] = new double[width];
            for (int column = 0; column < width; ++column) {
                mirrored[row][column] = image[row][width - 1 - column];
            }
        }
        return mirrored;
    }

    static double[][] copy(double[][] image) {
        double[][] copy = new double[image.length][];
        for (int row = 0; row < image.length; ++row) {
            copy[row] = image[row].clone();
        }
        return copy;
    }

    private static boolean contains(String[] candidates, String value) {
        for (String candidate : candidates) {
            if (candidate.equals(value)) {
                return true;
            }
        }
        return false;
    }
}
