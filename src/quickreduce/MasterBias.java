/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

import java.util.Optional;

/**
 * The master bias of one amplifier. Calibration records need not carry one, in
 * which case nothing is subtracted.
 */
public final class MasterBias {

    private static final MasterBias NONE = new MasterBias(null);

    /**
     * The bias frame in electrons, or null when the record has none.
     */
    private final double[][] frame;

    private MasterBias(double[][] frame) {
        this.frame = frame;
    }

    /**
     * Returns the master bias used when a calibration record carries none.
     */
    public static MasterBias none() {
        return NONE;
    }

    /**
     * Wraps a master bias frame.
     *
     * @param frame the bias frame, oriented and trimmed like a preprocessed
     *        exposure.
     * @return the master bias.
     */
    public static MasterBias of(double[][] frame) {
        if (frame == null) {
            throw new IllegalArgumentException("Cannot create a master bias from a null frame, use MasterBias.none().");
        }
        return new MasterBias(frame);
    }

    public boolean isPresent() {
        return frame != null;
    }

    /**
     * Gets the bias frame, if there is one.
     */
    public Optional<double[][]> getFrame() {
        return Optional.ofNullable(frame);
    }

    /**
     * Subtracts the bias from an image.
     *
     * @param image the image, not modified.
     * @return a new array holding the bias subtracted image.
     *
     * @throws IllegalArgumentException if the bias and image sizes differ.
     */
    public double[][] subtractFrom(double[][] image) {
        double[][] result = DetectorPreprocessor.copy(image);
        if (frame == null) {
            return result;
        }

        if ((frame.length != image.length) || (frame[0].length != image[0].length)) {
            throw new IllegalArgumentException("Cannot subtract a " + frame.length + "x" + frame[0].length
                    + " master bias from a " + image.length + "x" + image[0].length + " image.");
        }
        for (int row = 0; row < result.length; ++row) {
            for (int column = 0; column < result[row].length; ++column) {
                result[row][column] -= frame[row][column];
            }
        }
        return result;
    }
}
