/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.util.MathArrays;

/**
 * Extracts fiber spectra from a preprocessed exposure.
 *
 * <p>At every detector column the two rows bracketing a fiber trace are used.
 * The twilight spectrum is the mean of the master flat over those two rows.
 * The science spectrum is the mean over the same rows of science / flat, which
 * extracts the fiber and flat-fields it pixel by pixel in one step. Both
 * spectra are then resampled from the fiber's own wavelength solution onto the
 * common wavelength grid.</p>
 *
 * <p>A fiber whose trace leaves the detector at any column gives zero spectra,
 * so the number of rows always equals the number of fibers.</p>
 */
public class FiberSpectrumExtractor {

    /**
     * The grid all spectra are resampled onto.
     */
    private final WavelengthGrid grid;

    public FiberSpectrumExtractor(WavelengthGrid grid) {
        if (grid == null) {
            throw new IllegalArgumentException("Cannot extract spectra without a wavelength grid.");
        }
        this.grid = grid;
    }

    /**
     * Extracts the twilight and science spectra of every fiber.
     *
     * @param science the preprocessed, bias subtracted science exposure.
     * @param flat the master flat of the same amplifier.
     * @param trace the row position of each fiber at each column, [fiber][column].
     * @param wavelength the wavelength of each fiber at each column, [fiber][column].
     * @return the spectra, one row per fiber.
     */
    public ExtractedSpectra extract(double[][] science, double[][] flat, double[][] trace, double[][] wavelength) {
        checkInputs(science, flat, trace, wavelength);

        final int fibers = trace.length;
        final int rows = flat.length;
        final int columns = flat[0].length;
        final double[] gridWavelengths = grid.getWavelengths();

        double[][] twilightSpectra = new double[fibers][grid.size()];
        double[][] scienceSpectra = new double[fibers][grid.size()];

        for (int fiber = 0; fiber < fibers; ++fiber) {
            if (!isWithinFrame(trace[fiber], rows)) {
                continue;
            }
            if (!isUsableWavelength(wavelength[fiber])) {
                System.err.println("Skipping fiber " + fiber + " as its wavelength solution is not finite and increasing.");
                continue;
            }

            double[] twilight = new double[columns];
            double[] flatFielded = new double[columns];
            for (int column = 0; column < columns; ++column) {
                int low = (int) Math.floor(trace[fiber][column]);
                int high = (int) Math.ceil(trace[fiber][column]);
                twilight[column] = flat[low][column] / 2.0 + flat[high][column] / 2.0;
                flatFielded[column] = science[low][column] / flat[low][column]
                        + science[high][column] / flat[high][column];
            }

            twilightSpectra[fiber] = resample(wavelength[fiber], twilight, gridWavelengths);
            double[] resampled = resample(wavelength[fiber], flatFielded, gridWavelengths);
            for (int bin = 0; bin < resampled.length; ++bin) {
                scienceSpectra[fiber][bin] = resampled[bin] / 2.0;
            }
        }

        return new ExtractedSpectra(twilightSpectra, scienceSpectra);
    }

    /**
     * Checks whether the rows bracketing a trace lie on the detector at every
     * column.
     *
     * @param trace the row position of the fiber at each column.
     * @param rows the number of detector rows.
     * @return true if floor(trace) >= 0 and ceil(trace) < rows everywhere.
     */
    public static boolean isWithinFrame(double[] trace, int rows) {
        for (double position : trace) {
            if (Double.isNaN(position) || (position < 0.0) || (Math.ceil(position) >= rows)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks whether a wavelength solution can be interpolated: every value
     * finite and strictly increasing.
     *
     * @param wavelength the wavelength of the fiber at each column.
     * @return true if the solution is usable.
     */
    public static boolean isUsableWavelength(double[] wavelength) {
        for (double value : wavelength) {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return false;
            }
        }
        return MathArrays.isMonotonic(wavelength, MathArrays.OrderDirection.INCREASING, true);
    }

    /**
     * Linearly interpolates a spectrum onto new wavelengths. Wavelengths
     * outside the range of the source wavelengths, and results that are not
     * finite, are set to zero.
     *
     * @param wavelength the strictly increasing source wavelengths.
     * @param flux the flux at each source wavelength.
     * @param target the wavelengths to interpolate to.
     * @return the interpolated flux at each target wavelength.
     */
    public static double[] resample(double[] wavelength, double[] flux, double[] target) {
        PolynomialSplineFunction function = new LinearInterpolator().interpolate(wavelength, flux);

        double[] result = new double[target.length];
        for (int index = 0; index < target.length; ++index) {
            if (function.isValidPoint(target[index])) {
                double value = function.value(target[index]);
                result[index] = Double.isNaN(value) || Double.isInfinite(value) ? 0.0 : value;
            }
        }
        return result;
    }

    private static void checkInputs(double[][] science, double[][] flat, double[][] trace, double[][] wavelength) {
        if ((science == null) || (flat == null) || (trace == null) || (wavelength == null)) {
            throw new IllegalArgumentException("Cannot extract spectra as an input array was null.");
        }
        if ((science.length != flat.length) || (science[0].length != flat[0].length)) {
            throw new IllegalArgumentException("Cannot extract spectra as the " + science.length + "x" + science[0].length
                    + " exposure and the " + flat.length + "x" + flat[0].length + " master flat differ in size.");
        }
        if (trace.length != wavelength.length) {
            throw new IllegalArgumentException("Cannot extract spectra as there are " + trace.length + " traces and "
                    + wavelength.length + " wavelength solutions.");
        }
        for (int fiber = 0; fiber < trace.length; ++fiber) {
            if ((trace[fiber].length != flat[0].length) || (wavelength[fiber].length != flat[0].length)) {
                throw new IllegalArgumentException("Cannot extract spectra as fiber " + fiber + " has a trace of "
                        + trace[fiber].length + " and a wavelength solution of " + wavelength[fiber].length
                        + " columns on a detector with " + flat[0].length + " columns.");
            }
        }
    }
}
