/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

/**
 * The common wavelength grid that every fiber spectrum is resampled onto. The
 * grid is uniform and increasing: start, start + step, ... up to but excluding
 * stop.
 */
public final class WavelengthGrid {

    /**
     * The grid used by the reduction, 3470 to 5540 Angstroms in 2 Angstrom steps.
     */
    public static final WavelengthGrid DEFAULT = new WavelengthGrid(3470.0, 5542.0, 2.0);

    private final double start;

    private final double step;

    private final double[] wavelengths;

    public WavelengthGrid(double start, double stop, double step) {
        if (step <= 0.0) {
            throw new IllegalArgumentException("Cannot create a wavelength grid with a step of " + step + ".");
        }
        if (stop <= start) {
            throw new IllegalArgumentException("Cannot create a wavelength grid from " + start + " to " + stop + ".");
        }
        this.start = start;
        this.step = step;

        final int count = (int) Math.ceil((stop - start) / step);
        wavelengths = new double[count];
        for (int index = 0; index < count; ++index) {
            wavelengths[index] = start + index * step;
        }
    }

    public double getStart() {
        return start;
    }

    public double getStep() {
        return step;
    }

    /**
     * Gets the number of wavelength bins.
     */
    public int size() {
        return wavelengths.length;
    }

    /**
     * Gets a copy of the grid wavelengths.
     */
    public double[] getWavelengths() {
        return wavelengths.clone();
    }

    /**
     * Finds the index of the first grid wavelength that is not less than the
     * given wavelength, so inserting the wavelength there keeps the grid sorted.
     *
     * @param wavelength the wavelength to look up.
     * @return an index from 0 to size() inclusive.
     */
    public int insertionIndex(double wavelength) {
        int low = 0;
        int high = wavelengths.length;
        while (low < high) {
            int middle = (low + high) >>> 1;
            if (wavelengths[middle] < wavelength) {
                low = middle + 1;
            } else {
                high = middle;
            }
        }
        return low;
    }
}
