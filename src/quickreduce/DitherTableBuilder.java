/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates dithered fiber samples and finalises them into a DitherTable.
 * A builder is not shared between threads; each amplifier is collected in
 * its own builder and the results are appended to the run's builder in order.
 */
public class DitherTableBuilder {

    /**
     * The number of wavelength bins every spectrum must have.
     */
    private final int binCount;

    private final List<double[]> positions = new ArrayList<double[]>();

    private final List<double[]> twilight = new ArrayList<double[]>();

    private final List<double[]> science = new ArrayList<double[]>();

    public DitherTableBuilder(int binCount) {
        if (binCount <= 0) {
            throw new IllegalArgumentException("Cannot collect spectra with " + binCount + " wavelength bins.");
        }
        this.binCount = binCount;
    }

    /**
     * Adds one sample.
     *
     * @param x the sky x position.
     * @param y the sky y position.
     * @param twilightSpectrum the twilight spectrum, copied.
     * @param scienceSpectrum the science spectrum, copied.
     * @return this builder.
     */
    public DitherTableBuilder addRow(double x, double y, double[] twilightSpectrum, double[] scienceSpectrum) {
        if ((twilightSpectrum == null) || (scienceSpectrum == null)
                || (twilightSpectrum.length != binCount) || (scienceSpectrum.length != binCount)) {
            throw new IllegalArgumentException("Cannot add a sample whose spectra do not have " + binCount + " bins.");
        }
        positions.add(new double[] {x, y});
        twilight.add(twilightSpectrum.clone());
        science.add(scienceSpectrum.clone());
        return this;
    }

    /**
     * Adds every fiber of one exposure. The sky position of each fiber is its
     * nominal position plus the dither offset of the exposure.
     *
     * @param fiberPositions the nominal (x, y) position of each fiber.
     * @param exposure the position of the exposure in the ordered exposure list.
     * @param spectra the spectra extracted from the exposure.
     * @return this builder.
     *
     * @throws IllegalArgumentException if the dither pattern has no offset for
     *         the exposure.
     */
    public DitherTableBuilder addExposure(double[][] fiberPositions, int exposure, ExtractedSpectra spectra) {
        if (fiberPositions.length != spectra.getFiberCount()) {
            throw new IllegalArgumentException("Cannot add an exposure with " + spectra.getFiberCount()
                    + " extracted fibers and " + fiberPositions.length + " fiber positions.");
        }
        double[] offset = DitherPattern.offset(exposure);
        for (int fiber = 0; fiber < fiberPositions.length; ++fiber) {
            addRow(fiberPositions[fiber][0] + offset[0], fiberPositions[fiber][1] + offset[1],
                    spectra.getTwilight()[fiber], spectra.getScience()[fiber]);
        }
        return this;
    }

    /**
     * Appends all rows of a table, keeping their order.
     */
    public DitherTableBuilder addAll(DitherTable table) {
        for (int row = 0; row < table.getRowCount(); ++row) {
            addRow(table.getX(row), table.getY(row), table.getTwilight(row), table.getScience(row));
        }
        return this;
    }

    public int getRowCount() {
        return positions.size();
    }

    /**
     * Finalises the collected samples. The builder may keep being used; later
     * additions do not affect tables already built.
     */
    public DitherTable build() {
        return new DitherTable(toArray(positions), toArray(twilight), toArray(science));
    }

    private static double[][] toArray(List<double[]> rows) {
        double[][] array = new double[rows.size()][];
        for (int row = 0; row < array.length; ++row) {
            array[row] = rows.get(row).clone();
        }
        return array;
    }
}
