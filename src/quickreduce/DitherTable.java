/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

/**
 * An immutable table of dithered fiber samples. Each row holds the sky
 * position of one fiber in one exposure together with its twilight and
 * science spectra. Rows are kept in the order they were added: by calibration
 * record, then exposure, then fiber.
 */
public final class DitherTable {

    private final double[][] positions;

    private final double[][] twilight;

    private final double[][] science;

    DitherTable(double[][] positions, double[][] twilight, double[][] science) {
        this.positions = positions;
        this.twilight = twilight;
        this.science = science;
    }

    public int getRowCount() {
        return positions.length;
    }

    /**
     * Gets the number of wavelength bins in each spectrum.
     */
    public int getBinCount() {
        return positions.length == 0 ? 0 : twilight[0].length;
    }

    public double getX(int row) {
        return positions[row][0];
    }

    public double getY(int row) {
        return positions[row][1];
    }

    public double[] getTwilight(int row) {
        return twilight[row].clone();
    }

    public double[] getScience(int row) {
        return science[row].clone();
    }

    /**
     * Gets a copy of the (x, y) positions, one row per sample.
     */
    public double[][] getPositions() {
        return DetectorPreprocessor.copy(positions);
    }

    /**
     * Gets a copy of the twilight spectra, one row per sample.
     */
    public double[][] getTwilightSpectra() {
        return DetectorPreprocessor.copy(twilight);
    }

    /**
     * Gets a copy of the science spectra, one row per sample.
     */
    public double[][] getScienceSpectra() {
        return DetectorPreprocessor.copy(science);
    }
}
