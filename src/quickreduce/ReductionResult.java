/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

/**
 * The products of a reduction run.
 */
public class ReductionResult {

    /**
     * Every dithered fiber sample of the run.
     */
    private final DitherTable table;

    /**
     * The background flattened intensity of each row of the table.
     */
    private final double[] intensities;

    /**
     * The intensities resampled onto the sky grid, indexed [y][x].
     */
    private final double[][] image;

    public ReductionResult(DitherTable table, double[] intensities, double[][] image) {
        this.table = table;
        this.intensities = intensities;
        this.image = image;
    }

    public DitherTable getTable() {
        return table;
    }

    public double[] getIntensities() {
        return intensities;
    }

    public double[][] getImage() {
        return image;
    }
}
