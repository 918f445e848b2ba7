/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

/**
 * The spectra extracted from one exposure of one amplifier, one row per fiber
 * and one column per bin of the common wavelength grid.
 */
public class ExtractedSpectra {

    /**
     * Master flat (twilight) flux along each fiber trace.
     */
    private final double[][] twilight;

    /**
     * Flat-fielded science flux along each fiber trace.
     */
    private final double[][] science;

    public ExtractedSpectra(double[][] twilight, double[][] science) {
        if ((twilight == null) || (science == null) || (twilight.length != science.length)) {
            throw new IllegalArgumentException("Cannot create extracted spectra as the twilight and science "
                    + "spectra are missing or have different fiber counts.");
        }
        this.twilight = twilight;
        this.science = science;
    }

    public double[][] getTwilight() {
        return twilight;
    }

    public double[][] getScience() {
        return science;
    }

    public int getFiberCount() {
        return twilight.length;
    }
}
