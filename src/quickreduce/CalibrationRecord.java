/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

/**
 * The calibration of one amplifier of one instrument slot: where each fiber
 * falls on the detector, its wavelength solution, where it looks on the sky
 * and, optionally, the amplifier's master bias.
 */
public class CalibrationRecord {

    /**
     * The instrument slot number.
     */
    private final int slot;

    /**
     * The amplifier, for example "LL".
     */
    private final String amplifier;

    /**
     * The nominal (x, y) sky position of each fiber, [fiber][2].
     */
    private final double[][] fiberPositions;

    /**
     * The wavelength of each fiber at each detector column, [fiber][column].
     */
    private final double[][] wavelength;

    /**
     * The detector row of each fiber at each detector column, [fiber][column].
     */
    private final double[][] trace;

    private final MasterBias masterBias;

    public CalibrationRecord(int slot, String amplifier, double[][] fiberPositions, double[][] wavelength,
                             double[][] trace, MasterBias masterBias) {
        if ((amplifier == null) || (amplifier.trim().length() < 1)) {
            throw new IllegalArgumentException("Cannot create a calibration record without an amplifier.");
        }
        if ((fiberPositions == null) || (wavelength == null) || (trace == null)) {
            throw new IllegalArgumentException("Cannot create the calibration record of " + slot + amplifier
                    + " as its fiber positions, wavelengths or traces are missing.");
        }
        if ((fiberPositions.length != trace.length) || (wavelength.length != trace.length)) {
            throw new IllegalArgumentException("Cannot create the calibration record of " + slot + amplifier
                    + " as it has " + fiberPositions.length + " fiber positions, " + wavelength.length
                    + " wavelength solutions and " + trace.length + " traces.");
        }
        for (int fiber = 0; fiber < fiberPositions.length; ++fiber) {
            if (fiberPositions[fiber].length != 2) {
                throw new IllegalArgumentException("Fiber " + fiber + " of " + slot + amplifier
                        + " does not have an (x, y) position.");
            }
        }
        if (masterBias == null) {
            throw new IllegalArgumentException("Cannot create a calibration record with a null master bias, "
                    + "use MasterBias.none().");
        }

        this.slot = slot;
        this.amplifier = amplifier;
        this.fiberPositions = fiberPositions;
        this.wavelength = wavelength;
        this.trace = trace;
        this.masterBias = masterBias;
    }

    public int getSlot() {
        return slot;
    }

    /**
     * Gets the slot number as it appears in raw file names.
     */
    public String getSlotId() {
        return RawFilePaths.slotId(slot);
    }

    public String getAmplifier() {
        return amplifier;
    }

    public double[][] getFiberPositions() {
        return fiberPositions;
    }

    public double[][] getWavelength() {
        return wavelength;
    }

    public double[][] getTrace() {
        return trace;
    }

    public MasterBias getMasterBias() {
        return masterBias;
    }

    public int getFiberCount() {
        return trace.length;
    }

    @Override
    public String toString() {
        return getSlotId() + amplifier;
    }
}
