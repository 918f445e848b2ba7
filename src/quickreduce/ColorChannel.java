/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

/**
 * Wavelength bands that can be collapsed into a single image intensity per
 * fiber.
 */
public enum ColorChannel {

    BLUE(3600.0, 3900.0),
    GREEN(4350.0, 4650.0),
    RED(5100.0, 5400.0);

    /**
     * Blue end of the band, in Angstroms.
     */
    private final double startWavelength;

    /**
     * Red end of the band, in Angstroms.
     */
    private final double endWavelength;

    private ColorChannel(double startWavelength, double endWavelength) {
        this.startWavelength = startWavelength;
        this.endWavelength = endWavelength;
    }

    public double getStartWavelength() {
        return startWavelength;
    }

    public double getEndWavelength() {
        return endWavelength;
    }

    /**
     * Gets the first grid column inside the band.
     */
    public int getStartIndex(WavelengthGrid grid) {
        return grid.insertionIndex(startWavelength);
    }

    /**
     * Gets the grid column just past the band.
     */
    public int getEndIndex(WavelengthGrid grid) {
        return grid.insertionIndex(endWavelength);
    }

    /**
     * Looks up a channel by name, ignoring case.
     *
     * @param name the channel name, for example "red".
     * @return the channel.
     *
     * @throws IllegalArgumentException if there is no such channel.
     */
    public static ColorChannel fromName(String name) {
        if (name != null) {
            for (ColorChannel channel : values()) {
                if (channel.name().equalsIgnoreCase(name.trim())) {
                    return channel;
                }
            }
        }
        throw new IllegalArgumentException("Unknown color channel '" + name + "', expected blue, green or red.");
    }
}
