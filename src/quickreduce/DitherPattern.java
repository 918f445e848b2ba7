/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

/**
 * The telescope offsets applied between the exposures of an observation, in
 * the same units as the fiber sky positions. Exposure j of an amplifier is
 * offset by the j-th entry.
 */
public final class DitherPattern {

    private static final double[][] OFFSETS = {
        {0.0, 0.0},
        {1.27, -0.73},
        {1.27, 0.73}
    };

    private DitherPattern() {
    }

    /**
     * Gets the number of dither positions in the pattern.
     */
    public static int size() {
        return OFFSETS.length;
    }

    /**
     * Gets the offset of an exposure.
     *
     * @param exposure the position of the exposure in the ordered exposure list.
     * @return a new array holding the x and y offsets.
     *
     * @throws IllegalArgumentException if the pattern has no entry for the
     *         exposure.
     */
    public static double[] offset(int exposure) {
        if ((exposure < 0) || (exposure >= OFFSETS.length)) {
            throw new IllegalArgumentException("The dither pattern has " + OFFSETS.length
                    + " positions, so there is no offset for exposure " + exposure + ".");
        }
        return OFFSETS[exposure].clone();
    }
}
