/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

import java.io.File;

/**
 * Builds the path patterns of raw exposures in the archive. Raw files are laid
 * out as
 * <pre>
 *   root/date/instrument/instrumentOBSERVATION/expNN/instrument/2*SLOTAMP*BASE.fits
 * </pre>
 * where OBSERVATION is the zero-padded observation number.
 */
public final class RawFilePaths {

    /**
     * Matches any observation, exposure or file name fragment.
     */
    public static final String WILDCARD = "*";

    /**
     * File name suffix of science exposures.
     */
    public static final String SCIENCE = "sci";

    /**
     * File name suffix of twilight flat exposures.
     */
    public static final String TWILIGHT = "twi";

    /**
     * Pattern matching every exposure directory of an observation.
     */
    public static final String ANY_EXPOSURE = "exp*";

    private RawFilePaths() {
    }

    /**
     * Formats an observation number the way it appears in directory names.
     *
     * @param observation the observation number.
     * @return the number zero-padded to seven digits.
     */
    public static String observationId(int observation) {
        if (observation < 0) {
            throw new IllegalArgumentException("Cannot format the negative observation number " + observation + ".");
        }
        return String.format("%07d", observation);
    }

    /**
     * Formats a slot number the way it appears in file names.
     *
     * @param slot the slot number.
     * @return the number zero-padded to three digits.
     */
    public static String slotId(int slot) {
        return String.format("%03d", slot);
    }

    /**
     * Builds the path pattern of the raw exposures of one amplifier.
     *
     * @param rootDirectory the directory holding the date directories.
     * @param date the night (yyyyMMdd).
     * @param observation the formatted observation id, or {@link #WILDCARD}.
     * @param slot the formatted slot id.
     * @param amplifier the amplifier, for example "LL".
     * @param base the kind of exposure, {@link #SCIENCE} or {@link #TWILIGHT}.
     * @param exposure the exposure directory pattern, usually {@link #ANY_EXPOSURE}.
     * @param instrument the instrument name.
     * @return the path pattern.
     */
    public static String buildPath(String rootDirectory, String date, String observation, String slot,
                                   String amplifier, String base, String exposure, String instrument) {
        StringBuilder path = new StringBuilder(rootDirectory);
        if (!rootDirectory.endsWith(File.separator)) {
            path.append(File.separator);
        }
        path.append(date).append(File.separator)
            .append(instrument).append(File.separator)
            .append(instrument).append(observation).append(File.separator)
            .append(exposure).append(File.separator)
            .append(instrument).append(File.separator)
            .append("2*").append(slot).append(amplifier).append('*').append(base).append(".fits");
        return path.toString();
    }
}
