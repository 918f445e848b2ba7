/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

/**
 * The outcome of searching backwards in time for calibration exposures.
 */
public class CalibrationLookup {

    /**
     * The last path pattern that was tried.
     */
    private final String path;

    /**
     * The date (yyyyMMdd) substituted into the path pattern.
     */
    private final String date;

    /**
     * Number of days stepped back from the requested date.
     */
    private final int daysBack;

    /**
     * True if at least one file matched the path pattern.
     */
    private final boolean found;

    public CalibrationLookup(String path, String date, int daysBack, boolean found) {
        this.path = path;
        this.date = date;
        this.daysBack = daysBack;
        this.found = found;
    }

    public String getPath() {
        return path;
    }

    public String getDate() {
        return date;
    }

    public int getDaysBack() {
        return daysBack;
    }

    /**
     * Indicates whether calibration exposures were found. When false the path
     * is the last (non-matching) one tried and the caller has no calibration
     * data for the amplifier.
     *
     * @return true if files match the path.
     */
    public boolean isFound() {
        return found;
    }

    @Override
    public String toString() {
        return "CalibrationLookup{path=" + path + ", date=" + date + ", daysBack=" + daysBack + ", found=" + found + '}';
    }
}
