/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

import java.io.IOException;
import java.text.ParseException;
import java.text.SimpleDateFormat;
import java.util.Calendar;
import java.util.TimeZone;

/**
 * Locates calibration exposures for a night. Calibrations are not taken every
 * night, so when none exist for the requested date the preceding nights are
 * searched, one day at a time.
 */
public class CalibrationDateResolver {

    /**
     * The maximum number of nights to step back before giving up.
     */
    public static final int MAX_DAYS_BACK = 30;

    /**
     * Format of the dates embedded in raw data paths.
     */
    public static final String DATE_FORMAT = "yyyyMMdd";

    /**
     * Used to check whether files exist for a candidate path.
     */
    private final FileLocator locator;

    /**
     * Represents the UTC (Universal Coordinated Time) timezone.
     */
    private final TimeZone utcTimeZone;

    public CalibrationDateResolver(FileLocator locator) {
        if (locator == null) {
            throw new IllegalArgumentException("Cannot resolve calibration dates without a file locator.");
        }
        this.locator = locator;
        this.utcTimeZone = TimeZone.getTimeZone("UTC");
    }

    /**
     * Finds the most recent night, on or before the given date, that has files
     * matching the path template.
     *
     * @param template a path pattern that contains the date.
     * @param date the requested date (yyyyMMdd), which must appear in the
     *        template.
     * @return the matching path and its date, or the last path tried (with
     *         isFound() false) if nothing matched within MAX_DAYS_BACK nights.
     *
     * @throws IOException if the file locator failed.
     */
    public CalibrationLookup resolve(String template, String date) throws IOException {
        if ((template == null) || (date == null)) {
            throw new IllegalArgumentException("Cannot resolve a calibration path from a null template or date.");
        }
        if (!template.contains(date)) {
            throw new IllegalArgumentException("Cannot resolve a calibration path as the template '" + template
                    + "' does not contain the date " + date + ".");
        }

        SimpleDateFormat formatter = new SimpleDateFormat(DATE_FORMAT);
        formatter.setTimeZone(utcTimeZone);
        formatter.setLenient(false);

        Calendar calendar = Calendar.getInstance(utcTimeZone);
        try {
            calendar.setTime(formatter.parse(date));
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Cannot resolve a calibration path as the date '" + date
                    + "' is not of the form " + DATE_FORMAT + ".", ex);
        }

        String path = template;
        String candidateDate = date;
        int daysBack = 0;
        while (locator.find(path).isEmpty()) {
            if (daysBack >= MAX_DAYS_BACK) {
                System.err.println("Could not find calibrations within " + MAX_DAYS_BACK + " days of " + date
                        + ", last tried " + path);
                return new CalibrationLookup(path, candidateDate, daysBack, false);
            }
            calendar.add(Calendar.DAY_OF_MONTH, -1);
            candidateDate = formatter.format(calendar.getTime());
            path = template.replace(date, candidateDate);
            ++daysBack;
            System.out.println("Looking for calibrations in " + path);
        }

        return new CalibrationLookup(path, candidateDate, daysBack, true);
    }
}
