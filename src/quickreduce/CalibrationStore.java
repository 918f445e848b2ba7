/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

import java.io.IOException;
import java.util.List;

/**
 * The CalibrationStore interface provides the calibration records of every
 * instrument slot and amplifier.
 */
public interface CalibrationStore {

    /**
     * Loads every calibration record, ordered by slot and then amplifier.
     *
     * @return the calibration records.
     *
     * @throws IOException if the store could not be read.
     */
    public List<CalibrationRecord> loadRecords() throws IOException;
}
