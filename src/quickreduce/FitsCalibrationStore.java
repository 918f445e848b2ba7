/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

import java.io.DataOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;

/**
 * Reads calibration records from a directory of FITS files, one file per slot
 * and amplifier. The primary HDU of each file holds the fiber sky positions
 * (one row of x, y per fiber) and the IFUSLOT and AMP header values. Image
 * extensions, identified by EXTNAME, hold the TRACE and WAVELENGTH tables and
 * optionally the MASTERBIAS frame.
 */
public class FitsCalibrationStore implements CalibrationStore {

    public static final String SLOT_KEYWORD = "IFUSLOT";

    public static final String AMP_KEYWORD = "AMP";

    public static final String EXTENSION_NAME_KEYWORD = "EXTNAME";

    public static final String TRACE_EXTENSION = "TRACE";

    public static final String WAVELENGTH_EXTENSION = "WAVELENGTH";

    public static final String MASTER_BIAS_EXTENSION = "MASTERBIAS";

    /**
     * The order amplifiers of a slot are reduced in.
     */
    static final List<String> AMPLIFIER_ORDER = Arrays.asList("LL", "LU", "RL", "RU");

    /**
     * The directory holding the calibration files.
     */
    private final File directory;

    public FitsCalibrationStore(File directory) {
        if (directory == null) {
            throw new IllegalArgumentException("Cannot read calibrations as no directory was given.");
        }
        this.directory = directory;
    }

    public File getDirectory() {
        return directory;
    }

    public List<CalibrationRecord> loadRecords() throws IOException {
        File[] files = directory.listFiles();
        if (files == null) {
            throw new IOException("Cannot read calibrations as '" + directory + "' is not a readable directory.");
        }

        List<CalibrationRecord> records = new ArrayList<CalibrationRecord>();
        for (File file : files) {
            if (file.isFile() && file.getName().toLowerCase().endsWith(".fits")) {
                records.add(loadRecord(file));
            }
        }

        Collections.sort(records, new Comparator<CalibrationRecord>() {
            public int compare(CalibrationRecord first, CalibrationRecord second) {
                if (first.getSlot() != second.getSlot()) {
                    return first.getSlot() < second.getSlot() ? -1 : 1;
                }
                int firstRank = amplifierRank(first.getAmplifier());
                int secondRank = amplifierRank(second.getAmplifier());
                if (firstRank != secondRank) {
                    return firstRank < secondRank ? -1 : 1;
                }
                return first.getAmplifier().compareTo(second.getAmplifier());
            }
        });

        System.out.println("Loaded " + records.size() + " calibration records from " + directory);
        return records;
    }

    /**
     * Reads one calibration file.
     *
     * @param file the calibration file.
     * @return the calibration record held in the file.
     *
     * @throws IOException if the file could not be read or lacks a mandatory
     *         value.
     */
    public CalibrationRecord loadRecord(File file) throws IOException {
        final String source = file.getPath();
        try (FileInputStream fis = new FileInputStream(file)) {
            Fits fits = new Fits();
            fits.read(fis);

            BasicHDU<?> primary = fits.getHDU(0);
            if (primary == null) {
                throw new IOException("The calibration file '" + source + "' is empty.");
            }
            Header header = primary.getHeader();
            int slot = header.getIntValue(SLOT_KEYWORD, -1);
            String amplifier = header.getStringValue(AMP_KEYWORD);
            if ((slot < 0) || (amplifier == null)) {
                throw new IOException("The calibration file '" + source + "' does not have both the "
                        + SLOT_KEYWORD + " and " + AMP_KEYWORD + " header values.");
            }

            double[][] positions = FitsFrameReader.readPixels(primary, source);
            double[][] trace = null;
            double[][] wavelength = null;
            MasterBias bias = MasterBias.none();

            for (int index = 1; index < fits.getNumberOfHDUs(); ++index) {
                BasicHDU<?> extension = fits.getHDU(index);
                String name = extension.getHeader().getStringValue(EXTENSION_NAME_KEYWORD);
                if (TRACE_EXTENSION.equals(name)) {
                    trace = FitsFrameReader.readPixels(extension, source + "[" + name + "]");
                } else if (WAVELENGTH_EXTENSION.equals(name)) {
                    wavelength = FitsFrameReader.readPixels(extension, source + "[" + name + "]");
                } else if (MASTER_BIAS_EXTENSION.equals(name)) {
                    bias = MasterBias.of(FitsFrameReader.readPixels(extension, source + "[" + name + "]"));
                }
            }

            if ((trace == null) || (wavelength == null)) {
                throw new IOException("The calibration file '" + source + "' does not have both the "
                        + TRACE_EXTENSION + " and " + WAVELENGTH_EXTENSION + " extensions.");
            }
            return new CalibrationRecord(slot, amplifier, positions, wavelength, trace, bias);
        } catch (FitsException ex) {
            throw new IOException("Unable to load the calibration file '" + source + "'", ex);
        }
    }

    /**
     * Writes a calibration record in the layout read by this store.
     *
     * @param record the record to write.
     * @param file the destination file.
     *
     * @throws IOException if the file could not be written.
     */
    public static void saveRecord(CalibrationRecord record, File file) throws IOException {
        try (DataOutputStream dos = new DataOutputStream(new FileOutputStream(file))) {
            Fits fits = new Fits();

            BasicHDU<?> primary = Fits.makeHDU(record.getFiberPositions());
            primary.addValue(SLOT_KEYWORD, record.getSlot(), "instrument slot");
            primary.addValue(AMP_KEYWORD, record.getAmplifier(), "amplifier");
            fits.addHDU(primary);

            fits.addHDU(extension(TRACE_EXTENSION, record.getTrace()));
            fits.addHDU(extension(WAVELENGTH_EXTENSION, record.getWavelength()));
            if (record.getMasterBias().isPresent()) {
                fits.addHDU(extension(MASTER_BIAS_EXTENSION, record.getMasterBias().getFrame().get()));
            }

            fits.write(dos);
        } catch (FitsException ex) {
            throw new IOException("Unable to write the calibration file '" + file + "'", ex);
        }
    }

    private static BasicHDU<?> extension(String name, double[][] data) throws FitsException {
        BasicHDU<?> hdu = Fits.makeHDU(data);
        hdu.addValue(EXTENSION_NAME_KEYWORD, name, "calibration table");
        return hdu;
    }

    static int amplifierRank(String amplifier) {
        int rank = AMPLIFIER_ORDER.indexOf(amplifier);
        return rank < 0 ? AMPLIFIER_ORDER.size() : rank;
    }
}
