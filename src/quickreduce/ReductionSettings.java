/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.util.Properties;

/**
 * The settings of one reduction run: which night and observation to reduce,
 * where the raw data and calibrations are, and where to write the results.
 * Settings are read once at startup (from the quickreduce.properties file and
 * then the command line) and handed to the ReductionPipeline.
 */
public class ReductionSettings {

    /**
     * File name of the properties file (excluding the file path) holding the
     * default settings.
     */
    public final static String PROPERTY_FILE_NAME = "quickreduce.properties";

    final static String DATE_PROPERTY_NAME = "date";

    final static String OBSERVATION_PROPERTY_NAME = "observation";

    final static String ROOT_DIRECTORY_PROPERTY_NAME = "rootdir";

    final static String CALIBRATION_DIRECTORY_PROPERTY_NAME = "calibrations";

    final static String SLOT_PROPERTY_NAME = "ifuslot";

    final static String INSTRUMENT_PROPERTY_NAME = "instrument";

    final static String CHANNEL_PROPERTY_NAME = "channel";

    final static String PNG_PROPERTY_NAME = "png";

    final static String FITS_PROPERTY_NAME = "fits";

    /**
     * The night to reduce (yyyyMMdd).
     */
    private String date = "20181108";

    /**
     * The observation number, or null if none was given.
     */
    private Integer observation = null;

    /**
     * The directory holding the date directories of raw data.
     */
    private String rootDirectory = "/work/03946/hetdex/maverick";

    /**
     * The directory of calibration record files.
     */
    private String calibrationDirectory = "cals";

    /**
     * The only slot to reduce, or null to reduce every slot.
     */
    private Integer slot = null;

    /**
     * The instrument name used in raw data paths.
     */
    private String instrument = "virus";

    /**
     * The color channel the image is made from.
     */
    private ColorChannel channel = ColorChannel.RED;

    /**
     * Where to write the rendered image.
     */
    private String pngPath = "image.png";

    /**
     * Where to write the reconstructed image as FITS, or null to skip it.
     */
    private String fitsPath = null;

    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        if ((date == null) || !date.matches("\\d{8}")) {
            throw new IllegalArgumentException("The date must have the form yyyyMMdd, the value given was " + date);
        }
        this.date = date;
    }

    /**
     * Gets the observation number.
     *
     * @return the observation number, or null if none has been set.
     */
    public Integer getObservation() {
        return observation;
    }

    public void setObservation(Integer observation) {
        if ((observation != null) && (observation < 0)) {
            throw new IllegalArgumentException("Cannot set the observation to a negative value, the value given was "
                    + observation);
        }
        this.observation = observation;
    }

    public String getRootDirectory() {
        return rootDirectory;
    }

    public void setRootDirectory(String rootDirectory) {
        this.rootDirectory = rootDirectory;
    }

    public String getCalibrationDirectory() {
        return calibrationDirectory;
    }

    public void setCalibrationDirectory(String calibrationDirectory) {
        this.calibrationDirectory = calibrationDirectory;
    }

    /**
     * Gets the only slot to reduce.
     *
     * @return the slot number, or null if every slot is reduced.
     */
    public Integer getSlot() {
        return slot;
    }

    public void setSlot(Integer slot) {
        this.slot = slot;
    }

    public String getInstrument() {
        return instrument;
    }

    public void setInstrument(String instrument) {
        this.instrument = instrument;
    }

    public ColorChannel getChannel() {
        return channel;
    }

    public void setChannel(ColorChannel channel) {
        if (channel == null) {
            throw new IllegalArgumentException("Cannot set the color channel to null.");
        }
        this.channel = channel;
    }

    public String getPngPath() {
        return pngPath;
    }

    public void setPngPath(String pngPath) {
        this.pngPath = pngPath;
    }

    /**
     * Gets where the reconstructed image should be written as FITS.
     *
     * @return the path, or null if no FITS file is wanted.
     */
    public String getFitsPath() {
        return fitsPath;
    }

    public void setFitsPath(String fitsPath) {
        this.fitsPath = fitsPath;
    }

    /**
     * Loads the quickreduce.properties file from the given directory. Any
     * recognised properties within it replace the current settings. A missing
     * file is not an error as the user may not have created one.
     *
     * @param directory the directory to look in.
     */
    public void loadPropertiesFromFile(File directory) {
        File propertiesFile = new File(directory, PROPERTY_FILE_NAME);

        try (FileInputStream stream = new FileInputStream(propertiesFile)) {
            Properties properties = new Properties();
            properties.load(stream);
            applyProperties(properties);
            System.out.println("Successfully loaded settings from the properties file called " + propertiesFile);
        } catch (IOException ex) {
            System.out.println("Could not load settings from the properties file called " + propertiesFile
                    + ", (properties file may not exist?).");
        }
    }

    /**
     * Sets every recognised property that is present.
     *
     * @param properties the properties to apply.
     */
    public void applyProperties(Properties properties) {
        String dateProperty = properties.getProperty(DATE_PROPERTY_NAME);
        String observationProperty = properties.getProperty(OBSERVATION_PROPERTY_NAME);
        String rootProperty = properties.getProperty(ROOT_DIRECTORY_PROPERTY_NAME);
        String calibrationProperty = properties.getProperty(CALIBRATION_DIRECTORY_PROPERTY_NAME);
        String slotProperty = properties.getProperty(SLOT_PROPERTY_NAME);
        String instrumentProperty = properties.getProperty(INSTRUMENT_PROPERTY_NAME);
        String channelProperty = properties.getProperty(CHANNEL_PROPERTY_NAME);
        String pngProperty = properties.getProperty(PNG_PROPERTY_NAME);
        String fitsProperty = properties.getProperty(FITS_PROPERTY_NAME);

        if (dateProperty != null) {
            setDate(dateProperty.trim());
        }
        if (observationProperty != null) {
            setObservation(parseInteger(OBSERVATION_PROPERTY_NAME, observationProperty));
        }
        if (rootProperty != null) {
            setRootDirectory(rootProperty.trim());
        }
        if (calibrationProperty != null) {
            setCalibrationDirectory(calibrationProperty.trim());
        }
        if (slotProperty != null) {
            setSlot(parseInteger(SLOT_PROPERTY_NAME, slotProperty));
        }
        if (instrumentProperty != null) {
            setInstrument(instrumentProperty.trim());
        }
        if (channelProperty != null) {
            setChannel(ColorChannel.fromName(channelProperty));
        }
        if (pngProperty != null) {
            setPngPath(pngProperty.trim());
        }
        if (fitsProperty != null) {
            setFitsPath(fitsProperty.trim().length() > 0 ? fitsProperty.trim() : null);
        }
    }

    /**
     * Applies command line options, which take precedence over the properties
     * file.
     *
     * @param args the command line arguments.
     *
     * @throws IllegalArgumentException if an option is unknown or lacks its value.
     */
    public void applyArguments(String[] args) {
        Properties properties = new Properties();
        for (int index = 0; index < args.length; ++index) {
            String option = args[index];
            String name = propertyForOption(option);
            if (name == null) {
                throw new IllegalArgumentException("Unknown option '" + option + "'.\n" + usage());
            }
            if (index + 1 >= args.length) {
                throw new IllegalArgumentException("The option '" + option + "' needs a value.\n" + usage());
            }
            properties.setProperty(name, args[++index]);
        }
        applyProperties(properties);
    }

    /**
     * Gets a summary of the command line options.
     */
    public static String usage() {
        return "Usage: quickreduce [-d|--date yyyyMMdd] -o|--observation N [-r|--rootdir DIR]\n"
                + "                   [-c|--calibrations DIR] [-i|--ifuslot N] [--instrument NAME]\n"
                + "                   [--channel blue|green|red] [--png FILE] [--fits FILE]";
    }

    private static String propertyForOption(String option) {
        if (option.equals("-d") || option.equals("--date")) {
            return DATE_PROPERTY_NAME;
        }
        if (option.equals("-o") || option.equals("--observation")) {
            return OBSERVATION_PROPERTY_NAME;
        }
        if (option.equals("-r") || option.equals("--rootdir")) {
            return ROOT_DIRECTORY_PROPERTY_NAME;
        }
        if (option.equals("-c") || option.equals("--calibrations")) {
            return CALIBRATION_DIRECTORY_PROPERTY_NAME;
        }
        if (option.equals("-i") || option.equals("--ifuslot")) {
            return SLOT_PROPERTY_NAME;
        }
        if (option.equals("--instrument")) {
            return INSTRUMENT_PROPERTY_NAME;
        }
        if (option.equals("--channel")) {
            return CHANNEL_PROPERTY_NAME;
        }
        if (option.equals("--png")) {
            return PNG_PROPERTY_NAME;
        }
        if (option.equals("--fits")) {
            return FITS_PROPERTY_NAME;
        }
        return null;
    }

    private static Integer parseInteger(String name, String value) {
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("The " + name + " setting must be a whole number, the value given was '"
                    + value + "'.", ex);
        }
    }
}
