/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/

package quickreduce;

import java.io.File;
import java.io.IOException;
import java.util.List;

import quickreduce.plot.SkyImageFactory;

/**
 * Command line entry point which reduces one observation and writes the
 * reconstructed sky image.
 */
public class Main {

    /**
     * @param args the command line arguments
     */
    public static void main(String[] args) {
        Main application = new Main();
        System.exit(application.run(args));
    }

    /**
     * Runs a reduction.
     *
     * @param args the command line arguments.
     * @return the process exit status, 0 on success.
     */
    public int run(String[] args) {
        ReductionSettings settings = new ReductionSettings();
        try {
            settings.loadPropertiesFromFile(new File(System.getProperty("user.dir")));
            settings.applyArguments(args);
            if (settings.getObservation() == null) {
                System.err.println("No observation number was given.\n" + ReductionSettings.usage());
                return 1;
            }

            ReductionResult result = reduce(settings);
            writeProducts(settings, result);
            return 0;
        } catch (IllegalArgumentException ex) {
            System.err.println(ex.getMessage());
            return 1;
        } catch (IllegalStateException ex) {
            System.err.println("Reduction failed: " + ex.getMessage());
            return 1;
        } catch (IOException ex) {
            System.err.println("Reduction failed: " + ex.getMessage());
            ex.printStackTrace();
            return 1;
        }
    }

    ReductionResult reduce(ReductionSettings settings) throws IOException {
        CalibrationStore store = new FitsCalibrationStore(new File(settings.getCalibrationDirectory()));
        List<CalibrationRecord> records = store.loadRecords();

        ReductionPipeline pipeline = new ReductionPipeline(settings, new GlobFileLocator(), new FitsFrameReader());
        return pipeline.reduce(records);
    }

    void writeProducts(ReductionSettings settings, ReductionResult result) throws IOException {
        SkyImageFactory imageFactory = new SkyImageFactory();
        SkyImageFactory.writePng(imageFactory.generateImage(result.getImage()), new File(settings.getPngPath()));

        if (settings.getFitsPath() != null) {
            FitsImageWriter writer = new FitsImageWriter();
            writer.saveFitsImage(settings.getFitsPath(), result.getImage(), "Observation "
                    + settings.getObservation() + " on " + settings.getDate() + ", "
                    + settings.getChannel().name().toLowerCase() + " channel");
        }
    }
}
