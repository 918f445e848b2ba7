/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a master flat (twilight) frame from several calibration exposures of
 * the same amplifier.
 */
public class MasterFlatBuilder {

    /**
     * Loads the calibration exposures.
     */
    private final FrameLoader loader;

    /**
     * Preprocesses each calibration exposure.
     */
    private final DetectorPreprocessor preprocessor;

    public MasterFlatBuilder(FrameLoader loader, DetectorPreprocessor preprocessor) {
        if (loader == null) {
            throw new IllegalArgumentException("Cannot build master flats without a frame loader.");
        }
        if (preprocessor == null) {
            throw new IllegalArgumentException("Cannot build master flats without a detector preprocessor.");
        }
        this.loader = loader;
        this.preprocessor = preprocessor;
    }

    /**
     * Loads, preprocesses and bias subtracts the named calibration exposures
     * and combines them into a master flat.
     *
     * @param filenames the calibration exposures to combine.
     * @param bias the master bias of the amplifier.
     * @return the master flat.
     *
     * @throws IOException if one of the exposures could not be read.
     * @throws IllegalStateException if no exposures were given.
     */
    public double[][] build(List<String> filenames, MasterBias bias) throws IOException {
        if ((filenames == null) || filenames.isEmpty()) {
            throw new IllegalStateException("Cannot build a master flat as no calibration exposures were found.");
        }

        List<double[][]> frames = new ArrayList<double[][]>();
        for (String filename : filenames) {
            ReducedFrame reduced = preprocessor.preprocess(loader.load(filename));
            frames.add(bias.subtractFrom(reduced.getFlux()));
        }
        return combine(frames);
    }

    /**
     * Combines frames into a master flat. Each frame is divided by its own
     * median, the per-pixel median of the normalised frames is taken and the
     * result is multiplied by the median of the frame medians, so the master
     * flat keeps the scale of its inputs.
     *
     * @param frames the frames to combine, all of the same size.
     * @return the combined frame.
     */
    public static double[][] combine(List<double[][]> frames) {
        if ((frames == null) || frames.isEmpty()) {
            throw new IllegalStateException("Cannot combine an empty list of frames into a master flat.");
        }

        final int count = frames.size();
        final int rows = frames.get(0).length;
        final int columns = frames.get(0)[0].length;

        double[] norms = new double[count];
        for (int index = 0; index < count; ++index) {
            double[][] frame = frames.get(index);
            if ((frame.length != rows) || (frame[0].length != columns)) {
                throw new IllegalArgumentException("Cannot combine frame " + index + " of size " + frame.length + "x"
                        + frame[0].length + " with frames of size " + rows + "x" + columns + ".");
            }
            norms[index] = RobustStatistics.median(frame);
        }
        final double scale = RobustStatistics.median(norms);

        double[][] master = new double[rows][columns];
        double[] stack = new double[count];
        for (int row = 0; row < rows; ++row) {
            for (int column = 0; column < columns; ++column) {
                for (int index = 0; index < count; ++index) {
                    stack[index] = frames.get(index)[row][column] / norms[index];
                }
                master[row][column] = RobustStatistics.median(stack) * scale;
            }
        }
        return master;
    }
}
