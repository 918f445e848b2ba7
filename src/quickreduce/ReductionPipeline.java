/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The ReductionPipeline coordinates a reduction run. For every calibration
 * record (one amplifier of one slot) it builds the master flat, extracts the
 * spectra of every science exposure and collects them with their dithered sky
 * positions. The collected spectra are then normalised into one intensity per
 * sample and resampled onto the sky grid.
 *
 * <p>Records are reduced one after the other, each with its own working state;
 * the row order of the result follows the record order, then the exposure
 * order, then the fiber order.</p>
 */
public class ReductionPipeline {

    private final ReductionSettings settings;

    private final FileLocator locator;

    private final FrameLoader loader;

    private final WavelengthGrid grid;

    private final DetectorPreprocessor preprocessor;

    private final CalibrationDateResolver resolver;

    private final MasterFlatBuilder flatBuilder;

    private final FiberSpectrumExtractor extractor;

    private final FluxNormalizer normalizer;

    private final SpatialReconstructor reconstructor;

    public ReductionPipeline(ReductionSettings settings, FileLocator locator, FrameLoader loader) {
        this(settings, locator, loader, WavelengthGrid.DEFAULT, new SpatialReconstructor());
    }

    public ReductionPipeline(ReductionSettings settings, FileLocator locator, FrameLoader loader,
                             WavelengthGrid grid, SpatialReconstructor reconstructor) {
        if ((settings == null) || (locator == null) || (loader == null) || (grid == null) || (reconstructor == null)) {
            throw new IllegalArgumentException("Cannot create a reduction pipeline with null collaborators.");
        }
        if (settings.getObservation() == null) {
            throw new IllegalArgumentException("Cannot create a reduction pipeline as no observation was given.");
        }
        this.settings = settings;
        this.locator = locator;
        this.loader = loader;
        this.grid = grid;
        this.reconstructor = reconstructor;
        this.preprocessor = new DetectorPreprocessor();
        this.resolver = new CalibrationDateResolver(locator);
        this.flatBuilder = new MasterFlatBuilder(loader, preprocessor);
        this.extractor = new FiberSpectrumExtractor(grid);
        this.normalizer = new FluxNormalizer(grid);
    }

    /**
     * Reduces the observation using the given calibration records. Records of
     * other slots are skipped when a single slot was requested.
     *
     * @param records the calibration records, in reduction order.
     * @return the dithered samples, their intensities and the sky image.
     *
     * @throws IOException if an exposure could not be read.
     * @throws IllegalStateException if an amplifier has no calibration
     *         exposures or no science exposures were found at all.
     */
    public ReductionResult reduce(List<CalibrationRecord> records) throws IOException {
        DitherTableBuilder builder = new DitherTableBuilder(grid.size());
        for (CalibrationRecord record : records) {
            if ((settings.getSlot() != null) && (record.getSlot() != settings.getSlot().intValue())) {
                continue;
            }
            System.out.println("Reducing ifuslot: " + record.getSlotId() + record.getAmplifier());
            builder.addAll(reduceRecord(record));
        }

        DitherTable table = builder.build();
        if (table.getRowCount() == 0) {
            throw new IllegalStateException("No science exposures were found for observation "
                    + settings.getObservation() + " on " + settings.getDate() + ".");
        }

        double[] intensities = normalizer.normalize(table, settings.getChannel());
        double[][] image = reconstructor.reconstruct(table.getPositions(), intensities);
        System.out.println("Done base reduction of " + table.getRowCount() + " fiber samples.");
        return new ReductionResult(table, intensities, image);
    }

    /**
     * Reduces every science exposure of one amplifier.
     *
     * @param record the calibration record of the amplifier.
     * @return the dithered samples of the amplifier.
     *
     * @throws IOException if an exposure could not be read.
     */
    public DitherTable reduceRecord(CalibrationRecord record) throws IOException {
        final String slot = record.getSlotId();
        final String amplifier = record.getAmplifier();

        String twilightTemplate = RawFilePaths.buildPath(settings.getRootDirectory(), settings.getDate(),
                RawFilePaths.WILDCARD, slot, amplifier, RawFilePaths.TWILIGHT, RawFilePaths.ANY_EXPOSURE,
                settings.getInstrument());
        CalibrationLookup lookup = resolver.resolve(twilightTemplate, settings.getDate());
        if (lookup.isFound() && !lookup.getDate().equals(settings.getDate())) {
            System.out.println("Found twi files on " + lookup.getDate() + " and using them for " + settings.getDate());
        }

        System.out.println("Making master flat for " + slot + amplifier);
        double[][] masterFlat = flatBuilder.build(locator.find(lookup.getPath()), record.getMasterBias());
        System.out.println("Done making master flat for " + slot + amplifier);

        String sciencePattern = RawFilePaths.buildPath(settings.getRootDirectory(), settings.getDate(),
                RawFilePaths.observationId(settings.getObservation()), slot, amplifier, RawFilePaths.SCIENCE,
                RawFilePaths.ANY_EXPOSURE, settings.getInstrument());
        List<String> exposures = new ArrayList<String>(locator.find(sciencePattern));
        Collections.sort(exposures);
        if (exposures.size() > DitherPattern.size()) {
            throw new IllegalArgumentException("Found " + exposures.size() + " science exposures for " + slot
                    + amplifier + " but the dither pattern only has " + DitherPattern.size() + " positions.");
        }

        DitherTableBuilder builder = new DitherTableBuilder(grid.size());
        for (int exposure = 0; exposure < exposures.size(); ++exposure) {
            ReducedFrame reduced = preprocessor.preprocess(loader.load(exposures.get(exposure)));
            double[][] science = record.getMasterBias().subtractFrom(reduced.getFlux());
            ExtractedSpectra spectra = extractor.extract(science, masterFlat, record.getTrace(),
                    record.getWavelength());
            builder.addExposure(record.getFiberPositions(), exposure, spectra);
        }
        return builder.build();
    }
}
