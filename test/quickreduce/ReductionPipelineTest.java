/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/

package quickreduce;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for the ReductionPipeline class, using an in-memory archive of
 * raw exposures.
 */
public class ReductionPipelineTest {

    // Bins at 5000, 5050, ... 5450 Angstroms, so the red channel is bins 2 to 7.
    private static final WavelengthGrid GRID = new WavelengthGrid(5000.0, 5500.0, 50.0);

    private static final int ROWS = 4;

    private static final int COLUMNS = 6;

    /**
     * Serves exact patterns from a map.
     */
    static class MapFileLocator implements FileLocator {

        final Map<String, List<String>> files = new HashMap<String, List<String>>();

        public List<String> find(String pattern) {
            List<String> found = files.get(pattern);
            return found == null ? Collections.<String>emptyList() : found;
        }
    }

    /**
     * Serves frames from a map.
     */
    static class MapFrameLoader implements FrameLoader {

        final Map<String, RawFrame> frames = new HashMap<String, RawFrame>();

        final List<String> loaded = new ArrayList<String>();

        public RawFrame load(String filename) throws IOException {
            if (!frames.containsKey(filename)) {
                throw new IOException("There is no exposure called " + filename);
            }
            loaded.add(filename);
            return frames.get(filename);
        }

        void put(String filename, double value) {
            double[][] pixels = new double[ROWS][COLUMNS];
            for (double[] row : pixels) {
                Arrays.fill(row, value);
            }
            frames.put(filename, new RawFrame(pixels, 1.0, 3.0, "L", "L", Optional.<String>empty()));
        }
    }

    private ReductionSettings settings;

    private MapFileLocator locator;

    private MapFrameLoader loader;

    public ReductionPipelineTest() {
    }

    @BeforeClass
    public static void setUpClass() throws Exception {
    }

    @AfterClass
    public static void tearDownClass() throws Exception {
    }

    @Before
    public void setUp() {
        settings = new ReductionSettings();
        settings.setRootDirectory("/raw");
        settings.setDate("20181108");
        settings.setObservation(12);

        locator = new MapFileLocator();
        loader = new MapFrameLoader();
    }

    @After
    public void tearDown() {
    }

    private static CalibrationRecord record(int slot) {
        double[][] positions = {{0.0, 0.0}};
        double[][] trace = {{1.0, 1.0, 1.0, 1.0, 1.0, 1.0}};
        double[][] wavelength = {{5000.0, 5100.0, 5200.0, 5300.0, 5400.0, 5500.0}};
        return new CalibrationRecord(slot, "LL", positions, wavelength, trace, MasterBias.none());
    }

    private String twilightPattern(String date) {
        return RawFilePaths.buildPath("/raw", date, RawFilePaths.WILDCARD, "012", "LL", RawFilePaths.TWILIGHT,
                RawFilePaths.ANY_EXPOSURE, "virus");
    }

    private String sciencePattern() {
        return RawFilePaths.buildPath("/raw", "20181108", "0000012", "012", "LL", RawFilePaths.SCIENCE,
                RawFilePaths.ANY_EXPOSURE, "virus");
    }

    private ReductionPipeline pipeline() {
        return new ReductionPipeline(settings, locator, loader, GRID, new SpatialReconstructor(25.0, 5));
    }

    /**
     * Test of reduce method, of class ReductionPipeline.
     */
    @Test
    public void testReduce() throws IOException {
        locator.files.put(twilightPattern("20181108"), Arrays.asList("twi1", "twi2"));
        locator.files.put(sciencePattern(), Arrays.asList("sci3", "sci1", "sci2"));
        loader.put("twi1", 2.0);
        loader.put("twi2", 2.0);
        loader.put("sci1", 6.0);
        loader.put("sci2", 6.0);
        loader.put("sci3", 6.0);

        ReductionResult result = pipeline().reduce(Collections.singletonList(record(12)));

        DitherTable table = result.getTable();
        assertEquals(3, table.getRowCount());
        assertEquals(0.0, table.getX(0), 1e-12);
        assertEquals(1.27, table.getX(1), 1e-12);
        assertEquals(-0.73, table.getY(1), 1e-12);
        assertEquals(0.73, table.getY(2), 1e-12);
        assertEquals(2.0, table.getTwilight(0)[4], 1e-12);
        assertEquals(3.0, table.getScience(2)[4], 1e-12);

        assertArrayEquals(new double[] {6.0, 6.0, 6.0}, result.getIntensities(), 1e-9);
        assertEquals(5, result.getImage().length);
        for (double[] row : result.getImage()) {
            for (double value : row) {
                assertEquals(6.0, value, 1e-9);
            }
        }

        // Exposures are reduced in name order, after the calibration frames.
        assertEquals(Arrays.asList("twi1", "twi2", "sci1", "sci2", "sci3"), loader.loaded);
    }

    @Test
    public void testReduceWithEarlierCalibrations() throws IOException {
        locator.files.put(twilightPattern("20181105"), Collections.singletonList("twi1"));
        locator.files.put(sciencePattern(), Collections.singletonList("sci1"));
        loader.put("twi1", 4.0);
        loader.put("sci1", 8.0);

        DitherTable table = pipeline().reduceRecord(record(12));

        assertEquals(1, table.getRowCount());
        assertEquals(4.0, table.getTwilight(0)[0], 1e-12);
        assertEquals(2.0, table.getScience(0)[0], 1e-12);
    }

    @Test(expected = IllegalStateException.class)
    public void testReduceWithoutCalibrations() throws IOException {
        locator.files.put(sciencePattern(), Collections.singletonList("sci1"));
        loader.put("sci1", 6.0);

        pipeline().reduce(Collections.singletonList(record(12)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTooManyExposures() throws IOException {
        locator.files.put(twilightPattern("20181108"), Collections.singletonList("twi1"));
        locator.files.put(sciencePattern(), Arrays.asList("sci1", "sci2", "sci3", "sci4"));
        loader.put("twi1", 2.0);
        for (int exposure = 1; exposure <= 4; ++exposure) {
            loader.put("sci" + exposure, 6.0);
        }

        pipeline().reduceRecord(record(12));
    }

    @Test
    public void testReduceOnlyRequestedSlot() throws IOException {
        locator.files.put(twilightPattern("20181108"), Collections.singletonList("twi1"));
        locator.files.put(sciencePattern(), Collections.singletonList("sci1"));
        loader.put("twi1", 2.0);
        loader.put("sci1", 6.0);
        settings.setSlot(12);

        // Slot 47 has no raw data and would fail if it were reduced.
        ReductionResult result = pipeline().reduce(Arrays.asList(record(47), record(12)));

        assertEquals(1, result.getTable().getRowCount());
    }

    @Test(expected = IllegalStateException.class)
    public void testReduceWithoutScienceExposures() throws IOException {
        locator.files.put(twilightPattern("20181108"), Collections.singletonList("twi1"));
        loader.put("twi1", 2.0);

        pipeline().reduce(Collections.singletonList(record(12)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPipelineNeedsObservation() {
        settings.setObservation(null);
        pipeline();
    }
}
