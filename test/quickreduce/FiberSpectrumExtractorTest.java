/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/

package quickreduce;

import java.util.Arrays;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for the FiberSpectrumExtractor class.
 */
public class FiberSpectrumExtractorTest {

    private static final WavelengthGrid GRID = new WavelengthGrid(100.0, 110.0, 1.0);

    public FiberSpectrumExtractorTest() {
    }

    @BeforeClass
    public static void setUpClass() throws Exception {
    }

    @AfterClass
    public static void tearDownClass() throws Exception {
    }

    @Before
    public void setUp() {
    }

    @After
    public void tearDown() {
    }

    private static double[][] filled(int rows, int columns, double value) {
        double[][] image = new double[rows][columns];
        for (double[] row : image) {
            Arrays.fill(row, value);
        }
        return image;
    }

    /**
     * Test of resample method, of class FiberSpectrumExtractor.
     */
    @Test
    public void testResample() {
        double[] wavelength = {10.0, 20.0, 30.0};
        double[] flux = {1.0, 2.0, 3.0};
        double[] target = {5.0, 10.0, 15.0, 30.0, 35.0};

        double[] result = FiberSpectrumExtractor.resample(wavelength, flux, target);

        assertArrayEquals(new double[] {0.0, 1.0, 1.5, 3.0, 0.0}, result, 1e-12);
    }

    @Test
    public void testResampleReplacesNonFiniteValues() {
        double[] wavelength = {10.0, 20.0, 30.0};
        double[] flux = {1.0, Double.POSITIVE_INFINITY, 3.0};

        double[] result = FiberSpectrumExtractor.resample(wavelength, flux, new double[] {15.0, 25.0});

        assertEquals(0.0, result[0], 0.0);
        assertEquals(0.0, result[1], 0.0);
    }

    /**
     * Test of isWithinFrame method, of class FiberSpectrumExtractor.
     */
    @Test
    public void testIsWithinFrame() {
        assertTrue(FiberSpectrumExtractor.isWithinFrame(new double[] {0.0, 1.5, 2.0}, 3));
        assertFalse(FiberSpectrumExtractor.isWithinFrame(new double[] {0.0, 2.5}, 3));
        assertFalse(FiberSpectrumExtractor.isWithinFrame(new double[] {1.0, -0.5}, 3));
        assertFalse(FiberSpectrumExtractor.isWithinFrame(new double[] {1.0, Double.NaN}, 3));
    }

    /**
     * Test of extract method, of class FiberSpectrumExtractor.
     */
    @Test
    public void testExtract() {
        double[][] flat = filled(4, 5, 2.0);
        double[][] science = filled(4, 5, 6.0);
        double[][] trace = {
            {1.0, 1.0, 1.0, 1.0, 1.0},
            {3.5, 3.5, 3.5, 3.5, 3.5}
        };
        double[][] wavelength = {
            {100.0, 102.0, 104.0, 106.0, 108.0},
            {100.0, 102.0, 104.0, 106.0, 108.0}
        };

        ExtractedSpectra spectra = new FiberSpectrumExtractor(GRID).extract(science, flat, trace, wavelength);

        assertEquals(2, spectra.getFiberCount());
        double[] twilight = spectra.getTwilight()[0];
        double[] flatFielded = spectra.getScience()[0];
        assertEquals(GRID.size(), twilight.length);
        for (int bin = 0; bin < 9; ++bin) {
            assertEquals(2.0, twilight[bin], 1e-12);
            assertEquals(3.0, flatFielded[bin], 1e-12);
        }
        // 109 Angstroms lies beyond the fiber's wavelength solution.
        assertEquals(0.0, twilight[9], 0.0);
        assertEquals(0.0, flatFielded[9], 0.0);

        // The second trace runs off the bottom of the detector.
        assertArrayEquals(new double[GRID.size()], spectra.getTwilight()[1], 0.0);
        assertArrayEquals(new double[GRID.size()], spectra.getScience()[1], 0.0);
    }

    @Test
    public void testExtractBetweenRows() {
        double[][] flat = filled(3, 2, 1.0);
        double[][] science = {{0.0, 0.0}, {2.0, 4.0}, {6.0, 8.0}};
        double[][] trace = {{1.5, 1.5}};
        double[][] wavelength = {{100.0, 101.0}};

        ExtractedSpectra spectra = new FiberSpectrumExtractor(GRID).extract(science, flat, trace, wavelength);

        assertEquals(4.0, spectra.getScience()[0][0], 1e-12);
        assertEquals(6.0, spectra.getScience()[0][1], 1e-12);
        assertEquals(0.0, spectra.getScience()[0][2], 0.0);
        assertEquals(1.0, spectra.getTwilight()[0][0], 1e-12);
    }

    @Test
    public void testExtractSkipsDecreasingWavelengths() {
        double[][] flat = filled(2, 3, 1.0);
        double[][] science = filled(2, 3, 1.0);
        double[][] trace = {{0.0, 0.0, 0.0}};
        double[][] wavelength = {{104.0, 102.0, 100.0}};

        ExtractedSpectra spectra = new FiberSpectrumExtractor(GRID).extract(science, flat, trace, wavelength);

        assertArrayEquals(new double[GRID.size()], spectra.getScience()[0], 0.0);
    }

    @Test
    public void testExtractSkipsNonFiniteWavelengths() {
        WavelengthGrid grid = new WavelengthGrid(98.0, 110.0, 1.0);
        double[][] flat = filled(2, 3, 1.0);
        double[][] science = filled(2, 3, 1.0);
        double[][] trace = {{0.0, 0.0, 0.0}, {1.0, 1.0, 1.0}};
        double[][] wavelength = {{Double.NaN, 102.0, 104.0}, {100.0, 102.0, 104.0}};

        ExtractedSpectra spectra = new FiberSpectrumExtractor(grid).extract(science, flat, trace, wavelength);

        assertArrayEquals(new double[grid.size()], spectra.getScience()[0], 0.0);
        assertArrayEquals(new double[grid.size()], spectra.getTwilight()[0], 0.0);
        // 100 Angstroms is bin 2 of this grid.
        assertEquals(1.0, spectra.getScience()[1][2], 1e-12);
    }

    /**
     * Test of isUsableWavelength method, of class FiberSpectrumExtractor.
     */
    @Test
    public void testIsUsableWavelength() {
        assertTrue(FiberSpectrumExtractor.isUsableWavelength(new double[] {100.0, 102.0, 104.0}));
        assertFalse(FiberSpectrumExtractor.isUsableWavelength(new double[] {100.0, 100.0, 104.0}));
        assertFalse(FiberSpectrumExtractor.isUsableWavelength(new double[] {100.0, Double.NaN, 104.0}));
        assertFalse(FiberSpectrumExtractor.isUsableWavelength(new double[] {100.0, 102.0,
            Double.POSITIVE_INFINITY}));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testExtractMismatchedFlat() {
        new FiberSpectrumExtractor(GRID).extract(new double[2][3], new double[2][4], new double[0][], new double[0][]);
    }
}
