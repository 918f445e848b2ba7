/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/

package quickreduce;

import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for the DitherTableBuilder class.
 */
public class DitherTableBuilderTest {

    private static ExtractedSpectra spectra(double... science) {
        double[][] twilight = new double[science.length][2];
        double[][] flux = new double[science.length][2];
        for (int fiber = 0; fiber < science.length; ++fiber) {
            twilight[fiber][0] = 1.0;
            twilight[fiber][1] = 1.0;
            flux[fiber][0] = science[fiber];
            flux[fiber][1] = science[fiber];
        }
        return new ExtractedSpectra(twilight, flux);
    }

    /**
     * Test of addExposure method, of class DitherTableBuilder.
     */
    @Test
    public void testAddExposureAppliesDitherOffset() {
        double[][] positions = {{1.0, 2.0}, {-3.0, 4.0}};
        DitherTableBuilder builder = new DitherTableBuilder(2);

        builder.addExposure(positions, 0, spectra(10.0, 20.0));
        builder.addExposure(positions, 1, spectra(30.0, 40.0));
        builder.addExposure(positions, 2, spectra(50.0, 60.0));
        DitherTable table = builder.build();

        assertEquals(6, table.getRowCount());
        assertEquals(2, table.getBinCount());
        assertEquals(1.0, table.getX(0), 1e-12);
        assertEquals(2.0, table.getY(0), 1e-12);
        assertEquals(-3.0 + 1.27, table.getX(3), 1e-12);
        assertEquals(4.0 - 0.73, table.getY(3), 1e-12);
        assertEquals(1.0 + 1.27, table.getX(4), 1e-12);
        assertEquals(2.0 + 0.73, table.getY(4), 1e-12);
        assertEquals(40.0, table.getScience(3)[0], 0.0);
        assertEquals(60.0, table.getScience(5)[1], 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFourthExposureIsRejected() {
        new DitherTableBuilder(2).addExposure(new double[][] {{0.0, 0.0}}, 3, spectra(1.0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAddRowWithWrongBinCount() {
        new DitherTableBuilder(3).addRow(0.0, 0.0, new double[3], new double[2]);
    }

    /**
     * Test of addAll and build methods, of class DitherTableBuilder.
     */
    @Test
    public void testBuiltTablesAreIndependent() {
        DitherTableBuilder builder = new DitherTableBuilder(2);
        double[] twilight = {1.0, 2.0};
        builder.addRow(0.5, -0.5, twilight, new double[] {3.0, 4.0});
        DitherTable first = builder.build();

        twilight[0] = 99.0;
        builder.addRow(1.5, -1.5, twilight, new double[] {5.0, 6.0});
        DitherTable second = builder.build();

        assertEquals(1, first.getRowCount());
        assertEquals(2, second.getRowCount());
        assertEquals(1.0, first.getTwilight(0)[0], 0.0);

        DitherTableBuilder combined = new DitherTableBuilder(2).addAll(first).addAll(second);
        DitherTable table = combined.build();
        assertEquals(3, table.getRowCount());
        assertEquals(0.5, table.getX(1), 0.0);
        assertEquals(99.0, table.getTwilight(2)[0], 0.0);
    }

    /**
     * Test of offset method, of class DitherPattern.
     */
    @Test
    public void testDitherPattern() {
        assertEquals(3, DitherPattern.size());
        assertArrayEquals(new double[] {1.27, 0.73}, DitherPattern.offset(2), 0.0);
    }
}
