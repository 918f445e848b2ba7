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
 * Unit tests for the MasterBias class.
 */
public class MasterBiasTest {

    /**
     * Test of subtractFrom method, of class MasterBias.
     */
    @Test
    public void testSubtractFrom() {
        double[][] image = {{5.0, 6.0}, {7.0, 8.0}};
        MasterBias bias = MasterBias.of(new double[][] {{1.0, 2.0}, {3.0, 4.0}});

        double[][] result = bias.subtractFrom(image);

        assertTrue(bias.isPresent());
        assertArrayEquals(new double[] {4.0, 4.0}, result[0], 0.0);
        assertArrayEquals(new double[] {4.0, 4.0}, result[1], 0.0);
        assertEquals(5.0, image[0][0], 0.0);
    }

    @Test
    public void testNoBiasLeavesImageUnchanged() {
        double[][] image = {{5.0, 6.0}};
        double[][] result = MasterBias.none().subtractFrom(image);

        assertFalse(MasterBias.none().isPresent());
        assertFalse(MasterBias.none().getFrame().isPresent());
        assertArrayEquals(image[0], result[0], 0.0);
        assertNotSame(image[0], result[0]);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSubtractFromDifferentSize() {
        MasterBias.of(new double[2][2]).subtractFrom(new double[2][3]);
    }
}
