/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/

package quickreduce;

import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Unit tests for the RobustStatistics class.
 */
public class RobustStatisticsTest {

    public RobustStatisticsTest() {
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

    /**
     * Test of median method, of class RobustStatistics.
     */
    @Test
    public void testMedian() {
        assertEquals(2.0, RobustStatistics.median(new double[] {3.0, 1.0, 2.0}), 1e-12);
        assertEquals(2.5, RobustStatistics.median(new double[] {4.0, 1.0, 3.0, 2.0}), 1e-12);

        double[][] image = {{1.0, 9.0}, {5.0, 7.0}};
        assertEquals(6.0, RobustStatistics.median(image), 1e-12);
    }

    /**
     * Test of percentile method, of class RobustStatistics.
     */
    @Test
    public void testPercentile() {
        double[] values = {5.0, 4.0, 3.0, 2.0, 1.0};
        assertEquals(1.8, RobustStatistics.percentile(values, 20.0), 1e-12);
        assertEquals(3.0, RobustStatistics.percentile(values, 50.0), 1e-12);
        assertEquals(5.0, RobustStatistics.percentile(values, 100.0), 1e-12);
    }

    /**
     * Test of biweightLocation method, of class RobustStatistics.
     */
    @Test
    public void testBiweightLocation() {
        // The outlier gets no weight at all.
        double[] values = {1.0, 2.0, 3.0, 4.0, 100.0};
        assertEquals(2.5706499, RobustStatistics.biweightLocation(values), 1e-6);
    }

    @Test
    public void testBiweightLocationOfConstantValues() {
        double[] values = {7.0, 7.0, 7.0, 7.0, 1000.0};
        assertEquals(7.0, RobustStatistics.biweightLocation(values), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMedianOfEmptyArray() {
        RobustStatistics.median(new double[0]);
    }
}
