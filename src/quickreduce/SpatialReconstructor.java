/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

/**
 * Resamples the irregularly placed fiber intensities onto a uniform square
 * grid on the sky. Every grid node takes the intensity of the nearest sample,
 * which never extrapolates beyond the sampled values.
 */
public class SpatialReconstructor {

    /**
     * Half-width of the default grid, in sky position units.
     */
    public static final double DEFAULT_EXTENT = 25.0;

    /**
     * Number of nodes along each axis of the default grid.
     */
    public static final int DEFAULT_SIZE = 401;

    private final double extent;

    private final int size;

    public SpatialReconstructor() {
        this(DEFAULT_EXTENT, DEFAULT_SIZE);
    }

    /**
     * Creates a reconstructor for a grid spanning [-extent, extent] on both
     * axes.
     *
     * @param extent the half-width of the grid.
     * @param size the number of nodes along each axis, at least two.
     */
    public SpatialReconstructor(double extent, int size) {
        if (extent <= 0.0) {
            throw new IllegalArgumentException("Cannot reconstruct an image with an extent of " + extent + ".");
        }
        if (size < 2) {
            throw new IllegalArgumentException("Cannot reconstruct an image with " + size + " nodes per axis.");
        }
        this.extent = extent;
        this.size = size;
    }

    public double getExtent() {
        return extent;
    }

    public int getSize() {
        return size;
    }

    /**
     * Gets the coordinates of the grid nodes along either axis, evenly spaced
     * from -extent to extent inclusive.
     */
    public double[] axis() {
        double[] axis = new double[size];
        final double spacing = 2.0 * extent / (size - 1);
        for (int index = 0; index < size; ++index) {
            axis[index] = -extent + index * spacing;
        }
        axis[size - 1] = extent;
        return axis;
    }

    /**
     * Interpolates samples onto the grid.
     *
     * @param positions the (x, y) position of each sample.
     * @param values the value of each sample.
     * @return the image, indexed [y][x] with y and x increasing with the index.
     */
    public double[][] reconstruct(double[][] positions, double[] values) {
        if ((positions == null) || (values == null) || (positions.length != values.length)) {
            throw new IllegalArgumentException("Cannot reconstruct an image as the sample positions and values "
                    + "are missing or differ in number.");
        }

        NearestNeighbourIndex index = new NearestNeighbourIndex(positions);
        double[] axis = axis();
        double[][] image = new double[size][size];
        for (int row = 0; row < size; ++row) {
            for (int column = 0; column < size; ++column) {
                image[row][column] = values[index.nearest(axis[column], axis[row])];
            }
        }
        return image;
    }
}
