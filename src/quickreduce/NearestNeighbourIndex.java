/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the nearest of a fixed set of points in the plane. The points are
 * sorted into square buckets and a query searches rings of buckets outwards
 * from its own bucket until no closer point can remain.
 */
public class NearestNeighbourIndex {

    private final double[] xs;

    private final double[] ys;

    private final double minX;

    private final double minY;

    private final double cellSize;

    private final int cellColumns;

    private final int cellRows;

    /**
     * Point indices of each bucket, indexed [cellRow * cellColumns + cellColumn].
     */
    private final List<List<Integer>> cells;

    /**
     * Builds an index over points.
     *
     * @param points the (x, y) coordinates of each point, at least one.
     */
    public NearestNeighbourIndex(double[][] points) {
        if ((points == null) || (points.length == 0)) {
            throw new IllegalArgumentException("Cannot index an empty set of points.");
        }

        final int count = points.length;
        xs = new double[count];
        ys = new double[count];
        double lowX = Double.MAX_VALUE;
        double lowY = Double.MAX_VALUE;
        double highX = -Double.MAX_VALUE;
        double highY = -Double.MAX_VALUE;
        for (int index = 0; index < count; ++index) {
            if (Double.isNaN(points[index][0]) || Double.isNaN(points[index][1])
                    || Double.isInfinite(points[index][0]) || Double.isInfinite(points[index][1])) {
                throw new IllegalArgumentException("Cannot index point " + index + " as its position is not finite.");
            }
            xs[index] = points[index][0];
            ys[index] = points[index][1];
            lowX = Math.min(lowX, xs[index]);
            lowY = Math.min(lowY, ys[index]);
            highX = Math.max(highX, xs[index]);
            highY = Math.max(highY, ys[index]);
        }

        // Aim for about one point per bucket.
        final double width = Math.max(highX - lowX, highY - lowY);
        final double size = width / Math.ceil(Math.sqrt(count));
        cellSize = size > 0.0 ? size : 1.0;
        minX = lowX;
        minY = lowY;
        cellColumns = (int) Math.floor((highX - lowX) / cellSize) + 1;
        cellRows = (int) Math.floor((highY - lowY) / cellSize) + 1;

        cells = new ArrayList<List<Integer>>(cellColumns * cellRows);
        for (int cell = 0; cell < cellColumns * cellRows; ++cell) {
            cells.add(new ArrayList<Integer>());
        }
        for (int index = 0; index < count; ++index) {
            int column = cellColumn(xs[index]);
            int row = cellRow(ys[index]);
            cells.get(row * cellColumns + column).add(index);
        }
    }

    public int size() {
        return xs.length;
    }

    /**
     * Finds the point closest to (x, y). When several points are equally close
     * the one with the lowest index is returned.
     *
     * @return the index of the nearest point.
     */
    public int nearest(double x, double y) {
        final int queryColumn = (int) Math.floor((x - minX) / cellSize);
        final int queryRow = (int) Math.floor((y - minY) / cellSize);

        // Ring beyond which every bucket is off the grid.
        final int lastRing = Math.max(Math.max(Math.abs(queryColumn), Math.abs(cellColumns - 1 - queryColumn)),
                Math.max(Math.abs(queryRow), Math.abs(cellRows - 1 - queryRow)));

        int best = -1;
        double bestDistance = Double.MAX_VALUE;
        for (int ring = 0; ring <= lastRing; ++ring) {
            for (int row = queryRow - ring; row <= queryRow + ring; ++row) {
                if ((row < 0) || (row >= cellRows)) {
                    continue;
                }
                boolean edgeRow = (row == queryRow - ring) || (row == queryRow + ring);
                int step = edgeRow ? 1 : 2 * ring;
                for (int column = queryColumn - ring; column <= queryColumn + ring; column += Math.max(step, 1)) {
                    if ((column < 0) || (column >= cellColumns)) {
                        continue;
                    }
                    for (Integer index : cells.get(row * cellColumns + column)) {
                        double dx = xs[index] - x;
                        double dy = ys[index] - y;
                        double distance = dx * dx + dy * dy;
                        if ((distance < bestDistance) || ((distance == bestDistance) && (index < best))) {
                            best = index;
                            bestDistance = distance;
                        }
                    }
                }
            }

            // Points in later rings are at least ring * cellSize away.
            double reach = ring * cellSize;
            if ((best >= 0) && (bestDistance < reach * reach)) {
                break;
            }
        }
        return best;
    }

    private int cellColumn(double x) {
        return Math.min(cellColumns - 1, (int) Math.floor((x - minX) / cellSize));
    }

    private int cellRow(double y) {
        return Math.min(cellRows - 1, (int) Math.floor((y - minY) / cellSize));
    }
}
