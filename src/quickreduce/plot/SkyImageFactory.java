/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/

/******************************************************************************
*
*  File      :  SkyImageFactory.java
*
*  Overview
*  ========
*
*    The SkyImageFactory takes reconstructed sky images (two-dimensional
*  arrays of intensity) and generates greyscale images suitable for display.
*  The intensities are smoothed with a Gaussian kernel, their median is
*  removed and the display range is clipped to the 2nd and 98th percentiles.
*
******************************************************************************/

package quickreduce.plot;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import javax.imageio.ImageIO;

import quickreduce.RobustStatistics;

public class SkyImageFactory
{
  /**
   * Standard deviation (in grid cells) of the default smoothing kernel.
   */
  public static final double DEFAULT_SMOOTHING = 7.0;

  public static final double LOW_PERCENTILE = 2.0;

  public static final double HIGH_PERCENTILE = 98.0;

  double smoothing;        // Standard deviation of the smoothing kernel.
  int[] colourmap;         // ARGB colourmap.
  int maxComponent;        // Number of colourmap entries.
  double lowestLevel;      // Intensity drawn with the first colourmap entry.
  double highestLevel;     // Intensity drawn with the last colourmap entry.

  //*******************************************************************
  /**
   * Constructs a SkyImageFactory which produces greyscale images smoothed
   * with the default kernel.
   */
  public SkyImageFactory()
  {
    this(DEFAULT_SMOOTHING);
  }

  //*******************************************************************
  /**
   * Constructs a SkyImageFactory which produces greyscale images.
   * @param smoothing - standard deviation of the Gaussian smoothing kernel in
   *                    grid cells, or 0 for no smoothing.
   */
  public SkyImageFactory(double smoothing)
  {
    if (smoothing < 0.0)
    {
      throw new IllegalArgumentException("Cannot smooth images with a kernel width of " + smoothing);
    }
    this.smoothing = smoothing;
    maxComponent = 256;

    loadColourmapGrey();
  }

  //*******************************************************************
  // Draws a sky image into an image buffer. Row 0 of the data (the lowest y)
  // is drawn at the bottom of the image.
  public BufferedImage generateImage(double[][] data)
  {
    if ( (data == null) || (data.length == 0) || (data[0].length == 0) )
    {
      throw new IllegalArgumentException("Cannot generate an image if the source data array is null or empty");
    }

    double[][] display = prepare(data);

    int numrows = display.length;
    int numcolumns = display[0].length;
    double range = highestLevel - lowestLevel;

    BufferedImage image = new BufferedImage(numcolumns, numrows, BufferedImage.TYPE_INT_ARGB);

    for (int row = 0; row < numrows; ++row)
    {
      for (int column = 0; column < numcolumns; ++column)
      {
        int yDest = (numrows-row-1);  // nb. reverse image in y-direction.
        double intensity = display[row][column];

        int index = 0;
        if (range > 0.0)
        {
          index = (int) Math.floor((intensity - lowestLevel) / range * (maxComponent-1.0));
        }
        index = Math.max(0, Math.min(maxComponent-1, index));

        image.setRGB(column, yDest, colourmap[index]);
      }
    }

    return image;
  }

  //*******************************************************************
  // Smooths the data, removes its median and sets the display range.
  double[][] prepare(double[][] data)
  {
    double[][] display = smooth(data, smoothing);

    double median = RobustStatistics.median(display);
    for (double[] row : display)
    {
      for (int column = 0; column < row.length; ++column)
      {
        row[column] -= median;
      }
    }

    double[] values = flatten(display);
    lowestLevel = RobustStatistics.percentile(values, LOW_PERCENTILE);
    highestLevel = RobustStatistics.percentile(values, HIGH_PERCENTILE);

    return display;
  }

  //*******************************************************************
  /**
   * Convolves the data with a normalised Gaussian kernel of 8 sigma + 1
   * cells. Cells beyond the edge take the value of the nearest edge cell.
   * @param data - the image to smooth, not modified.
   * @param sigma - the standard deviation of the kernel in cells.
   * @return the smoothed image.
   */
  public static double[][] smooth(double[][] data, double sigma)
  {
    int numrows = data.length;
    int numcolumns = data[0].length;

    double[][] result = new double[numrows][];
    for (int row = 0; row < numrows; ++row)
    {
      result[row] = data[row].clone();
    }
    if (sigma <= 0.0)
    {
      return result;
    }

    double[] kernel = gaussianKernel(sigma);
    int half = kernel.length / 2;

    // The kernel is separable: smooth along rows, then along columns.
    double[][] rowPass = new double[numrows][numcolumns];
    for (int row = 0; row < numrows; ++row)
    {
      for (int column = 0; column < numcolumns; ++column)
      {
        double sum = 0.0;
        for (int k = 0; k < kernel.length; ++k)
        {
          int source = clamp(column + k - half, numcolumns);
          sum += kernel[k] * data[row][source];
        }
        rowPass[row][column] = sum;
      }
    }

    for (int row = 0; row < numrows; ++row)
    {
      for (int column = 0; column < numcolumns; ++column)
      {
        double sum = 0.0;
        for (int k = 0; k < kernel.length; ++k)
        {
          int source = clamp(row + k - half, numrows);
          sum += kernel[k] * rowPass[source][column];
        }
        result[row][column] = sum;
      }
    }

    return result;
  }

  //*******************************************************************
  // One-dimensional Gaussian weights, odd in length and summing to one.
  static double[] gaussianKernel(double sigma)
  {
    // 8 sigma + 1 taps, rounded up to odd: 57 for the default sigma of 7.
    int size = (int) (8.0 * sigma + 1.0);
    if (size % 2 == 0)
    {
      ++size;
    }

    double[] kernel = new double[size];
    int half = size / 2;
    double total = 0.0;
    for (int index = 0; index < size; ++index)
    {
      double offset = index - half;
      kernel[index] = Math.exp(-0.5 * offset * offset / (sigma * sigma));
      total += kernel[index];
    }
    for (int index = 0; index < size; ++index)
    {
      kernel[index] /= total;
    }
    return kernel;
  }

  //*******************************************************************
  /**
   * Writes an image to disk in the PNG format.
   * @param image - the image to write.
   * @param file - the destination file.
   * @throws java.io.IOException if the file could not be written.
   */
  public static void writePng(BufferedImage image, File file) throws IOException
  {
    if (!ImageIO.write(image, "png", file))
    {
      throw new IOException("No PNG image writer is available to write " + file);
    }
    System.out.println("Finished writing image " + file);
  }

  //****************************************************************************
  public void loadColourmapGrey()
  {
    int index = 0;
    int alpha = 255;
    int pixel = 0;

    colourmap = new int[maxComponent];

    for (index = 0; index < maxComponent; ++index)
    {
      pixel = ((alpha & 0xff) << 24) | ((index & 0xff) << 16) |
                  ((index & 0xff) << 8) | (index & 0xff);

      colourmap[index] = pixel;
    }
  }

  public double getLowestLevel()
  {
    return lowestLevel;
  }

  public double getHighestLevel()
  {
    return highestLevel;
  }

  private static int clamp(int index, int length)
  {
    return Math.max(0, Math.min(length - 1, index));
  }

  private static double[] flatten(double[][] data)
  {
    double[] values = new double[data.length * data[0].length];
    int position = 0;
    for (double[] row : data)
    {
      System.arraycopy(row, 0, values, position, row.length);
      position += row.length;
    }
    return values;
  }
}
