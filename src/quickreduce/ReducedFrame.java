/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

/**
 * An exposure after detector preprocessing: overscan removed, oriented blue to
 * red along the rows and converted to electrons.
 */
public class ReducedFrame {

  /**
   * Calibrated flux in electrons, indexed as [row][column].
   */
  private final double[][] flux;

  /**
   * Per-pixel uncertainty in electrons (read noise plus Poisson noise).
   */
  private final double[][] error;

  /**
   * The gain that was applied (after defaulting).
   */
  private final double gain;

  /**
   * The read noise used for the uncertainty (after defaulting).
   */
  private final double readNoise;

  /**
   * The amplifier identity, for example "LU".
   */
  private final String amplifier;

  public ReducedFrame(double[][] flux, double[][] error, double gain, double readNoise, String amplifier) {
    this.flux = flux;
    this.error = error;
    this.gain = gain;
    this.readNoise = readNoise;
    this.amplifier = amplifier;
  }

  public double[][] getFlux() {
    return flux;
  }

  public double[][] getError() {
    return error;
  }

  public double getGain() {
    return gain;
  }

  public double getReadNoise() {
    return readNoise;
  }

  public String getAmplifier() {
    return amplifier;
  }

  public int getRows() {
    return flux.length;
  }

  public int getColumns() {
    return flux[0].length;
  }
}
