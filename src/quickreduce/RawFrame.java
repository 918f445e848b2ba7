/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/

package quickreduce;

import java.util.Optional;

/**
 * Represents a single amplifier readout (one FITS exposure) exactly as it was
 * loaded from disk, together with the header values needed to calibrate it.
 */
public class RawFrame {

  /**
   * The pixels of the readout, indexed as [row][column]. The overscan columns
   * are still present.
   */
  private final double[][] pixels;

  /**
   * The GAIN header value (electrons per ADU). May be zero or negative when the
   * header carries no usable value.
   */
  private final double gain;

  /**
   * The RDNOISE header value (electrons). May be zero or negative when the
   * header carries no usable value.
   */
  private final double readNoise;

  /**
   * The CCDPOS header value, for example "L" or "R".
   */
  private final String ccdPosition;

  /**
   * The CCDHALF header value, for example "L" or "U".
   */
  private final String ccdHalf;

  /**
   * The AMPNAME header value, only present on some controllers.
   */
  private final Optional<String> ampName;

  public RawFrame(double[][] pixels, double gain, double readNoise, String ccdPosition,
                  String ccdHalf, Optional<String> ampName) {
    if (pixels == null) {
      throw new IllegalArgumentException("Cannot create a raw frame as the pixel array was null.");
    }
    if ((pixels.length == 0) || (pixels[0].length == 0)) {
      throw new IllegalArgumentException("Cannot create a raw frame from an empty pixel array.");
    }
    for (int row = 0; row < pixels.length; ++row) {
      if (pixels[row].length != pixels[0].length) {
        throw new IllegalArgumentException("Cannot create a raw frame as row " + row + " has "
                + pixels[row].length + " columns when " + pixels[0].length + " columns were expected.");
      }
    }
    if ((ccdPosition == null) || (ccdHalf == null)) {
      throw new IllegalArgumentException("Cannot create a raw frame without both the CCDPOS and CCDHALF values.");
    }
    if (ampName == null) {
      throw new IllegalArgumentException("Cannot create a raw frame with a null amplifier name, use Optional.empty().");
    }

    this.pixels = pixels;
    this.gain = gain;
    this.readNoise = readNoise;
    this.ccdPosition = ccdPosition;
    this.ccdHalf = ccdHalf;
    this.ampName = ampName;
  }

  /**
   * The pixels of the readout, indexed as [row][column].
   * @return the pixels
   */
  public double[][] getPixels() {
    return pixels;
  }

  public int getRows() {
    return pixels.length;
  }

  public int getColumns() {
    return pixels[0].length;
  }

  public double getGain() {
    return gain;
  }

  public double getReadNoise() {
    return readNoise;
  }

  public String getCcdPosition() {
    return ccdPosition;
  }

  public String getCcdHalf() {
    return ccdHalf;
  }

  /**
   * The AMPNAME header value, if the controller wrote one.
   * @return the amplifier name override
   */
  public Optional<String> getAmpName() {
    return ampName;
  }

  /**
   * Gets the amplifier identity, the CCDPOS and CCDHALF values concatenated
   * with all spaces removed (for example "LU").
   *
   * @return the amplifier identity.
   */
  public String getAmplifier() {
    return ccdPosition.replace(" ", "") + ccdHalf.replace(" ", "");
  }
}
