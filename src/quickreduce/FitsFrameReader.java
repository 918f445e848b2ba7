/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/

/*******************************************************************************
*  File      : FitsFrameReader.java
*
*  Overview
*  --------
*
*    The FitsFrameReader class converts raw amplifier exposures stored as FITS
*  files into RawFrame objects (pixel arrays plus the header values needed by
*  the detector preprocessing).
*
*******************************************************************************/

package quickreduce;

import java.io.FileInputStream;
import java.io.IOException;
import java.util.Optional;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;

public class FitsFrameReader implements FrameLoader
{
  /**
   * Header keyword holding the amplifier gain.
   */
  public static final String GAIN_KEYWORD = "GAIN";

  /**
   * Header keyword holding the amplifier read noise.
   */
  public static final String READ_NOISE_KEYWORD = "RDNOISE";

  /**
   * Header keyword holding the CCD position (left or right) of the amplifier.
   */
  public static final String CCD_POSITION_KEYWORD = "CCDPOS";

  /**
   * Header keyword holding the CCD half (lower or upper) of the amplifier.
   */
  public static final String CCD_HALF_KEYWORD = "CCDHALF";

  /**
   * Optional header keyword naming the amplifier on newer controllers.
   */
  public static final String AMP_NAME_KEYWORD = "AMPNAME";

  public FitsFrameReader()
  {
  };

  //***************************************************************************
  /**
   * Loads the named FITS exposure from disk and returns its pixels and the
   * header values used during preprocessing.
   * @param filename - the name of the FITS file on disk to load.
   * @return the loaded exposure.
   * @throws java.io.IOException if there was a problem loading the file or a
   *         mandatory header value is missing.
   */
  public RawFrame load(String filename) throws IOException
  {
    if ( (filename == null) || (filename.equals("")) )
    {
      throw new IllegalArgumentException("Cannot load a FITS exposure as the filename provided is a null string.");
    }

    try (FileInputStream fis = new FileInputStream(filename))
    {
      Fits fits = new Fits();
      fits.read(fis);

      BasicHDU<?> hdu = fits.getHDU(0);
      if (hdu == null)
      {
        throw new IOException("The FITS file called \'" + filename + "\' has no primary HDU.");
      }
      Header header = hdu.getHeader();

      String ccdPosition = header.getStringValue(CCD_POSITION_KEYWORD);
      String ccdHalf = header.getStringValue(CCD_HALF_KEYWORD);
      if ( (ccdPosition == null) || (ccdHalf == null) )
      {
        throw new IOException("The FITS file called \'" + filename + "\' does not have both the "
                              + CCD_POSITION_KEYWORD + " and " + CCD_HALF_KEYWORD + " header values.");
      }

      // An absent gain or read noise reads as 0.0 and is defaulted later on.
      double gain = header.getDoubleValue(GAIN_KEYWORD);
      double readNoise = header.getDoubleValue(READ_NOISE_KEYWORD);

      Optional<String> ampName = Optional.empty();
      if (header.containsKey(AMP_NAME_KEYWORD))
      {
        ampName = Optional.ofNullable(header.getStringValue(AMP_NAME_KEYWORD));
      }

      return new RawFrame(readPixels(hdu, filename), gain, readNoise, ccdPosition, ccdHalf, ampName);
    }
    catch(FitsException ex)
    {
      throw new IOException("Unable to load the FITS file called \'" + filename + "\'", ex);
    }
  }

  //***************************************************************************
  /**
   * Copies the two-dimensional image held by a FITS HDU into an array of
   * doubles, applying the BSCALE and BZERO values of the HDU.
   * @param hdu - the header/data unit holding the image.
   * @param source - a description of where the HDU came from, used in messages.
   * @return the image as an array indexed [row][column].
   * @throws java.io.IOException if the HDU does not hold a two-dimensional
   *         image of a supported pixel type.
   */
  static double[][] readPixels(BasicHDU<?> hdu, String source) throws IOException
  {
    int imageHeight = 0;
    int imageWidth = 0;
    int pixelType = 0;
    double bscale = 1.0;
    double bzero = 0.0;
    Object data = null;

    try
    {
      int axes[] = hdu.getAxes();
      if ( (axes == null) || (axes.length != 2) )
      {
        throw new IOException("The image in \'" + source + "\' is not two-dimensional.");
      }
      imageHeight = axes[0];
      imageWidth = axes[1];
      bscale = hdu.getBScale();
      bzero = hdu.getBZero();
      pixelType = hdu.getBitPix();
      data = hdu.getData().getData();
    }
    catch(FitsException ex)
    {
      throw new IOException("Unable to read the image held in \'" + source + "\'", ex);
    }

    double[][] pixelBuffer = new double[imageHeight][imageWidth];

    switch(pixelType)
    {
      case BasicHDU.BITPIX_SHORT:
      {
        short[][] values = (short[][]) data;
        for (int row = 0; row < imageHeight; ++row)
        {
          for (int column = 0; column < imageWidth; ++column)
          {
            pixelBuffer[row][column] = bzero + bscale*values[row][column];
          }
        }
      }
      break;

      case BasicHDU.BITPIX_FLOAT:
      {
        float[][] values = (float[][]) data;
        for (int row = 0; row < imageHeight; ++row)
        {
          for (int column = 0; column < imageWidth; ++column)
          {
            pixelBuffer[row][column] = bzero + bscale*values[row][column];
          }
        }
      }
      break;

      case BasicHDU.BITPIX_DOUBLE:
      {
        double[][] values = (double[][]) data;
        for (int row = 0; row < imageHeight; ++row)
        {
          for (int column = 0; column < imageWidth; ++column)
          {
            pixelBuffer[row][column] = bzero + bscale*values[row][column];
          }
        }
      }
      break;

      case BasicHDU.BITPIX_BYTE:
      {
        // FITS bytes are unsigned.
        byte[][] values = (byte[][]) data;
        for (int row = 0; row < imageHeight; ++row)
        {
          for (int column = 0; column < imageWidth; ++column)
          {
            pixelBuffer[row][column] = bzero + bscale*(values[row][column] & 0xff);
          }
        }
      }
      break;

      case BasicHDU.BITPIX_INT:
      {
        int[][] values = (int[][]) data;
        for (int row = 0; row < imageHeight; ++row)
        {
          for (int column = 0; column < imageWidth; ++column)
          {
            pixelBuffer[row][column] = bzero + bscale*values[row][column];
          }
        }
      }
      break;

      case BasicHDU.BITPIX_LONG:
      {
        long[][] values = (long[][]) data;
        for (int row = 0; row < imageHeight; ++row)
        {
          for (int column = 0; column < imageWidth; ++column)
          {
            pixelBuffer[row][column] = bzero + bscale*values[row][column];
          }
        }
      }
      break;

      default:
        throw new IOException("Pixel type is not yet supported (BITPIX = " + pixelType + ") in \'" + source + "\'.");
    }

    return pixelBuffer;
  }
}
