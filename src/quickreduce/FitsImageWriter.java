/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/

/*******************************************************************************
*  File      : FitsImageWriter.java
*
*  Overview
*  --------
*
*    The FitsImageWriter class saves reconstructed sky images as FITS files
*  holding a single 32-bit floating point image.
*
*******************************************************************************/

package quickreduce;

import java.io.DataOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;

import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;

public class FitsImageWriter
{
  public FitsImageWriter()
  {
  };

  //****************************************************************************
  /**
   * Saves an image to disk in the FITS format.
   * @param imageName - the name of the file to write.
   * @param data - the image, indexed [row][column].
   * @param comment - text for the COMMENT card, or null for none.
   * @throws java.io.IOException if the file could not be written.
   */
  public void saveFitsImage(String imageName, double[][] data, String comment) throws IOException
  {
    if ( (imageName == null) || (imageName.trim().length() < 1) )
    {
      throw new IllegalArgumentException("Cannot save the image as no filename was provided.");
    }
    if ( (data == null) || (data.length == 0) )
    {
      throw new IllegalArgumentException("Cannot save the image as the pixel array was null or empty.");
    }

    float[][] pixels = new float[data.length][];
    for (int row = 0; row < data.length; ++row)
    {
      pixels[row] = new float[data[row].length];
      for (int column = 0; column < data[row].length; ++column)
      {
        pixels[row][column] = (float) data[row][column];
      }
    }

    try (DataOutputStream dos = new DataOutputStream(new FileOutputStream(imageName)))
    {
      Fits image = new Fits();
      BasicHDU<?> header = Fits.makeHDU(pixels);
      if ( (comment != null) && (comment.trim().length() > 0) )
      {
        int endIndex = Math.min(72, comment.trim().length());
        header.getHeader().insertComment(comment.trim().substring(0, endIndex));
      }
      image.addHDU(header);
      image.write(dos);
    }
    catch(FitsException ex)
    {
      throw new IOException("Unable to write the FITS file called \'" + imageName + "\'", ex);
    }

    System.out.println("Finished writing image " + imageName);
  }
}
