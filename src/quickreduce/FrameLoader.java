/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

import java.io.IOException;

/**
 * The FrameLoader interface provides access to raw detector exposures held in
 * the raw exposure store.
 */
public interface FrameLoader {

    /**
     * Loads one raw amplifier exposure.
     *
     * @param filename the name of the exposure file to load.
     *
     * @return the pixels and header values of the exposure.
     *
     * @throws IOException if the exposure could not be read or its header
     *         lacks a mandatory value.
     */
    public RawFrame load(String filename) throws IOException;
}
