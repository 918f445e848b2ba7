/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

import java.io.IOException;
import java.util.List;

/**
 * The FileLocator interface finds the files matching a path pattern, where the
 * pattern may contain wildcards ('*', '?') in any of its path components.
 */
public interface FileLocator {

    /**
     * Finds the files matching a pattern.
     *
     * @param pattern the path pattern.
     * @return the names of the matching files in ascending order, or an empty
     *         list if nothing matches.
     *
     * @throws IOException if the directories could not be searched.
     */
    public List<String> find(String pattern) throws IOException;
}
