/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/
package quickreduce;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds files on the local file system using glob patterns. A wildcard never
 * matches across a directory separator, so "a/*&#47;b" only looks one level
 * below "a".
 */
public class GlobFileLocator implements FileLocator {

    private static final String GLOB_CHARACTERS = "*?[{";

    public List<String> find(String pattern) throws IOException {
        if ((pattern == null) || (pattern.trim().length() < 1)) {
            throw new IllegalArgumentException("Cannot find files as the pattern given was null or blank.");
        }
        // Walked paths never hold repeated separators.
        pattern = pattern.replaceAll(Pattern.quote(File.separator) + "+", Matcher.quoteReplacement(File.separator));

        String[] parts = pattern.split(Pattern.quote(File.separator), -1);
        int firstWildcard = -1;
        for (int index = 0; index < parts.length; ++index) {
            if (hasWildcard(parts[index])) {
                firstWildcard = index;
                break;
            }
        }

        List<String> matches = new ArrayList<String>();
        if (firstWildcard < 0) {
            if (new File(pattern).isFile()) {
                matches.add(pattern);
            }
            return matches;
        }

        StringBuilder base = new StringBuilder();
        for (int index = 0; index < firstWildcard; ++index) {
            base.append(parts[index]).append(File.separator);
        }
        Path baseDirectory = Paths.get(base.length() == 0 ? "." : base.toString());
        if (!Files.isDirectory(baseDirectory)) {
            return matches;
        }

        // Walked paths keep the base prefix, so they can be matched against the whole pattern.
        final PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:"
                + (base.length() == 0 ? "." + File.separator + pattern : pattern));
        final List<String> found = matches;
        final int depth = parts.length - firstWildcard;

        Files.walkFileTree(baseDirectory, EnumSet.of(FileVisitOption.FOLLOW_LINKS), depth,
                new SimpleFileVisitor<Path>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attributes) {
                        if (attributes.isRegularFile() && matcher.matches(file)) {
                            found.add(file.toString());
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException ex) throws IOException {
                        if (ex instanceof FileSystemLoopException) {
                            System.err.println("Not following the symbolic link loop at " + file);
                            return FileVisitResult.CONTINUE;
                        }
                        throw ex;
                    }
                });

        Collections.sort(matches);
        return matches;
    }

    private static boolean hasWildcard(String part) {
        for (int index = 0; index < part.length(); ++index) {
            if (GLOB_CHARACTERS.indexOf(part.charAt(index)) >= 0) {
                return true;
            }
        }
        return false;
    }
}
