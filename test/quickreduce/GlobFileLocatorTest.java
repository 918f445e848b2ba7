/*
* Copyright 2019-2026 The Authors (see AUTHORS)
* This file is part of QuickReduce, which is free software. It is made available
* to you under the terms of version 3 of the GNU General Public License, as
* published by the Free Software Foundation. For more information, see LICENSE.
*/

package quickreduce;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

/**
 * Unit tests for the GlobFileLocator class.
 */
public class GlobFileLocatorTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private String root;

    private File createFile(String... path) throws IOException {
        File file = new File(folder.getRoot(), String.join(File.separator, path));
        assertTrue(file.getParentFile().mkdirs() || file.getParentFile().isDirectory());
        assertTrue(file.createNewFile());
        return file;
    }

    @Before
    public void setUp() throws IOException {
        root = folder.getRoot().getPath();
        createFile("20181108", "virus", "virus0000012", "exp02", "virus", "20181108T031000.0_012LL_sci.fits");
        createFile("20181108", "virus", "virus0000012", "exp01", "virus", "20181108T030000.0_012LL_sci.fits");
        createFile("20181108", "virus", "virus0000012", "exp01", "virus", "20181108T030000.0_012LU_sci.fits");
        createFile("20181108", "virus", "virus0000003", "exp01", "virus", "20181108T010000.0_012LL_twi.fits");
    }

    /**
     * Test of find method, of class GlobFileLocator.
     */
    @Test
    public void testFindScienceExposures() throws IOException {
        String pattern = RawFilePaths.buildPath(root, "20181108", RawFilePaths.observationId(12), "012", "LL",
                RawFilePaths.SCIENCE, RawFilePaths.ANY_EXPOSURE, "virus");

        List<String> found = new GlobFileLocator().find(pattern);

        assertEquals(2, found.size());
        assertTrue(found.get(0).contains("exp01"));
        assertTrue(found.get(1).contains("exp02"));
        assertTrue(found.get(0).endsWith("012LL_sci.fits"));
    }

    @Test
    public void testFindAnyObservation() throws IOException {
        String pattern = RawFilePaths.buildPath(root, "20181108", RawFilePaths.WILDCARD, "012", "LL",
                RawFilePaths.TWILIGHT, RawFilePaths.ANY_EXPOSURE, "virus");

        List<String> found = new GlobFileLocator().find(pattern);

        assertEquals(1, found.size());
        assertTrue(found.get(0).contains("virus0000003"));
    }

    @Test
    public void testFindNothing() throws IOException {
        String missingDate = RawFilePaths.buildPath(root, "20181107", RawFilePaths.WILDCARD, "012", "LL",
                RawFilePaths.TWILIGHT, RawFilePaths.ANY_EXPOSURE, "virus");
        String missingSlot = RawFilePaths.buildPath(root, "20181108", RawFilePaths.WILDCARD, "099", "LL",
                RawFilePaths.SCIENCE, RawFilePaths.ANY_EXPOSURE, "virus");

        assertTrue(new GlobFileLocator().find(missingDate).isEmpty());
        assertTrue(new GlobFileLocator().find(missingSlot).isEmpty());
    }

    @Test
    public void testFindPlainPath() throws IOException {
        File file = createFile("cals", "012LL.fits");

        List<String> found = new GlobFileLocator().find(file.getPath());
        assertEquals(1, found.size());
        assertEquals(file.getPath(), found.get(0));

        assertTrue(new GlobFileLocator().find(file.getPath() + ".missing").isEmpty());
    }

    @Test
    public void testRepeatedSeparatorsAreIgnored() throws IOException {
        String pattern = root + File.separator + File.separator + "20181108" + File.separator + "virus"
                + File.separator + "virus0000012" + File.separator + "exp*" + File.separator + "virus"
                + File.separator + "*LU_sci.fits";

        assertEquals(1, new GlobFileLocator().find(pattern).size());
    }

    @Test
    public void testFindFollowsSymbolicLinks() throws IOException {
        File target = createFile("archive", "20181108T040000.0_012LL_sci.fits");
        File exposure = new File(folder.getRoot(), String.join(File.separator, "20181108", "virus",
                "virus0000012", "exp03", "virus"));
        assertTrue(exposure.mkdirs());
        Files.createSymbolicLink(new File(exposure, target.getName()).toPath(), target.toPath());

        File linkedDate = new File(folder.getRoot(), "20181109");
        Files.createSymbolicLink(linkedDate.toPath(), new File(folder.getRoot(), "20181108").toPath());

        String pattern = RawFilePaths.buildPath(root, "20181108", RawFilePaths.observationId(12), "012", "LL",
                RawFilePaths.SCIENCE, RawFilePaths.ANY_EXPOSURE, "virus");
        List<String> found = new GlobFileLocator().find(pattern);
        assertEquals(3, found.size());
        assertTrue(found.get(2).contains("exp03"));

        String linkedPattern = root + File.separator + "2018110*" + File.separator + "virus" + File.separator
                + "virus0000012" + File.separator + "exp01" + File.separator + "virus" + File.separator
                + "*LL_sci.fits";
        assertEquals(2, new GlobFileLocator().find(linkedPattern).size());
    }
}
