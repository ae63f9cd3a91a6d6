/* 
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of DarkTrack
 *
 * DarkTrack is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * DarkTrack is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with DarkTrack.  If not, see <http://www.gnu.org/licenses/>.
 */
package darktrack.utils;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import static org.junit.Assert.*;

/**
 *
 * @author Jean Ollion
 */
public class TestArrayFileWriter {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testWriteRows() throws IOException {
        File f = new File(folder.getRoot(), "X.csv");
        new ArrayFileWriter().addRows(new double[][]{{1, 2.5, Double.NaN}, {-1, 0, 3}}).writeToFile(f.getAbsolutePath());
        List<String> lines = Files.readAllLines(f.toPath(), StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertEquals("1.0;2.5;NaN", lines.get(0));
        assertEquals("-1.0;0.0;3.0", lines.get(1));
    }

    @Test
    public void testNoRow() throws IOException {
        File f = new File(folder.getRoot(), "empty.csv");
        new ArrayFileWriter().addRows(new double[0][3]).writeToFile(f.getAbsolutePath());
        assertTrue(f.isFile());
        assertEquals(0, f.length());
    }
}
