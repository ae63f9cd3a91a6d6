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
package darktrack.processing;

import darktrack.data_structure.Region;
import darktrack.image.ImageByte;
import darktrack.image.ImageInt;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

/**
 *
 * @author Jean Ollion
 */
public class TestImageLabeller {
    static ImageByte mask(int sizeX, String... rows) {
        ImageByte res = new ImageByte("mask", sizeX, rows.length, 1);
        for (int y = 0; y<rows.length; ++y) {
            for (int x = 0; x<sizeX; ++x) if (rows[y].charAt(x)=='1') res.setPixel(x, y, 0, 1);
        }
        return res;
    }

    @Test
    public void testConnectivity() {
        ImageByte m = mask(5,
                "10000",
                "01000",
                "00100",
                "00000",
                "00011");
        List<Region> diag = ImageLabeller.labelImage(m);
        assertEquals("8-connectivity joins diagonal pixels", 2, diag.size());
        assertEquals(3, diag.get(0).size());
        assertEquals(2, diag.get(1).size());
    }

    @Test
    public void testRasterOrder() {
        ImageByte m = mask(6,
                "000011",
                "110001",
                "110000",
                "000000",
                "001000");
        List<Region> regions = ImageLabeller.labelImage(m);
        assertEquals(3, regions.size());
        for (int i = 0; i<regions.size(); ++i) assertEquals("labels start at 1", i+1, regions.get(i).getLabel());
        assertArrayEquals("first region contains the first foreground pixel", new int[]{4, 5, 11}, regions.get(0).getPixels());
        assertArrayEquals(new int[]{6, 7, 12, 13}, regions.get(1).getPixels());
        assertArrayEquals(new int[]{26}, regions.get(2).getPixels());
    }

    @Test
    public void testUShape() {
        // branches are fused when they meet
        ImageByte m = mask(5,
                "10001",
                "10001",
                "11111");
        List<Region> regions = ImageLabeller.labelImage(m);
        assertEquals(1, regions.size());
        assertEquals(9, regions.get(0).size());
    }

    @Test
    public void testLabelMap() {
        ImageByte m = mask(4,
                "1100",
                "0000",
                "0011");
        ImageInt labels = ImageLabeller.toLabelMap(ImageLabeller.labelImage(m), 4, 3);
        assertEquals(1, labels.getPixelInt(1, 0, 0));
        assertEquals(0, labels.getPixelInt(2, 1, 0));
        assertEquals(2, labels.getPixelInt(3, 2, 0));
    }

    @Test
    public void testEmpty() {
        assertTrue(ImageLabeller.labelImage(new ImageByte("empty", 4, 4, 1)).isEmpty());
    }
}
