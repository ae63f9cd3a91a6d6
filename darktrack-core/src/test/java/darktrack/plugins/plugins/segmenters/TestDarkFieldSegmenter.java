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
package darktrack.plugins.plugins.segmenters;

import darktrack.data_structure.Region;
import darktrack.image.ImageByte;
import darktrack.image.ImageFloat;
import darktrack.processing.holography.FrameVolumes;
import org.junit.Test;

import java.util.List;

import static darktrack.test_utils.TestUtils.constantImage;
import static org.junit.Assert.*;

/**
 *
 * @author Jean Ollion
 */
public class TestDarkFieldSegmenter {
    static final int S = 64;

    static void square(ImageFloat image, int x0, int y0, int size, float value) {
        for (int z = 0; z<image.sizeZ(); ++z) {
            for (int y = y0; y<y0+size; ++y) for (int x = x0; x<x0+size; ++x) image.setPixel(x, y, z, value);
        }
    }

    /**
     * Two bright squares of 36 and 9 pixels on a dark background, uniform gradient
     */
    static FrameVolumes volumes() {
        ImageFloat dark = new ImageFloat("dark", S, S, 3);
        square(dark, 10, 10, 6, 1);
        square(dark, 40, 40, 3, 1);
        return new FrameVolumes(dark, constantImage(S, S, 3, 1), 1);
    }

    @Test
    public void testForeground() {
        DarkFieldSegmenter seg = new DarkFieldSegmenter(1);
        FrameVolumes v = volumes();
        ImageFloat score = seg.getScoreImage(v);
        assertEquals(1, score.getPixel(12, 12, 0), 1e-3);
        assertEquals(0, score.getPixel(30, 30, 0), 1e-3);
        ImageByte mask = seg.getForegroundMask(score);
        assertEquals(45, mask.count());
        assertTrue(mask.insideMask(41, 41, 0));
    }

    @Test
    public void testObjects() {
        List<Region> regions = new DarkFieldSegmenter(1).runSegmenter(volumes());
        assertEquals(2, regions.size());
        assertEquals(36, regions.get(0).size());
        assertEquals(9, regions.get(1).size());
        assertEquals(1, regions.get(0).getLabel());
        assertEquals(2, regions.get(1).getLabel());
        List<Region> filtered = new DarkFieldSegmenter(10).runSegmenter(volumes());
        assertEquals("small object removed", 1, filtered.size());
        assertEquals("labels are consecutive", 1, filtered.get(0).getLabel());
        assertEquals(36, filtered.get(0).size());
    }

    @Test
    public void testMonotonicInMinimalSize() {
        FrameVolumes v = volumes();
        int previous = Integer.MAX_VALUE;
        for (int minPix = 0; minPix<=50; minPix+=1) {
            int count = new DarkFieldSegmenter(minPix).runSegmenter(v).size();
            assertTrue("object count at min size "+minPix, count<=previous);
            previous = count;
        }
        assertEquals(0, previous);
    }

    @Test
    public void testEmptyFrame() {
        FrameVolumes v = new FrameVolumes(new ImageFloat("dark", S, S, 2), new ImageFloat("grad", S, S, 2), 0);
        assertTrue(new DarkFieldSegmenter().runSegmenter(v).isEmpty());
    }
}
