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

import darktrack.data_structure.Detection;
import darktrack.data_structure.Region;
import darktrack.image.ImageFloat;
import darktrack.processing.holography.FrameVolumes;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

/**
 *
 * @author Jean Ollion
 */
public class TestObjectLocalizer {
    static final int SX = 10, SY = 5, DEPTH = 5;

    /**
     * Object on row 2. Pixel x has its maximal gradient x+1 at depth {@param depths}[x]
     */
    static FrameVolumes volumes(int[] depths, ImageFloat dark) {
        ImageFloat grad = new ImageFloat("grad", SX, SY, DEPTH);
        for (int x = 0; x<SX; ++x) grad.setPixel(x, 2, depths[x], x+1);
        return new FrameVolumes(dark, grad, DEPTH/2);
    }

    static Region row(int label) {
        int[] pixels = new int[SX];
        for (int x = 0; x<SX; ++x) pixels[x] = x + 2*SX;
        return new Region(label, pixels, SX, SY);
    }

    @Test
    public void testWeightedDepth() {
        int[] depths = new int[]{0, 1, 2, 3, 4, 0, 1, 2, 1, 3};
        ImageFloat dark = new ImageFloat("dark", SX, SY, DEPTH);
        dark.setPixel(4, 2, 2, 5);
        dark.setPixel(7, 2, 2, 5);
        dark.setPixel(0, 0, 2, 100); // outside the object
        dark.setPixel(9, 2, 3, 50); // other depth
        FrameVolumes v = volumes(depths, dark);
        float[] edof = new float[SX*SY];
        List<Detection> detections = new ObjectLocalizer(v).localize(3, Arrays.asList(row(1)), edof);
        assertEquals(1, detections.size());
        Detection d = detections.get(0);
        // quantile 0.8 of 1..10 is 8.2: pixels 8 and 9 are the sharpest
        assertEquals((9*1 + 10*3)/19d, d.getDepthIndex(), 1e-9);
        assertEquals(2, d.getFocusSlice());
        assertEquals("first maximum in raster order", 4, d.getX());
        assertEquals(2, d.getY());
        assertEquals(3, d.getFrame());
        assertEquals(1, d.getLabel());
        assertEquals("EDOF takes the focus slice", 5, edof[4 + 2*SX], 0);
        assertEquals(0, edof[9 + 2*SX], 0);
        assertEquals("EDOF is null outside objects", 0, edof[0], 0);
    }

    @Test
    public void testEqualSharpness() {
        ImageFloat grad = new ImageFloat("grad", SX, SY, DEPTH);
        for (int x = 0; x<SX; ++x) grad.setPixel(x, 2, 1, 2);
        FrameVolumes v = new FrameVolumes(new ImageFloat("dark", SX, SY, DEPTH), grad, DEPTH/2);
        Detection d = new ObjectLocalizer(v).localize(0, row(1), null);
        assertEquals("all pixels are used when none is above the quantile", 1, d.getDepthIndex(), 1e-9);
        assertEquals(1, d.getFocusSlice());
        assertEquals(0, d.getX());
    }

    @Test
    public void testNullGradient() {
        FrameVolumes v = new FrameVolumes(new ImageFloat("dark", SX, SY, DEPTH), new ImageFloat("grad", SX, SY, DEPTH), DEPTH/2);
        Detection d = new ObjectLocalizer(v).localize(0, row(1), null);
        assertEquals(0, d.getDepthIndex(), 0);
    }
}
