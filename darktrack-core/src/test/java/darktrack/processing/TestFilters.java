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

import darktrack.image.ImageFloat;
import org.junit.Test;

import static darktrack.test_utils.TestUtils.constantImage;
import static org.junit.Assert.*;

/**
 *
 * @author Jean Ollion
 */
public class TestFilters {

    @Test
    public void testLocalMeanReplicatesBorders() {
        ImageFloat row = new ImageFloat("row", 3, new float[]{0, 0, 3});
        float[] mean = Filters.localMean(row, 1, 0).getPixelArray()[0];
        assertEquals(0, mean[0], 1e-6);
        assertEquals(1, mean[1], 1e-6);
        assertEquals("last value is replicated", 2, mean[2], 1e-6);
    }

    @Test
    public void testLocalMean2D() {
        ImageFloat image = new ImageFloat("impulse", 5, 5, 1);
        image.setPixel(2, 2, 0, 9);
        ImageFloat mean = Filters.localMean(image, 1, 1);
        for (int y = 0; y<5; ++y) {
            for (int x = 0; x<5; ++x) {
                boolean inside = Math.abs(x-2)<=1 && Math.abs(y-2)<=1;
                assertEquals(x+";"+y, inside ? 1 : 0, mean.getPixel(x, y, 0), 1e-6);
            }
        }
    }

    @Test
    public void testConstantImage() {
        ImageFloat c = constantImage(20, 15, 1, 3);
        ImageFloat mean = Filters.localMean(c, 4, 3);
        ImageFloat smooth = Filters.gaussianSmooth(c, 2);
        for (int xy = 0; xy<c.sizeXY(); ++xy) {
            assertEquals(3, mean.getPixel(xy, 0), 1e-5);
            assertEquals(3, smooth.getPixel(xy, 0), 1e-2);
        }
        assertEquals("input is not modified", 3, c.getPixel(0, 0), 0);
    }
}
