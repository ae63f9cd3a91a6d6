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
package darktrack.test_utils;

import darktrack.image.ImageFloat;
import darktrack.utils.geom.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

/**
 *
 * @author Jean Ollion
 */
public class TestUtils {
    public static final Logger logger = LoggerFactory.getLogger(TestUtils.class);

    public static void assertImageFloat(String message, ImageFloat expected, ImageFloat actual, float precision) {
        assertEquals(message+" image comparison: sizeZ", expected.sizeZ(), actual.sizeZ());
        for (int z = 0; z < expected.sizeZ(); z++) {
            assertArrayEquals(message+" image comparison " + expected.getName() + " plane: " + z, expected.getPixelArray()[z], actual.getPixelArray()[z], precision);
        }
    }

    public static ImageFloat constantImage(int sizeX, int sizeY, int sizeZ, float value) {
        ImageFloat res = new ImageFloat("constant", sizeX, sizeY, sizeZ);
        for (float[] p : res.getPixelArray()) Arrays.fill(p, value);
        return res;
    }

    /**
     * 
     * @param frames positions of each frame
     * @return detections per frame
     */
    public static List<List<Point>> frames(Point[]... frames) {
        List<List<Point>> res = new ArrayList<>(frames.length);
        for (Point[] f : frames) res.add(new ArrayList<>(Arrays.asList(f)));
        return res;
    }
}
