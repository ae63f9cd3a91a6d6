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
package darktrack.plugins.plugins.thresholders;

import darktrack.image.ImageFloat;
import org.junit.Test;

import static darktrack.test_utils.TestUtils.constantImage;
import static org.junit.Assert.*;

/**
 *
 * @author Jean Ollion
 */
public class TestLocalMeanThresholder {

    @Test
    public void testSensitivity() {
        ImageFloat input = constantImage(32, 32, 1, 0.5f);
        assertEquals(0.55, new LocalMeanThresholder().runLocalThresholder(input).getPixel(5, 7, 0), 1e-6);
        assertEquals("higher sensitivity lowers the threshold", 0.3, new LocalMeanThresholder().setSensitivity(1).runLocalThresholder(input).getPixel(31, 0, 0), 1e-6);
        assertEquals("input is not modified", 0.5, input.getPixel(0, 0, 0), 0);
    }

    @Test
    public void testClipping() {
        ImageFloat threshold = new LocalMeanThresholder().setSensitivity(0).runLocalThresholder(constantImage(20, 20, 1, 1));
        assertEquals(1, threshold.getPixel(10, 10, 0), 0);
    }
}
