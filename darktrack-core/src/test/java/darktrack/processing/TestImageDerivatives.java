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

import org.junit.Test;

import static org.junit.Assert.*;

/**
 *
 * @author Jean Ollion
 */
public class TestImageDerivatives {

    @Test
    public void testLinearRamp() {
        int sX = 5, sY = 4;
        float[] plane = new float[sX*sY];
        for (int y = 0; y<sY; ++y) for (int x = 0; x<sX; ++x) plane[x + y*sX] = 2*x + 3*y;
        float[] g = ImageDerivatives.gradientSquaredMagnitude(plane, sX, sY);
        for (int i = 0; i<g.length; ++i) assertEquals("pixel "+i, 13, g[i], 1e-6);
    }

    @Test
    public void testBorders() {
        int sX = 5;
        float[] plane = new float[sX];
        for (int x = 0; x<sX; ++x) plane[x] = x*x;
        float[] g = ImageDerivatives.gradientSquaredMagnitude(plane, sX, 1);
        assertEquals("one-sided at first column", 1, g[0], 1e-6);
        assertEquals("central difference", 4, g[1], 1e-6); // (4 - 0) / 2
        assertEquals("central difference", 36, g[3], 1e-6); // (16 - 4) / 2
        assertEquals("one-sided at last column", 49, g[4], 1e-6); // 16 - 9
    }
}
