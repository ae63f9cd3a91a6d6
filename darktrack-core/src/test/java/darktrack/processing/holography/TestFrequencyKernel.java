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
package darktrack.processing.holography;

import darktrack.configuration.OpticalGeometry;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 *
 * @author Jean Ollion
 */
public class TestFrequencyKernel {

    @Test
    public void testFrequencyOrder() {
        assertArrayEquals("even size", new double[]{0, 0.25, -0.5, -0.25}, FrequencyKernel.frequencies(4, 1), 1e-12);
        assertArrayEquals("odd size", new double[]{0, 0.2, 0.4, -0.4, -0.2}, FrequencyKernel.frequencies(5, 1), 1e-12);
        assertArrayEquals("pixel size", new double[]{0, 0.5, -1, -0.5}, FrequencyKernel.frequencies(4, 0.5), 1e-12);
    }

    @Test
    public void testEvanescentFrequenciesAreZero() {
        int sX = 16, sY = 12;
        double pixelSize = 0.25, wavelength = 1, n0 = 1;
        FrequencyKernel kernel = new FrequencyKernel(sX, sY, pixelSize, wavelength, n0);
        double[] fx = FrequencyKernel.frequencies(sX, pixelSize);
        double[] fy = FrequencyKernel.frequencies(sY, pixelSize);
        int evanescent = 0;
        for (int y = 0; y<sY; ++y) {
            for (int x = 0; x<sX; ++x) {
                double r = (n0/wavelength)*(n0/wavelength) - fx[x]*fx[x] - fy[y]*fy[y];
                if (r<0) {
                    ++evanescent;
                    assertEquals("evanescent frequency at "+x+";"+y, 0, kernel.get(x, y), 0);
                } else assertEquals("propagating frequency at "+x+";"+y, Math.sqrt(r), kernel.get(x, y), 1e-12);
            }
        }
        assertTrue("some frequencies are evanescent", evanescent>0);
        assertEquals(evanescent, kernel.getEvanescentCount());
        assertEquals("zero frequency", n0/wavelength, kernel.get(0, 0), 1e-12);
    }

    @Test
    public void testMediumIndex() {
        FrequencyKernel kernel = new FrequencyKernel(8, 8, new OpticalGeometry(100, -10, 10, 1, 0.5, 5.5, 11).setBackgroundIndex(1.33));
        assertEquals(1.33/0.5, kernel.get(0, 0), 1e-9);
        assertEquals("no evanescent frequency when the sampling is coarse", 0, kernel.getEvanescentCount());
    }

    @Test
    public void testValuesAreCopied() {
        FrequencyKernel kernel = new FrequencyKernel(4, 4, 1, 1, 1);
        double[] values = kernel.getValues();
        values[0] = -1;
        assertEquals(1, kernel.get(0), 0);
    }
}
