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

import org.junit.Test;

import static org.junit.Assert.*;

/**
 *
 * @author Jean Ollion
 */
public class TestArrayUtil {

    @Test
    public void testQuantile() {
        assertEquals(4, ArrayUtil.quantile(new float[]{5, 1, 4, 2, 3}, 0.75), 1e-6);
        assertEquals("interpolated between 4 and 5", 4.2, ArrayUtil.quantile(new float[]{1, 2, 3, 4, 5}, 0.8), 1e-6);
        assertEquals(5, ArrayUtil.quantile(new float[]{1, 2, 3, 4, 5}, 1), 1e-6);
        assertEquals(1, ArrayUtil.quantile(new float[]{3, 1, 2}, 0), 1e-6);
        assertEquals(7, ArrayUtil.quantile(new float[]{7}, 0.8), 1e-6);
        assertTrue(Double.isNaN(ArrayUtil.quantile(new float[0], 0.5)));
    }

    @Test
    public void testMedian() {
        assertEquals(2, ArrayUtil.median(new double[]{3, 1, 2}), 1e-12);
        assertEquals(2.5, ArrayUtil.median(new double[]{4, 1, 3, 2}), 1e-12);
        assertTrue(Double.isNaN(ArrayUtil.median(new double[0])));
    }

    @Test
    public void testMean() {
        double[] values = new double[]{0, 2, Double.NaN, 4};
        assertEquals(3, ArrayUtil.mean(values, true), 1e-12);
        assertEquals(2, ArrayUtil.mean(values, false), 1e-12);
        assertTrue(Double.isNaN(ArrayUtil.mean(new double[]{0, Double.NaN}, true)));
    }

    @Test
    public void testMin() {
        assertEquals("NaN is never the minimum", 2, ArrayUtil.min(new double[]{Double.NaN, 3, 1, 1}));
        assertEquals(0, ArrayUtil.min(new double[]{Double.NaN, Double.NaN}));
        assertEquals(-1, ArrayUtil.min(new double[0]));
        assertEquals("first occurrence", 1, ArrayUtil.min(new double[]{4, 1, 1, 2}));
    }
}
