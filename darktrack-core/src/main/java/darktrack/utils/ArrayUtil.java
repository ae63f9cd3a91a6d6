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

import java.util.Arrays;

/**
 *
 * @author Jean Ollion
 */
public class ArrayUtil {

    /**
     * NaN values are considered as +infinity
     * @return index of minimal value, first occurrence in case of ties; -1 if array is empty
     */
    public static int min(double[] array) {
        if (array.length==0) return -1;
        int idxMin = 0;
        double minV = Double.isNaN(array[0]) ? Double.POSITIVE_INFINITY : array[0];
        for (int i = 1; i<array.length; ++i) {
            double v = Double.isNaN(array[i]) ? Double.POSITIVE_INFINITY : array[i];
            if (v<minV) {
                minV = v;
                idxMin=i;
            }
        }
        return idxMin;
    }

    public static double median(double[] array) {
        if (array.length==0) return Double.NaN;
        Arrays.sort(array);
        if (array.length%2==1) return array[array.length/2];
        else return (array[array.length/2]+array[array.length/2-1])/2.0d;
    }

    /**
     * Linear interpolation between order statistics at position (n-1) * q. {@param array} is sorted in place.
     */
    public static double quantile(float[] array, double q) {
        if (array.length==0) return Double.NaN;
        Arrays.sort(array);
        double idx = (array.length-1)*q;
        int idxInf = (int)idx;
        double delta = idx - idxInf;
        if (delta==0 || idx==array.length-1) return array[idxInf];
        else return array[idxInf] * (1-delta) + array[idxInf+1] * delta;
    }

    /**
     * @return mean of values that are neither NaN nor excluded by {@param excludeZeros}; NaN if there are none
     */
    public static double mean(double[] array, boolean excludeZeros) {
        double sum = 0;
        int count = 0;
        for (double d : array) {
            if (Double.isNaN(d) || (excludeZeros && d==0)) continue;
            sum+=d;
            ++count;
        }
        return count==0 ? Double.NaN : sum / count;
    }
}
