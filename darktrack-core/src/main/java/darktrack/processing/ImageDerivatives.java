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

/**
 * Finite-difference derivatives of 2D planes
 * @author Jean Ollion
 */
public class ImageDerivatives {

    /**
     * Squared magnitude of the numerical gradient: central differences (f(i+1) - f(i-1)) / 2 inside,
     * one-sided differences on the first and last row / column, 0 along an axis of size 1.
     * @param plane pixels indexed x + y * sizeX
     * @return gx² + gy²
     */
    public static float[] gradientSquaredMagnitude(float[] plane, int sizeX, int sizeY) {
        float[] res = new float[plane.length];
        for (int y = 0; y<sizeY; ++y) {
            int off = y * sizeX;
            for (int x = 0; x<sizeX; ++x) {
                double gx, gy;
                if (sizeX==1) gx = 0;
                else if (x==0) gx = plane[off + 1] - plane[off];
                else if (x==sizeX-1) gx = plane[off + x] - plane[off + x - 1];
                else gx = (plane[off + x + 1] - plane[off + x - 1]) / 2d;
                if (sizeY==1) gy = 0;
                else if (y==0) gy = plane[x + sizeX] - plane[x];
                else if (y==sizeY-1) gy = plane[off + x] - plane[off + x - sizeX];
                else gy = (plane[off + x + sizeX] - plane[off + x - sizeX]) / 2d;
                res[off + x] = (float)(gx * gx + gy * gy);
            }
        }
        return res;
    }
}
