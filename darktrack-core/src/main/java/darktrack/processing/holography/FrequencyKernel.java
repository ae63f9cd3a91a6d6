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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Axial spatial frequency FZ = sqrt((n0/λ)² - fx² - fy²) of the angular spectrum, on the unshifted DFT grid
 * (zero frequency at index 0, negative frequencies in the upper half). Evanescent frequencies are set to 0.
 * Immutable.
 * @author Jean Ollion
 */
public class FrequencyKernel {
    public final static Logger logger = LoggerFactory.getLogger(FrequencyKernel.class);
    final int sizeX, sizeY;
    final double[] fz;
    final int evanescentCount;

    /**
     * 
     * @param sizeX width of the padded frame
     * @param sizeY height of the padded frame
     * @param pixelSize effective pixel size
     * @param wavelength wavelength, same unit as {@param pixelSize}
     * @param n0 refractive index of the medium
     */
    public FrequencyKernel(int sizeX, int sizeY, double pixelSize, double wavelength, double n0) {
        if (sizeX<1 || sizeY<1) throw new IllegalArgumentException("Invalid kernel size: "+sizeX+"x"+sizeY);
        if (pixelSize<=0 || wavelength<=0 || n0<=0) throw new IllegalArgumentException("Pixel size, wavelength and refractive index should be positive");
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        double[] fx = frequencies(sizeX, pixelSize);
        double[] fy = frequencies(sizeY, pixelSize);
        double k2 = (n0 / wavelength) * (n0 / wavelength);
        fz = new double[sizeX * sizeY];
        int evanescent = 0;
        for (int y = 0; y<sizeY; ++y) {
            double fy2 = fy[y] * fy[y];
            for (int x = 0; x<sizeX; ++x) {
                double r = k2 - fx[x] * fx[x] - fy2;
                if (r>=0) fz[x + y * sizeX] = Math.sqrt(r);
                else ++evanescent; // stays 0
            }
        }
        evanescentCount = evanescent;
        logger.debug("frequency kernel: {}x{}, evanescent frequencies: {}", sizeX, sizeY, evanescentCount);
    }

    public FrequencyKernel(int sizeX, int sizeY, OpticalGeometry geometry) {
        this(sizeX, sizeY, geometry.getEffectivePixelSize(), geometry.getWavelength(), geometry.getBackgroundIndex());
    }

    /**
     * Centered grid (k - floor(n/2)) / (n * pixelSize) cyclically shifted so that index 0 holds the zero frequency
     * @param n number of samples
     * @param pixelSize sampling step
     * @return frequencies in unshifted DFT order
     */
    public static double[] frequencies(int n, double pixelSize) {
        double df = 1. / (n * pixelSize);
        int half = n / 2;
        double[] res = new double[n];
        for (int j = 0; j<n; ++j) {
            int k = (j + half) % n; // index in the centered grid
            res[j] = (k - half) * df;
        }
        return res;
    }

    public int sizeX() {
        return sizeX;
    }

    public int sizeY() {
        return sizeY;
    }

    public double get(int x, int y) {
        return fz[x + y * sizeX];
    }

    public double get(int xy) {
        return fz[xy];
    }

    public int getEvanescentCount() {
        return evanescentCount;
    }

    /**
     * 
     * @return copy of the values, indexed x + y * sizeX
     */
    public double[] getValues() {
        return fz.clone();
    }
}
