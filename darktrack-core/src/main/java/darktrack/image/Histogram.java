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
package darktrack.image;

/**
 * Histogram with regular bins starting at {@link #getMin()}
 * @author Jean Ollion
 */
public class Histogram {
    public final int[] data;
    final double min, binSize;

    public Histogram(int[] data, double binSize, double min) {
        this.data = data;
        this.binSize = binSize;
        this.min = min;
    }

    /**
     * Histogram of values in [0;1] with {@param nBins} bins centered on k/(nBins-1): value v falls in bin round(v * (nBins-1))
     * @param image normalized image
     * @param mask optional mask
     * @param nBins bin number
     * @return histogram
     */
    public static Histogram getUnitHistogram(Image image, ImageMask mask, int nBins) {
        int[] data = new int[nBins];
        double scale = nBins-1;
        for (int z = 0; z<image.sizeZ(); ++z) {
            for (int xy = 0; xy<image.sizeXY(); ++xy) {
                if (mask!=null && !mask.insideMask(xy, z)) continue;
                double v = image.getPixel(xy, z);
                if (Double.isNaN(v)) continue;
                int idx = (int)Math.round(v * scale);
                if (idx<0) idx = 0;
                else if (idx>=nBins) idx = nBins-1;
                ++data[idx];
            }
        }
        return new Histogram(data, 1./scale, 0);
    }

    public double getMin() {
        return min;
    }

    public double getBinSize() {
        return binSize;
    }

    public double getValueFromIdx(double idx) {
        return idx * binSize + min;
    }

    public long count() {
        long sum = 0;
        for (int i : data) sum+=i;
        return sum;
    }
}
