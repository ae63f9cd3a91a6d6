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
import ij.plugin.filter.GaussianBlur;
import ij.process.FloatProcessor;

/**
 * Smoothing filters on 2D float images
 * @author Jean Ollion
 */
public class Filters {
    static final double GAUSSIAN_ACCURACY = 0.002;

    /**
     * Gaussian smoothing of each plane, using ImageJ's separable implementation. Edges are extrapolated.
     * @param image input image, not modified
     * @param sigma standard deviation in pixels
     * @return smoothed copy of {@param image}
     */
    public static ImageFloat gaussianSmooth(ImageFloat image, double sigma) {
        ImageFloat res = image.duplicate(image.getName()+"_gaussian");
        if (sigma<=0) return res;
        GaussianBlur gb = new GaussianBlur();
        float[][] pixels = res.getPixelArray();
        for (int z = 0; z<res.sizeZ(); ++z) {
            FloatProcessor fp = new FloatProcessor(res.sizeX(), res.sizeY(), pixels[z]);
            gb.blurGaussian(fp, sigma, sigma, GAUSSIAN_ACCURACY);
        }
        return res;
    }

    /**
     * Local mean over a (2 * radiusX + 1) x (2 * radiusY + 1) rectangle. Out-of-bound pixels replicate the border.
     * @param image 2D image
     * @return new image
     */
    public static ImageFloat localMean(ImageFloat image, int radiusX, int radiusY) {
        if (image.sizeZ()!=1) throw new IllegalArgumentException("Only 2D images are supported");
        int sX = image.sizeX();
        int sY = image.sizeY();
        float[] in = image.getPixelArray()[0];
        double[] rowMean = new double[sX*sY];
        // horizontal pass
        double[] cumSum = new double[sX + 2 * radiusX + 1];
        for (int y = 0; y<sY; ++y) {
            int off = y*sX;
            for (int i = 0; i<sX + 2 * radiusX; ++i) cumSum[i+1] = cumSum[i] + in[off + clamp(i - radiusX, sX)];
            for (int x = 0; x<sX; ++x) rowMean[off + x] = (cumSum[x + 2*radiusX + 1] - cumSum[x]) / (2 * radiusX + 1);
        }
        // vertical pass
        float[] out = new float[sX*sY];
        cumSum = new double[sY + 2 * radiusY + 1];
        for (int x = 0; x<sX; ++x) {
            for (int i = 0; i<sY + 2 * radiusY; ++i) cumSum[i+1] = cumSum[i] + rowMean[x + clamp(i - radiusY, sY) * sX];
            for (int y = 0; y<sY; ++y) out[x + y * sX] = (float)((cumSum[y + 2*radiusY + 1] - cumSum[y]) / (2 * radiusY + 1));
        }
        return new ImageFloat(image.getName()+"_mean", sX, out);
    }

    private static int clamp(int i, int size) {
        return i<0 ? 0 : (i>=size ? size-1 : i);
    }
}
