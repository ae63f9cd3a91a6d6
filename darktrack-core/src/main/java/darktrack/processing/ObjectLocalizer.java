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

import darktrack.data_structure.Detection;
import darktrack.data_structure.Region;
import darktrack.processing.holography.FrameVolumes;
import darktrack.utils.ArrayUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Localizes segmented objects in 3D. The depth of an object is the mean of the depths of maximal gradient of its sharpest pixels,
 * weighted by this maximal gradient; its lateral position is the maximal dark-field amplitude at this depth.
 * @author Jean Ollion
 */
public class ObjectLocalizer {
    public final static Logger logger = LoggerFactory.getLogger(ObjectLocalizer.class);
    public final static double SHARPNESS_QUANTILE = 0.8;
    final float[] maxGradient;
    final int[] maxGradientDepth;
    final FrameVolumes volumes;
    final int sizeX;

    public ObjectLocalizer(FrameVolumes volumes) {
        this.volumes = volumes;
        this.sizeX = volumes.grad.sizeX();
        this.maxGradient = ImageOperations.maxZProjection(volumes.grad).getPixelArray()[0];
        this.maxGradientDepth = ImageOperations.argMaxZProjection(volumes.grad);
    }

    /**
     * 
     * @param frame frame index assigned to detections
     * @param regions segmented objects
     * @param edof extended depth of field plane: pixels of each object are set to the dark-field amplitude at its focus slice. May be null.
     * @return one detection per region, in the same order
     */
    public List<Detection> localize(int frame, List<Region> regions, float[] edof) {
        List<Detection> res = new ArrayList<>(regions.size());
        for (Region r : regions) res.add(localize(frame, r, edof));
        return res;
    }

    public Detection localize(int frame, Region region, float[] edof) {
        int[] pixels = region.getPixels();
        if (pixels.length==0) throw new IllegalArgumentException("Cannot localize empty region: "+region);
        double depth = getDepthIndex(pixels);
        int slice = (int)Math.round(depth);
        slice = Math.max(0, Math.min(volumes.getDepth()-1, slice));
        float[] darkPlane = volumes.dark.getPixelArray()[slice];
        int xyMax = pixels[0];
        for (int xy : pixels) if (darkPlane[xy]>darkPlane[xyMax]) xyMax = xy;
        if (edof!=null) for (int xy : pixels) edof[xy] = darkPlane[xy];
        Detection d = new Detection(frame, region.getLabel(), xyMax % sizeX, xyMax / sizeX, depth, slice);
        logger.trace("frame: {} region: {} -> {}", frame, region, d);
        return d;
    }

    /**
     * 
     * @param pixels linear indices of an object
     * @return mean depth index of the pixels whose maximal gradient is above the {@link #SHARPNESS_QUANTILE} quantile, weighted by the maximal gradient
     */
    public double getDepthIndex(int[] pixels) {
        float[] values = new float[pixels.length];
        for (int i = 0; i<pixels.length; ++i) values[i] = maxGradient[pixels[i]];
        double q = ArrayUtil.quantile(values, SHARPNESS_QUANTILE);
        double[] sums = sharpSums(pixels, q, false);
        if (sums[3]==0) sums = sharpSums(pixels, q, true); // values above the quantile are all equal to it
        if (sums[3]==0) sums = sharpSums(pixels, Double.NEGATIVE_INFINITY, true); // rounding of the interpolated quantile
        if (sums[0]==0) return sums[2] / sums[3];
        return sums[1] / sums[0];
    }

    /**
     * @return sum of weights, weighted sum of depths, sum of depths and count, over pixels above {@param threshold}
     */
    private double[] sharpSums(int[] pixels, double threshold, boolean inclusive) {
        double sumW = 0, sumWD = 0, sumD = 0;
        int count = 0;
        for (int xy : pixels) {
            float m = maxGradient[xy];
            if (m>threshold || (inclusive && m>=threshold)) {
                sumW += m;
                sumWD += m * maxGradientDepth[xy];
                sumD += maxGradientDepth[xy];
                ++count;
            }
        }
        return new double[]{sumW, sumWD, sumD, count};
    }
}
