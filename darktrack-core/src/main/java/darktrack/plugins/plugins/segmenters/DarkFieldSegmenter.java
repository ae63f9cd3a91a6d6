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
package darktrack.plugins.plugins.segmenters;

import darktrack.configuration.ReconstructionOptions;
import darktrack.configuration.parameters.BoundedNumberParameter;
import darktrack.configuration.parameters.Parameter;
import darktrack.data_structure.Region;
import darktrack.image.ImageByte;
import darktrack.image.ImageFloat;
import darktrack.plugins.Hint;
import darktrack.plugins.Segmenter;
import darktrack.plugins.plugins.thresholders.IJAutoThresholder;
import darktrack.plugins.plugins.thresholders.LocalMeanThresholder;
import darktrack.processing.Filters;
import darktrack.processing.ImageLabeller;
import darktrack.processing.ImageOperations;
import darktrack.processing.holography.FrameVolumes;
import ij.process.AutoThresholder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Segments scattering objects on the projection of the reconstructed volumes:
 * score = max_z(dark-field) × gaussian(max_z(gradient)), normalized to [0;1],
 * thresholded with the mean of a local and a global (Otsu) threshold.
 * Small components are discarded.
 * @author Jean Ollion
 */
public class DarkFieldSegmenter implements Segmenter, Hint {
    public final static Logger logger = LoggerFactory.getLogger(DarkFieldSegmenter.class);
    BoundedNumberParameter minObjectPixels = new BoundedNumberParameter("Minimal object size", 0, ReconstructionOptions.DEFAULT_MIN_OBJECT_PIXELS, 0, null).setHint("Connected components with fewer pixels are removed");
    BoundedNumberParameter gradientSmoothScale = new BoundedNumberParameter("Gradient smooth scale", 1, 4, 0, null).setHint("Sigma of the gaussian applied to the projected gradient");
    final LocalMeanThresholder localThresholder = new LocalMeanThresholder();
    final IJAutoThresholder globalThresholder = new IJAutoThresholder().setMethod(AutoThresholder.Method.Otsu);

    public DarkFieldSegmenter() {}

    public DarkFieldSegmenter(int minObjectPixels) {
        this.minObjectPixels.setValue(minObjectPixels);
    }

    public DarkFieldSegmenter setMinObjectPixels(int minObjectPixels) {
        this.minObjectPixels.setValue(minObjectPixels);
        return this;
    }

    public int getMinObjectPixels() {
        return minObjectPixels.getIntValue();
    }

    /**
     * 
     * @return normalized score image
     */
    public ImageFloat getScoreImage(FrameVolumes volumes) {
        ImageFloat darkMax = ImageOperations.maxZProjection(volumes.dark);
        ImageFloat gradMax = Filters.gaussianSmooth(ImageOperations.maxZProjection(volumes.grad), gradientSmoothScale.getDoubleValue());
        return ImageOperations.normalize(ImageOperations.multiply(darkMax, gradMax)).setName("score");
    }

    /**
     * 
     * @param score image normalized to [0;1]
     * @return pixels strictly above the mean of the local and global thresholds
     */
    public ImageByte getForegroundMask(ImageFloat score) {
        ImageFloat local = localThresholder.runLocalThresholder(score);
        double global = globalThresholder.runSimpleThresholder(score, null);
        logger.trace("global threshold: {}", global);
        ImageByte mask = new ImageByte("foreground", score);
        float[] s = score.getPixelArray()[0];
        float[] l = local.getPixelArray()[0];
        byte[] m = mask.getPixelArray()[0];
        for (int i = 0; i<s.length; ++i) {
            if (s[i] > (l[i] + global) / 2) m[i] = 1;
        }
        return mask;
    }

    @Override
    public List<Region> runSegmenter(FrameVolumes volumes) {
        ImageByte mask = getForegroundMask(getScoreImage(volumes));
        List<Region> components = ImageLabeller.labelImage(mask);
        int minSize = getMinObjectPixels();
        List<Region> res = new ArrayList<>(components.size());
        for (Region r : components) {
            if (r.size()>=minSize) res.add(r.setLabel(res.size()+1));
        }
        logger.trace("components: {}, objects: {} (min size: {})", components.size(), res.size(), minSize);
        return res;
    }

    @Override
    public Parameter[] getParameters() {
        return new Parameter[]{minObjectPixels, gradientSmoothScale};
    }

    @Override
    public String getHintText() {
        return "Segments objects on the product of the maximal dark-field amplitude and the smoothed maximal gradient over the propagation range";
    }
}
