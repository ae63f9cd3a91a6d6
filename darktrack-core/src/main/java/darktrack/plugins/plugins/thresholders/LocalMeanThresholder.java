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
package darktrack.plugins.plugins.thresholders;

import darktrack.configuration.parameters.BoundedNumberParameter;
import darktrack.configuration.parameters.Parameter;
import darktrack.image.ImageFloat;
import darktrack.plugins.Hint;
import darktrack.plugins.LocalThresholder;
import darktrack.processing.Filters;

/**
 * Adaptive threshold: local mean scaled by a sensitivity-dependent factor, clipped to [0;1].
 * The neighborhood spans 2 * floor(size / 16) + 1 pixels along each axis.
 * @author Jean Ollion
 */
public class LocalMeanThresholder implements LocalThresholder, Hint {
    BoundedNumberParameter sensitivity = new BoundedNumberParameter("Sensitivity", 3, 0.5, 0, 1).setHint("Higher values lower the threshold");
    BoundedNumberParameter neighborhoodFraction = new BoundedNumberParameter("Neighborhood fraction", 0, 16, 1, null).setHint("Neighborhood half-size is the image size divided by this value");

    public LocalMeanThresholder setSensitivity(double sensitivity) {
        this.sensitivity.setValue(sensitivity);
        return this;
    }

    @Override
    public ImageFloat runLocalThresholder(ImageFloat input) {
        return run(input, sensitivity.getDoubleValue(), neighborhoodFraction.getIntValue());
    }

    public static ImageFloat run(ImageFloat input, double sensitivity, int neighborhoodFraction) {
        int radX = input.sizeX() / neighborhoodFraction;
        int radY = input.sizeY() / neighborhoodFraction;
        ImageFloat mean = Filters.localMean(input, radX, radY);
        double factor = 0.6 + (1 - sensitivity);
        float[] p = mean.getPixelArray()[0];
        for (int i = 0; i<p.length; ++i) {
            double v = p[i] * factor;
            p[i] = (float)(v<0 ? 0 : (v>1 ? 1 : v));
        }
        return mean.setName("local threshold");
    }

    @Override
    public Parameter[] getParameters() {
        return new Parameter[]{sensitivity, neighborhoodFraction};
    }

    @Override
    public String getHintText() {
        return "Adaptive threshold based on the local mean intensity. Input values are expected in [0;1]";
    }
}
