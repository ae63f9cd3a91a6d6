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

import darktrack.configuration.parameters.EnumChoiceParameter;
import darktrack.configuration.parameters.Parameter;
import darktrack.image.Histogram;
import darktrack.image.Image;
import darktrack.image.ImageMask;
import darktrack.plugins.Hint;
import darktrack.plugins.SimpleThresholder;
import ij.process.AutoThresholder;
import ij.process.AutoThresholder.Method;

/**
 * ImageJ's automatic thresholds, on the 256-bin histogram of an image normalized to [0;1]
 * @author Jean Ollion
 */
public class IJAutoThresholder implements SimpleThresholder, Hint {
    EnumChoiceParameter<Method> method = new EnumChoiceParameter<>("Method", Method.values(), Method.Otsu);
    
    public IJAutoThresholder setMethod(Method method) {
        this.method.setSelectedEnum(method);
        return this;
    }
    
    @Override 
    public double runSimpleThresholder(Image input, ImageMask mask) {
        return runThresholder(input, mask, method.getSelectedEnum());
    }

    /**
     * 
     * @param input image with values in [0;1]
     * @return threshold as a value in [0;1]: pixels strictly above it are foreground
     */
    public static double runThresholder(Image input, ImageMask mask, Method method) {
        Histogram histo = Histogram.getUnitHistogram(input, mask, 256);
        return runThresholder(method, histo);
    }
    
    public static double runThresholder(Method method, Histogram histo) {
        if (method==null) return Double.NaN;
        if (histo.data.length!=256) throw new IllegalArgumentException("Histogram should have 256 bins");
        if (histo.count()==0) return Double.NaN;
        AutoThresholder at = new AutoThresholder();
        int thld = at.getThreshold(method, histo.data);
        return histo.getValueFromIdx(thld);
    }

    @Override
    public Parameter[] getParameters() {
        return new Parameter[]{method};
    }

    @Override
    public String getHintText() {
        return "Global threshold computed by ImageJ's AutoThresholder. Input values are expected in [0;1]";
    }
}
