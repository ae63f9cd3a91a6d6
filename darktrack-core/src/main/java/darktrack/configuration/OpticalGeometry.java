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
package darktrack.configuration;

import darktrack.configuration.parameters.BoundedNumberParameter;
import darktrack.configuration.parameters.GroupParameter;
import darktrack.configuration.parameters.IntervalParameter;

import java.util.List;

/**
 * Acquisition geometry. All lengths are in micrometers.
 * Sampled propagation distances are distance + range[0] + k * step, for k such that the value does not exceed distance + range[1].
 * @author Jean Ollion
 */
public class OpticalGeometry extends GroupParameter<OpticalGeometry> {
    BoundedNumberParameter distance = new BoundedNumberParameter("distance", 5, null).setHint("Base propagation distance (µm)");
    IntervalParameter propagationRange = new IntervalParameter("propagationRange", 5, null, null, 2).setHint("Lower and upper bounds of the propagation range, relative to the base distance (µm)");
    BoundedNumberParameter propagationStep = new BoundedNumberParameter("propagationStep", 5, null).addValidationFunction(p->p.getDoubleValue()>0).setHint("Step between sampled propagation distances (µm)");
    BoundedNumberParameter wavelength = new BoundedNumberParameter("wavelength", 5, null).addValidationFunction(p->p.getDoubleValue()>0).setHint("Illumination wavelength (µm)");
    BoundedNumberParameter pixelSize = new BoundedNumberParameter("pixelSize", 5, null).addValidationFunction(p->p.getDoubleValue()>0).setHint("Camera pixel pitch (µm)");
    BoundedNumberParameter magnification = new BoundedNumberParameter("magnification", 5, null).addValidationFunction(p->p.getDoubleValue()>0).setHint("Optical magnification");
    BoundedNumberParameter backgroundIndex = new BoundedNumberParameter("backgroundIndex", 5, 1).addValidationFunction(p->p.getDoubleValue()>0).setHint("Refractive index of the medium");
    // guards against floating-point error when the range is a multiple of the step
    static final double SAMPLING_EPSILON = 1e-10;

    public OpticalGeometry() {
        super("geometry");
        children.add(distance);
        children.add(propagationRange);
        children.add(propagationStep);
        children.add(wavelength);
        children.add(pixelSize);
        children.add(magnification);
        children.add(backgroundIndex);
    }

    public OpticalGeometry(double distance, double rangeLower, double rangeUpper, double step, double wavelength, double pixelSize, double magnification) {
        this();
        this.distance.setValue(distance);
        this.propagationRange.setValues(rangeLower, rangeUpper);
        this.propagationStep.setValue(step);
        this.wavelength.setValue(wavelength);
        this.pixelSize.setValue(pixelSize);
        this.magnification.setValue(magnification);
    }

    public OpticalGeometry setBackgroundIndex(double n0) {
        this.backgroundIndex.setValue(n0);
        return this;
    }

    public double getDistance() {
        return distance.getDoubleValue();
    }
    public double getRangeLower() {
        return propagationRange.getValuesAsDouble()[0];
    }
    public double getRangeUpper() {
        return propagationRange.getValuesAsDouble()[1];
    }
    public double getPropagationStep() {
        return propagationStep.getDoubleValue();
    }
    public double getWavelength() {
        return wavelength.getDoubleValue();
    }
    public double getPixelSize() {
        return pixelSize.getDoubleValue();
    }
    public double getMagnification() {
        return magnification.getDoubleValue();
    }
    public double getBackgroundIndex() {
        return backgroundIndex.getDoubleValue();
    }

    /**
     * 
     * @return pixel size in the object plane: pixelSize / magnification
     */
    public double getEffectivePixelSize() {
        return getPixelSize() / getMagnification();
    }

    /**
     * 
     * @return number of sampled distances, at least 1 for a valid geometry
     */
    public int getDistanceCount() {
        return (int)Math.floor((getRangeUpper() - getRangeLower()) / getPropagationStep() + SAMPLING_EPSILON) + 1;
    }

    public double[] getDistances() {
        int n = getDistanceCount();
        double[] res = new double[n];
        double start = getDistance() + getRangeLower();
        for (int k = 0; k<n; ++k) res[k] = start + k * getPropagationStep();
        return res;
    }

    /**
     * 
     * @return index of the mid-range sample exported as classical reconstruction
     */
    public int getMiddleDistanceIndex() {
        return Math.max(0, (int)Math.round(getDistanceCount() / 2.0) - 1);
    }

    /**
     * 
     * @param depthIndex fractional depth index, 0 = first sampled distance
     * @return axial position relative to the base distance
     */
    public double toPhysicalZ(double depthIndex) {
        return depthIndex * getPropagationStep() + getRangeLower();
    }

    /**
     * @throws ConfigurationException listing missing or invalid fields
     */
    public void validate() {
        List<String> invalid = getInvalidParameterNames();
        if (!invalid.isEmpty()) throw new ConfigurationException("Missing or invalid geometry parameter(s): "+String.join(", ", invalid));
    }
}
