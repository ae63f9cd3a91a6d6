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
package darktrack.test_utils;

import darktrack.configuration.OpticalGeometry;
import darktrack.image.ImageFloat;
import darktrack.processing.backend.ComplexField;
import darktrack.processing.backend.JTransformsBackend;
import darktrack.processing.holography.FrequencyKernel;
import darktrack.processing.holography.Propagator;
import darktrack.processing.holography.VolumeBuilder;

/**
 * In-line holograms of opaque disks under plane wave illumination of unit intensity:
 * the transmittance of the object plane is propagated to the sensor and the intensity is recorded.
 * The object plane is padded by {@link VolumeBuilder#DEFAULT_PADDING} pixels on each side so that diffraction does not wrap around the frame.
 * @author Jean Ollion
 */
public class SyntheticHolograms {
    final int sizeX, sizeY, padding;
    final Propagator propagator;

    public SyntheticHolograms(int sizeX, int sizeY, OpticalGeometry geometry) {
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.padding = VolumeBuilder.DEFAULT_PADDING;
        this.propagator = new Propagator(new FrequencyKernel(sizeX + 2 * padding, sizeY + 2 * padding, geometry), new JTransformsBackend());
    }

    /**
     * 
     * @param x center of the disk (pixels)
     * @param y center of the disk (pixels)
     * @param radius radius of the disk (pixels)
     * @param distance distance between the disk and the sensor (micrometers)
     * @return hologram intensity
     */
    public ImageFloat hologram(double x, double y, double radius, double distance) {
        int pX = sizeX + 2 * padding;
        int pY = sizeY + 2 * padding;
        ComplexField object = new ComplexField(pX, pY);
        for (int j = 0; j<pY; ++j) {
            for (int i = 0; i<pX; ++i) {
                double dx = i - padding - x;
                double dy = j - padding - y;
                object.set(i, j, dx*dx + dy*dy <= radius*radius ? 0 : 1, 0);
            }
        }
        ComplexField sensor = propagator.propagateField(object, -distance);
        float[] intensity = new float[sizeX*sizeY];
        for (int j = 0; j<sizeY; ++j) {
            for (int i = 0; i<sizeX; ++i) {
                double m = sensor.getModulus(i + padding, j + padding);
                intensity[i + j*sizeX] = (float)(m*m);
            }
        }
        return new ImageFloat("hologram", sizeX, intensity);
    }

    /**
     * 
     * @param xy disk centers per frame, as {x, y} in pixels
     * @param depth distance of the disks to the sensor per frame (micrometers)
     * @return stack of holograms, Z = frame
     */
    public ImageFloat stack(double[][] xy, double[] depth, double radius) {
        float[][] planes = new float[xy.length][];
        for (int t = 0; t<xy.length; ++t) planes[t] = hologram(xy[t][0], xy[t][1], radius, depth[t]).getPixelArray()[0];
        return new ImageFloat("holograms", sizeX, planes);
    }
}
