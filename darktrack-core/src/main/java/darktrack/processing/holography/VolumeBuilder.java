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
import darktrack.image.ImageFloat;
import darktrack.processing.ImageDerivatives;
import darktrack.processing.ImageOperations;
import darktrack.processing.backend.ComplexField;
import darktrack.processing.backend.NumericBackend;
import darktrack.utils.ThreadRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;

/**
 * Reconstructs a hologram frame at every sampled distance of the propagation range.
 * The frame is padded, the background is subtracted and the result is transformed once;
 * each distance then costs one kernel multiplication and one inverse transform. Distances are processed in parallel.
 * @author Jean Ollion
 */
public class VolumeBuilder {
    public final static Logger logger = LoggerFactory.getLogger(VolumeBuilder.class);
    public final static int DEFAULT_PADDING = 100;
    final int sizeX, sizeY, padding;
    final double[] distances;
    final int middleIndex;
    final Propagator propagator;
    final ExecutorService executor;

    /**
     * 
     * @param geometry acquisition geometry
     * @param sizeX width of the holograms
     * @param sizeY height of the holograms
     * @param padding zero border added on each side
     * @param backend numeric backend
     * @param executor used for the loop over distances; if null distances are processed in the calling thread
     */
    public VolumeBuilder(OpticalGeometry geometry, int sizeX, int sizeY, int padding, NumericBackend backend, ExecutorService executor) {
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.padding = padding;
        this.distances = geometry.getDistances();
        this.middleIndex = geometry.getMiddleDistanceIndex();
        this.propagator = new Propagator(new FrequencyKernel(sizeX + 2 * padding, sizeY + 2 * padding, geometry), backend);
        this.executor = executor;
        logger.debug("volume builder: frame {}x{} padding: {} distances: {} [{}; {}]", sizeX, sizeY, padding, distances.length, distances[0], distances[distances.length-1]);
    }

    public VolumeBuilder(OpticalGeometry geometry, int sizeX, int sizeY, NumericBackend backend, ExecutorService executor) {
        this(geometry, sizeX, sizeY, DEFAULT_PADDING, backend, executor);
    }

    public int getPadding() {
        return padding;
    }

    public Propagator getPropagator() {
        return propagator;
    }

    /**
     * 
     * @param hologram 2D hologram
     * @param paddedBackground background padded by {@link #getPadding()}
     * @return spectrum of the padded dark-field hologram
     */
    public ComplexField getDarkFieldSpectrum(ImageFloat hologram, ImageFloat paddedBackground) {
        if (hologram.sizeX()!=sizeX || hologram.sizeY()!=sizeY) throw new IllegalArgumentException("Hologram dimensions: "+hologram+" differ from "+sizeX+"x"+sizeY);
        ImageFloat darkField = ImageOperations.subtract(ImageOperations.pad(hologram, padding), paddedBackground, "dark-field");
        return propagator.getBackend().forwardTransform(darkField);
    }

    /**
     * 
     * @param hologram 2D hologram
     * @param paddedBackground background padded by {@link #getPadding()}
     * @return dark-field and gradient volumes, complete: all distance workers have ended
     */
    public FrameVolumes build(ImageFloat hologram, ImageFloat paddedBackground) {
        ComplexField spectrum = getDarkFieldSpectrum(hologram, paddedBackground);
        ImageFloat dark = new ImageFloat("dark-field", sizeX, sizeY, distances.length);
        ImageFloat grad = new ImageFloat("gradient", sizeX, sizeY, distances.length);
        ThreadRunner.execute(distances.length, "propagation", k -> {
            float[] amplitude = propagator.propagateAmplitude(spectrum, distances[k], padding);
            dark.setPlane(k, amplitude);
            grad.setPlane(k, ImageDerivatives.gradientSquaredMagnitude(amplitude, sizeX, sizeY));
        }, executor);
        return new FrameVolumes(dark, grad, middleIndex);
    }
}
