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

import darktrack.image.ImageFloat;

/**
 * Reconstruction of one frame: dark-field amplitude and squared gradient magnitude for each sampled distance (Z = distance index),
 * and the classical reconstruction at the middle distance
 * @author Jean Ollion
 */
public class FrameVolumes {
    public final ImageFloat dark, grad, classicalReconstruction;
    public final int middleIndex;

    public FrameVolumes(ImageFloat dark, ImageFloat grad, int middleIndex) {
        if (!dark.sameDimensions(grad)) throw new IllegalArgumentException("Dark and gradient volumes should have same dimensions");
        this.dark = dark;
        this.grad = grad;
        this.middleIndex = middleIndex;
        this.classicalReconstruction = dark.getZPlane(middleIndex).duplicate("CR");
    }

    public int getDepth() {
        return dark.sizeZ();
    }
}
