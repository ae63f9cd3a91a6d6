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

import darktrack.configuration.BackgroundRemoval;
import darktrack.configuration.ConfigurationException;
import darktrack.image.ImageFloat;
import darktrack.processing.Filters;
import darktrack.processing.ImageOperations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a {@link BackgroundRemoval} option into a {@link BackgroundProvider}
 * @author Jean Ollion
 */
public class BackgroundEstimator {
    public final static Logger logger = LoggerFactory.getLogger(BackgroundEstimator.class);
    public final static double SMOOTH_SIGMA = 30;

    /**
     * 
     * @param removal background option
     * @param holograms whole hologram stack, Z = frames
     * @param border padding applied to frames before propagation
     * @return background provider
     * @throws ConfigurationException if an explicit background does not match the stack
     */
    public static BackgroundProvider resolve(BackgroundRemoval removal, ImageFloat holograms, int border) {
        BackgroundRemoval.Mode mode = removal.resolveMode(holograms.sizeZ());
        logger.debug("background removal: {} (requested: {}) frames: {}", mode, removal.getMode(), holograms.sizeZ());
        switch (mode) {
            case GLOBAL_MEAN: {
                ImageFloat padded = ImageOperations.pad(ImageOperations.meanZProjection(holograms, holograms.sizeZ()), border);
                return (frame, hologram) -> padded;
            }
            case PER_FRAME_SMOOTHED:
                return (frame, hologram) -> ImageOperations.pad(Filters.gaussianSmooth(hologram, SMOOTH_SIGMA), border);
            case EXPLICIT: {
                ImageFloat bck = removal.getBackground();
                if (!bck.sameDimensions2D(holograms)) throw new ConfigurationException("Background dimensions: "+bck.sizeX()+"x"+bck.sizeY()+" differ from hologram dimensions: "+holograms.sizeX()+"x"+holograms.sizeY());
                if (bck.sizeZ()==1) {
                    ImageFloat padded = ImageOperations.pad(bck, border);
                    return (frame, hologram) -> padded;
                }
                if (bck.sizeZ()!=holograms.sizeZ()) throw new ConfigurationException("3D background should have one plane per frame: "+bck.sizeZ()+" planes for "+holograms.sizeZ()+" frames");
                return (frame, hologram) -> ImageOperations.pad(bck.getZPlane(frame), border);
            }
            default:
                throw new ConfigurationException("Unresolved background mode: "+mode);
        }
    }
}
