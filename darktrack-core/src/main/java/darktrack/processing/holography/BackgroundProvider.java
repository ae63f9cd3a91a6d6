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
 * Background subtracted from each hologram frame, resolved once per run
 * @author Jean Ollion
 */
public interface BackgroundProvider {
    /**
     * 
     * @param frame frame index in the hologram stack
     * @param hologram hologram of this frame (unpadded)
     * @return background, zero-padded like the holograms
     */
    ImageFloat getBackground(int frame, ImageFloat hologram);
}
