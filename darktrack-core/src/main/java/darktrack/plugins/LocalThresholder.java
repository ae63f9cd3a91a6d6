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
package darktrack.plugins;

import darktrack.image.ImageFloat;

/**
 * Threshold that varies across the image
 * @author Jean Ollion
 */
public interface LocalThresholder extends Plugin {
    /**
     * 
     * @param input 2D image
     * @return threshold map, same dimensions as {@param input}
     */
    ImageFloat runLocalThresholder(ImageFloat input);
}
