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

import darktrack.data_structure.Region;
import darktrack.processing.holography.FrameVolumes;

import java.util.List;

/**
 * Detects objects of one frame from its reconstructed volumes
 * @author Jean Ollion
 */
public interface Segmenter extends Plugin {
    /**
     * 
     * @param volumes reconstruction of the frame
     * @return objects, labelled from 1 in list order; possibly empty
     */
    List<Region> runSegmenter(FrameVolumes volumes);
}
