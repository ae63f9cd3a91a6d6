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

import darktrack.data_structure.TrackTable;
import darktrack.utils.geom.Point;

import java.util.List;

/**
 * Links detections of successive frames
 * @author Jean Ollion
 */
public interface Tracker extends Plugin {
    /**
     * 
     * @param detections positions per frame, in physical units; a frame without detection is an empty list
     * @return tracks
     */
    TrackTable track(List<List<Point>> detections);
}
