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
package darktrack.data_structure;

import darktrack.utils.geom.Point;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Holds all tracks of a run. Track ids are their creation index; tracks are never removed.
 * @author Jean Ollion
 */
public class TrackTable {
    final List<Track> tracks = new ArrayList<>();
    int frameCount;

    public TrackTable(int frameCount) {
        this.frameCount = frameCount;
    }

    public Track createTrack(int birthFrame) {
        Track t = new Track(tracks.size(), birthFrame);
        tracks.add(t);
        if (birthFrame>=frameCount) frameCount = birthFrame+1;
        return t;
    }

    public Track getTrack(int id) {
        return tracks.get(id);
    }

    public List<Track> getTracks() {
        return Collections.unmodifiableList(tracks);
    }

    public int size() {
        return tracks.size();
    }

    public int getFrameCount() {
        return frameCount;
    }

    /**
     * 
     * @return number of tracks present at {@param frame}
     */
    public int presentCount(int frame) {
        int count = 0;
        for (Track t : tracks) if (t.isPresent(frame)) ++count;
        return count;
    }

    /**
     * 
     * @return coordinates as [axis][track][frame] with axis X, Y, Z; NaN where a track is absent
     */
    public double[][][] toArrays() {
        double[][][] res = new double[3][tracks.size()][frameCount];
        for (int i = 0; i<tracks.size(); ++i) {
            Track t = tracks.get(i);
            for (int f = 0; f<frameCount; ++f) {
                Point p = t.getPosition(f);
                res[0][i][f] = p==null ? Double.NaN : p.x;
                res[1][i][f] = p==null ? Double.NaN : p.y;
                res[2][i][f] = p==null ? Double.NaN : p.z;
            }
        }
        return res;
    }

    public Trajectories toTrajectories() {
        double[][][] xyz = toArrays();
        return new Trajectories(xyz[0], xyz[1], xyz[2], frameCount);
    }
}
