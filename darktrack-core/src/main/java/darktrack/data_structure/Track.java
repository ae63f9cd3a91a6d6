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
import java.util.List;

/**
 * Sequence of positions of one object, from its birth frame on. A null slot means the object is absent at this frame.
 * @author Jean Ollion
 */
public class Track {
    final int id;
    final int birthFrame;
    final List<Point> positions = new ArrayList<>();

    Track(int id, int birthFrame) {
        this.id = id;
        this.birthFrame = birthFrame;
    }

    public int getId() {
        return id;
    }

    public int getBirthFrame() {
        return birthFrame;
    }

    /**
     * 
     * @return last frame with a slot, present or not
     */
    public int getLastFrame() {
        return birthFrame + positions.size() - 1;
    }

    /**
     * 
     * @param frame frame index
     * @return position at {@param frame}, null if absent or outside the track's frames
     */
    public Point getPosition(int frame) {
        int idx = frame - birthFrame;
        if (idx<0 || idx>=positions.size()) return null;
        return positions.get(idx);
    }

    public boolean isPresent(int frame) {
        return getPosition(frame)!=null;
    }

    /**
     * Sets the position at {@param frame}, replacing an existing one. Slots between the last frame and {@param frame} are absent.
     * @param position null to mark the track absent
     */
    public void setPosition(int frame, Point position) {
        int idx = frame - birthFrame;
        if (idx<0) throw new IllegalArgumentException("Frame "+frame+" is before birth frame "+birthFrame+" of track "+id);
        while (positions.size()<=idx) positions.add(null);
        positions.set(idx, position);
    }

    /**
     * 
     * @param fromFrame first frame considered, inclusive
     * @param toFrame last frame considered, inclusive
     * @return index of the last frame within [{@param fromFrame}; {@param toFrame}] where the track is present, -1 if none
     */
    public int lastPresentFrame(int fromFrame, int toFrame) {
        for (int f = Math.min(toFrame, getLastFrame()); f>=Math.max(fromFrame, birthFrame); --f) {
            if (isPresent(f)) return f;
        }
        return -1;
    }

    @Override
    public String toString() {
        return "Track{id="+id+", birth="+birthFrame+", frames="+positions.size()+"}";
    }
}
