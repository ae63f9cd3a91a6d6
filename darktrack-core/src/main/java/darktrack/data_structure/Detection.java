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

import darktrack.configuration.OpticalGeometry;
import darktrack.utils.geom.Point;

/**
 * Object localized in one frame, in pixel units
 * @author Jean Ollion
 */
public class Detection {
    final int frame, label;
    final int x, y;
    final double depthIndex;
    final int focusSlice;

    /**
     * 
     * @param frame frame index (0-based)
     * @param label label of the object within the frame
     * @param x 0-based pixel column
     * @param y 0-based pixel row
     * @param depthIndex fractional index in the sampled distances
     * @param focusSlice rounded depth index
     */
    public Detection(int frame, int label, int x, int y, double depthIndex, int focusSlice) {
        this.frame = frame;
        this.label = label;
        this.x = x;
        this.y = y;
        this.depthIndex = depthIndex;
        this.focusSlice = focusSlice;
    }

    public int getFrame() {
        return frame;
    }

    public int getLabel() {
        return label;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public double getDepthIndex() {
        return depthIndex;
    }

    public int getFocusSlice() {
        return focusSlice;
    }

    /**
     * 
     * @return position in micrometers: X and Y scaled by the effective pixel size, Z within the propagation range
     */
    public Point toPhysical(OpticalGeometry geometry) {
        double dPix = geometry.getEffectivePixelSize();
        return new Point(x * dPix, y * dPix, geometry.toPhysicalZ(depthIndex));
    }

    @Override
    public String toString() {
        return "Detection{f="+frame+", l="+label+", x="+x+", y="+y+", z="+depthIndex+"}";
    }
}
