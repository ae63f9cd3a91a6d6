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

/**
 * Physical coordinates of tracks as tables [track][frame]; NaN where a track is absent
 * @author Jean Ollion
 */
public class Trajectories {
    final double[][] x, y, z;
    final int frameCount;

    /**
     * 
     * @param frameCount number of processed frames, kept when there is no track
     */
    public Trajectories(double[][] x, double[][] y, double[][] z, int frameCount) {
        if (x.length!=y.length || x.length!=z.length) throw new IllegalArgumentException("Coordinate tables should have the same number of tracks");
        for (double[][] axis : new double[][][]{x, y, z}) {
            for (double[] row : axis) if (row.length!=frameCount) throw new IllegalArgumentException("Track row of "+row.length+" frames, expected "+frameCount);
        }
        this.x = x;
        this.y = y;
        this.z = z;
        this.frameCount = frameCount;
    }

    public double[][] getX() {
        return x;
    }

    public double[][] getY() {
        return y;
    }

    public double[][] getZ() {
        return z;
    }

    public int getTrackCount() {
        return x.length;
    }

    public int getFrameCount() {
        return frameCount;
    }

    public boolean isPresent(int track, int frame) {
        return !Double.isNaN(x[track][frame]);
    }

    /**
     * 
     * @return number of tracks present at {@param frame}
     */
    public int presentCount(int frame) {
        int count = 0;
        for (int i = 0; i<x.length; ++i) if (isPresent(i, frame)) ++count;
        return count;
    }

    @Override
    public String toString() {
        return "Trajectories{tracks="+getTrackCount()+", frames="+getFrameCount()+"}";
    }
}
