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
package darktrack.core;

import darktrack.data_structure.Detection;
import darktrack.data_structure.Trajectories;
import darktrack.image.ImageFloat;

import java.util.List;

/**
 * Output of a run: trajectories in physical units, extended depth of field and classical reconstruction volumes (Z = frame)
 * and the detections of each frame, in pixel units
 * @author Jean Ollion
 */
public class DarkTrackResult {
    final Trajectories trajectories;
    final ImageFloat edof, classicalReconstruction;
    final List<List<Detection>> detections;

    public DarkTrackResult(Trajectories trajectories, ImageFloat edof, ImageFloat classicalReconstruction, List<List<Detection>> detections) {
        this.trajectories = trajectories;
        this.edof = edof;
        this.classicalReconstruction = classicalReconstruction;
        this.detections = detections;
    }

    public Trajectories getTrajectories() {
        return trajectories;
    }

    public ImageFloat getEDOF() {
        return edof;
    }

    public ImageFloat getClassicalReconstruction() {
        return classicalReconstruction;
    }

    public List<List<Detection>> getDetections() {
        return detections;
    }

    @Override
    public String toString() {
        return "DarkTrackResult{"+trajectories+", frames="+detections.size()+"}";
    }
}
