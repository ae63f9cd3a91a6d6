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

import darktrack.image.ImageFloat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-run frame-indexed storage: detections, extended depth of field and classical reconstruction planes.
 * Each frame slot is written once, by the thread processing this frame.
 * @author Jean Ollion
 */
public class ReconstructionContext {
    final List<List<Detection>> detections;
    final ImageFloat edof, classicalReconstruction;
    final boolean[] processed;

    public ReconstructionContext(int sizeX, int sizeY, int frameCount) {
        this.detections = new ArrayList<>(frameCount);
        for (int f = 0; f<frameCount; ++f) detections.add(Collections.emptyList());
        this.edof = new ImageFloat("EDOF", sizeX, sizeY, frameCount);
        this.classicalReconstruction = new ImageFloat("CR", sizeX, sizeY, frameCount);
        this.processed = new boolean[frameCount];
    }

    public int getFrameCount() {
        return processed.length;
    }

    public synchronized void setFrame(int frame, List<Detection> frameDetections, float[] edofPlane, float[] crPlane) {
        if (processed[frame]) throw new IllegalStateException("Frame "+frame+" already processed");
        detections.set(frame, Collections.unmodifiableList(new ArrayList<>(frameDetections)));
        edof.setPlane(frame, edofPlane);
        classicalReconstruction.setPlane(frame, crPlane);
        processed[frame] = true;
    }

    public boolean isProcessed(int frame) {
        return processed[frame];
    }

    public List<Detection> getDetections(int frame) {
        return detections.get(frame);
    }

    public List<List<Detection>> getDetections() {
        return Collections.unmodifiableList(detections);
    }

    public ImageFloat getEDOF() {
        return edof;
    }

    public ImageFloat getClassicalReconstruction() {
        return classicalReconstruction;
    }
}
