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
package darktrack.configuration;

import darktrack.configuration.parameters.BoundedNumberParameter;
import darktrack.configuration.parameters.EnumChoiceParameter;
import darktrack.configuration.parameters.GroupParameter;
import darktrack.image.ImageFloat;

import java.util.List;

/**
 * Advanced options of the reconstruction. All have default values.
 * @author Jean Ollion
 */
public class ReconstructionOptions extends GroupParameter<ReconstructionOptions> {
    public final static int DEFAULT_MIN_OBJECT_PIXELS = 10;
    BoundedNumberParameter minObjectPixels = new BoundedNumberParameter("minObjectPixels", 0, DEFAULT_MIN_OBJECT_PIXELS, 0, null).setHint("Connected components with fewer pixels are discarded as noise");
    BoundedNumberParameter verbosity = new BoundedNumberParameter("verbosity", 0, 1, 0, 3).setHint("Display of intermediate results. 0: none; 1: progress; 2: progress and EDOF images; 3: also classical reconstruction and label maps");
    BoundedNumberParameter frameNumber = new BoundedNumberParameter("frameNumber", 0, 0, 0, null).setHint("Number of frames to process, from the first one. 0 means all frames");
    EnumChoiceParameter<BackgroundRemoval.Mode> backgroundRemoval = new EnumChoiceParameter<>("backgroundRemoval", new BackgroundRemoval.Mode[]{BackgroundRemoval.Mode.AUTO, BackgroundRemoval.Mode.GLOBAL_MEAN, BackgroundRemoval.Mode.PER_FRAME_SMOOTHED}, BackgroundRemoval.Mode.AUTO).setHint("Background estimation. Explicit backgrounds are set programmatically");
    EnumChoiceParameter<AccelerationMode> acceleration = new EnumChoiceParameter<>("acceleration", AccelerationMode.values(), AccelerationMode.AUTO).setHint("Use of an accelerated numeric backend");
    BoundedNumberParameter threads = new BoundedNumberParameter("threads", 0, 0, 0, null).setHint("Number of threads used for propagation. 0 means all processors");
    ImageFloat explicitBackground;

    public ReconstructionOptions() {
        super("advanced");
        children.add(minObjectPixels);
        children.add(verbosity);
        children.add(frameNumber);
        children.add(backgroundRemoval);
        children.add(acceleration);
        children.add(threads);
    }

    public int getMinObjectPixels() {
        return minObjectPixels.getIntValue();
    }
    public ReconstructionOptions setMinObjectPixels(int minPix) {
        minObjectPixels.setValue(minPix);
        return this;
    }
    public int getVerbosity() {
        return verbosity.getIntValue();
    }
    public ReconstructionOptions setVerbosity(int level) {
        verbosity.setValue(level);
        return this;
    }

    /**
     * 
     * @return number of frames to process; 0 means all frames
     */
    public int getFrameNumber() {
        return frameNumber.getIntValue();
    }
    public ReconstructionOptions setFrameNumber(int frameNumber) {
        this.frameNumber.setValue(frameNumber);
        return this;
    }
    public AccelerationMode getAcceleration() {
        return acceleration.getSelectedEnum();
    }
    public ReconstructionOptions setAcceleration(AccelerationMode mode) {
        acceleration.setSelectedEnum(mode);
        return this;
    }
    public int getThreads() {
        return threads.getIntValue();
    }
    public ReconstructionOptions setThreads(int threads) {
        this.threads.setValue(threads);
        return this;
    }

    public BackgroundRemoval getBackgroundRemoval() {
        if (explicitBackground!=null) return BackgroundRemoval.explicit(explicitBackground);
        return BackgroundRemoval.of(backgroundRemoval.getSelectedEnum());
    }

    public ReconstructionOptions setBackgroundRemoval(BackgroundRemoval removal) {
        if (BackgroundRemoval.Mode.EXPLICIT.equals(removal.getMode())) {
            explicitBackground = removal.getBackground();
        } else {
            explicitBackground = null;
            backgroundRemoval.setSelectedEnum(removal.getMode());
        }
        return this;
    }

    /**
     * 
     * @param stackFrameCount number of frames of the hologram stack
     * @return number of frames actually processed
     * @throws ConfigurationException if the frame number exceeds the stack frame count
     */
    public int getFrameNumber(int stackFrameCount) {
        int n = getFrameNumber();
        if (n==0) return stackFrameCount;
        if (n>stackFrameCount) throw new ConfigurationException("Frame number: "+n+" exceeds the number of frames of the stack: "+stackFrameCount);
        return n;
    }

    /**
     * @throws ConfigurationException listing invalid fields
     */
    public void validate() {
        List<String> invalid = getInvalidParameterNames();
        if (!invalid.isEmpty()) throw new ConfigurationException("Invalid advanced parameter(s): "+String.join(", ", invalid));
    }
}
