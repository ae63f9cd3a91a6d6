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

import darktrack.image.ImageFloat;

/**
 * How the background subtracted from holograms is obtained.
 * Either a mode, or an explicit background image (2D: same background for all frames, 3D: one plane per stack frame).
 * @author Jean Ollion
 */
public final class BackgroundRemoval {
    public enum Mode {
        /** GLOBAL_MEAN if the stack has at least {@link #MIN_FRAMES_FOR_MEAN} frames, PER_FRAME_SMOOTHED otherwise */
        AUTO,
        /** mean of all frames of the stack */
        GLOBAL_MEAN,
        /** frame smoothed with a large gaussian kernel */
        PER_FRAME_SMOOTHED,
        EXPLICIT
    }
    public final static int MIN_FRAMES_FOR_MEAN = 10;
    private final static BackgroundRemoval AUTO = new BackgroundRemoval(Mode.AUTO, null);
    private final static BackgroundRemoval GLOBAL_MEAN = new BackgroundRemoval(Mode.GLOBAL_MEAN, null);
    private final static BackgroundRemoval PER_FRAME_SMOOTHED = new BackgroundRemoval(Mode.PER_FRAME_SMOOTHED, null);

    private final Mode mode;
    private final ImageFloat background;

    private BackgroundRemoval(Mode mode, ImageFloat background) {
        this.mode = mode;
        this.background = background;
    }

    public static BackgroundRemoval auto() {
        return AUTO;
    }
    public static BackgroundRemoval globalMean() {
        return GLOBAL_MEAN;
    }
    public static BackgroundRemoval perFrameSmoothed() {
        return PER_FRAME_SMOOTHED;
    }
    public static BackgroundRemoval explicit(ImageFloat background) {
        if (background==null) throw new ConfigurationException("Explicit background cannot be null");
        return new BackgroundRemoval(Mode.EXPLICIT, background);
    }
    public static BackgroundRemoval of(Mode mode) {
        switch (mode) {
            case AUTO: return AUTO;
            case GLOBAL_MEAN: return GLOBAL_MEAN;
            case PER_FRAME_SMOOTHED: return PER_FRAME_SMOOTHED;
            default: throw new ConfigurationException("Explicit background requires an image");
        }
    }

    public Mode getMode() {
        return mode;
    }

    /**
     * 
     * @return explicit background, null for other modes
     */
    public ImageFloat getBackground() {
        return background;
    }

    /**
     * 
     * @param frameCount number of frames of the hologram stack
     * @return AUTO resolved into the mode actually used
     */
    public Mode resolveMode(int frameCount) {
        if (!Mode.AUTO.equals(mode)) return mode;
        return frameCount >= MIN_FRAMES_FOR_MEAN ? Mode.GLOBAL_MEAN : Mode.PER_FRAME_SMOOTHED;
    }

    @Override
    public String toString() {
        return Mode.EXPLICIT.equals(mode) ? mode+"("+background+")" : mode.toString();
    }
}
