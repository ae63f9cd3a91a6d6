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

import darktrack.configuration.DarkTrackConfiguration;
import darktrack.configuration.OpticalGeometry;
import darktrack.configuration.ReconstructionOptions;
import darktrack.data_structure.Detection;
import darktrack.data_structure.Region;
import darktrack.data_structure.ReconstructionContext;
import darktrack.data_structure.TrackTable;
import darktrack.image.ImageFloat;
import darktrack.image.ImageInt;
import darktrack.plugins.plugins.segmenters.DarkFieldSegmenter;
import darktrack.plugins.plugins.trackers.DarkFieldTracker;
import darktrack.processing.ImageLabeller;
import darktrack.processing.ObjectLocalizer;
import darktrack.processing.backend.BackendFactory;
import darktrack.processing.backend.NumericBackend;
import darktrack.processing.holography.BackgroundEstimator;
import darktrack.processing.holography.BackgroundProvider;
import darktrack.processing.holography.FrameVolumes;
import darktrack.processing.holography.VolumeBuilder;
import darktrack.utils.JSONUtils;
import darktrack.utils.ThreadRunner;
import darktrack.utils.geom.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Reconstruction and tracking of scattering objects from a stack of in-line holograms.
 * Each frame is reconstructed over the propagation range, objects are segmented and localized in 3D,
 * then detections are linked into trajectories.
 * @author Jean Ollion
 */
public class DarkTrack {
    public final static Logger logger = LoggerFactory.getLogger(DarkTrack.class);
    final DarkTrackConfiguration configuration;
    DarkFieldSegmenter segmenter;
    DarkFieldTracker tracker = new DarkFieldTracker();
    boolean defaultTracker = true;

    public DarkTrack(DarkTrackConfiguration configuration) {
        this.configuration = configuration;
        this.segmenter = new DarkFieldSegmenter(configuration.getOptions().getMinObjectPixels());
    }

    public DarkTrackConfiguration getConfiguration() {
        return configuration;
    }

    public DarkFieldSegmenter getSegmenter() {
        return segmenter;
    }

    public DarkFieldTracker getTracker() {
        return tracker;
    }

    public DarkTrack setTracker(DarkFieldTracker tracker) {
        this.tracker = tracker;
        this.defaultTracker = false;
        return this;
    }

    /**
     * 
     * @param holograms hologram stack, Z = frames
     * @return trajectories, EDOF and CR volumes
     * @throws darktrack.configuration.ConfigurationException if the configuration is invalid or inconsistent with {@param holograms}
     * @throws darktrack.utils.MultipleException if an error occurred during reconstruction
     */
    public DarkTrackResult run(ImageFloat holograms) {
        configuration.validate(holograms);
        OpticalGeometry geometry = configuration.getGeometry();
        ReconstructionOptions options = configuration.getOptions();
        int frameCount = options.getFrameNumber(holograms.sizeZ());
        int verbosity = options.getVerbosity();
        segmenter.setMinObjectPixels(options.getMinObjectPixels());
        logger.info("DarkTrack: frames: {}/{} size: {}x{} distances: {} {}", frameCount, holograms.sizeZ(), holograms.sizeX(), holograms.sizeY(), geometry.getDistanceCount(), geometry);
        logger.debug("configuration: {}", JSONUtils.serialize(configuration));
        NumericBackend backend = BackendFactory.getBackend(options.getAcceleration());
        ExecutorService executor = ThreadRunner.newFixedThreadPool(options.getThreads(), "DarkTrack");
        ReconstructionContext context = new ReconstructionContext(holograms.sizeX(), holograms.sizeY(), frameCount);
        ProgressCallback pcb = Core.getProgressLogger()==null ? null : ProgressCallback.get(Core.getProgressLogger(), frameCount);
        try {
            VolumeBuilder builder = new VolumeBuilder(geometry, holograms.sizeX(), holograms.sizeY(), backend, executor);
            BackgroundProvider background = BackgroundEstimator.resolve(options.getBackgroundRemoval(), holograms, builder.getPadding());
            for (int t = 0; t<frameCount; ++t) {
                ImageFloat hologram = holograms.getZPlane(t);
                processFrame(t, builder.build(hologram, background.getBackground(t, hologram)), context, verbosity);
                if (pcb!=null) pcb.incrementProgress();
                if (verbosity>=1 && ((t+1)%10==0 || t==frameCount-1)) {
                    String message = "Processed "+(t+1)+"/"+frameCount;
                    logger.info(message);
                    if (pcb!=null) pcb.log(message);
                }
            }
        } finally {
            executor.shutdownNow();
        }
        List<List<Point>> positions = toPhysical(context.getDetections(), geometry);
        TrackTable tracks;
        if (frameCount>1) {
            if (defaultTracker) tracker.setMinGatingRadius(geometry.getEffectivePixelSize()); // static objects stay gated
            tracks = tracker.track(positions);
        } else {
            tracks = new TrackTable(1);
            for (Point p : positions.get(0)) tracks.createTrack(0).setPosition(0, p);
        }
        logger.info("DarkTrack: tracks: {}", tracks.size());
        return new DarkTrackResult(tracks.toTrajectories(), context.getEDOF(), context.getClassicalReconstruction(), context.getDetections());
    }

    protected void processFrame(int frame, FrameVolumes volumes, ReconstructionContext context, int verbosity) {
        List<Region> regions = segmenter.runSegmenter(volumes);
        float[] edof = new float[volumes.dark.sizeXY()];
        List<Detection> detections = new ObjectLocalizer(volumes).localize(frame, regions, edof);
        context.setFrame(frame, detections, edof, volumes.classicalReconstruction.getPixelArray()[0]);
        logger.debug("frame: {} objects: {}", frame, detections.size());
        if (verbosity>=2) Core.showImage(new ImageFloat("EDOF_t"+frame, volumes.dark.sizeX(), edof));
        if (verbosity>=3) {
            Core.showImage(volumes.classicalReconstruction.duplicate("CR_t"+frame));
            ImageInt labels = ImageLabeller.toLabelMap(regions, volumes.dark.sizeX(), volumes.dark.sizeY());
            Core.showImage(labels.setName("labels_t"+frame));
        }
    }

    /**
     * 
     * @return positions in micrometers, per frame
     */
    public static List<List<Point>> toPhysical(List<List<Detection>> detections, OpticalGeometry geometry) {
        List<List<Point>> res = new ArrayList<>(detections.size());
        for (List<Detection> frame : detections) {
            List<Point> points = new ArrayList<>(frame.size());
            for (Detection d : frame) points.add(d.toPhysical(geometry));
            res.add(points);
        }
        return res;
    }
}
