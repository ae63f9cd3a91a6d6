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
package darktrack.plugins.plugins.trackers;

import darktrack.configuration.parameters.BoundedNumberParameter;
import darktrack.configuration.parameters.Parameter;
import darktrack.data_structure.Track;
import darktrack.data_structure.TrackTable;
import darktrack.plugins.Hint;
import darktrack.plugins.Tracker;
import darktrack.utils.ArrayUtil;
import darktrack.utils.geom.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Greedy frame-to-frame linking of 3D detections.
 * A detection is linked to the track whose last position is the closest in XY when it is the only one within the gating radius,
 * and to the track whose mean recent displacement best predicts it when several tracks are within the gating radius.
 * Unmatched detections start new tracks. Tracks are never terminated: a track without detection is absent at this frame
 * and can be linked again as long as its last position is within the forgetting window.
 * @author Jean Ollion
 */
public class DarkFieldTracker implements Tracker, Hint {
    public final static Logger logger = LoggerFactory.getLogger(DarkFieldTracker.class);
    BoundedNumberParameter forgettingWindow = new BoundedNumberParameter("Forgetting window", 0, 20, 1, null).setHint("Number of previous frames in which the last position of a track is searched. Tracks absent from all of them are no longer linked");
    BoundedNumberParameter velocityMemory = new BoundedNumberParameter("Velocity memory", 0, 5, 1, null).setHint("Number of frame-to-frame displacements averaged to estimate the velocity of a track");
    BoundedNumberParameter gatingFactor = new BoundedNumberParameter("Gating factor", 3, 10, 0, null).setHint("Gating radius is this factor times the median nearest-neighbor XY distance between the first two frames with detections");
    BoundedNumberParameter minGatingRadius = new BoundedNumberParameter("Minimal gating radius", 5, 0, 0, null).setHint("Lower bound of the gating radius, in physical units");
    double gatingRadius = Double.NaN;

    public DarkFieldTracker setForgettingWindow(int frames) {
        forgettingWindow.setValue(frames);
        return this;
    }

    public DarkFieldTracker setVelocityMemory(int frames) {
        velocityMemory.setValue(frames);
        return this;
    }

    public DarkFieldTracker setGatingFactor(double factor) {
        gatingFactor.setValue(factor);
        return this;
    }

    public DarkFieldTracker setMinGatingRadius(double radius) {
        minGatingRadius.setValue(radius);
        return this;
    }

    /**
     * 
     * @return gating radius of the last call to {@link #track(List)}, NaN before
     */
    public double getGatingRadius() {
        return gatingRadius;
    }

    /**
     * 
     * @param detections positions per frame
     * @return gating factor times the median over the detections of the first pair of consecutive non-empty frames
     * of the XY distance to the closest detection of the next frame, bounded by the minimal gating radius
     */
    public double computeGatingRadius(List<List<Point>> detections) {
        double minRadius = minGatingRadius.getDoubleValue();
        for (int f = 0; f<detections.size()-1; ++f) {
            List<Point> first = detections.get(f);
            List<Point> second = detections.get(f+1);
            if (first.isEmpty() || second.isEmpty()) continue;
            double[] minDist = new double[first.size()];
            for (int i = 0; i<first.size(); ++i) {
                double min = Double.POSITIVE_INFINITY;
                for (Point p : second) min = Math.min(min, first.get(i).distXY(p));
                minDist[i] = min;
            }
            double radius = gatingFactor.getDoubleValue() * ArrayUtil.median(minDist);
            logger.debug("gating radius computed on frames {}-{}: {} (min: {})", f, f+1, radius, minRadius);
            return Math.max(radius, minRadius);
        }
        logger.debug("no consecutive frames with detections: gating radius set to minimal radius: {}", minRadius);
        return minRadius;
    }

    @Override
    public TrackTable track(List<List<Point>> detections) {
        TrackTable tracks = new TrackTable(detections.size());
        if (detections.isEmpty()) return tracks;
        gatingRadius = computeGatingRadius(detections);
        int window = forgettingWindow.getIntValue();
        int memory = velocityMemory.getIntValue();
        List<double[][]> displacements = new ArrayList<>();
        for (Point p : detections.get(0)) {
            tracks.createTrack(0).setPosition(0, p);
            displacements.add(newDisplacementBuffer(memory));
        }
        for (int t = 1; t<detections.size(); ++t) {
            int trackCount = tracks.size();
            TrackState[] states = new TrackState[trackCount];
            for (int i = 0; i<trackCount; ++i) states[i] = new TrackState(tracks.getTrack(i), displacements.get(i), t, window, memory);
            List<Point> current = detections.get(t);
            int[] claims = new int[trackCount];
            List<List<Integer>> claimants = new ArrayList<>(trackCount);
            for (int i = 0; i<trackCount; ++i) claimants.add(new ArrayList<>());
            int births = 0;
            for (int d = 0; d<current.size(); ++d) {
                Point p = current.get(d);
                int[] candidates = getCandidates(p, states, 0, trackCount);
                if (candidates.length==0) {
                    tracks.createTrack(t).setPosition(t, p);
                    displacements.add(newDisplacementBuffer(memory));
                    ++births;
                    continue;
                }
                int trackIdx = assign(p, candidates, states, t);
                tracks.getTrack(trackIdx).setPosition(t, p);
                ++claims[trackIdx];
                claimants.get(trackIdx).add(d);
            }
            int absent = 0, contended = 0;
            for (int i = 0; i<trackCount; ++i) {
                if (claims[i]==0) {
                    tracks.getTrack(i).setPosition(t, null);
                    ++absent;
                } else if (claims[i]>1) {
                    ++contended;
                    tracks.getTrack(i).setPosition(t, resolveContention(states[i], claimants.get(i), current, t));
                }
            }
            logger.trace("frame {}: detections: {}, births: {}, absent: {}, contended: {}", t, current.size(), births, absent, contended);
        }
        logger.debug("tracking done: frames: {}, tracks: {}, gating radius: {}", detections.size(), tracks.size(), gatingRadius);
        return tracks;
    }

    /**
     * 
     * @return indices of tracks within [{@param from}; {@param to}) whose last position lies within the gating radius of {@param p} in XY
     */
    protected int[] getCandidates(Point p, TrackState[] states, int from, int to) {
        return IntStream.range(from, to).filter(i -> states[i].last!=null && states[i].last.distXY(p)<=gatingRadius).toArray();
    }

    /**
     * 
     * @param candidates indices of gated tracks, non empty
     * @return index of the track {@param p} is linked to
     */
    protected int assign(Point p, int[] candidates, TrackState[] states, int t) {
        if (candidates.length==1 || t==1) { // nearest track
            double[] dist = new double[states.length];
            for (int i = 0; i<states.length; ++i) dist[i] = states[i].last==null ? Double.NaN : states[i].last.distXY(p);
            return ArrayUtil.min(dist);
        }
        return candidates[closestToPrediction(p, candidates, states)];
    }

    /**
     * 
     * @return index within {@param candidates} of the track whose velocity is the closest to its displacement towards {@param p};
     * if no candidate has a velocity, index of the closest candidate in XY
     */
    protected static int closestToPrediction(Point p, int[] candidates, TrackState[] states) {
        double[] dist = new double[candidates.length];
        boolean anyVelocity = false;
        for (int c = 0; c<candidates.length; ++c) {
            dist[c] = states[candidates[c]].predictionError(p);
            if (!Double.isNaN(dist[c])) anyVelocity = true;
        }
        if (!anyVelocity) {
            for (int c = 0; c<candidates.length; ++c) dist[c] = states[candidates[c]].last.distXY(p);
        }
        return ArrayUtil.min(dist);
    }

    /**
     * Selects among the detections that claimed a same track, with the same gating and linking rules
     * @return selected position, null if none of the claimants is within the gating radius
     */
    protected Point resolveContention(TrackState state, List<Integer> claimantIdx, List<Point> current, int t) {
        List<Point> gated = new ArrayList<>();
        for (int d : claimantIdx) {
            Point p = current.get(d);
            if (state.last.distXY(p)<=gatingRadius) gated.add(p);
        }
        if (gated.isEmpty()) return null;
        if (gated.size()==1 || t==1) {
            double[] dist = new double[gated.size()];
            for (int i = 0; i<dist.length; ++i) dist[i] = state.last.distXY(gated.get(i));
            return gated.get(ArrayUtil.min(dist));
        }
        double[] dist = new double[gated.size()];
        boolean anyVelocity = false;
        for (int i = 0; i<dist.length; ++i) {
            dist[i] = state.predictionError(gated.get(i));
            if (!Double.isNaN(dist[i])) anyVelocity = true;
        }
        if (!anyVelocity) for (int i = 0; i<dist.length; ++i) dist[i] = state.last.distXY(gated.get(i));
        return gated.get(ArrayUtil.min(dist));
    }

    private static double[][] newDisplacementBuffer(int memory) {
        double[][] res = new double[memory][3];
        for (double[] d : res) Arrays.fill(d, Double.NaN);
        return res;
    }

    /**
     * State of a track when linking frame t: last position within the forgetting window and mean recent velocity.
     * Building the state records the last displacement of the track in its buffer.
     */
    protected static class TrackState {
        final Point last;
        final double[] velocity = new double[3];
        boolean hasDisplacement;

        TrackState(Track track, double[][] displacements, int t, int window, int memory) {
            int from = Math.max(0, t - window);
            int lastFrame = track.lastPresentFrame(from, t-1);
            int previousFrame = track.lastPresentFrame(from, t-2);
            last = lastFrame>=0 ? track.getPosition(lastFrame) : null;
            Point previous = previousFrame>=0 ? track.getPosition(previousFrame) : null;
            double[] d = displacements[t % memory];
            if (last!=null && previous!=null) {
                d[0] = last.x - previous.x;
                d[1] = last.y - previous.y;
                d[2] = last.z - previous.z;
            } else Arrays.fill(d, Double.NaN);
            for (double[] dd : displacements) if (!Double.isNaN(dd[0])) hasDisplacement = true;
            // zero displacements are not averaged: a track absent at t-1 yields a zero displacement
            double[] axis = new double[memory];
            for (int a = 0; a<3; ++a) {
                for (int i = 0; i<memory; ++i) axis[i] = displacements[i][a];
                velocity[a] = ArrayUtil.mean(axis, true);
            }
        }

        /**
         * An axis without non-zero displacement is predicted as still
         * @return 3D distance between the velocity and the displacement from the last position to {@param p}. NaN if the track has no recorded displacement
         */
        double predictionError(Point p) {
            if (last==null || !hasDisplacement) return Double.NaN;
            double dx = velocity(0) - (p.x - last.x);
            double dy = velocity(1) - (p.y - last.y);
            double dz = velocity(2) - (p.z - last.z);
            return Math.sqrt(dx*dx + dy*dy + dz*dz);
        }

        private double velocity(int axis) {
            return Double.isNaN(velocity[axis]) ? 0 : velocity[axis];
        }
    }

    @Override
    public Parameter[] getParameters() {
        return new Parameter[]{forgettingWindow, velocityMemory, gatingFactor, minGatingRadius};
    }

    @Override
    public String getHintText() {
        return "Greedy linking of 3D detections: nearest track in XY within a gating radius, ties between several gated tracks are resolved by consistency with the track's recent velocity";
    }
}
