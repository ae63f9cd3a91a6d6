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

import darktrack.data_structure.Track;
import darktrack.data_structure.TrackTable;
import darktrack.data_structure.Trajectories;
import darktrack.utils.geom.Point;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static darktrack.test_utils.TestUtils.frames;
import static org.junit.Assert.*;

/**
 *
 * @author Jean Ollion
 */
public class TestDarkFieldTracker {

    @Test
    public void testStaticObject() {
        Point p = new Point(10, 10, 5);
        List<List<Point>> detections = frames(new Point[]{p}, new Point[]{p}, new Point[]{p}, new Point[]{p}, new Point[]{p});
        DarkFieldTracker tracker = new DarkFieldTracker();
        TrackTable tracks = tracker.track(detections);
        assertEquals("gating radius", 0, tracker.getGatingRadius(), 0);
        assertEquals("track number", 1, tracks.size());
        for (int t = 0; t<5; ++t) assertEquals("position at frame "+t, p, tracks.getTrack(0).getPosition(t));
    }

    @Test
    public void testCrossingObjects() {
        int frameCount = 6;
        List<List<Point>> detections = new ArrayList<>();
        for (int t = 0; t<frameCount; ++t) detections.add(Arrays.asList(new Point(10*t, 0, 0), new Point(50-10*t, 4, 0)));
        DarkFieldTracker tracker = new DarkFieldTracker();
        TrackTable tracks = tracker.track(detections);
        assertEquals("gating radius", 100, tracker.getGatingRadius(), 1e-9);
        assertEquals("track number", 2, tracks.size());
        for (int t = 0; t<frameCount; ++t) {
            assertEquals("track 0 at frame "+t, detections.get(t).get(0), tracks.getTrack(0).getPosition(t));
            assertEquals("track 1 at frame "+t, detections.get(t).get(1), tracks.getTrack(1).getPosition(t));
        }
    }

    @Test
    public void testCrossingObjectsReversedDetectionOrder() {
        int frameCount = 6;
        List<List<Point>> detections = new ArrayList<>();
        for (int t = 0; t<frameCount; ++t) {
            List<Point> frame = Arrays.asList(new Point(10*t, 0, 0), new Point(50-10*t, 4, 0));
            if (t%2==1) frame = Arrays.asList(frame.get(1), frame.get(0));
            detections.add(frame);
        }
        TrackTable tracks = new DarkFieldTracker().track(detections);
        assertEquals("track number", 2, tracks.size());
        for (int t = 0; t<frameCount; ++t) {
            assertEquals("track 0 X at frame "+t, 10*t, tracks.getTrack(0).getPosition(t).x, 1e-9);
            assertEquals("track 1 X at frame "+t, 50-10*t, tracks.getTrack(1).getPosition(t).x, 1e-9);
        }
    }

    @Test
    public void testLateAppearance() {
        Point p = new Point(0, 0, 0);
        Point q = new Point(100, 100, 0);
        List<List<Point>> detections = frames(new Point[]{p}, new Point[]{p}, new Point[]{p}, new Point[]{p, q}, new Point[]{p, q});
        TrackTable tracks = new DarkFieldTracker().setMinGatingRadius(1).track(detections);
        assertEquals("track number", 2, tracks.size());
        Track first = tracks.getTrack(0);
        Track born = tracks.getTrack(1);
        assertEquals("birth frame", 3, born.getBirthFrame());
        for (int t = 0; t<5; ++t) assertEquals("first track at frame "+t, p, first.getPosition(t));
        for (int t = 0; t<3; ++t) assertFalse("new track absent at frame "+t, born.isPresent(t));
        assertEquals(q, born.getPosition(3));
        assertEquals(q, born.getPosition(4));
        Trajectories traj = tracks.toTrajectories();
        assertTrue(Double.isNaN(traj.getX()[1][0]));
        assertEquals(100, traj.getY()[1][4], 0);
    }

    @Test
    public void testAbsenceKeepsTrack() {
        Point p0 = new Point(0, 0, 0);
        Point p1 = new Point(1, 0, 0);
        Point p5 = new Point(2, 1, 0);
        List<List<Point>> detections = frames(new Point[]{p0}, new Point[]{p1}, new Point[0], new Point[0], new Point[0], new Point[]{p5});
        TrackTable tracks = new DarkFieldTracker().track(detections);
        assertEquals("track number", 1, tracks.size());
        Track t = tracks.getTrack(0);
        assertEquals(p0, t.getPosition(0));
        assertEquals(p1, t.getPosition(1));
        for (int f = 2; f<5; ++f) assertFalse("absent at "+f, t.isPresent(f));
        assertEquals("linked after absence", p5, t.getPosition(5));
        assertEquals(0, tracks.presentCount(3));
    }

    @Test
    public void testForgettingWindow() {
        Point p = new Point(0, 0, 0);
        List<List<Point>> detections = frames(new Point[]{p}, new Point[]{p}, new Point[0], new Point[0], new Point[]{p});
        TrackTable tracks = new DarkFieldTracker().setMinGatingRadius(1).setForgettingWindow(2).track(detections);
        assertEquals("object is not linked beyond the window", 2, tracks.size());
        assertEquals(4, tracks.getTrack(1).getBirthFrame());
    }

    @Test
    public void testGatingRadiusFromFirstNonEmptyPair() {
        List<List<Point>> detections = frames(new Point[0], new Point[]{new Point(0, 0, 0)}, new Point[]{new Point(3, 4, 0)});
        DarkFieldTracker tracker = new DarkFieldTracker().setGatingFactor(2);
        assertEquals(10, tracker.computeGatingRadius(detections), 1e-9);
        assertEquals("minimal radius without consecutive detections", 0.5, tracker.setMinGatingRadius(0.5).computeGatingRadius(frames(new Point[]{new Point(0, 0, 0)}, new Point[0])), 0);
    }

    @Test
    public void testEmptyInput() {
        assertEquals(0, new DarkFieldTracker().track(Collections.emptyList()).size());
        TrackTable tracks = new DarkFieldTracker().track(frames(new Point[0], new Point[0]));
        assertEquals(0, tracks.size());
        assertEquals(2, tracks.getFrameCount());
    }

    @Test
    public void testContentionLeavesSingleClaim() {
        // both detections are closest to the single track of the first frame
        List<List<Point>> detections = frames(new Point[]{new Point(0, 0, 0)}, new Point[]{new Point(1, 0, 0), new Point(0, 1.5, 0)});
        TrackTable tracks = new DarkFieldTracker().track(detections);
        assertEquals("no birth for gated detections", 1, tracks.size());
        assertEquals("nearest claimant is kept", new Point(1, 0, 0), tracks.getTrack(0).getPosition(1));
    }

    @Test
    public void testTrackCountInvariant() {
        Random r = new Random(7);
        List<List<Point>> detections = new ArrayList<>();
        for (int t = 0; t<30; ++t) {
            int n = r.nextInt(8);
            List<Point> frame = new ArrayList<>(n);
            for (int i = 0; i<n; ++i) frame.add(new Point(r.nextDouble()*50, r.nextDouble()*50, r.nextDouble()*10));
            detections.add(frame);
        }
        TrackTable tracks = new DarkFieldTracker().setMinGatingRadius(1).track(detections);
        Trajectories traj = tracks.toTrajectories();
        assertEquals(30, traj.getFrameCount());
        for (int t = 0; t<30; ++t) {
            assertTrue("frame "+t, tracks.presentCount(t) <= detections.get(t).size());
            assertEquals(tracks.presentCount(t), traj.presentCount(t));
            for (int i = 0; i<tracks.size(); ++i) {
                Point p = tracks.getTrack(i).getPosition(t);
                if (p!=null) assertTrue("assigned positions are detections", detections.get(t).contains(p));
            }
        }
    }
}
