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
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

/**
 *
 * @author Jean Ollion
 */
public class TestTrackTable {

    @Test
    public void testTrackPositions() {
        TrackTable table = new TrackTable(6);
        Track t = table.createTrack(1);
        assertEquals(0, t.getId());
        t.setPosition(1, new Point(0, 0, 0));
        t.setPosition(4, new Point(3, 3, 3));
        assertEquals(4, t.getLastFrame());
        assertTrue(t.isPresent(1));
        assertFalse("gap is absent", t.isPresent(2));
        assertFalse(t.isPresent(3));
        assertFalse("before birth", t.isPresent(0));
        assertNull(t.getPosition(5));
        assertEquals(4, t.lastPresentFrame(0, 5));
        assertEquals(1, t.lastPresentFrame(0, 3));
        assertEquals(-1, t.lastPresentFrame(2, 3));
        t.setPosition(3, new Point(2, 2, 2));
        assertEquals(3, t.lastPresentFrame(2, 3));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPositionBeforeBirth() {
        new TrackTable(3).createTrack(2).setPosition(1, new Point(0, 0, 0));
    }

    @Test
    public void testArrays() {
        TrackTable table = new TrackTable(3);
        Track t0 = table.createTrack(0);
        t0.setPosition(0, new Point(1, 2, 3));
        t0.setPosition(2, new Point(4, 5, 6));
        Track t1 = table.createTrack(1);
        t1.setPosition(1, new Point(7, 8, 9));
        assertEquals(1, t1.getId());
        assertEquals(1, table.presentCount(1));
        double[][][] xyz = table.toArrays();
        assertEquals(3, xyz.length);
        assertEquals(2, xyz[0].length);
        assertEquals(3, xyz[0][0].length);
        assertEquals(1, xyz[0][0][0], 0);
        assertTrue(Double.isNaN(xyz[1][0][1]));
        assertEquals(6, xyz[2][0][2], 0);
        assertTrue("before birth", Double.isNaN(xyz[0][1][0]));
        assertEquals(9, xyz[2][1][1], 0);
        assertTrue("after last position", Double.isNaN(xyz[2][1][2]));
        Trajectories traj = table.toTrajectories();
        assertEquals(2, traj.getTrackCount());
        assertEquals(3, traj.getFrameCount());
        assertTrue(traj.isPresent(0, 2));
        assertFalse(traj.isPresent(1, 2));
        assertEquals(2, traj.presentCount(0) + traj.presentCount(2));
    }

    @Test
    public void testNoTrack() {
        Trajectories traj = new TrackTable(4).toTrajectories();
        assertEquals(0, traj.getTrackCount());
        assertEquals("frames are kept without tracks", 4, traj.getFrameCount());
        assertEquals(0, traj.presentCount(3));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInconsistentFrameCount() {
        double[][] row = new double[][]{{1, 2}};
        new Trajectories(row, row, row, 3);
    }

    @Test
    public void testDetectionToPhysical() {
        OpticalGeometry geometry = new OpticalGeometry(100, -20, 20, 2, 0.5, 5.5, 11);
        Detection d = new Detection(0, 1, 4, 6, 2.5, 2);
        Point p = d.toPhysical(geometry);
        assertEquals(2, p.x, 1e-9);
        assertEquals(3, p.y, 1e-9);
        assertEquals(2.5 * 2 - 20, p.z, 1e-9);
    }

    @Test
    public void testReconstructionContext() {
        ReconstructionContext context = new ReconstructionContext(2, 2, 2);
        assertFalse(context.isProcessed(1));
        assertTrue(context.getDetections(1).isEmpty());
        Detection d = new Detection(1, 1, 0, 1, 0, 0);
        context.setFrame(1, Collections.singletonList(d), new float[]{1, 2, 3, 4}, new float[]{5, 6, 7, 8});
        assertTrue(context.isProcessed(1));
        assertEquals(Arrays.asList(d), context.getDetections(1));
        assertEquals(4, context.getEDOF().getPixel(1, 1, 1), 0);
        assertEquals(7, context.getClassicalReconstruction().getPixel(0, 1, 1), 0);
        assertEquals(0, context.getEDOF().getPixel(0, 0, 0), 0);
        try {
            context.setFrame(1, Collections.emptyList(), new float[4], new float[4]);
            fail("frame processed twice");
        } catch (IllegalStateException e) {
            assertEquals(Arrays.asList(d), context.getDetections(1));
        }
    }
}
