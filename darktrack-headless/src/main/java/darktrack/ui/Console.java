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
package darktrack.ui;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import darktrack.configuration.ConfigurationException;
import darktrack.configuration.DarkTrackConfiguration;
import darktrack.core.Core;
import darktrack.core.DarkTrack;
import darktrack.core.DarkTrackResult;
import darktrack.data_structure.Trajectories;
import darktrack.image.ImageFloat;
import darktrack.image.wrappers.IJImageWrapper;
import darktrack.ui.logger.ConsoleProgressLogger;
import darktrack.ui.logger.ProgressLogger;
import darktrack.utils.ArrayFileWriter;
import darktrack.utils.MultipleException;
import ij.IJ;
import ij.ImagePlus;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;

/**
 * Runs DarkTrack on a hologram stack.
 * Arguments: configuration file (JSON), hologram stack (TIFF, one plane per frame), output directory.
 * Writes X.csv, Y.csv and Z.csv (one row per track, one column per frame), EDOF.tif and CR.tif
 * @author Jean Ollion
 */
public class Console {
    public final static org.slf4j.Logger logger = LoggerFactory.getLogger(Console.class);

    public static void main(String[] args) {
        Logger root = (Logger)LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.INFO);
        int status = run(args, new ConsoleProgressLogger());
        if (status!=0) System.exit(status);
    }

    /**
     * 
     * @return 0 on success, 1 on invalid arguments or configuration, 2 on processing or writing error
     */
    public static int run(String[] args, ProgressLogger ui) {
        if (args.length!=3) {
            ui.setMessage("Expected arguments: <configuration.json> <holograms.tif> <output directory>");
            return 1;
        }
        Core.setUserLogger(ui);
        ui.setRunning(true);
        try {
            DarkTrackConfiguration config = DarkTrackConfiguration.read(Paths.get(args[0]));
            ImagePlus imp = IJ.openImage(args[1]);
            if (imp==null) {
                ui.setMessage("Could not open hologram stack: "+args[1]);
                return 1;
            }
            ImageFloat holograms = IJImageWrapper.wrap(imp);
            ui.setMessage("Hologram stack: "+holograms.sizeX()+"x"+holograms.sizeY()+" frames: "+holograms.sizeZ());
            File outputDir = new File(args[2]);
            if (!outputDir.isDirectory() && !outputDir.mkdirs()) {
                ui.setMessage("Could not create output directory: "+args[2]);
                return 1;
            }
            DarkTrackResult result = new DarkTrack(config).run(holograms);
            write(result, outputDir, config.getGeometry().getEffectivePixelSize());
            ui.setMessage("Tracks: "+result.getTrajectories().getTrackCount()+" written to: "+outputDir.getAbsolutePath());
            return 0;
        } catch (ConfigurationException e) {
            logger.error("invalid configuration", e);
            ui.setMessage("Invalid configuration: "+e.getMessage());
            return 1;
        } catch (MultipleException e) {
            logger.error("reconstruction error", e);
            ui.setMessage("Error during reconstruction: "+e.getMessage());
            return 2;
        } catch (IOException e) {
            logger.error("I/O error", e);
            ui.setMessage("I/O error: "+e.getMessage());
            return 2;
        } finally {
            ui.setRunning(false);
            Core.setUserLogger(null);
        }
    }

    public static void write(DarkTrackResult result, File outputDir, double pixelSize) throws IOException {
        Trajectories traj = result.getTrajectories();
        new ArrayFileWriter().addRows(traj.getX()).writeToFile(new File(outputDir, "X.csv").getAbsolutePath());
        new ArrayFileWriter().addRows(traj.getY()).writeToFile(new File(outputDir, "Y.csv").getAbsolutePath());
        new ArrayFileWriter().addRows(traj.getZ()).writeToFile(new File(outputDir, "Z.csv").getAbsolutePath());
        saveTiff(IJImageWrapper.getImagePlus(result.getEDOF(), pixelSize), new File(outputDir, "EDOF.tif"));
        saveTiff(IJImageWrapper.getImagePlus(result.getClassicalReconstruction(), pixelSize), new File(outputDir, "CR.tif"));
    }

    private static void saveTiff(ImagePlus imp, File file) throws IOException {
        if (!IJ.saveAsTiff(imp, file.getAbsolutePath())) throw new IOException("Could not write: "+file.getAbsolutePath());
    }
}
