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

import darktrack.image.Image;
import darktrack.ui.logger.ProgressLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Static hooks through which processing code reaches the user: a message logger and an image displayer.
 * Both are optional; when unset, messages and images are dropped.
 * @author Jean Ollion
 */
public class Core {
    public static final Logger logger = LoggerFactory.getLogger(Core.class);
    private static ProgressLogger progressLogger;
    private static Consumer<Image> imageDisplayer;

    private Core() {}

    public static void setUserLogger(ProgressLogger plogger) {
        progressLogger = plogger;
    }
    public static ProgressLogger getProgressLogger() {return progressLogger;}
    public static void setImageDisplayer(Consumer<Image> imageDisp) {
        imageDisplayer=imageDisp;
    }
    public static void showImage(Image image) {
        if (imageDisplayer!=null) imageDisplayer.accept(image);
    }
}
