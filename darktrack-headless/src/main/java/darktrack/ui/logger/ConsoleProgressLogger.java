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
package darktrack.ui.logger;

import java.text.SimpleDateFormat;
import java.util.Date;

/**
 * Prints timestamped messages to the standard output, and progress by steps of {@link #PROGRESS_STEP} percent
 * @author Jean Ollion
 */
public class ConsoleProgressLogger implements ProgressLogger {
    public final static int PROGRESS_STEP = 10;
    int lastProgress = -PROGRESS_STEP;

    @Override
    public void setProgress(int i) {
        if (i - lastProgress < PROGRESS_STEP && i<100) return;
        lastProgress = i;
        setMessage("Progress: "+i+"%");
    }

    @Override
    public void setMessage(String message) {
        System.out.println(new SimpleDateFormat("yyyyMMdd-HH:mm:ss").format(new Date())+": "+message);
    }

    @Override
    public void setRunning(boolean running) {
        if (running) lastProgress = -PROGRESS_STEP;
    }
}
