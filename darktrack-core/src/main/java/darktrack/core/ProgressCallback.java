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

import darktrack.ui.logger.ProgressLogger;

/**
 *
 * @author Jean Ollion
 */
public interface ProgressCallback {
    void incrementTaskNumber(int subtask);
    void incrementProgress();
    void log(String message);

    static ProgressCallback get(ProgressLogger ui, int taskNumber) {
        ProgressCallback pcb = get(ui);
        pcb.incrementTaskNumber(taskNumber);
        return pcb;
    }
    static ProgressCallback get(ProgressLogger ui) {
        return new ProgressCallback(){
            double taskCounter = 0;
            double taskNumber = 0;

            @Override
            public void incrementTaskNumber(int subtask) {
                taskNumber +=subtask;
            }

            @Override
            public synchronized void incrementProgress() {
                taskCounter++;
                if (taskNumber >0) ui.setProgress((int)(100 * (taskCounter / taskNumber)));
            }
            @Override
            public void log(String message) {
                ui.setMessage(message);
            }
        };
    }
}
