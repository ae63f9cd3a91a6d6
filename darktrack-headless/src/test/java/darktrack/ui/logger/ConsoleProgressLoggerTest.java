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

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

/**
 *
 * @author Jean Ollion
 */
public class ConsoleProgressLoggerTest {

    @Test
    public void testProgressSteps() {
        List<String> messages = new ArrayList<>();
        ConsoleProgressLogger ui = new ConsoleProgressLogger() {
            @Override
            public void setMessage(String message) {
                messages.add(message);
            }
        };
        ui.setRunning(true);
        for (int p : new int[]{3, 5, 12, 19, 22, 99, 100}) ui.setProgress(p);
        assertEquals(4, messages.size());
        assertEquals("Progress: 3%", messages.get(0));
        assertEquals("Progress: 19%", messages.get(1));
        assertEquals("Progress: 99%", messages.get(2));
        assertEquals("Progress: 100%", messages.get(3));
    }
}
