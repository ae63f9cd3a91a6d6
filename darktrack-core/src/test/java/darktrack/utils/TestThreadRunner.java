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
package darktrack.utils;

import org.junit.Test;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicIntegerArray;

import static org.junit.Assert.*;

/**
 *
 * @author Jean Ollion
 */
public class TestThreadRunner {

    private static void runAll(ExecutorService executor) {
        AtomicIntegerArray visits = new AtomicIntegerArray(20);
        ThreadRunner.execute(20, "task", visits::incrementAndGet, executor);
        for (int i = 0; i<20; ++i) assertEquals("task "+i, 1, visits.get(i));
    }

    private static void collectErrors(ExecutorService executor) {
        AtomicIntegerArray visits = new AtomicIntegerArray(10);
        try {
            ThreadRunner.execute(10, "task", i -> {
                visits.incrementAndGet(i);
                if (i==3 || i==7) throw new IllegalStateException("failure at "+i);
            }, executor);
            fail("errors should be thrown");
        } catch (MultipleException e) {
            Set<String> keys = new TreeSet<>();
            for (Pair<String, Throwable> p : e.getExceptions()) {
                keys.add(p.key);
                assertTrue(p.value instanceof IllegalStateException);
            }
            assertEquals(new TreeSet<>(Arrays.asList("task#3", "task#7")), keys);
        }
        for (int i = 0; i<10; ++i) assertEquals("every task ran", 1, visits.get(i));
    }

    @Test
    public void testSequential() {
        runAll(null);
        collectErrors(null);
    }

    @Test
    public void testParallel() {
        ExecutorService executor = ThreadRunner.newFixedThreadPool(3, "test");
        try {
            runAll(executor);
            collectErrors(executor);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testNoTask() {
        ThreadRunner.execute(0, "task", i -> fail("no task should run"), null);
    }
}
