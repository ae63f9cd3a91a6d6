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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 *
 * @author Jean Ollion
 */
public class ThreadRunner {
    public final static Logger logger = LoggerFactory.getLogger(ThreadRunner.class);

    public static int getMaxCPUs() {
        return Runtime.getRuntime().availableProcessors();
    }

    /**
     * Fixed pool of named daemon threads
     * @param nThreads number of threads; values &lt;1 mean all available processors
     * @return executor
     */
    public static ExecutorService newFixedThreadPool(int nThreads, String name) {
        if (nThreads<1) nThreads = getMaxCPUs();
        return Executors.newFixedThreadPool(nThreads, new NamedDaemonThreadFactory(name));
    }

    /**
     * Runs {@param action} for each index in [0; count[ on {@param executor} and waits for all tasks.
     * Errors are collected and thrown as a single {@link MultipleException} once every task has ended.
     * @param count number of tasks
     * @param taskName used to locate errors
     * @param action task
     * @param executor if null, tasks are run in the calling thread
     */
    public static void execute(int count, String taskName, final IndexAction action, ExecutorService executor) {
        if (count<=0) return;
        if (count==1 || executor==null) {
            final List<Pair<String, Throwable>> errors = new ArrayList<>();
            for (int i = 0; i<count; ++i) {
                try {
                    action.run(i);
                } catch (MultipleException me) {
                    errors.addAll(me.getExceptions());
                } catch (RuntimeException e) {
                    errors.add(new Pair<>(taskName+"#"+i, e));
                }
            }
            if (!errors.isEmpty()) throw new MultipleException(errors);
            return;
        }
        CompletionService<Pair<String, Throwable>> completion = new ExecutorCompletionService<>(executor);
        final List<Pair<String, Throwable>> errors = new ArrayList<>();
        for (int idx = 0; idx<count; ++idx) {
            final int i = idx;
            completion.submit(()->{
                try {
                    action.run(i);
                } catch (Throwable ex) {
                    return new Pair<>(taskName+"#"+i, ex);
                }
                return null;
            });
        }
        for (int i = 0; i<count; ++i) {
            try {
                Pair<String, Throwable> e = completion.take().get();
                if (e!=null) {
                    if (e.value instanceof MultipleException) errors.addAll(((MultipleException)e.value).getExceptions());
                    else errors.add(e);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                errors.add(new Pair<>("Interrupted: "+taskName, ex));
                break;
            } catch (ExecutionException ex) {
                errors.add(new Pair<>("Execution exception: "+taskName, ex));
            }
        }
        if (!errors.isEmpty()) {
            logger.error("MultipleException: "+errors.get(0).key, errors.get(0).value);
            throw new MultipleException(errors);
        }
    }

    public interface IndexAction {
        void run(int idx);
    }

    static class NamedDaemonThreadFactory implements ThreadFactory {
        final String name;
        final AtomicInteger count = new AtomicInteger();
        NamedDaemonThreadFactory(String name) {
            this.name = name;
        }
        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, name+"-"+count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
