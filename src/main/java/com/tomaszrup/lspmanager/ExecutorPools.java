////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspmanager;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lspmanager.util.MdcProjectContext;

/**
 * Thread pools shared by every session of one {@link LanguageServerManager}.
 *
 * <ul>
 *   <li><b>Scheduling pool</b>: request timeouts, dispatcher deadlines and
 *       the idle/resource monitors. Tasks here are short and hand real work
 *       to the other pools.</li>
 *   <li><b>I/O pool</b>: one long-lived decode loop per live session, the
 *       stderr drain of each process and the diagnostics collectors. Cached,
 *       since the thread count follows the number of live sessions.</li>
 *   <li><b>Request pool</b>: caller submissions (which block on spawn,
 *       handshake and round-trips) and graceful stops.</li>
 * </ul>
 *
 * <p>All pools use daemon threads and propagate the submitting thread's
 * MDC. Call {@link #shutdownAll()} when the manager shuts down.</p>
 */
public class ExecutorPools {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorPools.class);

    private final ScheduledExecutorService schedulingPool;
    private final ExecutorService ioPool;
    private final ExecutorService requestPool;

    public ExecutorPools() {
        this.schedulingPool = new MdcScheduledExecutorService(
                Executors.newScheduledThreadPool(2, daemonThreads("lsm-scheduler")));
        this.ioPool = new MdcExecutorService(Executors.newCachedThreadPool(daemonThreads("lsm-io")));
        this.requestPool = new MdcExecutorService(Executors.newCachedThreadPool(daemonThreads("lsm-request")));
    }

    public ScheduledExecutorService getSchedulingPool() {
        return schedulingPool;
    }

    public ExecutorService getIoPool() {
        return ioPool;
    }

    public ExecutorService getRequestPool() {
        return requestPool;
    }

    /**
     * Shut down all pools. Running tasks are interrupted; waits up to 5
     * seconds per pool.
     */
    public void shutdownAll() {
        logger.debug("Shutting down executor pools");
        schedulingPool.shutdownNow();
        requestPool.shutdownNow();
        ioPool.shutdownNow();
        try {
            schedulingPool.awaitTermination(5, TimeUnit.SECONDS);
            requestPool.awaitTermination(5, TimeUnit.SECONDS);
            ioPool.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    // -----------------------------------------------------------------------
    // MDC-propagating executor wrappers
    // -----------------------------------------------------------------------

    /**
     * Wraps an {@link ExecutorService} so that every submitted task inherits
     * the caller thread's SLF4J MDC context.
     */
    private static class MdcExecutorService implements ExecutorService {
        protected final ExecutorService delegate;

        MdcExecutorService(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override public void execute(Runnable command) {
            delegate.execute(MdcProjectContext.wrap(command));
        }

        @Override public Future<?> submit(Runnable task) {
            return delegate.submit(MdcProjectContext.wrap(task));
        }

        @Override public <T> Future<T> submit(Runnable task, T result) {
            return delegate.submit(MdcProjectContext.wrap(task), result);
        }

        @Override public <T> Future<T> submit(Callable<T> task) {
            return delegate.submit(wrapCallable(task));
        }

        @Override public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks)
                throws InterruptedException {
            return delegate.invokeAll(wrapCallables(tasks));
        }

        @Override public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks,
                long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.invokeAll(wrapCallables(tasks), timeout, unit);
        }

        @Override public <T> T invokeAny(Collection<? extends Callable<T>> tasks)
                throws InterruptedException, ExecutionException {
            return delegate.invokeAny(wrapCallables(tasks));
        }

        @Override public <T> T invokeAny(Collection<? extends Callable<T>> tasks,
                long timeout, TimeUnit unit) throws InterruptedException, ExecutionException, TimeoutException {
            return delegate.invokeAny(wrapCallables(tasks), timeout, unit);
        }

        @Override public void shutdown() { delegate.shutdown(); }
        @Override public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override public boolean isShutdown() { return delegate.isShutdown(); }
        @Override public boolean isTerminated() { return delegate.isTerminated(); }
        @Override public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }

        static <T> Callable<T> wrapCallable(Callable<T> task) {
            Map<String, String> ctx = MdcProjectContext.snapshot();
            return () -> {
                Map<String, String> prev = MdcProjectContext.snapshot();
                MdcProjectContext.restore(ctx);
                try {
                    return task.call();
                } finally {
                    MdcProjectContext.restore(prev);
                }
            };
        }

        private static <T> Collection<Callable<T>> wrapCallables(Collection<? extends Callable<T>> tasks) {
            List<Callable<T>> wrapped = new ArrayList<>(tasks.size());
            for (Callable<T> task : tasks) {
                wrapped.add(wrapCallable(task));
            }
            return wrapped;
        }
    }

    private static class MdcScheduledExecutorService extends MdcExecutorService
            implements ScheduledExecutorService {
        private final ScheduledExecutorService scheduledDelegate;

        MdcScheduledExecutorService(ScheduledExecutorService delegate) {
            super(delegate);
            this.scheduledDelegate = delegate;
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
            return scheduledDelegate.schedule(MdcProjectContext.wrap(command), delay, unit);
        }

        @Override
        public <V> ScheduledFuture<V> schedule(Callable<V> callable, long delay, TimeUnit unit) {
            return scheduledDelegate.schedule(wrapCallable(callable), delay, unit);
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay,
                long period, TimeUnit unit) {
            return scheduledDelegate.scheduleAtFixedRate(
                    MdcProjectContext.wrap(command), initialDelay, period, unit);
        }

        @Override
        public ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay,
                long delay, TimeUnit unit) {
            return scheduledDelegate.scheduleWithFixedDelay(
                    MdcProjectContext.wrap(command), initialDelay, delay, unit);
        }
    }
}
