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
package com.tomaszrup.lspmanager.dispatch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.tomaszrup.lspmanager.LanguageServerException;
import com.tomaszrup.lspmanager.LanguageServerException.Kind;
import com.tomaszrup.lspmanager.RequestFailures;
import com.tomaszrup.lspmanager.project.ProjectKey;

/**
 * Per-session request queue.
 *
 * <p>At most {@code maxInFlight} requests are outstanding at the server at
 * once; the rest wait here and are released highest priority first, FIFO
 * within a priority. There is no aging, so a steady stream of high-priority
 * work can hold lower tiers back indefinitely.</p>
 *
 * <p>A request's deadline covers its queue time and its round-trip. A
 * request still queued at its deadline fails with {@code REQUEST_TIMEOUT}
 * without ever reaching the server; once sent, the remaining time becomes
 * the protocol call's timeout.</p>
 */
public class PriorityDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(PriorityDispatcher.class);

    private final ProjectKey key;
    private final int maxInFlight;
    private final ScheduledExecutorService scheduler;

    // guarded by this
    private final PriorityQueue<PendingRequest> queue = new PriorityQueue<>();
    private int inFlight;
    private long nextSequence;
    private LanguageServerException closedWith;

    public PriorityDispatcher(ProjectKey key, int maxInFlight, ScheduledExecutorService scheduler) {
        this.key = key;
        this.maxInFlight = Math.max(1, maxInFlight);
        this.scheduler = scheduler;
    }

    /**
     * Queues a request.
     *
     * @param sender performs the round-trip given the time left until the
     *        deadline, typically {@code ProtocolSession.call}
     */
    public CompletableFuture<JsonElement> submit(String method, RequestPriority priority, long deadlineNanos,
            Function<Duration, CompletableFuture<JsonElement>> sender) {
        PendingRequest request;
        synchronized (this) {
            if (closedWith != null) {
                return CompletableFuture.failedFuture(closedWith.copy());
            }
            request = new PendingRequest(nextSequence++, method, priority, System.nanoTime(), deadlineNanos,
                    sender);
            queue.add(request);
        }
        long delay = Math.max(0, deadlineNanos - System.nanoTime());
        ScheduledFuture<?> expiry = scheduler.schedule(() -> expire(request), delay, TimeUnit.NANOSECONDS);
        request.getResult().whenComplete((value, error) -> expiry.cancel(false));
        drain();
        return request.getResult();
    }

    private void expire(PendingRequest request) {
        boolean removed;
        synchronized (this) {
            removed = queue.remove(request);
        }
        if (removed) {
            logger.debug("{} expired in queue", request);
            request.getResult().completeExceptionally(new LanguageServerException(Kind.REQUEST_TIMEOUT, key,
                    request.getMethod() + " timed out waiting for dispatch"));
        }
    }

    private void drain() {
        List<PendingRequest> ready = new ArrayList<>();
        synchronized (this) {
            while (inFlight < maxInFlight && !queue.isEmpty()) {
                PendingRequest next = queue.poll();
                if (next.getResult().isDone()) {
                    continue;
                }
                inFlight++;
                ready.add(next);
            }
        }
        for (PendingRequest request : ready) {
            send(request);
        }
    }

    private void send(PendingRequest request) {
        long remaining = request.getDeadlineNanos() - System.nanoTime();
        if (remaining <= 0) {
            request.getResult().completeExceptionally(new LanguageServerException(Kind.REQUEST_TIMEOUT, key,
                    request.getMethod() + " timed out waiting for dispatch"));
            release();
            return;
        }
        CompletableFuture<JsonElement> call;
        try {
            call = request.getSender().apply(Duration.ofNanos(remaining));
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        call.whenComplete((value, error) -> {
            if (error != null) {
                request.getResult().completeExceptionally(
                        RequestFailures.toLanguageServerException(error, key, Kind.SESSION_CRASHED));
            } else {
                request.getResult().complete(value);
            }
            release();
        });
    }

    private void release() {
        synchronized (this) {
            inFlight--;
        }
        drain();
    }

    /**
     * Fails every queued request with {@code cause} and rejects later
     * submissions. In-flight requests are left to the protocol session,
     * which fails them with its own termination cause.
     */
    public void failAll(LanguageServerException cause) {
        List<PendingRequest> dropped;
        synchronized (this) {
            if (closedWith == null) {
                closedWith = cause;
            }
            dropped = new ArrayList<>(queue);
            queue.clear();
        }
        for (PendingRequest request : dropped) {
            request.getResult().completeExceptionally(cause.copy());
        }
    }

    public synchronized int getQueuedCount() {
        return queue.size();
    }

    public synchronized int getInFlightCount() {
        return inFlight;
    }

    /** Queued plus in flight. */
    public synchronized int getPendingCount() {
        return queue.size() + inFlight;
    }
}
