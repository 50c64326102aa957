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
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lspmanager.LanguageServerException.Kind;
import com.tomaszrup.lspmanager.process.ProcessMemorySampler;

/**
 * Background retirement of live sessions: idle sessions are shut down, and
 * sessions whose server grew past the memory threshold are restarted
 * proactively (the next request spawns a fresh process, with no crash
 * counted).
 *
 * <p>Sweeps only pick READY sessions with no outstanding request. The
 * transition to SHUTTING_DOWN is made under the table lock; the slow stop
 * itself is handed to the {@link SessionStopper}.</p>
 */
class SessionEvictionManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionEvictionManager.class);

    private static final long MB = 1024L * 1024;

    /** Performs the graceful stop of a session already marked SHUTTING_DOWN. */
    interface SessionStopper {
        void stopAsync(ServerSession session, LanguageServerException reason);
    }

    private final SessionRegistry sessions;
    private final ManagerSettings settings;
    private final ProcessMemorySampler sampler;
    private final SessionStopper stopper;

    private final AtomicReference<ScheduledFuture<?>> idleFuture = new AtomicReference<>();
    private final AtomicReference<ScheduledFuture<?>> resourceFuture = new AtomicReference<>();

    SessionEvictionManager(SessionRegistry sessions, ManagerSettings settings, ProcessMemorySampler sampler,
            SessionStopper stopper) {
        this.sessions = sessions;
        this.settings = settings;
        this.sampler = sampler;
        this.stopper = stopper;
    }

    void start(ScheduledExecutorService schedulingPool) {
        if (settings.isIdleMonitorEnabled()) {
            long interval = settings.getIdleCheckInterval().toMillis();
            idleFuture.set(schedulingPool.scheduleWithFixedDelay(this::guardedIdleSweep,
                    interval, interval, TimeUnit.MILLISECONDS));
            logger.info("Idle monitor started (timeout={}s, interval={}ms)",
                    settings.getIdleTimeout().toSeconds(), interval);
        } else {
            logger.info("Idle monitor disabled");
        }
        if (settings.isResourceMonitorEnabled()) {
            long interval = settings.getResourceCheckInterval().toMillis();
            resourceFuture.set(schedulingPool.scheduleWithFixedDelay(this::guardedResourceSweep,
                    interval, interval, TimeUnit.MILLISECONDS));
            logger.info("Resource monitor started (threshold={}MB, interval={}ms)",
                    settings.getMemoryThresholdBytes() / MB, interval);
        }
    }

    void stop() {
        cancel(idleFuture);
        cancel(resourceFuture);
    }

    private static void cancel(AtomicReference<ScheduledFuture<?>> ref) {
        ScheduledFuture<?> f = ref.getAndSet(null);
        if (f != null) {
            f.cancel(false);
        }
    }

    // A periodic task that throws is silently descheduled, so sweeps never throw.
    private void guardedIdleSweep() {
        try {
            sweepIdle();
        } catch (RuntimeException e) {
            logger.error("Idle sweep failed", e);
        }
    }

    private void guardedResourceSweep() {
        try {
            sweepResources();
        } catch (RuntimeException e) {
            logger.error("Resource sweep failed", e);
        }
    }

    /**
     * Marks READY sessions idle for at least the idle timeout as
     * SHUTTING_DOWN and hands them to the stopper.
     *
     * @return number of sessions retired
     */
    int sweepIdle() {
        long now = System.currentTimeMillis();
        long timeoutMs = settings.getIdleTimeout().toMillis();
        List<ServerSession> idle = new ArrayList<>();
        sessions.lock();
        try {
            for (ServerSession session : sessions.all()) {
                long idleMs = now - session.getLastActivityMillis();
                if (session.getState() == SessionState.READY && session.getActiveRequests() == 0
                        && idleMs >= timeoutMs) {
                    sessions.transition(session, SessionState.SHUTTING_DOWN);
                    idle.add(session);
                }
            }
        } finally {
            sessions.unlock();
        }
        for (ServerSession session : idle) {
            long idleSeconds = (now - session.getLastActivityMillis()) / 1000;
            logger.info("Stopping {} after {}s without activity", session.getKey().label(), idleSeconds);
            stopper.stopAsync(session, new LanguageServerException(Kind.SESSION_SHUTTING_DOWN, session.getKey(),
                    "idle for " + idleSeconds + "s"));
        }
        return idle.size();
    }

    /**
     * Samples every READY session's server memory and restarts those above
     * the threshold.
     *
     * @return number of sessions restarted
     */
    int sweepResources() {
        List<ServerSession> candidates = new ArrayList<>();
        List<ServerConnection> connections = new ArrayList<>();
        sessions.lock();
        try {
            for (ServerSession session : sessions.all()) {
                ServerConnection connection = session.getConnection();
                if (session.getState() == SessionState.READY && connection != null) {
                    candidates.add(session);
                    connections.add(connection);
                }
            }
        } finally {
            sessions.unlock();
        }

        long threshold = settings.getMemoryThresholdBytes();
        int restarted = 0;
        for (int i = 0; i < candidates.size(); i++) {
            ServerSession session = candidates.get(i);
            ServerConnection connection = connections.get(i);
            OptionalLong rss = sampler.residentBytes(connection.getSupervisor().pid());
            if (rss.isEmpty()) {
                continue;
            }
            long bytes = rss.getAsLong();
            logger.debug("{} resident memory: {} MB", session.getKey().label(), bytes / MB);
            if (bytes <= threshold) {
                continue;
            }
            boolean marked = false;
            sessions.lock();
            try {
                if (session.getState() == SessionState.READY && session.getConnection() == connection) {
                    if (session.getActiveRequests() == 0) {
                        sessions.transition(session, SessionState.SHUTTING_DOWN);
                        marked = true;
                    } else {
                        logger.debug("{} over memory threshold but busy, retrying next sweep",
                                session.getKey().label());
                    }
                }
            } finally {
                sessions.unlock();
            }
            if (marked) {
                LanguageServerException reason = new LanguageServerException(Kind.RESOURCE_EXCEEDED,
                        session.getKey(), "resident memory " + bytes / MB + " MB exceeds "
                                + threshold / MB + " MB");
                logger.warn("Restarting {}: {}", session.getKey().label(), reason.getMessage());
                stopper.stopAsync(session, reason);
                restarted++;
            }
        }
        return restarted;
    }
}
