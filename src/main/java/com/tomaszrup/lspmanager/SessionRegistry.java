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
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lspmanager.project.LanguageServerDefinition;
import com.tomaszrup.lspmanager.project.ProjectKey;

/**
 * The session table.
 *
 * <p>One lock guards the table and every session's state, counters and
 * connection reference. Critical sections are short: nothing here performs
 * I/O or waits on a process. Threads that must wait for another thread's
 * transition (a spawn in progress, a backoff, a free slot) wait on
 * {@link #awaitChange(long)}, which releases the lock; every transition and
 * every request completion signals it.</p>
 */
final class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private static final Map<SessionState, Set<SessionState>> ALLOWED = new EnumMap<>(SessionState.class);

    static {
        ALLOWED.put(SessionState.UNSPAWNED, EnumSet.of(SessionState.SPAWNING, SessionState.TERMINATED));
        ALLOWED.put(SessionState.SPAWNING, EnumSet.of(SessionState.INITIALIZING, SessionState.ERRORED));
        ALLOWED.put(SessionState.INITIALIZING, EnumSet.of(SessionState.READY, SessionState.ERRORED));
        ALLOWED.put(SessionState.READY, EnumSet.of(SessionState.SHUTTING_DOWN, SessionState.ERRORED));
        ALLOWED.put(SessionState.SHUTTING_DOWN, EnumSet.of(SessionState.TERMINATED));
        ALLOWED.put(SessionState.ERRORED, EnumSet.of(SessionState.SPAWNING, SessionState.TERMINATED));
        ALLOWED.put(SessionState.TERMINATED, EnumSet.noneOf(SessionState.class));
    }

    private final int maxLiveSessions;
    private final SessionStateListener listener;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<ProjectKey, ServerSession> sessions = new LinkedHashMap<>();

    SessionRegistry(int maxLiveSessions, SessionStateListener listener) {
        this.maxLiveSessions = maxLiveSessions;
        this.listener = listener;
    }

    void lock() {
        lock.lock();
    }

    void unlock() {
        lock.unlock();
    }

    /**
     * Waits for any transition or request completion, up to {@code nanos}.
     * Must be called with the lock held.
     */
    void awaitChange(long nanos) throws InterruptedException {
        if (nanos > 0) {
            changed.awaitNanos(nanos);
        }
    }

    void signalChange() {
        changed.signalAll();
    }

    ServerSession getOrCreate(ProjectKey key, LanguageServerDefinition definition) {
        assertLocked();
        return sessions.computeIfAbsent(key, k -> new ServerSession(k, definition));
    }

    ServerSession get(ProjectKey key) {
        assertLocked();
        return sessions.get(key);
    }

    List<ServerSession> all() {
        assertLocked();
        return new ArrayList<>(sessions.values());
    }

    /** Removes the entry if it still maps to {@code session}. */
    void remove(ServerSession session) {
        assertLocked();
        sessions.remove(session.getKey(), session);
        changed.signalAll();
    }

    void transition(ServerSession session, SessionState to) {
        assertLocked();
        SessionState from = session.getState();
        if (!ALLOWED.get(from).contains(to)) {
            throw new IllegalStateException("Illegal transition " + from + " -> " + to + " for " + session);
        }
        if (to == SessionState.SPAWNING) {
            session.incrementSpawnCount();
        }
        session.setState(to);
        logger.debug("{}: {} -> {}", session.getKey().label(), from, to);
        try {
            listener.onTransition(session.getKey(), from, to);
        } catch (RuntimeException e) {
            logger.warn("State listener failed: {}", RequestFailures.summarize(e));
        }
        changed.signalAll();
    }

    int occupiedSlots() {
        assertLocked();
        int count = 0;
        for (ServerSession session : sessions.values()) {
            if (session.getState().occupiesSlot()) {
                count++;
            }
        }
        return count;
    }

    boolean hasFreeSlot() {
        return occupiedSlots() < maxLiveSessions;
    }

    /**
     * Least recently active READY session with no outstanding request, or
     * null if every live session is busy or still starting.
     */
    ServerSession selectEvictionCandidate() {
        assertLocked();
        ServerSession candidate = null;
        for (ServerSession session : sessions.values()) {
            if (session.getState() == SessionState.READY && session.getActiveRequests() == 0
                    && (candidate == null || session.getLastActivityMillis() < candidate.getLastActivityMillis())) {
                candidate = session;
            }
        }
        return candidate;
    }

    void endRequest(ServerSession session) {
        lock.lock();
        try {
            session.endRequest();
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    int getMaxLiveSessions() {
        return maxLiveSessions;
    }

    private void assertLocked() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Session table lock not held");
        }
    }
}
