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

import java.time.Duration;
import java.time.Instant;

import com.tomaszrup.lspmanager.LanguageServerException.Kind;
import com.tomaszrup.lspmanager.project.ProjectKey;

/**
 * Read-only view of a session at one point in time.
 */
public final class SessionSnapshot {

    private final ProjectKey key;
    private final SessionState state;
    private final long pid;
    private final int crashCount;
    private final Duration backoff;
    private final Instant lastActivity;
    private final int activeRequests;
    private final int openDocuments;
    private final long roundTrips;
    private final int spawnCount;
    private final Kind lastErrorKind;
    private final String lastErrorMessage;

    SessionSnapshot(ProjectKey key, SessionState state, long pid, int crashCount, Duration backoff,
            Instant lastActivity, int activeRequests, int openDocuments, long roundTrips, int spawnCount,
            LanguageServerException lastError) {
        this.key = key;
        this.state = state;
        this.pid = pid;
        this.crashCount = crashCount;
        this.backoff = backoff;
        this.lastActivity = lastActivity;
        this.activeRequests = activeRequests;
        this.openDocuments = openDocuments;
        this.roundTrips = roundTrips;
        this.spawnCount = spawnCount;
        this.lastErrorKind = lastError != null ? lastError.getKind() : null;
        this.lastErrorMessage = lastError != null ? lastError.getMessage() : null;
    }

    /** Snapshot for a key with no table entry. */
    static SessionSnapshot absent(ProjectKey key) {
        return new SessionSnapshot(key, SessionState.UNSPAWNED, -1, 0, Duration.ZERO, null, 0, 0, 0, 0, null);
    }

    public ProjectKey getKey() {
        return key;
    }

    public SessionState getState() {
        return state;
    }

    /** Pid of the live process, or -1. */
    public long getPid() {
        return pid;
    }

    public int getCrashCount() {
        return crashCount;
    }

    public Duration getBackoff() {
        return backoff;
    }

    /** Null for a key never used. */
    public Instant getLastActivity() {
        return lastActivity;
    }

    public int getActiveRequests() {
        return activeRequests;
    }

    public int getOpenDocuments() {
        return openDocuments;
    }

    /** Requests written to the current process. */
    public long getRoundTrips() {
        return roundTrips;
    }

    /** Processes started for this table entry. */
    public int getSpawnCount() {
        return spawnCount;
    }

    public Kind getLastErrorKind() {
        return lastErrorKind;
    }

    public String getLastErrorMessage() {
        return lastErrorMessage;
    }

    @Override
    public String toString() {
        return "SessionSnapshot{" + key.label() + " " + state
                + (pid >= 0 ? " pid=" + pid : "")
                + " crashes=" + crashCount
                + " backoff=" + backoff.toMillis() + "ms"
                + " active=" + activeRequests
                + " docs=" + openDocuments
                + " roundTrips=" + roundTrips
                + (lastErrorKind != null ? " lastError=" + lastErrorKind : "") + "}";
    }
}
