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

import com.tomaszrup.lspmanager.project.LanguageServerDefinition;
import com.tomaszrup.lspmanager.project.ProjectKey;

/**
 * Table entry for one project key. Mutable fields are written only while
 * the {@link SessionRegistry} lock is held; the volatile ones may be read
 * without it.
 */
final class ServerSession {

    private final ProjectKey key;
    private final LanguageServerDefinition definition;

    private volatile SessionState state = SessionState.UNSPAWNED;
    private volatile ServerConnection connection;
    private volatile LanguageServerException lastError;
    private volatile long lastActivityMillis = System.currentTimeMillis();

    private int crashCount;
    private Duration backoff = Duration.ZERO;
    private long erroredAtNanos;
    private int spawnCount;
    private int activeRequests;

    ServerSession(ProjectKey key, LanguageServerDefinition definition) {
        this.key = key;
        this.definition = definition;
    }

    ProjectKey getKey() {
        return key;
    }

    LanguageServerDefinition getDefinition() {
        return definition;
    }

    SessionState getState() {
        return state;
    }

    void setState(SessionState state) {
        this.state = state;
    }

    ServerConnection getConnection() {
        return connection;
    }

    void setConnection(ServerConnection connection) {
        this.connection = connection;
    }

    LanguageServerException getLastError() {
        return lastError;
    }

    void setLastError(LanguageServerException lastError) {
        this.lastError = lastError;
    }

    long getLastActivityMillis() {
        return lastActivityMillis;
    }

    void touch() {
        lastActivityMillis = System.currentTimeMillis();
    }

    int getCrashCount() {
        return crashCount;
    }

    Duration getBackoff() {
        return backoff;
    }

    /**
     * Records a failure that put the session into ERRORED.
     */
    void recordCrash(LanguageServerException error, Duration nextBackoff) {
        crashCount++;
        backoff = nextBackoff;
        erroredAtNanos = System.nanoTime();
        lastError = error;
    }

    void resetCrashes() {
        crashCount = 0;
        backoff = Duration.ZERO;
        lastError = null;
    }

    long backoffRemainingNanos() {
        long elapsed = System.nanoTime() - erroredAtNanos;
        return Math.max(0, backoff.toNanos() - elapsed);
    }

    int getSpawnCount() {
        return spawnCount;
    }

    void incrementSpawnCount() {
        spawnCount++;
    }

    int getActiveRequests() {
        return activeRequests;
    }

    void beginRequest() {
        activeRequests++;
        touch();
    }

    void endRequest() {
        activeRequests--;
        touch();
    }

    @Override
    public String toString() {
        return "ServerSession{" + key.label() + " " + state + "}";
    }
}
