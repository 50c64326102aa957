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

import com.tomaszrup.lspmanager.cache.CachePolicy;

/**
 * Immutable tuning knobs of a {@link LanguageServerManager}.
 */
public final class ManagerSettings {

    private final Duration requestTimeout;
    private final Duration handshakeTimeout;
    private final Duration idleTimeout;
    private final Duration idleCheckInterval;
    private final boolean idleMonitorEnabled;
    private final Duration shutdownTimeout;
    private final Duration restartBackoffBase;
    private final Duration restartBackoffCap;
    private final long memoryThresholdBytes;
    private final Duration resourceCheckInterval;
    private final boolean resourceMonitorEnabled;
    private final int maxLiveSessions;
    private final int maxInFlightPerSession;
    private final Duration settleDelay;
    private final int cacheCapacity;
    private final CachePolicy cachePolicy;
    private final Duration slowRequestThreshold;
    private final int notificationBufferSize;
    private final Duration diagnosticsWait;

    private ManagerSettings(Builder b) {
        this.requestTimeout = b.requestTimeout;
        this.handshakeTimeout = b.handshakeTimeout;
        this.idleTimeout = b.idleTimeout;
        this.idleCheckInterval = b.idleCheckInterval;
        this.idleMonitorEnabled = b.idleMonitorEnabled;
        this.shutdownTimeout = b.shutdownTimeout;
        this.restartBackoffBase = b.restartBackoffBase;
        this.restartBackoffCap = b.restartBackoffCap;
        this.memoryThresholdBytes = b.memoryThresholdBytes;
        this.resourceCheckInterval = b.resourceCheckInterval;
        this.resourceMonitorEnabled = b.resourceMonitorEnabled;
        this.maxLiveSessions = b.maxLiveSessions;
        this.maxInFlightPerSession = b.maxInFlightPerSession;
        this.settleDelay = b.settleDelay;
        this.cacheCapacity = b.cacheCapacity;
        this.cachePolicy = b.cachePolicy;
        this.slowRequestThreshold = b.slowRequestThreshold;
        this.notificationBufferSize = b.notificationBufferSize;
        this.diagnosticsWait = b.diagnosticsWait;
    }

    public static ManagerSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.requestTimeout = requestTimeout;
        b.handshakeTimeout = handshakeTimeout;
        b.idleTimeout = idleTimeout;
        b.idleCheckInterval = idleCheckInterval;
        b.idleMonitorEnabled = idleMonitorEnabled;
        b.shutdownTimeout = shutdownTimeout;
        b.restartBackoffBase = restartBackoffBase;
        b.restartBackoffCap = restartBackoffCap;
        b.memoryThresholdBytes = memoryThresholdBytes;
        b.resourceCheckInterval = resourceCheckInterval;
        b.resourceMonitorEnabled = resourceMonitorEnabled;
        b.maxLiveSessions = maxLiveSessions;
        b.maxInFlightPerSession = maxInFlightPerSession;
        b.settleDelay = settleDelay;
        b.cacheCapacity = cacheCapacity;
        b.cachePolicy = cachePolicy;
        b.slowRequestThreshold = slowRequestThreshold;
        b.notificationBufferSize = notificationBufferSize;
        b.diagnosticsWait = diagnosticsWait;
        return b;
    }

    /** Default deadline of a request when the caller gives none. */
    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getHandshakeTimeout() {
        return handshakeTimeout;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public Duration getIdleCheckInterval() {
        return idleCheckInterval;
    }

    public boolean isIdleMonitorEnabled() {
        return idleMonitorEnabled;
    }

    /** Grace period for the shutdown request and for the process to exit. */
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public Duration getRestartBackoffBase() {
        return restartBackoffBase;
    }

    public Duration getRestartBackoffCap() {
        return restartBackoffCap;
    }

    public long getMemoryThresholdBytes() {
        return memoryThresholdBytes;
    }

    public Duration getResourceCheckInterval() {
        return resourceCheckInterval;
    }

    public boolean isResourceMonitorEnabled() {
        return resourceMonitorEnabled;
    }

    public int getMaxLiveSessions() {
        return maxLiveSessions;
    }

    public int getMaxInFlightPerSession() {
        return maxInFlightPerSession;
    }

    /**
     * Wait after a document is first opened, before the request is sent.
     * Servers give no reliable "indexing done" signal; this only makes an
     * early answer less likely to be empty.
     */
    public Duration getSettleDelay() {
        return settleDelay;
    }

    public int getCacheCapacity() {
        return cacheCapacity;
    }

    public CachePolicy getCachePolicy() {
        return cachePolicy;
    }

    public Duration getSlowRequestThreshold() {
        return slowRequestThreshold;
    }

    public int getNotificationBufferSize() {
        return notificationBufferSize;
    }

    public Duration getDiagnosticsWait() {
        return diagnosticsWait;
    }

    @Override
    public String toString() {
        return "ManagerSettings{requestTimeout=" + requestTimeout
                + ", idleTimeout=" + idleTimeout
                + ", idleMonitor=" + idleMonitorEnabled
                + ", maxLiveSessions=" + maxLiveSessions
                + ", memoryThresholdMb=" + (memoryThresholdBytes / (1024 * 1024))
                + ", backoff=" + restartBackoffBase + ".." + restartBackoffCap
                + ", settleDelay=" + settleDelay + "}";
    }

    public static final class Builder {
        private Duration requestTimeout = Duration.ofSeconds(60);
        private Duration handshakeTimeout = Duration.ofSeconds(30);
        private Duration idleTimeout = Duration.ofMinutes(10);
        private Duration idleCheckInterval = Duration.ofSeconds(60);
        private boolean idleMonitorEnabled = true;
        private Duration shutdownTimeout = Duration.ofSeconds(5);
        private Duration restartBackoffBase = Duration.ofSeconds(1);
        private Duration restartBackoffCap = Duration.ofSeconds(60);
        private long memoryThresholdBytes = 1024L * 1024 * 1024;
        private Duration resourceCheckInterval = Duration.ofSeconds(30);
        private boolean resourceMonitorEnabled = true;
        private int maxLiveSessions = 8;
        private int maxInFlightPerSession = 4;
        private Duration settleDelay = Duration.ofSeconds(2);
        private int cacheCapacity = 1000;
        private CachePolicy cachePolicy = CachePolicy.defaults();
        private Duration slowRequestThreshold = Duration.ofMillis(200);
        private int notificationBufferSize = 100;
        private Duration diagnosticsWait = Duration.ofSeconds(3);

        private Builder() {
        }

        public Builder requestTimeout(Duration value) {
            this.requestTimeout = positive(value, "requestTimeout");
            return this;
        }

        public Builder handshakeTimeout(Duration value) {
            this.handshakeTimeout = positive(value, "handshakeTimeout");
            return this;
        }

        public Builder idleTimeout(Duration value) {
            this.idleTimeout = positive(value, "idleTimeout");
            return this;
        }

        public Builder idleCheckInterval(Duration value) {
            this.idleCheckInterval = positive(value, "idleCheckInterval");
            return this;
        }

        public Builder idleMonitorEnabled(boolean value) {
            this.idleMonitorEnabled = value;
            return this;
        }

        public Builder shutdownTimeout(Duration value) {
            this.shutdownTimeout = nonNegative(value, "shutdownTimeout");
            return this;
        }

        public Builder restartBackoff(Duration base, Duration cap) {
            this.restartBackoffBase = nonNegative(base, "restartBackoffBase");
            this.restartBackoffCap = nonNegative(cap, "restartBackoffCap");
            return this;
        }

        public Builder memoryThresholdBytes(long value) {
            if (value <= 0) {
                throw new IllegalArgumentException("memoryThresholdBytes must be positive");
            }
            this.memoryThresholdBytes = value;
            return this;
        }

        public Builder resourceCheckInterval(Duration value) {
            this.resourceCheckInterval = positive(value, "resourceCheckInterval");
            return this;
        }

        public Builder resourceMonitorEnabled(boolean value) {
            this.resourceMonitorEnabled = value;
            return this;
        }

        public Builder maxLiveSessions(int value) {
            this.maxLiveSessions = Math.max(1, value);
            return this;
        }

        public Builder maxInFlightPerSession(int value) {
            this.maxInFlightPerSession = Math.max(1, value);
            return this;
        }

        public Builder settleDelay(Duration value) {
            this.settleDelay = nonNegative(value, "settleDelay");
            return this;
        }

        public Builder cacheCapacity(int value) {
            this.cacheCapacity = Math.max(1, value);
            return this;
        }

        public Builder cachePolicy(CachePolicy value) {
            this.cachePolicy = value;
            return this;
        }

        public Builder slowRequestThreshold(Duration value) {
            this.slowRequestThreshold = nonNegative(value, "slowRequestThreshold");
            return this;
        }

        public Builder notificationBufferSize(int value) {
            this.notificationBufferSize = Math.max(1, value);
            return this;
        }

        public Builder diagnosticsWait(Duration value) {
            this.diagnosticsWait = nonNegative(value, "diagnosticsWait");
            return this;
        }

        public ManagerSettings build() {
            if (restartBackoffCap.compareTo(restartBackoffBase) < 0) {
                restartBackoffCap = restartBackoffBase;
            }
            return new ManagerSettings(this);
        }

        private static Duration positive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }

        private static Duration nonNegative(Duration value, String name) {
            if (value == null || value.isNegative()) {
                throw new IllegalArgumentException(name + " must not be negative");
            }
            return value;
        }
    }
}
