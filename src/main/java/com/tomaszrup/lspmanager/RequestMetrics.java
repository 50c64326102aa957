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
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-method request counters and latency, plus cache hit accounting.
 * Requests slower than the configured threshold are logged at WARN.
 */
public class RequestMetrics {

    private static final Logger logger = LoggerFactory.getLogger(RequestMetrics.class);

    private final long slowThresholdNanos;
    private final Map<String, MethodStats> byMethod = new ConcurrentHashMap<>();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();

    /** Counters for one method. */
    public static final class MethodStats {
        private final LongAdder succeeded = new LongAdder();
        private final LongAdder failed = new LongAdder();
        private final LongAdder totalNanos = new LongAdder();

        public long getSucceeded() {
            return succeeded.sum();
        }

        public long getFailed() {
            return failed.sum();
        }

        public Duration getAverageLatency() {
            long count = succeeded.sum() + failed.sum();
            return count == 0 ? Duration.ZERO : Duration.ofNanos(totalNanos.sum() / count);
        }

        @Override
        public String toString() {
            return "ok=" + getSucceeded() + " failed=" + getFailed() + " avg=" + getAverageLatency().toMillis() + "ms";
        }
    }

    public RequestMetrics(Duration slowThreshold) {
        this.slowThresholdNanos = slowThreshold.toNanos();
    }

    public void record(String method, long elapsedNanos, boolean success) {
        MethodStats stats = byMethod.computeIfAbsent(method, m -> new MethodStats());
        (success ? stats.succeeded : stats.failed).increment();
        stats.totalNanos.add(elapsedNanos);
        if (slowThresholdNanos > 0 && elapsedNanos > slowThresholdNanos) {
            logger.warn("Slow request: {} took {} ms", method, elapsedNanos / 1_000_000L);
        }
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public MethodStats get(String method) {
        return byMethod.getOrDefault(method, new MethodStats());
    }

    public long getCacheHits() {
        return cacheHits.sum();
    }

    public long getCacheMisses() {
        return cacheMisses.sum();
    }

    public double getCacheHitRate() {
        long hits = cacheHits.sum();
        long total = hits + cacheMisses.sum();
        return total == 0 ? 0.0 : (double) hits / total;
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("cache hit rate %.1f%%", getCacheHitRate() * 100));
        for (Map.Entry<String, MethodStats> entry : new TreeMap<>(byMethod).entrySet()) {
            sb.append("; ").append(entry.getKey()).append(' ').append(entry.getValue());
        }
        return sb.toString();
    }
}
