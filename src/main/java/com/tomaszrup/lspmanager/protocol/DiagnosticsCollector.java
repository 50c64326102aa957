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
package com.tomaszrup.lspmanager.protocol;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Keeps the latest {@code textDocument/publishDiagnostics} push per document
 * for one session. Pushes are best effort: a query waits a bounded time for
 * a push newer than the point it synced the document, then settles for
 * whatever it has.
 */
public class DiagnosticsCollector {

    private static final Logger logger = LoggerFactory.getLogger(DiagnosticsCollector.class);

    public static final String PUBLISH_DIAGNOSTICS = "textDocument/publishDiagnostics";

    private final NotificationSubscription subscription;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition published = lock.newCondition();
    private final Map<String, Published> latest = new HashMap<>();
    private long sequence;

    private static final class Published {
        final JsonObject params;
        final long sequence;

        Published(JsonObject params, long sequence) {
            this.params = params;
            this.sequence = sequence;
        }
    }

    public DiagnosticsCollector(NotificationSubscription subscription) {
        this.subscription = subscription;
    }

    public void start(ExecutorService ioPool) {
        ioPool.execute(this::collect);
    }

    private void collect() {
        try {
            while (!subscription.isClosed()) {
                ServerNotification next = subscription.poll(Duration.ofSeconds(1));
                if (next != null && PUBLISH_DIAGNOSTICS.equals(next.getMethod())) {
                    record(next.getParams());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            lock.lock();
            try {
                published.signalAll();
            } finally {
                lock.unlock();
            }
        }
    }

    void record(JsonElement params) {
        if (params == null || !params.isJsonObject()) {
            return;
        }
        JsonObject p = params.getAsJsonObject();
        JsonElement uri = p.get("uri");
        if (uri == null || !uri.isJsonPrimitive()) {
            return;
        }
        lock.lock();
        try {
            latest.put(normalizeUri(uri.getAsString()), new Published(p, ++sequence));
            published.signalAll();
        } finally {
            lock.unlock();
        }
        logger.trace("Diagnostics published for {}", uri.getAsString());
    }

    /** Sequence mark to pass to {@link #awaitAfter} later. */
    public long mark() {
        lock.lock();
        try {
            return sequence;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for a push for {@code uri} newer than
     * {@code mark}; returns the latest known push either way.
     */
    public Optional<JsonObject> awaitAfter(String uri, long mark, Duration timeout) throws InterruptedException {
        String normalized = normalizeUri(uri);
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                Published p = latest.get(normalized);
                if (p != null && p.sequence > mark) {
                    return Optional.of(p.params);
                }
                if (remaining <= 0 || subscription.isClosed()) {
                    return Optional.ofNullable(p).map(x -> x.params);
                }
                remaining = published.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    public Optional<JsonObject> latest(String uri) {
        lock.lock();
        try {
            return Optional.ofNullable(latest.get(normalizeUri(uri))).map(p -> p.params);
        } finally {
            lock.unlock();
        }
    }

    public void forget(String uri) {
        lock.lock();
        try {
            latest.remove(normalizeUri(uri));
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        subscription.close();
    }

    // file:///x and file:/x spell the same document
    static String normalizeUri(String uri) {
        if (uri.startsWith("file:///")) {
            return "file:/" + uri.substring("file:///".length());
        }
        return uri;
    }
}
