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
package com.tomaszrup.lspmanager.cache;

import java.net.URI;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.tomaszrup.lspmanager.project.ProjectKey;

/**
 * Response cache shared by all sessions.
 *
 * <p>Entries expire by TTL and are evicted least-recently-used once the
 * capacity is reached. A reported write to a file drops every entry that
 * read it, plus the project-wide entries of the projects containing it.</p>
 *
 * <p>Each write also advances a write epoch. A caller takes the epoch with
 * {@link #currentEpoch(ProjectKey)} before it syncs and sends a request, and passes it
 * back to {@link #store}; if one of the request's files (or, for a
 * project-wide entry, its project) was written in between, the result is
 * not stored, since it may describe the old content.</p>
 */
public class ResponseCache {

    private static final Logger logger = LoggerFactory.getLogger(ResponseCache.class);

    private final int capacity;
    private final LongSupplier nanoClock;

    // guarded by this
    private final LinkedHashMap<CacheKey, Entry> entries = new LinkedHashMap<>(64, 0.75f, true);
    private final Map<String, Long> fileWriteEpochs = new HashMap<>();
    private final Map<ProjectKey, Long> projectWriteEpochs = new HashMap<>();
    private long epoch;
    private long hits;
    private long misses;
    private long evictions;
    private long invalidations;
    private long rejectedStores;

    private static final class Entry {
        final JsonElement value;
        final long expiresAtNanos;

        Entry(JsonElement value, long expiresAtNanos) {
            this.value = value;
            this.expiresAtNanos = expiresAtNanos;
        }
    }

    public ResponseCache(int capacity) {
        this(capacity, System::nanoTime);
    }

    public ResponseCache(int capacity, LongSupplier nanoClock) {
        this.capacity = Math.max(1, capacity);
        this.nanoClock = nanoClock;
    }

    /**
     * Current write epoch, to be passed to {@link #store} for a request of
     * {@code project} that starts now.
     */
    public synchronized long currentEpoch(ProjectKey project) {
        projectWriteEpochs.putIfAbsent(project, 0L);
        return epoch;
    }

    /**
     * Returns a copy of the cached value if present and not expired.
     */
    public synchronized Optional<JsonElement> lookup(CacheKey key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (nanoClock.getAsLong() - entry.expiresAtNanos >= 0) {
            entries.remove(key);
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(entry.value.deepCopy());
    }

    /**
     * Stores {@code value} unless a write relevant to {@code key} was
     * observed after {@code observedEpoch}.
     *
     * @return true if stored
     */
    public synchronized boolean store(CacheKey key, JsonElement value, Duration ttl, long observedEpoch) {
        if (isStale(key, observedEpoch)) {
            rejectedStores++;
            logger.debug("Not caching {}: input written while the request was in flight", key);
            return false;
        }
        entries.put(key, new Entry(value.deepCopy(), nanoClock.getAsLong() + ttl.toNanos()));
        while (entries.size() > capacity) {
            Iterator<CacheKey> eldest = entries.keySet().iterator();
            eldest.next();
            eldest.remove();
            evictions++;
        }
        return true;
    }

    private boolean isStale(CacheKey key, long observedEpoch) {
        if (key.isProjectWide()) {
            return projectWriteEpochs.getOrDefault(key.getProject(), 0L) > observedEpoch;
        }
        for (String uri : key.getFileFingerprints().keySet()) {
            if (fileWriteEpochs.getOrDefault(uri, 0L) > observedEpoch) {
                return true;
            }
        }
        return false;
    }

    /**
     * Drops every entry that depends on {@code uri}, and the project-wide
     * entries of projects containing it.
     *
     * @return number of entries removed
     */
    public synchronized int invalidate(String uri) {
        epoch++;
        fileWriteEpochs.put(uri, epoch);
        Path path = toPath(uri);
        int removed = 0;
        Iterator<Map.Entry<CacheKey, Entry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            CacheKey key = it.next().getKey();
            boolean affected = key.dependsOn(uri)
                    || (key.isProjectWide() && path != null && key.getProject().contains(path));
            if (affected) {
                it.remove();
                removed++;
            }
        }
        if (path != null) {
            for (Map.Entry<ProjectKey, Long> project : projectWriteEpochs.entrySet()) {
                if (project.getKey().contains(path)) {
                    project.setValue(epoch);
                }
            }
        }
        invalidations += removed;
        if (removed > 0) {
            logger.debug("Invalidated {} cached responses for {}", removed, uri);
        }
        return removed;
    }

    /**
     * Drops entries built from a different version of {@code uri} than the
     * one with {@code fingerprint}. Unlike {@link #invalidate}, this does not
     * advance the write epoch: it is used once the new content has already
     * been synced to the server.
     */
    public synchronized int dropStale(String uri, String fingerprint) {
        int removed = 0;
        Iterator<CacheKey> it = entries.keySet().iterator();
        while (it.hasNext()) {
            String seen = it.next().getFileFingerprints().get(uri);
            if (seen != null && !seen.equals(fingerprint)) {
                it.remove();
                removed++;
            }
        }
        invalidations += removed;
        return removed;
    }

    /**
     * Drops every entry of {@code project}.
     */
    public synchronized int invalidateProject(ProjectKey project) {
        epoch++;
        projectWriteEpochs.put(project, epoch);
        int removed = 0;
        Iterator<CacheKey> it = entries.keySet().iterator();
        while (it.hasNext()) {
            CacheKey key = it.next();
            if (key.getProject().equals(project)) {
                it.remove();
                removed++;
                for (String uri : key.getFileFingerprints().keySet()) {
                    fileWriteEpochs.put(uri, epoch);
                }
            }
        }
        invalidations += removed;
        return removed;
    }

    /** Removes expired entries; returns how many. */
    public synchronized int purgeExpired() {
        long now = nanoClock.getAsLong();
        int removed = 0;
        Iterator<Entry> it = entries.values().iterator();
        while (it.hasNext()) {
            if (now - it.next().expiresAtNanos >= 0) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public synchronized void clear() {
        epoch++;
        invalidations += entries.size();
        entries.clear();
        fileWriteEpochs.replaceAll((uri, e) -> epoch);
        projectWriteEpochs.replaceAll((project, e) -> epoch);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized CacheStats stats() {
        return new CacheStats(entries.size(), hits, misses, evictions, invalidations, rejectedStores);
    }

    private static Path toPath(String uri) {
        try {
            URI parsed = URI.create(uri);
            if (!"file".equalsIgnoreCase(parsed.getScheme())) {
                return null;
            }
            return Paths.get(parsed);
        } catch (IllegalArgumentException | FileSystemNotFoundException e) {
            return null;
        }
    }
}
