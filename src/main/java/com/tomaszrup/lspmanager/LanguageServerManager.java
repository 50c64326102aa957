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

import java.io.IOException;
import java.net.URI;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.lspmanager.LanguageServerException.Kind;
import com.tomaszrup.lspmanager.cache.CacheKey;
import com.tomaszrup.lspmanager.cache.CacheStats;
import com.tomaszrup.lspmanager.cache.ResponseCache;
import com.tomaszrup.lspmanager.dispatch.RequestPriority;
import com.tomaszrup.lspmanager.documents.DocumentSynchronizer;
import com.tomaszrup.lspmanager.documents.DocumentSynchronizer.SyncResult;
import com.tomaszrup.lspmanager.documents.FileContentProvider;
import com.tomaszrup.lspmanager.process.ExecutableLocator;
import com.tomaszrup.lspmanager.process.ProcessMemorySampler;
import com.tomaszrup.lspmanager.process.SystemProcessMemorySampler;
import com.tomaszrup.lspmanager.project.LanguageServerDefinition;
import com.tomaszrup.lspmanager.project.LanguageServerRegistry;
import com.tomaszrup.lspmanager.project.ProjectKey;
import com.tomaszrup.lspmanager.protocol.DiagnosticsCollector;
import com.tomaszrup.lspmanager.protocol.NotificationSubscription;
import com.tomaszrup.lspmanager.util.MdcProjectContext;

/**
 * Owns one language server session per project and brokers every request
 * to them.
 *
 * <p>A request resolves or starts the project's session, syncs the file it
 * names into the server, consults the response cache and otherwise queues
 * on the session's priority dispatcher. Sessions move through
 * {@link SessionState}; every transition is made under the session table
 * lock, while spawning, the handshake and round-trips run outside it.</p>
 *
 * <p>At most {@link ManagerSettings#getMaxLiveSessions()} sessions are live.
 * A new session displaces the least recently active idle one, or waits. A
 * session whose server crashes enters ERRORED and is respawned by the next
 * request once its backoff has elapsed.</p>
 */
public class LanguageServerManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(LanguageServerManager.class);

    private final ManagerSettings settings;
    private final LanguageServerRegistry registry;
    private final FileContentProvider contents;
    private final ExecutorPools pools;
    private final SessionRegistry sessions;
    private final SessionLauncher launcher;
    private final RestartBackoff backoff;
    private final ResponseCache cache;
    private final RequestMetrics metrics;
    private final SessionEvictionManager evictionManager;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    /** A session handed to one request, with the connection it was READY on. */
    private static final class Lease {
        final ServerSession session;
        final ServerConnection connection;

        Lease(ServerSession session, ServerConnection connection) {
            this.session = session;
            this.connection = connection;
        }
    }

    public LanguageServerManager(ManagerSettings settings, LanguageServerRegistry registry,
            FileContentProvider contents) {
        this(settings, registry, contents, new ExecutableLocator(), new SystemProcessMemorySampler(),
                SessionStateListener.NONE);
    }

    public LanguageServerManager(ManagerSettings settings, LanguageServerRegistry registry,
            FileContentProvider contents, ExecutableLocator locator, ProcessMemorySampler memorySampler,
            SessionStateListener listener) {
        this.settings = settings;
        this.registry = registry;
        this.contents = contents;
        this.pools = new ExecutorPools();
        this.sessions = new SessionRegistry(settings.getMaxLiveSessions(), listener);
        this.launcher = new SessionLauncher(settings, pools, locator);
        this.backoff = new RestartBackoff(settings.getRestartBackoffBase(), settings.getRestartBackoffCap());
        this.cache = new ResponseCache(settings.getCacheCapacity());
        this.metrics = new RequestMetrics(settings.getSlowRequestThreshold());
        this.evictionManager = new SessionEvictionManager(sessions, settings, memorySampler, this::stopAsync);
    }

    /** Starts the idle and resource monitors. */
    public void start() {
        if (started.compareAndSet(false, true)) {
            evictionManager.start(pools.getSchedulingPool());
            logger.info("Language server manager started: {}", settings);
        }
    }

    // ----------------------------------------------------------------------
    // Requests
    // ----------------------------------------------------------------------

    public CompletableFuture<JsonElement> submit(ProjectKey key, String method, JsonObject params) {
        return submit(key, method, params, RequestPriority.forMethod(method), settings.getRequestTimeout());
    }

    /**
     * Sends {@code method} to the project's server.
     *
     * <p>If {@code params} carries {@code textDocument.uri}, that file is
     * read through the content provider and synced into the server first.
     * The returned future fails with a {@link LanguageServerException}
     * describing why the request could not be answered.</p>
     *
     * @param deadline overall budget, including any wait for the session
     *        to start
     */
    public CompletableFuture<JsonElement> submit(ProjectKey key, String method, JsonObject params,
            RequestPriority priority, Duration deadline) {
        long deadlineNanos = System.nanoTime() + deadline.toNanos();
        return runAsync(key, () -> execute(key, method, params, priority, deadlineNanos));
    }

    private JsonElement execute(ProjectKey key, String method, JsonObject params, RequestPriority priority,
            long deadlineNanos) {
        long startedAt = System.nanoTime();
        boolean success = false;
        try {
            JsonElement result = dispatch(key, method, params, priority, deadlineNanos);
            success = true;
            return result;
        } catch (LanguageServerException e) {
            logger.debug("{} failed: {}", method, e.getMessage());
            throw e;
        } finally {
            metrics.record(method, System.nanoTime() - startedAt, success);
        }
    }

    private JsonElement dispatch(ProjectKey key, String method, JsonObject params, RequestPriority priority,
            long deadlineNanos) {
        LanguageServerDefinition definition = definitionFor(key);
        // taken before reading the file so a write racing this request keeps its result out of the cache
        long epoch = cache.currentEpoch(key);

        JsonObject request = params != null ? params.deepCopy() : new JsonObject();
        Path file = documentPath(key, request);
        String uri = null;
        String content = null;
        if (file != null) {
            uri = file.toUri().toString();
            request.getAsJsonObject("textDocument").addProperty("uri", uri);
            content = readContents(key, file);
        }

        Lease lease = acquire(key, definition, deadlineNanos);
        try {
            ServerConnection connection = lease.connection;
            Map<String, String> fingerprints = Collections.emptyMap();
            if (uri != null) {
                DocumentSynchronizer documents = connection.getDocuments();
                SyncResult sync = documents.ensureOpen(uri, definition.getLanguageId(), content);
                String fingerprint = documents.get(uri).getFingerprint();
                fingerprints = Collections.singletonMap(uri, fingerprint);
                if (sync == SyncResult.CHANGED) {
                    cache.dropStale(uri, fingerprint);
                } else if (sync == SyncResult.OPENED) {
                    settle(key, deadlineNanos);
                }
            }

            Optional<Duration> ttl = settings.getCachePolicy().ttlFor(method);
            CacheKey cacheKey = null;
            if (ttl.isPresent()) {
                cacheKey = CacheKey.of(key, method, request, fingerprints);
                Optional<JsonElement> cached = cache.lookup(cacheKey);
                if (cached.isPresent()) {
                    metrics.recordCacheHit();
                    logger.debug("{} served from cache", method);
                    return cached.get();
                }
                metrics.recordCacheMiss();
            }

            JsonElement result = join(key, connection.getDispatcher().submit(method, priority, deadlineNanos,
                    remaining -> connection.getProtocol().call(method, request, remaining)));
            if (cacheKey != null && result != null && !result.isJsonNull()) {
                cache.store(cacheKey, result, ttl.get(), epoch);
            }
            return result;
        } finally {
            sessions.endRequest(lease.session);
        }
    }

    /**
     * Syncs {@code file} into the project's server and waits up to
     * {@code wait} for the server to publish diagnostics for it. If the file
     * was already in sync, the last published diagnostics are returned
     * without waiting.
     */
    public CompletableFuture<Optional<JsonObject>> awaitDiagnostics(ProjectKey key, Path file, Duration wait) {
        long deadlineNanos = System.nanoTime() + settings.getRequestTimeout().toNanos();
        return runAsync(key, () -> {
            LanguageServerDefinition definition = definitionFor(key);
            Path normalized = file.toAbsolutePath().normalize();
            String uri = normalized.toUri().toString();
            String content = readContents(key, normalized);
            Lease lease = acquire(key, definition, deadlineNanos);
            try {
                DiagnosticsCollector diagnostics = lease.connection.getDiagnostics();
                long mark = diagnostics.mark();
                SyncResult sync = lease.connection.getDocuments().ensureOpen(uri, definition.getLanguageId(),
                        content);
                if (sync == SyncResult.UNCHANGED) {
                    Optional<JsonObject> latest = diagnostics.latest(uri);
                    if (latest.isPresent()) {
                        return latest;
                    }
                }
                return diagnostics.awaitAfter(uri, mark, wait);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LanguageServerException(Kind.SESSION_SHUTTING_DOWN, key, "Interrupted", e);
            } finally {
                sessions.endRequest(lease.session);
            }
        });
    }

    // ----------------------------------------------------------------------
    // Session acquisition
    // ----------------------------------------------------------------------

    /**
     * Returns the project's READY session with one request registered on
     * it, starting the session if needed.
     */
    private Lease acquire(ProjectKey key, LanguageServerDefinition definition, long deadlineNanos) {
        int awaitedSpawn = -1;
        sessions.lock();
        try {
            while (true) {
                if (closed.get()) {
                    throw new LanguageServerException(Kind.SESSION_SHUTTING_DOWN, key, "Manager is shut down");
                }
                ServerSession session = sessions.getOrCreate(key, definition);
                switch (session.getState()) {
                    case READY:
                        session.beginRequest();
                        return new Lease(session, session.getConnection());
                    case SHUTTING_DOWN:
                        throw new LanguageServerException(Kind.SESSION_SHUTTING_DOWN, key,
                                "Session " + key.label() + " is shutting down");
                    case TERMINATED:
                        sessions.remove(session);
                        continue;
                    case SPAWNING:
                    case INITIALIZING:
                        awaitedSpawn = session.getSpawnCount();
                        awaitUntil(deadlineNanos, () -> new LanguageServerException(Kind.REQUEST_TIMEOUT, key,
                                "Timed out waiting for " + key.label() + " to start"));
                        continue;
                    case ERRORED:
                        if (!mayRespawn(session, awaitedSpawn, deadlineNanos)) {
                            continue;
                        }
                        break;
                    default:
                        break;
                }

                if (!sessions.hasFreeSlot()) {
                    ServerSession victim = sessions.selectEvictionCandidate();
                    if (victim != null) {
                        sessions.transition(victim, SessionState.SHUTTING_DOWN);
                        logger.info("Pool full ({} live), evicting {} to admit {}",
                                sessions.getMaxLiveSessions(), victim.getKey().label(), key.label());
                        sessions.unlock();
                        try {
                            stopSession(victim, new LanguageServerException(Kind.SESSION_SHUTTING_DOWN,
                                    victim.getKey(), "evicted to admit " + key.label()));
                        } finally {
                            sessions.lock();
                        }
                    } else {
                        awaitUntil(deadlineNanos, () -> new LanguageServerException(Kind.POOL_AT_CAPACITY, key,
                                "All " + sessions.getMaxLiveSessions() + " live sessions are busy"));
                    }
                    continue;
                }

                sessions.transition(session, SessionState.SPAWNING);
                awaitedSpawn = session.getSpawnCount();
                ServerConnection connection;
                sessions.unlock();
                try {
                    connection = launch(session, definition, awaitedSpawn);
                } finally {
                    sessions.lock();
                }
                if (connection != null && session.getState() == SessionState.INITIALIZING
                        && session.getConnection() == connection && !connection.getProtocol().isTerminated()) {
                    sessions.transition(session, SessionState.READY);
                    session.resetCrashes();
                    session.beginRequest();
                    if (closed.get()) {
                        // shutdown() may have given up waiting for this session
                        session.endRequest();
                        sessions.transition(session, SessionState.SHUTTING_DOWN);
                        sessions.unlock();
                        try {
                            stopSession(session, new LanguageServerException(Kind.SESSION_SHUTTING_DOWN, key,
                                    "manager shut down during startup"));
                        } finally {
                            sessions.lock();
                        }
                        continue;
                    }
                    logger.info("{} is ready", key.label());
                    return new Lease(session, connection);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LanguageServerException(Kind.SESSION_SHUTTING_DOWN, key, "Interrupted", e);
        } finally {
            sessions.unlock();
        }
    }

    /**
     * Decides what an acquiring request does with an ERRORED session: true
     * to respawn now, false after waiting out part of the backoff. Throws
     * when the request must fail instead.
     */
    private boolean mayRespawn(ServerSession session, int awaitedSpawn, long deadlineNanos)
            throws InterruptedException {
        LanguageServerException last = session.getLastError();
        if (last == null) {
            last = new LanguageServerException(Kind.SESSION_CRASHED, session.getKey(), "Session failed");
        }
        if (session.getSpawnCount() == awaitedSpawn) {
            // the start this request waited on (or made) failed
            throw last.copy();
        }
        long remaining = session.backoffRemainingNanos();
        if (remaining <= 0) {
            return true;
        }
        if (!last.isRetryable() || System.nanoTime() + remaining - deadlineNanos > 0) {
            throw last.copy();
        }
        sessions.awaitChange(remaining);
        return false;
    }

    private void awaitUntil(long deadlineNanos, Supplier<LanguageServerException> onTimeout)
            throws InterruptedException {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            throw onTimeout.get();
        }
        sessions.awaitChange(remaining);
    }

    /**
     * Spawns and initializes a server for a session in SPAWNING. Must be
     * called without the table lock. Returns null if the start failed, in
     * which case the session is ERRORED.
     */
    private ServerConnection launch(ServerSession session, LanguageServerDefinition definition, int generation) {
        ProjectKey key = session.getKey();
        ServerConnection connection;
        try {
            connection = launcher.launch(key, definition, generation,
                    () -> transitionIf(session, SessionState.SPAWNING, SessionState.INITIALIZING));
        } catch (RuntimeException e) {
            LanguageServerException failure = RequestFailures.toLanguageServerException(e, key,
                    Kind.SPAWN_FAILED);
            logger.warn("Failed to start {} for {}: {}", definition.getExecutable(), key.label(),
                    failure.getMessage());
            sessions.lock();
            try {
                if (session.getState().isStarting()) {
                    markErrored(session, failure);
                }
            } finally {
                sessions.unlock();
            }
            return null;
        }
        sessions.lock();
        try {
            session.setConnection(connection);
        } finally {
            sessions.unlock();
        }
        connection.getProtocol().terminationSignal()
                .thenAccept(cause -> onConnectionLost(session, connection, cause));
        return connection;
    }

    private void transitionIf(ServerSession session, SessionState from, SessionState to) {
        sessions.lock();
        try {
            if (session.getState() == from) {
                sessions.transition(session, to);
            }
        } finally {
            sessions.unlock();
        }
    }

    // requires the lock
    private void markErrored(ServerSession session, LanguageServerException error) {
        Duration delay = backoff.delayFor(session.getCrashCount() + 1);
        session.recordCrash(error, delay);
        sessions.transition(session, SessionState.ERRORED);
        logger.warn("{} failed ({}: {}); crash #{}, respawn allowed in {} ms", session.getKey().label(),
                error.getKind(), error.getMessage(), session.getCrashCount(), delay.toMillis());
    }

    private void onConnectionLost(ServerSession session, ServerConnection connection,
            LanguageServerException cause) {
        boolean lost = false;
        sessions.lock();
        try {
            SessionState state = session.getState();
            if (session.getConnection() == connection
                    && (state == SessionState.READY || state.isStarting())) {
                markErrored(session, cause);
                lost = true;
            }
        } finally {
            sessions.unlock();
        }
        if (lost) {
            Runnable kill = () -> MdcProjectContext.runAs(session.getKey(), () -> connection.kill(cause));
            try {
                pools.getRequestPool().execute(kill);
            } catch (RejectedExecutionException e) {
                kill.run();
            }
        }
    }

    // ----------------------------------------------------------------------
    // Stopping
    // ----------------------------------------------------------------------

    /**
     * Gracefully stops a session already in SHUTTING_DOWN and removes it
     * from the table. Must be called without the table lock.
     */
    private void stopSession(ServerSession session, LanguageServerException reason) {
        ProjectKey key = session.getKey();
        ServerConnection connection = session.getConnection();
        logger.info("Stopping {}: {}", key.label(), reason.getMessage());
        try {
            if (connection != null) {
                connection.shutdown(settings.getShutdownTimeout());
            }
        } catch (RuntimeException e) {
            logger.warn("Error while stopping {}: {}", key.label(), RequestFailures.summarize(e));
        } finally {
            sessions.lock();
            try {
                if (session.getState() == SessionState.SHUTTING_DOWN) {
                    sessions.transition(session, SessionState.TERMINATED);
                }
                sessions.remove(session);
            } finally {
                sessions.unlock();
            }
        }
    }

    private void stopAsync(ServerSession session, LanguageServerException reason) {
        Runnable stop = () -> MdcProjectContext.runAs(session.getKey(), () -> stopSession(session, reason));
        try {
            pools.getRequestPool().execute(stop);
        } catch (RejectedExecutionException e) {
            stop.run();
        }
    }

    /**
     * Stops the project's session and removes it from the table. A session
     * that is still starting is waited for first.
     */
    public CompletableFuture<Void> forceStop(ProjectKey key) {
        return runAsync(key, () -> {
            stopNow(key, System.nanoTime() + lifecycleBudget().toNanos());
            return null;
        });
    }

    /**
     * Stops the project's session and starts a fresh one, resetting its
     * crash count.
     */
    public CompletableFuture<SessionSnapshot> forceRestart(ProjectKey key) {
        return runAsync(key, () -> {
            long deadlineNanos = System.nanoTime() + lifecycleBudget().toNanos();
            stopNow(key, deadlineNanos);
            Lease lease = acquire(key, definitionFor(key), deadlineNanos);
            sessions.endRequest(lease.session);
            return status(key);
        });
    }

    private void stopNow(ProjectKey key, long deadlineNanos) {
        ServerSession toStop = null;
        sessions.lock();
        try {
            while (true) {
                ServerSession session = sessions.get(key);
                if (session == null) {
                    return;
                }
                SessionState state = session.getState();
                if (state == SessionState.READY) {
                    sessions.transition(session, SessionState.SHUTTING_DOWN);
                    toStop = session;
                    break;
                }
                if (state == SessionState.ERRORED || state == SessionState.UNSPAWNED
                        || state == SessionState.TERMINATED) {
                    if (state != SessionState.TERMINATED) {
                        sessions.transition(session, SessionState.TERMINATED);
                    }
                    sessions.remove(session);
                    logger.info("Removed {} ({})", key.label(), state);
                    return;
                }
                awaitUntil(deadlineNanos, () -> new LanguageServerException(Kind.REQUEST_TIMEOUT, key,
                        "Timed out waiting for " + key.label() + " to leave " + state));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LanguageServerException(Kind.SESSION_SHUTTING_DOWN, key, "Interrupted", e);
        } finally {
            sessions.unlock();
        }
        stopSession(toStop, new LanguageServerException(Kind.SESSION_SHUTTING_DOWN, key, "stop requested"));
    }

    private Duration lifecycleBudget() {
        return settings.getHandshakeTimeout().plus(settings.getShutdownTimeout()).plus(settings.getRequestTimeout());
    }

    // ----------------------------------------------------------------------
    // File events
    // ----------------------------------------------------------------------

    /**
     * Reports that {@code file} was written outside the server's view.
     * Cached responses that read it are dropped; the next request touching
     * it re-syncs the new content.
     */
    public void onFileWritten(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        contents.invalidate(normalized);
        int dropped = cache.invalidate(normalized.toUri().toString());
        logger.debug("{} written, {} cached responses dropped", normalized, dropped);
    }

    /** Like {@link #onFileWritten}, and also closes the file in every live session. */
    public void onFileDeleted(Path file) {
        onFileWritten(file);
        String uri = file.toAbsolutePath().normalize().toUri().toString();
        List<ServerConnection> live = new ArrayList<>();
        sessions.lock();
        try {
            for (ServerSession session : sessions.all()) {
                if (session.getState() == SessionState.READY && session.getConnection() != null) {
                    live.add(session.getConnection());
                }
            }
        } finally {
            sessions.unlock();
        }
        for (ServerConnection connection : live) {
            connection.getDiagnostics().forget(uri);
            try {
                connection.getDocuments().close(uri);
            } catch (LanguageServerException e) {
                logger.debug("Could not close {}: {}", uri, e.getMessage());
            }
        }
    }

    // ----------------------------------------------------------------------
    // Introspection
    // ----------------------------------------------------------------------

    public SessionSnapshot status(ProjectKey key) {
        sessions.lock();
        try {
            ServerSession session = sessions.get(key);
            return session != null ? snapshot(session) : SessionSnapshot.absent(key);
        } finally {
            sessions.unlock();
        }
    }

    public List<SessionSnapshot> statuses() {
        sessions.lock();
        try {
            List<SessionSnapshot> result = new ArrayList<>();
            for (ServerSession session : sessions.all()) {
                result.add(snapshot(session));
            }
            return result;
        } finally {
            sessions.unlock();
        }
    }

    // requires the lock
    private SessionSnapshot snapshot(ServerSession session) {
        ServerConnection connection = session.getConnection();
        boolean live = connection != null && session.getState().occupiesSlot();
        return new SessionSnapshot(session.getKey(), session.getState(),
                live ? connection.getSupervisor().pid() : -1,
                session.getCrashCount(), session.getBackoff(),
                Instant.ofEpochMilli(session.getLastActivityMillis()), session.getActiveRequests(),
                live ? connection.getDocuments().size() : 0,
                live ? connection.getProtocol().getRoundTrips() : 0,
                session.getSpawnCount(), session.getLastError());
    }

    /**
     * Subscribes to the server notifications of the project's live session.
     * Empty if the session is not READY.
     */
    public Optional<NotificationSubscription> subscribe(ProjectKey key) {
        sessions.lock();
        try {
            ServerSession session = sessions.get(key);
            if (session == null || session.getState() != SessionState.READY || session.getConnection() == null) {
                return Optional.empty();
            }
            return Optional.of(session.getConnection().getProtocol().subscribe());
        } finally {
            sessions.unlock();
        }
    }

    public RequestMetrics getMetrics() {
        return metrics;
    }

    public CacheStats cacheStats() {
        return cache.stats();
    }

    public ManagerSettings getSettings() {
        return settings;
    }

    public LanguageServerRegistry getRegistry() {
        return registry;
    }

    // ----------------------------------------------------------------------
    // Shutdown
    // ----------------------------------------------------------------------

    /**
     * Rejects new requests, stops every session gracefully and releases the
     * executor pools. Sessions still starting are given the handshake
     * timeout to finish first.
     */
    public void shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        evictionManager.stop();
        List<ServerSession> toStop = new ArrayList<>();
        long deadlineNanos = System.nanoTime() + settings.getHandshakeTimeout().toNanos();
        sessions.lock();
        try {
            while (anyStarting() && deadlineNanos - System.nanoTime() > 0) {
                sessions.awaitChange(deadlineNanos - System.nanoTime());
            }
            for (ServerSession session : sessions.all()) {
                switch (session.getState()) {
                    case READY:
                        sessions.transition(session, SessionState.SHUTTING_DOWN);
                        toStop.add(session);
                        break;
                    case ERRORED:
                    case UNSPAWNED:
                        sessions.transition(session, SessionState.TERMINATED);
                        sessions.remove(session);
                        break;
                    default:
                        break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            sessions.unlock();
        }

        List<CompletableFuture<Void>> stops = new ArrayList<>();
        for (ServerSession session : toStop) {
            LanguageServerException reason = new LanguageServerException(Kind.SESSION_SHUTTING_DOWN,
                    session.getKey(), "manager shutting down");
            stops.add(CompletableFuture.runAsync(
                    () -> MdcProjectContext.runAs(session.getKey(), () -> stopSession(session, reason)),
                    pools.getRequestPool()));
        }
        try {
            CompletableFuture.allOf(stops.toArray(new CompletableFuture<?>[0])).join();
        } catch (CompletionException e) {
            logger.warn("Error while stopping sessions: {}", RequestFailures.summarize(e));
        }
        pools.shutdownAll();
        logger.info("Language server manager shut down ({} sessions stopped); {}", toStop.size(),
                metrics.summary());
    }

    private boolean anyStarting() {
        for (ServerSession session : sessions.all()) {
            if (session.getState().isStarting()) {
                return true;
            }
        }
        return false;
    }

    public boolean isShutdown() {
        return closed.get();
    }

    @Override
    public void close() {
        shutdown();
    }

    // ----------------------------------------------------------------------
    // Helpers
    // ----------------------------------------------------------------------

    private <T> CompletableFuture<T> runAsync(ProjectKey key, Supplier<T> task) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(
                    new LanguageServerException(Kind.SESSION_SHUTTING_DOWN, key, "Manager is shut down"));
        }
        try {
            return CompletableFuture.supplyAsync(() -> {
                Map<String, String> previous = MdcProjectContext.snapshot();
                MdcProjectContext.setProject(key);
                try {
                    return task.get();
                } finally {
                    MdcProjectContext.restore(previous);
                }
            }, pools.getRequestPool());
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(
                    new LanguageServerException(Kind.SESSION_SHUTTING_DOWN, key, "Manager is shut down", e));
        }
    }

    private LanguageServerDefinition definitionFor(ProjectKey key) {
        return registry.forLanguage(key.getLanguage())
                .orElseThrow(() -> new LanguageServerException(Kind.UNSUPPORTED_LANGUAGE, key,
                        "No language server registered for " + key.getLanguage()));
    }

    private JsonElement join(ProjectKey key, CompletableFuture<JsonElement> future) {
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            throw RequestFailures.toLanguageServerException(e, key, Kind.SERVER_ERROR);
        }
    }

    private String readContents(ProjectKey key, Path file) {
        try {
            return contents.getContents(file);
        } catch (IOException e) {
            throw new LanguageServerException(Kind.DOCUMENT_UNAVAILABLE, key,
                    "Cannot read " + file + ": " + RequestFailures.summarize(e), e);
        }
    }

    private void settle(ProjectKey key, long deadlineNanos) {
        long settle = Math.min(settings.getSettleDelay().toNanos(), deadlineNanos - System.nanoTime());
        if (settle <= 0) {
            return;
        }
        try {
            Thread.sleep(settle / 1_000_000L, (int) (settle % 1_000_000L));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LanguageServerException(Kind.SESSION_SHUTTING_DOWN, key, "Interrupted", e);
        }
    }

    /**
     * The file named by {@code textDocument.uri}, or null if the request is
     * not file-scoped. Plain paths are accepted in place of file URIs.
     */
    private static Path documentPath(ProjectKey key, JsonObject request) {
        if (!request.has("textDocument") || !request.get("textDocument").isJsonObject()) {
            return null;
        }
        JsonElement uri = request.getAsJsonObject("textDocument").get("uri");
        if (uri == null || !uri.isJsonPrimitive()) {
            return null;
        }
        String value = uri.getAsString();
        try {
            Path path = value.startsWith("file:") ? Paths.get(URI.create(value)) : Paths.get(value);
            return path.toAbsolutePath().normalize();
        } catch (IllegalArgumentException | FileSystemNotFoundException e) {
            throw new LanguageServerException(Kind.DOCUMENT_UNAVAILABLE, key, "Not a file URI: " + value, e);
        }
    }
}
