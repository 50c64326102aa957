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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.tomaszrup.lspmanager.LanguageServerException;
import com.tomaszrup.lspmanager.LanguageServerException.Kind;
import com.tomaszrup.lspmanager.RequestFailures;
import com.tomaszrup.lspmanager.jsonrpc.FramingFaultException;
import com.tomaszrup.lspmanager.jsonrpc.JsonRpcMessages;
import com.tomaszrup.lspmanager.jsonrpc.MessageCodec;
import com.tomaszrup.lspmanager.jsonrpc.MessageReader;
import com.tomaszrup.lspmanager.project.ProjectKey;
import com.tomaszrup.lspmanager.util.MdcProjectContext;

/**
 * JSON-RPC conversation with one language server process.
 *
 * <p>A single decode loop on the I/O pool reads every incoming message.
 * Responses are matched to {@link #call} futures strictly by id; server
 * notifications go to the current subscribers; server requests get a
 * default reply so the server never waits on us.</p>
 *
 * <p>The session ends exactly once, when the stream closes, a framing fault
 * is read, a write fails or the process exits. {@link #terminationSignal()}
 * then completes with the cause and every outstanding call fails with that
 * same cause.</p>
 */
public class ProtocolSession {

    private static final Logger logger = LoggerFactory.getLogger(ProtocolSession.class);

    /**
     * After the process exits, how long the decode loop gets to drain what
     * the server wrote before dying.
     */
    private static final long EXIT_DRAIN_MILLIS = 250;

    private final ProjectKey key;
    private final MessageReader reader;
    private final OutputStream output;
    private final CompletableFuture<Integer> processExit;
    private final ScheduledExecutorService scheduler;
    private final int notificationBufferSize;

    private final Object writeLock = new Object();
    private final AtomicLong nextId = new AtomicLong(1);
    private final Map<Long, InFlightCall> inFlight = new ConcurrentHashMap<>();
    private final List<NotificationSubscription> subscribers = new CopyOnWriteArrayList<>();
    private final CompletableFuture<LanguageServerException> termination = new CompletableFuture<>();
    private final AtomicLong roundTrips = new AtomicLong();
    private final Map<String, AtomicLong> roundTripsByMethod = new ConcurrentHashMap<>();

    private volatile boolean closing;
    private volatile JsonObject serverCapabilities = new JsonObject();

    public ProtocolSession(ProjectKey key, InputStream input, OutputStream output,
            CompletableFuture<Integer> processExit, ScheduledExecutorService scheduler,
            int notificationBufferSize) {
        this.key = key;
        this.reader = new MessageReader(input);
        this.output = output;
        this.processExit = processExit;
        this.scheduler = scheduler;
        this.notificationBufferSize = notificationBufferSize;
    }

    /** Starts the decode loop and exit watch. */
    public void start(ExecutorService ioPool) {
        ioPool.execute(this::readLoop);
        processExit.whenComplete((code, error) -> {
            if (termination.isDone()) {
                return;
            }
            try {
                scheduler.schedule(() -> terminate(endedCause("Server process exited with code " + code)),
                        EXIT_DRAIN_MILLIS, TimeUnit.MILLISECONDS);
            } catch (RuntimeException e) {
                // scheduler already stopped
                terminate(endedCause("Server process exited with code " + code));
            }
        });
    }

    /**
     * Sends {@code initialize}, waits for the result, then sends
     * {@code initialized}.
     *
     * @return the server capabilities object (empty if absent)
     * @throws LanguageServerException {@code HANDSHAKE_FAILED} on timeout,
     *         rejection or session end
     */
    public JsonObject initialize(JsonObject params, Duration timeout) {
        JsonElement result;
        try {
            result = call("initialize", params, timeout).join();
        } catch (RuntimeException e) {
            LanguageServerException cause = RequestFailures.toLanguageServerException(e, key, Kind.HANDSHAKE_FAILED);
            throw new LanguageServerException(Kind.HANDSHAKE_FAILED, key,
                    "initialize failed: " + cause.getMessage(), cause);
        }
        JsonObject capabilities = new JsonObject();
        if (result != null && result.isJsonObject()) {
            JsonElement caps = result.getAsJsonObject().get("capabilities");
            if (caps != null && caps.isJsonObject()) {
                capabilities = caps.getAsJsonObject();
            }
        }
        serverCapabilities = capabilities;
        try {
            notify("initialized", new JsonObject());
        } catch (LanguageServerException e) {
            throw new LanguageServerException(Kind.HANDSHAKE_FAILED, key,
                    "initialized notification failed: " + e.getMessage(), e);
        }
        return capabilities;
    }

    /**
     * Sends a request. The returned future completes with the {@code result}
     * member of the matching response (JSON null when absent), or fails with
     * {@code REQUEST_TIMEOUT}, {@code SERVER_ERROR} or the session's
     * termination cause.
     */
    public CompletableFuture<JsonElement> call(String method, JsonElement params, Duration timeout) {
        long id = nextId.getAndIncrement();
        InFlightCall call = new InFlightCall(id, method);
        inFlight.put(id, call);

        LanguageServerException ended = termination.getNow(null);
        if (ended != null) {
            inFlight.remove(id);
            call.fail(ended.copy());
            return call.getResult();
        }

        long timeoutMillis = Math.max(1, timeout.toMillis());
        call.setTimer(scheduler.schedule(() -> {
            if (inFlight.remove(id, call)) {
                logger.debug("{} (id {}) timed out after {} ms", method, id, timeoutMillis);
                call.fail(new LanguageServerException(Kind.REQUEST_TIMEOUT, key,
                        method + " timed out after " + timeoutMillis + " ms"));
            }
        }, timeoutMillis, TimeUnit.MILLISECONDS));

        try {
            write(JsonRpcMessages.request(id, method, params));
            roundTrips.incrementAndGet();
            roundTripsByMethod.computeIfAbsent(method, m -> new AtomicLong()).incrementAndGet();
        } catch (IOException e) {
            terminate(endedCause("Write of " + method + " failed: " + e.getMessage()));
        }
        return call.getResult();
    }

    /**
     * Fire-and-forget notification.
     *
     * @throws LanguageServerException if the session has ended or the write fails
     */
    public void notify(String method, JsonElement params) {
        LanguageServerException ended = termination.getNow(null);
        if (ended != null) {
            throw ended.copy();
        }
        try {
            write(JsonRpcMessages.notification(method, params));
        } catch (IOException e) {
            LanguageServerException cause = endedCause("Write of " + method + " failed: " + e.getMessage());
            terminate(cause);
            throw termination.join().copy();
        }
    }

    /**
     * Cooperative shutdown: {@code shutdown} request (bounded by
     * {@code timeout}) followed by the {@code exit} notification. From here
     * on the session's end is reported as {@code SESSION_SHUTTING_DOWN}.
     */
    public void shutdown(Duration timeout) {
        closing = true;
        if (termination.isDone()) {
            return;
        }
        try {
            call("shutdown", null, timeout).join();
        } catch (RuntimeException e) {
            logger.debug("shutdown request failed: {}", RequestFailures.summarize(RequestFailures.unwrap(e)));
        }
        try {
            notify("exit", null);
        } catch (LanguageServerException e) {
            logger.debug("exit notification not delivered: {}", e.getMessage());
        }
    }

    /** Marks the session as being stopped on purpose. */
    public void markClosing() {
        closing = true;
    }

    public NotificationSubscription subscribe() {
        NotificationSubscription subscription = new NotificationSubscription(notificationBufferSize,
                subscribers::remove);
        subscribers.add(subscription);
        LanguageServerException ended = termination.getNow(null);
        if (ended != null) {
            subscribers.remove(subscription);
            subscription.closeWith(ended);
        }
        return subscription;
    }

    /** Completes once, with the cause, when the session ends. */
    public CompletableFuture<LanguageServerException> terminationSignal() {
        return termination;
    }

    public boolean isTerminated() {
        return termination.isDone();
    }

    public int getPendingCount() {
        return inFlight.size();
    }

    public long getRoundTrips() {
        return roundTrips.get();
    }

    public long getRoundTrips(String method) {
        AtomicLong count = roundTripsByMethod.get(method);
        return count != null ? count.get() : 0;
    }

    public JsonObject getServerCapabilities() {
        return serverCapabilities;
    }

    /**
     * Ends the session with {@code cause}. Only the first call has an effect.
     */
    public void terminate(LanguageServerException cause) {
        if (!termination.complete(cause)) {
            return;
        }
        if (cause.getKind() == Kind.SESSION_SHUTTING_DOWN) {
            logger.debug("Session closed: {}", cause.getMessage());
        } else {
            logger.warn("Session ended: {}", cause.getMessage());
        }
        List<InFlightCall> orphaned = new ArrayList<>();
        for (Long id : inFlight.keySet()) {
            InFlightCall call = inFlight.remove(id);
            if (call != null) {
                orphaned.add(call);
            }
        }
        for (InFlightCall call : orphaned) {
            call.fail(cause.copy());
        }
        for (NotificationSubscription subscription : subscribers) {
            subscription.closeWith(cause);
        }
        subscribers.clear();
        try {
            output.close();
        } catch (IOException e) {
            logger.trace("Closing server input failed: {}", e.getMessage());
        }
    }

    // -----------------------------------------------------------------------
    // Decode loop
    // -----------------------------------------------------------------------

    private void readLoop() {
        MdcProjectContext.setProject(key);
        try {
            while (!termination.isDone()) {
                JsonObject message = reader.read();
                if (message == null) {
                    terminate(endedCause("Server closed its output stream"));
                    return;
                }
                dispatch(message);
            }
        } catch (FramingFaultException e) {
            logger.error("Framing fault, abandoning stream: {}", e.getMessage());
            terminate(new LanguageServerException(Kind.FRAMING_FAULT, key,
                    "Framing fault: " + e.getMessage(), e));
        } catch (IOException e) {
            terminate(endedCause("Read failed: " + e.getMessage()));
        } catch (RuntimeException e) {
            logger.error("Decode loop failed", e);
            terminate(new LanguageServerException(Kind.SESSION_CRASHED, key,
                    "Decode loop failed: " + RequestFailures.summarize(e), e));
        } finally {
            MdcProjectContext.clear();
        }
    }

    private void dispatch(JsonObject message) {
        if (JsonRpcMessages.isResponse(message)) {
            handleResponse(message);
        } else if (JsonRpcMessages.isRequest(message)) {
            handleServerRequest(message);
        } else if (JsonRpcMessages.isNotification(message)) {
            handleNotification(message);
        } else {
            logger.warn("Ignoring message that is neither request, response nor notification");
        }
    }

    private void handleResponse(JsonObject message) {
        long id = JsonRpcMessages.numericId(message);
        InFlightCall call = inFlight.remove(id);
        if (call == null) {
            // timed out earlier, or an id we never issued
            logger.debug("Response for unknown or expired id {}", message.get("id"));
            return;
        }
        JsonElement error = message.get("error");
        if (error != null && error.isJsonObject()) {
            JsonObject err = error.getAsJsonObject();
            int code = err.has("code") ? err.get("code").getAsInt() : JsonRpcMessages.INTERNAL_ERROR;
            String text = err.has("message") ? err.get("message").getAsString() : "";
            call.fail(LanguageServerException.serverError(key, call.getMethod(), code, text));
            return;
        }
        JsonElement result = message.get("result");
        if (logger.isTraceEnabled()) {
            logger.trace("{} (id {}) answered in {} ms", call.getMethod(), id, call.elapsedMillis());
        }
        call.complete(result != null ? result : JsonNull.INSTANCE);
    }

    private void handleServerRequest(JsonObject message) {
        String method = JsonRpcMessages.method(message);
        if (method == null) {
            method = "";
        }
        JsonElement id = message.get("id");
        JsonObject reply;
        switch (method) {
            case "workspace/configuration":
                reply = JsonRpcMessages.response(id, configurationReply(message.get("params")));
                break;
            case "client/registerCapability":
            case "client/unregisterCapability":
            case "window/workDoneProgress/create":
            case "window/showMessageRequest":
            case "workspace/workspaceFolders":
                reply = JsonRpcMessages.response(id, JsonNull.INSTANCE);
                break;
            case "workspace/applyEdit": {
                JsonObject result = new JsonObject();
                result.addProperty("applied", false);
                reply = JsonRpcMessages.response(id, result);
                break;
            }
            default:
                logger.debug("Rejecting unsupported server request {}", method);
                reply = JsonRpcMessages.errorResponse(id, JsonRpcMessages.METHOD_NOT_FOUND,
                        "Unsupported request " + method);
                break;
        }
        try {
            write(reply);
        } catch (IOException e) {
            terminate(endedCause("Reply to " + method + " failed: " + e.getMessage()));
        }
    }

    private static JsonArray configurationReply(JsonElement params) {
        JsonArray reply = new JsonArray();
        if (params != null && params.isJsonObject()) {
            JsonElement items = params.getAsJsonObject().get("items");
            if (items != null && items.isJsonArray()) {
                for (int i = 0; i < items.getAsJsonArray().size(); i++) {
                    reply.add(JsonNull.INSTANCE);
                }
            }
        }
        return reply;
    }

    private void handleNotification(JsonObject message) {
        String method = JsonRpcMessages.method(message);
        JsonElement params = message.get("params");
        if ("window/logMessage".equals(method) || "window/showMessage".equals(method)) {
            logServerMessage(params);
        }
        ServerNotification notification = new ServerNotification(method, params, System.currentTimeMillis());
        for (NotificationSubscription subscription : subscribers) {
            subscription.offer(notification);
        }
    }

    private void logServerMessage(JsonElement params) {
        if (params == null || !params.isJsonObject()) {
            return;
        }
        JsonObject p = params.getAsJsonObject();
        String text = p.has("message") ? p.get("message").getAsString() : "";
        int type = p.has("type") ? p.get("type").getAsInt() : 4;
        if (type == 1) {
            logger.warn("server: {}", text);
        } else {
            logger.debug("server: {}", text);
        }
    }

    private void write(JsonObject message) throws IOException {
        byte[] frame = MessageCodec.encode(message);
        synchronized (writeLock) {
            output.write(frame);
            output.flush();
        }
    }

    private LanguageServerException endedCause(String message) {
        return new LanguageServerException(closing ? Kind.SESSION_SHUTTING_DOWN : Kind.SESSION_CRASHED,
                key, message);
    }
}
