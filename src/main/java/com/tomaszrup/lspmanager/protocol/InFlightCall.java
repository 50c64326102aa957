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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

import com.google.gson.JsonElement;

/**
 * A request written to the server and awaiting the response with the same id.
 * Resolved at most once: by the response, by its timeout, or by session end.
 */
final class InFlightCall {

    private final long id;
    private final String method;
    private final long sentAtNanos;
    private final CompletableFuture<JsonElement> result = new CompletableFuture<>();
    private volatile ScheduledFuture<?> timer;

    InFlightCall(long id, String method) {
        this.id = id;
        this.method = method;
        this.sentAtNanos = System.nanoTime();
    }

    long getId() {
        return id;
    }

    String getMethod() {
        return method;
    }

    long elapsedMillis() {
        return (System.nanoTime() - sentAtNanos) / 1_000_000L;
    }

    CompletableFuture<JsonElement> getResult() {
        return result;
    }

    void setTimer(ScheduledFuture<?> timer) {
        this.timer = timer;
        if (result.isDone()) {
            timer.cancel(false);
        }
    }

    boolean complete(JsonElement value) {
        cancelTimer();
        return result.complete(value);
    }

    boolean fail(Throwable error) {
        cancelTimer();
        return result.completeExceptionally(error);
    }

    private void cancelTimer() {
        ScheduledFuture<?> t = timer;
        if (t != null) {
            t.cancel(false);
        }
    }
}
