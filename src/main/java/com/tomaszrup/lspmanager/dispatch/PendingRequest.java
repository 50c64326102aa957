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
package com.tomaszrup.lspmanager.dispatch;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import com.google.gson.JsonElement;

/**
 * A request handed to a {@link PriorityDispatcher}, queued or in flight.
 * The result slot is completed at most once.
 */
public final class PendingRequest implements Comparable<PendingRequest> {

    private final long sequence;
    private final String method;
    private final RequestPriority priority;
    private final long submittedAtNanos;
    private final long deadlineNanos;
    private final CompletableFuture<JsonElement> result = new CompletableFuture<>();
    private final Function<Duration, CompletableFuture<JsonElement>> sender;

    PendingRequest(long sequence, String method, RequestPriority priority, long submittedAtNanos,
            long deadlineNanos, Function<Duration, CompletableFuture<JsonElement>> sender) {
        this.sequence = sequence;
        this.method = method;
        this.priority = priority;
        this.submittedAtNanos = submittedAtNanos;
        this.deadlineNanos = deadlineNanos;
        this.sender = sender;
    }

    public long getSequence() {
        return sequence;
    }

    public String getMethod() {
        return method;
    }

    public RequestPriority getPriority() {
        return priority;
    }

    public long getSubmittedAtNanos() {
        return submittedAtNanos;
    }

    public long getDeadlineNanos() {
        return deadlineNanos;
    }

    public CompletableFuture<JsonElement> getResult() {
        return result;
    }

    Function<Duration, CompletableFuture<JsonElement>> getSender() {
        return sender;
    }

    // Higher priority first, then submission order.
    @Override
    public int compareTo(PendingRequest other) {
        int byPriority = Integer.compare(priority.ordinal(), other.priority.ordinal());
        return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
    }

    @Override
    public String toString() {
        return "PendingRequest{#" + sequence + " " + method + " " + priority + "}";
    }
}
