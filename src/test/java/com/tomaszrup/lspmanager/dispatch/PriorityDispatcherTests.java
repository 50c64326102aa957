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

import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;
import com.tomaszrup.lspmanager.LanguageServerException;
import com.tomaszrup.lspmanager.LanguageServerException.Kind;
import com.tomaszrup.lspmanager.project.ProjectKey;

class PriorityDispatcherTests {

	private ScheduledExecutorService scheduler;
	private PriorityDispatcher dispatcher;

	/** Calls handed to the server, in order; completed by the test. */
	private List<String> sent;
	private List<CompletableFuture<JsonElement>> calls;

	@BeforeEach
	void setup() {
		scheduler = Executors.newSingleThreadScheduledExecutor();
		dispatcher = new PriorityDispatcher(ProjectKey.of(Paths.get("/work/p"), "fake"), 1, scheduler);
		sent = Collections.synchronizedList(new ArrayList<>());
		calls = Collections.synchronizedList(new ArrayList<>());
	}

	@AfterEach
	void tearDown() {
		scheduler.shutdownNow();
	}

	private Function<Duration, CompletableFuture<JsonElement>> recording(String label) {
		return remaining -> {
			sent.add(label);
			CompletableFuture<JsonElement> call = new CompletableFuture<>();
			calls.add(call);
			return call;
		};
	}

	private CompletableFuture<JsonElement> submit(String label, RequestPriority priority, Duration deadline) {
		return dispatcher.submit(label, priority, System.nanoTime() + deadline.toNanos(), recording(label));
	}

	private static LanguageServerException failure(CompletableFuture<?> future) {
		ExecutionException e = Assertions.assertThrows(ExecutionException.class,
				() -> future.get(5, TimeUnit.SECONDS));
		return (LanguageServerException) e.getCause();
	}

	@Test
	void testHighestPriorityFirstThenFifo() throws Exception {
		Duration deadline = Duration.ofSeconds(30);
		CompletableFuture<JsonElement> blocker = submit("blocker", RequestPriority.LOW, deadline);
		submit("low", RequestPriority.LOW, deadline);
		submit("normal-1", RequestPriority.NORMAL, deadline);
		submit("critical", RequestPriority.CRITICAL, deadline);
		submit("normal-2", RequestPriority.NORMAL, deadline);
		submit("high", RequestPriority.HIGH, deadline);
		Assertions.assertEquals(5, dispatcher.getQueuedCount());
		Assertions.assertEquals(1, dispatcher.getInFlightCount());

		for (int i = 0; i < 6; i++) {
			calls.get(i).complete(new JsonPrimitive(i));
		}

		Assertions.assertEquals(List.of("blocker", "critical", "high", "normal-1", "normal-2", "low"), sent);
		Assertions.assertEquals(0, blocker.get().getAsInt());
		Assertions.assertEquals(0, dispatcher.getPendingCount());
	}

	@Test
	void testQueuedRequestExpiresWithoutBeingSent() throws Exception {
		submit("blocker", RequestPriority.HIGH, Duration.ofSeconds(30));
		CompletableFuture<JsonElement> starved = submit("starved", RequestPriority.LOW, Duration.ofMillis(100));

		Assertions.assertEquals(Kind.REQUEST_TIMEOUT, failure(starved).getKind());
		calls.get(0).complete(new JsonPrimitive("done"));

		Assertions.assertEquals(List.of("blocker"), sent, "Expired request never reaches the server");
	}

	@Test
	void testRemainingTimeIsPassedToSender() throws Exception {
		List<Duration> seen = new ArrayList<>();
		CompletableFuture<JsonElement> result = dispatcher.submit("m", RequestPriority.NORMAL,
				System.nanoTime() + Duration.ofSeconds(10).toNanos(), remaining -> {
					seen.add(remaining);
					return CompletableFuture.completedFuture(new JsonPrimitive("ok"));
				});

		Assertions.assertEquals("ok", result.get().getAsString());
		Assertions.assertTrue(seen.get(0).compareTo(Duration.ofSeconds(10)) <= 0);
		Assertions.assertTrue(seen.get(0).compareTo(Duration.ofSeconds(9)) > 0);
	}

	@Test
	void testSenderFailureIsMappedAndReleasesSlot() throws Exception {
		CompletableFuture<JsonElement> failing = dispatcher.submit("bad", RequestPriority.NORMAL,
				System.nanoTime() + Duration.ofSeconds(10).toNanos(), remaining -> {
					throw new IllegalStateException("boom");
				});
		CompletableFuture<JsonElement> next = submit("next", RequestPriority.NORMAL, Duration.ofSeconds(10));

		Assertions.assertEquals(Kind.SESSION_CRASHED, failure(failing).getKind());
		calls.get(0).complete(new JsonPrimitive(1));
		Assertions.assertEquals(1, next.get(5, TimeUnit.SECONDS).getAsInt());
	}

	@Test
	void testFailAllFailsQueuedAndRejectsLater() {
		submit("in-flight", RequestPriority.NORMAL, Duration.ofSeconds(30));
		CompletableFuture<JsonElement> queued = submit("queued", RequestPriority.NORMAL, Duration.ofSeconds(30));
		LanguageServerException cause = new LanguageServerException(Kind.SESSION_CRASHED, null, "died");

		dispatcher.failAll(cause);

		Assertions.assertEquals(Kind.SESSION_CRASHED, failure(queued).getKind());
		Assertions.assertEquals(Kind.SESSION_CRASHED,
				failure(submit("late", RequestPriority.CRITICAL, Duration.ofSeconds(30))).getKind());
		Assertions.assertEquals(List.of("in-flight"), sent);
	}

	@Test
	void testDefaultPriorities() {
		Assertions.assertEquals(RequestPriority.CRITICAL, RequestPriority.forMethod("textDocument/diagnostic"));
		Assertions.assertEquals(RequestPriority.HIGH, RequestPriority.forMethod("textDocument/hover"));
		Assertions.assertEquals(RequestPriority.NORMAL, RequestPriority.forMethod("textDocument/definition"));
		Assertions.assertEquals(RequestPriority.LOW, RequestPriority.forMethod("workspace/symbol"));
		Assertions.assertEquals(RequestPriority.NORMAL, RequestPriority.forMethod(null));
	}
}
