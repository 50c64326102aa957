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

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.lspmanager.project.LanguageServerDefinition;
import com.tomaszrup.lspmanager.project.ProjectKey;

class SessionRegistryTests {

	private static final LanguageServerDefinition DEFINITION = LanguageServerDefinition.builder("fake")
			.command("fake-ls")
			.build();

	private List<String> transitions;
	private SessionRegistry registry;

	@BeforeEach
	void setup() {
		transitions = new ArrayList<>();
		registry = new SessionRegistry(2, (key, from, to) -> transitions.add(key.label() + " " + from + "->" + to));
		registry.lock();
	}

	@AfterEach
	void tearDown() {
		while (true) {
			try {
				registry.unlock();
			} catch (IllegalMonitorStateException e) {
				break;
			}
		}
	}

	private static ProjectKey key(String name) {
		return ProjectKey.of(Paths.get("/work", name), "fake");
	}

	private ServerSession ready(String name) {
		ServerSession session = registry.getOrCreate(key(name), DEFINITION);
		registry.transition(session, SessionState.SPAWNING);
		registry.transition(session, SessionState.INITIALIZING);
		registry.transition(session, SessionState.READY);
		return session;
	}

	// ------------------------------------------------------------------
	// Transitions
	// ------------------------------------------------------------------

	@Test
	void testLifecycleIsReported() {
		ServerSession session = ready("a");
		registry.transition(session, SessionState.SHUTTING_DOWN);
		registry.transition(session, SessionState.TERMINATED);

		Assertions.assertEquals(List.of("a:fake UNSPAWNED->SPAWNING", "a:fake SPAWNING->INITIALIZING",
				"a:fake INITIALIZING->READY", "a:fake READY->SHUTTING_DOWN", "a:fake SHUTTING_DOWN->TERMINATED"),
				transitions);
		Assertions.assertEquals(1, session.getSpawnCount());
	}

	@Test
	void testIllegalTransitionsRejected() {
		ServerSession session = registry.getOrCreate(key("a"), DEFINITION);

		Assertions.assertThrows(IllegalStateException.class, () -> registry.transition(session, SessionState.READY));
		registry.transition(session, SessionState.SPAWNING);
		Assertions.assertThrows(IllegalStateException.class,
				() -> registry.transition(session, SessionState.SHUTTING_DOWN),
				"A starting session cannot be shut down directly");
		registry.transition(session, SessionState.ERRORED);
		Assertions.assertThrows(IllegalStateException.class, () -> registry.transition(session, SessionState.READY));
		registry.transition(session, SessionState.TERMINATED);
		Assertions.assertThrows(IllegalStateException.class,
				() -> registry.transition(session, SessionState.SPAWNING), "TERMINATED is final");
		Assertions.assertEquals(SessionState.TERMINATED, session.getState());
	}

	@Test
	void testRespawnCountsSpawns() {
		ServerSession session = registry.getOrCreate(key("a"), DEFINITION);
		registry.transition(session, SessionState.SPAWNING);
		registry.transition(session, SessionState.ERRORED);
		registry.transition(session, SessionState.SPAWNING);

		Assertions.assertEquals(2, session.getSpawnCount());
	}

	@Test
	void testFailingListenerDoesNotBlockTransition() {
		SessionRegistry noisy = new SessionRegistry(1, (key, from, to) -> {
			throw new IllegalArgumentException("listener bug");
		});
		noisy.lock();
		try {
			ServerSession session = noisy.getOrCreate(key("a"), DEFINITION);
			noisy.transition(session, SessionState.SPAWNING);
			Assertions.assertEquals(SessionState.SPAWNING, session.getState());
		} finally {
			noisy.unlock();
		}
	}

	// ------------------------------------------------------------------
	// Capacity
	// ------------------------------------------------------------------

	@Test
	void testSlotsCountLiveStates() {
		ready("a");
		ServerSession errored = registry.getOrCreate(key("b"), DEFINITION);
		registry.transition(errored, SessionState.SPAWNING);
		Assertions.assertEquals(2, registry.occupiedSlots());
		Assertions.assertFalse(registry.hasFreeSlot());

		registry.transition(errored, SessionState.ERRORED);

		Assertions.assertEquals(1, registry.occupiedSlots(), "ERRORED holds no process");
		Assertions.assertTrue(registry.hasFreeSlot());
	}

	@Test
	void testEvictionCandidateIsLeastRecentlyActiveIdle() throws Exception {
		ServerSession older = ready("older");
		Thread.sleep(5);
		ServerSession newer = ready("newer");
		Thread.sleep(5);
		older.touch();
		ServerSession busy = ready("busy");
		busy.beginRequest();

		Assertions.assertSame(newer, registry.selectEvictionCandidate());

		newer.beginRequest();
		Assertions.assertSame(older, registry.selectEvictionCandidate());
		older.beginRequest();
		Assertions.assertNull(registry.selectEvictionCandidate(), "Busy sessions are never evicted");
	}

	@Test
	void testRemoveOnlyMatchingEntry() {
		ServerSession first = ready("a");
		registry.transition(first, SessionState.SHUTTING_DOWN);
		registry.transition(first, SessionState.TERMINATED);
		registry.remove(first);
		ServerSession second = registry.getOrCreate(key("a"), DEFINITION);

		registry.remove(first);

		Assertions.assertSame(second, registry.get(key("a")), "Stale remove must not drop the new entry");
	}

	// ------------------------------------------------------------------
	// Locking
	// ------------------------------------------------------------------

	@Test
	void testAccessWithoutLockFails() {
		registry.unlock();

		Assertions.assertThrows(IllegalStateException.class, () -> registry.all());
		registry.lock();
	}

	@Test
	void testEndRequestWakesWaiter() throws Exception {
		ServerSession session = ready("a");
		session.beginRequest();
		registry.unlock();

		CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> {
			registry.lock();
			try {
				long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
				while (session.getActiveRequests() > 0) {
					long remaining = deadline - System.nanoTime();
					if (remaining <= 0) {
						return false;
					}
					registry.awaitChange(remaining);
				}
				return true;
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return false;
			} finally {
				registry.unlock();
			}
		});
		Thread.sleep(50);
		registry.endRequest(session);

		Assertions.assertTrue(waiter.get(5, TimeUnit.SECONDS));
		registry.lock();
	}
}
