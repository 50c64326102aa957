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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.lspmanager.LanguageServerException.Kind;
import com.tomaszrup.lspmanager.project.LanguageServerDefinition;
import com.tomaszrup.lspmanager.project.ProjectKey;

class SessionEvictionManagerTests {

	private static final LanguageServerDefinition DEFINITION = LanguageServerDefinition.builder("fake")
			.command("fake-ls")
			.build();

	private SessionRegistry registry;
	private List<ServerSession> stopped;
	private List<LanguageServerException> reasons;
	private AtomicInteger samples;
	private SessionEvictionManager eviction;

	@BeforeEach
	void setup() {
		registry = new SessionRegistry(4, SessionStateListener.NONE);
		stopped = new ArrayList<>();
		reasons = new ArrayList<>();
		samples = new AtomicInteger();
		ManagerSettings settings = ManagerSettings.builder()
				.idleTimeout(Duration.ofMillis(50))
				.memoryThresholdBytes(1024)
				.build();
		eviction = new SessionEvictionManager(registry, settings, pid -> {
			samples.incrementAndGet();
			return OptionalLong.of(1L << 40);
		}, (session, reason) -> {
			stopped.add(session);
			reasons.add(reason);
		});
	}

	private ServerSession ready(String name) {
		registry.lock();
		try {
			ServerSession session = registry.getOrCreate(ProjectKey.of(Paths.get("/work", name), "fake"), DEFINITION);
			registry.transition(session, SessionState.SPAWNING);
			registry.transition(session, SessionState.INITIALIZING);
			registry.transition(session, SessionState.READY);
			session.touch();
			return session;
		} finally {
			registry.unlock();
		}
	}

	private SessionState stateOf(ServerSession session) {
		registry.lock();
		try {
			return session.getState();
		} finally {
			registry.unlock();
		}
	}

	@Test
	void testIdleSessionIsRetired() throws Exception {
		ServerSession idle = ready("idle");
		Thread.sleep(80);
		ServerSession fresh = ready("fresh");

		Assertions.assertEquals(1, eviction.sweepIdle());

		Assertions.assertEquals(List.of(idle), stopped);
		Assertions.assertEquals(SessionState.SHUTTING_DOWN, stateOf(idle));
		Assertions.assertEquals(SessionState.READY, stateOf(fresh));
		Assertions.assertEquals(Kind.SESSION_SHUTTING_DOWN, reasons.get(0).getKind());
		Assertions.assertTrue(reasons.get(0).getMessage().startsWith("idle for"), reasons.get(0).getMessage());
	}

	@Test
	void testBusySessionIsNeverIdle() throws Exception {
		ServerSession busy = ready("busy");
		registry.lock();
		try {
			busy.beginRequest();
		} finally {
			registry.unlock();
		}
		Thread.sleep(80);

		Assertions.assertEquals(0, eviction.sweepIdle());
		Assertions.assertEquals(SessionState.READY, stateOf(busy));
	}

	@Test
	void testStartingSessionIsNeverIdle() throws Exception {
		registry.lock();
		try {
			ServerSession starting = registry.getOrCreate(ProjectKey.of(Paths.get("/work/s"), "fake"), DEFINITION);
			registry.transition(starting, SessionState.SPAWNING);
		} finally {
			registry.unlock();
		}
		Thread.sleep(80);

		Assertions.assertEquals(0, eviction.sweepIdle());
		Assertions.assertTrue(stopped.isEmpty());
	}

	@Test
	void testResourceSweepSkipsSessionsWithoutProcess() {
		ready("no-process");

		Assertions.assertEquals(0, eviction.sweepResources());
		Assertions.assertEquals(0, samples.get(), "Nothing to sample without a connection");
	}
}
