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
package com.tomaszrup.lspmanager.util;

import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import com.tomaszrup.lspmanager.project.ProjectKey;

class MdcProjectContextTests {

	private final ProjectKey billing = ProjectKey.of(Paths.get("/srv/work/billing-service"), "Java");

	@BeforeEach
	void setup() {
		MDC.clear();
	}

	@AfterEach
	void tearDown() {
		MDC.clear();
	}

	// ------------------------------------------------------------------
	// setProject() / clear()
	// ------------------------------------------------------------------

	@Test
	void testSetProjectUsesLabel() {
		MdcProjectContext.setProject(billing);

		Assertions.assertEquals("billing-service:java", MDC.get(MdcProjectContext.MDC_KEY),
				"Label is root directory name and lower-case language");
	}

	@Test
	void testSetProjectWithNullSetsDefault() {
		MdcProjectContext.setProject(null);

		Assertions.assertEquals("default", MDC.get(MdcProjectContext.MDC_KEY));
	}

	@Test
	void testClearRemovesOnlyProjectKey() {
		MDC.put("request", "42");
		MdcProjectContext.setProject(billing);

		MdcProjectContext.clear();

		Assertions.assertNull(MDC.get(MdcProjectContext.MDC_KEY));
		Assertions.assertEquals("42", MDC.get("request"));
	}

	// ------------------------------------------------------------------
	// snapshot() / restore() / runAs()
	// ------------------------------------------------------------------

	@Test
	void testSnapshotRestoreRoundTrip() {
		MDC.put(MdcProjectContext.MDC_KEY, "round-trip");
		MDC.put("extra-key", "extra-value");
		Map<String, String> snap = MdcProjectContext.snapshot();

		MDC.clear();
		MdcProjectContext.restore(snap);

		Assertions.assertEquals("round-trip", MDC.get(MdcProjectContext.MDC_KEY));
		Assertions.assertEquals("extra-value", MDC.get("extra-key"));
	}

	@Test
	void testRestoreNullClearsMdc() {
		MdcProjectContext.setProject(billing);

		MdcProjectContext.restore(null);

		Assertions.assertNull(MDC.get(MdcProjectContext.MDC_KEY));
	}

	@Test
	void testRunAsRestoresPreviousProject() {
		MDC.put(MdcProjectContext.MDC_KEY, "outer");
		AtomicReference<String> inside = new AtomicReference<>();

		MdcProjectContext.runAs(billing, () -> inside.set(MDC.get(MdcProjectContext.MDC_KEY)));

		Assertions.assertEquals("billing-service:java", inside.get());
		Assertions.assertEquals("outer", MDC.get(MdcProjectContext.MDC_KEY));
	}

	// ------------------------------------------------------------------
	// wrap(Runnable)
	// ------------------------------------------------------------------

	@Test
	void testWrapCarriesCallerContextAndRestoresWorkerContext() throws Exception {
		MDC.put(MdcProjectContext.MDC_KEY, "caller-context");
		AtomicReference<String> duringTask = new AtomicReference<>();
		AtomicReference<String> afterTask = new AtomicReference<>();
		Runnable wrapped = MdcProjectContext.wrap(() -> duringTask.set(MDC.get(MdcProjectContext.MDC_KEY)));

		ExecutorService exec = Executors.newSingleThreadExecutor();
		try {
			exec.submit(() -> MDC.put(MdcProjectContext.MDC_KEY, "worker-own")).get(5, TimeUnit.SECONDS);
			exec.submit(wrapped).get(5, TimeUnit.SECONDS);
			exec.submit(() -> afterTask.set(MDC.get(MdcProjectContext.MDC_KEY))).get(5, TimeUnit.SECONDS);
		} finally {
			exec.shutdownNow();
		}

		Assertions.assertEquals("caller-context", duringTask.get(), "During task, should see caller's MDC");
		Assertions.assertEquals("worker-own", afterTask.get(), "After task, worker's MDC should be restored");
	}
}
