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

import java.time.Duration;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class RequestMetricsTests {

	@Test
	void testPerMethodCounters() {
		RequestMetrics metrics = new RequestMetrics(Duration.ofSeconds(1));
		metrics.record("textDocument/hover", Duration.ofMillis(10).toNanos(), true);
		metrics.record("textDocument/hover", Duration.ofMillis(30).toNanos(), false);
		metrics.record("workspace/symbol", Duration.ofMillis(5).toNanos(), true);

		RequestMetrics.MethodStats hover = metrics.get("textDocument/hover");
		Assertions.assertEquals(1, hover.getSucceeded());
		Assertions.assertEquals(1, hover.getFailed());
		Assertions.assertEquals(Duration.ofMillis(20), hover.getAverageLatency());
		Assertions.assertEquals(0, metrics.get("textDocument/definition").getSucceeded());
	}

	@Test
	void testCacheHitRate() {
		RequestMetrics metrics = new RequestMetrics(Duration.ZERO);
		Assertions.assertEquals(0.0, metrics.getCacheHitRate());

		metrics.recordCacheHit();
		metrics.recordCacheHit();
		metrics.recordCacheHit();
		metrics.recordCacheMiss();

		Assertions.assertEquals(0.75, metrics.getCacheHitRate(), 1e-9);
	}

	@Test
	void testSummaryListsMethodsInOrder() {
		RequestMetrics metrics = new RequestMetrics(Duration.ofMillis(1));
		metrics.record("workspace/symbol", Duration.ofMillis(50).toNanos(), true);
		metrics.record("textDocument/hover", 1000, true);

		String summary = metrics.summary();

		Assertions.assertTrue(summary.startsWith("cache hit rate"), summary);
		Assertions.assertTrue(summary.indexOf("textDocument/hover") < summary.indexOf("workspace/symbol"), summary);
	}
}
