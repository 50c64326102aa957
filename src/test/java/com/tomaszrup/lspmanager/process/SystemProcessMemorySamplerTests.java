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
package com.tomaszrup.lspmanager.process;

import java.util.OptionalLong;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SystemProcessMemorySamplerTests {

	@Test
	void testParseKilobytes() {
		Assertions.assertEquals(123456, SystemProcessMemorySampler.parseKilobytes("   123456 kB"));
		Assertions.assertEquals(42, SystemProcessMemorySampler.parseKilobytes(" 42\n"));
		Assertions.assertThrows(NumberFormatException.class, () -> SystemProcessMemorySampler.parseKilobytes("n/a"));
	}

	@Test
	void testSamplesOwnProcess() {
		OptionalLong rss = new SystemProcessMemorySampler().residentBytes(ProcessHandle.current().pid());

		if (rss.isPresent()) {
			Assertions.assertTrue(rss.getAsLong() > 1024 * 1024, "A JVM uses more than a megabyte: " + rss);
		}
	}

	@Test
	void testUnknownPidIsEmpty() {
		Assertions.assertFalse(new SystemProcessMemorySampler().residentBytes(Long.MAX_VALUE - 1).isPresent());
	}
}
