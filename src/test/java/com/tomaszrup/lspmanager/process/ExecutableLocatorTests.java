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

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExecutableLocatorTests {

	private Path binDir;
	private Path otherDir;

	@BeforeEach
	void setup() throws IOException {
		binDir = Files.createTempDirectory("lsm-bin");
		otherDir = Files.createTempDirectory("lsm-other");
	}

	@AfterEach
	void tearDown() throws IOException {
		for (Path dir : new Path[] { binDir, otherDir }) {
			try (Stream<Path> walk = Files.walk(dir)) {
				walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
			}
		}
	}

	private static Path executable(Path dir, String name) throws IOException {
		Path file = Files.write(dir.resolve(name), "#!/bin/sh\n".getBytes());
		Assumptions.assumeTrue(file.toFile().setExecutable(true), "Filesystem must support the executable bit");
		return file;
	}

	@Test
	void testFindsExecutableOnPath() throws IOException {
		Path tool = executable(binDir, "fake-ls");
		ExecutableLocator locator = new ExecutableLocator(otherDir + File.pathSeparator + binDir, null);

		Optional<Path> found = locator.locate("fake-ls");

		Assertions.assertTrue(found.isPresent(), "Executable in the second PATH entry should be found");
		Assertions.assertEquals(tool.toAbsolutePath(), found.get());
	}

	@Test
	void testFirstPathEntryWins() throws IOException {
		Path first = executable(otherDir, "dup-ls");
		executable(binDir, "dup-ls");
		ExecutableLocator locator = new ExecutableLocator(otherDir + File.pathSeparator + binDir, null);

		Assertions.assertEquals(first.toAbsolutePath(), locator.locate("dup-ls").orElseThrow());
	}

	@Test
	void testMissingExecutableIsEmpty() {
		ExecutableLocator locator = new ExecutableLocator(binDir.toString(), null);

		Assertions.assertFalse(locator.locate("no-such-tool").isPresent());
		Assertions.assertFalse(locator.locate("").isPresent());
		Assertions.assertFalse(locator.locate(null).isPresent());
	}

	@Test
	void testPathWithSeparatorIsCheckedDirectly() throws IOException {
		Path tool = executable(binDir, "direct-ls");
		ExecutableLocator locator = new ExecutableLocator("", null);

		Assertions.assertEquals(tool.toAbsolutePath(), locator.locate(tool.toString()).orElseThrow(),
				"An explicit path should not need PATH");
	}

	@Test
	void testNonExecutableFileIsSkipped() throws IOException {
		Path plain = Files.write(binDir.resolve("plain-ls"), new byte[0]);
		Assumptions.assumeTrue(plain.toFile().setExecutable(false, false));
		Assumptions.assumeFalse(Files.isExecutable(plain), "Running as a user that can execute anything");
		ExecutableLocator locator = new ExecutableLocator(binDir.toString(), null);

		Assertions.assertFalse(locator.locate("plain-ls").isPresent());
	}

	@Test
	void testPathExtExtensionsAreTried() throws IOException {
		Path tool = executable(binDir, "win-ls.cmd");
		ExecutableLocator locator = new ExecutableLocator(binDir.toString(), ".EXE" + File.pathSeparator + ".CMD");

		Assertions.assertEquals(tool.toAbsolutePath(), locator.locate("win-ls").orElseThrow());
	}
}
