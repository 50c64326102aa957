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
package com.tomaszrup.lspmanager.project;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProjectDetectorTests {
	private Path workspace;
	private ProjectDetector detector;

	@BeforeEach
	void setup() throws IOException {
		workspace = Files.createTempDirectory("lsm-workspace").toRealPath();
		detector = new ProjectDetector(LanguageServerRegistry.withDefaults());
	}

	@AfterEach
	void tearDown() throws IOException {
		try (Stream<Path> walk = Files.walk(workspace)) {
			walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
		}
	}

	private Path touch(String relative) throws IOException {
		Path file = workspace.resolve(relative);
		Files.createDirectories(file.getParent());
		return Files.write(file, new byte[0]);
	}

	// ------------------------------------------------------------------
	// discover
	// ------------------------------------------------------------------

	@Test
	void testDiscoversNestedProjects() throws IOException {
		touch("services/api/Cargo.toml");
		touch("services/web/pom.xml");
		touch("tools/pyproject.toml");
		touch("README.md");

		List<ProjectDetector.DetectedProject> projects = detector.discover(workspace);

		List<String> found = projects.stream()
				.map(p -> workspace.relativize(p.getKey().getRoot()) + ":" + p.getKey().getLanguage())
				.sorted()
				.collect(Collectors.toList());
		Assertions.assertEquals(List.of("services/api:rust", "services/web:java", "tools:python"), found);
	}

	@Test
	void testDetectedProjectCarriesMarkerAndExecutable() throws IOException {
		touch("crate/Cargo.toml");

		ProjectDetector.DetectedProject project = detector.discover(workspace).get(0);

		Assertions.assertEquals("Cargo.toml", project.getMarker());
		Assertions.assertEquals("rust-analyzer", project.getExecutable());
	}

	@Test
	void testPolyglotDirectoryYieldsOneEntryPerLanguage() throws IOException {
		touch("mixed/pom.xml");
		touch("mixed/requirements.txt");
		touch("mixed/build.gradle");

		List<ProjectDetector.DetectedProject> projects = detector.discover(workspace);

		Assertions.assertEquals(2, projects.size(), "pom.xml and build.gradle are the same java project");
	}

	@Test
	void testPrunedDirectoriesAreSkipped() throws IOException {
		touch("node_modules/dep/pyproject.toml");
		touch(".git/modules/x/Cargo.toml");
		touch("app/target/classes/pom.xml");
		touch(".hidden/pom.xml");
		touch("app/pom.xml");

		List<ProjectDetector.DetectedProject> projects = detector.discover(workspace);

		Assertions.assertEquals(1, projects.size());
		Assertions.assertEquals(workspace.resolve("app"), projects.get(0).getKey().getRoot());
	}

	// ------------------------------------------------------------------
	// findProjectForFile
	// ------------------------------------------------------------------

	@Test
	void testNearestMarkerWins() throws IOException {
		touch("outer/Cargo.toml");
		touch("outer/inner/Cargo.toml");
		Path source = touch("outer/inner/src/main.rs");

		Optional<ProjectKey> key = detector.findProjectForFile(source);

		Assertions.assertEquals(ProjectKey.of(workspace.resolve("outer/inner"), "rust"), key.orElseThrow());
	}

	@Test
	void testMarkerOfAnotherLanguageIgnored() throws IOException {
		touch("outer/Cargo.toml");
		touch("outer/py/setup.py");
		Path source = touch("outer/py/lib.rs");

		Assertions.assertEquals(ProjectKey.of(workspace.resolve("outer"), "rust"),
				detector.findProjectForFile(source).orElseThrow());
	}

	@Test
	void testUnknownExtensionOrNoProject() throws IOException {
		touch("crate/Cargo.toml");

		Assertions.assertFalse(detector.findProjectForFile(touch("crate/notes.txt")).isPresent());
		Assertions.assertFalse(detector.findProjectForFile(touch("loose/script.py")).isPresent());
	}
}
