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
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds project roots by their marker files ({@code Cargo.toml},
 * {@code pom.xml}, {@code pyproject.toml}, ...).
 *
 * <p>The workspace walk skips VCS metadata, dependency and build output
 * directories and any hidden directory.</p>
 */
public class ProjectDetector {

    private static final Logger logger = LoggerFactory.getLogger(ProjectDetector.class);

    /** Directory names never descended into, matched case-insensitively. */
    private static final Set<String> PRUNED_DIRS = Set.of(
            ".git", ".svn", ".hg", ".idea", ".gradle", ".venv", "venv",
            "node_modules", "target", "build", "out", "dist", "__pycache__"
    );

    private final LanguageServerRegistry registry;

    public ProjectDetector(LanguageServerRegistry registry) {
        this.registry = registry;
    }

    /**
     * A project root found on disk, with the marker that identified it.
     */
    public static final class DetectedProject {
        private final ProjectKey key;
        private final String marker;
        private final String executable;

        DetectedProject(ProjectKey key, String marker, String executable) {
            this.key = key;
            this.marker = marker;
            this.executable = executable;
        }

        public ProjectKey getKey() {
            return key;
        }

        public String getMarker() {
            return marker;
        }

        /** Name of the language server executable for this project. */
        public String getExecutable() {
            return executable;
        }

        @Override
        public String toString() {
            return key + " via " + marker;
        }
    }

    /**
     * Walks {@code workspaceRoot} once and returns every project root, in
     * walk order. A directory with markers for several languages yields one
     * entry per language.
     */
    public List<DetectedProject> discover(Path workspaceRoot) throws IOException {
        Path root = workspaceRoot.toAbsolutePath().normalize();
        Set<ProjectKey> seen = new LinkedHashSet<>();
        List<DetectedProject> projects = new ArrayList<>();

        Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE,
                new SimpleFileVisitor<>() {

            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) {
                    return FileVisitResult.CONTINUE;
                }
                String dirName = dir.getFileName().toString();
                if (dirName.startsWith(".") || PRUNED_DIRS.contains(dirName.toLowerCase(Locale.ROOT))) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile() || file.getParent() == null) {
                    return FileVisitResult.CONTINUE;
                }
                String fileName = file.getFileName().toString();
                for (LanguageServerDefinition definition : registry.all()) {
                    if (definition.getProjectMarkers().contains(fileName)) {
                        ProjectKey key = ProjectKey.of(file.getParent(), definition.getLanguage());
                        if (seen.add(key)) {
                            projects.add(new DetectedProject(key, fileName, definition.getExecutable()));
                        }
                    }
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                logger.debug("Cannot access {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        logger.info("Discovered {} project(s) in {}", projects.size(), root);
        return Collections.unmodifiableList(projects);
    }

    /**
     * Most specific project containing {@code file} whose language handles
     * the file's extension: the nearest ancestor directory holding one of
     * that language's markers.
     */
    public Optional<ProjectKey> findProjectForFile(Path file) {
        Path normalized = file.toAbsolutePath().normalize();
        Path fileName = normalized.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        Optional<LanguageServerDefinition> definition = registry.forFile(fileName.toString());
        if (definition.isEmpty()) {
            return Optional.empty();
        }
        for (Path dir = normalized.getParent(); dir != null; dir = dir.getParent()) {
            for (String marker : definition.get().getProjectMarkers()) {
                if (Files.isRegularFile(dir.resolve(marker))) {
                    return Optional.of(ProjectKey.of(dir, definition.get().getLanguage()));
                }
            }
        }
        return Optional.empty();
    }
}
