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
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * PATH-style executable lookup.
 *
 * <p>A command containing a path separator is checked as-is. Otherwise each
 * {@code PATH} entry is tried in order; on Windows every {@code PATHEXT}
 * extension is tried as well.</p>
 */
public class ExecutableLocator {

    private final String pathVariable;
    private final List<String> extensions;

    public ExecutableLocator() {
        this(System.getenv("PATH"), isWindows() ? System.getenv("PATHEXT") : null);
    }

    public ExecutableLocator(String pathVariable, String pathExtVariable) {
        this.pathVariable = pathVariable != null ? pathVariable : "";
        this.extensions = new ArrayList<>();
        this.extensions.add("");
        if (pathExtVariable != null) {
            for (String ext : pathExtVariable.split(File.pathSeparator)) {
                if (!ext.isBlank()) {
                    extensions.add(ext.toLowerCase(Locale.ROOT));
                }
            }
        }
    }

    public Optional<Path> locate(String command) {
        if (command == null || command.isBlank()) {
            return Optional.empty();
        }
        if (command.indexOf('/') >= 0 || command.indexOf(File.separatorChar) >= 0) {
            return withExtensions(command);
        }
        for (String dir : pathVariable.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Optional<Path> found = withExtensions(dir + File.separator + command);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private Optional<Path> withExtensions(String candidate) {
        for (String ext : extensions) {
            try {
                Path path = Paths.get(candidate + ext);
                if (Files.isRegularFile(path) && Files.isExecutable(path)) {
                    return Optional.of(path.toAbsolutePath());
                }
            } catch (InvalidPathException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }
}
