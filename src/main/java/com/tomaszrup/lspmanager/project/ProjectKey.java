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
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Identity of a logical language server session: a canonical project root
 * plus the language served for it.
 */
public final class ProjectKey {

    private final Path root;
    private final String language;

    private ProjectKey(Path root, String language) {
        this.root = root;
        this.language = language;
    }

    /**
     * Creates a key from a root directory, resolving symlinks when the
     * directory exists so that two spellings of the same root compare equal.
     */
    public static ProjectKey of(Path root, String language) {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(language, "language");
        Path canonical = root.toAbsolutePath().normalize();
        try {
            canonical = canonical.toRealPath();
        } catch (IOException e) {
            // not on disk (yet); the normalized absolute path is the identity
        }
        return new ProjectKey(canonical, language.toLowerCase(Locale.ROOT));
    }

    public Path getRoot() {
        return root;
    }

    public String getLanguage() {
        return language;
    }

    /** Short label used in logs: {@code <root dir name>:<language>}. */
    public String label() {
        Path name = root.getFileName();
        return (name != null ? name.toString() : root.toString()) + ":" + language;
    }

    public boolean contains(Path file) {
        return file.toAbsolutePath().normalize().startsWith(root);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ProjectKey)) {
            return false;
        }
        ProjectKey other = (ProjectKey) o;
        return root.equals(other.root) && language.equals(other.language);
    }

    @Override
    public int hashCode() {
        return Objects.hash(root, language);
    }

    @Override
    public String toString() {
        return "ProjectKey{" + root + ", " + language + "}";
    }
}
