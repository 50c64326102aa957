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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.google.gson.JsonObject;

/**
 * How to run and talk to the language server of one language.
 */
public final class LanguageServerDefinition {

    private final String language;
    private final List<String> command;
    private final List<String> projectMarkers;
    private final List<String> fileExtensions;
    private final String languageId;
    private final JsonObject initializationOptions;

    private LanguageServerDefinition(Builder builder) {
        this.language = builder.language;
        this.command = Collections.unmodifiableList(new ArrayList<>(builder.command));
        this.projectMarkers = Collections.unmodifiableList(new ArrayList<>(builder.projectMarkers));
        this.fileExtensions = Collections.unmodifiableList(new ArrayList<>(builder.fileExtensions));
        this.languageId = builder.languageId != null ? builder.languageId : builder.language;
        this.initializationOptions = builder.initializationOptions;
    }

    public static Builder builder(String language) {
        return new Builder(language);
    }

    public String getLanguage() {
        return language;
    }

    /** Executable followed by its arguments. */
    public List<String> getCommand() {
        return command;
    }

    public String getExecutable() {
        return command.get(0);
    }

    /** File names whose presence marks a directory as a project root. */
    public List<String> getProjectMarkers() {
        return projectMarkers;
    }

    /** Extensions including the dot, lower case. */
    public List<String> getFileExtensions() {
        return fileExtensions;
    }

    /** {@code languageId} sent in {@code didOpen}. */
    public String getLanguageId() {
        return languageId;
    }

    /** Copy of the {@code initializationOptions}, or null. */
    public JsonObject getInitializationOptions() {
        return initializationOptions != null ? initializationOptions.deepCopy() : null;
    }

    public boolean handlesFile(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String ext : fileExtensions) {
            if (lower.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "LanguageServerDefinition{" + language + " " + command + "}";
    }

    public static final class Builder {
        private final String language;
        private List<String> command = new ArrayList<>();
        private List<String> projectMarkers = new ArrayList<>();
        private List<String> fileExtensions = new ArrayList<>();
        private String languageId;
        private JsonObject initializationOptions;

        private Builder(String language) {
            this.language = Objects.requireNonNull(language, "language").toLowerCase(Locale.ROOT);
        }

        public Builder command(List<String> command) {
            this.command = new ArrayList<>(command);
            return this;
        }

        public Builder command(String executable, String... args) {
            this.command = new ArrayList<>();
            this.command.add(executable);
            Collections.addAll(this.command, args);
            return this;
        }

        public Builder projectMarkers(String... markers) {
            this.projectMarkers = List.of(markers);
            return this;
        }

        public Builder fileExtensions(String... extensions) {
            List<String> normalized = new ArrayList<>();
            for (String ext : extensions) {
                String e = ext.toLowerCase(Locale.ROOT);
                normalized.add(e.startsWith(".") ? e : "." + e);
            }
            this.fileExtensions = normalized;
            return this;
        }

        public Builder languageId(String languageId) {
            this.languageId = languageId;
            return this;
        }

        public Builder initializationOptions(JsonObject options) {
            this.initializationOptions = options;
            return this;
        }

        public LanguageServerDefinition build() {
            if (command.isEmpty()) {
                throw new IllegalStateException("No command for language " + language);
            }
            return new LanguageServerDefinition(this);
        }
    }
}
