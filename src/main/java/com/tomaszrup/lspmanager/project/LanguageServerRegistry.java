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
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.google.gson.JsonObject;

/**
 * Known language servers, by language.
 */
public class LanguageServerRegistry {

    private final Map<String, LanguageServerDefinition> definitions = new ConcurrentHashMap<>();

    public LanguageServerRegistry() {
    }

    /** Registry with rust-analyzer, jdtls and pylsp. */
    public static LanguageServerRegistry withDefaults() {
        LanguageServerRegistry registry = new LanguageServerRegistry();
        registry.register(LanguageServerDefinition.builder("rust")
                .command("rust-analyzer")
                .projectMarkers("Cargo.toml")
                .fileExtensions(".rs")
                .build());

        JsonObject format = new JsonObject();
        format.addProperty("enabled", true);
        JsonObject java = new JsonObject();
        java.add("format", format);
        JsonObject javaSettings = new JsonObject();
        javaSettings.add("java", java);
        JsonObject jdtlsOptions = new JsonObject();
        jdtlsOptions.add("settings", javaSettings);
        registry.register(LanguageServerDefinition.builder("java")
                .command("jdtls")
                .projectMarkers("pom.xml", "build.gradle", "build.gradle.kts")
                .fileExtensions(".java")
                .initializationOptions(jdtlsOptions)
                .build());

        JsonObject plugins = new JsonObject();
        plugins.add("pycodestyle", enabled());
        plugins.add("pyflakes", enabled());
        JsonObject pylsp = new JsonObject();
        pylsp.add("plugins", plugins);
        JsonObject pylspOptions = new JsonObject();
        pylspOptions.add("pylsp", pylsp);
        registry.register(LanguageServerDefinition.builder("python")
                .command("pylsp")
                .projectMarkers("pyproject.toml", "setup.py", "requirements.txt")
                .fileExtensions(".py")
                .initializationOptions(pylspOptions)
                .build());
        return registry;
    }

    private static JsonObject enabled() {
        JsonObject plugin = new JsonObject();
        plugin.addProperty("enabled", true);
        return plugin;
    }

    /** Adds or replaces the definition for its language. */
    public void register(LanguageServerDefinition definition) {
        definitions.put(definition.getLanguage(), definition);
    }

    public Optional<LanguageServerDefinition> forLanguage(String language) {
        return Optional.ofNullable(definitions.get(language.toLowerCase(Locale.ROOT)));
    }

    public Optional<LanguageServerDefinition> forFile(String fileName) {
        for (LanguageServerDefinition definition : definitions.values()) {
            if (definition.handlesFile(fileName)) {
                return Optional.of(definition);
            }
        }
        return Optional.empty();
    }

    public List<LanguageServerDefinition> all() {
        return new ArrayList<>(definitions.values());
    }
}
