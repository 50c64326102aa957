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
package com.tomaszrup.lspmanager.cache;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.google.gson.JsonElement;
import com.tomaszrup.lspmanager.jsonrpc.JsonCanonicalizer;
import com.tomaszrup.lspmanager.project.ProjectKey;

/**
 * (project, method, normalized params, input fingerprint) identity of a
 * cached response. The input fingerprint combines the fingerprints of every
 * file the request reads; requests without file inputs (workspace symbol
 * search) have an empty one.
 */
public final class CacheKey {

    private final ProjectKey project;
    private final String method;
    private final String params;
    private final Map<String, String> fileFingerprints;

    private CacheKey(ProjectKey project, String method, String params, Map<String, String> fileFingerprints) {
        this.project = project;
        this.method = method;
        this.params = params;
        this.fileFingerprints = fileFingerprints;
    }

    /**
     * @param fileFingerprints document URI to content fingerprint, for every
     *        file the request depends on
     */
    public static CacheKey of(ProjectKey project, String method, JsonElement params,
            Map<String, String> fileFingerprints) {
        return new CacheKey(project, method, JsonCanonicalizer.canonicalize(params),
                Collections.unmodifiableMap(new TreeMap<>(fileFingerprints)));
    }

    public ProjectKey getProject() {
        return project;
    }

    public String getMethod() {
        return method;
    }

    public Map<String, String> getFileFingerprints() {
        return fileFingerprints;
    }

    public boolean dependsOn(String uri) {
        return fileFingerprints.containsKey(uri);
    }

    public boolean isProjectWide() {
        return fileFingerprints.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheKey)) {
            return false;
        }
        CacheKey other = (CacheKey) o;
        return project.equals(other.project) && method.equals(other.method)
                && params.equals(other.params) && fileFingerprints.equals(other.fileFingerprints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(project, method, params, fileFingerprints);
    }

    @Override
    public String toString() {
        return "CacheKey{" + project.label() + " " + method + " files=" + fileFingerprints.keySet() + "}";
    }
}
