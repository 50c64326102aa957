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
package com.tomaszrup.lspmanager.documents;

/**
 * A document the server currently holds open, as last sent to it.
 */
public final class OpenDocument {

    private final String uri;
    private final String languageId;
    private final int version;
    private final String fingerprint;

    OpenDocument(String uri, String languageId, int version, String fingerprint) {
        this.uri = uri;
        this.languageId = languageId;
        this.version = version;
        this.fingerprint = fingerprint;
    }

    public String getUri() {
        return uri;
    }

    public String getLanguageId() {
        return languageId;
    }

    public int getVersion() {
        return version;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    OpenDocument nextVersion(String newFingerprint) {
        return new OpenDocument(uri, languageId, version + 1, newFingerprint);
    }

    @Override
    public String toString() {
        return "OpenDocument{" + uri + " v" + version + "}";
    }
}
