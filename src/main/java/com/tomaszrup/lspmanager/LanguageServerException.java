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
package com.tomaszrup.lspmanager;

import com.tomaszrup.lspmanager.project.ProjectKey;

/**
 * Typed failure surfaced to callers of {@link LanguageServerManager}.
 *
 * <p>The {@link Kind} tells the caller whether retrying makes sense; the
 * manager never retries a failed call on its own.</p>
 */
public class LanguageServerException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** Executable not on PATH. Retrying will not help until it is installed. */
        BINARY_NOT_FOUND(false),
        SPAWN_FAILED(true),
        HANDSHAKE_FAILED(true),
        /** The request alone timed out; the session is still healthy. */
        REQUEST_TIMEOUT(true),
        SESSION_CRASHED(true),
        FRAMING_FAULT(true),
        /** Internal trigger for a proactive restart, never returned to callers. */
        RESOURCE_EXCEEDED(true),
        SESSION_SHUTTING_DOWN(true),
        POOL_AT_CAPACITY(true),
        /** The server answered with a JSON-RPC error object. */
        SERVER_ERROR(false),
        UNSUPPORTED_LANGUAGE(false),
        DOCUMENT_UNAVAILABLE(false);

        private final boolean retryable;

        Kind(boolean retryable) {
            this.retryable = retryable;
        }

        public boolean isRetryable() {
            return retryable;
        }
    }

    private final Kind kind;
    private final transient ProjectKey projectKey;
    private final Integer serverErrorCode;

    public LanguageServerException(Kind kind, ProjectKey projectKey, String message) {
        this(kind, projectKey, message, null, null);
    }

    public LanguageServerException(Kind kind, ProjectKey projectKey, String message, Throwable cause) {
        this(kind, projectKey, message, null, cause);
    }

    private LanguageServerException(Kind kind, ProjectKey projectKey, String message,
            Integer serverErrorCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.projectKey = projectKey;
        this.serverErrorCode = serverErrorCode;
    }

    public static LanguageServerException serverError(ProjectKey projectKey, String method, int code,
            String message) {
        return new LanguageServerException(Kind.SERVER_ERROR, projectKey,
                method + " failed with code " + code + ": " + message, code, null);
    }

    public Kind getKind() {
        return kind;
    }

    public ProjectKey getProjectKey() {
        return projectKey;
    }

    /** JSON-RPC error code for {@link Kind#SERVER_ERROR}, otherwise null. */
    public Integer getServerErrorCode() {
        return serverErrorCode;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    /**
     * Copy for handing a session-level failure to another caller, so that
     * each caller observes its own stack trace.
     */
    public LanguageServerException copy() {
        return new LanguageServerException(kind, projectKey, getMessage(), serverErrorCode, this);
    }
}
