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

import java.time.Duration;

import com.tomaszrup.lspmanager.LanguageServerException.Kind;
import com.tomaszrup.lspmanager.dispatch.PriorityDispatcher;
import com.tomaszrup.lspmanager.documents.DocumentSynchronizer;
import com.tomaszrup.lspmanager.process.ProcessSupervisor;
import com.tomaszrup.lspmanager.project.ProjectKey;
import com.tomaszrup.lspmanager.protocol.DiagnosticsCollector;
import com.tomaszrup.lspmanager.protocol.ProtocolSession;

/**
 * One incarnation of a session's server: the process and everything bound
 * to its streams. Discarded as a whole when the process goes away; a
 * respawn builds a new one.
 */
final class ServerConnection {

    private final ProjectKey key;
    private final int generation;
    private final ProcessSupervisor supervisor;
    private final ProtocolSession protocol;
    private final DocumentSynchronizer documents;
    private final PriorityDispatcher dispatcher;
    private final DiagnosticsCollector diagnostics;

    ServerConnection(ProjectKey key, int generation, ProcessSupervisor supervisor, ProtocolSession protocol,
            DocumentSynchronizer documents, PriorityDispatcher dispatcher, DiagnosticsCollector diagnostics) {
        this.key = key;
        this.generation = generation;
        this.supervisor = supervisor;
        this.protocol = protocol;
        this.documents = documents;
        this.dispatcher = dispatcher;
        this.diagnostics = diagnostics;
    }

    int getGeneration() {
        return generation;
    }

    ProcessSupervisor getSupervisor() {
        return supervisor;
    }

    ProtocolSession getProtocol() {
        return protocol;
    }

    DocumentSynchronizer getDocuments() {
        return documents;
    }

    PriorityDispatcher getDispatcher() {
        return dispatcher;
    }

    DiagnosticsCollector getDiagnostics() {
        return diagnostics;
    }

    /**
     * Graceful stop: queued requests are rejected, then {@code shutdown} and
     * {@code exit} are sent and the process gets {@code timeout} to leave
     * before it is killed.
     */
    void shutdown(Duration timeout) {
        LanguageServerException closing = new LanguageServerException(Kind.SESSION_SHUTTING_DOWN, key,
                "Session is shutting down");
        protocol.markClosing();
        dispatcher.failAll(closing);
        protocol.shutdown(timeout);
        supervisor.terminate(timeout);
        release(closing);
    }

    /** Kills the process without ceremony, after a crash or framing fault. */
    void kill(LanguageServerException cause) {
        dispatcher.failAll(cause);
        supervisor.terminate(Duration.ZERO);
        release(cause);
    }

    private void release(LanguageServerException cause) {
        protocol.terminate(cause);
        diagnostics.close();
        documents.clear();
    }
}
