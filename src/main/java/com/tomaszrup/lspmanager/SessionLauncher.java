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

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;

import org.eclipse.lsp4j.ClientCapabilities;
import org.eclipse.lsp4j.ClientInfo;
import org.eclipse.lsp4j.CompletionCapabilities;
import org.eclipse.lsp4j.CompletionItemCapabilities;
import org.eclipse.lsp4j.DefinitionCapabilities;
import org.eclipse.lsp4j.DocumentSymbolCapabilities;
import org.eclipse.lsp4j.HoverCapabilities;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.PublishDiagnosticsCapabilities;
import org.eclipse.lsp4j.ReferencesCapabilities;
import org.eclipse.lsp4j.SymbolCapabilities;
import org.eclipse.lsp4j.SynchronizationCapabilities;
import org.eclipse.lsp4j.TextDocumentClientCapabilities;
import org.eclipse.lsp4j.WorkspaceClientCapabilities;
import org.eclipse.lsp4j.WorkspaceFolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonObject;
import com.tomaszrup.lspmanager.LanguageServerException.Kind;
import com.tomaszrup.lspmanager.dispatch.PriorityDispatcher;
import com.tomaszrup.lspmanager.documents.DocumentSynchronizer;
import com.tomaszrup.lspmanager.jsonrpc.LspGson;
import com.tomaszrup.lspmanager.process.ExecutableLocator;
import com.tomaszrup.lspmanager.process.ProcessSupervisor;
import com.tomaszrup.lspmanager.project.LanguageServerDefinition;
import com.tomaszrup.lspmanager.project.ProjectKey;
import com.tomaszrup.lspmanager.protocol.DiagnosticsCollector;
import com.tomaszrup.lspmanager.protocol.ProtocolSession;

/**
 * Spawns a server process and runs the handshake, producing a ready
 * {@link ServerConnection}. Runs without the session table lock.
 */
final class SessionLauncher {

    private static final Logger logger = LoggerFactory.getLogger(SessionLauncher.class);

    static final String CLIENT_NAME = "language-server-manager";

    private final ManagerSettings settings;
    private final ExecutorPools pools;
    private final ExecutableLocator locator;

    SessionLauncher(ManagerSettings settings, ExecutorPools pools, ExecutableLocator locator) {
        this.settings = settings;
        this.pools = pools;
        this.locator = locator;
    }

    /**
     * @param onSpawned run once the process is up, before the handshake
     * @throws LanguageServerException {@code BINARY_NOT_FOUND},
     *         {@code SPAWN_FAILED} or {@code HANDSHAKE_FAILED}
     */
    ServerConnection launch(ProjectKey key, LanguageServerDefinition definition, int generation,
            Runnable onSpawned) {
        long started = System.nanoTime();
        ProcessSupervisor supervisor = ProcessSupervisor.spawn(key, definition.getCommand(), key.getRoot(),
                locator, pools.getIoPool());
        ProtocolSession protocol = null;
        try {
            onSpawned.run();
            protocol = new ProtocolSession(key, supervisor.getInputStream(), supervisor.getOutputStream(),
                    supervisor.exitSignal(), pools.getSchedulingPool(), settings.getNotificationBufferSize());
            DiagnosticsCollector diagnostics = new DiagnosticsCollector(protocol.subscribe());
            protocol.start(pools.getIoPool());
            diagnostics.start(pools.getIoPool());

            protocol.initialize(initializeParams(key, definition), settings.getHandshakeTimeout());

            ProtocolSession bound = protocol;
            DocumentSynchronizer documents = new DocumentSynchronizer(bound::notify);
            PriorityDispatcher dispatcher = new PriorityDispatcher(key, settings.getMaxInFlightPerSession(),
                    pools.getSchedulingPool());
            logger.info("Handshake with {} (pid {}) completed in {} ms", definition.getExecutable(),
                    supervisor.pid(), (System.nanoTime() - started) / 1_000_000L);
            return new ServerConnection(key, generation, supervisor, protocol, documents, dispatcher, diagnostics);
        } catch (RuntimeException e) {
            LanguageServerException failure = RequestFailures.toLanguageServerException(e, key,
                    Kind.HANDSHAKE_FAILED);
            if (protocol != null) {
                protocol.terminate(failure);
            }
            supervisor.terminate(Duration.ZERO);
            throw failure;
        }
    }

    static JsonObject initializeParams(ProjectKey key, LanguageServerDefinition definition) {
        String rootUri = key.getRoot().toUri().toString();
        InitializeParams params = new InitializeParams();
        params.setProcessId((int) ProcessHandle.current().pid());
        params.setRootUri(rootUri);
        Path rootName = key.getRoot().getFileName();
        params.setWorkspaceFolders(Collections.singletonList(
                new WorkspaceFolder(rootUri, rootName != null ? rootName.toString() : rootUri)));
        params.setClientInfo(new ClientInfo(CLIENT_NAME));
        params.setCapabilities(clientCapabilities());
        JsonObject options = definition.getInitializationOptions();
        if (options != null) {
            params.setInitializationOptions(options);
        }
        return LspGson.toJsonObject(params);
    }

    private static ClientCapabilities clientCapabilities() {
        HoverCapabilities hover = new HoverCapabilities();
        hover.setContentFormat(Arrays.asList(MarkupKind.MARKDOWN, MarkupKind.PLAINTEXT));

        CompletionItemCapabilities completionItem = new CompletionItemCapabilities();
        completionItem.setSnippetSupport(true);
        CompletionCapabilities completion = new CompletionCapabilities();
        completion.setCompletionItem(completionItem);

        DefinitionCapabilities definition = new DefinitionCapabilities();
        definition.setLinkSupport(true);

        DocumentSymbolCapabilities documentSymbol = new DocumentSymbolCapabilities();
        documentSymbol.setHierarchicalDocumentSymbolSupport(true);

        PublishDiagnosticsCapabilities publishDiagnostics = new PublishDiagnosticsCapabilities();
        publishDiagnostics.setRelatedInformation(true);

        TextDocumentClientCapabilities textDocument = new TextDocumentClientCapabilities();
        textDocument.setSynchronization(new SynchronizationCapabilities());
        textDocument.setHover(hover);
        textDocument.setCompletion(completion);
        textDocument.setDefinition(definition);
        textDocument.setReferences(new ReferencesCapabilities());
        textDocument.setDocumentSymbol(documentSymbol);
        textDocument.setPublishDiagnostics(publishDiagnostics);

        WorkspaceClientCapabilities workspace = new WorkspaceClientCapabilities();
        workspace.setConfiguration(true);
        workspace.setWorkspaceFolders(true);
        workspace.setSymbol(new SymbolCapabilities());

        ClientCapabilities capabilities = new ClientCapabilities();
        capabilities.setTextDocument(textDocument);
        capabilities.setWorkspace(workspace);
        return capabilities;
    }
}
