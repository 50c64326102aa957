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
package com.tomaszrup.lspmanager.services;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.DocumentSymbolParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.Location;
import org.eclipse.lsp4j.LocationLink;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.ReferenceContext;
import org.eclipse.lsp4j.ReferenceParams;
import org.eclipse.lsp4j.SymbolInformation;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.TextDocumentPositionParams;
import org.eclipse.lsp4j.WorkspaceSymbolParams;
import org.eclipse.lsp4j.jsonrpc.messages.Either;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.lspmanager.LanguageServerException;
import com.tomaszrup.lspmanager.LanguageServerException.Kind;
import com.tomaszrup.lspmanager.LanguageServerManager;
import com.tomaszrup.lspmanager.dispatch.RequestPriority;
import com.tomaszrup.lspmanager.jsonrpc.LspGson;
import com.tomaszrup.lspmanager.project.ProjectDetector;
import com.tomaszrup.lspmanager.project.ProjectKey;

/**
 * Code intelligence queries by file and position, resolved to the owning
 * project's session and decoded into lsp4j types. Positions are 0-based.
 */
public class CodeIntelligenceService {

    private final LanguageServerManager manager;
    private final ProjectDetector detector;

    public CodeIntelligenceService(LanguageServerManager manager, ProjectDetector detector) {
        this.manager = manager;
        this.detector = detector;
    }

    /** Hover at a position, or null if the server has nothing to show. */
    public CompletableFuture<Hover> hover(Path file, int line, int character) {
        HoverParams params = new HoverParams(document(file), new Position(line, character));
        return request(file, "textDocument/hover", params, RequestPriority.HIGH,
                result -> isNull(result) ? null : LspGson.fromJson(result, Hover.class));
    }

    public CompletableFuture<List<Location>> definition(Path file, int line, int character) {
        TextDocumentPositionParams params = new TextDocumentPositionParams(document(file),
                new Position(line, character));
        return request(file, "textDocument/definition", params, RequestPriority.NORMAL,
                CodeIntelligenceService::toLocations);
    }

    public CompletableFuture<List<Location>> references(Path file, int line, int character,
            boolean includeDeclaration) {
        ReferenceParams params = new ReferenceParams(document(file), new Position(line, character),
                new ReferenceContext(includeDeclaration));
        return request(file, "textDocument/references", params, RequestPriority.NORMAL,
                CodeIntelligenceService::toLocations);
    }

    public CompletableFuture<List<CompletionItem>> completion(Path file, int line, int character) {
        TextDocumentPositionParams params = new TextDocumentPositionParams(document(file),
                new Position(line, character));
        return request(file, "textDocument/completion", params, RequestPriority.HIGH, result -> {
            if (isNull(result)) {
                return Collections.emptyList();
            }
            if (result.isJsonObject()) {
                return LspGson.fromJson(result, CompletionList.class).getItems();
            }
            List<CompletionItem> items = new ArrayList<>();
            for (JsonElement item : result.getAsJsonArray()) {
                items.add(LspGson.fromJson(item, CompletionItem.class));
            }
            return items;
        });
    }

    /**
     * Symbols of one file, hierarchical when the server supports it.
     */
    public CompletableFuture<List<Either<SymbolInformation, DocumentSymbol>>> documentSymbols(Path file) {
        DocumentSymbolParams params = new DocumentSymbolParams(document(file));
        return request(file, "textDocument/documentSymbol", params, RequestPriority.LOW, result -> {
            List<Either<SymbolInformation, DocumentSymbol>> symbols = new ArrayList<>();
            if (isNull(result)) {
                return symbols;
            }
            for (JsonElement element : result.getAsJsonArray()) {
                if (element.getAsJsonObject().has("location")) {
                    symbols.add(Either.forLeft(LspGson.fromJson(element, SymbolInformation.class)));
                } else {
                    symbols.add(Either.forRight(LspGson.fromJson(element, DocumentSymbol.class)));
                }
            }
            return symbols;
        });
    }

    public CompletableFuture<List<SymbolInformation>> workspaceSymbols(ProjectKey project, String query) {
        JsonObject params = LspGson.toJsonObject(new WorkspaceSymbolParams(query));
        return manager.submit(project, "workspace/symbol", params, RequestPriority.LOW,
                manager.getSettings().getRequestTimeout()).thenApply(result -> {
                    List<SymbolInformation> symbols = new ArrayList<>();
                    if (!isNull(result)) {
                        for (JsonElement element : result.getAsJsonArray()) {
                            symbols.add(LspGson.fromJson(element, SymbolInformation.class));
                        }
                    }
                    return symbols;
                });
    }

    /**
     * Diagnostics the server publishes for {@code file} once it has been
     * synced, waiting up to the configured diagnostics wait. Empty if none
     * arrived.
     */
    public CompletableFuture<List<Diagnostic>> diagnostics(Path file) {
        ProjectKey project;
        try {
            project = projectFor(file);
        } catch (LanguageServerException e) {
            return CompletableFuture.failedFuture(e);
        }
        return manager.awaitDiagnostics(project, file, manager.getSettings().getDiagnosticsWait())
                .thenApply(published -> published
                        .map(json -> LspGson.fromJson(json, PublishDiagnosticsParams.class).getDiagnostics())
                        .orElse(Collections.emptyList()));
    }

    private <T> CompletableFuture<T> request(Path file, String method, Object params, RequestPriority priority,
            Function<JsonElement, T> decoder) {
        ProjectKey project;
        try {
            project = projectFor(file);
        } catch (LanguageServerException e) {
            return CompletableFuture.failedFuture(e);
        }
        return manager.submit(project, method, LspGson.toJsonObject(params), priority,
                manager.getSettings().getRequestTimeout()).thenApply(decoder);
    }

    private ProjectKey projectFor(Path file) {
        return detector.findProjectForFile(file)
                .orElseThrow(() -> new LanguageServerException(Kind.UNSUPPORTED_LANGUAGE, null,
                        "No project with a registered language server contains " + file));
    }

    private static TextDocumentIdentifier document(Path file) {
        return new TextDocumentIdentifier(file.toAbsolutePath().normalize().toUri().toString());
    }

    private static boolean isNull(JsonElement element) {
        return element == null || element.isJsonNull();
    }

    private static List<Location> toLocations(JsonElement result) {
        List<Location> locations = new ArrayList<>();
        if (isNull(result)) {
            return locations;
        }
        if (result.isJsonObject()) {
            locations.add(LspGson.fromJson(result, Location.class));
            return locations;
        }
        for (JsonElement element : result.getAsJsonArray()) {
            if (element.getAsJsonObject().has("targetUri")) {
                LocationLink link = LspGson.fromJson(element, LocationLink.class);
                locations.add(new Location(link.getTargetUri(), link.getTargetSelectionRange()));
            } else {
                locations.add(LspGson.fromJson(element, Location.class));
            }
        }
        return locations;
    }
}
