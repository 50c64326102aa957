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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.TextDocumentItem;
import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.tomaszrup.lspmanager.jsonrpc.LspGson;

/**
 * Open-document table of one session.
 *
 * <p>Keeps the server's view of each file in step with the caller's: the
 * first use of a file sends {@code didOpen} at version 1, and a later use
 * with different content sends {@code didChange} with the full new text at
 * the next version. Incremental edits are never computed.</p>
 *
 * <p>Calls are serialized so notifications reach the server in version
 * order. If sending fails the table is left unchanged.</p>
 */
public class DocumentSynchronizer {

    private static final Logger logger = LoggerFactory.getLogger(DocumentSynchronizer.class);

    /** Outgoing notification channel, typically {@code ProtocolSession::notify}. */
    @FunctionalInterface
    public interface NotificationSender {
        void send(String method, JsonElement params);
    }

    public enum SyncResult {
        /** First use in this session; {@code didOpen} was sent. */
        OPENED,
        /** Content differed; {@code didChange} was sent. */
        CHANGED,
        UNCHANGED
    }

    private final NotificationSender sender;
    private final Map<String, OpenDocument> documents = new HashMap<>();

    public DocumentSynchronizer(NotificationSender sender) {
        this.sender = sender;
    }

    public synchronized SyncResult ensureOpen(String uri, String languageId, String content) {
        String fingerprint = ContentFingerprint.of(content);
        OpenDocument existing = documents.get(uri);
        if (existing == null) {
            TextDocumentItem item = new TextDocumentItem(uri, languageId, 1, content);
            sender.send("textDocument/didOpen", LspGson.toJsonObject(new DidOpenTextDocumentParams(item)));
            documents.put(uri, new OpenDocument(uri, languageId, 1, fingerprint));
            logger.debug("Opened {}", uri);
            return SyncResult.OPENED;
        }
        if (existing.getFingerprint().equals(fingerprint)) {
            return SyncResult.UNCHANGED;
        }
        OpenDocument next = existing.nextVersion(fingerprint);
        DidChangeTextDocumentParams params = new DidChangeTextDocumentParams(
                new VersionedTextDocumentIdentifier(uri, next.getVersion()),
                Collections.singletonList(new TextDocumentContentChangeEvent(content)));
        sender.send("textDocument/didChange", LspGson.toJsonObject(params));
        documents.put(uri, next);
        logger.debug("Re-synced {} at version {}", uri, next.getVersion());
        return SyncResult.CHANGED;
    }

    /**
     * Sends {@code didClose} if the document is open.
     *
     * @return true if it was open
     */
    public synchronized boolean close(String uri) {
        OpenDocument removed = documents.remove(uri);
        if (removed == null) {
            return false;
        }
        sender.send("textDocument/didClose",
                LspGson.toJsonObject(new DidCloseTextDocumentParams(new TextDocumentIdentifier(uri))));
        return true;
    }

    /**
     * Drops every entry without notifying; used when the session is gone.
     */
    public synchronized void clear() {
        documents.clear();
    }

    public synchronized OpenDocument get(String uri) {
        return documents.get(uri);
    }

    public synchronized boolean isOpen(String uri) {
        return documents.containsKey(uri);
    }

    public synchronized int size() {
        return documents.size();
    }

    public synchronized Collection<OpenDocument> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(documents.values()));
    }

    public synchronized List<String> openUris() {
        return new ArrayList<>(documents.keySet());
    }
}
