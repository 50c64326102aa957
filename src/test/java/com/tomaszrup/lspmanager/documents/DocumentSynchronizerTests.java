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
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.tomaszrup.lspmanager.documents.DocumentSynchronizer.SyncResult;

class DocumentSynchronizerTests {
	private static final String URI = "file:///work/Main.fake";

	private List<String> methods;
	private List<JsonObject> params;
	private DocumentSynchronizer synchronizer;

	@BeforeEach
	void setup() {
		methods = new ArrayList<>();
		params = new ArrayList<>();
		synchronizer = new DocumentSynchronizer((String method, JsonElement p) -> {
			methods.add(method);
			params.add(p.getAsJsonObject());
		});
	}

	@AfterEach
	void tearDown() {
		synchronizer = null;
	}

	// ------------------------------------------------------------------
	// ensureOpen
	// ------------------------------------------------------------------

	@Test
	void testFirstUseSendsDidOpen() {
		Assertions.assertEquals(SyncResult.OPENED, synchronizer.ensureOpen(URI, "fake", "hello"));

		Assertions.assertEquals(List.of("textDocument/didOpen"), methods);
		JsonObject item = params.get(0).getAsJsonObject("textDocument");
		Assertions.assertEquals(URI, item.get("uri").getAsString());
		Assertions.assertEquals("fake", item.get("languageId").getAsString());
		Assertions.assertEquals(1, item.get("version").getAsInt());
		Assertions.assertEquals("hello", item.get("text").getAsString());
		Assertions.assertEquals(1, synchronizer.get(URI).getVersion());
	}

	@Test
	void testSameContentSendsNothing() {
		synchronizer.ensureOpen(URI, "fake", "hello");

		Assertions.assertEquals(SyncResult.UNCHANGED, synchronizer.ensureOpen(URI, "fake", "hello"));
		Assertions.assertEquals(1, methods.size(), "Unchanged content must not be re-sent");
	}

	@Test
	void testChangedContentSendsFullTextAndBumpsVersion() {
		synchronizer.ensureOpen(URI, "fake", "hello");

		Assertions.assertEquals(SyncResult.CHANGED, synchronizer.ensureOpen(URI, "fake", "hello world"));
		Assertions.assertEquals(SyncResult.CHANGED, synchronizer.ensureOpen(URI, "fake", "bye"));

		Assertions.assertEquals(List.of("textDocument/didOpen", "textDocument/didChange", "textDocument/didChange"),
				methods);
		JsonObject last = params.get(2);
		Assertions.assertEquals(3, last.getAsJsonObject("textDocument").get("version").getAsInt());
		Assertions.assertEquals("bye", last.getAsJsonArray("contentChanges").get(0).getAsJsonObject()
				.get("text").getAsString());
		Assertions.assertFalse(last.getAsJsonArray("contentChanges").get(0).getAsJsonObject().has("range"),
				"Full-text sync has no range");
		Assertions.assertEquals(ContentFingerprint.of("bye"), synchronizer.get(URI).getFingerprint());
	}

	@Test
	void testRevertToEarlierContentIsStillAChange() {
		synchronizer.ensureOpen(URI, "fake", "a");
		synchronizer.ensureOpen(URI, "fake", "b");

		Assertions.assertEquals(SyncResult.CHANGED, synchronizer.ensureOpen(URI, "fake", "a"));
		Assertions.assertEquals(3, synchronizer.get(URI).getVersion());
	}

	// ------------------------------------------------------------------
	// close / clear
	// ------------------------------------------------------------------

	@Test
	void testCloseSendsDidCloseOnce() {
		synchronizer.ensureOpen(URI, "fake", "hello");

		Assertions.assertTrue(synchronizer.close(URI));
		Assertions.assertFalse(synchronizer.close(URI));

		Assertions.assertEquals(List.of("textDocument/didOpen", "textDocument/didClose"), methods);
		Assertions.assertFalse(synchronizer.isOpen(URI));
	}

	@Test
	void testReopenAfterCloseStartsAtVersionOne() {
		synchronizer.ensureOpen(URI, "fake", "a");
		synchronizer.ensureOpen(URI, "fake", "b");
		synchronizer.close(URI);

		Assertions.assertEquals(SyncResult.OPENED, synchronizer.ensureOpen(URI, "fake", "c"));
		Assertions.assertEquals(1, synchronizer.get(URI).getVersion());
	}

	@Test
	void testClearForgetsSilently() {
		synchronizer.ensureOpen(URI, "fake", "a");
		synchronizer.ensureOpen("file:///work/Other.fake", "fake", "b");

		synchronizer.clear();

		Assertions.assertEquals(0, synchronizer.size());
		Assertions.assertEquals(2, methods.size(), "clear sends no notifications");
	}
}
