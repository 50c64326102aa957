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

import java.io.IOException;
import java.nio.file.Paths;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.lspmanager.LanguageServerException.Kind;
import com.tomaszrup.lspmanager.project.ProjectKey;

class RequestFailuresTests {

	private final ProjectKey key = ProjectKey.of(Paths.get("/work/p"), "fake");

	@Test
	void testUnwrapsNestedWrappers() {
		IOException root = new IOException("pipe closed");

		Throwable unwrapped = RequestFailures.unwrap(new CompletionException(new ExecutionException(root)));

		Assertions.assertSame(root, unwrapped);
	}

	@Test
	void testManagerExceptionPassesThrough() {
		LanguageServerException original = new LanguageServerException(Kind.REQUEST_TIMEOUT, key, "slow");

		Assertions.assertSame(original,
				RequestFailures.toLanguageServerException(new CompletionException(original), key, Kind.SERVER_ERROR));
	}

	@Test
	void testOtherFailuresUseFallback() {
		LanguageServerException converted = RequestFailures.toLanguageServerException(
				new CompletionException(new IllegalStateException("bad")), key, Kind.SESSION_CRASHED);

		Assertions.assertEquals(Kind.SESSION_CRASHED, converted.getKind());
		Assertions.assertEquals("IllegalStateException: bad", converted.getMessage());
		Assertions.assertSame(key, converted.getProjectKey());
	}

	@Test
	void testFatalErrorsAreRethrown() {
		Assertions.assertThrows(OutOfMemoryError.class, () -> RequestFailures.toLanguageServerException(
				new CompletionException(new OutOfMemoryError("heap")), key, Kind.SERVER_ERROR));
	}

	@Test
	void testCopyKeepsKindAndCode() {
		LanguageServerException error = LanguageServerException.serverError(key, "textDocument/hover", -32601, "nope");

		LanguageServerException copy = error.copy();

		Assertions.assertEquals(Kind.SERVER_ERROR, copy.getKind());
		Assertions.assertEquals(Integer.valueOf(-32601), copy.getServerErrorCode());
		Assertions.assertSame(error, copy.getCause());
		Assertions.assertFalse(copy.isRetryable());
		Assertions.assertTrue(new LanguageServerException(Kind.SESSION_CRASHED, key, "x").isRetryable());
		Assertions.assertFalse(new LanguageServerException(Kind.BINARY_NOT_FOUND, key, "x").isRetryable());
	}
}
