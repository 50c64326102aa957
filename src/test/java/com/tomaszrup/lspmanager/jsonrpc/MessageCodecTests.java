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
package com.tomaszrup.lspmanager.jsonrpc;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

class MessageCodecTests {

	@Test
	void testEncodeProducesExactFrame() {
		JsonObject message = JsonRpcMessages.notification("initialized", new JsonObject());

		String frame = new String(MessageCodec.encode(message), StandardCharsets.UTF_8);

		String body = "{\"jsonrpc\":\"2.0\",\"method\":\"initialized\",\"params\":{}}";
		Assertions.assertEquals("Content-Length: " + body.length() + "\r\n\r\n" + body, frame,
				"Frame should be the header, one blank line and the compact body");
	}

	@Test
	void testLengthCountsBytesNotCharacters() {
		byte[] frame = MessageCodec.encodeBody("{\"t\":\"é\"}");

		String text = new String(frame, StandardCharsets.UTF_8);
		Assertions.assertTrue(text.startsWith("Content-Length: 10\r\n\r\n"), "é takes two bytes: " + text);
	}

	@Test
	void testNullResultIsWritten() {
		JsonObject response = JsonRpcMessages.response(new JsonPrimitive(5), JsonNull.INSTANCE);

		String frame = new String(MessageCodec.encode(response), StandardCharsets.UTF_8);

		Assertions.assertTrue(frame.endsWith("\"result\":null}"), "A null result must be on the wire: " + frame);
	}

	@Test
	void testHtmlCharactersAreNotEscaped() {
		JsonObject message = new JsonObject();
		message.addProperty("text", "List<String> & <T>");

		String frame = new String(MessageCodec.encode(message), StandardCharsets.UTF_8);

		Assertions.assertTrue(frame.contains("List<String> & <T>"), frame);
	}

	@Test
	void testEncodedFrameDecodes() throws Exception {
		JsonObject request = JsonRpcMessages.request(12, "textDocument/hover", new JsonObject());
		FrameDecoder decoder = new FrameDecoder();

		decoder.feed(MessageCodec.encode(request));

		Assertions.assertEquals(request, decoder.poll());
	}
}
