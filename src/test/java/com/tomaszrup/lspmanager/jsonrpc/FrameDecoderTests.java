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
import java.util.Arrays;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;

class FrameDecoderTests {

	private FrameDecoder decoder;

	@BeforeEach
	void setup() {
		decoder = new FrameDecoder();
	}

	private static byte[] ascii(String text) {
		return text.getBytes(StandardCharsets.US_ASCII);
	}

	private static byte[] frame(String body) {
		return MessageCodec.encodeBody(body);
	}

	// ------------------------------------------------------------------
	// Complete and split frames
	// ------------------------------------------------------------------

	@Test
	void testSingleFrame() throws Exception {
		decoder.feed(frame("{\"jsonrpc\":\"2.0\",\"method\":\"initialized\"}"));

		JsonObject message = decoder.poll();
		Assertions.assertNotNull(message, "A complete frame should decode");
		Assertions.assertEquals("initialized", message.get("method").getAsString());
		Assertions.assertNull(decoder.poll(), "Only one message was fed");
		Assertions.assertFalse(decoder.hasPartialFrame());
	}

	@Test
	void testFrameSplitAcrossEveryByte() throws Exception {
		byte[] bytes = frame("{\"id\":7,\"result\":{\"text\":\"split me\"}}");
		for (byte b : bytes) {
			Assertions.assertNull(decoder.poll(), "No message before the last byte");
			decoder.feed(new byte[] { b });
		}
		JsonObject message = decoder.poll();
		Assertions.assertNotNull(message);
		Assertions.assertEquals(7, message.get("id").getAsInt());
		Assertions.assertEquals("split me", message.getAsJsonObject("result").get("text").getAsString());
	}

	@Test
	void testSeveralFramesInOneChunk() throws Exception {
		byte[] first = frame("{\"id\":1}");
		byte[] second = frame("{\"id\":2}");
		byte[] both = Arrays.copyOf(first, first.length + second.length);
		System.arraycopy(second, 0, both, first.length, second.length);

		decoder.feed(both);

		Assertions.assertEquals(1, decoder.poll().get("id").getAsInt());
		Assertions.assertEquals(2, decoder.poll().get("id").getAsInt());
		Assertions.assertNull(decoder.poll());
	}

	@Test
	void testBodyLengthCountsUtf8Bytes() throws Exception {
		decoder.feed(frame("{\"text\":\"zażółć ✓\"}"));

		Assertions.assertEquals("zażółć ✓", decoder.poll().get("text").getAsString(),
				"Multi-byte characters should survive framing");
	}

	@Test
	void testBodyWhitespaceIsPartOfTheLength() throws Exception {
		String body = "{ \"id\" :\r\n 3 }";
		decoder.feed(frame(body));

		Assertions.assertEquals(3, decoder.poll().get("id").getAsInt());
		Assertions.assertFalse(decoder.hasPartialFrame());
	}

	@Test
	void testExtraHeadersAreIgnored() throws Exception {
		String body = "{\"id\":4}";
		decoder.feed(ascii("Content-Type: application/vscode-jsonrpc; charset=utf-8\r\ncontent-length: "
				+ body.length() + "\r\n\r\n" + body));

		Assertions.assertEquals(4, decoder.poll().get("id").getAsInt());
	}

	@Test
	void testLargeBodyGrowsBuffer() throws Exception {
		StringBuilder text = new StringBuilder();
		for (int i = 0; i < 50_000; i++) {
			text.append('x');
		}
		decoder.feed(frame("{\"text\":\"" + text + "\"}"));

		Assertions.assertEquals(50_000, decoder.poll().get("text").getAsString().length());
	}

	@Test
	void testPartialFrameIsReported() throws Exception {
		decoder.feed(ascii("Content-Length: 10\r\n\r\n{\"id\""));

		Assertions.assertTrue(decoder.hasPartialFrame());
		Assertions.assertNull(decoder.poll());
	}

	// ------------------------------------------------------------------
	// Framing faults
	// ------------------------------------------------------------------

	@Test
	void testNonNumericLengthFaults() {
		Assertions.assertThrows(FramingFaultException.class,
				() -> decoder.feed(ascii("Content-Length: ten\r\n\r\n{}")));
		Assertions.assertTrue(decoder.isFaulted());
	}

	@Test
	void testNegativeLengthFaults() {
		Assertions.assertThrows(FramingFaultException.class,
				() -> decoder.feed(ascii("Content-Length: -1\r\n\r\n")));
	}

	@Test
	void testMissingLengthFaults() {
		Assertions.assertThrows(FramingFaultException.class,
				() -> decoder.feed(ascii("Content-Type: text/plain\r\n\r\n{}")));
	}

	@Test
	void testDuplicateLengthFaults() {
		Assertions.assertThrows(FramingFaultException.class,
				() -> FrameDecoder.parseContentLength("Content-Length: 2\r\nContent-Length: 2"));
	}

	@Test
	void testInvalidJsonBodyFaults() {
		Assertions.assertThrows(FramingFaultException.class, () -> decoder.feed(frame("{not json")));
	}

	@Test
	void testNonObjectBodyFaults() {
		Assertions.assertThrows(FramingFaultException.class, () -> decoder.feed(frame("[1,2,3]")));
	}

	@Test
	void testOversizedHeaderFaults() {
		byte[] junk = new byte[FrameDecoder.MAX_HEADER_BYTES + 10];
		Arrays.fill(junk, (byte) 'a');
		Assertions.assertThrows(FramingFaultException.class, () -> decoder.feed(junk));
	}

	@Test
	void testFaultIsSticky() throws Exception {
		decoder.feed(frame("{\"id\":1}"));
		Assertions.assertThrows(FramingFaultException.class,
				() -> decoder.feed(ascii("Content-Length: x\r\n\r\n")));

		Assertions.assertThrows(FramingFaultException.class, () -> decoder.feed(frame("{\"id\":2}")),
				"A faulted decoder must not resynchronize");
		Assertions.assertEquals(1, decoder.poll().get("id").getAsInt(),
				"Messages decoded before the fault stay available");
		Assertions.assertNull(decoder.poll());
	}
}
