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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

/**
 * Encodes JSON-RPC messages into the {@code Content-Length} framing used on
 * the language server's standard streams.
 *
 * <p>The body is compact JSON in UTF-8. The header counts body bytes, not
 * characters, and is followed by exactly one blank line.</p>
 */
public final class MessageCodec {

    static final String CONTENT_LENGTH = "Content-Length";
    static final String HEADER_SEPARATOR = "\r\n\r\n";

    // Null members are significant on the wire ("result": null).
    private static final Gson WIRE_GSON = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private MessageCodec() {
    }

    public static byte[] encode(JsonObject message) {
        return encodeBody(WIRE_GSON.toJson(message));
    }

    /**
     * Frames an already serialized body. Exposed for tests and for the
     * fake servers that need to emit raw bodies.
     */
    public static byte[] encodeBody(String body) {
        byte[] payload = body.getBytes(StandardCharsets.UTF_8);
        byte[] header = (CONTENT_LENGTH + ": " + payload.length + HEADER_SEPARATOR)
                .getBytes(StandardCharsets.US_ASCII);
        byte[] frame = new byte[header.length + payload.length];
        System.arraycopy(header, 0, frame, 0, header.length);
        System.arraycopy(payload, 0, frame, header.length, payload.length);
        return frame;
    }

    public static Gson wireGson() {
        return WIRE_GSON;
    }
}
