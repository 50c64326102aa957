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

import java.io.IOException;
import java.io.InputStream;

import com.google.gson.JsonObject;

/**
 * Pull-style view over a framed input stream. Bytes read past the end of
 * one message stay buffered for the next call.
 */
public final class MessageReader {

    private final InputStream input;
    private final FrameDecoder decoder = new FrameDecoder();
    private final byte[] chunk = new byte[8192];

    public MessageReader(InputStream input) {
        this.input = input;
    }

    /**
     * Blocks until the next message is available.
     *
     * @return the next message, or null when the stream ended cleanly
     *         between frames
     * @throws FramingFaultException if the stream is malformed or ends
     *         inside a frame
     * @throws IOException if the underlying read fails
     */
    public JsonObject read() throws IOException {
        while (true) {
            JsonObject message = decoder.poll();
            if (message != null) {
                return message;
            }
            int n = input.read(chunk);
            if (n < 0) {
                if (decoder.hasPartialFrame()) {
                    throw new FramingFaultException("Stream ended in the middle of a frame");
                }
                return null;
            }
            if (n > 0) {
                decoder.feed(chunk, 0, n);
            }
        }
    }
}
