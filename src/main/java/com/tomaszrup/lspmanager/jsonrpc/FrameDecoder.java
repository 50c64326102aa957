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
import java.util.ArrayDeque;
import java.util.Deque;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Incremental decoder for {@code Content-Length} framed JSON messages.
 *
 * <p>Bytes are pushed in with {@link #feed(byte[], int, int)} in whatever
 * chunks the underlying stream delivers; complete messages are taken out
 * with {@link #poll()}. Partial headers and bodies are buffered across
 * calls. Exactly {@code Content-Length} bytes are consumed as the body.</p>
 *
 * <p>Any malformed input puts the decoder into a permanent fault state: the
 * current and every later {@code feed} call throws
 * {@link FramingFaultException}. Messages decoded before the fault remain
 * available from {@link #poll()}.</p>
 *
 * <p>Not thread-safe; owned by a single decode loop.</p>
 */
public final class FrameDecoder {

    /** Upper bound on a header block; anything longer is not a real header. */
    static final int MAX_HEADER_BYTES = 8192;

    private static final byte[] SEPARATOR = MessageCodec.HEADER_SEPARATOR.getBytes(StandardCharsets.US_ASCII);

    private byte[] buffer = new byte[8192];
    private int start;
    private int end;
    /** Body length of the frame being read, or -1 while reading a header. */
    private int contentLength = -1;
    private FramingFaultException fault;
    private final Deque<JsonObject> decoded = new ArrayDeque<>();

    public void feed(byte[] data, int offset, int length) throws FramingFaultException {
        if (fault != null) {
            throw fault;
        }
        append(data, offset, length);
        try {
            drainFrames();
        } catch (FramingFaultException e) {
            fault = e;
            start = 0;
            end = 0;
            throw e;
        }
    }

    public void feed(byte[] data) throws FramingFaultException {
        feed(data, 0, data.length);
    }

    /** Returns the next complete message, or null if none is buffered. */
    public JsonObject poll() {
        return decoded.poll();
    }

    /** True when some bytes of an unfinished frame are buffered. */
    public boolean hasPartialFrame() {
        return end > start || contentLength >= 0;
    }

    public boolean isFaulted() {
        return fault != null;
    }

    private void drainFrames() throws FramingFaultException {
        while (true) {
            if (contentLength < 0) {
                int separatorAt = indexOfSeparator();
                if (separatorAt < 0) {
                    if (end - start > MAX_HEADER_BYTES) {
                        throw new FramingFaultException("Header block exceeds " + MAX_HEADER_BYTES + " bytes");
                    }
                    return;
                }
                if (separatorAt - start > MAX_HEADER_BYTES) {
                    throw new FramingFaultException("Header block exceeds " + MAX_HEADER_BYTES + " bytes");
                }
                String header = new String(buffer, start, separatorAt - start, StandardCharsets.US_ASCII);
                contentLength = parseContentLength(header);
                start = separatorAt + SEPARATOR.length;
            }
            if (end - start < contentLength) {
                return;
            }
            String body = new String(buffer, start, contentLength, StandardCharsets.UTF_8);
            start += contentLength;
            contentLength = -1;
            decoded.add(parseBody(body));
            if (start == end) {
                start = 0;
                end = 0;
            }
        }
    }

    static int parseContentLength(String header) throws FramingFaultException {
        Integer length = null;
        for (String line : header.split("\r\n", -1)) {
            if (line.isEmpty()) {
                throw new FramingFaultException("Empty line inside header block");
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new FramingFaultException("Malformed header line: " + abbreviate(line));
            }
            String name = line.substring(0, colon).trim();
            if (!MessageCodec.CONTENT_LENGTH.equalsIgnoreCase(name)) {
                // Content-Type and friends are accepted and ignored
                continue;
            }
            if (length != null) {
                throw new FramingFaultException("Duplicate Content-Length header");
            }
            String value = line.substring(colon + 1).trim();
            try {
                length = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new FramingFaultException("Invalid Content-Length: " + abbreviate(value), e);
            }
            if (length < 0) {
                throw new FramingFaultException("Negative Content-Length: " + length);
            }
        }
        if (length == null) {
            throw new FramingFaultException("Header block without Content-Length");
        }
        return length;
    }

    private static JsonObject parseBody(String body) throws FramingFaultException {
        JsonElement element;
        try {
            element = JsonParser.parseString(body);
        } catch (JsonParseException e) {
            throw new FramingFaultException("Body is not valid JSON", e);
        }
        if (element == null || !element.isJsonObject()) {
            throw new FramingFaultException("Body is not a JSON object: " + abbreviate(body));
        }
        return element.getAsJsonObject();
    }

    private int indexOfSeparator() {
        outer:
        for (int i = start; i <= end - SEPARATOR.length; i++) {
            for (int j = 0; j < SEPARATOR.length; j++) {
                if (buffer[i + j] != SEPARATOR[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private void append(byte[] data, int offset, int length) {
        if (end + length > buffer.length) {
            int live = end - start;
            if (live + length <= buffer.length) {
                System.arraycopy(buffer, start, buffer, 0, live);
            } else {
                byte[] grown = new byte[Math.max(buffer.length * 2, live + length)];
                System.arraycopy(buffer, start, grown, 0, live);
                buffer = grown;
            }
            start = 0;
            end = live;
        }
        System.arraycopy(data, offset, buffer, end, length);
        end += length;
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }
}
