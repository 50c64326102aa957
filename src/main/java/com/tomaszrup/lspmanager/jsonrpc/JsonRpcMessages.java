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

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Builders and classifiers for JSON-RPC 2.0 message objects.
 */
public final class JsonRpcMessages {

    public static final String VERSION = "2.0";

    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INTERNAL_ERROR = -32603;

    private JsonRpcMessages() {
    }

    public static JsonObject request(long id, String method, JsonElement params) {
        JsonObject message = base();
        message.addProperty("id", id);
        message.addProperty("method", method);
        if (params != null && !params.isJsonNull()) {
            message.add("params", params);
        }
        return message;
    }

    public static JsonObject notification(String method, JsonElement params) {
        JsonObject message = base();
        message.addProperty("method", method);
        if (params != null && !params.isJsonNull()) {
            message.add("params", params);
        }
        return message;
    }

    public static JsonObject response(JsonElement id, JsonElement result) {
        JsonObject message = base();
        message.add("id", id);
        message.add("result", result != null ? result : JsonNull.INSTANCE);
        return message;
    }

    public static JsonObject errorResponse(JsonElement id, int code, String errorMessage) {
        JsonObject error = new JsonObject();
        error.addProperty("code", code);
        error.addProperty("message", errorMessage);
        JsonObject message = base();
        message.add("id", id);
        message.add("error", error);
        return message;
    }

    public static boolean hasId(JsonObject message) {
        return message.has("id") && !message.get("id").isJsonNull();
    }

    public static boolean isRequest(JsonObject message) {
        return message.has("method") && hasId(message);
    }

    public static boolean isNotification(JsonObject message) {
        return message.has("method") && !hasId(message);
    }

    public static boolean isResponse(JsonObject message) {
        return !message.has("method") && hasId(message);
    }

    /**
     * Reads a numeric correlation id. Ids we issue are always numbers, but
     * some servers echo them back as strings.
     *
     * @return the id, or -1 when it is not a number
     */
    public static long numericId(JsonObject message) {
        JsonElement id = message.get("id");
        if (id == null || !id.isJsonPrimitive()) {
            return -1;
        }
        JsonPrimitive primitive = id.getAsJsonPrimitive();
        try {
            if (primitive.isNumber()) {
                return primitive.getAsLong();
            }
            if (primitive.isString()) {
                return Long.parseLong(primitive.getAsString());
            }
        } catch (NumberFormatException e) {
            return -1;
        }
        return -1;
    }

    public static String method(JsonObject message) {
        JsonElement method = message.get("method");
        return method != null && method.isJsonPrimitive() ? method.getAsString() : null;
    }

    private static JsonObject base() {
        JsonObject message = new JsonObject();
        message.addProperty("jsonrpc", VERSION);
        return message;
    }
}
