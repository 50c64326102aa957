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

import java.util.Collections;

import org.eclipse.lsp4j.jsonrpc.json.MessageJsonHandler;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Gson configured with lsp4j's type adapters (enums as numbers,
 * {@code Either} unions, ...), for converting between lsp4j types and the
 * JSON trees the protocol session works with.
 */
public final class LspGson {

    private static final Gson GSON = new MessageJsonHandler(Collections.emptyMap()).getGson();

    private LspGson() {
    }

    public static Gson get() {
        return GSON;
    }

    public static JsonObject toJsonObject(Object lspValue) {
        return GSON.toJsonTree(lspValue).getAsJsonObject();
    }

    public static <T> T fromJson(JsonElement json, Class<T> type) {
        return GSON.fromJson(json, type);
    }
}
