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
package com.tomaszrup.lspmanager.protocol;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;

/**
 * A notification pushed by the language server.
 */
public final class ServerNotification {

    private final String method;
    private final JsonElement params;
    private final long receivedAtMillis;

    public ServerNotification(String method, JsonElement params, long receivedAtMillis) {
        this.method = method;
        this.params = params != null ? params : JsonNull.INSTANCE;
        this.receivedAtMillis = receivedAtMillis;
    }

    public String getMethod() {
        return method;
    }

    public JsonElement getParams() {
        return params;
    }

    public long getReceivedAtMillis() {
        return receivedAtMillis;
    }

    @Override
    public String toString() {
        return "ServerNotification{" + method + "}";
    }
}
