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
package com.tomaszrup.lspmanager.cache;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Which methods are cached and for how long.
 */
public final class CachePolicy {

    private final Map<String, Duration> ttls;

    private CachePolicy(Map<String, Duration> ttls) {
        this.ttls = ttls;
    }

    public static CachePolicy defaults() {
        Map<String, Duration> ttls = new HashMap<>();
        ttls.put("textDocument/hover", Duration.ofSeconds(60));
        ttls.put("textDocument/completion", Duration.ofSeconds(30));
        ttls.put("textDocument/documentSymbol", Duration.ofSeconds(600));
        ttls.put("workspace/symbol", Duration.ofSeconds(600));
        ttls.put("textDocument/diagnostic", Duration.ofSeconds(300));
        return new CachePolicy(ttls);
    }

    public static CachePolicy none() {
        return new CachePolicy(new HashMap<>());
    }

    public CachePolicy with(String method, Duration ttl) {
        Map<String, Duration> copy = new HashMap<>(ttls);
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            copy.remove(method);
        } else {
            copy.put(method, ttl);
        }
        return new CachePolicy(copy);
    }

    public Optional<Duration> ttlFor(String method) {
        return Optional.ofNullable(ttls.get(method));
    }

    public boolean isCacheable(String method) {
        return ttls.containsKey(method);
    }
}
