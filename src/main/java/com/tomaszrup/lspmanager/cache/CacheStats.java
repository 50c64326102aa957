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

/**
 * Point-in-time counters of a {@link ResponseCache}.
 */
public final class CacheStats {

    private final int size;
    private final long hits;
    private final long misses;
    private final long evictions;
    private final long invalidations;
    private final long rejectedStores;

    CacheStats(int size, long hits, long misses, long evictions, long invalidations, long rejectedStores) {
        this.size = size;
        this.hits = hits;
        this.misses = misses;
        this.evictions = evictions;
        this.invalidations = invalidations;
        this.rejectedStores = rejectedStores;
    }

    public int getSize() {
        return size;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public long getEvictions() {
        return evictions;
    }

    public long getInvalidations() {
        return invalidations;
    }

    /** Stores refused because a write was observed while the request ran. */
    public long getRejectedStores() {
        return rejectedStores;
    }

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    @Override
    public String toString() {
        return String.format("CacheStats{size=%d, hits=%d, misses=%d, hitRate=%.1f%%, evictions=%d, invalidations=%d}",
                size, hits, misses, hitRate() * 100, evictions, invalidations);
    }
}
