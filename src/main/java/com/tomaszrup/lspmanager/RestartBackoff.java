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
package com.tomaszrup.lspmanager;

import java.time.Duration;

/**
 * Exponential respawn delay: {@code base * 2^(crashes - 1)}, capped.
 */
public final class RestartBackoff {

    private final long baseMillis;
    private final long capMillis;

    public RestartBackoff(Duration base, Duration cap) {
        this.baseMillis = Math.max(0, base.toMillis());
        this.capMillis = Math.max(baseMillis, cap.toMillis());
    }

    /**
     * @param consecutiveCrashes crashes since the session was last ready
     */
    public Duration delayFor(int consecutiveCrashes) {
        if (consecutiveCrashes <= 0 || baseMillis == 0) {
            return Duration.ZERO;
        }
        int shift = Math.min(consecutiveCrashes - 1, 62);
        if (baseMillis > (capMillis >> shift)) {
            return Duration.ofMillis(capMillis);
        }
        return Duration.ofMillis(Math.min(capMillis, baseMillis << shift));
    }
}
