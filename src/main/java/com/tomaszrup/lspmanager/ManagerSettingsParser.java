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
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Builds {@link ManagerSettings} from environment variables and a JSON
 * options object. Options win over the environment; both start from the
 * defaults. Malformed or out-of-range values are logged and skipped.
 */
public final class ManagerSettingsParser {

    private static final Logger logger = LoggerFactory.getLogger(ManagerSettingsParser.class);

    static final String ENV_TIMEOUT = "LSP_TIMEOUT";
    static final String ENV_IDLE_TIMEOUT = "LSP_IDLE_TIMEOUT";
    static final String ENV_CHECK_INTERVAL = "LSP_CHECK_INTERVAL";
    static final String ENV_ENABLE_IDLE_MONITOR = "LSP_ENABLE_IDLE_MONITOR";
    static final String ENV_MAX_SESSIONS = "LSP_MAX_SESSIONS";
    static final String ENV_MEMORY_THRESHOLD_MB = "LSP_MEMORY_THRESHOLD_MB";

    static final String REQUEST_TIMEOUT_OPTION = "requestTimeoutSeconds";
    static final String HANDSHAKE_TIMEOUT_OPTION = "handshakeTimeoutSeconds";
    static final String IDLE_TIMEOUT_OPTION = "idleTimeoutSeconds";
    static final String IDLE_CHECK_INTERVAL_OPTION = "idleCheckIntervalSeconds";
    static final String IDLE_MONITOR_OPTION = "idleMonitorEnabled";
    static final String SHUTDOWN_TIMEOUT_OPTION = "shutdownTimeoutSeconds";
    static final String BACKOFF_BASE_OPTION = "backoffBaseMillis";
    static final String BACKOFF_CAP_OPTION = "backoffCapMillis";
    static final String MEMORY_THRESHOLD_OPTION = "memoryThresholdMb";
    static final String RESOURCE_CHECK_INTERVAL_OPTION = "resourceCheckIntervalSeconds";
    static final String RESOURCE_MONITOR_OPTION = "resourceMonitorEnabled";
    static final String MAX_LIVE_SESSIONS_OPTION = "maxLiveSessions";
    static final String MAX_IN_FLIGHT_OPTION = "maxInFlightPerSession";
    static final String SETTLE_DELAY_OPTION = "settleDelayMillis";
    static final String CACHE_CAPACITY_OPTION = "cacheCapacity";
    static final String LOG_LEVEL_OPTION = "logLevel";

    private static final long MB = 1024L * 1024;

    private ManagerSettingsParser() {
        // utility class
    }

    public static ManagerSettings fromEnvironment() {
        return parse(System.getenv(), null);
    }

    /**
     * @param env environment variables (may be null)
     * @param options JSON options object (may be null)
     */
    public static ManagerSettings parse(Map<String, String> env, JsonObject options) {
        ManagerSettings.Builder builder = ManagerSettings.builder();
        if (env != null) {
            applyEnvironment(env, builder);
        }
        if (options != null) {
            applyOptions(options, builder);
        }
        ManagerSettings settings = builder.build();
        logger.debug("Effective settings: {}", settings);
        return settings;
    }

    static void applyEnvironment(Map<String, String> env, ManagerSettings.Builder builder) {
        envLong(env, ENV_TIMEOUT, 1, v -> builder.requestTimeout(Duration.ofSeconds(v)));
        envLong(env, ENV_IDLE_TIMEOUT, 1, v -> builder.idleTimeout(Duration.ofSeconds(v)));
        envLong(env, ENV_CHECK_INTERVAL, 1, v -> builder.idleCheckInterval(Duration.ofSeconds(v)));
        envLong(env, ENV_MAX_SESSIONS, 1, v -> builder.maxLiveSessions((int) Math.min(v, Integer.MAX_VALUE)));
        envLong(env, ENV_MEMORY_THRESHOLD_MB, 1, v -> builder.memoryThresholdBytes(v * MB));
        String idleMonitor = env.get(ENV_ENABLE_IDLE_MONITOR);
        if (idleMonitor != null) {
            Boolean enabled = parseBoolean(idleMonitor);
            if (enabled == null) {
                logger.warn("Ignoring {}='{}': expected true or false", ENV_ENABLE_IDLE_MONITOR, idleMonitor);
            } else {
                builder.idleMonitorEnabled(enabled);
            }
        }
    }

    static void applyOptions(JsonObject opts, ManagerSettings.Builder builder) {
        applyLogLevelOption(opts);
        optLong(opts, REQUEST_TIMEOUT_OPTION, 1, v -> builder.requestTimeout(Duration.ofSeconds(v)));
        optLong(opts, HANDSHAKE_TIMEOUT_OPTION, 1, v -> builder.handshakeTimeout(Duration.ofSeconds(v)));
        optLong(opts, IDLE_TIMEOUT_OPTION, 1, v -> builder.idleTimeout(Duration.ofSeconds(v)));
        optLong(opts, IDLE_CHECK_INTERVAL_OPTION, 1, v -> builder.idleCheckInterval(Duration.ofSeconds(v)));
        optBoolean(opts, IDLE_MONITOR_OPTION, builder::idleMonitorEnabled);
        optLong(opts, SHUTDOWN_TIMEOUT_OPTION, 0, v -> builder.shutdownTimeout(Duration.ofSeconds(v)));

        ManagerSettings current = builder.build();
        long[] backoff = {
                current.getRestartBackoffBase().toMillis(),
                current.getRestartBackoffCap().toMillis()
        };
        optLong(opts, BACKOFF_BASE_OPTION, 0, v -> backoff[0] = v);
        optLong(opts, BACKOFF_CAP_OPTION, 0, v -> backoff[1] = v);
        builder.restartBackoff(Duration.ofMillis(backoff[0]), Duration.ofMillis(Math.max(backoff[0], backoff[1])));

        optLong(opts, MEMORY_THRESHOLD_OPTION, 1, v -> builder.memoryThresholdBytes(v * MB));
        optLong(opts, RESOURCE_CHECK_INTERVAL_OPTION, 1, v -> builder.resourceCheckInterval(Duration.ofSeconds(v)));
        optBoolean(opts, RESOURCE_MONITOR_OPTION, builder::resourceMonitorEnabled);
        optLong(opts, MAX_LIVE_SESSIONS_OPTION, 1, v -> builder.maxLiveSessions((int) Math.min(v, Integer.MAX_VALUE)));
        optLong(opts, MAX_IN_FLIGHT_OPTION, 1, v -> builder.maxInFlightPerSession((int) Math.min(v, Integer.MAX_VALUE)));
        optLong(opts, SETTLE_DELAY_OPTION, 0, v -> builder.settleDelay(Duration.ofMillis(v)));
        optLong(opts, CACHE_CAPACITY_OPTION, 1, v -> builder.cacheCapacity((int) Math.min(v, Integer.MAX_VALUE)));
    }

    private static void applyLogLevelOption(JsonObject opts) {
        if (opts.has(LOG_LEVEL_OPTION) && opts.get(LOG_LEVEL_OPTION).isJsonPrimitive()) {
            applyLogLevel(opts.get(LOG_LEVEL_OPTION).getAsString());
        }
    }

    /**
     * Sets the level of the {@code com.tomaszrup.lspmanager} logger.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     *
     * @return true if the level was applied
     */
    static boolean applyLogLevel(String levelName) {
        ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
        if (level == null) {
            logger.warn("Unknown log level '{}', keeping current level", levelName);
            return false;
        }
        org.slf4j.Logger target = LoggerFactory.getLogger("com.tomaszrup.lspmanager");
        if (!(target instanceof ch.qos.logback.classic.Logger)) {
            logger.warn("Logging backend is not logback, cannot set level '{}'", levelName);
            return false;
        }
        ch.qos.logback.classic.Logger packageLogger = (ch.qos.logback.classic.Logger) target;
        ch.qos.logback.classic.Level previous = packageLogger.getLevel();
        packageLogger.setLevel(level);
        logger.info("Log level changed from {} to {}", previous, level);
        return true;
    }

    private static void envLong(Map<String, String> env, String name, long min, Consumer<Long> target) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < min) {
                logger.warn("Ignoring {}={}: must be at least {}", name, value, min);
                return;
            }
            target.accept(value);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring {}='{}': not a number", name, raw);
        }
    }

    private static void optLong(JsonObject opts, String name, long min, Consumer<Long> target) {
        JsonElement element = opts.get(name);
        if (element == null || !element.isJsonPrimitive()) {
            return;
        }
        try {
            long value = element.getAsLong();
            if (value < min) {
                logger.warn("Ignoring option {}={}: must be at least {}", name, value, min);
                return;
            }
            target.accept(value);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring option {}='{}': not a number", name, element.getAsString());
        }
    }

    private static void optBoolean(JsonObject opts, String name, Consumer<Boolean> target) {
        JsonElement element = opts.get(name);
        if (element == null || !element.isJsonPrimitive()) {
            return;
        }
        Boolean value = parseBoolean(element.getAsString());
        if (value == null) {
            logger.warn("Ignoring option {}='{}': expected true or false", name, element.getAsString());
            return;
        }
        target.accept(value);
    }

    private static Boolean parseBoolean(String raw) {
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
                return Boolean.TRUE;
            case "false":
            case "0":
            case "no":
                return Boolean.FALSE;
            default:
                return null;
        }
    }
}
