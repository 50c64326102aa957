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
package com.tomaszrup.lspmanager.util;

import java.util.Map;

import org.slf4j.MDC;

import com.tomaszrup.lspmanager.project.ProjectKey;

/**
 * Manages the SLF4J MDC key {@code "project"} so that every log line
 * written on behalf of a session names it (for example
 * {@code billing-service:java}).
 *
 * <pre>{@code
 * MdcProjectContext.setProject(key);
 * try {
 *     // log calls here include [billing-service:java]
 * } finally {
 *     MdcProjectContext.clear();
 * }
 * }</pre>
 *
 * <p>Use {@link #wrap(Runnable)} to carry the caller's context into a pool
 * thread.</p>
 */
public final class MdcProjectContext {

    /** MDC key used in the logback pattern via {@code %X{project}}. */
    public static final String MDC_KEY = "project";

    private MdcProjectContext() {
        // utility class
    }

    public static void setProject(ProjectKey key) {
        MDC.put(MDC_KEY, key != null ? key.label() : "default");
    }

    public static void clear() {
        MDC.remove(MDC_KEY);
    }

    /**
     * @return the current MDC context map, or null if empty
     */
    public static Map<String, String> snapshot() {
        return MDC.getCopyOfContextMap();
    }

    /**
     * @param contextMap the context map to restore (may be null)
     */
    public static void restore(Map<String, String> contextMap) {
        if (contextMap != null) {
            MDC.setContextMap(contextMap);
        } else {
            MDC.clear();
        }
    }

    /**
     * Captures the current thread's MDC and installs it around the task in
     * the executing thread, restoring that thread's own context afterwards.
     */
    public static Runnable wrap(Runnable task) {
        Map<String, String> callerContext = snapshot();
        return () -> {
            Map<String, String> previousContext = snapshot();
            restore(callerContext);
            try {
                task.run();
            } finally {
                restore(previousContext);
            }
        };
    }

    /**
     * Runs {@code task} with the MDC set to {@code key}, restoring the prior
     * context afterwards.
     */
    public static void runAs(ProjectKey key, Runnable task) {
        Map<String, String> previous = snapshot();
        setProject(key);
        try {
            task.run();
        } finally {
            restore(previous);
        }
    }
}
