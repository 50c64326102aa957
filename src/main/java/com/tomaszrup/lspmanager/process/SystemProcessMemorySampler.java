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
package com.tomaszrup.lspmanager.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Samples resident memory from {@code /proc/<pid>/status} where available,
 * falling back to {@code ps -o rss=}. Child processes of the server (jdtls
 * and friends fork helpers) are included in the total.
 */
public class SystemProcessMemorySampler implements ProcessMemorySampler {

    private static final Logger logger = LoggerFactory.getLogger(SystemProcessMemorySampler.class);

    private static final Path PROC = Paths.get("/proc");

    @Override
    public OptionalLong residentBytes(long pid) {
        OptionalLong own = sampleOne(pid);
        if (own.isEmpty()) {
            return own;
        }
        long total = own.getAsLong();
        List<ProcessHandle> descendants = ProcessHandle.of(pid)
                .map(h -> h.descendants().toList())
                .orElse(List.of());
        for (ProcessHandle child : descendants) {
            total += sampleOne(child.pid()).orElse(0L);
        }
        return OptionalLong.of(total);
    }

    private OptionalLong sampleOne(long pid) {
        Path status = PROC.resolve(Long.toString(pid)).resolve("status");
        if (Files.isReadable(status)) {
            try {
                for (String line : Files.readAllLines(status, StandardCharsets.US_ASCII)) {
                    if (line.startsWith("VmRSS:")) {
                        return OptionalLong.of(parseKilobytes(line.substring("VmRSS:".length())) * 1024L);
                    }
                }
                // kernel threads and zombies have no VmRSS
                return OptionalLong.empty();
            } catch (IOException | NumberFormatException e) {
                logger.debug("Could not read {}: {}", status, e.getMessage());
            }
        }
        return sampleWithPs(pid);
    }

    private OptionalLong sampleWithPs(long pid) {
        try {
            Process ps = new ProcessBuilder("ps", "-o", "rss=", "-p", Long.toString(pid))
                    .redirectErrorStream(true)
                    .start();
            String output;
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(ps.getInputStream(), StandardCharsets.US_ASCII))) {
                output = reader.readLine();
            }
            if (!ps.waitFor(5, TimeUnit.SECONDS)) {
                ps.destroyForcibly();
                return OptionalLong.empty();
            }
            if (ps.exitValue() != 0 || output == null || output.isBlank()) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(parseKilobytes(output) * 1024L);
        } catch (IOException | NumberFormatException e) {
            logger.debug("ps sampling failed for pid {}: {}", pid, e.getMessage());
            return OptionalLong.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OptionalLong.empty();
        }
    }

    static long parseKilobytes(String value) {
        String trimmed = value.trim();
        if (trimmed.endsWith("kB")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2).trim();
        }
        return Long.parseLong(trimmed);
    }
}
