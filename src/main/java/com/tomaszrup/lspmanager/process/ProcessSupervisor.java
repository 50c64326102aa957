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
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lspmanager.LanguageServerException;
import com.tomaszrup.lspmanager.project.ProjectKey;

/**
 * Sole owner of one language server process.
 *
 * <p>Standard input and output carry the protocol; standard error is drained
 * on the I/O pool into the debug log so the child never blocks on a full
 * pipe. {@link #exitSignal()} completes once, with the exit code, however
 * the process ends.</p>
 */
public class ProcessSupervisor {

    private static final Logger logger = LoggerFactory.getLogger(ProcessSupervisor.class);

    /** How long to wait for the OS to reap a forcibly killed process. */
    private static final long REAP_TIMEOUT_SECONDS = 10;

    private final ProjectKey key;
    private final Process process;
    private final CompletableFuture<Integer> exitSignal;

    private ProcessSupervisor(ProjectKey key, Process process) {
        this.key = key;
        this.process = process;
        this.exitSignal = process.onExit().thenApply(Process::exitValue);
    }

    /**
     * Starts {@code command} in {@code workingDirectory}.
     *
     * @throws LanguageServerException {@code BINARY_NOT_FOUND} when the
     *         executable cannot be located, {@code SPAWN_FAILED} for any
     *         other launch error
     */
    public static ProcessSupervisor spawn(ProjectKey key, List<String> command, Path workingDirectory,
            ExecutableLocator locator, ExecutorService ioPool) {
        if (command.isEmpty()) {
            throw new LanguageServerException(LanguageServerException.Kind.SPAWN_FAILED, key,
                    "Empty server command line");
        }
        String executable = command.get(0);
        Path resolved = locator.locate(executable).orElseThrow(() -> new LanguageServerException(
                LanguageServerException.Kind.BINARY_NOT_FOUND, key,
                "Language server executable '" + executable + "' not found on PATH"));

        List<String> resolvedCommand = new ArrayList<>(command);
        resolvedCommand.set(0, resolved.toString());
        ProcessBuilder builder = new ProcessBuilder(resolvedCommand)
                .directory(workingDirectory.toFile())
                .redirectInput(ProcessBuilder.Redirect.PIPE)
                .redirectOutput(ProcessBuilder.Redirect.PIPE)
                .redirectError(ProcessBuilder.Redirect.PIPE);

        Process process;
        try {
            process = builder.start();
        } catch (IOException | SecurityException e) {
            throw new LanguageServerException(LanguageServerException.Kind.SPAWN_FAILED, key,
                    "Could not start " + resolved + ": " + e.getMessage(), e);
        }
        logger.info("Started {} (pid {}) in {}", resolved.getFileName(), process.pid(), workingDirectory);

        ProcessSupervisor supervisor = new ProcessSupervisor(key, process);
        ioPool.execute(supervisor::drainStderr);
        return supervisor;
    }

    public InputStream getInputStream() {
        return process.getInputStream();
    }

    public OutputStream getOutputStream() {
        return process.getOutputStream();
    }

    public long pid() {
        return process.pid();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /** Completes with the exit code when the process ends for any reason. */
    public CompletableFuture<Integer> exitSignal() {
        return exitSignal;
    }

    /**
     * Asks the process to exit, waits up to {@code gracePeriod}, then kills
     * it and its descendants. Returns once the process has been reaped.
     *
     * @return true if the process exited within the grace period
     */
    public boolean terminate(Duration gracePeriod) {
        if (!process.isAlive()) {
            awaitReaped();
            return true;
        }
        process.destroy();
        boolean graceful = false;
        try {
            graceful = process.waitFor(Math.max(0, gracePeriod.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!graceful) {
            logger.warn("Process {} did not exit within {} ms, killing it", process.pid(), gracePeriod.toMillis());
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
        awaitReaped();
        return graceful;
    }

    private void awaitReaped() {
        boolean interrupted = false;
        try {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(REAP_TIMEOUT_SECONDS);
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    logger.error("Process {} still running after kill", process.pid());
                    return;
                }
                try {
                    if (process.waitFor(remaining, TimeUnit.NANOSECONDS)) {
                        return;
                    }
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void drainStderr() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                logger.debug("[{} stderr] {}", key.label(), line);
            }
        } catch (IOException e) {
            logger.trace("stderr of pid {} closed: {}", process.pid(), e.getMessage());
        }
    }
}
