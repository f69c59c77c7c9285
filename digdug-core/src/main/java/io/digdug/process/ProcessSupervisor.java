/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.digdug.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Spawns tunnel executables, waits for them to become ready and tears them down.
 * <p>
 * Readiness is a race between the {@link ReadinessMatcher} (fed with every output line and,
 * for polling matchers, probed every {@link #POLL_INTERVAL}), the exit of the process and the
 * startup timeout. Whatever happens first decides the outcome; the other watchers are detached
 * before {@link #awaitReady} returns. A process that times out or reports a failure is always
 * terminated before the error is thrown.
 */
public class ProcessSupervisor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ProcessSupervisor.class);

    public static final Duration POLL_INTERVAL = Duration.ofMillis(250);

    private final Duration gracePeriod;
    private final ScheduledExecutorService scheduler;

    public ProcessSupervisor(Duration gracePeriod) {
        this.gracePeriod = gracePeriod;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "digdug-ready-probe");
            thread.setDaemon(true);
            return thread;
        });
    }

    public Duration getGracePeriod() {
        return gracePeriod;
    }

    // ========== Spawn ==========

    /**
     * Start the executable. The listener sees every output line from the first one on.
     *
     * @throws SpawnException if the executable is missing or cannot be executed
     */
    public ProcessHandle spawn(String executable, List<String> args, Path workingDir,
                               Map<String, String> env, Consumer<ProcessEvent> listener) {
        ProcessConfig config = ProcessBuilder.create()
                .executable(executable)
                .addArgs(args)
                .workingDir(workingDir)
                .env(env == null ? Map.of() : env)
                .listener(listener)
                .build();
        ProcessHandle handle = ProcessHandle.start(config);
        logger.debug("spawned pid {}: {}", handle.getPid(), executable);
        return handle;
    }

    public ProcessHandle spawn(String executable, List<String> args, Path workingDir) {
        return spawn(executable, args, workingDir, Map.of(), null);
    }

    // ========== Readiness ==========

    /**
     * Block until the matcher reports ready.
     *
     * @throws ReadyTimeoutException if the timeout elapses first, the process is terminated
     * @throws ProcessExitException  if the process exits or the matcher reports a failure
     * @throws InterruptedException  if the waiting thread is interrupted; the process is left
     *                               running for the caller to tear down
     */
    public void awaitReady(ProcessHandle handle, ReadinessMatcher matcher, Duration timeout) throws InterruptedException {
        CompletableFuture<Readiness> outcome = new CompletableFuture<>();
        Consumer<ProcessEvent> listener = event -> {
            if (event.isExit()) {
                outcome.completeExceptionally(exitError(handle, event.exitCode()));
            } else {
                complete(outcome, matcher.onEvent(event));
            }
        };
        handle.onEvent(listener);
        ScheduledFuture<?> probe = null;
        try {
            replayBuffered(handle, matcher, outcome);
            if (handle.getExitFuture().isDone() && !outcome.isDone()) {
                outcome.completeExceptionally(exitError(handle, handle.getExitCode()));
            }
            complete(outcome, matcher.poll());
            if (matcher.isPolling() && !outcome.isDone()) {
                long interval = POLL_INTERVAL.toMillis();
                probe = scheduler.scheduleWithFixedDelay(() -> {
                    try {
                        complete(outcome, matcher.poll());
                    } catch (RuntimeException e) {
                        logger.debug("readiness probe error: {}", e.getMessage());
                    }
                }, interval, interval, TimeUnit.MILLISECONDS);
            }
            Readiness result;
            try {
                result = outcome.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                handle.transition(ProcessState.SPAWNED, ProcessState.TIMED_OUT);
                ReadyTimeoutException error = new ReadyTimeoutException(timeout);
                terminate(handle, error);
                throw error;
            } catch (ExecutionException e) {
                handle.transition(ProcessState.SPAWNED, ProcessState.FAILED);
                throw (ProcessExitException) e.getCause();
            }
            if (result.isFailed()) {
                handle.transition(ProcessState.SPAWNED, ProcessState.FAILED);
                ProcessExitException error = new ProcessExitException(result.message());
                terminate(handle, error);
                throw error;
            }
            handle.transition(ProcessState.SPAWNED, ProcessState.READY);
            logger.debug("pid {} is ready", handle.getPid());
        } finally {
            handle.removeListener(listener);
            if (probe != null) {
                probe.cancel(false);
            }
            outcome.cancel(false);
        }
    }

    private static void complete(CompletableFuture<Readiness> outcome, Readiness readiness) {
        if (!readiness.isPending()) {
            outcome.complete(readiness);
        }
    }

    // lines read before the listener was attached
    private static void replayBuffered(ProcessHandle handle, ReadinessMatcher matcher, CompletableFuture<Readiness> outcome) {
        for (String line : handle.getSysOut().split("\n")) {
            if (!line.isEmpty()) {
                complete(outcome, matcher.onEvent(ProcessEvent.stdout(line)));
            }
        }
        for (String line : handle.getSysErr().split("\n")) {
            if (!line.isEmpty()) {
                complete(outcome, matcher.onEvent(ProcessEvent.stderr(line)));
            }
        }
    }

    private static ProcessExitException exitError(ProcessHandle handle, Integer exitCode) {
        String output = handle.getSysErr();
        if (output.isBlank()) {
            output = handle.getSysOut();
        }
        return new ProcessExitException(exitCode == null ? -1 : exitCode, output);
    }

    private void terminate(ProcessHandle handle, Exception primary) {
        try {
            handle.terminate(gracePeriod);
        } catch (RuntimeException e) {
            primary.addSuppressed(e);
        }
    }

    // ========== Termination ==========

    /**
     * Graceful stop, then forced after the grace period.
     *
     * @return the exit code
     */
    public int terminate(ProcessHandle handle, Duration gracePeriod) {
        int code = handle.terminate(gracePeriod);
        logger.debug("pid {} terminated with exit code {}", handle.getPid(), code);
        return code;
    }

    public int terminate(ProcessHandle handle) {
        return terminate(handle, gracePeriod);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

}
