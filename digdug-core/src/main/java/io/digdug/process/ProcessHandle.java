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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * A supervised native process.
 * Manages the process lifecycle, stream readers, and event dispatch.
 * Listeners given in the {@link ProcessConfig} see every line, including the first ones.
 * <p>
 * Output is read line by line on daemon threads and dispatched as soon as it is read.
 * The exit future completes only after both streams are drained, so the last lines
 * written before exit are always visible to listeners.
 */
public class ProcessHandle {

    private static final Logger logger = LoggerFactory.getLogger(ProcessHandle.class);
    private static final Logger OUTPUT = LoggerFactory.getLogger("digdug.process");

    // Captured output kept for error messages.
    private static final int BUFFER_LIMIT = 16 * 1024;

    private final ProcessConfig config;
    private Process process;
    private final CompletableFuture<Integer> exitFuture = new CompletableFuture<>();
    private final StringBuilder stdoutBuffer = new StringBuilder();
    private final StringBuilder stderrBuffer = new StringBuilder();
    private final AtomicReference<ProcessState> state = new AtomicReference<>();
    private final CopyOnWriteArrayList<Consumer<ProcessEvent>> eventListeners = new CopyOnWriteArrayList<>();

    private ExecutorService executor;
    private Thread shutdownHook;
    private volatile int exitCode = -1;

    private ProcessHandle(ProcessConfig config) {
        this.config = config;
    }

    /**
     * Launch the process described by the config.
     *
     * @throws SpawnException if the executable cannot be launched
     */
    public static ProcessHandle start(ProcessConfig config) {
        ProcessHandle handle = new ProcessHandle(config);
        handle.launch();
        return handle;
    }

    private void launch() {
        java.lang.ProcessBuilder pb = new java.lang.ProcessBuilder(config.args());
        if (config.workingDir() != null) {
            pb.directory(config.workingDir().toFile());
        }
        if (!config.env().isEmpty()) {
            pb.environment().putAll(config.env());
        }
        pb.redirectErrorStream(config.redirectErrorStream());
        logger.debug("starting process: {}", config.executable());
        try {
            this.process = pb.start();
        } catch (IOException e) {
            throw new SpawnException(config.executable(), e);
        }
        state.set(ProcessState.SPAWNED);
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r);
            thread.setDaemon(true);
            return thread;
        });
        registerShutdownHook();
        List<Future<?>> readers = startStreamReaders();
        startExitWaiter(readers);
    }

    /**
     * Add an event listener. Lines read before the call are not replayed.
     */
    public ProcessHandle onEvent(Consumer<ProcessEvent> listener) {
        eventListeners.add(listener);
        return this;
    }

    public void removeListener(Consumer<ProcessEvent> listener) {
        eventListeners.remove(listener);
    }

    private List<Future<?>> startStreamReaders() {
        List<Future<?>> readers = new ArrayList<>(2);
        readers.add(executor.submit(() -> readStream(process.getInputStream(), ProcessEvent.Type.STDOUT)));
        if (!config.redirectErrorStream()) {
            readers.add(executor.submit(() -> readStream(process.getErrorStream(), ProcessEvent.Type.STDERR)));
        }
        return readers;
    }

    private void readStream(InputStream stream, ProcessEvent.Type type) {
        Thread.currentThread().setName("process-" + type.name().toLowerCase() + "-reader");
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                handleLine(type, line);
            }
        } catch (IOException e) {
            if (isAlive()) {
                logger.warn("{} reader error: {}", type.name().toLowerCase(), e.getMessage());
            }
        }
    }

    private void startExitWaiter(List<Future<?>> readers) {
        executor.submit(() -> {
            Thread.currentThread().setName("process-exit-waiter");
            try {
                int code = process.waitFor();
                for (Future<?> reader : readers) {
                    try {
                        reader.get(1, TimeUnit.SECONDS);
                    } catch (Exception e) {
                        logger.debug("stream reader did not finish after exit: {}", e.toString());
                    }
                }
                exitCode = code;
                state.set(ProcessState.EXITED);
                removeShutdownHook();
                dispatchEvent(ProcessEvent.exit(code));
                exitFuture.complete(code);
                logger.debug("process exited with code: {}", code);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                exitFuture.completeExceptionally(e);
            } finally {
                executor.shutdown();
            }
        });
    }

    private void handleLine(ProcessEvent.Type type, String line) {
        StringBuilder buffer = (type == ProcessEvent.Type.STDOUT) ? stdoutBuffer : stderrBuffer;
        synchronized (buffer) {
            buffer.append(line).append('\n');
            if (buffer.length() > BUFFER_LIMIT) {
                buffer.delete(0, buffer.length() - BUFFER_LIMIT);
            }
        }
        OUTPUT.debug("[{}] {}", type.name().toLowerCase(), line);
        ProcessEvent event = (type == ProcessEvent.Type.STDOUT)
                ? ProcessEvent.stdout(line)
                : ProcessEvent.stderr(line);
        dispatchEvent(event);
    }

    private void dispatchEvent(ProcessEvent event) {
        if (config.listener() != null) {
            try {
                config.listener().accept(event);
            } catch (Exception e) {
                logger.warn("listener error: {}", e.getMessage());
            }
        }
        for (Consumer<ProcessEvent> listener : eventListeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                logger.warn("event listener error: {}", e.getMessage());
            }
        }
    }

    // ========== Shutdown Hook ==========

    private void registerShutdownHook() {
        Process p = process;
        shutdownHook = new Thread(() -> {
            if (p.isAlive()) {
                p.descendants().forEach(java.lang.ProcessHandle::destroyForcibly);
                p.destroyForcibly();
            }
        }, "process-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
    }

    private void removeShutdownHook() {
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            // jvm is already shutting down, the hook runs anyway
            logger.trace("shutdown hook not removed: {}", e.getMessage());
        }
    }

    // ========== State ==========

    public ProcessState getState() {
        return state.get();
    }

    /**
     * Move from {@code expected} to {@code next}. Returns false if the process is in another state,
     * which includes having exited in the meantime.
     */
    boolean transition(ProcessState expected, ProcessState next) {
        return state.compareAndSet(expected, next);
    }

    // ========== Termination ==========

    /**
     * Ask the process (and its descendants) to stop, then kill it if it is still alive after the grace period.
     * Always waits for the exit. Interruption does not abort the wait: the process is killed
     * forcibly instead and the interrupt flag is restored before returning.
     *
     * @return the exit code, or the already recorded one if the process had exited before
     */
    public int terminate(Duration gracePeriod) {
        if (process == null) {
            return -1;
        }
        ProcessState current;
        do {
            current = state.get();
            if (current == ProcessState.EXITED) {
                return exitCode;
            }
        } while (!state.compareAndSet(current, ProcessState.TERMINATING));
        boolean interrupted = false;
        process.descendants().forEach(java.lang.ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.debug("process did not exit within {}ms, killing", gracePeriod.toMillis());
                destroyForcibly();
            }
        } catch (InterruptedException e) {
            interrupted = true;
            destroyForcibly();
        }
        int code = awaitExitCode();
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return code;
    }

    private void destroyForcibly() {
        process.descendants().forEach(java.lang.ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private int awaitExitCode() {
        while (true) {
            try {
                return exitFuture.get(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return process.isAlive() ? -1 : process.exitValue();
            } catch (Exception e) {
                if (!process.isAlive()) {
                    return process.exitValue();
                }
                logger.warn("still waiting for process {} to exit", process.pid());
            }
        }
    }

    // ========== Public API ==========

    public String getSysOut() {
        synchronized (stdoutBuffer) {
            return stdoutBuffer.toString();
        }
    }

    public String getSysErr() {
        synchronized (stderrBuffer) {
            return stderrBuffer.toString();
        }
    }

    public int getExitCode() {
        return exitCode;
    }

    public boolean isAlive() {
        return process != null && process.isAlive();
    }

    public long getPid() {
        return process.pid();
    }

    public CompletableFuture<Integer> getExitFuture() {
        return exitFuture;
    }

    public ProcessConfig getConfig() {
        return config;
    }

}
