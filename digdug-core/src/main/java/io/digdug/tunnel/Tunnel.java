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
package io.digdug.tunnel;

import io.digdug.common.FileUtils;
import io.digdug.fetch.Artifact;
import io.digdug.fetch.ArtifactFetcher;
import io.digdug.http.ApacheHttpClient;
import io.digdug.http.HttpRequest;
import io.digdug.http.HttpResponse;
import io.digdug.process.ProcessEvent;
import io.digdug.process.ProcessHandle;
import io.digdug.process.ProcessSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lifecycle of one tunnel: download, start, stop and job status reporting.
 * <p>
 * State changes are serialized on the instance. At most one start and one stop are in flight
 * at any time; concurrent callers get the same future. Blocking work runs on threads owned by
 * the tunnel, so every operation returns immediately. Errors are delivered only through the
 * returned futures, except for configuration and state errors which are thrown by the call itself.
 * <pre>
 * STOPPED -> STARTING -> RUNNING -> STOPPING -> STOPPED
 *               |                      ^
 *               +------ stop() --------+
 * </pre>
 * Calling {@link #stop()} while starting interrupts the start: a running download is aborted,
 * a spawned process is terminated, and the start future fails with a {@link CancellationException}.
 */
public class Tunnel implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Tunnel.class);

    static final Duration RETRY_BACKOFF = Duration.ofMillis(500);

    private static final String REDACTED = "****";

    private final TunnelConfig config;
    private final TunnelProvider provider;
    private final ArtifactFetcher fetcher;
    private final ProcessSupervisor supervisor;
    private final ApacheHttpClient apiClient;
    private final ApacheHttpClient listClient;
    private final ExecutorService worker;
    private final List<TunnelListener> listeners = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    // guarded by lock
    private TunnelState state = TunnelState.STOPPED;
    private CompletableFuture<Void> startFuture;
    private CompletableFuture<Integer> stopFuture;
    private CompletableFuture<Void> downloadFuture;
    private ProcessHandle handle;
    private Thread startThread;
    private Thread downloadThread;
    private boolean cancelRequested;
    private Integer cancelledExitCode;
    private boolean closed;

    private volatile String lastProviderStatus;

    public Tunnel(TunnelConfig config, TunnelProvider provider) {
        this.config = config;
        this.provider = provider;
        this.fetcher = new ArtifactFetcher(config.getProxySettings());
        this.supervisor = new ProcessSupervisor(config.getGracePeriod());
        int timeout = (int) config.getJobStatusTimeout().toMillis();
        this.apiClient = new ApacheHttpClient()
                .proxy(config.getProxySettings())
                .connectTimeout(timeout)
                .readTimeout(timeout);
        this.listClient = new ApacheHttpClient().proxy(config.getProxySettings());
        AtomicInteger counter = new AtomicInteger();
        this.worker = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "digdug-" + provider.type().getName() + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    // ========== Listeners ==========

    public Tunnel addListener(TunnelListener listener) {
        listeners.add(listener);
        return this;
    }

    public void removeListener(TunnelListener listener) {
        listeners.remove(listener);
    }

    private void emit(TunnelEvent event) {
        for (TunnelListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                logger.warn("tunnel listener error: {}", e.getMessage());
            }
        }
    }

    private void emitStatus(String status) {
        logger.debug("[{}] {}", provider.type(), status);
        emit(new StatusEvent(status));
    }

    private void onProcessEvent(ProcessEvent event) {
        if (!event.isOutput()) {
            return;
        }
        emit(event.isStdout() ? IOEvent.stdout(event.data()) : IOEvent.stderr(event.data()));
        String status = provider.statusLine(event);
        // tunnels repeat the same line while waiting
        if (status != null && !status.equals(lastProviderStatus)) {
            lastProviderStatus = status;
            emitStatus(status);
        }
    }

    // ========== Download ==========

    /**
     * True if every file the provider needs exists. No network access.
     *
     * @throws ConfigurationException if the configuration cannot be resolved to files
     */
    public boolean isDownloaded() {
        return provider.artifacts(config).stream().allMatch(a -> Files.exists(a.installedFile()));
    }

    public CompletableFuture<Void> download() {
        return download(false);
    }

    /**
     * Download whatever is missing, or everything when forced. Joins a download already in flight.
     *
     * @throws ConfigurationException if the configuration cannot be resolved to files
     */
    public CompletableFuture<Void> download(boolean force) {
        List<Artifact> artifacts = provider.artifacts(config);
        synchronized (lock) {
            ensureOpen();
            if (downloadFuture != null && !downloadFuture.isDone()) {
                return downloadFuture;
            }
            List<Artifact> pending = new ArrayList<>();
            for (Artifact artifact : artifacts) {
                if (force || !Files.exists(artifact.installedFile())) {
                    pending.add(artifact);
                }
            }
            if (pending.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> future = new CompletableFuture<>();
            downloadFuture = future;
            worker.execute(() -> runDownload(pending, future));
            return future;
        }
    }

    private void runDownload(List<Artifact> artifacts, CompletableFuture<Void> future) {
        synchronized (lock) {
            if (future.isDone()) {
                return;
            }
            downloadThread = Thread.currentThread();
        }
        try {
            for (Artifact artifact : artifacts) {
                emitStatus("Downloading " + artifact.url());
                if (future.isDone()) {
                    logger.debug("download cancelled before {}", artifact.url());
                    return;
                }
                fetcher.install(artifact, (url, received, total) -> emit(new DownloadProgressEvent(url, received, total)));
            }
            future.complete(null);
        } catch (RuntimeException e) {
            if (future.isCancelled()) {
                logger.debug("download cancelled: {}", e.getMessage());
            } else {
                logger.warn("download failed: {}", e.getMessage());
                future.completeExceptionally(e);
            }
        } finally {
            synchronized (lock) {
                if (downloadThread == Thread.currentThread()) {
                    downloadThread = null;
                }
            }
            Thread.interrupted();
        }
    }

    /**
     * Stop a download in flight: the request is aborted, extraction is interrupted and no
     * further artifact is fetched.
     */
    private void cancelDownload(CompletableFuture<Void> future) {
        synchronized (lock) {
            if (future != downloadFuture || !future.cancel(false)) {
                return;
            }
            if (downloadThread != null) {
                downloadThread.interrupt();
            }
            fetcher.abort();
        }
    }

    private void awaitDownload() throws InterruptedException {
        CompletableFuture<Void> future;
        boolean joined;
        synchronized (lock) {
            joined = downloadFuture != null && !downloadFuture.isDone();
            future = download(false);
        }
        try {
            future.get();
        } catch (InterruptedException e) {
            // a download started by someone else keeps going
            if (!joined) {
                cancelDownload(future);
            }
            throw e;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(e.getCause());
        }
    }

    // ========== Start ==========

    /**
     * Start the tunnel, downloading it first if needed.
     *
     * @return completes when the tunnel is ready; the same future while starting or running
     * @throws TunnelStateException   if the tunnel is stopping
     * @throws ConfigurationException if credentials or settings are missing
     */
    public CompletableFuture<Void> start() {
        synchronized (lock) {
            ensureOpen();
            switch (state) {
                case STOPPING -> throw new TunnelStateException(state, "previous tunnel is still stopping");
                case STARTING, RUNNING -> {
                    return startFuture;
                }
                default -> {
                    // STOPPED
                }
            }
            provider.validate(config);
            state = TunnelState.STARTING;
            handle = null;
            cancelRequested = false;
            cancelledExitCode = null;
            lastProviderStatus = null;
            CompletableFuture<Void> future = new CompletableFuture<>();
            startFuture = future;
            worker.execute(() -> runStart(future));
            return future;
        }
    }

    private void runStart(CompletableFuture<Void> future) {
        ProcessHandle spawned = null;
        Path readyFile = null;
        try {
            synchronized (lock) {
                checkCancelled();
                startThread = Thread.currentThread();
            }
            awaitDownload();
            if (provider.hasProcess()) {
                Path providerDir = config.getProviderDirectory();
                FileUtils.createDirectories(providerDir);
                readyFile = newReadyFile();
                LaunchContext context = new LaunchContext(providerDir, readyFile);
                String executable = provider.launchExecutable(config);
                List<String> args = new ArrayList<>(provider.buildArgs(config, context));
                args.addAll(config.getExtraArgs());
                logCommand(executable, args);
                emitStatus("Starting tunnel");
                synchronized (lock) {
                    checkCancelled();
                    spawned = supervisor.spawn(executable, args, providerDir, Map.of(), this::onProcessEvent);
                    handle = spawned;
                }
                supervisor.awaitReady(spawned, provider.readinessMatcher(config, context), config.getStartupTimeout());
            }
            synchronized (lock) {
                checkCancelled();
                state = TunnelState.RUNNING;
            }
            if (spawned != null) {
                ProcessHandle running = spawned;
                running.getExitFuture().thenAccept(code -> onProcessExit(running, code));
            }
            emitStatus("Ready");
            future.complete(null);
        } catch (InterruptedException | CancellationException e) {
            Integer code = teardown(spawned, null);
            failStart(future, new CancellationException("tunnel start was cancelled"), code);
        } catch (RuntimeException e) {
            Integer code = teardown(spawned, e);
            failStart(future, e, code);
        } finally {
            synchronized (lock) {
                // a start() retried from a callback of the failed future may own it already
                if (startThread == Thread.currentThread()) {
                    startThread = null;
                }
            }
            // a stop() may have interrupted this pooled thread after the last wait
            Thread.interrupted();
            deleteQuietly(readyFile);
        }
    }

    // caller holds the lock
    private void checkCancelled() {
        if (cancelRequested) {
            throw new CancellationException("tunnel start was cancelled");
        }
    }

    private Integer teardown(ProcessHandle spawned, Exception primary) {
        if (spawned == null) {
            return null;
        }
        // let the graceful part of the termination wait
        Thread.interrupted();
        try {
            return supervisor.terminate(spawned, config.getGracePeriod());
        } catch (RuntimeException e) {
            if (primary != null) {
                primary.addSuppressed(e);
            } else {
                logger.warn("failed to terminate tunnel process: {}", e.getMessage());
            }
            return null;
        }
    }

    private void failStart(CompletableFuture<Void> future, RuntimeException error, Integer exitCode) {
        boolean cancelled;
        synchronized (lock) {
            cancelled = cancelRequested;
            handle = null;
            cancelledExitCode = exitCode;
            if (state == TunnelState.STARTING) {
                state = TunnelState.STOPPED;
            }
            // when STOPPING, the pending stop() completes the transition
        }
        if (cancelled && !(error instanceof CancellationException)) {
            logger.debug("start failed after cancellation: {}", error.getMessage());
            error = new CancellationException("tunnel start was cancelled");
        }
        if (error instanceof CancellationException) {
            emitStatus("Start cancelled");
        } else {
            logger.warn("failed to start tunnel: {}", error.getMessage());
            emitStatus("Failed to start tunnel");
        }
        future.completeExceptionally(error);
    }

    private Path newReadyFile() {
        String tmp = System.getProperty("java.io.tmpdir");
        return Path.of(tmp, "digdug-" + provider.type().getName() + "-" + UUID.randomUUID() + ".ready");
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.debug("failed to delete {}: {}", file, e.getMessage());
        }
    }

    private void logCommand(String executable, List<String> args) {
        List<String> safe = redact(args, provider.secrets(config));
        if (config.isVerbose()) {
            logger.info("starting {} with arguments: {}", executable, String.join(" ", safe));
        } else {
            logger.debug("starting {} with arguments: {}", executable, String.join(" ", safe));
        }
    }

    /**
     * Replace every occurrence of a secret in the arguments with {@code ****}.
     */
    public static List<String> redact(List<String> args, Collection<String> secrets) {
        List<String> result = new ArrayList<>(args.size());
        for (String arg : args) {
            String safe = arg;
            for (String secret : secrets) {
                if (secret != null && !secret.isEmpty()) {
                    safe = safe.replace(secret, REDACTED);
                }
            }
            result.add(safe);
        }
        return result;
    }

    private void onProcessExit(ProcessHandle exited, Integer code) {
        boolean unexpected;
        synchronized (lock) {
            unexpected = state == TunnelState.RUNNING && handle == exited;
            if (unexpected) {
                state = TunnelState.STOPPED;
            }
        }
        if (unexpected) {
            logger.warn("tunnel process exited with code {}", code);
            emitStatus("Tunnel exited with code " + code);
        }
    }

    // ========== Stop ==========

    /**
     * Stop the tunnel: cancels a start in flight, or terminates the running process.
     *
     * @return the exit code of the process; null if a cancelled start had not spawned one yet
     * @throws TunnelStateException if there is nothing to stop
     */
    public CompletableFuture<Integer> stop() {
        synchronized (lock) {
            switch (state) {
                case STOPPING -> {
                    return stopFuture;
                }
                case STARTING -> {
                    return cancelStart();
                }
                case RUNNING -> {
                    state = TunnelState.STOPPING;
                    CompletableFuture<Integer> future = new CompletableFuture<>();
                    stopFuture = future;
                    ProcessHandle running = handle;
                    worker.execute(() -> runStop(running, future));
                    return future;
                }
                default -> {
                    if (handle == null) {
                        throw new TunnelStateException(state, "tunnel is not running");
                    }
                    // the process exited on its own, report its exit code once
                    ProcessHandle exited = handle;
                    handle = null;
                    return CompletableFuture.completedFuture(exited.getExitCode());
                }
            }
        }
    }

    // caller holds the lock
    private CompletableFuture<Integer> cancelStart() {
        cancelRequested = true;
        state = TunnelState.STOPPING;
        CompletableFuture<Integer> future = new CompletableFuture<>();
        stopFuture = future;
        if (startThread != null) {
            startThread.interrupt();
        }
        startFuture.whenComplete((v, e) -> {
            Integer code;
            synchronized (lock) {
                state = TunnelState.STOPPED;
                handle = null;
                code = cancelledExitCode;
            }
            emitStatus("Stopped");
            future.complete(code);
        });
        return future;
    }

    private void runStop(ProcessHandle running, CompletableFuture<Integer> future) {
        emitStatus("Stopping");
        try {
            int code = running == null ? 0 : supervisor.terminate(running, config.getGracePeriod());
            synchronized (lock) {
                state = TunnelState.STOPPED;
                handle = null;
            }
            emitStatus("Stopped");
            future.complete(code);
        } catch (RuntimeException e) {
            synchronized (lock) {
                state = TunnelState.RUNNING;
            }
            logger.warn("failed to stop tunnel: {}", e.getMessage());
            future.completeExceptionally(e);
        }
    }

    // ========== Job Status ==========

    /**
     * Report the outcome of a session to the provider. Transport errors and 5xx responses are
     * retried once, anything else fails with a {@link ReportException}. Never changes the tunnel state.
     *
     * @throws ConfigurationException if credentials are missing
     */
    public CompletableFuture<Void> sendJobState(String sessionId, JobState jobState) {
        HttpRequest request = provider.jobStatusRequest(config, sessionId, jobState);
        if (request == null) {
            return CompletableFuture.completedFuture(null);
        }
        synchronized (lock) {
            ensureOpen();
        }
        CompletableFuture<Void> future = CompletableFuture.runAsync(() -> sendWithRetry(request), worker);
        future.whenComplete((v, e) -> {
            if (e != null) {
                logger.warn("failed to report job state for {}: {}", sessionId, e.getMessage());
            }
        });
        return future;
    }

    private void sendWithRetry(HttpRequest request) {
        for (int attempt = 1; ; attempt++) {
            boolean last = attempt >= 2;
            try {
                HttpResponse response = apiClient.invoke(request);
                if (response.isSuccess()) {
                    provider.checkJobStatusResponse(response);
                    return;
                }
                String body = response.getBodyString();
                ReportException error = new ReportException(response.status(), body.isBlank()
                        ? "server reported " + response.status() + " with no other data"
                        : "server reported " + response.status() + " with: " + body);
                if (!response.isServerError() || last) {
                    throw error;
                }
                logger.debug("job status request returned {}, retrying", response.status());
            } catch (UncheckedIOException e) {
                if (last) {
                    throw new ReportException("job status request failed: " + e.getMessage(), e);
                }
                logger.debug("job status request failed, retrying: {}", e.getMessage());
            }
            try {
                Thread.sleep(RETRY_BACKOFF.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ReportException("interrupted before retrying job status request", e);
            }
        }
    }

    // ========== Environments ==========

    /**
     * The browser environments the provider offers. Empty for providers without a listing.
     *
     * @throws ConfigurationException if credentials are missing
     */
    public CompletableFuture<List<NormalizedEnvironment>> getEnvironments() {
        HttpRequest request = provider.environmentsRequest(config);
        if (request == null) {
            return CompletableFuture.completedFuture(List.of());
        }
        synchronized (lock) {
            ensureOpen();
        }
        return CompletableFuture.supplyAsync(() -> fetchEnvironments(request), worker);
    }

    @SuppressWarnings("unchecked")
    private List<NormalizedEnvironment> fetchEnvironments(HttpRequest request) {
        HttpResponse response;
        try {
            response = listClient.invoke(request);
        } catch (UncheckedIOException e) {
            throw new ReportException("failed to get environments: " + e.getMessage(), e);
        }
        if (response.status() == 401) {
            throw new ReportException(401, "missing or invalid username and access key");
        }
        if (response.status() < 200 || response.status() >= 400) {
            throw new ReportException(response.status(), "server replied with a status of " + response.status());
        }
        Object json = response.getBodyJson();
        if (!(json instanceof List)) {
            throw new ReportException(response.status(), "unexpected environments response from " + request.getUrl());
        }
        List<NormalizedEnvironment> result = new ArrayList<>();
        for (Object entry : (List<Object>) json) {
            if (entry instanceof Map) {
                result.addAll(provider.normalizeEnvironment((Map<String, Object>) entry));
            }
        }
        return result;
    }

    // ========== Client ==========

    /**
     * {@code protocol://hostname:port/pathname} of the WebDriver endpoint this tunnel exposes.
     */
    public String getClientUrl() {
        String protocol = config.getProtocol() != null ? config.getProtocol() : provider.defaultProtocol();
        String hostname = config.getHostname() != null ? config.getHostname() : provider.defaultHostname();
        int port = config.getPort() != null ? config.getPort() : provider.defaultPort();
        String pathname = config.getPathname() != null ? config.getPathname() : provider.defaultPathname();
        if (!pathname.startsWith("/")) {
            pathname = "/" + pathname;
        }
        return protocol + "://" + hostname + ":" + port + pathname;
    }

    public Map<String, Object> getExtraCapabilities() {
        return provider.extraCapabilities(config);
    }

    // ========== State ==========

    public TunnelState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isRunning() {
        return getState() == TunnelState.RUNNING;
    }

    public boolean isStarting() {
        return getState() == TunnelState.STARTING;
    }

    public boolean isStopping() {
        return getState() == TunnelState.STOPPING;
    }

    public TunnelConfig getConfig() {
        return config;
    }

    public TunnelProvider getProvider() {
        return provider;
    }

    // caller holds the lock
    private void ensureOpen() {
        if (closed) {
            throw new TunnelStateException(state, "tunnel is closed");
        }
    }

    /**
     * Stop the tunnel if needed and release threads and connections.
     */
    @Override
    public void close() {
        CompletableFuture<Integer> pending = null;
        synchronized (lock) {
            if (closed) {
                return;
            }
            if (state != TunnelState.STOPPED) {
                pending = stop();
            }
            closed = true;
        }
        if (pending != null) {
            try {
                pending.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException e) {
                logger.warn("failed to stop tunnel on close: {}", e.getCause().getMessage());
            }
        }
        worker.shutdownNow();
        supervisor.close();
        fetcher.close();
        try {
            apiClient.close();
            listClient.close();
        } catch (IOException e) {
            logger.debug("failed to close http clients: {}", e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "Tunnel[" + provider.type() + ", " + getState() + "]";
    }

}
