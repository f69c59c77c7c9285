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

import io.digdug.fetch.Artifact;
import io.digdug.http.HttpRequest;
import io.digdug.http.HttpResponse;
import io.digdug.process.ProcessEvent;
import io.digdug.process.ReadinessMatcher;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Everything that differs between tunnel providers: what to download, how to launch it,
 * how to tell it is ready and how to report job results.
 * <p>
 * Implementations are stateless; all per-run values come from the {@link TunnelConfig}
 * and the {@link LaunchContext}. Methods that need credentials throw
 * {@link ConfigurationException} when they are missing.
 */
public interface TunnelProvider {

    ProviderType type();

    // ========== Configuration ==========

    /**
     * Environment variables for the username and the access key, in that order.
     */
    default List<String> credentialVariables() {
        return List.of();
    }

    /**
     * Check the configuration before anything is started.
     *
     * @throws ConfigurationException on missing credentials or unsupported settings
     */
    default void validate(TunnelConfig config) {
        artifacts(config);
    }

    // ========== Install ==========

    /**
     * Files needed on disk before the tunnel can start. Empty if nothing is downloaded.
     * No I/O.
     *
     * @throws ConfigurationException for unsupported platforms or invalid driver names
     */
    List<Artifact> artifacts(TunnelConfig config);

    /**
     * The download url of the main artifact, null if the provider downloads nothing.
     */
    default String resolveDownloadUrl(TunnelConfig config) {
        List<Artifact> artifacts = artifacts(config);
        return artifacts.isEmpty() ? null : artifacts.get(0).url();
    }

    /**
     * The installed tunnel binary (or jar), null if there is none.
     */
    Path resolveExecutable(TunnelConfig config);

    // ========== Launch ==========

    /**
     * False for providers that do not run a process at all.
     */
    default boolean hasProcess() {
        return true;
    }

    /**
     * The program to run: the tunnel binary, or {@code java} for jar based tunnels.
     */
    default String launchExecutable(TunnelConfig config) {
        if (config.getExecutable() != null) {
            return config.getExecutable();
        }
        return resolveExecutable(config).toString();
    }

    /**
     * Command line arguments, without the executable.
     */
    List<String> buildArgs(TunnelConfig config, LaunchContext context);

    ReadinessMatcher readinessMatcher(TunnelConfig config, LaunchContext context);

    /**
     * Values that must not appear in logged command lines.
     */
    default List<String> secrets(TunnelConfig config) {
        return List.of();
    }

    /**
     * A user-facing status line derived from a process output line, or null.
     * Called for every line, also after the tunnel is ready.
     */
    default String statusLine(ProcessEvent event) {
        return null;
    }

    // ========== Client ==========

    default String defaultProtocol() {
        return "http";
    }

    default String defaultHostname() {
        return "localhost";
    }

    default int defaultPort() {
        return 4444;
    }

    default String defaultPathname() {
        return "/wd/hub/";
    }

    /**
     * Capabilities a client adds to new sessions to route them through this tunnel.
     */
    default Map<String, Object> extraCapabilities(TunnelConfig config) {
        return Map.of();
    }

    // ========== Provider API ==========

    /**
     * The request that records a job result, or null if the provider has no job status api.
     */
    default HttpRequest jobStatusRequest(TunnelConfig config, String sessionId, JobState state) {
        return null;
    }

    /**
     * Inspect a 2xx job status response. Some apis report errors in the body.
     *
     * @throws ReportException if the response body reports a failure
     */
    default void checkJobStatusResponse(HttpResponse response) {
    }

    /**
     * The request listing available environments, or null if not supported.
     */
    default HttpRequest environmentsRequest(TunnelConfig config) {
        return null;
    }

    /**
     * Convert one entry of the environments response. Some providers expand one entry into several.
     */
    default List<NormalizedEnvironment> normalizeEnvironment(Map<String, Object> entry) {
        return List.of();
    }

}
