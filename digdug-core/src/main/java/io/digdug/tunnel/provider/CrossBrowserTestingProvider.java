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
package io.digdug.tunnel.provider;

import io.digdug.common.Platform;
import io.digdug.fetch.Artifact;
import io.digdug.http.HttpRequest;
import io.digdug.http.HttpResponse;
import io.digdug.process.ReadinessMatcher;
import io.digdug.tunnel.JobState;
import io.digdug.tunnel.LaunchContext;
import io.digdug.tunnel.NormalizedEnvironment;
import io.digdug.tunnel.ProviderType;
import io.digdug.tunnel.ReportException;
import io.digdug.tunnel.TunnelConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CrossBrowserTesting, using the standalone {@code cbt_tunnels} release binaries.
 */
public class CrossBrowserTestingProvider extends AbstractTunnelProvider {

    public static final String DEFAULT_VERSION = "0.9.12";
    public static final String RELEASES_URL = "https://github.com/crossbrowsertesting/cbt-tunnel-nodejs/releases/download/";
    public static final String ENVIRONMENTS_URL = "https://crossbrowsertesting.com/api/v3/selenium/browsers?format=json";
    public static final String SELENIUM_URL = "https://crossbrowsertesting.com/api/v3/selenium/";

    @Override
    public ProviderType type() {
        return ProviderType.CROSSBROWSERTESTING;
    }

    @Override
    protected String usernameVariable() {
        return "CBT_USERNAME";
    }

    @Override
    protected String accessKeyVariable() {
        return "CBT_APIKEY";
    }

    @Override
    protected String displayName() {
        return "CrossBrowserTesting";
    }

    // ========== Install ==========

    static String binaryName(Platform platform) {
        String os;
        if (platform.isWindows()) {
            os = "win";
        } else if (platform.isMac()) {
            os = "macos";
        } else if (platform.isLinux() && Platform.X64.equals(platform.arch())) {
            os = "linux";
        } else {
            throw unsupported("CrossBrowserTesting", platform);
        }
        return "cbt_tunnels-" + os + "-x64";
    }

    private static String version(TunnelConfig config) {
        return config.getVersion() != null ? config.getVersion() : DEFAULT_VERSION;
    }

    @Override
    public List<Artifact> artifacts(TunnelConfig config) {
        if (config.getExecutable() != null) {
            return List.of();
        }
        String url = RELEASES_URL + "v" + version(config) + "/" + binaryName(config.getPlatform()) + ".zip";
        return List.of(Artifact.zip(url, config.getProviderDirectory().resolve(version(config)), resolveExecutable(config)));
    }

    @Override
    public Path resolveExecutable(TunnelConfig config) {
        Platform platform = config.getPlatform();
        return config.getProviderDirectory().resolve(version(config)).resolve(exe(platform, binaryName(platform)));
    }

    // ========== Launch ==========

    @Override
    public List<String> buildArgs(TunnelConfig config, LaunchContext context) {
        requireCredentials(config);
        List<String> args = new ArrayList<>();
        args.add("--authkey");
        args.add(accessKey(config));
        args.add("--username");
        args.add(username(config));
        args.add("--ready");
        args.add(context.readyFile().toString());
        if (config.isVerbose()) {
            args.add("--verbose");
        }
        return args;
    }

    @Override
    public ReadinessMatcher readinessMatcher(TunnelConfig config, LaunchContext context) {
        // startup errors show up on stdout and are reported with the exit of the process
        return ReadinessMatcher.readyFile(context.readyFile());
    }

    // ========== Client ==========

    @Override
    public String defaultHostname() {
        return "hub.crossbrowsertesting.com";
    }

    @Override
    public int defaultPort() {
        return 80;
    }

    @Override
    public Map<String, Object> extraCapabilities(TunnelConfig config) {
        Map<String, Object> capabilities = new LinkedHashMap<>();
        capabilities.put("username", username(config));
        capabilities.put("password", accessKey(config));
        return capabilities;
    }

    // ========== Provider API ==========

    @Override
    public HttpRequest jobStatusRequest(TunnelConfig config, String sessionId, JobState state) {
        requireCredentials(config);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", "set_score");
        payload.put("score", state.success() ? "pass" : "fail");
        return HttpRequest.put(SELENIUM_URL + sessionId)
                .basicAuth(username(config), accessKey(config))
                .json(payload);
    }

    @Override
    public void checkJobStatusResponse(HttpResponse response) {
        Object json = response.getBodyJson();
        if (json instanceof Map<?, ?> data && data.get("status") != null && response.status() != 200) {
            throw new ReportException(response.status(), "Could not save test status (" + data.get("message") + ")");
        }
    }

    @Override
    public HttpRequest environmentsRequest(TunnelConfig config) {
        requireCredentials(config);
        return HttpRequest.get(ENVIRONMENTS_URL).basicAuth(username(config), accessKey(config));
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<NormalizedEnvironment> normalizeEnvironment(Map<String, Object> entry) {
        String platform = (String) entry.get("api_name");
        Object browsers = entry.get("browsers");
        if (!(browsers instanceof List)) {
            return List.of();
        }
        List<NormalizedEnvironment> result = new ArrayList<>();
        for (Object item : (List<Object>) browsers) {
            if (!(item instanceof Map)) {
                continue;
            }
            Map<String, Object> browser = (Map<String, Object>) item;
            Object type = browser.get("type");
            String browserName = type == null ? null : type.toString().toLowerCase();
            String version = browser.get("version") == null ? null : browser.get("version").toString();
            result.add(new NormalizedEnvironment(platform, null, null, browserName, version, version, entry));
        }
        return result;
    }

}
