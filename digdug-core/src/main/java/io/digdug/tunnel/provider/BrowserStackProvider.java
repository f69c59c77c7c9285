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
import io.digdug.http.ProxySettings;
import io.digdug.process.ProcessEvent;
import io.digdug.process.ReadinessMatcher;
import io.digdug.tunnel.ConfigurationException;
import io.digdug.tunnel.JobState;
import io.digdug.tunnel.LaunchContext;
import io.digdug.tunnel.NormalizedEnvironment;
import io.digdug.tunnel.ProviderType;
import io.digdug.tunnel.TunnelConfig;

import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * BrowserStack Local.
 * <p>
 * Provider options: {@code servers} (urls proxied by the tunnel), {@code automateOnly} (default true),
 * {@code forceLocal}, {@code killOtherTunnels}, {@code skipServerValidation} (default true).
 */
public class BrowserStackProvider extends AbstractTunnelProvider {

    public static final String DOWNLOAD_BASE = "https://www.browserstack.com/browserstack-local/BrowserStackLocal-";
    public static final String ENVIRONMENTS_URL = "https://www.browserstack.com/automate/browsers.json";
    public static final String SESSIONS_URL = "https://www.browserstack.com/automate/sessions/";

    static final String READY_MESSAGE = "You can now access your local server(s) in our remote browser";

    private static final Pattern ERROR = Pattern.compile("\\s*\\*\\*\\* Error: (.*)$");
    private static final Pattern STATUS = Pattern.compile("^(BrowserStackLocal v|Connecting to BrowserStack|Connected)");

    private static final Map<String, String> WINDOWS_PLATFORMS = Map.of(
            "10", "WINDOWS",
            "8.1", "WIN8",
            "8", "WIN8",
            "7", "WINDOWS",
            "XP", "XP");

    @Override
    public ProviderType type() {
        return ProviderType.BROWSERSTACK;
    }

    @Override
    protected String usernameVariable() {
        return "BROWSERSTACK_USERNAME";
    }

    @Override
    protected String accessKeyVariable() {
        return "BROWSERSTACK_ACCESS_KEY";
    }

    @Override
    protected String displayName() {
        return "BrowserStack";
    }

    // ========== Install ==========

    /**
     * @throws ConfigurationException for platforms without a BrowserStackLocal binary
     */
    static String downloadUrl(Platform platform) {
        String os = platform.os();
        String arch = platform.arch();
        String suffix;
        if (platform.isMac() && Platform.X64.equals(arch)) {
            suffix = os + "-" + arch;
        } else if (platform.isWindows()) {
            suffix = os;
        } else if (platform.isLinux() && (Platform.IA32.equals(arch) || Platform.X64.equals(arch))) {
            suffix = os + "-" + arch;
        } else {
            throw unsupported("BrowserStack", platform);
        }
        return DOWNLOAD_BASE + suffix + ".zip";
    }

    @Override
    public List<Artifact> artifacts(TunnelConfig config) {
        if (config.getExecutable() != null) {
            return List.of();
        }
        String url = downloadUrl(config.getPlatform());
        return List.of(Artifact.zip(url, config.getProviderDirectory(), resolveExecutable(config)));
    }

    @Override
    public Path resolveExecutable(TunnelConfig config) {
        return config.getProviderDirectory().resolve(exe(config.getPlatform(), "BrowserStackLocal"));
    }

    // ========== Launch ==========

    @Override
    public List<String> buildArgs(TunnelConfig config, LaunchContext context) {
        requireCredentials(config);
        List<String> args = new ArrayList<>();
        args.add(accessKey(config));
        List<String> servers = new ArrayList<>();
        for (String server : config.getStringListOption("servers")) {
            servers.add(serverSpec(server));
        }
        args.add(String.join(",", servers));
        if (config.getBooleanOption("automateOnly", true)) {
            args.add("-onlyAutomate");
        }
        if (config.getBooleanOption("forceLocal", false)) {
            args.add("-forcelocal");
        }
        if (config.getBooleanOption("killOtherTunnels", false)) {
            args.add("-force");
        }
        if (config.getBooleanOption("skipServerValidation", true)) {
            args.add("-skipCheck");
        }
        if (config.getTunnelId() != null) {
            args.add("-localIdentifier");
            args.add(config.getTunnelId());
        }
        if (config.isVerbose()) {
            args.add("-v");
        }
        ProxySettings proxy = config.getTunnelProxySettings();
        if (proxy != null) {
            args.add("-proxyHost");
            args.add(proxy.host());
            args.add("-proxyPort");
            args.add(String.valueOf(proxy.port()));
            if (proxy.hasCredentials()) {
                args.add("-proxyUser");
                args.add(proxy.username());
                args.add("-proxyPass");
                args.add(proxy.password() == null ? "" : proxy.password());
            }
        }
        return args;
    }

    /**
     * {@code https://example.com:8443} to {@code example.com,8443,1}.
     */
    static String serverSpec(String server) {
        URI uri;
        try {
            uri = URI.create(server);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("invalid server url: " + server);
        }
        if (uri.getHost() == null) {
            throw new ConfigurationException("server url has no host: " + server);
        }
        boolean https = "https".equalsIgnoreCase(uri.getScheme());
        int port = uri.getPort() != -1 ? uri.getPort() : (https ? 443 : 80);
        return uri.getHost() + "," + port + "," + (https ? 1 : 0);
    }

    @Override
    public ReadinessMatcher readinessMatcher(TunnelConfig config, LaunchContext context) {
        return ReadinessMatcher.pattern(Pattern.compile(Pattern.quote(READY_MESSAGE)), ERROR);
    }

    @Override
    public String statusLine(ProcessEvent event) {
        if (!event.isStdout() || event.data() == null) {
            return null;
        }
        String line = event.data().trim();
        return STATUS.matcher(line).find() ? line : null;
    }

    // ========== Client ==========

    @Override
    public String defaultProtocol() {
        return "https";
    }

    @Override
    public String defaultHostname() {
        return "hub.browserstack.com";
    }

    @Override
    public int defaultPort() {
        return 443;
    }

    @Override
    public Map<String, Object> extraCapabilities(TunnelConfig config) {
        Map<String, Object> capabilities = new LinkedHashMap<>();
        capabilities.put("browserstack.local", "true");
        if (config.getTunnelId() != null) {
            capabilities.put("browserstack.localIdentifier", config.getTunnelId());
        }
        return capabilities;
    }

    // ========== Provider API ==========

    @Override
    public HttpRequest jobStatusRequest(TunnelConfig config, String sessionId, JobState state) {
        requireCredentials(config);
        String status = state.status() != null ? state.status() : (state.success() ? "completed" : "error");
        return HttpRequest.put(SESSIONS_URL + sessionId + ".json")
                .basicAuth(username(config), accessKey(config))
                .json(Map.of("status", status));
    }

    @Override
    public HttpRequest environmentsRequest(TunnelConfig config) {
        requireCredentials(config);
        return HttpRequest.get(ENVIRONMENTS_URL).basicAuth(username(config), accessKey(config));
    }

    @Override
    public List<NormalizedEnvironment> normalizeEnvironment(Map<String, Object> entry) {
        String os = (String) entry.get("os");
        String osVersion = entry.get("os_version") == null ? null : entry.get("os_version").toString();
        String platform;
        if ("Windows".equals(os)) {
            platform = WINDOWS_PLATFORMS.get(osVersion);
        } else if ("OS X".equals(os)) {
            platform = "MAC";
        } else {
            platform = os;
        }
        String browser = (String) entry.get("browser");
        String browserName = "ie".equals(browser) ? "internet explorer" : browser;
        String version = entry.get("browser_version") == null ? null : entry.get("browser_version").toString();
        return List.of(new NormalizedEnvironment(platform, os, osVersion, browserName, version, version, entry));
    }

}
