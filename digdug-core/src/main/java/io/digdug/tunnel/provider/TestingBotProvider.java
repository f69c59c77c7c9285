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

import io.digdug.common.Json;
import io.digdug.fetch.Artifact;
import io.digdug.http.HttpRequest;
import io.digdug.http.HttpResponse;
import io.digdug.http.ProxySettings;
import io.digdug.process.ProcessEvent;
import io.digdug.process.Readiness;
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
 * TestingBot tunnel, a Java application.
 * <p>
 * Provider options: {@code fastFailDomains}, {@code logFile}, {@code useJettyProxy} (default true),
 * {@code useSquidProxy} (default true), {@code useCompression}, {@code useSsl}.
 */
public class TestingBotProvider extends AbstractTunnelProvider {

    public static final String DOWNLOAD_URL = "https://testingbot.com/downloads/testingbot-tunnel.zip";
    public static final String ENVIRONMENTS_URL = "https://api.testingbot.com/v1/browsers";
    public static final String TESTS_URL = "https://api.testingbot.com/v1/tests/";

    @Override
    public ProviderType type() {
        return ProviderType.TESTINGBOT;
    }

    @Override
    protected String usernameVariable() {
        return "TESTINGBOT_KEY";
    }

    @Override
    protected String accessKeyVariable() {
        return "TESTINGBOT_SECRET";
    }

    @Override
    protected String displayName() {
        return "TestingBot";
    }

    // ========== Install ==========

    @Override
    public List<Artifact> artifacts(TunnelConfig config) {
        return List.of(Artifact.zip(DOWNLOAD_URL, config.getProviderDirectory(), resolveExecutable(config)));
    }

    @Override
    public Path resolveExecutable(TunnelConfig config) {
        return config.getProviderDirectory().resolve("testingbot-tunnel").resolve("testingbot-tunnel.jar");
    }

    @Override
    public String launchExecutable(TunnelConfig config) {
        return config.getExecutable() != null ? config.getExecutable() : "java";
    }

    // ========== Launch ==========

    @Override
    public List<String> buildArgs(TunnelConfig config, LaunchContext context) {
        requireCredentials(config);
        List<String> args = new ArrayList<>();
        ProxySettings proxy = config.getTunnelProxySettings();
        if (proxy != null) {
            args.add("-Dhttp.proxyHost=" + proxy.host());
            args.add("-Dhttp.proxyPort=" + proxy.port());
        }
        args.add("-jar");
        args.add(resolveExecutable(config).toString());
        args.add(username(config));
        args.add(accessKey(config));
        args.add("-P");
        args.add(String.valueOf(config.getPort() != null ? config.getPort() : defaultPort()));
        args.add("-f");
        args.add(context.readyFile().toString());
        List<String> fastFail = config.getStringListOption("fastFailDomains");
        if (!fastFail.isEmpty()) {
            args.add("-F");
            args.add(String.join(",", fastFail));
        }
        String logFile = config.getStringOption("logFile");
        if (logFile != null) {
            args.add("-l");
            args.add(logFile);
        }
        if (!config.getBooleanOption("useJettyProxy", true)) {
            args.add("-x");
        }
        if (!config.getBooleanOption("useSquidProxy", true)) {
            args.add("-q");
        }
        if (config.getBooleanOption("useCompression", false)) {
            args.add("-b");
        }
        if (config.getBooleanOption("useSsl", false)) {
            args.add("-s");
        }
        if (config.isVerbose()) {
            args.add("-d");
        }
        return args;
    }

    @Override
    public ReadinessMatcher readinessMatcher(TunnelConfig config, LaunchContext context) {
        ReadinessMatcher errors = new ReadinessMatcher() {
            @Override
            public Readiness onEvent(ProcessEvent event) {
                if (event.isStderr() && event.data() != null
                        && (event.data().startsWith("SEVERE: ") || event.data().startsWith("An error ocurred:"))) {
                    return Readiness.failed(event.data());
                }
                return Readiness.pending();
            }
        };
        return ReadinessMatcher.anyOf(errors, ReadinessMatcher.readyFile(context.readyFile()));
    }

    @Override
    public String statusLine(ProcessEvent event) {
        if (!event.isStderr() || event.data() == null || !event.data().startsWith("INFO: ")) {
            return null;
        }
        String message = event.data().substring("INFO: ".length());
        // request traffic
        if (message.contains(">> [") || message.contains("<< [")) {
            return null;
        }
        return message;
    }

    // ========== Client ==========

    @Override
    public int defaultPort() {
        return 4445;
    }

    // ========== Provider API ==========

    @Override
    public HttpRequest jobStatusRequest(TunnelConfig config, String sessionId, JobState state) {
        requireCredentials(config);
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("test[success]", state.success() ? "1" : "0");
        if (state.status() != null) {
            params.put("test[status_message]", state.status());
        }
        if (state.name() != null) {
            params.put("test[name]", state.name());
        }
        if (!state.extra().isEmpty()) {
            params.put("test[extra]", Json.toJson(state.extra()));
        }
        if (!state.tags().isEmpty()) {
            params.put("groups", String.join(",", state.tags()));
        }
        return HttpRequest.put(TESTS_URL + sessionId)
                .basicAuth(username(config), accessKey(config))
                .form(params);
    }

    @Override
    public void checkJobStatusResponse(HttpResponse response) {
        if (response.getBodyString().isBlank()) {
            throw new ReportException(response.status(), "server reported " + response.status() + " with no other data");
        }
        Object json = response.getBodyJson();
        if (!(json instanceof Map<?, ?> data)) {
            throw new ReportException(response.status(), "unexpected response: " + response.getBodyString());
        }
        if (data.get("error") != null) {
            throw new ReportException(response.status(), String.valueOf(data.get("error")));
        }
        if (!Boolean.TRUE.equals(data.get("success"))) {
            throw new ReportException(response.status(), "Job data failed to save.");
        }
    }

    @Override
    public HttpRequest environmentsRequest(TunnelConfig config) {
        return HttpRequest.get(ENVIRONMENTS_URL);
    }

    @Override
    public List<NormalizedEnvironment> normalizeEnvironment(Map<String, Object> entry) {
        String name = (String) entry.get("name");
        String browserName;
        if ("googlechrome".equals(name)) {
            browserName = "chrome";
        } else if ("iexplore".equals(name)) {
            browserName = "internet explorer";
        } else {
            browserName = name;
        }
        String platform = (String) entry.get("platform");
        String version = entry.get("version") == null ? null : entry.get("version").toString();
        return List.of(new NormalizedEnvironment(platform, platform, null, browserName, version, version, entry));
    }

}
