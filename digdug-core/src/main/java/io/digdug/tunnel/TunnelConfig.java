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

import io.digdug.common.Json;
import io.digdug.common.OsUtils;
import io.digdug.common.Platform;
import io.digdug.http.ProxySettings;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable configuration of one tunnel.
 * <p>
 * Built with {@link #builder(ProviderType)}, or loaded from a json file:
 * <pre>
 * {
 *   "provider": "browserstack",
 *   "installDirectory": "/tmp/digdug",
 *   "tunnelId": "build-42",
 *   "startupTimeout": 90000,
 *   "verbose": true,
 *   "options": {
 *     "servers": ["http://localhost:9000"],
 *     "killOtherTunnels": true
 *   }
 * }
 * </pre>
 * Durations in json are milliseconds. Keys that are not known settings are treated as provider options.
 * <p>
 * Credentials not given explicitly are looked up in {@link #getEnvironment()} using the
 * provider's variable names, explicit values always win.
 */
public class TunnelConfig {

    public static final Duration DEFAULT_STARTUP_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(5);
    public static final Duration DEFAULT_JOB_STATUS_TIMEOUT = Duration.ofSeconds(10);

    public static Path defaultInstallDirectory() {
        return Path.of(OsUtils.USER_HOME, ".digdug");
    }

    private static final Set<String> KEYS = Set.of(
            "provider", "installDirectory", "executable", "version", "platform", "architecture",
            "proxy", "tunnelProxy", "username", "accessKey", "tunnelId", "extraArgs",
            "startupTimeout", "gracePeriod", "jobStatusTimeout", "verbose",
            "protocol", "hostname", "port", "pathname", "options"
    );

    private final ProviderType provider;
    private final Path installDirectory;
    private final String executable;
    private final String version;
    private final Platform platform;
    private final String proxy;
    private final String tunnelProxy;
    private final String username;
    private final String accessKey;
    private final String tunnelId;
    private final List<String> extraArgs;
    private final Duration startupTimeout;
    private final Duration gracePeriod;
    private final Duration jobStatusTimeout;
    private final boolean verbose;
    private final String protocol;
    private final String hostname;
    private final Integer port;
    private final String pathname;
    private final Map<String, String> environment;
    private final Map<String, Object> options;

    private TunnelConfig(Builder b) {
        this.provider = b.provider;
        this.installDirectory = b.installDirectory == null ? defaultInstallDirectory() : b.installDirectory;
        this.executable = b.executable;
        this.version = b.version;
        this.platform = b.platform == null ? Platform.current() : b.platform;
        this.proxy = b.proxy;
        this.tunnelProxy = b.tunnelProxy;
        this.username = b.username;
        this.accessKey = b.accessKey;
        this.tunnelId = b.tunnelId;
        this.extraArgs = List.copyOf(b.extraArgs);
        this.startupTimeout = b.startupTimeout;
        this.gracePeriod = b.gracePeriod;
        this.jobStatusTimeout = b.jobStatusTimeout;
        this.verbose = b.verbose;
        this.protocol = b.protocol;
        this.hostname = b.hostname;
        this.port = b.port;
        this.pathname = b.pathname;
        this.environment = b.environment == null ? System.getenv() : Map.copyOf(b.environment);
        this.options = Map.copyOf(b.options);
    }

    public static Builder builder(ProviderType provider) {
        return new Builder(provider);
    }

    public Builder toBuilder() {
        return toBuilder(provider);
    }

    /**
     * A builder with all values of this configuration, for another provider.
     */
    public Builder toBuilder(ProviderType provider) {
        Builder b = new Builder(provider);
        b.installDirectory = installDirectory;
        b.executable = executable;
        b.version = version;
        b.platform = platform;
        b.proxy = proxy;
        b.tunnelProxy = tunnelProxy;
        b.username = username;
        b.accessKey = accessKey;
        b.tunnelId = tunnelId;
        b.extraArgs.addAll(extraArgs);
        b.startupTimeout = startupTimeout;
        b.gracePeriod = gracePeriod;
        b.jobStatusTimeout = jobStatusTimeout;
        b.verbose = verbose;
        b.protocol = protocol;
        b.hostname = hostname;
        b.port = port;
        b.pathname = pathname;
        b.environment = environment;
        b.options.putAll(options);
        return b;
    }

    // ========== Loading ==========

    /**
     * Load configuration from a JSON file.
     *
     * @throws ConfigurationException if the file cannot be read or parsed
     */
    public static TunnelConfig load(Path path) {
        Map<String, Object> map = read(path);
        try {
            return fromMap(map);
        } catch (ConfigurationException e) {
            throw new ConfigurationException("invalid config in " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load configuration from a JSON file for the given provider. The file may omit the provider,
     * or name another one.
     */
    public static TunnelConfig load(Path path, ProviderType provider) {
        Map<String, Object> map = new LinkedHashMap<>(read(path));
        map.put("provider", provider.getName());
        try {
            return fromMap(map);
        } catch (ConfigurationException e) {
            throw new ConfigurationException("invalid config in " + path + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> read(Path path) {
        String content;
        try {
            content = Files.readString(path);
        } catch (Exception e) {
            throw new ConfigurationException("failed to read config from: " + path, e);
        }
        try {
            return Json.parseObject(content);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("invalid config in " + path + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    public static TunnelConfig fromMap(Map<String, Object> map) {
        Builder b = builder(ProviderType.fromName(asString(map.get("provider"))));
        String dir = asString(map.get("installDirectory"));
        if (dir != null) {
            b.installDirectory(Path.of(dir));
        }
        b.executable(asString(map.get("executable")));
        b.version(asString(map.get("version")));
        String os = asString(map.get("platform"));
        String arch = asString(map.get("architecture"));
        if (os != null || arch != null) {
            Platform current = Platform.current();
            b.platform(Platform.of(os == null ? current.os() : os, arch == null ? current.arch() : arch));
        }
        b.proxy(asString(map.get("proxy")));
        b.tunnelProxy(asString(map.get("tunnelProxy")));
        b.username(asString(map.get("username")));
        b.accessKey(asString(map.get("accessKey")));
        b.tunnelId(asString(map.get("tunnelId")));
        b.extraArgs(asStringList(map.get("extraArgs")));
        Duration startup = asMillis(map.get("startupTimeout"));
        if (startup != null) {
            b.startupTimeout(startup);
        }
        Duration grace = asMillis(map.get("gracePeriod"));
        if (grace != null) {
            b.gracePeriod(grace);
        }
        Duration jobStatus = asMillis(map.get("jobStatusTimeout"));
        if (jobStatus != null) {
            b.jobStatusTimeout(jobStatus);
        }
        if (map.get("verbose") instanceof Boolean verbose) {
            b.verbose(verbose);
        }
        b.protocol(asString(map.get("protocol")));
        b.hostname(asString(map.get("hostname")));
        if (map.get("port") != null) {
            b.port(asInt(map.get("port"), "port"));
        }
        b.pathname(asString(map.get("pathname")));
        if (map.get("options") instanceof Map) {
            ((Map<String, Object>) map.get("options")).forEach(b::option);
        }
        map.forEach((k, v) -> {
            if (!KEYS.contains(k)) {
                b.option(k, v);
            }
        });
        return b.build();
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static List<String> asStringList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> c) {
            List<String> list = new ArrayList<>(c.size());
            c.forEach(o -> list.add(String.valueOf(o)));
            return list;
        }
        String s = value.toString();
        if (s.isBlank()) {
            return List.of();
        }
        List<String> list = new ArrayList<>();
        for (String part : s.split(",")) {
            if (!part.isBlank()) {
                list.add(part.trim());
            }
        }
        return list;
    }

    private static int asInt(Object value, String key) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("number expected for: " + key + ", got: " + value);
        }
    }

    private static Duration asMillis(Object value) {
        if (value == null) {
            return null;
        }
        return Duration.ofMillis(asInt(value, "duration"));
    }

    // ========== Credentials ==========

    /**
     * The explicit username, or the value of the environment variable.
     */
    public String resolveUsername(String variable) {
        return username != null ? username : lookup(variable);
    }

    public String resolveAccessKey(String variable) {
        return accessKey != null ? accessKey : lookup(variable);
    }

    private String lookup(String variable) {
        if (variable == null) {
            return null;
        }
        String value = environment.get(variable);
        return value == null || value.isEmpty() ? null : value;
    }

    // ========== Options ==========

    public Object getOption(String key) {
        return options.get(key);
    }

    public String getStringOption(String key) {
        return asString(options.get(key));
    }

    public List<String> getStringListOption(String key) {
        return asStringList(options.get(key));
    }

    public boolean getBooleanOption(String key, boolean defaultValue) {
        Object value = options.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString());
    }

    public int getIntOption(String key, int defaultValue) {
        Object value = options.get(key);
        return value == null ? defaultValue : asInt(value, key);
    }

    // ========== Accessors ==========

    public ProviderType getProvider() {
        return provider;
    }

    public Path getInstallDirectory() {
        return installDirectory;
    }

    /**
     * {@code <installDirectory>/<provider>}
     */
    public Path getProviderDirectory() {
        return installDirectory.resolve(provider.getName());
    }

    public String getExecutable() {
        return executable;
    }

    public String getVersion() {
        return version;
    }

    public Platform getPlatform() {
        return platform;
    }

    public String getProxy() {
        return proxy;
    }

    public String getTunnelProxy() {
        return tunnelProxy;
    }

    public ProxySettings getProxySettings() {
        return ProxySettings.parse(proxy);
    }

    /**
     * The proxy the tunnel process itself should use: {@code tunnelProxy} if set, else {@code proxy}.
     */
    public ProxySettings getTunnelProxySettings() {
        return tunnelProxy != null ? ProxySettings.parse(tunnelProxy) : getProxySettings();
    }

    public String getUsername() {
        return username;
    }

    public String getAccessKey() {
        return accessKey;
    }

    public String getTunnelId() {
        return tunnelId;
    }

    public List<String> getExtraArgs() {
        return extraArgs;
    }

    public Duration getStartupTimeout() {
        return startupTimeout;
    }

    public Duration getGracePeriod() {
        return gracePeriod;
    }

    public Duration getJobStatusTimeout() {
        return jobStatusTimeout;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public String getProtocol() {
        return protocol;
    }

    public String getHostname() {
        return hostname;
    }

    public Integer getPort() {
        return port;
    }

    public String getPathname() {
        return pathname;
    }

    public Map<String, String> getEnvironment() {
        return environment;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    @Override
    public String toString() {
        // credentials and proxy auth are left out on purpose
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("provider", provider.getName());
        map.put("installDirectory", installDirectory.toString());
        map.put("platform", platform.toString());
        if (version != null) {
            map.put("version", version);
        }
        if (tunnelId != null) {
            map.put("tunnelId", tunnelId);
        }
        map.put("startupTimeout", startupTimeout.toMillis());
        map.put("verbose", verbose);
        return map.toString();
    }

    // ========== Builder ==========

    public static class Builder {

        private final ProviderType provider;
        private Path installDirectory;
        private String executable;
        private String version;
        private Platform platform;
        private String proxy;
        private String tunnelProxy;
        private String username;
        private String accessKey;
        private String tunnelId;
        private final List<String> extraArgs = new ArrayList<>();
        private Duration startupTimeout = DEFAULT_STARTUP_TIMEOUT;
        private Duration gracePeriod = DEFAULT_GRACE_PERIOD;
        private Duration jobStatusTimeout = DEFAULT_JOB_STATUS_TIMEOUT;
        private boolean verbose;
        private String protocol;
        private String hostname;
        private Integer port;
        private String pathname;
        private Map<String, String> environment;
        private final Map<String, Object> options = new HashMap<>();

        private Builder(ProviderType provider) {
            if (provider == null) {
                throw new ConfigurationException("provider is required");
            }
            this.provider = provider;
        }

        public Builder installDirectory(Path installDirectory) {
            this.installDirectory = installDirectory;
            return this;
        }

        public Builder executable(String executable) {
            this.executable = executable;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder platform(Platform platform) {
            this.platform = platform;
            return this;
        }

        public Builder proxy(String proxy) {
            this.proxy = proxy;
            return this;
        }

        public Builder tunnelProxy(String tunnelProxy) {
            this.tunnelProxy = tunnelProxy;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder accessKey(String accessKey) {
            this.accessKey = accessKey;
            return this;
        }

        public Builder tunnelId(String tunnelId) {
            this.tunnelId = tunnelId;
            return this;
        }

        public Builder extraArgs(List<String> extraArgs) {
            this.extraArgs.clear();
            this.extraArgs.addAll(extraArgs);
            return this;
        }

        public Builder startupTimeout(Duration startupTimeout) {
            this.startupTimeout = startupTimeout;
            return this;
        }

        public Builder gracePeriod(Duration gracePeriod) {
            this.gracePeriod = gracePeriod;
            return this;
        }

        public Builder jobStatusTimeout(Duration jobStatusTimeout) {
            this.jobStatusTimeout = jobStatusTimeout;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder protocol(String protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder port(Integer port) {
            this.port = port;
            return this;
        }

        public Builder pathname(String pathname) {
            this.pathname = pathname;
            return this;
        }

        /**
         * Variables used for credential lookup, the process environment if not set.
         */
        public Builder environment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        /**
         * A provider specific setting, for example {@code servers} for BrowserStack or {@code drivers} for Selenium.
         */
        public Builder option(String key, Object value) {
            if (value == null) {
                options.remove(key);
            } else {
                options.put(key, value);
            }
            return this;
        }

        public TunnelConfig build() {
            if (startupTimeout == null || startupTimeout.isNegative() || startupTimeout.isZero()) {
                throw new ConfigurationException("startupTimeout must be positive");
            }
            if (gracePeriod == null || gracePeriod.isNegative()) {
                throw new ConfigurationException("gracePeriod must not be negative");
            }
            if (jobStatusTimeout == null || jobStatusTimeout.isNegative() || jobStatusTimeout.isZero()) {
                throw new ConfigurationException("jobStatusTimeout must be positive");
            }
            return new TunnelConfig(this);
        }

    }

}
