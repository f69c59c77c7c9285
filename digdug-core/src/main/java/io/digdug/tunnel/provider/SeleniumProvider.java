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

import io.digdug.fetch.Artifact;
import io.digdug.process.PortUtils;
import io.digdug.process.ProcessEvent;
import io.digdug.process.Readiness;
import io.digdug.process.ReadinessMatcher;
import io.digdug.selenium.DriverDescriptor;
import io.digdug.selenium.DriverResolver;
import io.digdug.tunnel.ConfigurationException;
import io.digdug.tunnel.LaunchContext;
import io.digdug.tunnel.ProviderType;
import io.digdug.tunnel.TunnelConfig;
import io.digdug.tunnel.TunnelProvider;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A local Selenium standalone server plus the WebDriver executables it needs. Requires java on the path.
 * <p>
 * Provider options:
 * <ul>
 * <li>{@code drivers}: driver names, or objects with {@code name} and {@code version}, or custom
 * definitions with {@code url}, {@code executable} and {@code seleniumProperty}; default {@code ["chrome"]}</li>
 * <li>{@code seleniumArgs}: extra JVM arguments placed before {@code -jar}</li>
 * <li>{@code baseUrl}: where the server jar is downloaded from</li>
 * </ul>
 */
public class SeleniumProvider implements TunnelProvider {

    public static final String DEFAULT_VERSION = "3.141.59";
    public static final String DEFAULT_BASE_URL = "https://selenium-release.storage.googleapis.com";

    private static final Pattern READY = Pattern.compile("Selenium Server is up and running|Started Selenium");
    private static final Pattern ADDRESS_IN_USE = Pattern.compile("Address already in use|Port \\d+ is busy");

    private final DriverResolver resolver;

    public SeleniumProvider(DriverResolver resolver) {
        this.resolver = resolver;
    }

    public SeleniumProvider() {
        this(new DriverResolver());
    }

    @Override
    public ProviderType type() {
        return ProviderType.SELENIUM;
    }

    // ========== Drivers ==========

    /**
     * @throws ConfigurationException on unknown driver names or malformed definitions
     */
    @SuppressWarnings("unchecked")
    public List<DriverDescriptor> drivers(TunnelConfig config) {
        Object value = config.getOption("drivers");
        List<Object> entries;
        if (value == null) {
            entries = List.of(DriverResolver.CHROME);
        } else if (value instanceof List) {
            entries = (List<Object>) value;
        } else {
            entries = new ArrayList<>(config.getStringListOption("drivers"));
        }
        List<String> names = new ArrayList<>();
        for (Object entry : entries) {
            if (entry instanceof String name) {
                names.add(name);
            } else if (entry instanceof Map<?, ?> map && map.get("name") != null) {
                names.add(map.get("name").toString());
            }
        }
        DriverResolver.validate(names);
        List<DriverDescriptor> drivers = new ArrayList<>();
        for (Object entry : entries) {
            if (entry instanceof String name) {
                drivers.add(resolver.resolve(name, config.getPlatform()));
            } else if (entry instanceof Map<?, ?> map) {
                drivers.add(fromMap((Map<String, Object>) map, config));
            } else {
                throw new ConfigurationException("invalid driver entry: " + entry);
            }
        }
        return drivers;
    }

    private DriverDescriptor fromMap(Map<String, Object> map, TunnelConfig config) {
        Object name = map.get("name");
        if (name != null) {
            Object version = map.get("version");
            return resolver.resolve(name.toString(), config.getPlatform(), version == null ? null : version.toString());
        }
        Object url = map.get("url");
        Object executable = map.get("executable");
        Object property = map.get("seleniumProperty");
        if (url == null || executable == null || property == null) {
            throw new ConfigurationException("a custom driver needs url, executable and seleniumProperty: " + map);
        }
        return new DriverDescriptor(null, null, url.toString(), executable.toString(), property.toString());
    }

    // ========== Install ==========

    private static String version(TunnelConfig config) {
        return config.getVersion() != null ? config.getVersion() : DEFAULT_VERSION;
    }

    public static String jarName(String version) {
        return "selenium-server-standalone-" + version + ".jar";
    }

    /**
     * {@code <baseUrl>/<major.minor>/selenium-server-standalone-<version>.jar}
     */
    public static String jarUrl(String baseUrl, String version) {
        int last = version.lastIndexOf('.');
        String majorMinor = last == -1 ? version : version.substring(0, last);
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + "/" + majorMinor + "/" + jarName(version);
    }

    @Override
    public List<Artifact> artifacts(TunnelConfig config) {
        String baseUrl = config.getStringOption("baseUrl");
        String url = jarUrl(baseUrl != null ? baseUrl : DEFAULT_BASE_URL, version(config));
        List<Artifact> artifacts = new ArrayList<>();
        artifacts.add(Artifact.raw(url, resolveExecutable(config)));
        Path dir = config.getProviderDirectory();
        for (DriverDescriptor driver : drivers(config)) {
            Artifact artifact = driver.toArtifact(dir);
            if (artifact != null) {
                artifacts.add(artifact);
            }
        }
        return artifacts;
    }

    @Override
    public Path resolveExecutable(TunnelConfig config) {
        return config.getProviderDirectory().resolve(jarName(version(config)));
    }

    @Override
    public String launchExecutable(TunnelConfig config) {
        return config.getExecutable() != null ? config.getExecutable() : "java";
    }

    // ========== Launch ==========

    @Override
    public List<String> buildArgs(TunnelConfig config, LaunchContext context) {
        List<String> args = new ArrayList<>();
        for (DriverDescriptor driver : drivers(config)) {
            args.add(driver.toSystemProperty(context.providerDirectory()));
        }
        args.addAll(config.getStringListOption("seleniumArgs"));
        args.add("-jar");
        args.add(resolveExecutable(config).toString());
        args.add("-port");
        args.add(String.valueOf(port(config)));
        if (config.isVerbose()) {
            args.add("-debug");
            if (debugTakesValue(version(config))) {
                args.add("true");
            }
        }
        return args;
    }

    /**
     * Selenium 3.1 to 3.4 expect a value after {@code -debug}.
     */
    static boolean debugTakesValue(String version) {
        String[] parts = version.split("\\.");
        try {
            int major = Integer.parseInt(parts[0]);
            int minor = parts.length > 1 ? Integer.parseInt(parts[1]) : 0;
            return major == 3 && minor >= 1 && minor < 5;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private int port(TunnelConfig config) {
        return config.getPort() != null ? config.getPort() : defaultPort();
    }

    /**
     * Also fails if something already listens on the server port, the status check could not tell
     * that server from the one being started.
     */
    @Override
    public void validate(TunnelConfig config) {
        artifacts(config);
        int port = port(config);
        if (PortUtils.isPortOpen("localhost", port)) {
            throw new ConfigurationException("port " + port + " is already in use");
        }
    }

    /**
     * Ready on the startup log line, or as soon as {@code /wd/hub/status} answers.
     */
    @Override
    public ReadinessMatcher readinessMatcher(TunnelConfig config, LaunchContext context) {
        String statusUrl = "http://localhost:" + port(config) + "/wd/hub/status";
        return ReadinessMatcher.anyOf(outputMatcher(), ReadinessMatcher.http(statusUrl));
    }

    private static ReadinessMatcher outputMatcher() {
        return new ReadinessMatcher() {
            @Override
            public Readiness onEvent(ProcessEvent event) {
                if (!event.isOutput() || event.data() == null) {
                    return Readiness.pending();
                }
                if (ADDRESS_IN_USE.matcher(event.data()).find()) {
                    return Readiness.failed("Address is already in use");
                }
                return READY.matcher(event.data()).find() ? Readiness.ready() : Readiness.pending();
            }
        };
    }

}
