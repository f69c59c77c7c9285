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
package io.digdug.selenium;

import io.digdug.common.Platform;
import io.digdug.tunnel.ConfigurationException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps a driver name and platform to the download url and executable of the WebDriver binary.
 * No I/O: unknown names and unsupported platforms are reported before anything is downloaded.
 * <p>
 * Drivers install under {@code <name>/<version>/<arch>/} inside the provider directory.
 */
public class DriverResolver {

    public static final String CHROME = "chrome";
    public static final String FIREFOX = "firefox";
    public static final String IE = "ie";
    public static final String EDGE = "edge";
    public static final String SAFARI = "safari";

    public static final Set<String> NAMES = Set.of(CHROME, FIREFOX, IE, EDGE, SAFARI);

    public static final String CHROME_BASE_URL = "https://chromedriver.storage.googleapis.com";
    public static final String FIREFOX_BASE_URL = "https://github.com/mozilla/geckodriver/releases/download";
    public static final String IE_BASE_URL = "https://selenium-release.storage.googleapis.com";
    public static final String EDGE_BASE_URL = "https://msedgedriver.azureedge.net";

    public static final String SAFARI_EXECUTABLE = "/usr/bin/safaridriver";

    private static final Map<String, String> ALIASES = Map.of(
            "internet explorer", IE,
            "MicrosoftEdge", EDGE);

    private static final Map<String, String> DEFAULT_VERSIONS = Map.of(
            CHROME, "114.0.5735.90",
            FIREFOX, "0.34.0",
            IE, "3.150.1",
            EDGE, "114.0.1823.67");

    private final Map<String, String> baseUrls = new LinkedHashMap<>();

    public DriverResolver() {
        baseUrls.put(CHROME, CHROME_BASE_URL);
        baseUrls.put(FIREFOX, FIREFOX_BASE_URL);
        baseUrls.put(IE, IE_BASE_URL);
        baseUrls.put(EDGE, EDGE_BASE_URL);
    }

    /**
     * Download from a mirror instead of the default location.
     */
    public DriverResolver baseUrl(String name, String url) {
        baseUrls.put(canonicalName(name), stripSlash(url));
        return this;
    }

    /**
     * The canonical name, also accepting the WebDriver browser names {@code internet explorer}
     * and {@code MicrosoftEdge}.
     *
     * @throws ConfigurationException if the name is not a known driver
     */
    public static String canonicalName(String name) {
        if (name == null) {
            throw new ConfigurationException("driver name is missing");
        }
        String canonical = ALIASES.getOrDefault(name, name);
        if (!NAMES.contains(canonical)) {
            throw new ConfigurationException("invalid driver name \"" + name + "\", expected one of " + new TreeSet<>(NAMES));
        }
        return canonical;
    }

    /**
     * @throws ConfigurationException on the first unknown name
     */
    public static void validate(Collection<String> names) {
        for (String name : names) {
            canonicalName(name);
        }
    }

    public static String defaultVersion(String name) {
        return DEFAULT_VERSIONS.get(canonicalName(name));
    }

    /**
     * @param version null for the default version
     * @throws ConfigurationException for unknown names and platforms without that driver
     */
    public DriverDescriptor resolve(String name, Platform platform, String version) {
        String canonical = canonicalName(name);
        String v = version != null ? version : DEFAULT_VERSIONS.get(canonical);
        return switch (canonical) {
            case CHROME -> chrome(platform, v);
            case FIREFOX -> firefox(platform, v);
            case IE -> ie(platform, v);
            case EDGE -> edge(platform, v);
            default -> safari(platform);
        };
    }

    public DriverDescriptor resolve(String name, Platform platform) {
        return resolve(name, platform, null);
    }

    private static String installPath(String name, String version, Platform platform, String file) {
        return name + "/" + version + "/" + platform.arch() + "/" + platform.executableName(file);
    }

    private DriverDescriptor chrome(Platform platform, String version) {
        String target;
        if (platform.isLinux()) {
            target = Platform.IA32.equals(platform.arch()) ? "linux32" : "linux64";
        } else if (platform.isMac()) {
            target = "mac64";
        } else if (platform.isWindows()) {
            target = "win32";
        } else {
            throw unsupported(CHROME, platform);
        }
        String url = baseUrls.get(CHROME) + "/" + version + "/chromedriver_" + target + ".zip";
        return new DriverDescriptor(CHROME, version, url, installPath(CHROME, version, platform, "chromedriver"),
                "webdriver.chrome.driver");
    }

    private DriverDescriptor firefox(Platform platform, String version) {
        String target;
        boolean arm = Platform.ARM64.equals(platform.arch());
        if (platform.isLinux()) {
            target = arm ? "linux-aarch64" : Platform.X64.equals(platform.arch()) ? "linux64" : "linux32";
        } else if (platform.isWindows()) {
            target = Platform.X64.equals(platform.arch()) ? "win64" : "win32";
        } else if (platform.isMac()) {
            target = arm ? "macos-aarch64" : "macos";
        } else {
            throw unsupported(FIREFOX, platform);
        }
        String extension = platform.isWindows() ? ".zip" : ".tar.gz";
        String url = baseUrls.get(FIREFOX) + "/v" + version + "/geckodriver-v" + version + "-" + target + extension;
        return new DriverDescriptor(FIREFOX, version, url, installPath(FIREFOX, version, platform, "geckodriver"),
                "webdriver.gecko.driver");
    }

    private DriverDescriptor ie(Platform platform, String version) {
        if (!platform.isWindows()) {
            throw unsupported(IE, platform);
        }
        String arch = Platform.X64.equals(platform.arch()) ? "x64" : "Win32";
        String url = baseUrls.get(IE) + "/" + majorMinor(version) + "/IEDriverServer_" + arch + "_" + version + ".zip";
        return new DriverDescriptor(IE, version, url, installPath(IE, version, platform, "IEDriverServer"),
                "webdriver.ie.driver");
    }

    private DriverDescriptor edge(Platform platform, String version) {
        String target;
        if (platform.isMac()) {
            target = "mac64";
        } else if (platform.isWindows()) {
            target = Platform.IA32.equals(platform.arch()) ? "win32" : "win64";
        } else if (platform.isLinux()) {
            target = "linux64";
        } else {
            throw unsupported(EDGE, platform);
        }
        String url = baseUrls.get(EDGE) + "/" + version + "/edgedriver_" + target + ".zip";
        return new DriverDescriptor(EDGE, version, url, installPath(EDGE, version, platform, "msedgedriver"),
                "webdriver.edge.driver");
    }

    private static DriverDescriptor safari(Platform platform) {
        if (!platform.isMac()) {
            throw unsupported(SAFARI, platform);
        }
        return new DriverDescriptor(SAFARI, null, null, SAFARI_EXECUTABLE, "webdriver.safari.driver");
    }

    /**
     * {@code 3.150.1} to {@code 3.150}.
     */
    static String majorMinor(String version) {
        int last = version.lastIndexOf('.');
        return last == -1 ? version : version.substring(0, last);
    }

    private static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static ConfigurationException unsupported(String driver, Platform platform) {
        return new ConfigurationException("the " + driver + " driver is not available for " + platform);
    }

}
