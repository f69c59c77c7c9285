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
import io.digdug.fetch.Artifact;
import io.digdug.tunnel.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DriverResolverTest {

    static final Platform LINUX = Platform.of("linux", "x64");
    static final Platform MAC_ARM = Platform.of("darwin", "arm64");
    static final Platform WINDOWS = Platform.of("win32", "x64");

    final DriverResolver resolver = new DriverResolver();

    @Test
    void testCanonicalName() {
        assertEquals("ie", DriverResolver.canonicalName("internet explorer"));
        assertEquals("edge", DriverResolver.canonicalName("MicrosoftEdge"));
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> DriverResolver.canonicalName("foo"));
        assertEquals("invalid driver name \"foo\", expected one of [chrome, edge, firefox, ie, safari]", e.getMessage());
        assertThrows(ConfigurationException.class, () -> DriverResolver.validate(List.of("chrome", "opera")));
    }

    @Test
    void testChrome() {
        DriverDescriptor d = resolver.resolve("chrome", WINDOWS);
        assertEquals("https://chromedriver.storage.googleapis.com/114.0.5735.90/chromedriver_win32.zip", d.url());
        assertEquals("chrome/114.0.5735.90/x64/chromedriver.exe", d.executable());
        assertEquals("webdriver.chrome.driver", d.seleniumProperty());
        assertTrue(resolver.resolve("chrome", MAC_ARM).url().endsWith("chromedriver_mac64.zip"));
    }

    @Test
    void testFirefox() {
        assertEquals("https://github.com/mozilla/geckodriver/releases/download/v0.34.0/geckodriver-v0.34.0-linux64.tar.gz",
                resolver.resolve("firefox", LINUX).url());
        assertEquals("https://github.com/mozilla/geckodriver/releases/download/v0.33.0/geckodriver-v0.33.0-macos-aarch64.tar.gz",
                resolver.resolve("firefox", MAC_ARM, "0.33.0").url());
        assertTrue(resolver.resolve("firefox", WINDOWS).url().endsWith("-win64.zip"));
        assertTrue(resolver.resolve("firefox", Platform.of("linux", "arm64")).url().endsWith("-linux-aarch64.tar.gz"));
    }

    @Test
    void testInternetExplorer() {
        DriverDescriptor d = resolver.resolve("internet explorer", WINDOWS);
        assertEquals("https://selenium-release.storage.googleapis.com/3.150/IEDriverServer_x64_3.150.1.zip", d.url());
        assertTrue(resolver.resolve("ie", Platform.of("win32", "ia32")).url().contains("IEDriverServer_Win32_"));
        assertThrows(ConfigurationException.class, () -> resolver.resolve("ie", LINUX));
    }

    @Test
    void testEdge() {
        assertEquals("https://msedgedriver.azureedge.net/114.0.1823.67/edgedriver_linux64.zip",
                resolver.resolve("MicrosoftEdge", LINUX).url());
        assertTrue(resolver.resolve("edge", WINDOWS).url().endsWith("edgedriver_win64.zip"));
    }

    @Test
    void testSafari() {
        DriverDescriptor d = resolver.resolve("safari", MAC_ARM);
        assertFalse(d.requiresDownload());
        assertNull(d.toArtifact(Path.of("/opt/digdug/selenium")));
        assertEquals(Path.of("/usr/bin/safaridriver"), d.resolveExecutable(Path.of("/opt/digdug/selenium")));
        assertThrows(ConfigurationException.class, () -> resolver.resolve("safari", WINDOWS));
    }

    @Test
    void testBaseUrlOverride() {
        resolver.baseUrl("chrome", "http://mirror.local/chromedriver/");
        assertEquals("http://mirror.local/chromedriver/114.0.5735.90/chromedriver_linux64.zip",
                resolver.resolve("chrome", LINUX).url());
    }

    @Test
    void testArtifact() {
        Path dir = Path.of("/opt/digdug/selenium");
        Artifact artifact = resolver.resolve("firefox", LINUX).toArtifact(dir);
        assertEquals(Artifact.Kind.TAR_GZ, artifact.kind());
        assertEquals(dir.resolve("firefox/0.34.0/x64"), artifact.directory());
        assertEquals(dir.resolve("firefox/0.34.0/x64/geckodriver"), artifact.installedFile());
    }

    @Test
    void testMajorMinor() {
        assertEquals("3.150", DriverResolver.majorMinor("3.150.1"));
        assertEquals("4", DriverResolver.majorMinor("4"));
    }

}
