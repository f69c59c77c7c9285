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
import io.digdug.http.HttpRequest;
import io.digdug.process.ProcessEvent;
import io.digdug.process.Readiness;
import io.digdug.process.ReadinessMatcher;
import io.digdug.tunnel.ConfigurationException;
import io.digdug.tunnel.JobState;
import io.digdug.tunnel.LaunchContext;
import io.digdug.tunnel.NormalizedEnvironment;
import io.digdug.tunnel.ProviderType;
import io.digdug.tunnel.TunnelConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BrowserStackProviderTest {

    static final Path INSTALL = Path.of("/opt/digdug");
    static final LaunchContext CONTEXT = new LaunchContext(INSTALL.resolve("browserstack"), Path.of("/tmp/bs.ready"));

    final BrowserStackProvider provider = new BrowserStackProvider();

    private static TunnelConfig.Builder builder() {
        return TunnelConfig.builder(ProviderType.BROWSERSTACK)
                .installDirectory(INSTALL)
                .platform(Platform.of("linux", "x64"))
                .environment(Map.of("BROWSERSTACK_USERNAME", "jane", "BROWSERSTACK_ACCESS_KEY", "s3cret"));
    }

    @Test
    void testDownloadUrl() {
        assertEquals("https://www.browserstack.com/browserstack-local/BrowserStackLocal-darwin-x64.zip",
                BrowserStackProvider.downloadUrl(Platform.of("darwin", "x64")));
        assertEquals("https://www.browserstack.com/browserstack-local/BrowserStackLocal-win32.zip",
                BrowserStackProvider.downloadUrl(Platform.of("win32", "x64")));
        assertEquals("https://www.browserstack.com/browserstack-local/BrowserStackLocal-linux-ia32.zip",
                BrowserStackProvider.downloadUrl(Platform.of("linux", "ia32")));
    }

    @Test
    void testUnsupportedPlatform() {
        TunnelConfig config = builder().platform(Platform.of("darwin", "arm64")).build();
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> provider.validate(config));
        assertTrue(e.getMessage().contains("darwin-arm64"));
    }

    @Test
    void testExecutable() {
        assertEquals(INSTALL.resolve("browserstack/BrowserStackLocal"), provider.resolveExecutable(builder().build()));
        TunnelConfig windows = builder().platform(Platform.of("win32", "x64")).build();
        assertEquals(INSTALL.resolve("browserstack/BrowserStackLocal.exe"), provider.resolveExecutable(windows));
    }

    @Test
    void testDefaultArgs() {
        assertEquals(List.of("s3cret", "", "-onlyAutomate", "-skipCheck"), provider.buildArgs(builder().build(), CONTEXT));
    }

    @Test
    void testArgs() {
        TunnelConfig config = builder()
                .tunnelId("build-42")
                .verbose(true)
                .tunnelProxy("http://bob:pw@proxy.local:3128")
                .option("servers", List.of("https://example.com", "http://localhost:8080"))
                .option("automateOnly", false)
                .option("forceLocal", true)
                .option("killOtherTunnels", true)
                .build();
        assertEquals(List.of(
                "s3cret", "example.com,443,1,localhost,8080,0",
                "-forcelocal", "-force", "-skipCheck",
                "-localIdentifier", "build-42",
                "-v",
                "-proxyHost", "proxy.local", "-proxyPort", "3128",
                "-proxyUser", "bob", "-proxyPass", "pw"), provider.buildArgs(config, CONTEXT));
    }

    @Test
    void testServerSpec() {
        assertEquals("example.com,8443,1", BrowserStackProvider.serverSpec("https://example.com:8443"));
        assertEquals("example.com,80,0", BrowserStackProvider.serverSpec("http://example.com"));
        assertThrows(ConfigurationException.class, () -> BrowserStackProvider.serverSpec("no host"));
    }

    @Test
    void testReadiness() {
        ReadinessMatcher matcher = provider.readinessMatcher(builder().build(), CONTEXT);
        assertTrue(matcher.onEvent(ProcessEvent.stdout("BrowserStackLocal v8.1")).isPending());
        Readiness failed = matcher.onEvent(ProcessEvent.stdout("  *** Error: Invalid key"));
        assertTrue(failed.isFailed());
        assertEquals("Invalid key", failed.message());
        assertTrue(matcher.onEvent(ProcessEvent.stdout(
                "[SUCCESS] " + BrowserStackProvider.READY_MESSAGE)).isReady());
    }

    @Test
    void testStatusLine() {
        assertEquals("Connecting to BrowserStack using WebSocket",
                provider.statusLine(ProcessEvent.stdout("Connecting to BrowserStack using WebSocket")));
        assertNull(provider.statusLine(ProcessEvent.stdout("something else")));
    }

    @Test
    void testClient() {
        TunnelConfig config = builder().tunnelId("build-42").build();
        assertEquals("https", provider.defaultProtocol());
        assertEquals("hub.browserstack.com", provider.defaultHostname());
        assertEquals(443, provider.defaultPort());
        assertEquals(Map.of("browserstack.local", "true", "browserstack.localIdentifier", "build-42"),
                provider.extraCapabilities(config));
    }

    @Test
    void testJobStatusRequest() {
        HttpRequest passed = provider.jobStatusRequest(builder().build(), "s1", JobState.passed());
        assertEquals("https://www.browserstack.com/automate/sessions/s1.json", passed.getUrl());
        assertEquals("{\"status\":\"completed\"}", passed.getBodyString());
        HttpRequest failed = provider.jobStatusRequest(builder().build(), "s1", JobState.failed());
        assertEquals("{\"status\":\"error\"}", failed.getBodyString());
        HttpRequest explicit = provider.jobStatusRequest(builder().build(), "s1",
                JobState.builder(true).status("error").build());
        assertEquals("{\"status\":\"error\"}", explicit.getBodyString());
    }

    @Test
    void testEnvironmentsNeedCredentials() {
        TunnelConfig config = builder().environment(Map.of()).build();
        assertThrows(ConfigurationException.class, () -> provider.environmentsRequest(config));
    }

    @Test
    void testNormalizeEnvironment() {
        NormalizedEnvironment env = provider.normalizeEnvironment(Map.of(
                "os", "Windows", "os_version", "8.1", "browser", "ie", "browser_version", "11.0")).get(0);
        assertEquals("WIN8", env.platform());
        assertEquals("internet explorer", env.browserName());
        assertEquals("11.0", env.version());

        env = provider.normalizeEnvironment(Map.of(
                "os", "OS X", "os_version", "Mojave", "browser", "safari", "browser_version", "12.0")).get(0);
        assertEquals("MAC", env.platform());
        assertEquals("Mojave", env.platformVersion());
    }

}
