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

import com.sun.net.httpserver.HttpServer;
import io.digdug.common.Platform;
import io.digdug.fetch.Artifact;
import io.digdug.process.ProcessEvent;
import io.digdug.process.Readiness;
import io.digdug.process.ReadinessMatcher;
import io.digdug.process.TestPorts;
import io.digdug.selenium.DriverDescriptor;
import io.digdug.tunnel.ConfigurationException;
import io.digdug.tunnel.LaunchContext;
import io.digdug.tunnel.ProviderType;
import io.digdug.tunnel.TunnelConfig;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SeleniumProviderTest {

    static final Path INSTALL = Path.of("/opt/digdug");
    static final Path DIR = INSTALL.resolve("selenium");
    static final LaunchContext CONTEXT = new LaunchContext(DIR, Path.of("/tmp/selenium.ready"));

    final SeleniumProvider provider = new SeleniumProvider();

    private static TunnelConfig.Builder builder() {
        return TunnelConfig.builder(ProviderType.SELENIUM)
                .installDirectory(INSTALL)
                .platform(Platform.of("linux", "x64"));
    }

    @Test
    void testJarUrl() {
        assertEquals("https://selenium-release.storage.googleapis.com/3.141/selenium-server-standalone-3.141.59.jar",
                SeleniumProvider.jarUrl(SeleniumProvider.DEFAULT_BASE_URL, "3.141.59"));
        assertEquals("http://mirror.local/3.4/selenium-server-standalone-3.4.0.jar",
                SeleniumProvider.jarUrl("http://mirror.local/", "3.4.0"));
    }

    @Test
    void testDefaultArtifacts() {
        List<Artifact> artifacts = provider.artifacts(builder().build());
        assertEquals(2, artifacts.size());
        assertEquals(Artifact.Kind.RAW, artifacts.get(0).kind());
        assertEquals(DIR.resolve("selenium-server-standalone-3.141.59.jar"), artifacts.get(0).installedFile());
        Artifact chrome = artifacts.get(1);
        assertEquals("https://chromedriver.storage.googleapis.com/114.0.5735.90/chromedriver_linux64.zip", chrome.url());
        assertEquals(DIR.resolve("chrome/114.0.5735.90/x64/chromedriver"), chrome.installedFile());
    }

    @Test
    void testDriverEntries() {
        TunnelConfig config = builder().option("drivers", List.of(
                "firefox",
                Map.of("name", "chrome", "version", "113.0.5672.63"),
                Map.of("url", "https://example.com/mydriver.zip", "executable", "custom/mydriver",
                        "seleniumProperty", "webdriver.custom.driver"))).build();
        List<DriverDescriptor> drivers = provider.drivers(config);
        assertEquals(3, drivers.size());
        assertEquals("firefox", drivers.get(0).name());
        assertEquals("113.0.5672.63", drivers.get(1).version());
        assertEquals("webdriver.custom.driver", drivers.get(2).seleniumProperty());
    }

    @Test
    void testDriversFromString() {
        TunnelConfig config = builder().option("drivers", "chrome,firefox").build();
        assertEquals(2, provider.drivers(config).size());
    }

    @Test
    void testInvalidDriverName() {
        TunnelConfig config = builder().option("drivers", List.of("chrome", "foo")).build();
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> provider.validate(config));
        assertTrue(e.getMessage().contains("foo"));
    }

    @Test
    void testIncompleteCustomDriver() {
        TunnelConfig config = builder().option("drivers", List.of(Map.of("url", "https://example.com/d.zip"))).build();
        assertThrows(ConfigurationException.class, () -> provider.drivers(config));
    }

    @Test
    void testArgs() {
        TunnelConfig config = builder()
                .port(4446)
                .option("drivers", List.of("chrome"))
                .option("seleniumArgs", List.of("-Xmx512m"))
                .build();
        assertEquals("java", provider.launchExecutable(config));
        assertEquals(List.of(
                "-Dwebdriver.chrome.driver=" + DIR.resolve("chrome/114.0.5735.90/x64/chromedriver"),
                "-Xmx512m",
                "-jar", DIR.resolve("selenium-server-standalone-3.141.59.jar").toString(),
                "-port", "4446"), provider.buildArgs(config, CONTEXT));
    }

    @Test
    void testDebugFlag() {
        List<String> args = provider.buildArgs(builder().verbose(true).build(), CONTEXT);
        assertEquals("-debug", args.get(args.size() - 1));
        args = provider.buildArgs(builder().verbose(true).version("3.4.0").build(), CONTEXT);
        assertEquals(List.of("-debug", "true"), args.subList(args.size() - 2, args.size()));
        assertFalse(SeleniumProvider.debugTakesValue("3.0.1"));
        assertFalse(SeleniumProvider.debugTakesValue("3.141.59"));
    }

    @Test
    void testReadiness() {
        ReadinessMatcher matcher = provider.readinessMatcher(builder().build(), CONTEXT);
        assertTrue(matcher.onEvent(ProcessEvent.stderr("Launching a standalone Selenium Server")).isPending());
        Readiness busy = matcher.onEvent(ProcessEvent.stderr("java.net.BindException: Address already in use"));
        assertTrue(busy.isFailed());
        assertEquals("Address is already in use", busy.message());
        assertTrue(matcher.onEvent(ProcessEvent.stderr("INFO - Selenium Server is up and running on port 4444")).isReady());
    }

    @Test
    void testReadyWhenStatusAnswers() throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/wd/hub/status", exchange -> {
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        server.start();
        try {
            int port = server.getAddress().getPort();
            TunnelConfig config = builder().port(port).build();
            ReadinessMatcher matcher = provider.readinessMatcher(config, CONTEXT);
            assertTrue(matcher.isPolling());
            assertTrue(matcher.poll().isReady());
            // the same server is in the way of a new one
            ConfigurationException e = assertThrows(ConfigurationException.class, () -> provider.validate(config));
            assertTrue(e.getMessage().contains("port " + port + " is already in use"));
        } finally {
            server.stop(0);
        }
    }

    @Test
    void testPendingWhileStatusDown() {
        TunnelConfig config = builder().port(TestPorts.freePort()).build();
        assertTrue(provider.readinessMatcher(config, CONTEXT).poll().isPending());
        assertDoesNotThrow(() -> provider.validate(config));
    }

    @Test
    void testClientDefaults() {
        assertEquals("http", provider.defaultProtocol());
        assertEquals("localhost", provider.defaultHostname());
        assertEquals(4444, provider.defaultPort());
        assertEquals("/wd/hub/", provider.defaultPathname());
    }

}
