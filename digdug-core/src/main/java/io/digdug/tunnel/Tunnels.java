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

import io.digdug.tunnel.provider.BrowserStackProvider;
import io.digdug.tunnel.provider.CrossBrowserTestingProvider;
import io.digdug.tunnel.provider.NullProvider;
import io.digdug.tunnel.provider.SauceLabsProvider;
import io.digdug.tunnel.provider.SeleniumProvider;
import io.digdug.tunnel.provider.TestingBotProvider;

import java.nio.file.Path;

/**
 * Entry point for creating tunnels.
 * <pre>
 * TunnelConfig config = TunnelConfig.builder(ProviderType.SAUCELABS).tunnelId("build-42").build();
 * try (Tunnel tunnel = Tunnels.create(config)) {
 *     tunnel.start().join();
 *     // run sessions against tunnel.getClientUrl()
 * }
 * </pre>
 */
public final class Tunnels {

    private Tunnels() {
    }

    public static TunnelProvider provider(ProviderType type) {
        return switch (type) {
            case SAUCELABS -> new SauceLabsProvider();
            case BROWSERSTACK -> new BrowserStackProvider();
            case TESTINGBOT -> new TestingBotProvider();
            case CROSSBROWSERTESTING -> new CrossBrowserTestingProvider();
            case SELENIUM -> new SeleniumProvider();
            case NULL -> new NullProvider();
        };
    }

    public static Tunnel create(TunnelConfig config) {
        return new Tunnel(config, provider(config.getProvider()));
    }

    public static Tunnel create(ProviderType type) {
        return create(TunnelConfig.builder(type).build());
    }

    /**
     * A tunnel configured from a JSON file.
     *
     * @throws ConfigurationException if the file cannot be read or has invalid values
     */
    public static Tunnel load(Path configFile) {
        return create(TunnelConfig.load(configFile));
    }

}
