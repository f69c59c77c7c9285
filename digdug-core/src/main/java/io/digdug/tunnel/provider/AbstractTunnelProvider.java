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
import io.digdug.http.ProxySettings;
import io.digdug.tunnel.ConfigurationException;
import io.digdug.tunnel.TunnelConfig;
import io.digdug.tunnel.TunnelProvider;

import java.util.ArrayList;
import java.util.List;

/**
 * Credential and platform helpers shared by the hosted tunnel providers.
 */
public abstract class AbstractTunnelProvider implements TunnelProvider {

    protected abstract String usernameVariable();

    protected abstract String accessKeyVariable();

    /**
     * Human readable provider name used in error messages.
     */
    protected abstract String displayName();

    @Override
    public List<String> credentialVariables() {
        return List.of(usernameVariable(), accessKeyVariable());
    }

    protected String username(TunnelConfig config) {
        return config.resolveUsername(usernameVariable());
    }

    protected String accessKey(TunnelConfig config) {
        return config.resolveAccessKey(accessKeyVariable());
    }

    /**
     * @throws ConfigurationException if the username or the access key is missing
     */
    protected void requireCredentials(TunnelConfig config) {
        if (username(config) == null || accessKey(config) == null) {
            throw new ConfigurationException(displayName() + " requires a username and access key, set "
                    + usernameVariable() + " and " + accessKeyVariable() + " or configure them explicitly");
        }
    }

    @Override
    public void validate(TunnelConfig config) {
        requireCredentials(config);
        artifacts(config);
    }

    @Override
    public List<String> secrets(TunnelConfig config) {
        List<String> secrets = new ArrayList<>();
        addIfPresent(secrets, accessKey(config));
        addProxySecrets(secrets, config.getProxySettings());
        addProxySecrets(secrets, config.getTunnelProxySettings());
        return secrets;
    }

    protected static void addProxySecrets(List<String> secrets, ProxySettings proxy) {
        if (proxy != null && proxy.hasCredentials()) {
            addIfPresent(secrets, proxy.getAuth());
            addIfPresent(secrets, proxy.password());
        }
    }

    private static void addIfPresent(List<String> list, String value) {
        if (value != null && !value.isEmpty() && !list.contains(value)) {
            list.add(value);
        }
    }

    protected static String exe(Platform platform, String name) {
        return platform.executableName(name);
    }

    protected static ConfigurationException unsupported(String provider, Platform platform) {
        return new ConfigurationException(provider + " does not support the platform " + platform);
    }

}
