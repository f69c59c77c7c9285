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
import io.digdug.process.ReadinessMatcher;
import io.digdug.tunnel.LaunchContext;
import io.digdug.tunnel.ProviderType;
import io.digdug.tunnel.TunnelConfig;
import io.digdug.tunnel.TunnelProvider;

import java.nio.file.Path;
import java.util.List;

/**
 * A tunnel that does nothing, for clients that connect to a WebDriver server directly.
 */
public class NullProvider implements TunnelProvider {

    @Override
    public ProviderType type() {
        return ProviderType.NULL;
    }

    @Override
    public void validate(TunnelConfig config) {
    }

    @Override
    public List<Artifact> artifacts(TunnelConfig config) {
        return List.of();
    }

    @Override
    public Path resolveExecutable(TunnelConfig config) {
        return null;
    }

    @Override
    public boolean hasProcess() {
        return false;
    }

    @Override
    public List<String> buildArgs(TunnelConfig config, LaunchContext context) {
        return List.of();
    }

    @Override
    public ReadinessMatcher readinessMatcher(TunnelConfig config, LaunchContext context) {
        return ReadinessMatcher.immediate();
    }

}
