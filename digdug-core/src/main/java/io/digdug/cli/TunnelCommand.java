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
package io.digdug.cli;

import io.digdug.tunnel.ConfigurationException;
import io.digdug.tunnel.ProviderType;
import io.digdug.tunnel.TunnelConfig;
import picocli.CommandLine;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Options shared by the commands that create a tunnel.
 */
public abstract class TunnelCommand {

    @Spec
    CommandSpec spec;

    @Option(
            names = {"-c", "--config"},
            description = "JSON configuration file, the provider argument wins over its provider"
    )
    Path configFile;

    @Option(
            names = {"-d", "--directory"},
            description = "Install directory (default: ~/.digdug)"
    )
    Path directory;

    @Option(
            names = {"--proxy"},
            description = "Proxy url for downloads and api calls"
    )
    String proxy;

    @Option(
            names = {"-v", "--verbose"},
            description = "Verbose tunnel output"
    )
    boolean verbose;

    /**
     * @throws ConfigurationException on an unknown provider or an invalid configuration file
     */
    protected TunnelConfig buildConfig(String providerName) {
        ProviderType type = ProviderType.fromName(providerName);
        TunnelConfig.Builder builder;
        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new ConfigurationException("configuration file not found: " + configFile);
            }
            builder = TunnelConfig.load(configFile, type).toBuilder();
        } else {
            builder = TunnelConfig.builder(type);
        }
        if (directory != null) {
            builder.installDirectory(directory);
        }
        if (proxy != null) {
            builder.proxy(proxy);
        }
        if (verbose) {
            builder.verbose(true);
        }
        return builder.build();
    }

    /**
     * Message and usage on stderr, exit code 1.
     */
    protected int usageError(String message) {
        CommandLine cmd = spec.commandLine();
        cmd.getErr().println(message);
        cmd.usage(cmd.getErr());
        cmd.getErr().flush();
        return 1;
    }

    protected int error(String message) {
        spec.commandLine().getErr().println(message);
        spec.commandLine().getErr().flush();
        return 1;
    }

    /**
     * Invalid command lines exit with 1 and print usage on stderr.
     */
    public static int handleParameterException(CommandLine.ParameterException ex, String[] args) {
        CommandLine cmd = ex.getCommandLine();
        cmd.getErr().println(ex.getMessage());
        cmd.usage(cmd.getErr());
        cmd.getErr().flush();
        return 1;
    }

}
