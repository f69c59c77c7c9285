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
import io.digdug.tunnel.DownloadProgressEvent;
import io.digdug.tunnel.StatusEvent;
import io.digdug.tunnel.Tunnel;
import io.digdug.tunnel.TunnelConfig;
import io.digdug.tunnel.Tunnels;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

/**
 * The 'download' subcommand: installs the files a provider needs, without starting it.
 * <pre>
 * digdug download browserstack
 * digdug download selenium -c selenium.json --force
 * </pre>
 */
@Command(
        name = "download",
        mixinStandardHelpOptions = true,
        description = "Download the tunnel binaries of a provider"
)
public class DownloadCommand extends TunnelCommand implements Callable<Integer> {

    @Parameters(
            index = "0",
            arity = "0..1",
            paramLabel = "<provider>",
            description = "Provider name: saucelabs, browserstack, testingbot, cbt, selenium, null"
    )
    String provider;

    @Option(
            names = {"--force"},
            description = "Download again even if the files exist"
    )
    boolean force;

    @Override
    public Integer call() {
        if (provider == null) {
            return usageError("missing provider name");
        }
        TunnelConfig config;
        try {
            config = buildConfig(provider);
        } catch (ConfigurationException e) {
            return usageError(e.getMessage());
        }
        PrintWriter err = spec.commandLine().getErr();
        try (Tunnel tunnel = Tunnels.create(config)) {
            if (!force && tunnel.isDownloaded()) {
                err.println("already downloaded to " + config.getProviderDirectory());
                err.flush();
                return 0;
            }
            tunnel.addListener(event -> {
                if (event instanceof DownloadProgressEvent progress) {
                    err.print("\r" + progressLine(progress));
                    err.flush();
                } else if (event instanceof StatusEvent status) {
                    err.println(status.status());
                    err.flush();
                }
            });
            tunnel.download(force).join();
            err.println();
            err.println("downloaded to " + config.getProviderDirectory());
            err.flush();
            return 0;
        } catch (ConfigurationException e) {
            return error(e.getMessage());
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            err.println();
            return error("download failed: " + cause.getMessage());
        }
    }

    static String progressLine(DownloadProgressEvent event) {
        if (!event.isTotalKnown() || event.total() == 0) {
            return String.format("%,d bytes", event.received());
        }
        long percent = event.received() * 100 / event.total();
        return String.format("%,d / %,d bytes (%d%%)", event.received(), event.total(), percent);
    }

}
