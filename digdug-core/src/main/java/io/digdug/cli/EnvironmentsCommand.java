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

import io.digdug.common.Json;
import io.digdug.tunnel.ConfigurationException;
import io.digdug.tunnel.NormalizedEnvironment;
import io.digdug.tunnel.ReportException;
import io.digdug.tunnel.Tunnel;
import io.digdug.tunnel.TunnelConfig;
import io.digdug.tunnel.Tunnels;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

/**
 * The 'environments' subcommand: lists the browser environments a provider offers,
 * one JSON object per line.
 * <pre>
 * digdug environments saucelabs
 * SAUCE_USERNAME=me SAUCE_ACCESS_KEY=... java -cp digdug.jar io.digdug.cli.EnvironmentsCommand saucelabs
 * </pre>
 */
@Command(
        name = "environments",
        mixinStandardHelpOptions = true,
        description = "List the environments a tunnel provider supports"
)
public class EnvironmentsCommand extends TunnelCommand implements Callable<Integer> {

    @Parameters(
            index = "0",
            arity = "0..1",
            paramLabel = "<provider>",
            description = "Provider name: saucelabs, browserstack, testingbot, cbt, selenium, null"
    )
    String provider;

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    static int execute(String... args) {
        return new CommandLine(new EnvironmentsCommand())
                .setParameterExceptionHandler(TunnelCommand::handleParameterException)
                .execute(args);
    }

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
        try (Tunnel tunnel = Tunnels.create(config)) {
            List<NormalizedEnvironment> environments = tunnel.getEnvironments().join();
            PrintWriter out = spec.commandLine().getOut();
            for (NormalizedEnvironment environment : environments) {
                out.println(Json.toJson(environment.toSummary()));
            }
            out.flush();
            return 0;
        } catch (ConfigurationException e) {
            return error(e.getMessage());
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ReportException || cause instanceof ConfigurationException) {
                return error(cause.getMessage());
            }
            return error("failed to get environments: " + cause);
        }
    }

}
