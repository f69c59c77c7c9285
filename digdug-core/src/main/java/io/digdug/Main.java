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
package io.digdug;

import io.digdug.cli.DownloadCommand;
import io.digdug.cli.EnvironmentsCommand;
import io.digdug.cli.TunnelCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Main entry point for the digdug CLI.
 * <pre>
 * digdug environments browserstack
 * digdug download selenium --force
 * </pre>
 */
@Command(
        name = "digdug",
        mixinStandardHelpOptions = true,
        versionProvider = Main.VersionProvider.class,
        description = "Download, start and stop WebDriver tunnels",
        subcommands = {
                EnvironmentsCommand.class,
                DownloadCommand.class
        }
)
public class Main implements Callable<Integer> {

    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            String version = Main.class.getPackage().getImplementationVersion();
            return new String[]{"digdug " + (version == null ? "(development)" : version)};
        }
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    public static int execute(String... args) {
        return new CommandLine(new Main())
                .setParameterExceptionHandler(TunnelCommand::handleParameterException)
                .execute(args);
    }

    @Override
    public Integer call() {
        // no subcommand
        CommandLine.usage(this, System.err);
        return 1;
    }

}
