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

import io.digdug.tunnel.DownloadProgressEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CommandsTest {

    @TempDir
    Path dir;

    final StringWriter out = new StringWriter();
    final StringWriter err = new StringWriter();

    private int run(Object command, String... args) {
        return new CommandLine(command)
                .setOut(new PrintWriter(out))
                .setErr(new PrintWriter(err))
                .setParameterExceptionHandler(TunnelCommand::handleParameterException)
                .execute(args);
    }

    // ========== environments ==========

    @Test
    void testEnvironmentsWithoutProvider() {
        assertEquals(1, run(new EnvironmentsCommand()));
        assertTrue(err.toString().contains("missing provider name"));
        assertTrue(err.toString().contains("Usage: environments"));
        assertEquals("", out.toString());
    }

    @Test
    void testEnvironmentsUnknownProvider() {
        assertEquals(1, run(new EnvironmentsCommand(), "foo"));
        assertTrue(err.toString().contains("unknown provider 'foo'"));
        assertTrue(err.toString().contains("Usage: environments"));
    }

    @Test
    void testEnvironmentsTooManyArguments() {
        assertEquals(1, run(new EnvironmentsCommand(), "saucelabs", "extra"));
        assertTrue(err.toString().contains("Usage: environments"));
    }

    @Test
    void testEnvironmentsNullProvider() {
        assertEquals(0, run(new EnvironmentsCommand(), "null"));
        assertEquals("", out.toString());
    }

    @Test
    void testEnvironmentsMissingConfigFile() {
        assertEquals(1, run(new EnvironmentsCommand(), "null", "-c", dir.resolve("nope.json").toString()));
        assertTrue(err.toString().contains("configuration file not found"));
    }

    @Test
    void testEnvironmentsInvalidConfigFile() throws Exception {
        Path config = dir.resolve("digdug.json");
        Files.writeString(config, "[1, 2]");
        assertEquals(1, run(new EnvironmentsCommand(), "null", "-c", config.toString()));
        assertTrue(err.toString().contains("invalid config"));
    }

    // ========== download ==========

    @Test
    void testDownloadNothingToDo() {
        assertEquals(0, run(new DownloadCommand(), "null", "-d", dir.toString()));
        assertTrue(err.toString().contains("already downloaded to " + dir.resolve("null")));
    }

    @Test
    void testDownloadUnsupportedPlatform() throws Exception {
        Path config = dir.resolve("digdug.json");
        Files.writeString(config, "{\"platform\": \"darwin\", \"architecture\": \"arm64\"}");
        assertEquals(1, run(new DownloadCommand(), "browserstack", "-c", config.toString(), "-d", dir.toString()));
        assertTrue(err.toString().contains("does not support the platform darwin-arm64"));
    }

    @Test
    void testProgressLine() {
        assertEquals(String.format("%,d bytes", 1500), DownloadCommand.progressLine(new DownloadProgressEvent("u", 1500, -1)));
        assertEquals(String.format("%,d / %,d bytes (50%%)", 500, 1000),
                DownloadCommand.progressLine(new DownloadProgressEvent("u", 500, 1000)));
    }

}
