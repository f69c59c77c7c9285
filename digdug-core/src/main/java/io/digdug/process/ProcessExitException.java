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
package io.digdug.process;

import io.digdug.common.TunnelException;

/**
 * The process exited, or reported a fatal error, before it became ready.
 * The exit code is -1 when the process was still alive and had to be torn down.
 */
public class ProcessExitException extends TunnelException {

    private final int exitCode;

    public ProcessExitException(int exitCode, String output) {
        super(message(exitCode, output));
        this.exitCode = exitCode;
    }

    public ProcessExitException(String reason) {
        super("tunnel failed to start: " + reason);
        this.exitCode = -1;
    }

    private static String message(int exitCode, String output) {
        if (output == null || output.isBlank()) {
            return "tunnel failed to start, exit code: " + exitCode;
        }
        return "tunnel failed to start, exit code: " + exitCode + ", output: " + output.trim();
    }

    public int getExitCode() {
        return exitCode;
    }

}
