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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Builder for ProcessConfig. Provides fluent API for process configuration.
 * <p>
 * Tunnels keep stdout and stderr apart by default since several tunnel binaries report
 * readiness on one stream and errors on the other.
 */
public class ProcessBuilder {

    private final List<String> args = new ArrayList<>();
    private Path workingDir;
    private final Map<String, String> env = new HashMap<>();
    private boolean redirectErrorStream = false;
    private Consumer<ProcessEvent> listener;

    private ProcessBuilder() {
    }

    public static ProcessBuilder create() {
        return new ProcessBuilder();
    }

    // ========== Command Configuration ==========

    public ProcessBuilder executable(String executable) {
        if (args.isEmpty()) {
            args.add(executable);
        } else {
            args.set(0, executable);
        }
        return this;
    }

    public ProcessBuilder args(String... args) {
        return args(List.of(args));
    }

    /**
     * Replaces the whole command line, executable first.
     */
    public ProcessBuilder args(List<String> args) {
        this.args.clear();
        this.args.addAll(args);
        return this;
    }

    /**
     * Appends arguments after the executable.
     */
    public ProcessBuilder addArgs(List<String> more) {
        if (args.isEmpty()) {
            throw new IllegalStateException("executable must be set before arguments");
        }
        args.addAll(more);
        return this;
    }

    // ========== Environment Configuration ==========

    public ProcessBuilder workingDir(Path dir) {
        this.workingDir = dir;
        return this;
    }

    public ProcessBuilder env(Map<String, String> env) {
        this.env.putAll(env);
        return this;
    }

    public ProcessBuilder env(String key, String value) {
        this.env.put(key, value);
        return this;
    }

    public ProcessBuilder redirectErrorStream(boolean redirect) {
        this.redirectErrorStream = redirect;
        return this;
    }

    public ProcessBuilder listener(Consumer<ProcessEvent> listener) {
        this.listener = listener;
        return this;
    }

    // ========== Build ==========

    public ProcessConfig build() {
        if (args.isEmpty()) {
            throw new IllegalStateException("no executable configured");
        }
        return new ProcessConfig(args, workingDir, env, redirectErrorStream, listener);
    }

}
