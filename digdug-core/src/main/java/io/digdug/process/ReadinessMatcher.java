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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides when a spawned tunnel is able to accept traffic.
 * <p>
 * A matcher observes every output line of the process and, if {@link #isPolling()} is true,
 * is also polled periodically for signals that do not show up in the output (a ready file,
 * an HTTP health check). Implementations must be thread-safe: events and polls arrive on
 * different threads.
 */
public interface ReadinessMatcher {

    /**
     * Called for each stdout / stderr line.
     */
    default Readiness onEvent(ProcessEvent event) {
        return Readiness.pending();
    }

    /**
     * Called once right after spawn and then periodically while {@link #isPolling()} is true.
     */
    default Readiness poll() {
        return Readiness.pending();
    }

    default boolean isPolling() {
        return false;
    }

    // ========== Factories ==========

    /**
     * Ready as soon as the process has been spawned.
     */
    static ReadinessMatcher immediate() {
        return new ReadinessMatcher() {
            @Override
            public Readiness poll() {
                return Readiness.ready();
            }
        };
    }

    /**
     * Ready when a line matches {@code ready}; failed when a line matches {@code failure}.
     * If the failure pattern has a capturing group, the first group becomes the failure message.
     */
    static ReadinessMatcher pattern(Pattern ready, Pattern failure) {
        return new ReadinessMatcher() {
            @Override
            public Readiness onEvent(ProcessEvent event) {
                if (!event.isOutput() || event.data() == null) {
                    return Readiness.pending();
                }
                if (failure != null) {
                    Matcher m = failure.matcher(event.data());
                    if (m.find()) {
                        String message = m.groupCount() > 0 && m.group(1) != null ? m.group(1) : event.data().trim();
                        return Readiness.failed(message);
                    }
                }
                if (ready != null && ready.matcher(event.data()).find()) {
                    return Readiness.ready();
                }
                return Readiness.pending();
            }
        };
    }

    static ReadinessMatcher pattern(String ready) {
        return pattern(Pattern.compile(Pattern.quote(ready)), null);
    }

    /**
     * Ready once the given file exists. Several tunnels touch a file passed on the command line
     * when the connection is established.
     */
    static ReadinessMatcher readyFile(Path file) {
        return new ReadinessMatcher() {
            @Override
            public Readiness poll() {
                return Files.exists(file) ? Readiness.ready() : Readiness.pending();
            }

            @Override
            public boolean isPolling() {
                return true;
            }
        };
    }

    /**
     * Ready once the url answers with a 2xx status.
     */
    static ReadinessMatcher http(String url) {
        return new ReadinessMatcher() {
            @Override
            public Readiness poll() {
                return PortUtils.isHttpAvailable(url) ? Readiness.ready() : Readiness.pending();
            }

            @Override
            public boolean isPolling() {
                return true;
            }
        };
    }

    /**
     * The first non-pending verdict of any matcher wins.
     */
    static ReadinessMatcher anyOf(ReadinessMatcher... matchers) {
        List<ReadinessMatcher> list = List.of(matchers);
        return new ReadinessMatcher() {
            @Override
            public Readiness onEvent(ProcessEvent event) {
                for (ReadinessMatcher matcher : list) {
                    Readiness result = matcher.onEvent(event);
                    if (!result.isPending()) {
                        return result;
                    }
                }
                return Readiness.pending();
            }

            @Override
            public Readiness poll() {
                for (ReadinessMatcher matcher : list) {
                    Readiness result = matcher.poll();
                    if (!result.isPending()) {
                        return result;
                    }
                }
                return Readiness.pending();
            }

            @Override
            public boolean isPolling() {
                return list.stream().anyMatch(ReadinessMatcher::isPolling);
            }
        };
    }

}
