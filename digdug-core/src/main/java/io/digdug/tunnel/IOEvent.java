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
package io.digdug.tunnel;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A line written by the tunnel process, forwarded verbatim.
 */
public record IOEvent(Stream stream, String data) implements TunnelEvent {

    public enum Stream {
        STDOUT,
        STDERR
    }

    public static IOEvent stdout(String data) {
        return new IOEvent(Stream.STDOUT, data);
    }

    public static IOEvent stderr(String data) {
        return new IOEvent(Stream.STDERR, data);
    }

    @Override
    public TunnelEventType getType() {
        return stream == Stream.STDOUT ? TunnelEventType.STDOUT : TunnelEventType.STDERR;
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", stream.name().toLowerCase());
        map.put("data", data);
        return map;
    }

}
