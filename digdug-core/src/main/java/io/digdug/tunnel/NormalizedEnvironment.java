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
 * A browser environment offered by a provider, in a provider independent form.
 * The raw provider entry is kept as {@code descriptor}.
 */
public record NormalizedEnvironment(
        String platform,
        String platformName,
        String platformVersion,
        String browserName,
        String browserVersion,
        String version,
        Map<String, Object> descriptor
) {

    public static NormalizedEnvironment of(String platform, String browserName, String version, Map<String, Object> descriptor) {
        return new NormalizedEnvironment(platform, null, null, browserName, version, version, descriptor);
    }

    /**
     * The short form printed by the environments command.
     */
    public Map<String, Object> toSummary() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("platform", platform);
        map.put("browserName", browserName);
        map.put("version", version);
        return map;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("platform", platform);
        if (platformName != null) {
            map.put("platformName", platformName);
        }
        if (platformVersion != null) {
            map.put("platformVersion", platformVersion);
        }
        map.put("browserName", browserName);
        if (browserVersion != null) {
            map.put("browserVersion", browserVersion);
        }
        map.put("version", version);
        if (descriptor != null) {
            map.put("descriptor", descriptor);
        }
        return map;
    }

}
