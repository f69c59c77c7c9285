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

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The closed set of supported providers.
 */
public enum ProviderType {

    SAUCELABS("saucelabs"),
    BROWSERSTACK("browserstack"),
    TESTINGBOT("testingbot"),
    CROSSBROWSERTESTING("cbt"),
    SELENIUM("selenium"),
    NULL("null");

    private final String name;

    ProviderType(String name) {
        this.name = name;
    }

    /**
     * The short name, also used as the sub directory of the install directory.
     */
    public String getName() {
        return name;
    }

    /**
     * Accepts the short name or the enum constant name, case-insensitive.
     *
     * @throws ConfigurationException for unknown names
     */
    public static ProviderType fromName(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("provider name is required, one of: " + names());
        }
        String lower = value.trim().toLowerCase(Locale.ROOT);
        for (ProviderType type : values()) {
            if (type.name.equals(lower) || type.name().toLowerCase(Locale.ROOT).equals(lower)) {
                return type;
            }
        }
        throw new ConfigurationException("unknown provider '" + value + "', expected one of: " + names());
    }

    public static String names() {
        return Arrays.stream(values()).map(ProviderType::getName).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return name;
    }

}
