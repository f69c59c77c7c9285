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
package io.digdug.common;

import java.util.Objects;

/**
 * The operating system and CPU architecture a tunnel binary is resolved for.
 * <p>
 * Values follow the naming used by the tunnel download servers: os is one of
 * {@code win32}, {@code darwin}, {@code linux}; arch is one of {@code x64}, {@code ia32}, {@code arm64}.
 * Unknown values are passed through untouched so providers can reject them.
 */
public record Platform(String os, String arch) {

    public static final String WINDOWS = "win32";
    public static final String MAC = "darwin";
    public static final String LINUX = "linux";

    public static final String X64 = "x64";
    public static final String IA32 = "ia32";
    public static final String ARM64 = "arm64";

    public Platform {
        Objects.requireNonNull(os, "os");
        Objects.requireNonNull(arch, "arch");
    }

    public static Platform of(String os, String arch) {
        return new Platform(os, arch);
    }

    public static Platform current() {
        return new Platform(OsUtils.getOsType(), OsUtils.getArchType());
    }

    public boolean isWindows() {
        return WINDOWS.equals(os);
    }

    public boolean isMac() {
        return MAC.equals(os);
    }

    public boolean isLinux() {
        return LINUX.equals(os);
    }

    /**
     * Appends ".exe" on Windows.
     */
    public String executableName(String baseName) {
        return isWindows() ? baseName + ".exe" : baseName;
    }

    @Override
    public String toString() {
        return os + "-" + arch;
    }

}
