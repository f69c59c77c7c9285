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

import java.util.Locale;

/**
 * Operating system detection utilities.
 * Only used to compute the default {@link Platform}, everything else receives the platform explicitly.
 */
public class OsUtils {

    public static final String OS_NAME = System.getProperty("os.name").toLowerCase(Locale.ROOT);
    public static final String OS_ARCH = System.getProperty("os.arch").toLowerCase(Locale.ROOT);
    public static final String USER_HOME = System.getProperty("user.home");

    private OsUtils() {
        // only static methods
    }

    public static boolean isWindows() {
        return OS_NAME.contains("win");
    }

    public static boolean isMac() {
        return OS_NAME.contains("mac");
    }

    public static boolean isLinux() {
        return OS_NAME.contains("nix") || OS_NAME.contains("nux");
    }

    /**
     * Returns the OS name in the form download servers use: "win32", "darwin" or "linux".
     */
    public static String getOsType() {
        if (isWindows()) {
            return Platform.WINDOWS;
        } else if (isMac()) {
            return Platform.MAC;
        } else if (isLinux()) {
            return Platform.LINUX;
        }
        return OS_NAME;
    }

    /**
     * Returns the CPU architecture as "x64", "ia32" or "arm64".
     */
    public static String getArchType() {
        return switch (OS_ARCH) {
            case "amd64", "x86_64" -> Platform.X64;
            case "x86", "i386", "i486", "i586", "i686" -> Platform.IA32;
            case "aarch64", "arm64" -> Platform.ARM64;
            default -> OS_ARCH;
        };
    }

}
