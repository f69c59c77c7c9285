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
package io.digdug.selenium;

import io.digdug.fetch.Artifact;

import java.nio.file.Path;

/**
 * A WebDriver executable the Selenium server is pointed at through a system property.
 *
 * @param name             canonical driver name, or null for a custom definition
 * @param version          driver version, null if not versioned
 * @param url              download url, null if the driver ships with the OS
 * @param executable       path of the executable, relative to the provider directory unless absolute
 * @param seleniumProperty the java system property naming the executable
 */
public record DriverDescriptor(String name, String version, String url, String executable, String seleniumProperty) {

    public boolean requiresDownload() {
        return url != null;
    }

    public Path resolveExecutable(Path providerDirectory) {
        Path path = Path.of(executable);
        return path.isAbsolute() ? path : providerDirectory.resolve(path);
    }

    /**
     * The artifact to install, null if nothing is downloaded.
     */
    public Artifact toArtifact(Path providerDirectory) {
        if (!requiresDownload()) {
            return null;
        }
        Path file = resolveExecutable(providerDirectory);
        Path directory = file.getParent();
        return switch (Artifact.kindOf(url)) {
            case ZIP -> Artifact.zip(url, directory, file);
            case TAR_GZ -> Artifact.tarGz(url, directory, file);
            case RAW -> Artifact.raw(url, file);
        };
    }

    /**
     * The {@code -Dproperty=path} argument for the Selenium server.
     */
    public String toSystemProperty(Path providerDirectory) {
        return "-D" + seleniumProperty + "=" + resolveExecutable(providerDirectory);
    }

}
