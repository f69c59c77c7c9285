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
package io.digdug.fetch;

import java.nio.file.Path;

/**
 * One downloadable file a provider needs on disk.
 *
 * @param url             where to download from
 * @param directory       where the content lands: the extraction root for archives, the parent of a raw file
 * @param installedFile   the file whose presence means the artifact is installed
 * @param kind            how the download is unpacked
 * @param stripComponents leading path segments dropped from archive entries
 */
public record Artifact(String url, Path directory, Path installedFile, Kind kind, int stripComponents) {

    public enum Kind {
        ZIP,
        TAR_GZ,
        RAW
    }

    public static Artifact zip(String url, Path directory, Path installedFile) {
        return new Artifact(url, directory, installedFile, Kind.ZIP, 0);
    }

    public static Artifact tarGz(String url, Path directory, Path installedFile) {
        return new Artifact(url, directory, installedFile, Kind.TAR_GZ, 0);
    }

    /**
     * A file used as downloaded, a jar for example.
     */
    public static Artifact raw(String url, Path installedFile) {
        return new Artifact(url, installedFile.getParent(), installedFile, Kind.RAW, 0);
    }

    /**
     * Guess the kind from the file name in the url.
     */
    public static Kind kindOf(String url) {
        String lower = url.toLowerCase();
        int query = lower.indexOf('?');
        if (query != -1) {
            lower = lower.substring(0, query);
        }
        if (lower.endsWith(".zip")) {
            return Kind.ZIP;
        }
        if (lower.endsWith(".tar.gz") || lower.endsWith(".tgz")) {
            return Kind.TAR_GZ;
        }
        return Kind.RAW;
    }

    public Artifact withStripComponents(int strip) {
        return new Artifact(url, directory, installedFile, kind, strip);
    }

    public String fileName() {
        String path = url;
        int query = path.indexOf('?');
        if (query != -1) {
            path = path.substring(0, query);
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }

}
