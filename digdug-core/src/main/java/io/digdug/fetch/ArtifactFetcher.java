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

import io.digdug.common.FileUtils;
import io.digdug.http.ApacheHttpClient;
import io.digdug.http.ProxySettings;
import io.digdug.tunnel.TunnelConfig;
import io.digdug.tunnel.TunnelProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.TimeUnit;

/**
 * Downloads and installs tunnel artifacts.
 * <p>
 * Downloads are streamed to a {@code .part} file next to the destination and moved into place
 * only once complete, so an interrupted or failed download never leaves a file at the final path.
 * Progress is reported at most every {@link #PROGRESS_INTERVAL_MILLIS}, plus once at the end.
 */
public class ArtifactFetcher implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ArtifactFetcher.class);

    public static final long PROGRESS_INTERVAL_MILLIS = 100;

    private static final int BUFFER_SIZE = 64 * 1024;

    @FunctionalInterface
    public interface ProgressListener {
        /**
         * @param total the content length, -1 if the server did not send one
         */
        void onProgress(String url, long received, long total);
    }

    private final ApacheHttpClient client;
    private final ArchiveExtractor extractor = new ArchiveExtractor();

    public ArtifactFetcher(ProxySettings proxy) {
        this.client = new ApacheHttpClient().proxy(proxy);
    }

    public ArtifactFetcher() {
        this(null);
    }

    /**
     * The download url for the provider and configuration. No I/O.
     */
    public static String resolveUrl(TunnelProvider provider, TunnelConfig config) {
        return provider.resolveDownloadUrl(config);
    }

    // ========== Fetch ==========

    /**
     * Download the url to the destination file.
     *
     * @throws FetchException on a non-2xx status, a transport error or interruption
     */
    public void fetch(String url, Path destination, ProgressListener listener) {
        FileUtils.createDirectories(destination.toAbsolutePath().getParent());
        Path temp = destination.resolveSibling(destination.getFileName() + ".part");
        logger.debug("downloading {} to {}", url, destination);
        try {
            client.stream(url, (status, length, body) -> {
                if (status < 200 || status >= 300) {
                    throw new FetchException(url, status);
                }
                try (OutputStream os = Files.newOutputStream(temp)) {
                    byte[] buffer = new byte[BUFFER_SIZE];
                    long received = 0;
                    long lastEvent = System.nanoTime();
                    long interval = TimeUnit.MILLISECONDS.toNanos(PROGRESS_INTERVAL_MILLIS);
                    int n;
                    while ((n = body.read(buffer)) != -1) {
                        if (Thread.currentThread().isInterrupted()) {
                            throw new InterruptedIOException("download interrupted");
                        }
                        os.write(buffer, 0, n);
                        received += n;
                        long now = System.nanoTime();
                        if (listener != null && now - lastEvent >= interval) {
                            listener.onProgress(url, received, length);
                            lastEvent = now;
                        }
                    }
                    if (listener != null) {
                        listener.onProgress(url, received, length);
                    }
                }
                return null;
            });
            move(temp, destination);
        } catch (FetchException e) {
            deleteQuietly(temp);
            throw e;
        } catch (UncheckedIOException e) {
            deleteQuietly(temp);
            throw new FetchException(url, e.getCause());
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new FetchException(url, e);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("failed to delete {}: {}", file, e.getMessage());
        }
    }

    /**
     * Abort the download in flight, if any.
     */
    public void abort() {
        client.abort();
    }

    // ========== Extract ==========

    public void extract(Path archive, Path targetDir, int stripComponents) {
        extractor.extract(archive, targetDir, stripComponents);
    }

    // ========== Install ==========

    /**
     * Download the artifact and unpack it. The archive itself is removed after extraction,
     * the installed file is made executable.
     */
    public void install(Artifact artifact, ProgressListener listener) {
        if (artifact.kind() == Artifact.Kind.RAW) {
            fetch(artifact.url(), artifact.installedFile(), listener);
        } else {
            Path archive = artifact.directory().resolve(artifact.fileName());
            fetch(artifact.url(), archive, listener);
            try {
                extractor.extract(archive, artifact.directory(), artifact.stripComponents(), artifact.kind());
            } catch (RuntimeException e) {
                // a half written executable would count as installed
                deleteQuietly(artifact.installedFile());
                throw e;
            } finally {
                deleteQuietly(archive);
            }
            if (!Files.exists(artifact.installedFile())) {
                throw new ExtractException("archive " + artifact.fileName() + " did not contain " + artifact.installedFile());
            }
        }
        FileUtils.makeExecutable(artifact.installedFile());
        logger.info("installed {}", artifact.installedFile());
    }

    @Override
    public void close() {
        try {
            client.close();
        } catch (IOException e) {
            logger.debug("failed to close http client: {}", e.getMessage());
        }
    }

}
