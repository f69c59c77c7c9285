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
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Enumeration;

/**
 * Unpacks zip and gzip-compressed tar archives, keeping unix permission bits where the
 * archive records them and the file system supports them.
 */
public class ArchiveExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveExtractor.class);

    /**
     * Extract an archive, detecting the type from the file name.
     */
    public void extract(Path archive, Path targetDir, int stripComponents) {
        Artifact.Kind kind = Artifact.kindOf(archive.getFileName().toString());
        if (kind == Artifact.Kind.RAW) {
            throw new ExtractException("unsupported archive type: " + archive.getFileName());
        }
        extract(archive, targetDir, stripComponents, kind);
    }

    public void extract(Path archive, Path targetDir, int stripComponents, Artifact.Kind kind) {
        FileUtils.createDirectories(targetDir);
        Path root = targetDir.toAbsolutePath().normalize();
        logger.debug("extracting {} to {}", archive, root);
        try {
            switch (kind) {
                case ZIP -> extractZip(archive, root, stripComponents);
                case TAR_GZ -> extractTarGz(archive, root, stripComponents);
                default -> throw new ExtractException("unsupported archive type: " + kind);
            }
        } catch (IOException e) {
            throw new ExtractException("failed to extract " + archive.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private void extractZip(Path archive, Path root, int strip) throws IOException {
        try (ZipFile zip = ZipFile.builder().setPath(archive).get()) {
            Enumeration<ZipArchiveEntry> entries = zip.getEntries();
            while (entries.hasMoreElements()) {
                ZipArchiveEntry entry = entries.nextElement();
                Path target = resolve(root, entry.getName(), strip);
                if (target == null) {
                    continue;
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                try (InputStream is = zip.getInputStream(entry)) {
                    if (entry.isUnixSymlink()) {
                        writeSymlink(root, target, new String(is.readAllBytes(), StandardCharsets.UTF_8));
                    } else {
                        writeFile(is, target, entry.getUnixMode());
                    }
                }
            }
        }
    }

    private void extractTarGz(Path archive, Path root, int strip) throws IOException {
        try (InputStream fis = Files.newInputStream(archive);
             GzipCompressorInputStream gzip = new GzipCompressorInputStream(new BufferedInputStream(fis));
             TarArchiveInputStream tar = new TarArchiveInputStream(gzip)) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                if (!tar.canReadEntryData(entry)) {
                    logger.warn("skipping unreadable entry: {}", entry.getName());
                    continue;
                }
                Path target = resolve(root, entry.getName(), strip);
                if (target == null) {
                    continue;
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else if (entry.isSymbolicLink()) {
                    writeSymlink(root, target, entry.getLinkName());
                } else if (entry.isFile()) {
                    writeFile(tar, target, entry.getMode());
                }
            }
        }
    }

    /**
     * Apply strip components and check the entry stays inside the root.
     * Returns null for entries that are stripped away entirely.
     */
    static Path resolve(Path root, String name, int strip) {
        String[] parts = name.replace('\\', '/').split("/");
        StringBuilder sb = new StringBuilder();
        int skipped = 0;
        for (String part : parts) {
            if (part.isEmpty() || part.equals(".")) {
                continue;
            }
            if (skipped < strip) {
                skipped++;
                continue;
            }
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(part);
        }
        if (sb.length() == 0) {
            return null;
        }
        Path target = root.resolve(sb.toString()).normalize();
        if (!target.startsWith(root)) {
            throw new ExtractException("archive entry is outside of the target directory: " + name);
        }
        return target;
    }

    private static void writeFile(InputStream is, Path target, int mode) throws IOException {
        Files.createDirectories(target.getParent());
        Files.copy(is, target, StandardCopyOption.REPLACE_EXISTING);
        int permissions = mode & 0777;
        if (FileUtils.POSIX && permissions != 0) {
            // keep the owner able to overwrite on a later forced download
            Files.setPosixFilePermissions(target, FileUtils.toPermissions(permissions | 0600));
        }
    }

    private static void writeSymlink(Path root, Path link, String linkTarget) throws IOException {
        Path resolved = link.getParent().resolve(linkTarget).normalize();
        if (!resolved.startsWith(root)) {
            throw new ExtractException("symbolic link points outside of the target directory: " + link + " -> " + linkTarget);
        }
        Files.createDirectories(link.getParent());
        Files.deleteIfExists(link);
        Files.createSymbolicLink(link, link.getParent().relativize(resolved));
    }

}
