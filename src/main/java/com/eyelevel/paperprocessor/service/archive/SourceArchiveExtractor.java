package com.eyelevel.paperprocessor.service.archive;

import com.eyelevel.paperprocessor.config.PaperProcessingConfig;
import com.eyelevel.paperprocessor.exception.ExtractionException;
import com.eyelevel.paperprocessor.model.FileSet;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.ArchiveException;
import org.apache.commons.compress.archivers.ArchiveStreamFactory;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.CompressorException;
import org.apache.commons.compress.compressors.CompressorStreamFactory;
import org.apache.commons.io.IOUtils;
import org.springframework.stereotype.Service;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * Decodes a downloaded source archive into an in-memory {@link FileSet}.
 * <p>
 * ZIP is tried first, then TAR with any compression commons-compress can detect (gzip, bzip2, xz) or none.
 * Directory entries are skipped; every member name goes through {@link ArchivePathGuard}. The same input
 * bytes always produce the same FileSet, in archive order.
 */
@Slf4j
@Service
public class SourceArchiveExtractor {

    private static final byte[] ZIP_LOCAL_HEADER = {'P', 'K', 3, 4};
    private static final byte[] ZIP_EMPTY_ARCHIVE = {'P', 'K', 5, 6};
    private static final String[] LATEX_MARKERS = {"\\documentclass", "\\documentstyle", "\\begin{document}"};

    private final boolean singleFileFallback;
    private final long maxUncompressedBytes;

    public SourceArchiveExtractor(PaperProcessingConfig config) {
        this.singleFileFallback = config.getExtraction().isSingleFileFallback();
        this.maxUncompressedBytes = config.getExtraction().getMaxUncompressedBytes();
    }

    /**
     * Extracts every regular file from an archive.
     *
     * @param archive     The raw archive bytes.
     * @param maxFiles    The maximum number of non-directory members accepted.
     * @param contextInfo The paper ID, used for logging and for naming a single-file submission.
     * @return The extracted files keyed by normalized relative path.
     * @throws ExtractionException if the archive has too many members, an unsafe member path, exceeds the
     *                             size bound, or is neither a ZIP nor a TAR archive.
     */
    public FileSet extract(final byte[] archive, final int maxFiles, final String contextInfo) {
        log.info("[{}] Attempting to unpack source archive of {} bytes (max files: {}).", contextInfo,
                archive.length, maxFiles);
        try {
            if (looksLikeZip(archive)) {
                return readZip(archive, maxFiles, contextInfo);
            }

            final byte[] payload = decompress(archive, contextInfo);
            if (isTar(payload)) {
                return readTar(payload, maxFiles, contextInfo);
            }

            if (singleFileFallback && looksLikeLatex(payload)) {
                final String name = contextInfo.replace('/', '_') + ".tex";
                log.info("[{}] Payload is a single LaTeX document; treating it as '{}'.", contextInfo, name);
                return FileSet.builder().put(name, payload).build();
            }
        } catch (ZipException | IllegalArgumentException e) {
            log.error("[{}] Archive is corrupted and cannot be processed.", contextInfo, e);
            throw new ExtractionException("Invalid or corrupted archive: " + e.getMessage(), e);
        } catch (IOException e) {
            log.error("[{}] Failed to read source archive.", contextInfo, e);
            throw new ExtractionException("Failed to extract archive: " + e.getMessage(), e);
        }
        throw new ExtractionException("Failed to extract archive: content is neither a ZIP nor a TAR archive");
    }

    public FileSet extract(final byte[] archive, final int maxFiles) {
        return extract(archive, maxFiles, "archive");
    }

    private FileSet readZip(final byte[] archive, final int maxFiles, final String contextInfo) throws IOException {
        final FileSet.Builder files = FileSet.builder();
        long totalBytes = 0;
        try (ZipInputStream zis = new ZipInputStream(new ByteArrayInputStream(archive))) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                try {
                    if (entry.isDirectory()) {
                        continue;
                    }
                    final String path = ArchivePathGuard.normalize(entry.getName());
                    ensureWithinLimit(files.size() + 1, maxFiles);
                    final byte[] content = readMember(zis, totalBytes);
                    totalBytes += content.length;
                    putMember(files, path, content, contextInfo);
                } finally {
                    zis.closeEntry();
                }
            }
        }
        log.info("[{}] Extracted {} files from ZIP archive.", contextInfo, files.size());
        return files.build();
    }

    private FileSet readTar(final byte[] payload, final int maxFiles, final String contextInfo) throws IOException {
        final FileSet.Builder files = FileSet.builder();
        long totalBytes = 0;
        try (TarArchiveInputStream tar = new TarArchiveInputStream(new ByteArrayInputStream(payload))) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                if (entry.isDirectory()) {
                    continue;
                }
                // isFile() is also true for link entries
                if (!entry.isFile() || entry.isSymbolicLink() || entry.isLink()) {
                    log.debug("[{}] Skipping non-regular TAR entry '{}'.", contextInfo, entry.getName());
                    continue;
                }
                final String path = ArchivePathGuard.normalize(entry.getName());
                ensureWithinLimit(files.size() + 1, maxFiles);
                final byte[] content = readMember(tar, totalBytes);
                totalBytes += content.length;
                putMember(files, path, content, contextInfo);
            }
        }
        log.info("[{}] Extracted {} files from TAR archive.", contextInfo, files.size());
        return files.build();
    }

    private void putMember(final FileSet.Builder files, final String path, final byte[] content,
                           final String contextInfo) {
        if (files.contains(path)) {
            log.warn("[{}] Archive contains '{}' more than once; keeping the last copy.", contextInfo, path);
        }
        files.put(path, content);
    }

    private void ensureWithinLimit(final int memberCount, final int maxFiles) {
        if (memberCount > maxFiles) {
            throw new ExtractionException("Archive contains too many files: more than " + maxFiles);
        }
    }

    private byte[] readMember(final InputStream in, final long bytesSoFar) throws IOException {
        final long remaining = maxUncompressedBytes - bytesSoFar;
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        IOUtils.copyLarge(in, out, 0, remaining + 1);
        final byte[] content = out.toByteArray();
        if (content.length > remaining) {
            throw new ExtractionException("Archive exceeds the uncompressed size limit of " + maxUncompressedBytes
                    + " bytes");
        }
        return content;
    }

    /**
     * Strips a single compression layer if one is detected, otherwise returns the input unchanged.
     */
    private byte[] decompress(final byte[] archive, final String contextInfo) throws IOException {
        final InputStream in = new BufferedInputStream(new ByteArrayInputStream(archive));
        final String compression;
        try {
            compression = CompressorStreamFactory.detect(in);
        } catch (CompressorException e) {
            return archive;
        }
        log.debug("[{}] Detected '{}' compression.", contextInfo, compression);
        try (InputStream decompressed = new CompressorStreamFactory().createCompressorInputStream(compression, in)) {
            return readMember(decompressed, 0);
        } catch (CompressorException e) {
            throw new ExtractionException("Failed to decompress archive (" + compression + "): " + e.getMessage(), e);
        }
    }

    private boolean isTar(final byte[] payload) {
        try {
            final InputStream in = new BufferedInputStream(new ByteArrayInputStream(payload));
            return ArchiveStreamFactory.TAR.equals(ArchiveStreamFactory.detect(in));
        } catch (ArchiveException e) {
            return false;
        }
    }

    private static boolean looksLikeZip(final byte[] archive) {
        return startsWith(archive, ZIP_LOCAL_HEADER) || startsWith(archive, ZIP_EMPTY_ARCHIVE);
    }

    private static boolean looksLikeLatex(final byte[] payload) {
        final String head = new String(payload, 0, Math.min(payload.length, 64 * 1024), StandardCharsets.UTF_8)
                .toLowerCase(Locale.ROOT);
        for (String marker : LATEX_MARKERS) {
            if (head.contains(marker.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static boolean startsWith(final byte[] data, final byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
