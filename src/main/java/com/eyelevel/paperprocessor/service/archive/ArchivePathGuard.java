package com.eyelevel.paperprocessor.service.archive;

import com.eyelevel.paperprocessor.exception.ExtractionException;
import org.apache.commons.io.FilenameUtils;
import org.springframework.util.StringUtils;

import java.nio.file.Path;

/**
 * Keeps archive member paths inside their extraction root.
 * <p>
 * A member name is rejected when it is absolute, carries a drive or UNC prefix, contains a NUL character,
 * or climbs above the root through {@code ..} segments. Accepted names are returned in normalized,
 * forward-slash form.
 */
public final class ArchivePathGuard {

    private ArchivePathGuard() {
    }

    /**
     * @param memberName The raw name of an archive member.
     * @return The normalized relative path, e.g. {@code sections/intro.tex} for {@code ./sections//intro.tex}.
     * @throws ExtractionException if the name would resolve outside the extraction root.
     */
    public static String normalize(final String memberName) {
        if (!StringUtils.hasText(memberName) || memberName.indexOf('\0') >= 0) {
            throw new ExtractionException("Archive contains an entry with an invalid name: '" + memberName + "'");
        }
        final String slashed = memberName.replace('\\', '/');
        if (FilenameUtils.getPrefixLength(slashed) != 0) {
            throw new ExtractionException("Archive entry uses an absolute path: '" + memberName + "'");
        }
        final String normalized = FilenameUtils.normalize(slashed, true);
        if (normalized == null || normalized.equals("..") || normalized.startsWith("../")) {
            throw new ExtractionException("Archive entry escapes the extraction root: '" + memberName + "'");
        }
        if (normalized.isEmpty()) {
            throw new ExtractionException("Archive contains an entry with an invalid name: '" + memberName + "'");
        }
        return normalized;
    }

    /**
     * Resolves a member path against a real directory, re-checking containment on the resolved path.
     *
     * @throws ExtractionException if the resolved path is not inside {@code root}.
     */
    public static Path resolveInside(final Path root, final String memberName) {
        final Path normalizedRoot = root.toAbsolutePath().normalize();
        final Path target = normalizedRoot.resolve(normalize(memberName)).normalize();
        if (!target.startsWith(normalizedRoot) || target.equals(normalizedRoot)) {
            throw new ExtractionException("Archive entry escapes the extraction root: '" + memberName + "'");
        }
        return target;
    }
}
