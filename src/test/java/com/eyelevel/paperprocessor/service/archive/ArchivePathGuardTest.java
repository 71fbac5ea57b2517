package com.eyelevel.paperprocessor.service.archive;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eyelevel.paperprocessor.exception.ExtractionException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Verifies that archive member names cannot escape their extraction root.
 */
class ArchivePathGuardTest {

    @TempDir
    Path root;

    @ParameterizedTest
    @ValueSource(strings = {"../x.tex", "a/../../x.tex", "..", "/etc/passwd", "\\windows\\x.tex", "C:\\x.tex",
            "C:/x.tex", "//server/share/x.tex", "..\\x.tex", ".", "./", "   "})
    void normalize_rejectsEscapingOrEmptyNames(String name) {
        assertThrows(ExtractionException.class, () -> ArchivePathGuard.normalize(name));
    }

    @Test
    void normalize_rejectsNulCharacter() {
        assertThrows(ExtractionException.class, () -> ArchivePathGuard.normalize("main.tex\u0000.sh"));
    }

    @Test
    void normalize_collapsesRedundantSegments() {
        assertEquals("sections/intro.tex", ArchivePathGuard.normalize("./sections//intro.tex"));
        assertEquals("main.tex", ArchivePathGuard.normalize("sections/../main.tex"));
        assertEquals("fig/a.png", ArchivePathGuard.normalize("fig\\a.png"));
    }

    @Test
    void resolveInside_staysUnderRoot() {
        Path resolved = ArchivePathGuard.resolveInside(root, "sections/intro.tex");

        assertTrue(resolved.startsWith(root.toAbsolutePath().normalize()));
        assertEquals("intro.tex", resolved.getFileName().toString());
    }

    @Test
    void resolveInside_rejectsTraversal() {
        assertThrows(ExtractionException.class, () -> ArchivePathGuard.resolveInside(root, "../outside.tex"));
    }
}
