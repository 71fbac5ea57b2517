package com.eyelevel.paperprocessor.service.latex;

import com.eyelevel.paperprocessor.model.FileSet;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the root LaTeX document of a source tree.
 * <p>
 * The choice depends only on the paths and contents of the FileSet, so the same input always yields the same
 * main file.
 */
@Slf4j
@Service
public class MainFileResolver {

    /**
     * Conventional main-file names, highest priority first.
     */
    static final List<String> PREFERRED_NAMES = List.of("main.tex", "paper.tex", "manuscript.tex", "article.tex");

    private static final String DOCUMENT_CLASS = "\\documentclass";

    /**
     * @param files The extracted source tree.
     * @return The path of the main {@code .tex} file, or empty if the tree contains no {@code .tex} file.
     */
    public Optional<String> resolve(final FileSet files) {
        final List<String> texFiles = files.paths().stream()
                .filter(MainFileResolver::isTexFile)
                .toList();
        if (texFiles.isEmpty()) {
            return Optional.empty();
        }

        for (String preferred : PREFERRED_NAMES) {
            for (String path : texFiles) {
                if (FilenameUtils.getName(path).equalsIgnoreCase(preferred)) {
                    log.debug("Selected '{}' by conventional name.", path);
                    return Optional.of(path);
                }
            }
        }

        for (String path : texFiles) {
            final boolean declaresClass = files.text(path)
                    .map(text -> text.toLowerCase(Locale.ROOT).contains(DOCUMENT_CLASS))
                    .orElse(false);
            if (declaresClass) {
                log.debug("Selected '{}' as the first file declaring a document class.", path);
                return Optional.of(path);
            }
        }

        log.debug("No obvious main file; falling back to '{}'.", texFiles.get(0));
        return Optional.of(texFiles.get(0));
    }

    private static boolean isTexFile(final String path) {
        return "tex".equalsIgnoreCase(FilenameUtils.getExtension(path));
    }
}
