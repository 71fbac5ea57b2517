package com.eyelevel.paperprocessor.service.validation;

import com.eyelevel.paperprocessor.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.regex.Pattern;

/**
 * Validates paper identifiers before any network or filesystem work is done.
 * <p>
 * Two shapes are accepted:
 * <ul>
 *     <li>new style {@code YYMM.NNNN} or {@code YYMM.NNNNN}, e.g. {@code 2404.04895v2}</li>
 *     <li>old style {@code subject-class/YYMMNNN}, e.g. {@code hep-th/9901001} or {@code math.GT/0309136v1}</li>
 * </ul>
 */
@Slf4j
@Service
public class PaperIdValidator {

    private static final Pattern NEW_STYLE = Pattern.compile("^\\d{4}\\.\\d{4,5}(v\\d+)?$");
    private static final Pattern OLD_STYLE = Pattern.compile("^[A-Za-z]+(?:[.\\-][A-Za-z]+)*/\\d{7}(v\\d+)?$");

    public boolean isValid(final String paperId) {
        if (!StringUtils.hasText(paperId)) {
            return false;
        }
        final String trimmed = paperId.trim();
        return NEW_STYLE.matcher(trimmed).matches() || OLD_STYLE.matcher(trimmed).matches();
    }

    /**
     * Returns the trimmed identifier when it is well formed.
     *
     * @throws ValidationException if the identifier matches neither accepted shape.
     */
    public String requireValid(final String paperId) {
        if (!isValid(paperId)) {
            log.debug("Rejected malformed paper ID '{}'.", paperId);
            throw new ValidationException("Invalid paper ID format: " + paperId);
        }
        return paperId.trim();
    }
}
