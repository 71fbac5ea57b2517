package com.eyelevel.paperprocessor.service.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eyelevel.paperprocessor.exception.ValidationException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

/**
 * Verifies accepted and rejected paper identifier shapes.
 */
class PaperIdValidatorTest {

    private final PaperIdValidator validator = new PaperIdValidator();

    @ParameterizedTest
    @ValueSource(strings = {"2404.04895", "2404.04895v2", "0704.0001", "hep-th/9901001", "math.GT/0309136v1",
            "cond-mat.stat-mech/0102536"})
    void isValid_acceptsNewAndOldStyleIds(String id) {
        assertTrue(validator.isValid(id));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "2404.048", "2404.048951", "24040.4895", "hep-th/990100", "../etc/passwd",
            "2404.04895/../../x", "hep-th/9901001v", "https://arxiv.org/abs/2404.04895"})
    void isValid_rejectsMalformedIds(String id) {
        assertFalse(validator.isValid(id));
    }

    @Test
    void requireValid_returnsTrimmedId() {
        assertEquals("2404.04895v1", validator.requireValid("  2404.04895v1\n"));
    }

    @Test
    void requireValid_throwsValidationExceptionForNull() {
        ValidationException ex = assertThrows(ValidationException.class, () -> validator.requireValid(null));
        assertTrue(ex.getMessage().startsWith("Invalid paper ID format"));
    }
}
