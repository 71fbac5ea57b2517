package com.eyelevel.paperprocessor.model;

/**
 * Stable classification of a pipeline failure, surfaced on {@link ProcessingResult#getErrorType()}.
 */
public enum ErrorType {
    VALIDATION,
    DOWNLOAD,
    EXTRACTION,
    PROCESSING,
    COMPILATION,
    RENDERED_ARTIFACT,
    INTERNAL
}
