package com.eyelevel.paperprocessor.model;

import java.util.Locale;

/**
 * The sequential stages of a single paper run.
 */
public enum PipelineStage {
    VALIDATING,
    DOWNLOADING,
    EXTRACTING,
    RESOLVING,
    EXTRACTING_TEXT,
    COMPILING,
    READING_ARTIFACT,
    DONE;

    public String metricTag() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
