package com.eyelevel.paperprocessor.model;

public enum CompilationFailureKind {
    TIMEOUT,
    BINARY_NOT_FOUND,
    NON_ZERO_EXIT,
    ARTIFACT_MISSING,
    /**
     * The temporary working directory could not be created or populated.
     */
    WORKSPACE_ERROR
}
