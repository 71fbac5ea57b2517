package com.eyelevel.paperprocessor.exception;

import com.eyelevel.paperprocessor.model.ErrorType;
import lombok.Getter;

import java.io.Serial;

/**
 * Thrown when a source archive cannot be fetched: a non-2xx response, a connection failure or a timeout.
 */
@Getter
public class DownloadException extends PaperProcessingException {
    @Serial
    private static final long serialVersionUID = 2481179302665927391L;

    /**
     * HTTP status of the failed response, or {@code null} when no response was received.
     */
    private final Integer statusCode;
    private final boolean transientFailure;

    public DownloadException(String message, Integer statusCode, boolean transientFailure) {
        super(message);
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }

    public DownloadException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.statusCode = null;
        this.transientFailure = transientFailure;
    }

    @Override
    public ErrorType getErrorType() {
        return ErrorType.DOWNLOAD;
    }
}
