package com.eyelevel.paperprocessor.service.download;

import com.eyelevel.paperprocessor.exception.DownloadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class DownloadRetryListener implements RetryListener {

    /**
     * Name of the retry-context attribute carrying the paper ID, set by the pipeline before each attempt.
     */
    public static final String PAPER_ID_ATTRIBUTE = "paperId";

    /**
     * Called after a failed attempt.
     *
     * @param context   The current retry context.
     * @param callback  The callback that was executed.
     * @param throwable The exception that was thrown.
     */
    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
        Object paperId = context.getAttribute(PAPER_ID_ATTRIBUTE);
        boolean retryable = throwable instanceof DownloadException download && download.isTransientFailure();

        log.warn("[{}] Download attempt {} failed ({}). Error: {}",
                paperId != null ? paperId : "Unknown Paper",
                context.getRetryCount(),
                retryable ? "transient" : "permanent",
                throwable.getMessage());
    }

    @Override
    public <T, E extends Throwable> boolean open(RetryContext context, RetryCallback<T, E> callback) {
        return true;
    }

    @Override
    public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
        if (throwable != null && context.getRetryCount() > 1) {
            log.error("[{}] Download failed after {} attempts.", context.getAttribute(PAPER_ID_ATTRIBUTE),
                    context.getRetryCount());
        }
    }
}
