package com.eyelevel.paperprocessor.config;

import com.eyelevel.paperprocessor.common.ratelimit.SlidingWindowRateLimiter;
import com.eyelevel.paperprocessor.common.ratelimit.Sleeper;
import com.eyelevel.paperprocessor.exception.DownloadException;
import com.eyelevel.paperprocessor.service.download.DownloadRetryListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.policy.NeverRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.util.Map;

/**
 * Wires the shared pieces of the paper pipeline: the time source, the process-wide download rate limiter
 * and the download retry policy.
 */
@Slf4j
@Configuration
public class PipelineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SlidingWindowRateLimiter downloadRateLimiter(PaperProcessingConfig config, Clock clock) {
        final double requestsPerSecond = config.getDownload().getRequestsPerSecond();
        log.info("Download rate limit set to {} request(s) per second.", requestsPerSecond);
        return new SlidingWindowRateLimiter(requestsPerSecond, clock, Sleeper.SYSTEM);
    }

    /**
     * Builds the retry template applied around downloads. Only transient {@link DownloadException}s are retried,
     * and with the default of zero retry attempts the template runs each download exactly once.
     */
    @Bean("downloadRetryTemplate")
    public RetryTemplate downloadRetryTemplate(PaperProcessingConfig config, DownloadRetryListener listener) {
        final PaperProcessingConfig.RetryConfig retry = config.getDownload().getRetry();
        final RetryPolicy policy = retry.getAttempts() <= 0
                ? new NeverRetryPolicy()
                : new TransientDownloadRetryPolicy(retry.getAttempts() + 1);

        final RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(policy);
        template.setThrowLastExceptionOnExhausted(true);
        if (retry.getDelayMs() > 0) {
            final FixedBackOffPolicy backOff = new FixedBackOffPolicy();
            backOff.setBackOffPeriod(retry.getDelayMs());
            template.setBackOffPolicy(backOff);
        }
        template.registerListener(listener);
        log.info("Download retry policy: {} additional attempt(s), {} ms delay.", Math.max(0, retry.getAttempts()),
                retry.getDelayMs());
        return template;
    }

    /**
     * Retries a {@link DownloadException} only when it is flagged transient (5xx, 429, connect errors, timeouts).
     */
    static class TransientDownloadRetryPolicy extends SimpleRetryPolicy {

        TransientDownloadRetryPolicy(int maxAttempts) {
            super(maxAttempts, Map.of(DownloadException.class, true));
        }

        @Override
        public boolean canRetry(RetryContext context) {
            final Throwable last = context.getLastThrowable();
            if (last instanceof DownloadException download && !download.isTransientFailure()) {
                return false;
            }
            return super.canRetry(context);
        }
    }
}
