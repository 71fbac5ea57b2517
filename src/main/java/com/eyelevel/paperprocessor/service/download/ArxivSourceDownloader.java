package com.eyelevel.paperprocessor.service.download;

import com.eyelevel.paperprocessor.common.ratelimit.SlidingWindowRateLimiter;
import com.eyelevel.paperprocessor.config.PaperProcessingConfig;
import com.eyelevel.paperprocessor.exception.DownloadException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeoutException;

/**
 * Fetches paper source archives from the e-print endpoint.
 * <p>
 * Each fetch holds one of {@code burst-size} slots, waits on the shared rate limiter and then issues a single
 * GET bounded by the caller's timeout. There are no retries here; see
 * {@link com.eyelevel.paperprocessor.service.pipeline.PaperPipelineService} for the retry policy.
 */
@Slf4j
@Service
public class ArxivSourceDownloader {

    public static final String DOWNLOAD_COUNTER = "paper.downloads";

    private final WebClient webClient;
    private final SlidingWindowRateLimiter rateLimiter;
    private final Semaphore burstSlots;
    private final MeterRegistry meterRegistry;

    public ArxivSourceDownloader(@Qualifier("arxivWebClient") WebClient webClient,
                                 SlidingWindowRateLimiter rateLimiter,
                                 PaperProcessingConfig config,
                                 MeterRegistry meterRegistry) {
        this.webClient = webClient;
        this.rateLimiter = rateLimiter;
        this.burstSlots = new Semaphore(config.getDownload().getBurstSize(), true);
        this.meterRegistry = meterRegistry;
    }

    /**
     * Downloads the source archive of a paper.
     *
     * @param paperId A validated paper identifier.
     * @param timeout Upper bound for the network call only; slot and rate-limit waits are not counted.
     * @return The raw archive bytes.
     * @throws DownloadException    on a non-2xx response, a connection failure or a timeout.
     * @throws InterruptedException if the thread is interrupted while waiting for a slot or the rate limiter.
     */
    public byte[] fetch(final String paperId, final Duration timeout) throws InterruptedException {
        burstSlots.acquire();
        try {
            rateLimiter.acquire();
            log.info("[{}] Downloading source archive (timeout: {}s).", paperId, timeout.toSeconds());
            final byte[] content = request(paperId, timeout);
            meterRegistry.counter(DOWNLOAD_COUNTER, "status", "success").increment();
            log.info("[{}] Downloaded {} bytes (sha256: {}).", paperId, content.length, DigestUtils.sha256Hex(content));
            return content;
        } catch (DownloadException e) {
            meterRegistry.counter(DOWNLOAD_COUNTER, "status", "error").increment();
            log.warn("[{}] Download failed: {}", paperId, e.getMessage());
            throw e;
        } finally {
            burstSlots.release();
        }
    }

    private byte[] request(final String paperId, final Duration timeout) throws InterruptedException {
        try {
            final byte[] body = webClient.get()
                    .uri(uriBuilder -> uriBuilder.path("/" + paperId).build())
                    .exchangeToMono(response -> handleResponse(paperId, response))
                    .timeout(timeout)
                    .block();
            return body == null ? new byte[0] : body;
        } catch (DownloadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw mapException(paperId, timeout, e);
        }
    }

    private Mono<byte[]> handleResponse(final String paperId, final ClientResponse response) {
        final int statusCode = response.statusCode().value();
        if (response.statusCode().is2xxSuccessful()) {
            log.debug("[{}] Response was successful, statusCode {}", paperId, statusCode);
            return response.bodyToMono(byte[].class).defaultIfEmpty(new byte[0]);
        }
        final boolean transientFailure = response.statusCode().is5xxServerError() || statusCode == 429;
        return response.releaseBody().then(Mono.error(new DownloadException(
                "Failed to download " + paperId + ": HTTP " + statusCode, statusCode, transientFailure)));
    }

    /**
     * Maps transport-level failures to a {@link DownloadException}, keeping the interrupt status intact.
     */
    private DownloadException mapException(final String paperId, final Duration timeout, final RuntimeException error)
            throws InterruptedException {
        final Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw interrupted;
        }
        if (cause instanceof DownloadException downloadException) {
            return downloadException;
        }
        if (cause instanceof TimeoutException) {
            return new DownloadException(
                    "Download of " + paperId + " timed out after " + timeout.toSeconds() + " seconds", cause, true);
        }
        if (cause instanceof WebClientRequestException || cause instanceof ConnectException
                || cause instanceof UnknownHostException) {
            return new DownloadException("Failed to connect to the source repository for " + paperId + ": "
                    + cause.getMessage(), cause, true);
        }
        if (cause instanceof WebClientException) {
            return new DownloadException("Unexpected client error while downloading " + paperId + ": "
                    + cause.getMessage(), cause, false);
        }
        return new DownloadException("Download failed for " + paperId + ": " + cause.getMessage(), cause, false);
    }
}
