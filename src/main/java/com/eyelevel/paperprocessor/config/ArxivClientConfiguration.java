package com.eyelevel.paperprocessor.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Configures the {@link WebClient} used to fetch source archives from the e-print endpoint.
 */
@Slf4j
@Configuration
public class ArxivClientConfiguration {

    /**
     * Creates the {@link WebClient} for the configured source repository. Redirects are followed because
     * the e-print endpoint answers versioned and legacy identifiers with a redirect.
     *
     * @return A configured {@link WebClient} bean named "arxivWebClient".
     */
    @Bean("arxivWebClient")
    public WebClient arxivWebClient(PaperProcessingConfig config) {
        final PaperProcessingConfig.Download download = config.getDownload();
        log.info("Initializing source repository WebClient with base URL: {}", download.getBaseUrl());
        return WebClient.builder()
                .baseUrl(download.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create().followRedirect(true)))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(download.getMaxArchiveBytes()))
                .build();
    }
}
