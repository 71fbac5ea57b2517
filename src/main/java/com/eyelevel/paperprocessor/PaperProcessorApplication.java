package com.eyelevel.paperprocessor;

import com.eyelevel.paperprocessor.config.PaperProcessingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;

/**
 * The main entry point for the Paper Processor Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link SpringBootApplication}: A composite annotation that enables auto-configuration,
 *     component scanning, and property support.</li>
 *     <li>{@link EnableConfigurationProperties}: Binds custom application properties (prefixed with "app.processing")
 *     to the {@link PaperProcessingConfig} class.</li>
 * </ul>
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(value = PaperProcessingConfig.class)
public class PaperProcessorApplication {

    /**
     * The main method which serves as the entry point for the Java application.
     * It delegates to Spring Boot's {@link SpringApplication} class to launch the application,
     * and logs key environment information upon startup.
     *
     * @param args Command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        log.info("Starting PaperProcessorApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(PaperProcessorApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "PaperProcessor"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Source:     {}", env.getProperty("app.processing.download.base-url"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
