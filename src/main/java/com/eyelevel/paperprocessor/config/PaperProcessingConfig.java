package com.eyelevel.paperprocessor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds application properties under the "app.processing" prefix to a strongly-typed
 * configuration object. This provides centralized control over download, extraction,
 * compilation and rendering behaviour of the paper pipeline.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.processing")
public class PaperProcessingConfig {

    @Valid
    private Download download = new Download();
    @Valid
    private Extraction extraction = new Extraction();
    @Valid
    private Compilation compilation = new Compilation();
    @Valid
    private Rendering rendering = new Rendering();

    @Data
    public static class RetryConfig {
        @Min(0)
        private int attempts;
        @Min(0)
        private long delayMs = 1000;
    }

    @Data
    public static class Download {
        @NotBlank
        private String baseUrl = "https://arxiv.org/e-print";
        @Min(1)
        private long timeoutSeconds = 60;
        @DecimalMin(value = "0.0", inclusive = false)
        private double requestsPerSecond = 2.0;
        @Min(1)
        private int burstSize = 5;
        @Min(1)
        private int maxConcurrent = 5;
        /**
         * Upper bound on the size of a downloaded archive held in memory.
         */
        @Min(1024)
        private int maxArchiveBytes = 200 * 1024 * 1024;
        @Valid
        private RetryConfig retry = new RetryConfig();
    }

    @Data
    public static class Extraction {
        @Min(1)
        private int maxFiles = 1000;
        @Min(1)
        private int maxConcurrent = 3;
        /**
         * Upper bound on the total decompressed size of an archive's members.
         */
        @Min(1024)
        private long maxUncompressedBytes = 512L * 1024 * 1024;
        /**
         * Accept a bare (optionally gzip-compressed) LaTeX document as a one-file archive.
         */
        private boolean singleFileFallback;
    }

    @Data
    public static class Compilation {
        @NotBlank
        private String binary = "pdflatex";
        @Min(1)
        private long timeoutSeconds = 300;
        @Min(1)
        private int maxConcurrent = 2;
        private boolean enableSandboxing = true;
        /**
         * Parent directory for per-compilation working directories. Blank means the system temp directory.
         */
        private String workDir;
        private List<String> options = new ArrayList<>(List.of("-interaction=nonstopmode", "-halt-on-error"));
    }

    @Data
    public static class Rendering {
        /**
         * Which rendered-artifact reader to use: {@code pdfbox} or {@code none}.
         */
        private String reader = "pdfbox";
    }
}
