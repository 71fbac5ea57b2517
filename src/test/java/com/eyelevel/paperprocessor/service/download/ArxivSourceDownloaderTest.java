package com.eyelevel.paperprocessor.service.download;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.eyelevel.paperprocessor.common.ratelimit.Sleeper;
import com.eyelevel.paperprocessor.common.ratelimit.SlidingWindowRateLimiter;
import com.eyelevel.paperprocessor.config.ArxivClientConfiguration;
import com.eyelevel.paperprocessor.config.PaperProcessingConfig;
import com.eyelevel.paperprocessor.exception.DownloadException;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Exercises the downloader against a local HTTP stub.
 */
class ArxivSourceDownloaderTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final byte[] ARCHIVE = "archive-bytes".getBytes(StandardCharsets.UTF_8);

    private HttpServer server;
    private ExecutorService serverExecutor;
    private final List<String> requestedPaths = new CopyOnWriteArrayList<>();
    private SimpleMeterRegistry meterRegistry;
    private ArxivSourceDownloader downloader;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.createContext("/e-print", exchange -> {
            String path = exchange.getRequestURI().getPath();
            requestedPaths.add(path);
            int status;
            byte[] body;
            if (path.endsWith("/2404.00404")) {
                status = 404;
                body = "not found".getBytes(StandardCharsets.UTF_8);
            } else if (path.endsWith("/2404.00503")) {
                status = 503;
                body = "busy".getBytes(StandardCharsets.UTF_8);
            } else if (path.endsWith("/2404.09999")) {
                sleepQuietly(3_000);
                status = 200;
                body = ARCHIVE;
            } else {
                status = 200;
                body = ARCHIVE;
            }
            exchange.sendResponseHeaders(status, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();

        downloader = downloaderFor("http://127.0.0.1:" + server.getAddress().getPort() + "/e-print");
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    @Test
    void fetch_returnsBodyAndCountsSuccess() throws Exception {
        byte[] content = downloader.fetch("2404.04895v2", TIMEOUT);

        assertArrayEquals(ARCHIVE, content);
        assertEquals(List.of("/e-print/2404.04895v2"), requestedPaths);
        assertEquals(1.0, meterRegistry.counter(ArxivSourceDownloader.DOWNLOAD_COUNTER, "status", "success").count());
    }

    @Test
    void fetch_keepsOldStyleIdentifierPath() throws Exception {
        downloader.fetch("hep-th/9901001", TIMEOUT);

        assertEquals(List.of("/e-print/hep-th/9901001"), requestedPaths);
    }

    @Test
    void fetch_notFoundIsPermanentFailure() {
        DownloadException ex = assertThrows(DownloadException.class, () -> downloader.fetch("2404.00404", TIMEOUT));

        assertEquals(404, ex.getStatusCode());
        assertFalse(ex.isTransientFailure());
        assertTrue(ex.getMessage().contains("HTTP 404"));
        assertEquals(1.0, meterRegistry.counter(ArxivSourceDownloader.DOWNLOAD_COUNTER, "status", "error").count());
    }

    @Test
    void fetch_serverErrorIsTransientFailure() {
        DownloadException ex = assertThrows(DownloadException.class, () -> downloader.fetch("2404.00503", TIMEOUT));

        assertEquals(503, ex.getStatusCode());
        assertTrue(ex.isTransientFailure());
    }

    @Test
    void fetch_slowResponseTimesOut() {
        long start = System.nanoTime();

        DownloadException ex = assertThrows(DownloadException.class,
                () -> downloader.fetch("2404.09999", Duration.ofMillis(300)));

        assertTrue(ex.getMessage().contains("timed out"), ex.getMessage());
        assertTrue(ex.isTransientFailure());
        assertNull(ex.getStatusCode());
        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(3)) < 0);
    }

    @Test
    void fetch_connectionRefusedIsTransientFailure() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        ArxivSourceDownloader unreachable = downloaderFor("http://127.0.0.1:" + closedPort + "/e-print");

        DownloadException ex = assertThrows(DownloadException.class, () -> unreachable.fetch("2404.04895", TIMEOUT));

        assertTrue(ex.isTransientFailure());
    }

    private ArxivSourceDownloader downloaderFor(String baseUrl) {
        PaperProcessingConfig config = new PaperProcessingConfig();
        config.getDownload().setBaseUrl(baseUrl);
        meterRegistry = new SimpleMeterRegistry();
        SlidingWindowRateLimiter rateLimiter = new SlidingWindowRateLimiter(100, Clock.systemUTC(), Sleeper.SYSTEM);
        return new ArxivSourceDownloader(new ArxivClientConfiguration().arxivWebClient(config), rateLimiter, config,
                meterRegistry);
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
