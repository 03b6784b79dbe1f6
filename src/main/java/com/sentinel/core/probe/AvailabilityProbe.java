package com.sentinel.core.probe;

import com.sentinel.core.config.SentinelProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Liveness check for the local model tier.
 *
 * <p>Issues {@code GET <base-url><probe-path>} with a fixed 5 second timeout. Any
 * failure (refused connection, unknown host, timeout, malformed URL) reads as
 * "unavailable"; this class never throws. Results are not cached because the local
 * endpoint may come and go between runs.
 */
@Component
public class AvailabilityProbe {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityProbe.class);

    static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final String baseUrl;
    private final String probePath;
    private final Duration timeout;
    private final HttpClient httpClient;

    @Autowired
    public AvailabilityProbe(SentinelProperties properties) {
        this(properties.getTiers().getLocal().getBaseUrl(), properties.getTiers().getLocal().getProbePath());
    }

    public AvailabilityProbe(String baseUrl, String probePath) {
        this(baseUrl, probePath, TIMEOUT);
    }

    AvailabilityProbe(String baseUrl, String probePath, Duration timeout) {
        this.baseUrl = baseUrl;
        this.probePath = probePath;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    public boolean isAvailable() {
        String url = probeUrl();
        try {
            var request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .GET()
                    .build();
            var response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            boolean up = response.statusCode() >= 200 && response.statusCode() < 300;
            log.info("Local tier probe {} -> HTTP {} ({})", url, response.statusCode(), up ? "available" : "unavailable");
            return up;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Local tier probe {} interrupted", url);
            return false;
        } catch (IOException | RuntimeException e) {
            log.info("Local tier probe {} failed: {}", url, e.toString());
            return false;
        }
    }

    String probeUrl() {
        String base = baseUrl == null ? "" : baseUrl.trim();
        String path = probePath == null ? "" : probePath.trim();
        if (base.endsWith("/") && path.startsWith("/")) {
            return base + path.substring(1);
        }
        if (!base.endsWith("/") && !path.isEmpty() && !path.startsWith("/")) {
            return base + "/" + path;
        }
        return base + path;
    }
}
