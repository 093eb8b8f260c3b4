package com.historicforts.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * Fetches pages with {@link HttpClient}, sending the configured User-Agent and timeout.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Builds a GET request per URL; a non-2xx status counts as a failure.</li>
 *   <li>Failures are retried through {@link Utils#retryAction} with exponential backoff.</li>
 *   <li>The last failure message is returned in the {@link FetchResult}; nothing is thrown.</li>
 * </ul>
 * Bodies are decoded as ISO-8859-1 unless the server names a charset: the fort pages predate UTF-8
 * and Latin-1 never fails to decode.
 *
 * @author Fort Scraper Team
 * @since 1.0
 */
public class FetchService implements FetchServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(FetchService.class);

    static final long RETRY_BASE_DELAY_MS = 1000L;

    private final HttpClient client;
    private final ScraperConfig config;

    public FetchService(ScraperConfig config) {
        this(HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(config.requestTimeoutSeconds()))
                .build(),
            config);
    }

    FetchService(HttpClient client, ScraperConfig config) {
        this.client = client;
        this.config = config;
    }

    @Override
    public FetchResult fetch(String url) {
        if (url == null || url.isBlank()) {
            logger.warn("Refusing to fetch blank URL");
            return FetchResult.failure("blank URL");
        }
        String[] lastError = new String[1];
        String body = Utils.retryAction(() -> {
            try {
                return get(url);
            } catch (IOException e) {
                lastError[0] = e.getMessage();
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lastError[0] = "interrupted";
                throw e;
            }
        }, Math.max(1, config.maxRetries()), RETRY_BASE_DELAY_MS, "fetch " + url);
        if (body == null) {
            return FetchResult.failure(lastError[0]);
        }
        logger.debug("Fetched {} ({} chars)", url, body.length());
        return FetchResult.success(body);
    }

    private String get(String url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("User-Agent", config.userAgent())
            .timeout(Duration.ofSeconds(config.requestTimeoutSeconds()))
            .GET()
            .build();
        HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("HTTP " + status + " for " + url);
        }
        String contentType = response.headers().firstValue("Content-Type").orElse("");
        return new String(response.body(), charsetOf(contentType));
    }

    static Charset charsetOf(String contentType) {
        int idx = contentType.toLowerCase(Locale.ROOT).indexOf("charset=");
        if (idx >= 0) {
            String name = contentType.substring(idx + "charset=".length()).replace("\"", "").split(";")[0].trim();
            try {
                return Charset.forName(name);
            } catch (IllegalArgumentException e) {
                logger.debug("Unknown charset '{}', falling back to ISO-8859-1", name);
            }
        }
        return StandardCharsets.ISO_8859_1;
    }
}
