package com.eventfeed.feed.http;

import com.eventfeed.config.FeedProperties;
import com.eventfeed.feed.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Single-attempt GET with a fixed desktop-browser header set. Every failure, including non-2xx
 * responses, comes back as an unsuccessful {@link HttpFetchResult}; nothing is thrown.
 */
@Service
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    static final String HTML_ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    static final String ACCEPT_LANGUAGE = "en-US,en;q=0.9";

    private final FeedProperties properties;
    private final HttpClient client;

    public PageFetcher(FeedProperties properties) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    public HttpFetchResult fetch(String url) {
        return fetch(url, Duration.ofSeconds(properties.getRequestTimeoutSeconds()));
    }

    public HttpFetchResult fetch(String url, Duration timeout) {
        return get(url, HTML_ACCEPT, timeout);
    }

    /**
     * @return page HTML, or empty on any miss
     */
    public Optional<String> fetchHtml(String url) {
        return fetch(url).html();
    }

    public HttpFetchResult get(String url, String acceptHeader, Duration timeout) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        try {
            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            Duration safeTimeout = timeout == null || timeout.isZero() || timeout.isNegative()
                ? Duration.ofSeconds(properties.getRequestTimeoutSeconds())
                : timeout;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(safeTimeout)
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", ACCEPT_LANGUAGE);
            String bypassName = properties.getBypassHeaderName();
            String bypassValue = properties.getBypassHeaderValue();
            if (bypassName != null && !bypassName.isBlank() && bypassValue != null && !bypassValue.isBlank()) {
                builder.header(bypassName.trim(), bypassValue.trim());
            }

            HttpResponse<byte[]> response = client.send(builder.GET().build(), HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            String responseBody = responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8);
            HttpFetchResult result = new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBody,
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
            if (!result.isSuccessful()) {
                log.debug("Bad status url={} code={}", url, result.statusCode());
            }
            return result;
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        log.debug("Request error url={} code={} message={}", url, code, message);
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            if (value.contains("://")) {
                return null;
            }
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
