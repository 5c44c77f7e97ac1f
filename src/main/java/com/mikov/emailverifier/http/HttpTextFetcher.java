package com.mikov.emailverifier.http;

import com.mikov.emailverifier.exception.ConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Fetches text documents over HTTP. Server errors and transport failures are retried with a
 * linearly growing delay; client errors fail at once.
 */
@Slf4j
public class HttpTextFetcher {
    private final RestTemplate restTemplate;
    private final int maxRetries;
    private final Duration retryDelay;

    public HttpTextFetcher(final RestTemplate restTemplate, final int maxRetries, final Duration retryDelay) {
        this.restTemplate = restTemplate;
        this.maxRetries = maxRetries;
        this.retryDelay = retryDelay;
    }

    /**
     * @param url absolute URL of the document
     * @return the response body, empty if the server sent none
     * @throws ConnectionException if the document cannot be fetched
     */
    public String fetch(final String url) {
        RestClientException lastException = null;

        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                if (attempt > 0) {
                    log.debug("Retrying fetch of {} (attempt {}/{})", url, attempt + 1, maxRetries);
                    TimeUnit.MILLISECONDS.sleep(retryDelay.toMillis() * attempt);
                }

                final var response = restTemplate.getForEntity(url, byte[].class);
                final var body = decode(response);
                log.debug("Fetched {} characters from {}", body.length(), url);
                return body;
            } catch (final HttpClientErrorException e) {
                log.error("Fetching {} failed with {}", url, e.getStatusCode());
                throw new ConnectionException("Failed to fetch " + url + ": HTTP " + e.getStatusCode().value(), e);
            } catch (final HttpServerErrorException | ResourceAccessException e) {
                lastException = e;
                log.warn("Fetch attempt {}/{} of {} failed: {}", attempt + 1, maxRetries, url, e.getMessage());
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConnectionException("Interrupted while fetching " + url, e);
            }
        }

        throw new ConnectionException("Failed to fetch " + url + " after " + maxRetries + " attempts", lastException);
    }

    /**
     * Uses the charset declared by the server, UTF-8 when there is none.
     */
    private static String decode(final ResponseEntity<byte[]> response) {
        final var body = response.getBody();
        if (body == null) {
            return "";
        }
        final var contentType = response.getHeaders().getContentType();
        final var charset = contentType != null && contentType.getCharset() != null
                ? contentType.getCharset()
                : StandardCharsets.UTF_8;
        return new String(body, charset);
    }
}
