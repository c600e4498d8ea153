package io.github.yok.toch.source;

import io.github.yok.toch.config.IngestConfig;
import io.github.yok.toch.exception.RemoteFetchException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link HttpFetcher} backed by {@link HttpClient}. Redirects are followed.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class JdkHttpFetcher implements HttpFetcher {

    private final HttpClient client;

    // null = no request timeout
    private final Duration requestTimeout;

    /**
     * Creates a fetcher using the {@code toch.http} settings.
     *
     * @param config ingestion configuration
     */
    public JdkHttpFetcher(IngestConfig config) {
        IngestConfig.Http http = config.getHttp();
        HttpClient.Builder builder =
                HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL);
        if (http.getConnectTimeoutSeconds() > 0) {
            builder.connectTimeout(Duration.ofSeconds(http.getConnectTimeoutSeconds()));
        }
        this.client = builder.build();
        this.requestTimeout = http.getRequestTimeoutSeconds() > 0
                ? Duration.ofSeconds(http.getRequestTimeoutSeconds())
                : null;
    }

    @Override
    public byte[] fetch(String url) {
        HttpRequest request;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url.trim())).GET();
            if (requestTimeout != null) {
                builder.timeout(requestTimeout);
            }
            request = builder.build();
        } catch (IllegalArgumentException e) {
            throw new RemoteFetchException("Invalid URL: " + url, e);
        }

        log.info("Fetching {}", url);
        HttpResponse<byte[]> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new RemoteFetchException("Failed to fetch " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteFetchException("Interrupted while fetching " + url, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new RemoteFetchException("HTTP status " + status + " fetching " + url);
        }
        byte[] body = response.body();
        log.info("Fetched {} ({} bytes)", url, body.length);
        return body;
    }
}
