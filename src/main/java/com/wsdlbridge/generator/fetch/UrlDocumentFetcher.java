package com.wsdlbridge.generator.fetch;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wsdlbridge.generator.model.SourceLocation;

/**
 * Reads documents from local files or over HTTP(S) as raw bytes.
 *
 * One instance belongs to one conversion run; the HTTP client is not shared statically.
 */
public class UrlDocumentFetcher implements DocumentFetcher {
    private static final Logger log = LoggerFactory.getLogger(UrlDocumentFetcher.class);

    private final HttpClient httpClient;
    private final Duration timeout;

    public UrlDocumentFetcher(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public byte[] fetch(SourceLocation location) throws IOException {
        Objects.requireNonNull(location, "location");

        if (location.isFile()) {
            return readFile(location);
        }
        if (location.isHttp()) {
            return readHttp(location.getUri());
        }
        throw new IOException("Unsupported location scheme: " + location);
    }

    private byte[] readFile(SourceLocation location) throws IOException {
        Path path;
        try {
            path = Path.of(location.getUri());
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid file location: " + location, e);
        }
        log.debug("Reading file {}", path);
        return Files.readAllBytes(path);
    }

    private byte[] readHttp(URI uri) throws IOException {
        log.debug("Fetching {}", uri);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .GET()
                .build();
        try {
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() >= 400) {
                throw new IOException("HTTP " + response.statusCode() + " fetching " + uri);
            }
            return response.body();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while fetching " + uri);
        }
    }
}
