package com.docuvision.pipeline.service.fetch;

import com.docuvision.pipeline.service.extraction.FailureKind;
import com.docuvision.pipeline.service.format.FormatResolver;
import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.timeout.ReadTimeoutException;
import org.apache.tika.mime.MimeType;
import org.apache.tika.mime.MimeTypeException;
import org.apache.tika.mime.MimeTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

@Component
public class WebClientRemoteFetcher implements RemoteFetcher {

    private static final Logger log = LoggerFactory.getLogger(WebClientRemoteFetcher.class);

    static final String DEFAULT_BASE_NAME = "document";

    private final WebClient fetchWebClient;
    private final FormatResolver formatResolver;
    private final Duration timeout;
    private final Path scratchDir;

    public WebClientRemoteFetcher(@Qualifier("fetchWebClient") WebClient fetchWebClient,
                                  FormatResolver formatResolver,
                                  @Value("${docuvision.fetch.timeout-seconds:30}") long timeoutSeconds,
                                  @Value("${docuvision.fetch.scratch-dir:${java.io.tmpdir}}") String scratchDir) {
        this.fetchWebClient = fetchWebClient;
        this.formatResolver = formatResolver;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.scratchDir = Path.of(scratchDir);
    }

    @Override
    public FetchedFile fetch(String url, String fallbackExtension) {
        log.info("Downloading file from {}", url);
        URI uri = toUri(url);
        Path tempFile = createTempFile();
        try {
            FetchedFile fetched = fetchWebClient.get()
                    .uri(uri)
                    .exchangeToMono(response -> {
                        if (!response.statusCode().is2xxSuccessful()) {
                            return response.releaseBody()
                                    .then(Mono.error(new FetchException(FailureKind.HTTP_ERROR,
                                            "Download of " + url + " failed with HTTP " + response.statusCode().value())));
                        }
                        HttpHeaders headers = response.headers().asHttpHeaders();
                        String contentType = headers.getContentType() == null ? null : headers.getContentType().toString();
                        String name = deriveName(url, headers.getFirst(HttpHeaders.CONTENT_DISPOSITION), contentType, fallbackExtension);
                        return DataBufferUtils.write(response.bodyToFlux(DataBuffer.class), tempFile)
                                .thenReturn(new FetchedFile(tempFile, name));
                    })
                    .timeout(timeout)
                    .block();
            if (fetched == null) {
                throw new FetchException(FailureKind.NETWORK_ERROR, "No response received from " + url);
            }
            log.info("File downloaded to temp: {} as {}", tempFile, fetched.suggestedName());
            return fetched;
        } catch (RuntimeException e) {
            deleteQuietly(tempFile);
            throw translate(url, e);
        }
    }

    String deriveName(String url, String contentDisposition, String contentType, String fallbackExtension) {
        String name = filenameFromDisposition(contentDisposition);
        if (name == null || name.isBlank()) {
            String path = FormatResolver.stripQuery(url);
            int slash = path.lastIndexOf('/');
            name = slash > -1 ? path.substring(slash + 1) : path;
        }
        if (name == null || name.isBlank()) {
            name = DEFAULT_BASE_NAME;
        }
        if (!formatResolver.hasKnownExtension(name)) {
            name = name + extensionFor(contentType, fallbackExtension);
        }
        return name;
    }

    private String filenameFromDisposition(String contentDisposition) {
        if (contentDisposition == null || contentDisposition.isBlank()) {
            return null;
        }
        try {
            return ContentDisposition.parse(contentDisposition).getFilename();
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed Content-Disposition '{}'", contentDisposition, e);
            return null;
        }
    }

    private String extensionFor(String contentType, String fallbackExtension) {
        if (contentType != null && !contentType.isBlank()) {
            try {
                MimeType mimeType = MimeTypes.getDefaultMimeTypes().forName(contentType.split(";")[0].trim().toLowerCase(Locale.ROOT));
                String extension = mimeType.getExtension();
                if (formatResolver.hasKnownExtension(extension)) {
                    return extension;
                }
            } catch (MimeTypeException e) {
                log.debug("Unknown content type {}", contentType, e);
            }
        }
        return fallbackExtension;
    }

    private URI toUri(String url) {
        try {
            return URI.create(url.trim());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new FetchException(FailureKind.NETWORK_ERROR, "Invalid document URL: " + url, e);
        }
    }

    private Path createTempFile() {
        try {
            Files.createDirectories(scratchDir);
            return Files.createTempFile(scratchDir, "docuvision-fetch-", ".download");
        } catch (IOException e) {
            throw new FetchException(FailureKind.NETWORK_ERROR, "Failed to create scratch file in " + scratchDir, e);
        }
    }

    private FetchException translate(String url, RuntimeException e) {
        if (e instanceof FetchException fetchException) {
            log.error("Error downloading file {}: {}", url, fetchException.getMessage());
            return fetchException;
        }
        Throwable cause = Exceptions.unwrap(e);
        if (hasTimeoutCause(cause)) {
            log.error("Timeout while downloading file: {}", url);
            return new FetchException(FailureKind.TIMEOUT, "Timed out after " + timeout.toSeconds() + "s downloading " + url, cause);
        }
        if (cause instanceof WebClientRequestException) {
            log.error("Network error downloading file {}: {}", url, cause.getMessage());
            return new FetchException(FailureKind.NETWORK_ERROR, "Network error downloading " + url + ": " + cause.getMessage(), cause);
        }
        log.error("Error downloading file {}", url, cause);
        return new FetchException(FailureKind.NETWORK_ERROR, "Failed to download " + url + ": " + cause.getMessage(), cause);
    }

    private boolean hasTimeoutCause(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException
                    || current instanceof ReadTimeoutException
                    || current instanceof ConnectTimeoutException
                    || current instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete partial download {}", file, e);
        }
    }
}
