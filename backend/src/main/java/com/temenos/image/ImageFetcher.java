package com.temenos.image;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.temenos.config.TemenosProperties;
import com.temenos.error.InvalidRequestException;

import reactor.core.publisher.Mono;

/**
 * Downloads an image for URL imports. The response must declare an {@code image/*} type and
 * stay under the configured size cap; everything else is reported as a bad request.
 */
@Component
public class ImageFetcher {

    static final String USER_AGENT = "Mozilla/5.0 (compatible; Temenos/1.0)";

    private final WebClient webClient;
    private final long maxBytes;
    private final Duration timeout;

    public ImageFetcher(WebClient.Builder webClientBuilder, TemenosProperties properties) {
        this.maxBytes = properties.imageMaxBytes();
        this.timeout = properties.imageDownloadTimeout();
        int bufferLimit = (int) Math.min(Integer.MAX_VALUE - 1L, maxBytes) + 1;
        this.webClient = webClientBuilder
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(bufferLimit))
                .build();
    }

    public Mono<ImageUpload> fetch(String url) {
        URI uri;
        try {
            uri = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            return Mono.error(new InvalidRequestException("Invalid image URL", e));
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            return Mono.error(new InvalidRequestException("Image URL must use http or https"));
        }

        return webClient.get()
                .uri(uri)
                .header(HttpHeaders.USER_AGENT, USER_AGENT)
                .retrieve()
                .toEntity(byte[].class)
                .timeout(timeout)
                .map(entity -> {
                    MediaType contentType = entity.getHeaders().getContentType();
                    if (contentType == null || !"image".equalsIgnoreCase(contentType.getType())) {
                        throw new InvalidRequestException("URL does not point to a valid image");
                    }
                    byte[] body = entity.getBody() != null ? entity.getBody() : new byte[0];
                    if (body.length > maxBytes) {
                        throw new InvalidRequestException("Image file size must be less than " + describe(maxBytes));
                    }
                    String mimeType = contentType.getType() + "/" + contentType.getSubtype();
                    return new ImageUpload(body, mimeType, fileNameFor(uri, contentType));
                })
                .onErrorMap(e -> !(e instanceof InvalidRequestException), e -> {
                    if (e instanceof DataBufferLimitException) {
                        return new InvalidRequestException("Image file size must be less than " + describe(maxBytes), e);
                    }
                    if (e instanceof TimeoutException) {
                        return new InvalidRequestException("Failed to download image from URL: timed out", e);
                    }
                    return new InvalidRequestException("Failed to download image from URL: " + e.getMessage(), e);
                });
    }

    /** Last path segment of the URL, given an extension from the content type when it has none. */
    static String fileNameFor(URI uri, MediaType contentType) {
        String path = uri.getPath() == null ? "" : uri.getPath();
        String name = path.substring(path.lastIndexOf('/') + 1);
        if (name.isBlank()) {
            name = "image";
        }
        if (name.lastIndexOf('.') <= 0) {
            String subtype = contentType.getSubtype();
            name = name + "." + (subtype == null || subtype.isBlank() ? "jpg" : subtype);
        }
        return name;
    }

    static String describe(long bytes) {
        return bytes % (1024 * 1024) == 0 ? (bytes / (1024 * 1024)) + "MB" : bytes + " bytes";
    }
}
