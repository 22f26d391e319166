package com.temenos.image;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.CacheControl;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.http.codec.multipart.FormFieldPart;
import org.springframework.http.codec.multipart.Part;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;

import com.temenos.config.TemenosProperties;
import com.temenos.error.InvalidRequestException;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/images")
public class ImageController {

    private static final Logger log = LoggerFactory.getLogger(ImageController.class);

    private final ImageService imageService;
    private final int maxBytes;

    public ImageController(ImageService imageService, TemenosProperties properties) {
        this.imageService = imageService;
        this.maxBytes = (int) Math.min(Integer.MAX_VALUE - 1L, properties.imageMaxBytes());
    }

    @GetMapping
    public Flux<ImageView> list() {
        return imageService.list();
    }

    /**
     * Multipart form: {@code title} plus either an {@code image} file part or an {@code imageUrl} field.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ImageView> upload(ServerWebExchange exchange) {
        return exchange.getMultipartData().flatMap(parts -> {
            String title = fieldValue(parts, "title");
            String imageUrl = fieldValue(parts, "imageUrl");
            Part image = parts.getFirst("image");
            if (image instanceof FilePart filePart) {
                return readUpload(filePart).flatMap(upload -> imageService.upload(title, upload, imageUrl));
            }
            return imageService.upload(title, null, imageUrl);
        });
    }

    @GetMapping("/{id}")
    public Mono<ImageView> get(@PathVariable String id) {
        return imageService.get(id);
    }

    @GetMapping("/{id}/content")
    public Mono<ResponseEntity<byte[]>> content(@PathVariable String id) {
        return imageService.content(id).map(content -> ResponseEntity.ok()
                .contentType(contentType(content.mimeType()))
                .contentLength(content.bytes().length)
                .cacheControl(CacheControl.maxAge(Duration.ofDays(365)).cachePrivate())
                .body(content.bytes()));
    }

    @DeleteMapping("/{id}")
    public Mono<Void> delete(@PathVariable String id) {
        return imageService.delete(id);
    }

    @PostMapping("/cleanup")
    public Mono<CleanupReport> cleanup() {
        return imageService.cleanup();
    }

    @GetMapping("/cleanup")
    public Mono<CleanupStatus> cleanupStatus() {
        return imageService.cleanupStatus();
    }

    private Mono<ImageUpload> readUpload(FilePart filePart) {
        MediaType type = filePart.headers().getContentType();
        String mimeType = type == null ? null : type.getType() + "/" + type.getSubtype();
        return DataBufferUtils.join(filePart.content(), maxBytes + 1)
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return new ImageUpload(bytes, mimeType, filePart.filename());
                })
                .defaultIfEmpty(new ImageUpload(new byte[0], mimeType, filePart.filename()))
                .onErrorMap(DataBufferLimitException.class,
                        e -> new InvalidRequestException("File size must be less than " + ImageFetcher.describe(maxBytes) + ".", e));
    }

    // the index is plaintext on disk, so a stored type may not parse
    static MediaType contentType(String mimeType) {
        try {
            return MediaType.parseMediaType(mimeType);
        } catch (InvalidMediaTypeException e) {
            log.warn("Serving image with unparseable type as octet-stream: {}", e.getMessage());
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }

    private static String fieldValue(MultiValueMap<String, Part> parts, String name) {
        return parts.getFirst(name) instanceof FormFieldPart field ? field.value() : null;
    }
}
