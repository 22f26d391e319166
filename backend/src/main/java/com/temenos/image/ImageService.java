package com.temenos.image;

import org.springframework.stereotype.Service;

import com.temenos.config.TemenosProperties;
import com.temenos.error.InvalidRequestException;
import com.temenos.store.Blocking;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
public class ImageService {

    private final ImageBlobStore store;
    private final ImageFetcher fetcher;
    private final long maxBytes;

    public ImageService(ImageBlobStore store, ImageFetcher fetcher, TemenosProperties properties) {
        this.store = store;
        this.fetcher = fetcher;
        this.maxBytes = properties.imageMaxBytes();
    }

    public Flux<ImageView> list() {
        return Blocking.flux(store::list).map(ImageView::of);
    }

    public Mono<ImageView> get(String id) {
        return Blocking.mono(() -> store.get(id)).map(ImageView::of);
    }

    public Mono<ImageContent> content(String id) {
        return Blocking.mono(() -> store.content(id));
    }

    /**
     * Stores an image given either as uploaded bytes or as a URL to download, never both.
     */
    public Mono<ImageView> upload(String title, ImageUpload file, String imageUrl) {
        if (title == null || title.isBlank()) {
            return Mono.error(new InvalidRequestException("Title is required"));
        }
        boolean hasUrl = imageUrl != null && !imageUrl.isBlank();
        if (file == null && !hasUrl) {
            return Mono.error(new InvalidRequestException("Either image file or image URL is required"));
        }
        if (file != null && hasUrl) {
            return Mono.error(new InvalidRequestException("Please provide either an image file or a URL, not both"));
        }

        Mono<ImageUpload> source = file != null ? Mono.just(file) : fetcher.fetch(imageUrl);
        return source.flatMap(upload -> {
            validate(upload);
            return Blocking.mono(() -> store.save(title, upload.bytes(), upload.mimeType(), upload.originalName()));
        }).map(ImageView::of);
    }

    public Mono<Void> delete(String id) {
        return Blocking.run(() -> store.delete(id));
    }

    public Mono<CleanupReport> cleanup() {
        return Blocking.mono(store::cleanup);
    }

    public Mono<CleanupStatus> cleanupStatus() {
        return Blocking.mono(store::cleanupStatus);
    }

    private void validate(ImageUpload upload) {
        if (upload.mimeType() == null || !upload.mimeType().startsWith("image/")) {
            throw new InvalidRequestException("Invalid file type. Only images are allowed.");
        }
        if (upload.bytes().length > maxBytes) {
            throw new InvalidRequestException("File size must be less than " + ImageFetcher.describe(maxBytes) + ".");
        }
    }
}
