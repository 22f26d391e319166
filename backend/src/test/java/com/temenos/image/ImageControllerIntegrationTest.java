package com.temenos.image;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;

import com.temenos.TestDataDirectory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HTTP-layer tests for ImageController: multipart upload, content retrieval and the
 * validation errors, against a real store in a temporary directory.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class ImageControllerIntegrationTest {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', 13, 10, 26, 10, 0, 0, 0, 13};

    @Autowired
    private WebTestClient webTestClient;

    @DynamicPropertySource
    static void dataDir(DynamicPropertyRegistry registry) {
        TestDataDirectory.register(registry);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static MultipartBodyBuilder form(String title, byte[] bytes, MediaType type) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        if (title != null) {
            builder.part("title", title);
        }
        if (bytes != null) {
            builder.part("image", new ByteArrayResource(bytes) {
                @Override
                public String getFilename() {
                    return "pixel.png";
                }
            }).contentType(type);
        }
        return builder;
    }

    private WebTestClient.ResponseSpec upload(MultipartBodyBuilder builder) {
        return webTestClient.post()
                .uri("/api/images")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .exchange();
    }

    // ── POST /api/images ──────────────────────────────────────────────────────

    @Test
    void uploadThenFetchContent() {
        ImageView view = upload(form("Pixel", PNG, MediaType.IMAGE_PNG))
                .expectStatus().isOk()
                .expectBody(ImageView.class)
                .returnResult().getResponseBody();

        assertNotNull(view);
        assertEquals("Pixel", view.title());
        assertEquals(PNG.length, view.size());
        assertEquals("/api/images/" + view.id() + "/content", view.url());

        byte[] content = webTestClient.get()
                .uri(view.url())
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentType(MediaType.IMAGE_PNG)
                .expectBody(byte[].class)
                .returnResult().getResponseBody();
        assertArrayEquals(PNG, content, "content must round-trip through the encrypted blob");

        webTestClient.get().uri("/api/images")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[?(@.id == '" + view.id() + "')].title").isEqualTo("Pixel");
    }

    @Test
    void nonImageIsRejected() {
        upload(form("Notes", "hello".getBytes(), MediaType.TEXT_PLAIN))
                .expectStatus().isEqualTo(HttpStatus.BAD_REQUEST)
                .expectBody()
                .jsonPath("$.message").isEqualTo("Invalid file type. Only images are allowed.");
    }

    @Test
    void titleAndSourceAreRequired() {
        upload(form(null, PNG, MediaType.IMAGE_PNG))
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.message").isEqualTo("Title is required");

        upload(form("No source", null, null))
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.message").isEqualTo("Either image file or image URL is required");
    }

    // ── GET / DELETE /api/images/{id} ─────────────────────────────────────────

    @Test
    void unknownImageIsNotFound() {
        webTestClient.get().uri("/api/images/img_unknown/content")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.status").isEqualTo(404);

        webTestClient.delete().uri("/api/images/img_unknown")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void deleteRemovesImage() {
        ImageView view = upload(form("Temp", PNG, MediaType.IMAGE_PNG))
                .expectStatus().isOk()
                .expectBody(ImageView.class)
                .returnResult().getResponseBody();
        assertNotNull(view);

        webTestClient.delete().uri("/api/images/" + view.id())
                .exchange()
                .expectStatus().isOk();

        webTestClient.get().uri("/api/images/" + view.id())
                .exchange()
                .expectStatus().isNotFound();
    }
}
