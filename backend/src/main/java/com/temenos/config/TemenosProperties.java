package com.temenos.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalized settings. Both keys normally come from the environment
 * ({@code ENCRYPTION_KEY}, {@code CLIENT_ENCRYPTION_KEY}); see application.yml.
 */
@ConfigurationProperties(prefix = "temenos")
public record TemenosProperties(
        String encryptionKey,
        String transportKey,
        @DefaultValue("data") String dataDir,
        @DefaultValue("10485760") long imageMaxBytes,
        @DefaultValue("30s") Duration imageDownloadTimeout
) {

    @Override
    public String toString() {
        return "TemenosProperties[dataDir=" + dataDir
                + ", imageMaxBytes=" + imageMaxBytes
                + ", imageDownloadTimeout=" + imageDownloadTimeout + "]";
    }
}
