package com.temenos.config;

import java.nio.file.Path;
import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.temenos.context.ContextNote;
import com.temenos.conversation.Conversation;
import com.temenos.crypto.AesGcmCipher;
import com.temenos.crypto.LegacyCbcCipher;
import com.temenos.crypto.VaultCrypto;
import com.temenos.image.ImageBlobStore;
import com.temenos.narrative.Narrative;
import com.temenos.prompt.SystemPrompt;
import com.temenos.store.EncryptedEntityStore;
import com.temenos.store.EntityClass;
import com.temenos.store.RecordJson;
import com.temenos.transport.TransportCipher;

/**
 * Wires keys, ciphers and one store per entity class. The keys are threaded explicitly
 * into the components that use them; nothing reads the environment after this point.
 */
@Configuration
@EnableConfigurationProperties(TemenosProperties.class)
public class VaultConfig {

    @Bean
    public KeyRing keyRing(TemenosProperties properties) {
        return new KeyRing(properties.encryptionKey(), properties.transportKey());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AesGcmCipher aesGcmCipher() {
        return new AesGcmCipher();
    }

    @Bean
    public LegacyCbcCipher legacyCbcCipher() {
        return new LegacyCbcCipher();
    }

    @Bean
    public VaultCrypto vaultCrypto(KeyRing keyRing, AesGcmCipher current, LegacyCbcCipher legacy) {
        return new VaultCrypto(keyRing::atRestKey, current, legacy);
    }

    @Bean
    public TransportCipher transportCipher(KeyRing keyRing, AesGcmCipher current) {
        return new TransportCipher(keyRing::transportKey, current);
    }

    @Bean
    public RecordJson recordJson() {
        return new RecordJson();
    }

    @Bean
    public EncryptedEntityStore<Conversation> conversationStore(TemenosProperties properties, RecordJson json,
                                                                VaultCrypto crypto, Clock clock) {
        return new EncryptedEntityStore<>(EntityClass.CONVERSATIONS, dataDir(properties), Conversation.class,
                json, crypto, clock);
    }

    @Bean
    public EncryptedEntityStore<Narrative> narrativeStore(TemenosProperties properties, RecordJson json,
                                                          VaultCrypto crypto, Clock clock) {
        return new EncryptedEntityStore<>(EntityClass.NARRATIVES, dataDir(properties), Narrative.class,
                json, crypto, clock);
    }

    @Bean
    public EncryptedEntityStore<SystemPrompt> systemPromptStore(TemenosProperties properties, RecordJson json,
                                                                VaultCrypto crypto, Clock clock) {
        return new EncryptedEntityStore<>(EntityClass.SYSTEM_PROMPTS, dataDir(properties), SystemPrompt.class,
                json, crypto, clock);
    }

    @Bean
    public EncryptedEntityStore<ContextNote> contextStore(TemenosProperties properties, RecordJson json,
                                                          VaultCrypto crypto, Clock clock) {
        return new EncryptedEntityStore<>(EntityClass.CONTEXTS, dataDir(properties), ContextNote.class,
                json, crypto, clock);
    }

    @Bean
    public ImageBlobStore imageBlobStore(TemenosProperties properties, RecordJson json,
                                         VaultCrypto crypto, Clock clock) {
        return new ImageBlobStore(dataDir(properties), json, crypto, clock);
    }

    private static Path dataDir(TemenosProperties properties) {
        return Path.of(properties.dataDir());
    }
}
