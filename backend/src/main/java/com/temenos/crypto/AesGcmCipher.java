package com.temenos.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Base64;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import com.temenos.error.IntegrityException;

/**
 * Current at-rest and transport format (v2): AES-256-GCM with a fresh 96-bit IV per call.
 *
 * <pre>
 *   "v2:" + Base64( IV(12) || CIPHERTEXT || TAG(16) )
 * </pre>
 *
 * The ASCII marker {@code v2} is bound as additional authenticated data, so the prefix
 * cannot be stripped or swapped without failing authentication.
 */
public class AesGcmCipher implements BlobDecryptor {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    public static final String PREFIX = "v2:";

    private static final String AES_ALGO = "AES/GCM/NoPadding";
    private static final int IV_SIZE = 12;   // 96-bit IV
    private static final int TAG_SIZE = 128; // 128-bit authentication tag
    private static final byte[] AAD = "v2".getBytes(StandardCharsets.US_ASCII);

    private final SecureRandom random = new SecureRandom();

    @Override
    public EncryptionVersion version() {
        return EncryptionVersion.CURRENT;
    }

    public String encrypt(String plaintext, VaultKey key) {
        byte[] iv = new byte[IV_SIZE];
        random.nextBytes(iv);

        byte[] ciphertext;
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.ENCRYPT_MODE, key.aesKey(), new GCMParameterSpec(TAG_SIZE, iv));
            cipher.updateAAD(AAD);
            ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM is not available", e);
        }

        byte[] result = new byte[IV_SIZE + ciphertext.length];
        System.arraycopy(iv, 0, result, 0, IV_SIZE);
        System.arraycopy(ciphertext, 0, result, IV_SIZE, ciphertext.length);

        return PREFIX + Base64.getEncoder().encodeToString(result);
    }

    @Override
    public String decrypt(String blob, VaultKey key) {
        String trimmed = blob == null ? "" : blob.strip();
        if (!trimmed.startsWith(PREFIX)) {
            throw new IntegrityException("Blob is not in v2 format");
        }

        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(trimmed.substring(PREFIX.length()));
        } catch (IllegalArgumentException e) {
            throw new IntegrityException("Malformed v2 blob", e);
        }
        if (decoded.length < IV_SIZE + TAG_SIZE / 8) {
            throw new IntegrityException("Truncated v2 blob");
        }

        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.DECRYPT_MODE, key.aesKey(), new GCMParameterSpec(TAG_SIZE, decoded, 0, IV_SIZE));
            cipher.updateAAD(AAD);
            byte[] plaintext = cipher.doFinal(decoded, IV_SIZE, decoded.length - IV_SIZE);
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new IntegrityException("Authentication failed: wrong key or tampered blob", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM is not available", e);
        }
    }
}
