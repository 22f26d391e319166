package com.temenos.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Security;
import java.util.Base64;

import javax.crypto.BadPaddingException;
import javax.crypto.Cipher;
import javax.crypto.IllegalBlockSizeException;
import javax.crypto.spec.IvParameterSpec;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import com.temenos.error.IntegrityException;

/**
 * Legacy at-rest format (v1), decrypt only:
 *
 * <pre>
 *   Base64( IV(16) || AES-256-CBC/PKCS7 CIPHERTEXT )
 * </pre>
 *
 * There is no authentication tag. A wrong key is caught by the padding check and by a strict
 * UTF-8 decode of the result, which rejects nearly all garbage but is not an integrity proof.
 * Nothing in the application writes this format.
 */
public class LegacyCbcCipher implements BlobDecryptor {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private static final String AES_ALGO = "AES/CBC/PKCS7Padding";
    private static final int IV_SIZE = 16;

    @Override
    public EncryptionVersion version() {
        return EncryptionVersion.LEGACY;
    }

    @Override
    public String decrypt(String blob, VaultKey key) {
        return decryptLegacy(blob, key);
    }

    public String decryptLegacy(String blob, VaultKey key) {
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(blob == null ? "" : blob.strip());
        } catch (IllegalArgumentException e) {
            throw new IntegrityException("Malformed legacy blob", e);
        }
        if (decoded.length < IV_SIZE * 2 || decoded.length % IV_SIZE != 0) {
            throw new IntegrityException("Malformed legacy blob");
        }

        byte[] plaintext;
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.DECRYPT_MODE, key.aesKey(), new IvParameterSpec(decoded, 0, IV_SIZE));
            plaintext = cipher.doFinal(decoded, IV_SIZE, decoded.length - IV_SIZE);
        } catch (BadPaddingException | IllegalBlockSizeException e) {
            throw new IntegrityException("Legacy decrypt failed: wrong key or corrupted blob", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-CBC is not available", e);
        }

        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(plaintext))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IntegrityException("Legacy decrypt failed: wrong key or corrupted blob", e);
        }
    }
}
