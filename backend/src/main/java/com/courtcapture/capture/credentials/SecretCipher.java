package com.courtcapture.capture.credentials;

import com.courtcapture.config.CaptureProperties;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-GCM for stored login secrets. Ciphertext layout is base64(iv || sealed bytes).
 */
@Component
public class SecretCipher {
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_BITS = 128;

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    public SecretCipher(CaptureProperties properties) {
        this.key = parseKey(properties.getCredentials().getEncryptionKey());
    }

    public String encrypt(String plaintext) {
        requireKey();
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            ByteBuffer buffer = ByteBuffer.allocate(iv.length + sealed.length);
            buffer.put(iv).put(sealed);
            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to encrypt credential secret", e);
        }
    }

    public String decrypt(String ciphertext) {
        requireKey();
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Credential secret is not valid base64", e);
        }
        if (raw.length <= IV_LENGTH) {
            throw new IllegalStateException("Credential secret is truncated");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, raw, 0, IV_LENGTH));
            byte[] plain = cipher.doFinal(raw, IV_LENGTH, raw.length - IV_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to decrypt credential secret", e);
        }
    }

    private void requireKey() {
        if (key == null) {
            throw new IllegalStateException("capture.credentials.encryption-key is not configured");
        }
    }

    private static SecretKeySpec parseKey(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            return null;
        }
        byte[] bytes = Base64.getDecoder().decode(encoded);
        if (bytes.length != 16 && bytes.length != 24 && bytes.length != 32) {
            throw new IllegalArgumentException("Encryption key must be 128, 192 or 256 bits, got " + bytes.length * 8);
        }
        return new SecretKeySpec(bytes, "AES");
    }
}
