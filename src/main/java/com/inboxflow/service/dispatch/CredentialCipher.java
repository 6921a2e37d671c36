package com.inboxflow.service.dispatch;

import com.inboxflow.config.InboxflowProperties;
import com.inboxflow.exception.CredentialUnavailableException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * Encrypts provider access tokens at rest.
 *
 * Format (hex, colon separated):  salt:iv:tag:ciphertext
 *   salt → 64 random bytes, input to PBKDF2-HMAC-SHA256 (100 000 iterations)
 *   iv   → 16 random bytes
 *   tag  → 16-byte GCM authentication tag
 *
 * The AES-256 key is derived per value from inboxflow.crypto.encryption-key
 * and the stored salt, so the same token never encrypts to the same string twice.
 */
@Component
@RequiredArgsConstructor
public class CredentialCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final String KDF = "PBKDF2WithHmacSHA256";
    private static final int SALT_LENGTH = 64;
    private static final int IV_LENGTH = 16;
    private static final int TAG_LENGTH = 16;
    private static final int KEY_LENGTH_BITS = 256;
    private static final int ITERATIONS = 100_000;
    private static final int MIN_KEY_LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of();
    private static final SecureRandom RANDOM = new SecureRandom();

    private final InboxflowProperties properties;

    public String encrypt(String plaintext) {
        byte[] salt = randomBytes(SALT_LENGTH);
        byte[] iv = randomBytes(IV_LENGTH);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(salt), new GCMParameterSpec(TAG_LENGTH * 8, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            // JCE appends the tag to the ciphertext; the stored format keeps them apart
            int ciphertextLength = sealed.length - TAG_LENGTH;
            byte[] ciphertext = new byte[ciphertextLength];
            byte[] tag = new byte[TAG_LENGTH];
            System.arraycopy(sealed, 0, ciphertext, 0, ciphertextLength);
            System.arraycopy(sealed, ciphertextLength, tag, 0, TAG_LENGTH);

            return String.join(":", HEX.formatHex(salt), HEX.formatHex(iv), HEX.formatHex(tag), HEX.formatHex(ciphertext));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Credential encryption failed", e);
        }
    }

    /**
     * @throws CredentialUnavailableException when the value is malformed, was encrypted
     *         under another key, or has been tampered with
     */
    public String decrypt(String encrypted) {
        if (encrypted == null) {
            throw new CredentialUnavailableException("Credential has no stored token");
        }
        String[] parts = encrypted.split(":");
        if (parts.length != 4) {
            throw new CredentialUnavailableException("Stored token is not in salt:iv:tag:ciphertext format");
        }
        try {
            byte[] salt = HEX.parseHex(parts[0]);
            byte[] iv = HEX.parseHex(parts[1]);
            byte[] tag = HEX.parseHex(parts[2]);
            byte[] ciphertext = HEX.parseHex(parts[3]);

            byte[] sealed = new byte[ciphertext.length + tag.length];
            System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
            System.arraycopy(tag, 0, sealed, ciphertext.length, tag.length);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, deriveKey(salt), new GCMParameterSpec(tag.length * 8, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new CredentialUnavailableException("Stored token cannot be decrypted: " + e.getMessage());
        }
    }

    private SecretKey deriveKey(byte[] salt) throws GeneralSecurityException {
        String password = properties.getCrypto().getEncryptionKey();
        if (password == null || password.length() < MIN_KEY_LENGTH) {
            throw new IllegalStateException(
                    "inboxflow.crypto.encryption-key must be at least " + MIN_KEY_LENGTH + " characters");
        }
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, ITERATIONS, KEY_LENGTH_BITS);
        try {
            byte[] keyBytes = SecretKeyFactory.getInstance(KDF).generateSecret(spec).getEncoded();
            return new SecretKeySpec(keyBytes, "AES");
        } finally {
            spec.clearPassword();
        }
    }

    private static byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        RANDOM.nextBytes(bytes);
        return bytes;
    }
}
