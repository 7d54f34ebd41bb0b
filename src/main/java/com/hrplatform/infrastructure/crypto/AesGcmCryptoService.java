package com.hrplatform.infrastructure.crypto;

import com.hrplatform.config.CryptoProperties;
import com.hrplatform.domain.model.EncryptedField;
import com.hrplatform.domain.model.SensitiveFieldType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.text.Normalizer;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * AES-256-GCM field encryption with HMAC-SHA256 search digests.
 *
 * <p>Stored format: {@code v1:} followed by Base64 of {@code nonce || ciphertext || tag}.
 * <ul>
 *   <li>96-bit random nonce, fresh for every call</li>
 *   <li>128-bit authentication tag, verified on every decrypt</li>
 *   <li>Base64 must be canonical, so no two strings decode to the same bytes</li>
 * </ul>
 *
 * <p>Search digests are keyed with a separate secret and computed over the trimmed,
 * NFKC-normalized, lower-cased plaintext.
 *
 * @see <a href="https://nvlpubs.nist.gov/nistpubs/Legacy/SP/nistspecialpublication800-38d.pdf">NIST SP 800-38D</a>
 */
@Service
@Slf4j
public class AesGcmCryptoService implements CryptoService {

    static final String FORMAT_PREFIX = "v1:";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final String DIGEST_ALGORITHM = "HmacSHA256";
    private static final int GCM_IV_LENGTH = 12; // 96 bits recommended for GCM
    private static final int GCM_TAG_LENGTH = 128; // 128 bits authentication tag
    private static final int KEY_LENGTH_BYTES = 32;

    private final SecureRandom secureRandom = new SecureRandom();

    private final SecretKey encryptionKey;
    private final SecretKey searchKey;

    public AesGcmCryptoService(CryptoProperties properties) {
        this.encryptionKey = decodeKey(properties.getEncryptionKey(), "AES", "hr.crypto.encryption-key");
        this.searchKey = decodeKey(properties.getSearchKey(), DIGEST_ALGORITHM, "hr.crypto.search-key");

        if (encryptionKey == null) {
            log.warn("No encryption key configured (hr.crypto.encryption-key); sensitive fields cannot be read or written");
        }
        if (searchKey == null) {
            log.warn("No search key configured (hr.crypto.search-key); encrypted fields cannot be searched");
        }
    }

    @Override
    public String encrypt(String plaintext) {
        SecretKey key = requireKey(encryptionKey, "Encryption key is not configured");
        if (plaintext == null || plaintext.isEmpty()) {
            throw new EncryptionException("Plaintext must be a non-empty string");
        }

        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, iv));

            // GCM produces ciphertext || auth_tag
            byte[] ciphertextWithTag = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] payload = ByteBuffer.allocate(iv.length + ciphertextWithTag.length)
                .put(iv)
                .put(ciphertextWithTag)
                .array();

            return FORMAT_PREFIX + Base64.getEncoder().encodeToString(payload);

        } catch (GeneralSecurityException e) {
            log.error("Encryption failed: {}", e.getClass().getSimpleName());
            throw new EncryptionException("Failed to encrypt data", e);
        }
    }

    @Override
    public String decrypt(String ciphertext) {
        SecretKey key = requireKey(encryptionKey, "Encryption key is not configured");
        byte[] payload = decodePayload(ciphertext);

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, payload, 0, GCM_IV_LENGTH));

            byte[] plaintext = cipher.doFinal(payload, GCM_IV_LENGTH, payload.length - GCM_IV_LENGTH);
            return new String(plaintext, StandardCharsets.UTF_8);

        } catch (AEADBadTagException e) {
            // Tampered value or wrong key
            throw new EncryptionException("Encrypted value failed authentication");
        } catch (GeneralSecurityException e) {
            log.error("Decryption failed: {}", e.getClass().getSimpleName());
            throw new EncryptionException("Failed to decrypt data", e);
        }
    }

    @Override
    public String searchDigest(String plaintext) {
        SecretKey key = requireKey(searchKey, "Search key is not configured");
        if (plaintext == null || plaintext.isBlank()) {
            throw new EncryptionException("Search digest requires a non-empty value");
        }

        try {
            Mac mac = Mac.getInstance(DIGEST_ALGORITHM);
            mac.init(key);
            byte[] digest = mac.doFinal(canonicalize(plaintext).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            log.error("Search digest failed: {}", e.getClass().getSimpleName());
            throw new EncryptionException("Failed to compute search digest", e);
        }
    }

    @Override
    public EncryptedField encryptField(SensitiveFieldType type, String plaintext) {
        Objects.requireNonNull(type, "Field type must not be null");
        String ciphertext = encrypt(plaintext);
        String digest = type.isSearchable() ? searchDigest(plaintext) : null;
        return new EncryptedField(ciphertext, digest);
    }

    @Override
    public String decryptField(EncryptedField field) {
        if (field == null) {
            throw new EncryptionException("Encrypted field is missing");
        }
        return decrypt(field.getCiphertext());
    }

    static String canonicalize(String plaintext) {
        return Normalizer.normalize(plaintext.trim(), Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
    }

    private byte[] decodePayload(String ciphertext) {
        if (ciphertext == null || !ciphertext.startsWith(FORMAT_PREFIX)) {
            throw new EncryptionException("Malformed encrypted value");
        }

        String encoded = ciphertext.substring(FORMAT_PREFIX.length());
        byte[] payload;
        try {
            payload = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            // Cause deliberately dropped: decoder messages quote input characters
            throw new EncryptionException("Malformed encrypted value");
        }

        // Reject non-canonical encodings (stray padding bits) so every stored string maps to one payload
        if (!Base64.getEncoder().encodeToString(payload).equals(encoded)) {
            throw new EncryptionException("Malformed encrypted value");
        }
        if (payload.length < GCM_IV_LENGTH + GCM_TAG_LENGTH / 8) {
            throw new EncryptionException("Malformed encrypted value");
        }
        return payload;
    }

    private static SecretKey requireKey(SecretKey key, String message) {
        if (key == null) {
            throw new EncryptionException(message);
        }
        return key;
    }

    private static SecretKey decodeKey(String encoded, String algorithm, String propertyName) {
        if (encoded == null || encoded.isBlank()) {
            return null;
        }

        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(encoded.trim());
        } catch (IllegalArgumentException e) {
            throw new EncryptionException(propertyName + " must be Base64-encoded");
        }

        if (keyBytes.length != KEY_LENGTH_BYTES) {
            Arrays.fill(keyBytes, (byte) 0);
            throw new EncryptionException(propertyName + " must decode to exactly " + KEY_LENGTH_BYTES + " bytes");
        }

        SecretKey key = new SecretKeySpec(keyBytes, algorithm);
        Arrays.fill(keyBytes, (byte) 0);
        return key;
    }
}
