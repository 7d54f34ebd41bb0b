package com.hrplatform.infrastructure.crypto;

import com.hrplatform.domain.model.EncryptedField;
import com.hrplatform.domain.model.SensitiveFieldType;

/**
 * Field-level cryptographic service.
 *
 * <p>Implementations hold a single static encryption key and an independent search key,
 * both read-only after construction, so every method is safe for concurrent use.
 *
 * @author Security Team
 * @since 1.0.0
 */
public interface CryptoService {

    /**
     * Encrypt a single value with authenticated encryption.
     *
     * @param plaintext value to protect, must not be empty
     * @return opaque stored representation carrying nonce, tag and ciphertext
     * @throws EncryptionException if the key is not configured or the value is empty
     */
    String encrypt(String plaintext);

    /**
     * Decrypt a value produced by {@link #encrypt(String)}.
     *
     * @throws EncryptionException if the value is malformed or fails authentication
     */
    String decrypt(String ciphertext);

    /**
     * Deterministic keyed digest of the canonical plaintext, for exact-match lookups.
     */
    String searchDigest(String plaintext);

    /**
     * Encrypt a sensitive attribute, pairing it with a search digest when the field type is
     * searchable.
     */
    EncryptedField encryptField(SensitiveFieldType type, String plaintext);

    /**
     * Decrypt the ciphertext half of a stored attribute.
     */
    String decryptField(EncryptedField field);
}
