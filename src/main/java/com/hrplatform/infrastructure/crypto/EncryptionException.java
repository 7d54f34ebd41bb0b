package com.hrplatform.infrastructure.crypto;

/**
 * Thrown when a value cannot be encrypted, decrypted or digested.
 *
 * <p>Messages describe the failure class only. They never carry plaintext, ciphertext or key
 * material.
 */
public class EncryptionException extends RuntimeException {

    public EncryptionException(String message) {
        super(message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
