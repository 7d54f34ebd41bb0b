package com.hrplatform.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.Serializable;
import java.util.Objects;

/**
 * Stored form of one sensitive attribute: ciphertext plus an optional search digest.
 *
 * <p>The ciphertext is an opaque value produced by the crypto service; it carries its own
 * nonce and authentication tag. {@link #toString()} never prints either value so the pair
 * can appear in log statements and exception messages safely.
 *
 * @since 1.0.0
 */
@Getter
@EqualsAndHashCode
public final class EncryptedField implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String ciphertext;
    private final String searchDigest;

    public EncryptedField(String ciphertext, String searchDigest) {
        this.ciphertext = Objects.requireNonNull(ciphertext, "Ciphertext must not be null");
        if (ciphertext.isBlank()) {
            throw new IllegalArgumentException("Ciphertext must not be blank");
        }
        this.searchDigest = searchDigest;
    }

    public boolean hasSearchDigest() {
        return searchDigest != null;
    }

    @Override
    public String toString() {
        return "EncryptedField[ciphertext=<redacted>, searchDigest=" + (hasSearchDigest() ? "<present>" : "<none>") + "]";
    }
}
