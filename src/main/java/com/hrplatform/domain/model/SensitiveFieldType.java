package com.hrplatform.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Attributes of an employee that are stored encrypted.
 *
 * <p>Each type has a public name (what callers see), an {@code <name>_encrypted} storage key
 * holding the ciphertext and, for searchable types, an {@code <name>_hash} key holding the
 * search digest. Storage keys are internal and never part of a response.
 *
 * @since 1.0.0
 */
public enum SensitiveFieldType {
    NAME("name", true),
    PHONE("phone", true),
    ID_NUMBER("id_card", true),
    BANK_ACCOUNT("bank_account", true),
    EMERGENCY_CONTACT_PHONE("emergency_contact_phone", false),
    BIRTH_DATE("birth_date", false);

    public static final String ENCRYPTED_SUFFIX = "_encrypted";
    public static final String HASH_SUFFIX = "_hash";

    private final String fieldName;
    private final boolean searchable;

    SensitiveFieldType(String fieldName, boolean searchable) {
        this.fieldName = fieldName;
        this.searchable = searchable;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getEncryptedKey() {
        return fieldName + ENCRYPTED_SUFFIX;
    }

    public String getHashKey() {
        return fieldName + HASH_SUFFIX;
    }

    /**
     * Whether a search digest is stored next to the ciphertext.
     */
    public boolean isSearchable() {
        return searchable;
    }

    public static Optional<SensitiveFieldType> fromFieldName(String fieldName) {
        return Arrays.stream(values())
            .filter(type -> type.fieldName.equals(fieldName))
            .findFirst();
    }

    /**
     * @return true for keys that only exist in storage ({@code *_encrypted}, {@code *_hash})
     */
    public static boolean isInternalKey(String key) {
        return key != null && (key.endsWith(ENCRYPTED_SUFFIX) || key.endsWith(HASH_SUFFIX));
    }
}
