package com.hrplatform.infrastructure.crypto;

import com.hrplatform.config.CryptoProperties;
import com.hrplatform.domain.model.EncryptedField;
import com.hrplatform.domain.model.SensitiveFieldType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AesGcmCryptoServiceTest {

    static final String ENCRYPTION_KEY = "MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=";
    static final String SEARCH_KEY = "ZmVkY2JhOTg3NjU0MzIxMGZlZGNiYTk4NzY1NDMyMTA=";

    private AesGcmCryptoService cryptoService;

    static AesGcmCryptoService newService(String encryptionKey, String searchKey) {
        CryptoProperties properties = new CryptoProperties();
        properties.setEncryptionKey(encryptionKey);
        properties.setSearchKey(searchKey);
        return new AesGcmCryptoService(properties);
    }

    @BeforeEach
    void setUp() {
        cryptoService = newService(ENCRYPTION_KEY, SEARCH_KEY);
    }

    @Test
    void decrypt_returns_original_plaintext() {
        for (String value : List.of("13800138000", "张三丰", "110101199003071234", "a", "emoji 😀 ok", " spaced ")) {
            assertEquals(value, cryptoService.decrypt(cryptoService.encrypt(value)));
        }
    }

    @Test
    void encrypt_uses_fresh_nonce_per_call() {
        String first = cryptoService.encrypt("13800138000");
        String second = cryptoService.encrypt("13800138000");

        assertNotEquals(first, second);
        assertTrue(first.startsWith(AesGcmCryptoService.FORMAT_PREFIX));
    }

    @Test
    void search_digest_is_deterministic_across_instances() {
        String digest = cryptoService.searchDigest("13800138000");

        assertEquals(digest, cryptoService.searchDigest("13800138000"));
        assertEquals(digest, newService(ENCRYPTION_KEY, SEARCH_KEY).searchDigest("13800138000"));
        assertEquals(64, digest.length());
    }

    @Test
    void search_digest_ignores_case_and_surrounding_whitespace() {
        assertEquals(cryptoService.searchDigest("Zhang San"), cryptoService.searchDigest("  zhang san "));
        assertNotEquals(cryptoService.searchDigest("13800138000"), cryptoService.searchDigest("13800138001"));
    }

    @Test
    void search_digest_depends_on_search_key_only() {
        String otherSearchKey = Base64.getEncoder().encodeToString(new byte[32]);

        assertNotEquals(cryptoService.searchDigest("13800138000"),
            newService(ENCRYPTION_KEY, otherSearchKey).searchDigest("13800138000"));
        assertEquals(cryptoService.searchDigest("13800138000"),
            newService(otherSearchKey, SEARCH_KEY).searchDigest("13800138000"));
    }

    @Test
    void flipping_any_character_bit_fails_authentication() {
        String stored = cryptoService.encrypt("13800138000");

        for (int i = 0; i < stored.length(); i++) {
            for (int bit = 0; bit < 8; bit++) {
                char[] chars = stored.toCharArray();
                chars[i] = (char) (chars[i] ^ (1 << bit));
                String tampered = new String(chars);

                assertThrows(EncryptionException.class, () -> cryptoService.decrypt(tampered),
                    "bit " + bit + " of character " + i + " was not detected");
            }
        }
    }

    @Test
    void flipping_any_payload_bit_fails_authentication() {
        String stored = cryptoService.encrypt("110101199003071234");
        byte[] payload = Base64.getDecoder().decode(stored.substring(AesGcmCryptoService.FORMAT_PREFIX.length()));

        for (int i = 0; i < payload.length * 8; i++) {
            byte[] copy = payload.clone();
            copy[i / 8] ^= (byte) (1 << (i % 8));
            String tampered = AesGcmCryptoService.FORMAT_PREFIX + Base64.getEncoder().encodeToString(copy);

            EncryptionException e = assertThrows(EncryptionException.class, () -> cryptoService.decrypt(tampered));
            assertEquals("Encrypted value failed authentication", e.getMessage());
        }
    }

    @Test
    void decrypt_with_other_key_fails() {
        String stored = cryptoService.encrypt("6222021234567890");
        AesGcmCryptoService other = newService(SEARCH_KEY, SEARCH_KEY);

        assertThrows(EncryptionException.class, () -> other.decrypt(stored));
    }

    @Test
    void malformed_values_are_rejected_without_echoing_input() {
        for (String malformed : List.of("", "plain-text", "v1:", "v1:!!!!", "v1:AAAA", "v2:" + "A".repeat(40))) {
            EncryptionException e = assertThrows(EncryptionException.class, () -> cryptoService.decrypt(malformed));
            assertEquals("Malformed encrypted value", e.getMessage());
        }
        assertThrows(EncryptionException.class, () -> cryptoService.decrypt(null));
    }

    @Test
    void empty_plaintext_is_rejected() {
        assertThrows(EncryptionException.class, () -> cryptoService.encrypt(""));
        assertThrows(EncryptionException.class, () -> cryptoService.encrypt(null));
        assertThrows(EncryptionException.class, () -> cryptoService.searchDigest("  "));
    }

    @Test
    void missing_keys_fail_on_use() {
        AesGcmCryptoService unconfigured = newService(null, "");

        assertThrows(EncryptionException.class, () -> unconfigured.encrypt("13800138000"));
        assertThrows(EncryptionException.class, () -> unconfigured.decrypt("v1:AAAA"));
        assertThrows(EncryptionException.class, () -> unconfigured.searchDigest("13800138000"));
    }

    @Test
    void keys_of_wrong_length_are_rejected_at_startup() {
        String shortKey = Base64.getEncoder().encodeToString(new byte[16]);

        assertThrows(EncryptionException.class, () -> newService(shortKey, SEARCH_KEY));
        assertThrows(EncryptionException.class, () -> newService("not base64 !", SEARCH_KEY));
    }

    @Test
    void error_messages_never_contain_ciphertext() {
        String stored = cryptoService.encrypt("13800138000");
        char original = stored.charAt(10);
        String tampered = stored.substring(0, 10) + (original == 'A' ? 'B' : 'A') + stored.substring(11);

        EncryptionException e = assertThrows(EncryptionException.class, () -> cryptoService.decrypt(tampered));
        assertFalse(e.getMessage().contains(tampered.substring(AesGcmCryptoService.FORMAT_PREFIX.length())));
        assertFalse(e.getMessage().contains("13800138000"));
    }

    @Test
    void encrypt_field_stores_digest_only_for_searchable_types() {
        EncryptedField phone = cryptoService.encryptField(SensitiveFieldType.PHONE, "13800138000");
        EncryptedField birthDate = cryptoService.encryptField(SensitiveFieldType.BIRTH_DATE, "1990-03-07");

        assertEquals(cryptoService.searchDigest("13800138000"), phone.getSearchDigest());
        assertFalse(birthDate.hasSearchDigest());
        assertEquals("1990-03-07", cryptoService.decryptField(birthDate));
        assertFalse(phone.toString().contains(phone.getCiphertext()));
    }
}
