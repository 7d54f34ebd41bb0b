package com.hrplatform.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Key material for field encryption and search digests.
 *
 * <p>Both keys are Base64-encoded 256-bit values supplied by the environment. They are
 * independent: compromising one does not expose the other.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "hr.crypto")
public class CryptoProperties {

    /** AES-256 key used for field encryption. */
    private String encryptionKey;

    /** HMAC-SHA256 key used for search digests. */
    private String searchKey;
}
