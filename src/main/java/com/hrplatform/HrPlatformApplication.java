package com.hrplatform;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the HR platform data-protection core.
 *
 * <ul>
 *   <li><strong>Field-Level Encryption</strong>: AES-256-GCM with keyed search digests</li>
 *   <li><strong>Role-Based Permissions</strong>: closed permission catalog with wildcard grants</li>
 *   <li><strong>Data Scopes</strong>: all, department and self row filtering</li>
 *   <li><strong>Response Masking</strong>: sensitive fields masked at the serialization boundary</li>
 * </ul>
 *
 * @author Security Team
 * @since 1.0.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class HrPlatformApplication {

    public static void main(String[] args) {
        SpringApplication.run(HrPlatformApplication.class, args);

        log.info("""
            ╔═══════════════════════════════════════════════════════════╗
            ║  HR Platform - Data Protection Core                       ║
            ║  Field Encryption: AES-256-GCM                            ║
            ║  Search Digests: HMAC-SHA256                              ║
            ║  Response Masking: ENABLED                                ║
            ╚═══════════════════════════════════════════════════════════╝
            """);
    }
}
