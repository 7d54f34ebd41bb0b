package com.hrplatform.infrastructure.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service
@Slf4j(topic = "AUDIT")
public class DefaultAuditService implements AuditService {

    @Override
    public void record(String category, String action, String resourceId, String principalId, String detail) {
        log.info("AUDIT category={} action={} resourceId={} principal={} detail={} timestamp={}",
            category, action, resourceId, principalId, detail, Instant.now());
    }
}
