package com.hrplatform.infrastructure.audit;

/**
 * Records security-relevant events.
 * Initial implementation logs to a dedicated logger; swap for a durable sink when one exists.
 */
public interface AuditService {

    void record(String category, String action, String resourceId, String principalId, String detail);
}
