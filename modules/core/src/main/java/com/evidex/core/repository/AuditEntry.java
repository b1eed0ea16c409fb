package com.evidex.core.repository;

import java.time.Instant;
import java.util.Map;

/**
 * One audit log row with its JSON details decoded.
 */
public record AuditEntry(
        long logId,
        Long caseId,
        String userName,
        String action,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        details = details == null ? Map.of() : details;
    }
}
