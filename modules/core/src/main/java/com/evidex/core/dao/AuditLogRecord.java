package com.evidex.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record AuditLogRecord(
        @ColumnName("log_id") long logId,
        @ColumnName("case_id") Long caseId,
        @ColumnName("user_name") String userName,
        @ColumnName("action") String action,
        @ColumnName("details") String details,
        @ColumnName("logged_at") Instant loggedAt
) {}
