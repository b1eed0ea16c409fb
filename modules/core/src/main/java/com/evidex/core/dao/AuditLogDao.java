package com.evidex.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;

/** Append-only: {@code audit_log} rows are never updated or deleted. */
@RegisterConstructorMapper(AuditLogRecord.class)
public interface AuditLogDao {

    @SqlUpdate("INSERT INTO audit_log (case_id, user_name, action, details) " +
            "VALUES (:caseId, :userName, :action, :details)")
    @GetGeneratedKeys
    long insert(@Bind("caseId") Long caseId,
                @Bind("userName") String userName,
                @Bind("action") String action,
                @Bind("details") String details);

    @SqlQuery("SELECT * FROM audit_log WHERE case_id = :caseId " +
            "ORDER BY logged_at DESC, log_id DESC LIMIT :limit")
    List<AuditLogRecord> findByCase(@Bind("caseId") long caseId, @Bind("limit") int limit);

    @SqlQuery("SELECT * FROM audit_log WHERE action = :action " +
            "ORDER BY logged_at DESC, log_id DESC LIMIT :limit")
    List<AuditLogRecord> findByAction(@Bind("action") String action, @Bind("limit") int limit);

    @SqlQuery("SELECT * FROM audit_log ORDER BY logged_at DESC, log_id DESC LIMIT :limit")
    List<AuditLogRecord> findAll(@Bind("limit") int limit);
}
