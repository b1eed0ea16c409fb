package com.evidex.core.dao;

import com.evidex.types.CaseStatus;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterColumnMapper(CaseStatusColumnMapper.class)
@RegisterArgumentFactory(CaseStatusArgumentFactory.class)
@RegisterConstructorMapper(CaseRecord.class)
public interface CaseDao {

    @SqlUpdate("INSERT INTO cases (case_number, case_name, investigator_name, agency_name, " +
            "incident_date, notes, status) " +
            "VALUES (:caseNumber, :caseName, :investigatorName, :agencyName, :incidentDate, :notes, 'open')")
    @GetGeneratedKeys
    long insert(@BindMethods NewCase newCase);

    @SqlQuery("SELECT * FROM cases WHERE case_id = :caseId")
    Optional<CaseRecord> findById(@Bind("caseId") long caseId);

    @SqlQuery("SELECT * FROM cases WHERE case_number = :caseNumber")
    Optional<CaseRecord> findByNumber(@Bind("caseNumber") String caseNumber);

    @SqlQuery("SELECT * FROM cases ORDER BY created_date DESC, case_id DESC")
    List<CaseRecord> findAll();

    @SqlQuery("SELECT * FROM cases WHERE status = :status ORDER BY created_date DESC, case_id DESC")
    List<CaseRecord> findByStatus(@Bind("status") CaseStatus status);

    /** {@code pattern} is a literal prefix with LIKE wildcards backslash-escaped. */
    @SqlQuery("SELECT case_number FROM cases WHERE case_number LIKE :pattern || '%' ESCAPE '\\' " +
            "ORDER BY case_number DESC LIMIT 1")
    Optional<String> findLastNumberWithPrefix(@Bind("pattern") String pattern);

    @SqlUpdate("UPDATE cases SET " +
            "case_name = COALESCE(:caseName, case_name), " +
            "investigator_name = COALESCE(:investigatorName, investigator_name), " +
            "agency_name = COALESCE(:agencyName, agency_name), " +
            "incident_date = COALESCE(:incidentDate, incident_date), " +
            "status = COALESCE(:status, status), " +
            "notes = COALESCE(:notes, notes), " +
            "evidence_source_path = COALESCE(:evidenceSourcePath, evidence_source_path), " +
            "last_modified = CURRENT_TIMESTAMP " +
            "WHERE case_id = :caseId")
    int update(@Bind("caseId") long caseId, @BindMethods CaseUpdate update);

    @SqlUpdate("UPDATE cases SET " +
            "total_files = (SELECT COUNT(*) FROM evidence_files WHERE case_id = :caseId), " +
            "total_flagged = (SELECT COUNT(*) FROM evidence_files WHERE case_id = :caseId AND is_flagged), " +
            "last_modified = CURRENT_TIMESTAMP " +
            "WHERE case_id = :caseId")
    int recount(@Bind("caseId") long caseId);

    @SqlQuery("SELECT COUNT(*) AS total_files, " +
            "COALESCE(SUM(CASE WHEN ai_processed THEN 1 ELSE 0 END), 0) AS processed_files, " +
            "COALESCE(SUM(CASE WHEN is_flagged THEN 1 ELSE 0 END), 0) AS flagged_files, " +
            "COALESCE(SUM(CASE WHEN face_count > 0 THEN 1 ELSE 0 END), 0) AS files_with_faces, " +
            "COALESCE(SUM(face_count), 0) AS total_faces, " +
            "COUNT(DISTINCT CAST(date_taken AS DATE)) AS unique_dates " +
            "FROM evidence_files WHERE case_id = :caseId")
    @RegisterConstructorMapper(CaseStatisticsRecord.class)
    CaseStatisticsRecord statistics(@Bind("caseId") long caseId);
}
