package com.evidex.core.dao;

import com.evidex.types.CaseStatus;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;
import java.time.LocalDate;

public record CaseRecord(
        @ColumnName("case_id") long caseId,
        @ColumnName("case_number") String caseNumber,
        @ColumnName("case_name") String caseName,
        @ColumnName("investigator_name") String investigatorName,
        @ColumnName("agency_name") String agencyName,
        @ColumnName("incident_date") LocalDate incidentDate,
        @ColumnName("created_date") Instant createdDate,
        @ColumnName("last_modified") Instant lastModified,
        @ColumnName("status") CaseStatus status,
        @ColumnName("notes") String notes,
        @ColumnName("evidence_source_path") String evidenceSourcePath,
        @ColumnName("total_files") int totalFiles,
        @ColumnName("total_flagged") int totalFlagged
) {
    public boolean isOpen() {
        return status == CaseStatus.OPEN;
    }
}
