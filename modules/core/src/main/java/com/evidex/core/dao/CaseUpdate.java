package com.evidex.core.dao;

import com.evidex.types.CaseStatus;

import java.time.LocalDate;

/**
 * Partial case update. A null component leaves the stored column unchanged.
 */
public record CaseUpdate(
        String caseName,
        String investigatorName,
        String agencyName,
        LocalDate incidentDate,
        CaseStatus status,
        String notes,
        String evidenceSourcePath
) {
    public static final CaseUpdate NONE = new CaseUpdate(null, null, null, null, null, null, null);

    public static CaseUpdate status(CaseStatus status) {
        return NONE.withStatus(status);
    }

    public static CaseUpdate evidenceSource(String path) {
        return new CaseUpdate(null, null, null, null, null, null, path);
    }

    public CaseUpdate withStatus(CaseStatus newStatus) {
        return new CaseUpdate(caseName, investigatorName, agencyName, incidentDate,
                newStatus, notes, evidenceSourcePath);
    }

    public CaseUpdate withNotes(String newNotes) {
        return new CaseUpdate(caseName, investigatorName, agencyName, incidentDate,
                status, newNotes, evidenceSourcePath);
    }

    public boolean isEmpty() {
        return this.equals(NONE);
    }
}
