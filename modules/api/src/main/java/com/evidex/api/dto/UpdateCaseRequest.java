package com.evidex.api.dto;

import com.evidex.core.dao.CaseUpdate;
import com.evidex.types.CaseStatus;

import java.time.LocalDate;

public record UpdateCaseRequest(
        String caseName,
        String investigatorName,
        String agencyName,
        LocalDate incidentDate,
        String status,
        String notes
) {
    public CaseUpdate toUpdate() {
        return new CaseUpdate(caseName, investigatorName, agencyName, incidentDate,
                status == null ? null : CaseStatus.fromLabel(status), notes, null);
    }
}
