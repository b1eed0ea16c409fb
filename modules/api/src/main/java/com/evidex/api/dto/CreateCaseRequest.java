package com.evidex.api.dto;

import com.evidex.core.dao.NewCase;

import java.time.LocalDate;

public record CreateCaseRequest(
        String caseNumber,
        String caseName,
        String investigatorName,
        String agencyName,
        LocalDate incidentDate,
        String notes
) {
    /** A missing case number asks for a generated one. */
    public NewCase toNewCase() {
        if (caseName == null || caseName.isBlank()) {
            throw new IllegalArgumentException("caseName is required");
        }
        return new NewCase(caseNumber == null ? "" : caseNumber.trim(), caseName,
                investigatorName, agencyName, incidentDate, notes);
    }
}
