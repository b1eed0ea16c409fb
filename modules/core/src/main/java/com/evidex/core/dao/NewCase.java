package com.evidex.core.dao;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Values for a case row about to be inserted. New cases always start
 * {@code open} with zero counts.
 */
public record NewCase(
        String caseNumber,
        String caseName,
        String investigatorName,
        String agencyName,
        LocalDate incidentDate,
        String notes
) {
    public NewCase {
        Objects.requireNonNull(caseNumber, "caseNumber");
        Objects.requireNonNull(caseName, "caseName");
    }

    public NewCase withCaseNumber(String number) {
        return new NewCase(number, caseName, investigatorName, agencyName, incidentDate, notes);
    }
}
