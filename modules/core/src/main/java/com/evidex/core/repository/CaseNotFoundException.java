package com.evidex.core.repository;

public class CaseNotFoundException extends RepositoryException {

    private final long caseId;

    public CaseNotFoundException(long caseId) {
        super("Case not found: " + caseId);
        this.caseId = caseId;
    }

    public long caseId() {
        return caseId;
    }
}
