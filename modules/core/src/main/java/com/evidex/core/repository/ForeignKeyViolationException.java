package com.evidex.core.repository;

/**
 * Thrown when a row references a case that does not exist.
 */
public class ForeignKeyViolationException extends RepositoryException {

    private final long caseId;

    public ForeignKeyViolationException(long caseId, Throwable cause) {
        super("Case " + caseId + " does not exist", cause);
        this.caseId = caseId;
    }

    public long caseId() {
        return caseId;
    }
}
