package com.evidex.core.repository;

/**
 * Thrown when a case is created with a number another case already uses.
 * Nothing is written.
 */
public class DuplicateCaseNumberException extends RepositoryException {

    private final String caseNumber;

    public DuplicateCaseNumberException(String caseNumber, Throwable cause) {
        super("Case number already exists: " + caseNumber, cause);
        this.caseNumber = caseNumber;
    }

    public String caseNumber() {
        return caseNumber;
    }
}
