package com.evidex.core.repository;

public class EvidenceFileNotFoundException extends RepositoryException {

    private final long fileId;

    public EvidenceFileNotFoundException(long fileId) {
        super("Evidence file not found: " + fileId);
        this.fileId = fileId;
    }

    public long fileId() {
        return fileId;
    }
}
