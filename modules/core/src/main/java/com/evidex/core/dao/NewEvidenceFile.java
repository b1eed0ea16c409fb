package com.evidex.core.dao;

import com.evidex.types.EvidenceCategory;

import java.time.Instant;
import java.util.Objects;

/**
 * Insert values for one evidence file. Analysis and flag columns start at
 * their defaults; {@code fileHash} is normally null and filled in later.
 */
public record NewEvidenceFile(
        long caseId,
        String filePath,
        String fileRelativePath,
        String fileName,
        EvidenceCategory fileType,
        Long fileSize,
        String fileHash,
        String sourceArchive,
        Instant dateCreated,
        Instant dateModified,
        Instant dateAccessed,
        Instant dateTaken,
        Double gpsLatitude,
        Double gpsLongitude,
        Double gpsAltitude,
        String cameraMake,
        String cameraModel
) {
    public NewEvidenceFile {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(fileType, "fileType");
    }

    /** Minimal row: path, name and category, everything else unknown. */
    public static NewEvidenceFile of(long caseId, String filePath, String fileName, EvidenceCategory type) {
        return new NewEvidenceFile(caseId, filePath, fileName, fileName, type, null, null, null,
                null, null, null, null, null, null, null, null, null);
    }
}
