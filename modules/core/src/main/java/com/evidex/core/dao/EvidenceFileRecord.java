package com.evidex.core.dao;

import com.evidex.types.EvidenceCategory;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

import java.time.Instant;

public record EvidenceFileRecord(
        @ColumnName("file_id") long fileId,
        @ColumnName("case_id") long caseId,
        @ColumnName("file_path") String filePath,
        @ColumnName("file_relative_path") String fileRelativePath,
        @ColumnName("file_name") String fileName,
        @ColumnName("file_type") EvidenceCategory fileType,
        @ColumnName("file_size") Long fileSize,
        @ColumnName("file_hash") String fileHash,
        @ColumnName("source_archive") String sourceArchive,
        @ColumnName("date_created") Instant dateCreated,
        @ColumnName("date_modified") Instant dateModified,
        @ColumnName("date_accessed") Instant dateAccessed,
        @ColumnName("date_taken") Instant dateTaken,
        @ColumnName("gps_latitude") Double gpsLatitude,
        @ColumnName("gps_longitude") Double gpsLongitude,
        @ColumnName("gps_altitude") Double gpsAltitude,
        @ColumnName("location_name") String locationName,
        @ColumnName("camera_make") String cameraMake,
        @ColumnName("camera_model") String cameraModel,
        @ColumnName("ai_processed") boolean aiProcessed,
        @ColumnName("ai_tags") String aiTags,
        @ColumnName("ai_confidence") Double aiConfidence,
        @ColumnName("ocr_text") String ocrText,
        @ColumnName("face_count") int faceCount,
        @ColumnName("is_flagged") boolean flagged,
        @ColumnName("flag_reason") String flagReason,
        @ColumnName("analyst_notes") String analystNotes,
        @ColumnName("imported_date") Instant importedDate,
        @ColumnName("analyzed_date") Instant analyzedDate
) {
    /**
     * Best available date for the file: when it was taken, else created,
     * else last modified.
     */
    public Instant effectiveDate() {
        if (dateTaken != null) {
            return dateTaken;
        }
        return dateCreated != null ? dateCreated : dateModified;
    }
}
