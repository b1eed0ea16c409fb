package com.evidex.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@RegisterColumnMapper(EvidenceCategoryColumnMapper.class)
@RegisterArgumentFactory(EvidenceCategoryArgumentFactory.class)
@RegisterConstructorMapper(EvidenceFileRecord.class)
public interface EvidenceFileDao {

    String CASE_ORDER = " ORDER BY date_taken DESC NULLS LAST, file_id";

    @SqlUpdate("INSERT INTO evidence_files (case_id, file_path, file_relative_path, file_name, " +
            "file_type, file_size, file_hash, source_archive, " +
            "date_created, date_modified, date_accessed, date_taken, " +
            "gps_latitude, gps_longitude, gps_altitude, camera_make, camera_model) " +
            "VALUES (:caseId, :filePath, :fileRelativePath, :fileName, " +
            ":fileType, :fileSize, :fileHash, :sourceArchive, " +
            ":dateCreated, :dateModified, :dateAccessed, :dateTaken, " +
            ":gpsLatitude, :gpsLongitude, :gpsAltitude, :cameraMake, :cameraModel)")
    @GetGeneratedKeys
    long insert(@BindMethods NewEvidenceFile file);

    @SqlQuery("SELECT * FROM evidence_files WHERE file_id = :fileId")
    Optional<EvidenceFileRecord> findById(@Bind("fileId") long fileId);

    @SqlQuery("SELECT * FROM evidence_files WHERE case_id = :caseId" + CASE_ORDER)
    List<EvidenceFileRecord> findByCase(@Bind("caseId") long caseId);

    @SqlQuery("SELECT * FROM evidence_files WHERE case_id = :caseId AND is_flagged" + CASE_ORDER)
    List<EvidenceFileRecord> findFlaggedByCase(@Bind("caseId") long caseId);

    @SqlQuery("SELECT * FROM evidence_files WHERE case_id = :caseId AND file_type IN (<types>)" + CASE_ORDER)
    List<EvidenceFileRecord> findByCaseAndTypes(@Bind("caseId") long caseId,
                                                @BindList("types") Collection<String> typeLabels);

    @SqlQuery("SELECT * FROM evidence_files WHERE case_id = :caseId AND NOT ai_processed " +
            "ORDER BY imported_date, file_id")
    List<EvidenceFileRecord> findUnprocessed(@Bind("caseId") long caseId);

    @SqlQuery("SELECT COUNT(*) FROM evidence_files WHERE case_id = :caseId AND NOT ai_processed")
    int countUnprocessed(@Bind("caseId") long caseId);

    @SqlQuery("SELECT * FROM evidence_files WHERE case_id = :caseId AND file_hash IS NULL ORDER BY file_id")
    List<EvidenceFileRecord> findWithoutHash(@Bind("caseId") long caseId);

    @SqlQuery("SELECT file_type, COUNT(*) AS file_count FROM evidence_files " +
            "WHERE case_id = :caseId GROUP BY file_type ORDER BY file_count DESC, file_type")
    @RegisterConstructorMapper(CategoryCount.class)
    List<CategoryCount> countByCategory(@Bind("caseId") long caseId);

    @SqlUpdate("UPDATE evidence_files SET ai_processed = TRUE, ai_tags = :aiTags, " +
            "ai_confidence = :aiConfidence, ocr_text = :ocrText, face_count = :faceCount, " +
            "analyzed_date = CURRENT_TIMESTAMP WHERE file_id = :fileId")
    int updateAnalysis(@Bind("fileId") long fileId,
                       @Bind("aiTags") String aiTags,
                       @Bind("aiConfidence") Double aiConfidence,
                       @Bind("ocrText") String ocrText,
                       @Bind("faceCount") int faceCount);

    @SqlUpdate("UPDATE evidence_files SET is_flagged = TRUE, flag_reason = :reason WHERE file_id = :fileId")
    int flag(@Bind("fileId") long fileId, @Bind("reason") String reason);

    @SqlUpdate("UPDATE evidence_files SET is_flagged = FALSE, flag_reason = NULL WHERE file_id = :fileId")
    int unflag(@Bind("fileId") long fileId);

    @SqlUpdate("UPDATE evidence_files SET analyst_notes = :note WHERE file_id = :fileId")
    int setNote(@Bind("fileId") long fileId, @Bind("note") String note);

    @SqlUpdate("UPDATE evidence_files SET file_hash = :hash WHERE file_id = :fileId")
    int setHash(@Bind("fileId") long fileId, @Bind("hash") String hash);
}
