package com.evidex.core.dao;

import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record CaseStatisticsRecord(
        @ColumnName("total_files") long totalFiles,
        @ColumnName("processed_files") long processedFiles,
        @ColumnName("flagged_files") long flaggedFiles,
        @ColumnName("files_with_faces") long filesWithFaces,
        @ColumnName("total_faces") long totalFaces,
        @ColumnName("unique_dates") long uniqueDates
) {}
