package com.evidex.core.dao;

import com.evidex.types.EvidenceCategory;
import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record CategoryCount(
        @ColumnName("file_type") EvidenceCategory category,
        @ColumnName("file_count") long count
) {}
