package com.evidex.core.cases;

import com.evidex.core.dao.CaseRecord;
import com.evidex.core.dao.CaseStatisticsRecord;
import com.evidex.core.dao.EvidenceFileRecord;
import com.evidex.types.EvidenceCategory;

import java.util.List;
import java.util.Map;

/**
 * Overview of a case: its row, statistics, category breakdown, the ten most
 * recent files and every flagged file.
 */
public record CaseSummary(
        CaseRecord caseInfo,
        CaseStatisticsRecord statistics,
        Map<EvidenceCategory, Long> categories,
        List<EvidenceFileRecord> recentFiles,
        List<EvidenceFileRecord> flaggedFiles
) {}
