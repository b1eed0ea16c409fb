package com.evidex.core.repository;

/** Action names written to the audit log. */
public final class AuditActions {

    public static final String CREATE_CASE = "create_case";
    public static final String OPEN_CASE = "open_case";
    public static final String CLOSE_CASE = "close_case";
    public static final String UPDATE_CASE = "update_case";
    public static final String IMPORT_EXTRACTION = "import_extraction";
    public static final String IMPORT_DIRECTORY = "import_directory";
    public static final String FLAG_FILE = "flag_file";
    public static final String UNFLAG_FILE = "unflag_file";
    public static final String ANALYZE_CASE = "analyze_case";
    public static final String HASH_BACKFILL = "hash_backfill";

    private AuditActions() {
    }
}
