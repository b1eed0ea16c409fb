package com.evidex.formats.category;

import com.evidex.types.EvidenceCategory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Generic extension-to-category tables, consulted after every forensic rule.
 * Iteration order is the lookup order; the first table holding an extension wins.
 */
final class ExtensionTables {

    static final Map<EvidenceCategory, Set<String>> TABLES;

    static {
        Map<EvidenceCategory, Set<String>> tables = new LinkedHashMap<>();
        tables.put(EvidenceCategory.IMAGE, Set.of(
                "jpg", "jpeg", "png", "gif", "bmp", "tiff", "tif", "webp", "heic", "heif"));
        tables.put(EvidenceCategory.VIDEO, Set.of(
                "mp4", "avi", "mov", "wmv", "flv", "mkv", "webm", "m4v", "mpeg", "mpg", "3gp"));
        tables.put(EvidenceCategory.DOCUMENT, Set.of(
                "pdf", "doc", "docx", "xls", "xlsx", "ppt", "pptx", "odt", "ods", "odp",
                "txt", "rtf", "csv", "pages", "numbers", "keynote"));
        tables.put(EvidenceCategory.AUDIO, Set.of(
                "mp3", "wav", "aac", "flac", "m4a", "wma", "ogg", "opus", "aiff", "ape", "alac", "amr"));
        tables.put(EvidenceCategory.ARCHIVE, Set.of(
                "zip", "rar", "7z", "tar", "gz", "bz2", "xz", "tgz", "tbz2"));
        tables.put(EvidenceCategory.DATABASE, Set.of(
                "db", "sqlite", "sqlite3", "sql", "mdb", "accdb", "dbf", "pdb", "frm", "ibd"));
        tables.put(EvidenceCategory.CODE, Set.of(
                "py", "java", "cpp", "c", "h", "js", "ts", "jsx", "tsx", "php", "rb", "go", "rs",
                "swift", "kt", "html", "css", "scss", "sass", "yaml", "yml", "sh", "bat", "ps1"));
        tables.put(EvidenceCategory.EXECUTABLE, Set.of(
                "exe", "dll", "app", "apk", "ipa", "deb", "rpm", "dmg", "pkg", "msi", "so", "dylib"));
        tables.put(EvidenceCategory.EMAIL, Set.of(
                "eml", "msg", "pst", "ost", "mbox", "emlx"));
        tables.put(EvidenceCategory.SYSTEM, Set.of(
                "log", "xml", "json", "ini", "cfg", "conf", "reg", "plist", "dat", "tmp", "bak", "sys"));
        TABLES = Collections.unmodifiableMap(tables);
    }

    private ExtensionTables() {
    }
}
