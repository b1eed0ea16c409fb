package com.evidex.types;

/**
 * Container types produced by acquisition tools, as recognised by the format detector.
 */
public enum ExtractionFormat {
    CELLEBRITE_UFDR("cellebrite_ufdr", true),
    CELLEBRITE_ZIP("cellebrite_zip", true),
    OXYGEN_OFB("oxygen_ofb", true),
    GENERIC_ZIP("generic_zip", true),
    ZIP_ARCHIVE("zip_archive", true),
    AXIOM_MFDB("axiom_mfdb", false),
    RAW_IMAGE("raw_image", false),
    TAR_ARCHIVE("tar_archive", false),
    ANDROID_BACKUP("android_backup", false),
    UNKNOWN("unknown", false);

    private final String tag;
    private final boolean zipFamily;

    ExtractionFormat(String tag, boolean zipFamily) {
        this.tag = tag;
        this.zipFamily = zipFamily;
    }

    public String tag() {
        return tag;
    }

    /** True when the container is a ZIP file underneath (vendor layouts included). */
    public boolean isZipFamily() {
        return zipFamily;
    }

    public static ExtractionFormat fromTag(String tag) {
        for (ExtractionFormat f : values()) {
            if (f.tag.equals(tag)) return f;
        }
        throw new IllegalArgumentException("Unknown extraction format: " + tag);
    }
}
