package com.evidex.types;

/**
 * Fixed forensic taxonomy for evidence files.
 * The label is what gets persisted in {@code evidence_files.file_type}.
 */
public enum EvidenceCategory {
    MESSAGING("messaging"),
    MESSAGES("messages"),
    CALLS("calls"),
    SOCIAL_MEDIA("social_media"),
    BANKING("banking"),
    CRYPTOCURRENCY("cryptocurrency"),
    IMAGE("image"),
    VIDEO("video"),
    CCTV("cctv"),
    DOCUMENT("document"),
    CONTACTS("contacts"),
    LOCATION("location"),
    BROWSER("browser"),
    CLOUD("cloud"),
    DATABASE("database"),
    ARCHIVE("archive"),
    MEMORY("memory"),
    NETWORK("network"),
    SIM_DATA("sim_data"),
    FRAUD_DEVICE("fraud_device"),
    IOT("iot"),
    ENCRYPTED("encrypted"),
    AUDIO("audio"),
    EMAIL("email"),
    CODE("code"),
    EXECUTABLE("executable"),
    SYSTEM("system"),
    OTHER("other");

    private final String label;

    EvidenceCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static EvidenceCategory fromLabel(String label) {
        for (EvidenceCategory c : values()) {
            if (c.label.equalsIgnoreCase(label)) return c;
        }
        throw new IllegalArgumentException("Unknown evidence category: " + label);
    }
}
