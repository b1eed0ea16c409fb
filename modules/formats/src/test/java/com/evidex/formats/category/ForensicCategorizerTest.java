package com.evidex.formats.category;

import com.evidex.types.EvidenceCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ForensicCategorizerTest {

    private final ForensicCategorizer categorizer = new ForensicCategorizer();

    @ParameterizedTest
    @CsvSource({
            "data/data/com.whatsapp/databases/msgstore.db, messaging",
            "WhatsApp/Databases/msgstore-2024-01-01.1.db.crypt14, messaging",
            "data/org.telegram.messenger/files/cache4.db, messaging",
            "Signal/attachment.bin, messaging",
            "data/com.android.providers.telephony/databases/mmssms.db, messages",
            "exports/sms/thread_12.txt, messages",
            "data/com.android.providers.contacts/databases/calllog.db, calls",
            "Library/CallHistoryDB/CallHistory.storedata, calls",
            "media/Instagram/IMG_1.jpg, social_media",
            "exports/bank_statement_march.pdf, banking",
            "data/net.one97.paytm/files/cache.json, banking",
            "Bitcoin/wallet.dat, cryptocurrency",
            "keystore/UTC--2021-05-01T10-00-00.0Z--abc, cryptocurrency",
            "CCTV_Export/cam1/clip.mp4, cctv",
            "export/ch01_20240101.dav, cctv",
            "data/contacts2.db, contacts",
            "Download/friends.VCF, contacts",
            "Takeout/Location History/Records.json, location",
            "tracks/run.gpx, location",
            "Chrome/Default/History, browser",
            "Mozilla/profile/places.sqlite, browser",
            "Dropbox/Camera Uploads/IMG_2.jpg, cloud",
            "evidence/hiberfil.sys, memory",
            "captures/office.pcapng, network",
            "Router/syslog.txt, network",
            "SIM/EF_ADN, sim_data",
            "seized/skimmer_01/dump.txt, fraud_device",
            "Garmin/Activities/run.fit, iot",
            "secret/vault.kdbx, encrypted",
            "backups/archive.crypt8, encrypted",
            "DCIM/Camera/IMG_0001.JPG, image",
            "Movies/clip.mkv, video",
            "Documents/report.docx, document",
            "Music/song.mp3, audio",
            "Download/files.7z, archive",
            "app/data/cache.sqlite, database",
            "src/main.py, code",
            "Download/installer.apk, executable",
            "Mail/inbox.mbox, email",
            "Library/Preferences/com.apple.plist, system",
            "misc/unknown.qqq, other",
            "README, other"
    })
    void categorizesByOrderedRules(String path, String expected) {
        assertThat(categorizer.categorize(path).label()).isEqualTo(expected);
    }

    @Test
    void forensicRuleBeatsExtensionTable() {
        assertThat(categorizer.categorize("msgstore.db", "msgstore.db", "db", ""))
                .isEqualTo(EvidenceCategory.MESSAGING);
        assertThat(categorizer.categorize("other.db", "other.db", "db", ""))
                .isEqualTo(EvidenceCategory.DATABASE);
    }

    @Test
    void matchingIsCaseInsensitiveAndAcceptsDottedExtension() {
        assertThat(categorizer.categorize("MSGSTORE.DB", "/Data/WhatsApp/MSGSTORE.DB", ".DB", "WhatsApp"))
                .isEqualTo(EvidenceCategory.MESSAGING);
        assertThat(categorizer.categorize("photo.PNG", "C:\\Users\\me\\photo.PNG", null, null))
                .isEqualTo(EvidenceCategory.IMAGE);
    }

    @Test
    void parentFolderArgumentIsHonouredWithoutPath() {
        assertThat(categorizer.categorize("chat.txt", null, "txt", "Telegram"))
                .isEqualTo(EvidenceCategory.MESSAGING);
    }

    @Test
    void resultDoesNotDependOnCallOrder() {
        List<String> paths = new ArrayList<>(List.of(
                "a/msgstore.db", "b/IMG.jpg", "c/calllog.db", "d/wallet.dat", "e/x.pcap", "f/unknown.bin"));
        List<EvidenceCategory> first = paths.stream().map(categorizer::categorize).toList();

        Collections.reverse(paths);
        List<EvidenceCategory> reversed = new ArrayList<>(paths.stream().map(categorizer::categorize).toList());
        Collections.reverse(reversed);

        assertThat(reversed).isEqualTo(first);
    }

    @Test
    void ruleTableIsOrderedAndIndividuallyTestable() {
        List<CategoryRule> rules = categorizer.rules();

        assertThat(rules.get(0).category()).isEqualTo(EvidenceCategory.MESSAGING);
        assertThat(rules.get(rules.size() - 1).category()).isEqualTo(EvidenceCategory.SYSTEM);
        assertThat(rules).extracting(CategoryRule::name).doesNotHaveDuplicates();

        CategoryRule cctv = rules.stream().filter(r -> r.name().equals("cctv")).findFirst().orElseThrow();
        assertThat(cctv.matches(FileFacts.fromPath("DVR/ch1.h264"))).isTrue();
        assertThat(cctv.matches(FileFacts.fromPath("Movies/holiday.mp4"))).isFalse();

        int messagingIndex = indexOf(rules, "messaging-store");
        int databaseIndex = indexOf(rules, "extension-database");
        assertThat(messagingIndex).isLessThan(databaseIndex);
    }

    @Test
    void fileFactsDeriveNameExtensionAndParent() {
        FileFacts facts = FileFacts.fromPath("Data/Apps/WhatsApp/Media/IMG-1.JPG");

        assertThat(facts.name()).isEqualTo("img-1.jpg");
        assertThat(facts.extension()).isEqualTo("jpg");
        assertThat(facts.parentFolder()).isEqualTo("media");
        assertThat(facts.segments()).containsExactly("data", "apps", "whatsapp", "media");
    }

    private static int indexOf(List<CategoryRule> rules, String name) {
        for (int i = 0; i < rules.size(); i++) {
            if (rules.get(i).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }
}
