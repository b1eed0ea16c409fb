package com.evidex.formats.category;

import com.evidex.types.EvidenceCategory;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.evidex.formats.category.CategoryRule.*;

/**
 * Assigns an {@link EvidenceCategory} to a file from its name, path,
 * extension and parent folder. Pure and stateless.
 *
 * <p>Rules are evaluated in table order and the first match wins, so
 * forensic knowledge (chat stores, call logs, wallets) takes precedence
 * over the generic extension tables: {@code msgstore.db} is messaging, not
 * database.
 */
@ApplicationScoped
public class ForensicCategorizer {

    private static final Logger log = Logger.getLogger(ForensicCategorizer.class);

    private static final List<CategoryRule> RULES = buildRules();

    public EvidenceCategory categorize(String name, String path, String extension, String parentFolder) {
        return categorize(FileFacts.of(name, path, extension, parentFolder));
    }

    public EvidenceCategory categorize(String path) {
        return categorize(FileFacts.fromPath(path));
    }

    public EvidenceCategory categorize(FileFacts facts) {
        for (CategoryRule rule : RULES) {
            if (rule.matches(facts)) {
                if (log.isTraceEnabled()) {
                    log.tracef("%s -> %s (rule %s)", facts.path(), rule.category().label(), rule.name());
                }
                return rule.category();
            }
        }
        return EvidenceCategory.OTHER;
    }

    /** The ordered rule table. */
    public List<CategoryRule> rules() {
        return RULES;
    }

    private static List<CategoryRule> buildRules() {
        List<CategoryRule> rules = new ArrayList<>();

        rules.add(new CategoryRule("messaging-store", EvidenceCategory.MESSAGING,
                nameIn("msgstore.db", "wa.db", "chatstorage.sqlite", "cache4.db", "signal.db",
                        "viber_messages", "viber_messages.db", "naver_line", "line.db", "kik.sqlite",
                        "threema.db", "imo.db", "chat.db", "mmailbox.db", "enmicromsg.db")
                        .or(nameMatches("msgstore.*\\.db(\\.crypt\\d+)?"))));
        rules.add(new CategoryRule("messaging-app-folder", EvidenceCategory.MESSAGING,
                parentIn("whatsapp", "telegram", "signal", "viber", "wechat", "kik", "threema",
                        "discord", "messenger", "skype", "imo")
                        .or(segmentIn("com.whatsapp", "com.whatsapp.w4b", "org.telegram.messenger",
                                "org.thoughtcrime.securesms", "com.viber.voip", "com.tencent.mm",
                                "jp.naver.line.android", "kik.android", "ch.threema.app",
                                "com.discord", "com.facebook.orca", "com.skype.raider", "whatsapp",
                                "telegram"))));

        rules.add(new CategoryRule("sms-store", EvidenceCategory.MESSAGES,
                nameIn("mmssms.db", "sms.db", "smsmms.db")
                        .or(nameMatches("sms[-_ ].*\\.(xml|csv|json)"))
                        .or(parentIn("sms", "mms"))
                        .or(segmentIn("com.android.providers.telephony"))));

        rules.add(new CategoryRule("call-log", EvidenceCategory.CALLS,
                nameIn("calllog.db", "call_history.db", "callhistory.storedata", "calls.db",
                        "callhistory.sqlite")
                        .or(nameMatches("call[-_ ]?logs?.*\\.(csv|xml|json|txt)"))
                        .or(parentIn("call_log", "calllog", "call_logs", "calllogs", "callhistorydb"))));

        rules.add(new CategoryRule("social-media", EvidenceCategory.SOCIAL_MEDIA,
                segmentIn("facebook", "instagram", "twitter", "tiktok", "snapchat", "linkedin",
                        "pinterest", "reddit", "com.facebook.katana", "com.instagram.android",
                        "com.twitter.android", "com.zhiliaoapp.musically", "com.snapchat.android",
                        "com.linkedin.android", "com.reddit.frontpage")
                        .or(nameMatches("(facebook|instagram|twitter|tiktok|snapchat)[-_].*"))));

        rules.add(new CategoryRule("banking", EvidenceCategory.BANKING,
                segmentIn("paytm", "net.one97.paytm", "phonepe", "com.phonepe.app", "gpay",
                        "com.google.android.apps.nbu.paisa.user", "bhim", "in.org.npci.upiapp",
                        "paypal", "com.paypal.android.p2pmobile", "venmo", "cashapp", "banking", "bank")
                        .or(nameMatches(".*(upi|bank|transaction|statement|payment).*\\.(csv|xls|xlsx|pdf|db|json|txt)"))));
        rules.add(new CategoryRule("cryptocurrency", EvidenceCategory.CRYPTOCURRENCY,
                nameIn("wallet.dat", "keystore", "default_wallet", "electrum.dat")
                        .or(nameMatches("utc--\\d{4}-.*"))
                        .or(extensionIn("wallet"))
                        .or(segmentIn("bitcoin", "ethereum", "electrum", "metamask", "io.metamask",
                                "trust wallet", "trustwallet", "com.wallet.crypto.trustapp", "exodus",
                                "coinbase", "com.coinbase.android", "binance", "com.binance.dev",
                                "keystore"))));

        rules.add(new CategoryRule("cctv", EvidenceCategory.CCTV,
                extensionIn("dav", "h264", "264")
                        .or(segmentIn("dvr", "nvr", "camera_export", "camera-export", "camera export"))
                        .or(segmentContains("cctv", "surveillance", "hikvision", "dahua"))));

        rules.add(new CategoryRule("contacts", EvidenceCategory.CONTACTS,
                nameIn("contacts2.db", "contacts.db", "addressbook.sqlitedb", "addressbook.sqlite",
                        "contacts.csv")
                        .or(extensionIn("vcf", "vcard"))
                        .or(segmentIn("com.android.providers.contacts", "addressbook"))));
        rules.add(new CategoryRule("location", EvidenceCategory.LOCATION,
                extensionIn("gpx", "kml", "kmz", "nmea", "geojson")
                        .or(nameIn("location history.json", "locationhistory.json", "records.json",
                                "cache_encryptedb.db", "consolidated.db"))
                        .or(segmentIn("location history", "locationhistory", "semantic location history"))));

        rules.add(new CategoryRule("browser", EvidenceCategory.BROWSER,
                nameIn("history", "history.db", "cookies", "login data", "web data", "top sites",
                        "favicons", "bookmarks", "places.sqlite", "cookies.sqlite", "formhistory.sqlite",
                        "browser.db", "browser2.db", "webview.db", "downloads.sqlite")
                        .or(segmentIn("com.android.chrome", "org.mozilla.firefox", "com.apple.mobilesafari",
                                "com.opera.browser", "com.brave.browser", "com.sec.android.app.sbrowser",
                                "chrome", "firefox", "safari"))));
        rules.add(new CategoryRule("cloud", EvidenceCategory.CLOUD,
                segmentIn("google drive", "googledrive", "dropbox", "icloud", "icloud drive", "onedrive",
                        "mega", "box sync", "mobile documents", "com.dropbox.android",
                        "com.google.android.apps.docs", "com.microsoft.skydrive", "mega.privacy.android.app")));

        rules.add(new CategoryRule("memory", EvidenceCategory.MEMORY,
                extensionIn("mem", "vmem", "dmp", "lime", "vmss", "vmsn")
                        .or(nameIn("hiberfil.sys", "pagefile.sys", "swapfile.sys"))
                        .or(segmentContains("memdump", "memory_dump", "ramdump"))));
        rules.add(new CategoryRule("network", EvidenceCategory.NETWORK,
                extensionIn("pcap", "pcapng", "cap")
                        .or(segmentIn("router", "router_logs", "netlog", "netlogs", "network_logs",
                                "firewall", "pcap", "wireshark"))));
        rules.add(new CategoryRule("sim-data", EvidenceCategory.SIM_DATA,
                segmentIn("sim", "sim_card", "simcard", "sim_dump", "usim", "iccid")
                        .or(nameMatches("ef_(adn|sms|iccid|imsi|fdn|sdn|loci)(\\..*)?"))));
        rules.add(new CategoryRule("fraud-device", EvidenceCategory.FRAUD_DEVICE,
                segmentContains("skimmer", "simbox", "sim_box", "gsm_gateway", "gsm-gateway", "gsmgateway")));

        rules.add(new CategoryRule("iot", EvidenceCategory.IOT,
                extensionIn("fit", "tcx")
                        .or(segmentIn("wearable", "wearables", "smartwatch", "fitbit", "garmin", "vehicle",
                                "infotainment", "carplay", "android auto", "com.fitbit.fitbitmobile",
                                "com.garmin.android.apps.connectmobile", "com.xiaomi.hm.health"))));
        rules.add(new CategoryRule("encrypted", EvidenceCategory.ENCRYPTED,
                extensionIn("aes", "gpg", "pgp", "enc", "tc", "hc", "vc", "axx", "kdbx", "bek")
                        .or(f -> f.extension().startsWith("crypt"))));

        for (Map.Entry<EvidenceCategory, Set<String>> table : ExtensionTables.TABLES.entrySet()) {
            rules.add(new CategoryRule("extension-" + table.getKey().label(), table.getKey(),
                    extensionIn(table.getValue())));
        }

        return List.copyOf(rules);
    }
}
