package com.evidex.formats.detect;

import com.evidex.formats.api.Codec;
import com.evidex.formats.api.IndexerFactory;
import com.evidex.formats.registry.IndexerRegistry;
import com.evidex.types.ExtractionFormat;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.tika.Tika;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves the {@link ExtractionFormat} of a forensic container.
 *
 * <p>Known vendor extensions map directly. ZIP-family containers are told
 * apart by their entry listing (central directory only). Files with an
 * unrecognised extension are sniffed by signature and Tika MIME detection.
 * Detection never throws: anything unreadable degrades to
 * {@link ExtractionFormat#UNKNOWN}, or {@link ExtractionFormat#ZIP_ARCHIVE}
 * for a ZIP-named file whose directory cannot be read.
 */
@Singleton
public class FormatDetector {

    private static final Logger log = Logger.getLogger(FormatDetector.class);

    private final IndexerRegistry registry;
    private final Tika tika = new Tika();

    @Inject
    public FormatDetector(IndexerRegistry registry) {
        this.registry = registry;
    }

    public ExtractionFormat detect(Path path) {
        ExtractionFormat format;
        try {
            format = detectInternal(path);
        } catch (IOException | RuntimeException e) {
            log.warnf(e, "Format detection failed for %s", path);
            format = ExtractionFormat.UNKNOWN;
        }
        log.debugf("Detected %s as %s", path, format.tag());
        return format;
    }

    private ExtractionFormat detectInternal(Path path) throws IOException {
        Path fileName = path.getFileName();
        String name = fileName != null ? fileName.toString().toLowerCase(Locale.ROOT) : "";

        if (name.endsWith(".tar") || name.endsWith(".tar.gz") || name.endsWith(".tgz")
                || name.endsWith(".tar.bz2") || name.endsWith(".tbz2")) {
            return ExtractionFormat.TAR_ARCHIVE;
        }

        int dot = name.lastIndexOf('.');
        String extension = dot >= 0 ? name.substring(dot + 1) : "";
        return switch (extension) {
            case "ufdr" -> ExtractionFormat.CELLEBRITE_UFDR;
            case "ofb" -> ExtractionFormat.OXYGEN_OFB;
            case "mfdb" -> ExtractionFormat.AXIOM_MFDB;
            case "zip", "clbx" -> probeZip(path);
            case "bin", "dd", "raw" -> ExtractionFormat.RAW_IMAGE;
            case "ab" -> ExtractionFormat.ANDROID_BACKUP;
            default -> sniff(path);
        };
    }

    /**
     * Distinguishes ZIP-family containers by their entry names.
     */
    ExtractionFormat probeZip(Path path) {
        try (ZipFile zip = ZipFile.builder().setPath(path).get()) {
            boolean manifest = false;
            Enumeration<ZipArchiveEntry> entries = zip.getEntries();
            while (entries.hasMoreElements()) {
                String entryName = entries.nextElement().getName();
                String lower = entryName.toLowerCase(Locale.ROOT);
                if (lower.endsWith(".xml") && lower.contains("report")) {
                    return ExtractionFormat.CELLEBRITE_ZIP;
                }
                if (entryName.equals("manifest.json") || entryName.equals("metadata.json")) {
                    manifest = true;
                }
            }
            return manifest ? ExtractionFormat.GENERIC_ZIP : ExtractionFormat.ZIP_ARCHIVE;
        } catch (IOException | RuntimeException e) {
            log.debugf("Could not read ZIP directory of %s: %s", path, e.getMessage());
            return ExtractionFormat.ZIP_ARCHIVE;
        }
    }

    private ExtractionFormat sniff(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            return ExtractionFormat.UNKNOWN;
        }
        byte[] header = IndexerRegistry.readHeader(path, IndexerRegistry.HEADER_SIZE);
        Optional<IndexerFactory> factory = registry.findBySignature(tika.detect(header), header);
        if (factory.isPresent()) {
            ExtractionFormat sniffed = factory.get().sniffedFormat();
            return sniffed.isZipFamily() ? probeZip(path) : sniffed;
        }

        // A compressed tarball without a telling name: look inside the codec
        Optional<Codec> codec = registry.findCodec(header, null);
        if (codec.isPresent()) {
            byte[] inner;
            try (InputStream decoded = codec.get().decode(Files.newInputStream(path))) {
                inner = decoded.readNBytes(IndexerRegistry.HEADER_SIZE);
            }
            boolean tar = registry.findBySignature(tika.detect(inner), inner)
                    .map(f -> f.sniffedFormat() == ExtractionFormat.TAR_ARCHIVE)
                    .orElse(false);
            if (tar) {
                return ExtractionFormat.TAR_ARCHIVE;
            }
        }
        return ExtractionFormat.UNKNOWN;
    }
}
