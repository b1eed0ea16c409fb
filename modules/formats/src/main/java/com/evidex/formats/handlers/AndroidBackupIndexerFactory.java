package com.evidex.formats.handlers;

import com.evidex.formats.api.*;
import com.evidex.types.ExtractionFormat;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.compressors.deflate.DeflateCompressorInputStream;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.EnumSet;
import java.util.Set;

/**
 * Indexer for {@code adb backup} files: a four-line text header followed by
 * a TAR stream that is optionally zlib-compressed. Encrypted backups are
 * rejected.
 */
@ApplicationScoped
public class AndroidBackupIndexerFactory implements IndexerFactory {

    static final String MAGIC = "ANDROID BACKUP";
    private static final int MAX_HEADER_LINE = 1024;

    @Override
    public DetectionCriteria getDetectionCriteria() {
        return new DetectionCriteria(
            Set.of("application/x-android-backup"),
            Set.of("ab"),
            (MAGIC + "\n").getBytes(StandardCharsets.US_ASCII),
            0,
            200
        );
    }

    @Override
    public Set<ExtractionFormat> supportedFormats() {
        return EnumSet.of(ExtractionFormat.ANDROID_BACKUP);
    }

    @Override
    public ExtractionFormat sniffedFormat() {
        return ExtractionFormat.ANDROID_BACKUP;
    }

    @Override
    public ArchiveIndexer createInstance(FileContext context) throws IOException {
        // Validate the header up front so an encrypted backup fails before any work starts
        try (InputStream in = new BufferedInputStream(Files.newInputStream(context.source()))) {
            readHeader(in, context);
        }
        return new AndroidBackupIndexer(context);
    }

    /** Consumes the header lines and reports whether the body is compressed. */
    static boolean readHeader(InputStream in, FileContext context) throws IOException {
        String magic = readLine(in);
        if (!MAGIC.equals(magic)) {
            throw new FormatException("Not an Android backup: " + context.source());
        }
        readLine(in); // format version
        boolean compressed = "1".equals(readLine(in));
        String encryption = readLine(in);
        if (!"none".equalsIgnoreCase(encryption)) {
            throw new UnsupportedFormatException(
                    "Encrypted Android backup (" + encryption + ") is not supported: " + context.source(),
                    ExtractionFormat.ANDROID_BACKUP);
        }
        return compressed;
    }

    private static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != '\n') {
            if (b == -1) {
                throw new EOFException("Truncated Android backup header");
            }
            if (line.size() >= MAX_HEADER_LINE) {
                throw new FormatException("Android backup header line too long");
            }
            line.write(b);
        }
        return line.toString(StandardCharsets.US_ASCII).trim();
    }

    private static class AndroidBackupIndexer extends StreamedTarIndexer {

        AndroidBackupIndexer(FileContext context) {
            super(context);
        }

        @Override
        protected InputStream openTarStream() throws IOException {
            InputStream raw = new BufferedInputStream(Files.newInputStream(context.source()));
            try {
                boolean compressed = readHeader(raw, context);
                return compressed ? new DeflateCompressorInputStream(raw) : raw;
            } catch (IOException | RuntimeException e) {
                raw.close();
                throw e;
            }
        }
    }
}
