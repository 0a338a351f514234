package io.cgmes.eqflat.parse;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls the EQ document out of its distribution archive. A path ending in {@code .xml} is read
 * as-is; anything else is opened as a ZIP archive and the first entry whose name matches the
 * entry pattern is returned.
 */
public class ArchiveReader {
    private static final Logger LOG = LoggerFactory.getLogger(ArchiveReader.class);

    public static final String DEFAULT_ENTRY_PATTERN = ".*\\.xml";

    private final Pattern entryPattern;

    public ArchiveReader() {
        this(DEFAULT_ENTRY_PATTERN);
    }

    public ArchiveReader(String entryPattern) {
        this.entryPattern = Pattern.compile(entryPattern, Pattern.CASE_INSENSITIVE);
    }

    public byte[] read(Path input) throws IOException {
        if (!Files.isRegularFile(input)) {
            throw new IOException("Input not found: " + input);
        }
        if (input.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".xml")) {
            LOG.info("Reading {}", input);
            return Files.readAllBytes(input);
        }
        try (ZipFile zip = new ZipFile(input.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (entry.isDirectory() || !entryPattern.matcher(entry.getName()).matches()) {
                    continue;
                }
                LOG.info("Reading {} from {}", entry.getName(), input);
                try (InputStream in = zip.getInputStream(entry)) {
                    return in.readAllBytes();
                }
            }
        }
        throw new IOException(
                "No XML found in archive " + input + " matching " + entryPattern.pattern());
    }
}
