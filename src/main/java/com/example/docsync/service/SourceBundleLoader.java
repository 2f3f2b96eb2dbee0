package com.example.docsync.service;

import com.example.docsync.config.DocSyncProperties;
import com.example.docsync.model.SourceUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Turns uploaded files (single files or zip archives) into decoded analysis input.
 */
@Service
public class SourceBundleLoader {

    private static final Logger log = LoggerFactory.getLogger(SourceBundleLoader.class);

    static final Set<String> EXCLUDED_DIRECTORIES =
            Set.of(".venv", "venv", "site-packages", "__pycache__", "node_modules", ".git");

    private final DocSyncProperties.Ingestion settings;

    public SourceBundleLoader(DocSyncProperties properties) {
        this.settings = properties.ingestion();
    }

    /**
     * Reads source code from a single file or a zip archive.
     *
     * @param filename original file name, used to detect archives and keep entity origins
     * @param content  raw upload bytes
     * @return one unit per source file, in archive order
     * @throws IngestionException if the upload is too large, unreadable, of an unsupported type or has no source files
     */
    public List<SourceUnit> readCode(String filename, byte[] content) {
        List<SourceUnit> units = read(filename, content, settings.codeExtensions());
        if (units.isEmpty()) {
            throw new IngestionException("No source files found in '" + filename + "'. Supported extensions: "
                    + String.join(" ", settings.codeExtensions()));
        }
        log.info("SourceBundleLoader: {} source file(s) loaded from '{}'", units.size(), filename);
        return units;
    }

    /**
     * Reads documentation from a single file or a zip archive. Archive entries are joined with newlines.
     *
     * @return the documentation text, empty when the archive holds no documentation files
     * @throws IngestionException if the upload is too large, unreadable or of an unsupported type
     */
    public String readDocumentation(String filename, byte[] content) {
        List<SourceUnit> units = read(filename, content, settings.docExtensions());
        log.info("SourceBundleLoader: {} documentation file(s) loaded from '{}'", units.size(), filename);
        return units.stream().map(SourceUnit::text).collect(Collectors.joining("\n"));
    }

    private List<SourceUnit> read(String filename, byte[] content, List<String> extensions) {
        String name = filename != null ? filename : "upload";
        byte[] bytes = content != null ? content : new byte[0];
        if (bytes.length > settings.maxUploadBytes()) {
            throw new IngestionException("File too large: '" + name + "' exceeds " + settings.maxUploadBytes() + " bytes.");
        }
        if (name.toLowerCase(Locale.ROOT).endsWith(".zip")) {
            return readArchive(name, bytes, extensions);
        }
        if (!hasExtension(name, extensions)) {
            throw new IngestionException("Unsupported file type: '" + name + "'. Supported extensions: "
                    + String.join(" ", extensions) + " (or a .zip archive).");
        }
        return List.of(new SourceUnit(name, decode(bytes)));
    }

    private List<SourceUnit> readArchive(String archiveName, byte[] bytes, List<String> extensions) {
        List<SourceUnit> units = new ArrayList<>();
        int entries = 0;
        long inflated = 0;
        try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(bytes))) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                if (++entries > settings.maxEntries()) {
                    throw new IngestionException("Archive '" + archiveName + "' has more than "
                            + settings.maxEntries() + " entries.");
                }
                String entryName = entry.getName();
                if (entry.isDirectory() || isExcluded(entryName) || !hasExtension(entryName, extensions)) {
                    continue;
                }
                byte[] data = readEntry(zip, settings.maxUploadBytes() - inflated, archiveName);
                inflated += data.length;
                units.add(new SourceUnit(entryName, decode(data)));
            }
        } catch (IOException e) {
            throw new IngestionException("Unable to read archive '" + archiveName + "': " + e.getMessage(), e);
        }
        log.debug("SourceBundleLoader: archive '{}' scanned, {} entries, {} kept", archiveName, entries, units.size());
        return units;
    }

    // Bounded copy: the inflated size of all entries shares the upload limit.
    private byte[] readEntry(InputStream in, long remaining, String archiveName) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[8192];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            total += read;
            if (total > remaining) {
                throw new IngestionException("Archive '" + archiveName + "' expands beyond "
                        + settings.maxUploadBytes() + " bytes.");
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }

    static boolean isExcluded(String entryName) {
        for (String segment : entryName.replace('\\', '/').split("/")) {
            if (EXCLUDED_DIRECTORIES.contains(segment)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasExtension(String entryName, List<String> extensions) {
        String lower = entryName.toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(ext -> lower.endsWith(ext.toLowerCase(Locale.ROOT)));
    }

    // new String(..) substitutes malformed sequences with U+FFFD
    private static String decode(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
