/**
 * Reads and writes per-library metadata documents
 * One YAML file per library type at {settings.path}/metadata/{type}_metadata.yml
 *
 * @author William Callahan
 *
 * Features:
 * - Top-level "metadata" map of "Title (Year)" to record
 * - Records keep insertion order on load and save
 * - Unreadable documents are logged and treated as empty
 * - Whole-file atomic rewrite; nothing is written in dry-run
 */

package com.williamcallahan.media_metadata_sync.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.williamcallahan.media_metadata_sync.config.MetadataSyncProperties;
import com.williamcallahan.media_metadata_sync.model.MetadataDocument;
import com.williamcallahan.media_metadata_sync.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Repository
public class MetadataDocumentRepository {

    public static final String ROOT_KEY = "metadata";
    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() { };

    private final Path metadataDirectory;
    private final boolean dryRun;
    private final ObjectMapper yamlMapper;

    @Autowired
    public MetadataDocumentRepository(MetadataSyncProperties properties) {
        this(Paths.get(properties.getSettings().getPath()).resolve("metadata"), properties.getSettings().isDryRun());
    }

    public MetadataDocumentRepository(Path metadataDirectory, boolean dryRun) {
        this.metadataDirectory = metadataDirectory;
        this.dryRun = dryRun;
        this.yamlMapper = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));
    }

    /**
     * File name for a library type, e.g. "movie_metadata.yml"
     */
    public static String fileNameFor(String libraryType) {
        return libraryType.toLowerCase(Locale.ROOT) + "_metadata.yml";
    }

    public Path pathFor(String libraryType) {
        return metadataDirectory.resolve(fileNameFor(libraryType));
    }

    public MetadataDocument load(String libraryType) {
        return loadFile(pathFor(libraryType));
    }

    /**
     * Loads a document; missing, empty and unreadable files all yield an empty document
     */
    @SuppressWarnings("unchecked")
    public MetadataDocument loadFile(Path file) {
        Map<String, Map<String, Object>> records = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            return new MetadataDocument(file, records);
        }
        try {
            if (Files.size(file) == 0) {
                return new MetadataDocument(file, records);
            }
            LinkedHashMap<String, Object> root = yamlMapper.readValue(file.toFile(), DOCUMENT_TYPE);
            Object metadata = root == null ? null : root.get(ROOT_KEY);
            if (metadata instanceof Map<?, ?> map) {
                map.forEach((title, record) -> {
                    if (record instanceof Map<?, ?> recordMap) {
                        records.put(String.valueOf(title), (Map<String, Object>) recordMap);
                    } else {
                        log.warn("Skipping malformed record '{}' in {}", title, file);
                    }
                });
            }
            log.debug("Loaded {} metadata record(s) from {}", records.size(), file);
        } catch (IOException e) {
            LoggingUtils.error(log, e, "Unable to parse metadata document {}, treating it as empty", file);
        }
        return new MetadataDocument(file, records);
    }

    /**
     * Rewrites the whole document
     *
     * @return true when the file was written
     */
    public boolean save(MetadataDocument document) {
        Path target = document.getLocation();
        if (dryRun) {
            log.info(LoggingUtils.dryRun(true, "Would write {} metadata record(s) to {}"), document.size(), target);
            return false;
        }
        Map<String, Object> root = new LinkedHashMap<>();
        root.put(ROOT_KEY, document.snapshot());
        try {
            Path parent = target.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
            try {
                yamlMapper.writeValue(temp.toFile(), root);
                try {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new MetadataStoreException("Failed to write metadata document " + target, e);
        }
        document.markClean();
        log.info("Saved {} metadata record(s) to {}", document.size(), target);
        return true;
    }
}
