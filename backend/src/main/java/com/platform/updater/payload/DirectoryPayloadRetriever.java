package com.platform.updater.payload;

import com.platform.updater.error.PayloadException;
import com.platform.updater.error.ValidationException;
import com.platform.updater.manifest.Manifest;
import com.platform.updater.manifest.ManifestParser;
import com.platform.updater.manifest.Payload;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads release payloads from the local filesystem.
 * 
 * Manifests come from {@code <baseDir>/<version>} when that directory exists, otherwise
 * from {@code baseDir} itself if it holds manifest files directly. Any other layout is a
 * missing payload. Files are read in lexical name order and multi-document YAML files
 * contribute their documents in file order.
 */
@Slf4j
public class DirectoryPayloadRetriever implements PayloadRetriever {
    
    private final Path baseDir;
    private final ManifestParser parser;
    
    public DirectoryPayloadRetriever(Path baseDir, ManifestParser parser) {
        this.baseDir = baseDir;
        this.parser = parser;
    }
    
    @Override
    public Payload retrieve(DesiredUpdate update) {
        String version = update.version();
        if (version == null || version.isBlank()) {
            throw new ValidationException("version", version, "must not be blank");
        }
        if (version.contains("/") || version.contains("\\") || version.contains("..")) {
            throw new ValidationException("version", version, "must not contain path separators");
        }
        
        Path dir = payloadDirectory(version);
        
        List<Manifest> manifests = new ArrayList<>();
        for (Path file : manifestFiles(dir)) {
            try (InputStream in = Files.newInputStream(file)) {
                manifests.addAll(parser.parseDocuments(in, file.getFileName().toString()));
            } catch (IOException e) {
                throw PayloadException.unreadable(file.toString(), e);
            }
        }
        
        String sourceId = update.source() != null ? update.source() : dir.toString();
        log.info("Loaded {} manifests for version {} from {}", manifests.size(), version, dir);
        return new Payload(sourceId, version, manifests);
    }
    
    /**
     * The version directory, or the base directory itself when it holds manifests directly.
     */
    private Path payloadDirectory(String version) {
        Path versionDir = baseDir.resolve(version);
        if (Files.isDirectory(versionDir)) {
            return versionDir;
        }
        if (Files.isDirectory(baseDir) && !manifestFiles(baseDir).isEmpty()) {
            log.debug("No directory for version {}, reading manifests from {}", version, baseDir);
            return baseDir;
        }
        throw PayloadException.notFound(versionDir.toString());
    }
    
    private static List<Path> manifestFiles(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                .filter(Files::isRegularFile)
                .filter(DirectoryPayloadRetriever::isManifestFile)
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw PayloadException.unreadable(dir.toString(), e);
        }
    }
    
    private static boolean isManifestFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") || name.endsWith(".json");
    }
}
