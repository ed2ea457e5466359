package com.localedata.assembler.repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localedata.assembler.config.AssemblerConfig;
import com.localedata.assembler.exception.AssemblerConfigurationException;
import com.localedata.assembler.exception.RepositoryReadException;
import com.localedata.assembler.model.DataDocument;

/**
 * Read-only view of the raw locale data tree.
 *
 * Documents are addressed by paths relative to the locale data directory,
 * without the ".json" extension ("en/US/dateformats", "zoneinfo/zonetab").
 * Parsed documents are cached; the cache is safe for concurrent readers.
 * An address that normalizes to a path outside the data directory is a miss.
 */
public class LocaleDataRepository {
    private static final Logger log = LoggerFactory.getLogger(LocaleDataRepository.class);

    public static final String EXTENSION = ".json";

    private final Path dataDir;
    private final Map<String, DataDocument> cache = new ConcurrentHashMap<>();

    public LocaleDataRepository(Path dataDir) {
        if (dataDir == null || !Files.isDirectory(dataDir)) {
            throw new AssemblerConfigurationException("Locale data directory does not exist: " + dataDir);
        }
        this.dataDir = dataDir.toAbsolutePath().normalize();
    }

    public static LocaleDataRepository open(AssemblerConfig config) {
        if (config.getRepositoryRoot() == null) {
            throw new AssemblerConfigurationException("No locale data repository root configured");
        }
        return new LocaleDataRepository(config.getLocaleDataDir());
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path resolve(String document) {
        return dataDir.resolve(document + EXTENSION).normalize();
    }

    private boolean contains(Path path, String document) {
        if (path.startsWith(dataDir)) {
            return true;
        }
        log.warn("Ignoring {}: resolves outside {}", document, dataDir);
        return false;
    }

    /**
     * Loads a document.
     *
     * @return empty when no document exists at that address
     * @throws RepositoryReadException when the document exists but cannot be read or parsed
     */
    public Optional<DataDocument> find(String document) {
        DataDocument cached = cache.get(document);
        if (cached != null) {
            return Optional.of(cached);
        }

        Path path = resolve(document);
        if (!contains(path, document) || !Files.isRegularFile(path)) {
            return Optional.empty();
        }

        try {
            DataDocument parsed = DataDocument.parse(Files.readString(path, StandardCharsets.UTF_8));
            cache.putIfAbsent(document, parsed);
            log.debug("Loaded {}", path);
            return Optional.of(parsed);
        } catch (IOException e) {
            throw new RepositoryReadException(path, e);
        }
    }

    /**
     * Names (without extension) of the documents directly inside a repository directory, sorted.
     */
    public List<String> listDocuments(String directory) {
        Path dir = dataDir.resolve(directory).normalize();
        if (!contains(dir, directory) || !Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(EXTENSION))
                    .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new RepositoryReadException(dir, e);
        }
    }
}
