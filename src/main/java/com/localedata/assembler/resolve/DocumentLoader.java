package com.localedata.assembler.resolve;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.localedata.assembler.exception.RepositoryReadException;
import com.localedata.assembler.model.DataDocument;
import com.localedata.assembler.repository.LocaleDataRepository;

/**
 * Repository access for resolvers: an unreadable document or directory is logged and treated as absent.
 */
class DocumentLoader {
    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    private final LocaleDataRepository repository;

    DocumentLoader(LocaleDataRepository repository) {
        this.repository = repository;
    }

    Optional<DataDocument> load(String document) {
        try {
            return repository.find(document);
        } catch (RepositoryReadException e) {
            log.warn("Skipping unreadable document {}: {}", e.getPath(), e.getCause().getMessage());
            return Optional.empty();
        }
    }

    List<String> list(String directory) {
        try {
            return repository.listDocuments(directory);
        } catch (RepositoryReadException e) {
            log.warn("Skipping unreadable directory {}: {}", e.getPath(), e.getCause().getMessage());
            return List.of();
        }
    }

    LocaleDataRepository getRepository() {
        return repository;
    }
}
