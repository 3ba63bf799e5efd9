package com.itrassist.backend.repositories;

import java.util.Optional;
import java.util.UUID;

/**
 * Raw upload bytes, kept apart from document metadata.
 */
public interface DocumentContentStore {

    void put(UUID documentId, byte[] bytes, String mimeType);

    Optional<DocumentContent> fetch(UUID documentId);

    void delete(UUID documentId);

    record DocumentContent(byte[] bytes, String mimeType) {
    }
}
