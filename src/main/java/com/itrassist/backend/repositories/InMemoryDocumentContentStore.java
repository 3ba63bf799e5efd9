package com.itrassist.backend.repositories;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Repository;

@Repository
public class InMemoryDocumentContentStore implements DocumentContentStore {

    private final Map<UUID, DocumentContent> contents = new ConcurrentHashMap<>();

    @Override
    public void put(UUID documentId, byte[] bytes, String mimeType) {
        contents.put(documentId, new DocumentContent(bytes == null ? new byte[0] : bytes.clone(), mimeType));
    }

    @Override
    public Optional<DocumentContent> fetch(UUID documentId) {
        if (documentId == null) return Optional.empty();
        DocumentContent content = contents.get(documentId);
        if (content == null) return Optional.empty();
        return Optional.of(new DocumentContent(content.bytes().clone(), content.mimeType()));
    }

    @Override
    public void delete(UUID documentId) {
        if (documentId != null) {
            contents.remove(documentId);
        }
    }
}
