package com.itrassist.backend.repositories;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

import com.itrassist.backend.entities.TaxDocument;

/**
 * Storage for document records. Implementations hand out snapshots, never live instances.
 */
public interface TaxDocumentRepository {

    TaxDocument save(TaxDocument document);

    Optional<TaxDocument> findById(UUID id);

    Optional<TaxDocument> findByIdAndOwnerId(UUID id, String ownerId);

    /**
     * All documents of one filer in upload (insertion) order.
     */
    List<TaxDocument> findAllByOwnerId(String ownerId);

    /**
     * Applies {@code mutation} atomically to the stored document and returns the stored result.
     * Empty when the id is unknown.
     */
    Optional<TaxDocument> update(UUID id, UnaryOperator<TaxDocument> mutation);

    boolean deleteById(UUID id);
}
