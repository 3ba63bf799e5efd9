package com.itrassist.backend.repositories;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import org.springframework.stereotype.Repository;

import com.itrassist.backend.entities.TaxDocument;

/**
 * Process-local store. Each entry remembers its insertion sequence so owner listings keep upload
 * order; re-saving an existing id keeps its original position.
 */
@Repository
public class InMemoryTaxDocumentRepository implements TaxDocumentRepository {

    private final Map<UUID, Entry> documents = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public TaxDocument save(TaxDocument document) {
        Objects.requireNonNull(document, "document");
        if (document.getId() == null) {
            document.setId(UUID.randomUUID());
        }
        TaxDocument snapshot = document.copy();
        documents.compute(snapshot.getId(), (id, existing) ->
                new Entry(existing != null ? existing.seq() : sequence.incrementAndGet(), snapshot));
        return snapshot.copy();
    }

    @Override
    public Optional<TaxDocument> findById(UUID id) {
        if (id == null) return Optional.empty();
        Entry entry = documents.get(id);
        return entry == null ? Optional.empty() : Optional.of(entry.document().copy());
    }

    @Override
    public Optional<TaxDocument> findByIdAndOwnerId(UUID id, String ownerId) {
        return findById(id).filter(d -> Objects.equals(d.getOwnerId(), ownerId));
    }

    @Override
    public List<TaxDocument> findAllByOwnerId(String ownerId) {
        return documents.values().stream()
                .filter(e -> Objects.equals(e.document().getOwnerId(), ownerId))
                .sorted(Comparator.comparingLong(Entry::seq))
                .map(e -> e.document().copy())
                .collect(Collectors.toList());
    }

    @Override
    public Optional<TaxDocument> update(UUID id, UnaryOperator<TaxDocument> mutation) {
        if (id == null) return Optional.empty();
        Entry updated = documents.computeIfPresent(id, (key, existing) -> {
            TaxDocument next = mutation.apply(existing.document().copy());
            return new Entry(existing.seq(), Objects.requireNonNull(next, "mutation result").copy());
        });
        return updated == null ? Optional.empty() : Optional.of(updated.document().copy());
    }

    @Override
    public boolean deleteById(UUID id) {
        if (id == null) return false;
        return documents.remove(id) != null;
    }

    private record Entry(long seq, TaxDocument document) {
    }
}
