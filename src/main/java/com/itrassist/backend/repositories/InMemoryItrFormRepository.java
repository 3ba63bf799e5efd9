package com.itrassist.backend.repositories;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import org.springframework.stereotype.Repository;

import com.itrassist.backend.entities.ItrForm;

@Repository
public class InMemoryItrFormRepository implements ItrFormRepository {

    private final Map<String, ItrForm> forms = new ConcurrentHashMap<>();

    @Override
    public Optional<ItrForm> findById(String id) {
        if (id == null) return Optional.empty();
        ItrForm form = forms.get(id);
        return form == null ? Optional.empty() : Optional.of(form.copy());
    }

    @Override
    public ItrForm findOrCreate(String id, Supplier<ItrForm> seed) {
        Objects.requireNonNull(id, "id");
        return forms.computeIfAbsent(id, key -> seed.get().copy()).copy();
    }

    @Override
    public ItrForm save(ItrForm form) {
        Objects.requireNonNull(form, "form");
        Objects.requireNonNull(form.getId(), "form.id");
        forms.put(form.getId(), form.copy());
        return form.copy();
    }
}
