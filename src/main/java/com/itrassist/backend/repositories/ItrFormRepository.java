package com.itrassist.backend.repositories;

import java.util.Optional;
import java.util.function.Supplier;

import com.itrassist.backend.entities.ItrForm;

public interface ItrFormRepository {

    Optional<ItrForm> findById(String id);

    /**
     * Returns the stored form, creating it from {@code seed} on first access.
     */
    ItrForm findOrCreate(String id, Supplier<ItrForm> seed);

    ItrForm save(ItrForm form);
}
