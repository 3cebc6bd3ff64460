package io.newsharvest.ingestion.api.repository;

import io.newsharvest.ingestion.api.dto.Category;

import java.util.Optional;

public interface CategoryRepository {

    Optional<Category> findByName(String name);

    /**
     * Stores the category unless one with the same name exists.
     *
     * @return the stored category, which may be the pre-existing one
     */
    Category saveIfAbsent(String name);
}
