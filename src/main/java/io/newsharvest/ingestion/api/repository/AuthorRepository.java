package io.newsharvest.ingestion.api.repository;

import io.newsharvest.ingestion.api.dto.Author;

import java.util.Optional;

public interface AuthorRepository {

    Optional<Author> findByName(String name);

    Author saveIfAbsent(String name);
}
