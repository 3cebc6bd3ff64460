package io.newsharvest.ingestion.api.repository;

import io.newsharvest.ingestion.api.dto.Author;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public class RedisAuthorRepository implements AuthorRepository {

    static final String AUTHORS_KEY = "news:authors";

    private final RedisNamedEntityStore store;

    public RedisAuthorRepository(RedisTemplate<String, String> redisTemplate) {
        this.store = new RedisNamedEntityStore(redisTemplate, AUTHORS_KEY);
    }

    @Override
    public Optional<Author> findByName(String name) {
        return store.find(name).map(parts -> new Author(parts[0], parts[1]));
    }

    @Override
    public Author saveIfAbsent(String name) {
        String[] parts = store.saveIfAbsent(name);
        return new Author(parts[0], parts[1]);
    }
}
